package xyz.vvrf.gds.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * IR 文档的元数据信封。
 */
@Value
@Builder
@Jacksonized
public class IRMetadata {

    @Builder.Default
    List<String> sources = Collections.emptyList();
    Instant generatedAt;
    String toolVersion;
}

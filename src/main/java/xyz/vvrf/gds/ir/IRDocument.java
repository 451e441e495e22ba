package xyz.vvrf.gds.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;

/**
 * IR 顶层文档，包含一个或多个系统。
 */
@Value
@Builder
@Jacksonized
public class IRDocument {

    @Builder.Default
    String version = "1.0";
    @Builder.Default
    List<SystemIR> systems = Collections.emptyList();
    IRMetadata metadata;
}

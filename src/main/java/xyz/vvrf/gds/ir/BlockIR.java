package xyz.vvrf.gds.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.Map;

/**
 * 扁平 IR 中的单个原子块。
 * blockType 是普通字符串，默认编译器写入角色种类 (boundary、policy 等)。
 */
@Value
@Builder
@Jacksonized
public class BlockIR {

    String name;
    @Builder.Default
    String blockType = "";
    @Builder.Default
    Signature signature = Signature.EMPTY;
    @Builder.Default
    String logic = "";
    @Builder.Default
    Map<String, Object> metadata = Collections.emptyMap();
}

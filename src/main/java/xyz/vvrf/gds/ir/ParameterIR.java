package xyz.vvrf.gds.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import xyz.vvrf.gds.core.ParameterDef;

/**
 * 参数定义的可序列化投影。约束谓词不会进入 IR。
 */
@Value
@Builder
@Jacksonized
public class ParameterIR {

    String name;
    String typeName;
    String kind;
    @Builder.Default
    String description = "";
    Object lowerBound;
    Object upperBound;

    public static ParameterIR from(ParameterDef def) {
        return ParameterIR.builder()
                .name(def.getName())
                .typeName(def.getTypedef().getName())
                .kind(def.getTypedef().getKind().label())
                .description(def.getDescription())
                .lowerBound(def.getLowerBound().orElse(null))
                .upperBound(def.getUpperBound().orElse(null))
                .build();
    }
}

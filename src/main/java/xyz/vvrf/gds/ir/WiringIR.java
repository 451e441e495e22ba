package xyz.vvrf.gds.ir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import xyz.vvrf.gds.core.FlowDirection;

/**
 * IR 中一条有向连线。
 * <p>
 * feedback / temporal 标记由声明它的组合块决定，验证时据此区分连线类别。
 * category 是开放字符串，通用检查只解释 {@code "dataflow"}。
 * </p>
 */
@Value
@Builder
@Jacksonized
public class WiringIR {

    public static final String CATEGORY_DATAFLOW = "dataflow";

    String source;
    String target;
    String label;
    @Builder.Default
    String wiringType = "";
    @Builder.Default
    FlowDirection direction = FlowDirection.COVARIANT;
    @JsonProperty("is_feedback")
    boolean feedback;
    @JsonProperty("is_temporal")
    boolean temporal;
    @Builder.Default
    String category = CATEGORY_DATAFLOW;

    @JsonIgnore
    public boolean isCovariant() {
        return direction == FlowDirection.COVARIANT;
    }
}

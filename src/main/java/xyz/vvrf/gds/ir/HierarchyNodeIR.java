package xyz.vvrf.gds.ir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;

/**
 * 组合树中的一个节点，用于可视化。
 * 叶子节点 (compositionType 为 null) 与 BlockIR 一一对应；内部节点表示组合运算。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class HierarchyNodeIR {

    String id;
    String name;
    CompositionType compositionType;
    @Builder.Default
    List<HierarchyNodeIR> children = Collections.emptyList();
    String blockName;
    @Builder.Default
    String exitCondition = "";

    @JsonIgnore
    public boolean isLeaf() {
        return compositionType == null;
    }
}

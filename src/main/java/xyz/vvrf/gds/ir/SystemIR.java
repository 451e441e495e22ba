package xyz.vvrf.gds.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一个完整的组合系统，是 IR 的顶层单元。产出后不可变。
 *
 * @author ruifeng.wen
 */
@Value
@Builder
@Jacksonized
public class SystemIR {

    String name;
    @Builder.Default
    List<BlockIR> blocks = Collections.emptyList();
    @Builder.Default
    List<WiringIR> wirings = Collections.emptyList();
    @Builder.Default
    List<Map<String, Object>> inputs = Collections.emptyList();
    @Builder.Default
    CompositionType compositionType = CompositionType.SEQUENTIAL;
    HierarchyNodeIR hierarchy;
    @Builder.Default
    String source = "";
    @Builder.Default
    Map<String, Object> metadata = Collections.emptyMap();
    @Builder.Default
    List<ParameterIR> parameterSchema = Collections.emptyList();

    /**
     * 所有块名称。
     */
    public Set<String> blockNames() {
        Set<String> names = new HashSet<>();
        for (BlockIR b : blocks) {
            names.add(b.getName());
        }
        return names;
    }

    /**
     * 所有外部输入的名称 (inputs 中 name 键)。
     */
    public Set<String> inputNames() {
        Set<String> names = new HashSet<>();
        for (Map<String, Object> input : inputs) {
            Object name = input.get("name");
            if (name != null) {
                names.add(name.toString());
            }
        }
        return names;
    }
}

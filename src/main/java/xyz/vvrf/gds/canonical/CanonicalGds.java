package xyz.vvrf.gds.canonical;

import lombok.Builder;
import lombok.Value;
import xyz.vvrf.gds.core.ParameterSchema;
import xyz.vvrf.gds.core.StateRef;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 规范注册表到形式化 GDS 结构的规范投影。
 * <pre>
 *   h_θ : X → X,  θ ∈ Θ
 *   X = 状态空间 (实体变量的乘积)
 *   U = 输入空间 (BoundaryAction 的 forwardOut)
 *   D = 决策空间 (Policy 的 forwardOut)
 *   g : X × U → D,  f : X × D → X
 * </pre>
 * 纯派生结果，随时可重算，从不作为权威来源。
 *
 * @author ruifeng.wen
 */
@Value
@Builder
public class CanonicalGds {

    @Builder.Default
    List<StateRef> stateVariables = Collections.emptyList();
    @Builder.Default
    ParameterSchema parameterSchema = ParameterSchema.EMPTY;
    @Builder.Default
    List<PortRef> inputPorts = Collections.emptyList();
    @Builder.Default
    List<PortRef> decisionPorts = Collections.emptyList();
    @Builder.Default
    List<String> boundaryBlocks = Collections.emptyList();
    @Builder.Default
    List<String> controlBlocks = Collections.emptyList();
    @Builder.Default
    List<String> policyBlocks = Collections.emptyList();
    @Builder.Default
    List<String> mechanismBlocks = Collections.emptyList();
    /** Mechanism 名称 → 其更新目标，保持注册顺序 */
    @Builder.Default
    Map<String, List<StateRef>> updateMap = Collections.emptyMap();

    public boolean hasParameters() {
        return !parameterSchema.isEmpty();
    }

    public String formula() {
        if (hasParameters()) {
            return "h_θ : X → X  (h = f_θ ∘ g_θ, θ ∈ Θ)";
        }
        return "h : X → X  (h = f ∘ g)";
    }
}

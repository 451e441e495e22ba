package xyz.vvrf.gds.query;

import xyz.vvrf.gds.block.AtomicBlock;
import xyz.vvrf.gds.block.Block;
import xyz.vvrf.gds.block.BlockKind;
import xyz.vvrf.gds.block.HasParameters;
import xyz.vvrf.gds.block.Mechanism;
import xyz.vvrf.gds.core.StateRef;
import xyz.vvrf.gds.spec.GdsSpec;
import xyz.vvrf.gds.spec.SpecWiring;
import xyz.vvrf.gds.spec.Wire;
import xyz.vvrf.gds.util.GraphUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 规范注册表上的只读依赖分析。
 * <p>
 * 所有方法都是纯读取，不缓存结果：注册表冻结后不会变化，重复调用得到相同结果。
 * </p>
 *
 * @author ruifeng.wen
 */
public class SpecQuery {

    private final GdsSpec spec;

    public SpecQuery(GdsSpec spec) {
        this.spec = Objects.requireNonNull(spec, "GdsSpec 不能为空");
    }

    /**
     * 参数名 -> 引用它的块名。schema 中的每个参数都有条目，未被引用的参数对应空列表；
     * 块引用了 schema 之外的参数时不出现在结果中 (由 SC-005 报告)。
     */
    public Map<String, List<String>> paramToBlocks() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String param : spec.getParameterSchema().names()) {
            result.put(param, new ArrayList<>());
        }
        for (Block block : spec.getBlocks().values()) {
            if (block instanceof HasParameters) {
                for (String param : ((HasParameters) block).getParamsUsed()) {
                    List<String> users = result.get(param);
                    if (users != null) {
                        users.add(block.getName());
                    }
                }
            }
        }
        return result;
    }

    /**
     * 块名 -> 它引用的参数名。每个已注册块都有条目，不引用参数的块对应空列表。
     */
    public Map<String, List<String>> blockToParams() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (Block block : spec.getBlocks().values()) {
            List<String> params = block instanceof HasParameters
                    ? ((HasParameters) block).getParamsUsed()
                    : Collections.<String>emptyList();
            result.put(block.getName(), new ArrayList<>(params));
        }
        return result;
    }

    /**
     * 实体 -> 变量 -> 更新它的 Mechanism 名称。
     * 每个已注册的变量都有条目，没有 Mechanism 更新的变量对应空列表。
     */
    public Map<String, Map<String, List<String>>> entityUpdateMap() {
        Map<String, Map<String, List<String>>> result = new LinkedHashMap<>();
        spec.getEntities().forEach((name, entity) -> {
            Map<String, List<String>> vars = new LinkedHashMap<>();
            for (String variable : entity.getVariables().keySet()) {
                vars.put(variable, new ArrayList<>());
            }
            result.put(name, vars);
        });
        for (Mechanism mech : spec.getMechanisms()) {
            for (StateRef ref : mech.getUpdates()) {
                Map<String, List<String>> vars = result.get(ref.getEntity());
                if (vars != null && vars.containsKey(ref.getVariable())) {
                    vars.get(ref.getVariable()).add(mech.getName());
                }
            }
        }
        return result;
    }

    /**
     * 所有连线分组中的 Wire 构成的邻接表：源块 -> 目标块集合。
     * 只包含至少有一条出边的块。
     */
    public Map<String, Set<String>> dependencyGraph() {
        Map<String, Set<String>> adj = new LinkedHashMap<>();
        for (SpecWiring wiring : spec.getWirings().values()) {
            for (Wire wire : wiring.getWires()) {
                adj.computeIfAbsent(wire.getSource(), k -> new LinkedHashSet<>()).add(wire.getTarget());
            }
        }
        return adj;
    }

    /**
     * 角色 -> 块名。五种角色都有条目；组合块不参与分组。
     */
    public Map<String, List<String>> blocksByKind() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        result.put(BlockKind.BOUNDARY.value(), new ArrayList<>());
        result.put(BlockKind.CONTROL.value(), new ArrayList<>());
        result.put(BlockKind.POLICY.value(), new ArrayList<>());
        result.put(BlockKind.MECHANISM.value(), new ArrayList<>());
        result.put(BlockKind.GENERIC.value(), new ArrayList<>());
        for (AtomicBlock block : spec.getAtomicBlocks()) {
            result.get(block.getKind().value()).add(block.getName());
        }
        return result;
    }

    /**
     * 可能影响某个状态变量的所有块：直接更新它的 Mechanism，
     * 以及在依赖图中能到达这些 Mechanism 的所有块。结果按名称排序。
     */
    public List<String> blocksAffecting(String entity, String variable) {
        StateRef target = StateRef.of(entity, variable);
        Set<String> direct = new LinkedHashSet<>();
        for (Mechanism mech : spec.getMechanisms()) {
            if (mech.getUpdates().contains(target)) {
                direct.add(mech.getName());
            }
        }
        if (direct.isEmpty()) {
            return Collections.emptyList();
        }

        Map<String, Set<String>> adj = dependencyGraph();
        Set<String> candidates = new LinkedHashSet<>(spec.getBlocks().keySet());
        candidates.addAll(adj.keySet());

        Set<String> affecting = new TreeSet<>(direct);
        for (String block : candidates) {
            if (affecting.contains(block)) {
                continue;
            }
            Set<String> reachable = GraphUtils.reachableFrom(adj, block);
            for (String mech : direct) {
                if (reachable.contains(mech)) {
                    affecting.add(block);
                    break;
                }
            }
        }
        return new ArrayList<>(affecting);
    }

    /**
     * from 是否能沿依赖图到达 to。from 等于 to 时返回 false (需要至少一条边)。
     */
    public boolean canReach(String from, String to) {
        if (from.equals(to)) {
            return false;
        }
        return GraphUtils.isReachable(dependencyGraph(), from, to);
    }

    public GdsSpec getSpec() {
        return spec;
    }
}

package xyz.vvrf.gds.verification;

import xyz.vvrf.gds.block.Block;
import xyz.vvrf.gds.block.HasParameters;
import xyz.vvrf.gds.block.Mechanism;
import xyz.vvrf.gds.canonical.CanonicalGds;
import xyz.vvrf.gds.canonical.CanonicalProjection;
import xyz.vvrf.gds.core.Entity;
import xyz.vvrf.gds.core.StateRef;
import xyz.vvrf.gds.spec.GdsSpec;
import xyz.vvrf.gds.spec.SpecWiring;
import xyz.vvrf.gds.spec.Wire;
import xyz.vvrf.gds.util.GraphUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 语义检查 SC-001 至 SC-007，作用于规范注册表。
 * <p>
 * SC-003 (可达性) 需要一对块名作为参数，因此不在 {@link #all()} 中，
 * 通过 {@link #reachability(String, String)} 构造。
 * </p>
 *
 * @author ruifeng.wen
 */
public final class SpecChecks {

    public static final String SC001 = "SC-001";
    public static final String SC002 = "SC-002";
    public static final String SC003 = "SC-003";
    public static final String SC004 = "SC-004";
    public static final String SC005 = "SC-005";
    public static final String SC006 = "SC-006";
    public static final String SC007 = "SC-007";

    public static final SpecCheck COMPLETENESS = SpecCheck.of(SC001, SpecChecks::completeness);
    public static final SpecCheck DETERMINISM = SpecCheck.of(SC002, SpecChecks::determinism);
    public static final SpecCheck TYPE_SAFETY = SpecCheck.of(SC004, SpecChecks::typeSafety);
    public static final SpecCheck PARAMETER_REFERENCES = SpecCheck.of(SC005, SpecChecks::parameterReferences);
    public static final SpecCheck CANONICAL_WELLFORMEDNESS =
            SpecCheck.of(SC006, SpecChecks::canonicalWellformedness);

    private static final List<SpecCheck> ALL = Collections.unmodifiableList(Arrays.asList(
            COMPLETENESS,
            DETERMINISM,
            TYPE_SAFETY,
            PARAMETER_REFERENCES,
            CANONICAL_WELLFORMEDNESS));

    private SpecChecks() {}

    public static List<SpecCheck> all() {
        return ALL;
    }

    /**
     * SC-001：每个 (实体, 变量) 都必须出现在某个 Mechanism 的 updates 中。
     * 孤立变量汇总为一条警告。
     */
    public static List<Finding> completeness(GdsSpec spec) {
        Set<StateRef> updated = new LinkedHashSet<>();
        for (Mechanism mech : spec.getMechanisms()) {
            updated.addAll(mech.getUpdates());
        }
        List<String> orphans = new ArrayList<>();
        for (Entity entity : spec.getEntities().values()) {
            for (String variable : entity.getVariables().keySet()) {
                StateRef ref = StateRef.of(entity.getName(), variable);
                if (!updated.contains(ref)) {
                    orphans.add(ref.toString());
                }
            }
        }
        if (!orphans.isEmpty()) {
            return Collections.singletonList(Finding.of(SC001, Severity.WARNING,
                    "Orphan state variables never updated by any mechanism: " + orphans,
                    orphans, false));
        }
        return Collections.singletonList(Finding.pass(SC001, Severity.INFO,
                "All state variables are updated by at least one mechanism"));
    }

    /**
     * SC-002：在同一个连线分组内，一个 (实体, 变量) 最多由一个 Mechanism 写入。
     * 分组之间互不影响。
     */
    public static List<Finding> determinism(GdsSpec spec) {
        List<Finding> findings = new ArrayList<>();
        for (SpecWiring wiring : spec.getWirings().values()) {
            // 状态变量 -> 写入它的 Mechanism 名称 (去重，保持首次出现顺序)
            Map<StateRef, Set<String>> writers = new LinkedHashMap<>();
            for (String blockName : wiring.getBlockNames()) {
                Block block = spec.getBlocks().get(blockName);
                if (!(block instanceof Mechanism)) {
                    continue;
                }
                for (StateRef ref : ((Mechanism) block).getUpdates()) {
                    writers.computeIfAbsent(ref, k -> new LinkedHashSet<>()).add(blockName);
                }
            }
            for (Map.Entry<StateRef, Set<String>> entry : writers.entrySet()) {
                if (entry.getValue().size() > 1) {
                    List<String> names = new ArrayList<>(entry.getValue());
                    findings.add(Finding.of(SC002, Severity.ERROR,
                            String.format("Write conflict in wiring '%s': %s updated by %s",
                                    wiring.getName(), entry.getKey(), names),
                            names, false));
                }
            }
        }
        if (findings.isEmpty()) {
            findings.add(Finding.pass(SC002, Severity.INFO, "No write conflicts detected"));
        }
        return findings;
    }

    /**
     * 构造一个 SC-003 检查：from 能否沿连线到达 to。
     */
    public static SpecCheck reachability(String from, String to) {
        return SpecCheck.of(SC003, spec -> reachability(spec, from, to));
    }

    /**
     * SC-003：在所有 Wire 构成的有向图上做 BFS。from 等于 to 视为可达。
     */
    public static List<Finding> reachability(GdsSpec spec, String from, String to) {
        boolean reachable = GraphUtils.isReachable(wireAdjacency(spec), from, to);
        if (reachable) {
            return Collections.singletonList(Finding.pass(SC003, Severity.INFO,
                    String.format("Block '%s' can reach '%s'", from, to), from, to));
        }
        return Collections.singletonList(Finding.fail(SC003, Severity.WARNING,
                String.format("Block '%s' cannot reach '%s'", from, to), from, to));
    }

    /**
     * SC-004：Wire 上非空的空间名称必须已注册。
     */
    public static List<Finding> typeSafety(GdsSpec spec) {
        List<Finding> findings = new ArrayList<>();
        for (SpecWiring wiring : spec.getWirings().values()) {
            for (Wire wire : wiring.getWires()) {
                if (wire.hasSpace() && !spec.getSpaces().containsKey(wire.getSpace())) {
                    findings.add(Finding.fail(SC004, Severity.ERROR,
                            String.format("Wire %s -> %s references unregistered space '%s'",
                                    wire.getSource(), wire.getTarget(), wire.getSpace()),
                            wire.getSource(), wire.getTarget()));
                }
            }
        }
        if (findings.isEmpty()) {
            findings.add(Finding.pass(SC004, Severity.INFO, "All wire space references are valid"));
        }
        return findings;
    }

    /**
     * SC-005：块引用的参数都必须在参数空间中定义。未解析的引用汇总为一条错误。
     */
    public static List<Finding> parameterReferences(GdsSpec spec) {
        Set<String> defined = spec.getParameterSchema().names();
        List<String> unresolved = new ArrayList<>();
        for (Block block : spec.getBlocks().values()) {
            if (!(block instanceof HasParameters)) {
                continue;
            }
            for (String param : ((HasParameters) block).getParamsUsed()) {
                if (!defined.contains(param)) {
                    unresolved.add(block.getName() + " -> " + param);
                }
            }
        }
        if (!unresolved.isEmpty()) {
            return Collections.singletonList(Finding.of(SC005, Severity.ERROR,
                    "Unresolved parameter references: " + unresolved,
                    unresolved, false));
        }
        return Collections.singletonList(Finding.pass(SC005, Severity.INFO,
                "All parameter references resolve to registered definitions"));
    }

    /**
     * SC-006 / SC-007：规范投影必须有状态转移 f (至少一个 Mechanism) 和状态空间 X (至少一个变量)。
     * 两者独立判定，各产出一条结果。
     */
    public static List<Finding> canonicalWellformedness(GdsSpec spec) {
        CanonicalGds canonical = CanonicalProjection.project(spec);
        List<Finding> findings = new ArrayList<>();

        int mechanisms = canonical.getMechanismBlocks().size();
        if (mechanisms == 0) {
            findings.add(Finding.fail(SC006, Severity.WARNING,
                    "No mechanisms found - state transition f is empty"));
        } else {
            findings.add(Finding.pass(SC006, Severity.INFO,
                    String.format("State transition f has %d mechanism(s)", mechanisms)));
        }

        int variables = canonical.getStateVariables().size();
        if (variables == 0) {
            findings.add(Finding.fail(SC007, Severity.WARNING,
                    "State space X is empty - no entity variables defined"));
        } else {
            findings.add(Finding.pass(SC007, Severity.INFO,
                    String.format("State space X has %d variable(s)", variables)));
        }
        return findings;
    }

    /**
     * 由所有连线分组中的 Wire 构建邻接表，节点包括出现过的所有端点。
     */
    public static Map<String, List<String>> wireAdjacency(GdsSpec spec) {
        Set<String> nodes = new LinkedHashSet<>(spec.getBlocks().keySet());
        List<String[]> edges = new ArrayList<>();
        for (SpecWiring wiring : spec.getWirings().values()) {
            for (Wire wire : wiring.getWires()) {
                nodes.add(wire.getSource());
                nodes.add(wire.getTarget());
                edges.add(new String[]{wire.getSource(), wire.getTarget()});
            }
        }
        return GraphUtils.buildAdjacencyList(nodes, edges);
    }
}

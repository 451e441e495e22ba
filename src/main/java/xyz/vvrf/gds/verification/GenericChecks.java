package xyz.vvrf.gds.verification;

import xyz.vvrf.gds.core.Tokens;
import xyz.vvrf.gds.ir.BlockIR;
import xyz.vvrf.gds.ir.Signature;
import xyz.vvrf.gds.ir.SystemIR;
import xyz.vvrf.gds.ir.WiringIR;
import xyz.vvrf.gds.util.GraphUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 通用检查 G-001 至 G-006。
 * <p>
 * 只读取领域无关的 {@link SystemIR}：类型一致性、结构完整性与图拓扑，
 * 不涉及任何领域块类型。检查从不抛出异常，无法验证的情况同样记为未通过。
 * </p>
 *
 * @author ruifeng.wen
 */
public final class GenericChecks {

    public static final String G001 = "G-001";
    public static final String G002 = "G-002";
    public static final String G003 = "G-003";
    public static final String G004 = "G-004";
    public static final String G005 = "G-005";
    public static final String G006 = "G-006";

    public static final SystemCheck DOMAIN_CODOMAIN_MATCHING = SystemCheck.of(G001, GenericChecks::domainCodomainMatching);
    public static final SystemCheck SIGNATURE_COMPLETENESS = SystemCheck.of(G002, GenericChecks::signatureCompleteness);
    public static final SystemCheck DIRECTION_CONSISTENCY = SystemCheck.of(G003, GenericChecks::directionConsistency);
    public static final SystemCheck DANGLING_WIRINGS = SystemCheck.of(G004, GenericChecks::danglingWirings);
    public static final SystemCheck SEQUENTIAL_TYPE_COMPATIBILITY = SystemCheck.of(G005, GenericChecks::sequentialTypeCompatibility);
    public static final SystemCheck COVARIANT_ACYCLICITY = SystemCheck.of(G006, GenericChecks::covariantAcyclicity);

    private static final List<SystemCheck> ALL = Collections.unmodifiableList(Arrays.asList(
            DOMAIN_CODOMAIN_MATCHING,
            SIGNATURE_COMPLETENESS,
            DIRECTION_CONSISTENCY,
            DANGLING_WIRINGS,
            SEQUENTIAL_TYPE_COMPATIBILITY,
            COVARIANT_ACYCLICITY));

    private GenericChecks() {}

    public static List<SystemCheck> all() {
        return ALL;
    }

    /**
     * G-001：协变、非时间连线的标签 token 必须是源 forwardOut 或目标 forwardIn 的子集。
     * 任一侧签名缺失都记为失败。
     */
    public static List<Finding> domainCodomainMatching(SystemIR system) {
        List<Finding> findings = new ArrayList<>();
        Map<String, Signature> sigs = signatures(system);
        for (WiringIR wiring : system.getWirings()) {
            if (!wiring.isCovariant() || wiring.isTemporal()) {
                continue;
            }
            if (!sigs.containsKey(wiring.getSource()) || !sigs.containsKey(wiring.getTarget())) {
                continue;
            }
            String srcOut = sigs.get(wiring.getSource()).getForwardOut();
            String tgtIn = sigs.get(wiring.getTarget()).getForwardIn();
            if (srcOut.isEmpty() || tgtIn.isEmpty()) {
                findings.add(Finding.fail(G001, Severity.ERROR,
                        String.format("Cannot verify domain/codomain: %s out='%s', %s in='%s'",
                                wiring.getSource(), srcOut, wiring.getTarget(), tgtIn),
                        wiring.getSource(), wiring.getTarget()));
                continue;
            }
            boolean compatible = Tokens.subset(wiring.getLabel(), srcOut) || Tokens.subset(wiring.getLabel(), tgtIn);
            findings.add(Finding.of(G001, Severity.ERROR,
                    String.format("Wiring '%s': %s out='%s' -> %s in='%s'%s",
                            wiring.getLabel(), wiring.getSource(), srcOut, wiring.getTarget(), tgtIn,
                            compatible ? "" : " - MISMATCH"),
                    Arrays.asList(wiring.getSource(), wiring.getTarget()), compatible));
        }
        return findings;
    }

    /**
     * G-002：每个块至少要有一个非空输入槽和一个非空输出槽。
     */
    public static List<Finding> signatureCompleteness(SystemIR system) {
        List<Finding> findings = new ArrayList<>();
        for (BlockIR block : system.getBlocks()) {
            Signature sig = block.getSignature();
            List<String> missing = new ArrayList<>();
            if (!sig.hasInput()) {
                missing.add("no inputs");
            }
            if (!sig.hasOutput()) {
                missing.add("no outputs");
            }
            findings.add(Finding.of(G002, Severity.ERROR,
                    String.format("%s: signature ('%s', '%s', '%s', '%s')%s",
                            block.getName(), sig.getForwardIn(), sig.getForwardOut(),
                            sig.getBackwardIn(), sig.getBackwardOut(),
                            missing.isEmpty() ? "" : " - " + String.join(", ", missing)),
                    Collections.singletonList(block.getName()), missing.isEmpty()));
        }
        return findings;
    }

    /**
     * G-003：逐条报告连线声明的方向，仅供参考，不会失败。
     */
    public static List<Finding> directionConsistency(SystemIR system) {
        List<Finding> findings = new ArrayList<>();
        for (WiringIR wiring : system.getWirings()) {
            findings.add(Finding.pass(G003, Severity.INFO,
                    String.format("Wiring '%s' (%s -> %s): direction=%s",
                            wiring.getLabel(), wiring.getSource(), wiring.getTarget(), wiring.getDirection().value()),
                    wiring.getSource(), wiring.getTarget()));
        }
        return findings;
    }

    /**
     * G-004：连线的源和目标必须是已知块或外部输入。
     */
    public static List<Finding> danglingWirings(SystemIR system) {
        List<Finding> findings = new ArrayList<>();
        Set<String> known = system.blockNames();
        known.addAll(system.inputNames());
        for (WiringIR wiring : system.getWirings()) {
            List<String> issues = new ArrayList<>();
            if (!known.contains(wiring.getSource())) {
                issues.add(String.format("source '%s' unknown", wiring.getSource()));
            }
            if (!known.contains(wiring.getTarget())) {
                issues.add(String.format("target '%s' unknown", wiring.getTarget()));
            }
            findings.add(Finding.of(G004, Severity.ERROR,
                    String.format("Wiring '%s' (%s -> %s)%s",
                            wiring.getLabel(), wiring.getSource(), wiring.getTarget(),
                            issues.isEmpty() ? "" : " - " + String.join(", ", issues)),
                    Arrays.asList(wiring.getSource(), wiring.getTarget()), issues.isEmpty()));
        }
        return findings;
    }

    /**
     * G-005：协变、非时间连线的标签必须同时是源 forwardOut 与目标 forwardIn 的子集。
     * 端点未知或签名缺失的连线由 G-004 / G-001 负责，这里跳过。
     */
    public static List<Finding> sequentialTypeCompatibility(SystemIR system) {
        List<Finding> findings = new ArrayList<>();
        Map<String, Signature> sigs = signatures(system);
        for (WiringIR wiring : system.getWirings()) {
            if (!wiring.isCovariant() || wiring.isTemporal()) {
                continue;
            }
            if (!sigs.containsKey(wiring.getSource()) || !sigs.containsKey(wiring.getTarget())) {
                continue;
            }
            String srcOut = sigs.get(wiring.getSource()).getForwardOut();
            String tgtIn = sigs.get(wiring.getTarget()).getForwardIn();
            if (srcOut.isEmpty() || tgtIn.isEmpty()) {
                continue;
            }
            boolean compatible = Tokens.subset(wiring.getLabel(), srcOut) && Tokens.subset(wiring.getLabel(), tgtIn);
            findings.add(Finding.of(G005, Severity.ERROR,
                    String.format("Stack %s ; %s: out='%s', in='%s', wiring='%s'%s",
                            wiring.getSource(), wiring.getTarget(), srcOut, tgtIn, wiring.getLabel(),
                            compatible ? "" : " - type mismatch"),
                    Arrays.asList(wiring.getSource(), wiring.getTarget()), compatible));
        }
        return findings;
    }

    /**
     * G-006：协变、非时间连线构成的子图必须是 DAG。
     * 时间连线与逆变连线不参与：只有纯协变环才是同一时间步内无法消解的代数环。
     */
    public static List<Finding> covariantAcyclicity(SystemIR system) {
        List<String> nodes = new ArrayList<>();
        for (BlockIR block : system.getBlocks()) {
            nodes.add(block.getName());
        }
        List<String[]> edges = new ArrayList<>();
        for (WiringIR wiring : system.getWirings()) {
            if (wiring.isCovariant() && !wiring.isTemporal()) {
                edges.add(new String[]{wiring.getSource(), wiring.getTarget()});
            }
        }
        Optional<List<String>> cycle = GraphUtils.findCycle(GraphUtils.buildAdjacencyList(nodes, edges));
        if (cycle.isPresent()) {
            List<String> path = new ArrayList<>(cycle.get());
            path.add(path.get(0));
            return Collections.singletonList(Finding.of(G006, Severity.ERROR,
                    "Covariant flow graph contains a cycle: " + String.join(" -> ", path),
                    cycle.get(), false));
        }
        return Collections.singletonList(
                Finding.pass(G006, Severity.ERROR, "Covariant flow graph is acyclic (DAG)"));
    }

    private static Map<String, Signature> signatures(SystemIR system) {
        Map<String, Signature> sigs = new HashMap<>();
        for (BlockIR block : system.getBlocks()) {
            sigs.put(block.getName(), block.getSignature());
        }
        return sigs;
    }
}

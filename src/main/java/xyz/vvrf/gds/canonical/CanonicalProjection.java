package xyz.vvrf.gds.canonical;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.gds.block.AtomicBlock;
import xyz.vvrf.gds.block.BoundaryAction;
import xyz.vvrf.gds.block.ControlAction;
import xyz.vvrf.gds.block.Mechanism;
import xyz.vvrf.gds.block.Policy;
import xyz.vvrf.gds.block.RoleVisitor;
import xyz.vvrf.gds.core.Entity;
import xyz.vvrf.gds.core.Port;
import xyz.vvrf.gds.core.StateRef;
import xyz.vvrf.gds.spec.GdsSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 纯函数：{@link GdsSpec} → {@link CanonicalGds}。
 * 确定性、无状态，从不修改注册表；相同的注册内容总是得到相等的投影。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class CanonicalProjection {

    private CanonicalProjection() {}

    public static CanonicalGds project(GdsSpec spec) {
        List<StateRef> stateVariables = new ArrayList<>();
        for (Entity entity : spec.getEntities().values()) {
            for (String variable : entity.getVariables().keySet()) {
                stateVariables.add(StateRef.of(entity.getName(), variable));
            }
        }

        Partition partition = new Partition();
        for (AtomicBlock block : spec.getAtomicBlocks()) {
            block.acceptRole(partition);
        }

        CanonicalGds canonical = CanonicalGds.builder()
                .stateVariables(Collections.unmodifiableList(stateVariables))
                .parameterSchema(spec.getParameterSchema())
                .inputPorts(Collections.unmodifiableList(partition.inputPorts))
                .decisionPorts(Collections.unmodifiableList(partition.decisionPorts))
                .boundaryBlocks(Collections.unmodifiableList(partition.boundary))
                .controlBlocks(Collections.unmodifiableList(partition.control))
                .policyBlocks(Collections.unmodifiableList(partition.policy))
                .mechanismBlocks(Collections.unmodifiableList(partition.mechanism))
                .updateMap(Collections.unmodifiableMap(partition.updateMap))
                .build();
        log.debug("规范 '{}' 投影完成: |X|={}, |U|={}, |D|={}, f={} 个",
                spec.getName(), stateVariables.size(), partition.inputPorts.size(),
                partition.decisionPorts.size(), partition.mechanism.size());
        return canonical;
    }

    // 按角色分桶；普通原子块不参与投影
    private static final class Partition implements RoleVisitor<Void> {
        final List<String> boundary = new ArrayList<>();
        final List<String> control = new ArrayList<>();
        final List<String> policy = new ArrayList<>();
        final List<String> mechanism = new ArrayList<>();
        final List<PortRef> inputPorts = new ArrayList<>();
        final List<PortRef> decisionPorts = new ArrayList<>();
        final Map<String, List<StateRef>> updateMap = new LinkedHashMap<>();

        @Override
        public Void visitBoundary(BoundaryAction block) {
            boundary.add(block.getName());
            for (Port p : block.getInterface().getForwardOut()) {
                inputPorts.add(PortRef.of(block.getName(), p.getName()));
            }
            return null;
        }

        @Override
        public Void visitPolicy(Policy block) {
            policy.add(block.getName());
            for (Port p : block.getInterface().getForwardOut()) {
                decisionPorts.add(PortRef.of(block.getName(), p.getName()));
            }
            return null;
        }

        @Override
        public Void visitControl(ControlAction block) {
            control.add(block.getName());
            return null;
        }

        @Override
        public Void visitMechanism(Mechanism block) {
            mechanism.add(block.getName());
            updateMap.put(block.getName(), block.getUpdates());
            return null;
        }

        @Override
        public Void visitGeneric(AtomicBlock block) {
            return null;
        }
    }
}

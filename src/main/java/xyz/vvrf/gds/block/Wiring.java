package xyz.vvrf.gds.block;

import xyz.vvrf.gds.core.FlowDirection;

import java.util.Objects;

/**
 * 两个 Block 之间的显式连接（不可变数据类）。
 * 协变连线 (默认) 正向传递数据；逆变连线反向传递反馈。
 */
public final class Wiring {
    private final String sourceBlock;
    private final String sourcePort;
    private final String targetBlock;
    private final String targetPort;
    private final FlowDirection direction;

    public Wiring(String sourceBlock, String sourcePort, String targetBlock, String targetPort,
                  FlowDirection direction) {
        this.sourceBlock = Objects.requireNonNull(sourceBlock, "源 Block 名称不能为空");
        this.sourcePort = Objects.requireNonNull(sourcePort, "源端口名称不能为空");
        this.targetBlock = Objects.requireNonNull(targetBlock, "目标 Block 名称不能为空");
        this.targetPort = Objects.requireNonNull(targetPort, "目标端口名称不能为空");
        this.direction = direction == null ? FlowDirection.COVARIANT : direction;
    }

    public static Wiring of(String sourceBlock, String sourcePort, String targetBlock, String targetPort) {
        return new Wiring(sourceBlock, sourcePort, targetBlock, targetPort, FlowDirection.COVARIANT);
    }

    public static Wiring contravariant(String sourceBlock, String sourcePort, String targetBlock, String targetPort) {
        return new Wiring(sourceBlock, sourcePort, targetBlock, targetPort, FlowDirection.CONTRAVARIANT);
    }

    public String getSourceBlock() {
        return sourceBlock;
    }

    public String getSourcePort() {
        return sourcePort;
    }

    public String getTargetBlock() {
        return targetBlock;
    }

    public String getTargetPort() {
        return targetPort;
    }

    public FlowDirection getDirection() {
        return direction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Wiring wiring = (Wiring) o;
        return sourceBlock.equals(wiring.sourceBlock) && sourcePort.equals(wiring.sourcePort)
                && targetBlock.equals(wiring.targetBlock) && targetPort.equals(wiring.targetPort)
                && direction == wiring.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceBlock, sourcePort, targetBlock, targetPort, direction);
    }

    @Override
    public String toString() {
        return String.format("Wiring[%s.%s -> %s.%s, %s]",
                sourceBlock, sourcePort, targetBlock, targetPort, direction.value());
    }
}

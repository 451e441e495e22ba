package xyz.vvrf.gds.block;

import xyz.vvrf.gds.core.FlowDirection;
import xyz.vvrf.gds.core.Interface;
import xyz.vvrf.gds.exception.CompositionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 跨时间步的正向迭代 (forwardOut → forwardIn)。
 * <p>
 * 所有时间连线必须是协变的。{@code exitCondition} 只是报告用的不透明元数据，
 * 框架从不求值。
 * </p>
 *
 * @author ruifeng.wen
 */
public class TemporalLoop extends Block {

    private final Block inner;
    private final List<Wiring> temporalWiring;
    private final String exitCondition;

    public TemporalLoop(String name, Block inner, List<Wiring> temporalWiring, String exitCondition,
                        Map<String, String> tags) {
        super(name, tags);
        this.inner = Objects.requireNonNull(inner, "inner 不能为空");
        List<Wiring> wiring = temporalWiring == null ? Collections.<Wiring>emptyList() : temporalWiring;
        for (Wiring w : wiring) {
            if (w.getDirection() != FlowDirection.COVARIANT) {
                throw new CompositionException(String.format(
                        "TemporalLoop '%s': temporal wiring %s.%s → %s.%s must be COVARIANT (got %s)",
                        name, w.getSourceBlock(), w.getSourcePort(), w.getTargetBlock(), w.getTargetPort(),
                        w.getDirection().value()));
            }
        }
        this.temporalWiring = Collections.unmodifiableList(new ArrayList<>(wiring));
        this.exitCondition = exitCondition == null ? "" : exitCondition;
    }

    public Block getInner() {
        return inner;
    }

    public List<Wiring> getTemporalWiring() {
        return temporalWiring;
    }

    public String getExitCondition() {
        return exitCondition;
    }

    @Override
    public Interface getInterface() {
        return inner.getInterface();
    }

    @Override
    public List<AtomicBlock> flatten() {
        return inner.flatten();
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitTemporal(this);
    }

    @Override
    public TemporalLoop withTags(Map<String, String> extra) {
        return new TemporalLoop(getName(), inner, temporalWiring, exitCondition, mergeTags(extra));
    }
}

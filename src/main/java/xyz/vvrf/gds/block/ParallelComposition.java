package xyz.vvrf.gds.block;

import xyz.vvrf.gds.core.Interface;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 并行组合 {@code left | right}：两侧独立运行，没有共享连线，也不做校验。
 */
public class ParallelComposition extends Block {

    private final Block left;
    private final Block right;
    private final Interface iface;

    public ParallelComposition(String name, Block left, Block right, Map<String, String> tags) {
        super(name, tags);
        this.left = Objects.requireNonNull(left, "left 不能为空");
        this.right = Objects.requireNonNull(right, "right 不能为空");
        this.iface = left.getInterface().concat(right.getInterface());
    }

    public Block getLeft() {
        return left;
    }

    public Block getRight() {
        return right;
    }

    @Override
    public Interface getInterface() {
        return iface;
    }

    @Override
    public List<AtomicBlock> flatten() {
        List<AtomicBlock> leaves = new ArrayList<>(left.flatten());
        leaves.addAll(right.flatten());
        return leaves;
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitParallel(this);
    }

    @Override
    public ParallelComposition withTags(Map<String, String> extra) {
        return new ParallelComposition(getName(), left, right, mergeTags(extra));
    }
}

package xyz.vvrf.gds.block;

import xyz.vvrf.gds.core.Interface;
import xyz.vvrf.gds.core.Tokens;
import xyz.vvrf.gds.exception.TypeMismatchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 顺序组合 {@code first >> second}：first 的输出喂给 second 的输入。
 * <p>
 * 没有显式连线时，要求 first.forwardOut 与 second.forwardIn 的 token 集合
 * (两侧都非空时) 至少有一个交集，否则抛出 {@link TypeMismatchException}。
 * 接口为两侧逐字段拼接。
 * </p>
 *
 * @author ruifeng.wen
 */
public class StackComposition extends Block {

    private final Block first;
    private final Block second;
    private final List<Wiring> wiring;
    private final Interface iface;

    public StackComposition(String name, Block first, Block second, List<Wiring> wiring, Map<String, String> tags) {
        super(name, tags);
        this.first = Objects.requireNonNull(first, "first 不能为空");
        this.second = Objects.requireNonNull(second, "second 不能为空");
        this.wiring = wiring == null || wiring.isEmpty()
                ? Collections.<Wiring>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(wiring));

        if (this.wiring.isEmpty()) {
            Set<String> outTokens = Interface.collectTokens(first.getInterface().getForwardOut());
            Set<String> inTokens = Interface.collectTokens(second.getInterface().getForwardIn());
            if (!outTokens.isEmpty() && !inTokens.isEmpty() && !Tokens.overlap(outTokens, inTokens)) {
                throw new TypeMismatchException(String.format(
                        "Stack composition '%s': first.forward_out tokens %s have no overlap with second.forward_in tokens %s",
                        name, new TreeSet<>(outTokens), new TreeSet<>(inTokens)));
            }
        }
        this.iface = first.getInterface().concat(second.getInterface());
    }

    public Block getFirst() {
        return first;
    }

    public Block getSecond() {
        return second;
    }

    /**
     * 显式连线；为空表示由编译器按 token 自动连线。
     */
    public List<Wiring> getWiring() {
        return wiring;
    }

    public boolean hasExplicitWiring() {
        return !wiring.isEmpty();
    }

    @Override
    public Interface getInterface() {
        return iface;
    }

    @Override
    public List<AtomicBlock> flatten() {
        List<AtomicBlock> leaves = new ArrayList<>(first.flatten());
        leaves.addAll(second.flatten());
        return leaves;
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitStack(this);
    }

    @Override
    public StackComposition withTags(Map<String, String> extra) {
        return new StackComposition(getName(), first, second, wiring, mergeTags(extra));
    }
}

package xyz.vvrf.gds.block;

import xyz.vvrf.gds.core.Interface;
import xyz.vvrf.gds.core.Tagged;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 所有 Block 的抽象基类，原子块与组合块共用。
 * <p>
 * 每个 Block 都有名称和描述其边界端口的 {@link Interface}。
 * 组合运算 ({@link #then}, {@link #parallel}, {@link #feedback}, {@link #loop})
 * 由较简单的 Block 构造组合块，形成一棵树，编译器再把它展开为原子块列表加连线。
 * 组合块按值持有子块，接口由子块推导，不单独存储。
 * </p>
 *
 * @author ruifeng.wen
 */
public abstract class Block extends Tagged {

    private final String name;

    protected Block(String name, Map<String, String> tags) {
        super(tags);
        this.name = Objects.requireNonNull(name, "Block 名称不能为空");
    }

    public String getName() {
        return name;
    }

    /**
     * 该 Block 的方向性边界。
     */
    public abstract Interface getInterface();

    /**
     * 按求值顺序返回所有原子块：递归、从左到右、先 first 后 second。
     */
    public abstract List<AtomicBlock> flatten();

    public abstract <R> R accept(BlockVisitor<R> visitor);

    /**
     * 返回合并了额外标签的新实例，原实例不变。
     */
    public abstract Block withTags(Map<String, String> extra);

    public Block withTag(String key, String value) {
        return withTags(Collections.singletonMap(key, value));
    }

    /**
     * 顺序组合 {@code this >> other}，不带显式连线 (按 token 校验并自动连线)。
     */
    public StackComposition then(Block other) {
        return new StackComposition(name + " >> " + other.getName(), this, other, null, null);
    }

    /**
     * 顺序组合，使用显式连线覆盖自动 token 校验。
     */
    public StackComposition then(Block other, List<Wiring> wiring) {
        return new StackComposition(name + " >> " + other.getName(), this, other, wiring, null);
    }

    /**
     * 并行组合 {@code this | other}。
     */
    public ParallelComposition parallel(Block other) {
        return new ParallelComposition(name + " | " + other.getName(), this, other, null);
    }

    /**
     * 包装为单时间步内的反向反馈。
     */
    public FeedbackLoop feedback(List<Wiring> wiring) {
        return new FeedbackLoop(name + " [feedback]", this, wiring, null);
    }

    /**
     * 包装为跨时间步的正向时间迭代，所有连线必须是协变的。
     */
    public TemporalLoop loop(List<Wiring> wiring, String exitCondition) {
        return new TemporalLoop(name + " [loop]", this, wiring, exitCondition, null);
    }

    public TemporalLoop loop(List<Wiring> wiring) {
        return loop(wiring, "");
    }

    @Override
    public String toString() {
        return String.format("%s[%s]", getClass().getSimpleName(), name);
    }
}

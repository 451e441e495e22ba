package xyz.vvrf.gds.block;

import xyz.vvrf.gds.core.Interface;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 单时间步内的反向反馈 (backwardOut → backwardIn)。
 * 接口直接透传内部块；声明的连线不限制方向。
 */
public class FeedbackLoop extends Block {

    private final Block inner;
    private final List<Wiring> feedbackWiring;

    public FeedbackLoop(String name, Block inner, List<Wiring> feedbackWiring, Map<String, String> tags) {
        super(name, tags);
        this.inner = Objects.requireNonNull(inner, "inner 不能为空");
        this.feedbackWiring = feedbackWiring == null
                ? Collections.<Wiring>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(feedbackWiring));
    }

    public Block getInner() {
        return inner;
    }

    public List<Wiring> getFeedbackWiring() {
        return feedbackWiring;
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
        return visitor.visitFeedback(this);
    }

    @Override
    public FeedbackLoop withTags(Map<String, String> extra) {
        return new FeedbackLoop(getName(), inner, feedbackWiring, mergeTags(extra));
    }
}

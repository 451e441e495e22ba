package xyz.vvrf.gds.block;

import xyz.vvrf.gds.core.Interface;
import xyz.vvrf.gds.core.StateRef;
import xyz.vvrf.gds.exception.CompositionException;

import java.util.List;
import java.util.Map;

/**
 * 状态更新：唯一可以写状态的 Block 类型。
 * <p>
 * {@link #getUpdates()} 是写入意图的唯一声明，列出被修改的 (实体, 变量)。
 * Mechanism 不传递反向信号，两组反向端口都必须为空。
 * </p>
 *
 * @author ruifeng.wen
 */
public class Mechanism extends RoleBlock {

    private final List<StateRef> updates;

    public Mechanism(String name, Interface iface, List<StateRef> updates, List<String> paramsUsed,
                     List<String> constraints, Map<String, String> tags) {
        super(name, iface, paramsUsed, constraints, tags);
        Interface i = getInterface();
        if (!i.getBackwardIn().isEmpty() || !i.getBackwardOut().isEmpty()) {
            throw new CompositionException(String.format(
                    "Mechanism '%s': backward ports must be empty (mechanisms write state, they don't pass backward signals)",
                    name));
        }
        this.updates = freeze(updates);
    }

    public Mechanism(String name, Interface iface, List<StateRef> updates) {
        this(name, iface, updates, null, null, null);
    }

    @Override
    public <R> R acceptRole(RoleVisitor<R> visitor) {
        return visitor.visitMechanism(this);
    }

    public List<StateRef> getUpdates() {
        return updates;
    }

    @Override
    public Mechanism withTags(Map<String, String> extra) {
        return new Mechanism(getName(), getInterface(), updates, getParamsUsed(), getConstraints(), mergeTags(extra));
    }
}

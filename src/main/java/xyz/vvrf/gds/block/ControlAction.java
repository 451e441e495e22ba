package xyz.vvrf.gds.block;

import xyz.vvrf.gds.core.Interface;

import java.util.List;
import java.util.Map;

/**
 * 内生控制：读取状态并发出控制信号。
 */
public class ControlAction extends RoleBlock implements HasOptions {

    private final List<String> options;

    public ControlAction(String name, Interface iface, List<String> options, List<String> paramsUsed,
                         List<String> constraints, Map<String, String> tags) {
        super(name, iface, paramsUsed, constraints, tags);
        this.options = freeze(options);
    }

    public ControlAction(String name, Interface iface) {
        this(name, iface, null, null, null, null);
    }

    @Override
    public <R> R acceptRole(RoleVisitor<R> visitor) {
        return visitor.visitControl(this);
    }

    @Override
    public List<String> getOptions() {
        return options;
    }

    @Override
    public ControlAction withTags(Map<String, String> extra) {
        return new ControlAction(getName(), getInterface(), options, getParamsUsed(), getConstraints(),
                mergeTags(extra));
    }
}

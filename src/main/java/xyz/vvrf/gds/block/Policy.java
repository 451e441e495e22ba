package xyz.vvrf.gds.block;

import xyz.vvrf.gds.core.Interface;

import java.util.List;
import java.util.Map;

/**
 * 决策逻辑：把信号映射为 Mechanism 的输入。
 * 命名选项用于情景分析。
 */
public class Policy extends RoleBlock implements HasOptions {

    private final List<String> options;

    public Policy(String name, Interface iface, List<String> options, List<String> paramsUsed,
                  List<String> constraints, Map<String, String> tags) {
        super(name, iface, paramsUsed, constraints, tags);
        this.options = freeze(options);
    }

    public Policy(String name, Interface iface) {
        this(name, iface, null, null, null, null);
    }

    @Override
    public <R> R acceptRole(RoleVisitor<R> visitor) {
        return visitor.visitPolicy(this);
    }

    @Override
    public List<String> getOptions() {
        return options;
    }

    @Override
    public Policy withTags(Map<String, String> extra) {
        return new Policy(getName(), getInterface(), options, getParamsUsed(), getConstraints(), mergeTags(extra));
    }
}

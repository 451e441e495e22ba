package xyz.vvrf.gds.block;

import xyz.vvrf.gds.core.Interface;
import xyz.vvrf.gds.exception.CompositionException;

import java.util.List;
import java.util.Map;

/**
 * 外生输入：从系统外部进入的信号，属于容许输入集 U。
 * 外部主体、预言机、用户输入、环境信号等都用它建模。
 * <p>
 * 不接收内部正向信号，forwardIn 必须为空。
 * </p>
 *
 * @author ruifeng.wen
 */
public class BoundaryAction extends RoleBlock implements HasOptions {

    private final List<String> options;

    public BoundaryAction(String name, Interface iface, List<String> options, List<String> paramsUsed,
                          List<String> constraints, Map<String, String> tags) {
        super(name, iface, paramsUsed, constraints, tags);
        if (!getInterface().getForwardIn().isEmpty()) {
            throw new CompositionException(String.format(
                    "BoundaryAction '%s': forward_in must be empty (boundary actions receive no internal forward signals)",
                    name));
        }
        this.options = freeze(options);
    }

    public BoundaryAction(String name, Interface iface) {
        this(name, iface, null, null, null, null);
    }

    @Override
    public <R> R acceptRole(RoleVisitor<R> visitor) {
        return visitor.visitBoundary(this);
    }

    @Override
    public List<String> getOptions() {
        return options;
    }

    @Override
    public BoundaryAction withTags(Map<String, String> extra) {
        return new BoundaryAction(getName(), getInterface(), options, getParamsUsed(), getConstraints(),
                mergeTags(extra));
    }
}

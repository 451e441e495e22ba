package xyz.vvrf.gds.block;

import xyz.vvrf.gds.core.Interface;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 四种角色块的公共部分：参数引用与约束注释。
 */
public abstract class RoleBlock extends AtomicBlock implements HasParameters, HasConstraints {

    private final List<String> paramsUsed;
    private final List<String> constraints;

    protected RoleBlock(String name, Interface iface, List<String> paramsUsed, List<String> constraints,
                        Map<String, String> tags) {
        super(name, iface, tags);
        this.paramsUsed = freeze(paramsUsed);
        this.constraints = freeze(constraints);
    }

    @Override
    public abstract <R> R acceptRole(RoleVisitor<R> visitor);

    @Override
    public abstract RoleBlock withTags(Map<String, String> extra);

    @Override
    public List<String> getParamsUsed() {
        return paramsUsed;
    }

    @Override
    public List<String> getConstraints() {
        return constraints;
    }

    protected static <T> List<T> freeze(List<T> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }
}

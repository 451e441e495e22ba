package xyz.vvrf.gds.verification;

import xyz.vvrf.gds.spec.GdsSpec;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * 作用于规范注册表 {@link GdsSpec} 的一项语义检查。
 */
public interface SpecCheck {

    String getId();

    List<Finding> check(GdsSpec spec);

    static SpecCheck of(String id, Function<GdsSpec, List<Finding>> fn) {
        Objects.requireNonNull(id, "检查 ID 不能为空");
        Objects.requireNonNull(fn, "检查函数不能为空");
        return new SpecCheck() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public List<Finding> check(GdsSpec spec) {
                return fn.apply(spec);
            }

            @Override
            public String toString() {
                return "SpecCheck[" + id + "]";
            }
        };
    }
}

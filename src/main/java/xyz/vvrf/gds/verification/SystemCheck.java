package xyz.vvrf.gds.verification;

import xyz.vvrf.gds.ir.SystemIR;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * 作用于编译后 {@link SystemIR} 的一项检查。
 * 实现不应抛出异常：所有异常情况都应表达为未通过的 {@link Finding}。
 */
public interface SystemCheck {

    String getId();

    List<Finding> check(SystemIR system);

    static SystemCheck of(String id, Function<SystemIR, List<Finding>> fn) {
        Objects.requireNonNull(id, "检查 ID 不能为空");
        Objects.requireNonNull(fn, "检查函数不能为空");
        return new SystemCheck() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public List<Finding> check(SystemIR system) {
                return fn.apply(system);
            }

            @Override
            public String toString() {
                return "SystemCheck[" + id + "]";
            }
        };
    }
}

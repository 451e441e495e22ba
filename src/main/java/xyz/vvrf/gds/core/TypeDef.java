package xyz.vvrf.gds.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 带可选运行时约束的命名类型（不可变数据类），是类型系统的原子。
 * <p>
 * {@link #checkValue(Object)} 先检查原始种类，再调用约束谓词。
 * 谓词由调用方提供并同步执行，框架不对其耗时或终止性做任何保护。
 * </p>
 * 相等性只看名称。
 *
 * @author ruifeng.wen
 */
public final class TypeDef {
    private final String name;
    private final PrimitiveKind kind;
    private final Predicate<Object> constraint; // 可为 null
    private final String description;
    private final String units; // 可为 null

    public TypeDef(String name, PrimitiveKind kind, Predicate<Object> constraint, String description, String units) {
        this.name = Objects.requireNonNull(name, "类型名称不能为空");
        this.kind = Objects.requireNonNull(kind, "类型种类不能为空");
        this.constraint = constraint;
        this.description = description == null ? "" : description;
        this.units = units;
    }

    public static TypeDef of(String name, PrimitiveKind kind) {
        return new TypeDef(name, kind, null, "", null);
    }

    public static TypeDef of(String name, PrimitiveKind kind, Predicate<Object> constraint) {
        return new TypeDef(name, kind, constraint, "", null);
    }

    /**
     * 值是否满足此类型定义 (种类 + 约束)。
     */
    public boolean checkValue(Object value) {
        if (!kind.accepts(value)) {
            return false;
        }
        return constraint == null || constraint.test(value);
    }

    public TypeDef withDescription(String description) {
        return new TypeDef(name, kind, constraint, description, units);
    }

    public TypeDef withUnits(String units) {
        return new TypeDef(name, kind, constraint, description, units);
    }

    public String getName() {
        return name;
    }

    public PrimitiveKind getKind() {
        return kind;
    }

    public Optional<Predicate<Object>> getConstraint() {
        return Optional.ofNullable(constraint);
    }

    public String getDescription() {
        return description;
    }

    public Optional<String> getUnits() {
        return Optional.ofNullable(units);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((TypeDef) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return String.format("TypeDef[%s:%s%s]", name, kind.label(), constraint == null ? "" : ", constrained");
    }
}

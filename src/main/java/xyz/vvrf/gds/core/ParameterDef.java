package xyz.vvrf.gds.core;

import java.util.Objects;
import java.util.Optional;

/**
 * 参数空间 Θ 中单个维度的结构定义（不可变数据类）。
 * 只描述类型、约束与边界；不承载取值，也不涉及绑定或执行。
 *
 * @author ruifeng.wen
 */
public final class ParameterDef {
    private final String name;
    private final TypeDef typedef;
    private final String description;
    private final Comparable<?> lowerBound; // 含边界，可为 null
    private final Comparable<?> upperBound;

    public ParameterDef(String name, TypeDef typedef, String description,
                        Comparable<?> lowerBound, Comparable<?> upperBound) {
        this.name = Objects.requireNonNull(name, "参数名称不能为空");
        this.typedef = Objects.requireNonNull(typedef, "参数类型不能为空");
        this.description = description == null ? "" : description;
        if ((lowerBound == null) != (upperBound == null)) {
            throw new IllegalArgumentException("Parameter '" + name + "' bounds must declare both low and high or neither");
        }
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public static ParameterDef of(String name, TypeDef typedef) {
        return new ParameterDef(name, typedef, "", null, null);
    }

    public static ParameterDef bounded(String name, TypeDef typedef, Comparable<?> low, Comparable<?> high) {
        return new ParameterDef(name, typedef, "", low, high);
    }

    /**
     * 值是否满足参数的类型、约束及边界。
     */
    public boolean checkValue(Object value) {
        if (!typedef.checkValue(value)) {
            return false;
        }
        if (lowerBound != null) {
            return compare(lowerBound, value) <= 0 && compare(upperBound, value) >= 0;
        }
        return true;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(Comparable bound, Object value) {
        if (bound instanceof Number && value instanceof Number) {
            return Double.compare(((Number) bound).doubleValue(), ((Number) value).doubleValue());
        }
        return bound.compareTo(value);
    }

    public String getName() {
        return name;
    }

    public TypeDef getTypedef() {
        return typedef;
    }

    public String getDescription() {
        return description;
    }

    public boolean hasBounds() {
        return lowerBound != null;
    }

    public Optional<Comparable<?>> getLowerBound() {
        return Optional.ofNullable(lowerBound);
    }

    public Optional<Comparable<?>> getUpperBound() {
        return Optional.ofNullable(upperBound);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterDef that = (ParameterDef) o;
        return name.equals(that.name) && typedef.equals(that.typedef) && description.equals(that.description)
                && Objects.equals(lowerBound, that.lowerBound) && Objects.equals(upperBound, that.upperBound);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typedef, description, lowerBound, upperBound);
    }

    @Override
    public String toString() {
        return String.format("ParameterDef[%s: %s%s]", name, typedef.getName(),
                hasBounds() ? ", bounds=[" + lowerBound + ", " + upperBound + "]" : "");
    }
}

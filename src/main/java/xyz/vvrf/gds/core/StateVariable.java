package xyz.vvrf.gds.core;

import java.util.Objects;

/**
 * 实体状态中的单个类型化变量（不可变数据类）。
 */
public final class StateVariable {
    private final String name;
    private final TypeDef typedef;
    private final String description;
    private final String symbol; // 数学符号，可为空串

    public StateVariable(String name, TypeDef typedef, String description, String symbol) {
        this.name = Objects.requireNonNull(name, "变量名称不能为空");
        this.typedef = Objects.requireNonNull(typedef, "变量类型不能为空");
        this.description = description == null ? "" : description;
        this.symbol = symbol == null ? "" : symbol;
    }

    public static StateVariable of(String name, TypeDef typedef) {
        return new StateVariable(name, typedef, "", "");
    }

    public static StateVariable of(String name, TypeDef typedef, String symbol) {
        return new StateVariable(name, typedef, "", symbol);
    }

    public boolean checkValue(Object value) {
        return typedef.checkValue(value);
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

    public String getSymbol() {
        return symbol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateVariable that = (StateVariable) o;
        return name.equals(that.name) && typedef.equals(that.typedef)
                && description.equals(that.description) && symbol.equals(that.symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typedef, description, symbol);
    }

    @Override
    public String toString() {
        return String.format("StateVariable[%s: %s]", name, typedef.getName());
    }
}

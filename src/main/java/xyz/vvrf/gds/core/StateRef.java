package xyz.vvrf.gds.core;

import java.util.Objects;

/**
 * (实体, 变量) 对，指向状态空间中的一个分量。
 * Mechanism 通过它声明写入意图。
 */
public final class StateRef implements Comparable<StateRef> {
    private final String entity;
    private final String variable;

    public StateRef(String entity, String variable) {
        this.entity = Objects.requireNonNull(entity, "实体名称不能为空");
        this.variable = Objects.requireNonNull(variable, "变量名称不能为空");
    }

    public static StateRef of(String entity, String variable) {
        return new StateRef(entity, variable);
    }

    public String getEntity() {
        return entity;
    }

    public String getVariable() {
        return variable;
    }

    @Override
    public int compareTo(StateRef o) {
        int c = entity.compareTo(o.entity);
        return c != 0 ? c : variable.compareTo(o.variable);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateRef that = (StateRef) o;
        return entity.equals(that.entity) && variable.equals(that.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, variable);
    }

    @Override
    public String toString() {
        return entity + "." + variable;
    }
}

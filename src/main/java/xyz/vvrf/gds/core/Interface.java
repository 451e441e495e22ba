package xyz.vvrf.gds.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Block 的方向性边界（不可变数据类）。
 * <p>
 * 四组有序端口：
 * <ul>
 *   <li>forwardIn: 定义域输入 (协变)</li>
 *   <li>forwardOut: 值域输出 (协变)</li>
 *   <li>backwardIn: 反向输入 (逆变)</li>
 *   <li>backwardOut: 反向输出 (逆变)</li>
 * </ul>
 *
 * @author ruifeng.wen
 */
public final class Interface {

    public static final Interface EMPTY = new Interface(
            Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), Collections.emptyList());

    private final List<Port> forwardIn;
    private final List<Port> forwardOut;
    private final List<Port> backwardIn;
    private final List<Port> backwardOut;

    public Interface(List<Port> forwardIn, List<Port> forwardOut, List<Port> backwardIn, List<Port> backwardOut) {
        this.forwardIn = freeze(forwardIn);
        this.forwardOut = freeze(forwardOut);
        this.backwardIn = freeze(backwardIn);
        this.backwardOut = freeze(backwardOut);
    }

    /**
     * 由端口名称列表创建接口，每个名称自动转换为 {@link Port}。
     * 任一参数为 null 时视为空。
     */
    public static Interface of(List<String> forwardIn, List<String> forwardOut,
                               List<String> backwardIn, List<String> backwardOut) {
        return new Interface(ports(forwardIn), ports(forwardOut), ports(backwardIn), ports(backwardOut));
    }

    public static Interface forward(List<String> forwardIn, List<String> forwardOut) {
        return of(forwardIn, forwardOut, null, null);
    }

    /**
     * 逐字段拼接两个接口：this 的端口在前，other 的端口在后。
     */
    public Interface concat(Interface other) {
        return new Interface(
                join(forwardIn, other.forwardIn),
                join(forwardOut, other.forwardOut),
                join(backwardIn, other.backwardIn),
                join(backwardOut, other.backwardOut));
    }

    public List<Port> getForwardIn() {
        return forwardIn;
    }

    public List<Port> getForwardOut() {
        return forwardOut;
    }

    public List<Port> getBackwardIn() {
        return backwardIn;
    }

    public List<Port> getBackwardOut() {
        return backwardOut;
    }

    /**
     * 收集一组端口的全部 token。
     */
    public static Set<String> collectTokens(List<Port> ports) {
        Set<String> tokens = new HashSet<>();
        for (Port p : ports) {
            tokens.addAll(p.getTypeTokens());
        }
        return Collections.unmodifiableSet(tokens);
    }

    private static List<Port> ports(List<String> names) {
        if (names == null) {
            return Collections.emptyList();
        }
        List<Port> result = new ArrayList<>(names.size());
        for (String name : names) {
            result.add(Port.of(name));
        }
        return result;
    }

    private static List<Port> join(List<Port> a, List<Port> b) {
        List<Port> result = new ArrayList<>(a.size() + b.size());
        result.addAll(a);
        result.addAll(b);
        return result;
    }

    private static List<Port> freeze(List<Port> ports) {
        if (ports == null || ports.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(ports));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Interface that = (Interface) o;
        return forwardIn.equals(that.forwardIn) &&
                forwardOut.equals(that.forwardOut) &&
                backwardIn.equals(that.backwardIn) &&
                backwardOut.equals(that.backwardOut);
    }

    @Override
    public int hashCode() {
        return Objects.hash(forwardIn, forwardOut, backwardIn, backwardOut);
    }

    @Override
    public String toString() {
        return String.format("Interface[fwdIn=%s, fwdOut=%s, bwdIn=%s, bwdOut=%s]",
                names(forwardIn), names(forwardOut), names(backwardIn), names(backwardOut));
    }

    private static List<String> names(List<Port> ports) {
        List<String> names = new ArrayList<>(ports.size());
        for (Port p : ports) {
            names.add(p.getName());
        }
        return names;
    }
}

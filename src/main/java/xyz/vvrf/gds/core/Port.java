package xyz.vvrf.gds.core;

import java.util.Objects;
import java.util.Set;

/**
 * 代表 Block 接口上的一个命名端口（不可变数据类）。
 * 端口的类型由其名称分词后得到的 token 集合决定。
 *
 * @author ruifeng.wen
 */
public final class Port {
    private final String name;
    private final Set<String> typeTokens; // 创建时冻结

    private Port(String name, Set<String> typeTokens) {
        this.name = Objects.requireNonNull(name, "端口名称不能为空");
        this.typeTokens = typeTokens;
    }

    /**
     * 根据人类可读的名称创建端口，自动分词。
     *
     * @param name 端口名称 (不能为空)
     * @return 新的 Port 实例
     */
    public static Port of(String name) {
        return new Port(name, Tokens.tokenize(name));
    }

    public String getName() {
        return name;
    }

    public Set<String> getTypeTokens() {
        return typeTokens;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Port port = (Port) o;
        return name.equals(port.name) && typeTokens.equals(port.typeTokens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeTokens);
    }

    @Override
    public String toString() {
        return String.format("Port[%s, tokens=%s]", name, typeTokens);
    }
}

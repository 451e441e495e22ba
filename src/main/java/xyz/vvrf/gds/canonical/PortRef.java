package xyz.vvrf.gds.canonical;

import java.util.Objects;

/**
 * (Block 名称, 端口名称) 对。
 */
public final class PortRef {
    private final String block;
    private final String port;

    public PortRef(String block, String port) {
        this.block = Objects.requireNonNull(block, "Block 名称不能为空");
        this.port = Objects.requireNonNull(port, "端口名称不能为空");
    }

    public static PortRef of(String block, String port) {
        return new PortRef(block, port);
    }

    public String getBlock() {
        return block;
    }

    public String getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PortRef portRef = (PortRef) o;
        return block.equals(portRef.block) && port.equals(portRef.port);
    }

    @Override
    public int hashCode() {
        return Objects.hash(block, port);
    }

    @Override
    public String toString() {
        return block + "." + port;
    }
}

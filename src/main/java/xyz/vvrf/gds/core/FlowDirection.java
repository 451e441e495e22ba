package xyz.vvrf.gds.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 信息流方向。
 * <ul>
 *   <li>COVARIANT: 正向数据流 (forwardIn → forwardOut)</li>
 *   <li>CONTRAVARIANT: 同一时间步内的反向反馈流 (backwardOut → backwardIn)</li>
 * </ul>
 */
public enum FlowDirection {
    COVARIANT,
    CONTRAVARIANT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FlowDirection fromValue(String value) {
        return FlowDirection.valueOf(value.toUpperCase(Locale.ROOT));
    }
}

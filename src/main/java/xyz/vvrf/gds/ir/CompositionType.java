package xyz.vvrf.gds.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 组合方式。
 * <ul>
 *   <li>SEQUENTIAL: 前者输出喂给后者输入 (stack)</li>
 *   <li>PARALLEL: 并列运行，无共享连线</li>
 *   <li>FEEDBACK: 时间步内的 backwardOut → backwardIn</li>
 *   <li>TEMPORAL: 跨时间步的 forwardOut → forwardIn</li>
 * </ul>
 */
public enum CompositionType {
    SEQUENTIAL,
    PARALLEL,
    FEEDBACK,
    TEMPORAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CompositionType fromValue(String value) {
        return CompositionType.valueOf(value.toUpperCase(Locale.ROOT));
    }
}

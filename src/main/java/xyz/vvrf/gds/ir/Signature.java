package xyz.vvrf.gds.ir;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * BlockIR 的四元签名：每个槽位是该方向端口名以 {@code " + "} 拼接的字符串，无端口时为空串。
 */
@Value
@Builder
@Jacksonized
@AllArgsConstructor(staticName = "of")
public class Signature {

    public static final Signature EMPTY = Signature.of("", "", "", "");

    @Builder.Default
    String forwardIn = "";
    @Builder.Default
    String forwardOut = "";
    @Builder.Default
    String backwardIn = "";
    @Builder.Default
    String backwardOut = "";

    /**
     * 至少一个输入槽 (正向或反向) 非空。
     */
    public boolean hasInput() {
        return !forwardIn.isEmpty() || !backwardIn.isEmpty();
    }

    /**
     * 至少一个输出槽 (正向或反向) 非空。
     */
    public boolean hasOutput() {
        return !forwardOut.isEmpty() || !backwardOut.isEmpty();
    }
}

package xyz.vvrf.gds.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 领域模型的结构性违规。
 * <p>
 * 一次构造或校验只抛出一个异常，其中携带本次发现的全部违规项，
 * 消息为各项以 {@code "; "} 拼接。
 * </p>
 */
public class ValidationException extends GdsException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public ValidationException(String violation) {
        this(Collections.singletonList(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}

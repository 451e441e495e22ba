package xyz.vvrf.gds.verification;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 单条验证结果：通过或失败，并附带涉及的元素名称。
 */
@Value
@Builder
@Jacksonized
public class Finding {

    String checkId;
    Severity severity;
    String message;
    @Builder.Default
    List<String> sourceElements = Collections.emptyList();
    boolean passed;

    public static Finding pass(String checkId, Severity severity, String message, String... elements) {
        return of(checkId, severity, message, Arrays.asList(elements), true);
    }

    public static Finding fail(String checkId, Severity severity, String message, String... elements) {
        return of(checkId, severity, message, Arrays.asList(elements), false);
    }

    public static Finding of(String checkId, Severity severity, String message, List<String> elements,
                             boolean passed) {
        return Finding.builder()
                .checkId(checkId)
                .severity(severity)
                .message(message)
                .sourceElements(Collections.unmodifiableList(new ArrayList<>(elements)))
                .passed(passed)
                .build();
    }
}

package xyz.vvrf.gds.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.gds.verification.Finding;
import xyz.vvrf.gds.verification.VerificationReport;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 把验证结果记录为 Micrometer 指标。
 * <ul>
 *     <li>{@code gds.verification.findings.total}：按 目标/检查/严重级别/是否通过 统计的结果数</li>
 *     <li>{@code gds.verification.time}：单项检查和整次运行的耗时</li>
 *     <li>{@code gds.verification.check.errors.total}：检查执行抛出异常的次数</li>
 * </ul>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MicrometerVerificationListener implements VerificationListener {

    public static final String METRIC_FINDINGS_TOTAL = "gds.verification.findings.total";
    public static final String METRIC_VERIFICATION_TIME = "gds.verification.time";
    public static final String METRIC_CHECK_ERRORS = "gds.verification.check.errors.total";

    // 标签键
    public static final String TAG_SYSTEM = "system";
    public static final String TAG_CHECK = "check";
    public static final String TAG_SEVERITY = "severity";
    public static final String TAG_PASSED = "passed";
    public static final String TAG_STATUS = "status";
    public static final String TAG_ERROR = "error";

    // 整次运行的计时器使用的检查标签值
    public static final String CHECK_ALL = "all";

    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_FAILURE = "FAILURE";

    private final MeterRegistry meterRegistry;

    public MicrometerVerificationListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onVerificationStart(String target, int checkCount) {
        // 指标在结束时记录
    }

    @Override
    public void onCheckComplete(String target, String checkId, Duration duration, List<Finding> findings) {
        boolean allPassed = true;
        for (Finding finding : findings) {
            allPassed &= finding.isPassed();
            incrementCounter(Tags.of(
                    Tag.of(TAG_SYSTEM, target),
                    Tag.of(TAG_CHECK, finding.getCheckId()),
                    Tag.of(TAG_SEVERITY, finding.getSeverity().value()),
                    Tag.of(TAG_PASSED, String.valueOf(finding.isPassed()))));
        }
        recordTimer(Tags.of(
                Tag.of(TAG_SYSTEM, target),
                Tag.of(TAG_CHECK, checkId),
                Tag.of(TAG_STATUS, allPassed ? STATUS_SUCCESS : STATUS_FAILURE)), duration);
    }

    @Override
    public void onCheckError(String target, String checkId, Duration duration, Throwable error) {
        // 异常转换成的失败结果随后经 onCheckComplete 计入结果数和耗时，这里单独计数异常
        Tags tags = Tags.of(
                Tag.of(TAG_SYSTEM, target),
                Tag.of(TAG_CHECK, checkId),
                Tag.of(TAG_ERROR, error != null ? error.getClass().getSimpleName() : "Unknown"));
        try {
            Counter.builder(METRIC_CHECK_ERRORS).tags(tags).register(meterRegistry).increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
        log.debug("Micrometer 监听器捕获到检查 {} 的执行异常", checkId);
    }

    @Override
    public void onVerificationComplete(VerificationReport report, Duration totalDuration) {
        recordTimer(Tags.of(
                Tag.of(TAG_SYSTEM, report.getSystemName()),
                Tag.of(TAG_CHECK, CHECK_ALL),
                Tag.of(TAG_STATUS, report.isSuccessful() ? STATUS_SUCCESS : STATUS_FAILURE)), totalDuration);
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(METRIC_VERIFICATION_TIME)
                    .tags(tags)
                    .description("验证检查耗时")
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter counter = Counter.builder(METRIC_FINDINGS_TOTAL)
                    .tags(tags)
                    .description("按检查与严重级别统计的验证结果总数")
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}

package xyz.vvrf.gds.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.gds.verification.Finding;
import xyz.vvrf.gds.verification.Severity;
import xyz.vvrf.gds.verification.VerificationReport;

import java.time.Duration;
import java.util.List;

/**
 * 把验证事件写入日志。未通过的 WARNING / ERROR 结果以 warn 级别输出。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LoggingVerificationListener implements VerificationListener {

    @Override
    public void onVerificationStart(String target, int checkCount) {
        log.info("[MONITOR] 目标:[{}] 验证开始。 检查数:[{}]", target, checkCount);
    }

    @Override
    public void onCheckComplete(String target, String checkId, Duration duration, List<Finding> findings) {
        log.debug("[MONITOR] 目标:[{}] 检查:[{}] 完成。 耗时:[{}ms], 结果数:[{}]",
                target, checkId, duration.toMillis(), findings.size());
        for (Finding finding : findings) {
            if (!finding.isPassed() && finding.getSeverity() != Severity.INFO) {
                log.warn("[MONITOR] 目标:[{}] 检查:[{}] 未通过 ({}): {}",
                        target, checkId, finding.getSeverity().value(), finding.getMessage());
            }
        }
    }

    @Override
    public void onCheckError(String target, String checkId, Duration duration, Throwable error) {
        log.error("[MONITOR] 目标:[{}] 检查:[{}] 执行异常。 耗时:[{}ms], 错误:[{}]",
                target, checkId, duration.toMillis(), error.getMessage(), error);
    }

    @Override
    public void onVerificationComplete(VerificationReport report, Duration totalDuration) {
        log.info("[MONITOR] 目标:[{}] 验证完成。 耗时:[{}ms], 通过:[{}/{}], 错误:[{}], 警告:[{}]",
                report.getSystemName(), totalDuration.toMillis(), report.getChecksPassed(),
                report.getChecksTotal(), report.getErrors(), report.getWarnings());
    }
}

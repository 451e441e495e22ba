package xyz.vvrf.gds.monitor;

import xyz.vvrf.gds.verification.Finding;
import xyz.vvrf.gds.verification.VerificationReport;

import java.time.Duration;
import java.util.List;

/**
 * 用于监控验证过程的监听器接口。
 * 包括一次验证运行级别和单项检查级别的事件。
 * 监听器抛出的异常会被引擎记录并忽略，不影响验证结果。
 *
 * @author ruifeng.wen
 */
public interface VerificationListener {

    /**
     * 一次验证运行开始时调用。
     *
     * @param target     被验证对象的名称 (系统名或规范名)
     * @param checkCount 将要执行的检查数量
     */
    void onVerificationStart(String target, int checkCount);

    /**
     * 单项检查正常返回时调用。
     *
     * @param target   被验证对象的名称
     * @param checkId  检查 ID
     * @param duration 检查耗时
     * @param findings 该检查产出的结果
     */
    void onCheckComplete(String target, String checkId, Duration duration, List<Finding> findings);

    /**
     * 单项检查抛出异常时调用。异常已被转换为一条失败结果。
     *
     * @param target   被验证对象的名称
     * @param checkId  检查 ID
     * @param duration 检查耗时
     * @param error    检查抛出的异常
     */
    void onCheckError(String target, String checkId, Duration duration, Throwable error);

    /**
     * 一次验证运行完成时调用。
     *
     * @param report        完整报告
     * @param totalDuration 总耗时
     */
    void onVerificationComplete(VerificationReport report, Duration totalDuration);
}

package xyz.vvrf.gds.registry;

import xyz.vvrf.gds.verification.Severity;
import xyz.vvrf.gds.verification.SpecCheck;
import xyz.vvrf.gds.verification.SystemCheck;

import java.util.List;

/**
 * 自定义验证检查的注册表。
 * 内置检查 (G-xxx / SC-xxx) 不需要注册，由 {@link xyz.vvrf.gds.verification.VerificationEngine} 直接提供；
 * 这里只保存领域扩展的检查。
 *
 * @author ruifeng.wen
 */
public interface CheckRegistry {

    /**
     * 注册一个作用于 SystemIR 的检查。
     *
     * @param check           检查实现 (不能为空)
     * @param failureSeverity 检查抛出异常时生成的失败结果的严重级别
     * @throws IllegalArgumentException 如果同 ID 的检查已注册
     */
    void registerSystemCheck(SystemCheck check, Severity failureSeverity);

    default void registerSystemCheck(SystemCheck check) {
        registerSystemCheck(check, Severity.ERROR);
    }

    /**
     * 注册一个作用于规范注册表的检查。
     *
     * @throws IllegalArgumentException 如果同 ID 的检查已注册
     */
    void registerSpecCheck(SpecCheck check, Severity failureSeverity);

    default void registerSpecCheck(SpecCheck check) {
        registerSpecCheck(check, Severity.ERROR);
    }

    /**
     * 按注册顺序返回所有 SystemIR 检查。
     */
    List<SystemCheck> getSystemChecks();

    /**
     * 按注册顺序返回所有规范检查。
     */
    List<SpecCheck> getSpecChecks();

    /**
     * 检查抛出异常时使用的严重级别；未注册的 ID 返回 ERROR。
     */
    Severity getFailureSeverity(String checkId);
}

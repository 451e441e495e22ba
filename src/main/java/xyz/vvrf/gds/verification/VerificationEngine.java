package xyz.vvrf.gds.verification;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.gds.ir.SystemIR;
import xyz.vvrf.gds.monitor.VerificationListener;
import xyz.vvrf.gds.registry.CheckRegistry;
import xyz.vvrf.gds.registry.SimpleCheckRegistry;
import xyz.vvrf.gds.spec.GdsSpec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 验证引擎：对 SystemIR 或规范注册表依次执行检查并汇总为 {@link VerificationReport}。
 * <p>
 * 检查之间相互独立，按给定顺序同步执行。任何检查抛出的异常都会被转换为
 * 一条未通过的结果，因此调用方总能拿到完整的报告。
 * </p>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class VerificationEngine {

    private final CheckRegistry checkRegistry;
    private final List<VerificationListener> listeners;
    private final Set<String> disabledChecks;
    private final boolean includeCustomChecks;

    /**
     * @param checkRegistry       自定义检查注册表
     * @param listeners           监听器列表，可为空
     * @param disabledChecks      要跳过的检查 ID
     * @param includeCustomChecks 默认检查集是否包含注册表中的自定义检查
     */
    public VerificationEngine(CheckRegistry checkRegistry,
                              List<VerificationListener> listeners,
                              Collection<String> disabledChecks,
                              boolean includeCustomChecks) {
        this.checkRegistry = Objects.requireNonNull(checkRegistry, "CheckRegistry 不能为空");
        this.listeners = listeners == null ? Collections.<VerificationListener>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(listeners));
        this.disabledChecks = disabledChecks == null ? Collections.<String>emptySet()
                : Collections.unmodifiableSet(new HashSet<>(disabledChecks));
        this.includeCustomChecks = includeCustomChecks;
        log.info("VerificationEngine 初始化完成。监听器: {} 个, 禁用检查: {}, 包含自定义检查: {}",
                this.listeners.size(), this.disabledChecks, includeCustomChecks);
    }

    public VerificationEngine() {
        this(new SimpleCheckRegistry(), null, null, true);
    }

    /**
     * 执行全部通用检查 (G-001 至 G-006) 以及已注册的自定义 SystemIR 检查。
     */
    public VerificationReport verify(SystemIR system) {
        List<SystemCheck> checks = new ArrayList<>(GenericChecks.all());
        if (includeCustomChecks) {
            checks.addAll(checkRegistry.getSystemChecks());
        }
        return verify(system, checks);
    }

    /**
     * 按给定顺序执行指定检查。被禁用的检查 ID 同样会被跳过。
     */
    public VerificationReport verify(SystemIR system, List<SystemCheck> checks) {
        Objects.requireNonNull(system, "SystemIR 不能为空");
        List<NamedCheck<SystemIR>> named = new ArrayList<>();
        for (SystemCheck check : checks) {
            named.add(new NamedCheck<>(check.getId(), check::check));
        }
        return run(system.getName(), system, named);
    }

    /**
     * 执行默认语义检查 (SC-001、SC-002、SC-004 至 SC-007) 以及已注册的自定义规范检查。
     * SC-003 需要显式的块对，通过 {@link SpecChecks#reachability(String, String)} 传入。
     */
    public VerificationReport verifySpec(GdsSpec spec) {
        List<SpecCheck> checks = new ArrayList<>(SpecChecks.all());
        if (includeCustomChecks) {
            checks.addAll(checkRegistry.getSpecChecks());
        }
        return verifySpec(spec, checks);
    }

    public VerificationReport verifySpec(GdsSpec spec, List<SpecCheck> checks) {
        Objects.requireNonNull(spec, "GdsSpec 不能为空");
        List<NamedCheck<GdsSpec>> named = new ArrayList<>();
        for (SpecCheck check : checks) {
            named.add(new NamedCheck<>(check.getId(), check::check));
        }
        return run(spec.getName(), spec, named);
    }

    private <T> VerificationReport run(String target, T subject, List<NamedCheck<T>> checks) {
        List<NamedCheck<T>> active = new ArrayList<>();
        for (NamedCheck<T> check : checks) {
            if (disabledChecks.contains(check.id)) {
                log.debug("目标 '{}': 检查 '{}' 已禁用，跳过", target, check.id);
            } else {
                active.add(check);
            }
        }

        long start = System.nanoTime();
        notifyListeners(l -> l.onVerificationStart(target, active.size()));

        List<Finding> findings = new ArrayList<>();
        for (NamedCheck<T> check : active) {
            long checkStart = System.nanoTime();
            List<Finding> result;
            try {
                result = check.fn.apply(subject);
                if (result == null) {
                    result = Collections.emptyList();
                }
            } catch (Exception e) {
                Duration failedAfter = Duration.ofNanos(System.nanoTime() - checkStart);
                log.error("目标 '{}': 检查 '{}' 执行时抛出异常", target, check.id, e);
                notifyListeners(l -> l.onCheckError(target, check.id, failedAfter, e));
                result = Collections.singletonList(Finding.fail(check.id,
                        checkRegistry.getFailureSeverity(check.id),
                        String.format("Check '%s' raised %s: %s", check.id, e.getClass().getSimpleName(), e.getMessage())));
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - checkStart);
            // 一个检查可能产出多个 ID 的结果 (SC-006 / SC-007)，被禁用的 ID 同样剔除
            List<Finding> produced = new ArrayList<>();
            for (Finding finding : result) {
                if (!disabledChecks.contains(finding.getCheckId())) {
                    produced.add(finding);
                }
            }
            notifyListeners(l -> l.onCheckComplete(target, check.id, elapsed, produced));
            findings.addAll(produced);
        }

        VerificationReport report = new VerificationReport(target, findings);
        Duration total = Duration.ofNanos(System.nanoTime() - start);
        notifyListeners(l -> l.onVerificationComplete(report, total));
        log.debug("目标 '{}' 验证完成: {}", target, report);
        return report;
    }

    // 监听器异常只记录，不影响验证
    private void notifyListeners(Consumer<VerificationListener> action) {
        for (VerificationListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                log.error("VerificationListener {} 执行失败: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    public CheckRegistry getCheckRegistry() {
        return checkRegistry;
    }

    public Set<String> getDisabledChecks() {
        return disabledChecks;
    }

    private static final class NamedCheck<T> {
        final String id;
        final Function<T, List<Finding>> fn;

        NamedCheck(String id, Function<T, List<Finding>> fn) {
            this.id = id;
            this.fn = fn;
        }
    }
}

package xyz.vvrf.gds.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.gds.verification.Severity;
import xyz.vvrf.gds.verification.SpecCheck;
import xyz.vvrf.gds.verification.SystemCheck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CheckRegistry 的简单内存实现。
 * 注册发生在构建阶段，之后只读；不做并发保护。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SimpleCheckRegistry implements CheckRegistry {

    // 保持注册顺序，验证按此顺序执行
    private final Map<String, SystemCheck> systemChecks = new LinkedHashMap<>();
    private final Map<String, SpecCheck> specChecks = new LinkedHashMap<>();
    private final Map<String, Severity> failureSeverities = new LinkedHashMap<>();

    @Override
    public void registerSystemCheck(SystemCheck check, Severity failureSeverity) {
        Objects.requireNonNull(check, "检查不能为空");
        String id = requireId(check.getId());
        if (systemChecks.containsKey(id)) {
            throw new IllegalArgumentException(String.format("System check '%s' already registered", id));
        }
        systemChecks.put(id, check);
        failureSeverities.put(id, failureSeverity == null ? Severity.ERROR : failureSeverity);
        log.info("已注册 SystemIR 检查 '{}' (实现: {})", id, check.getClass().getName());
    }

    @Override
    public void registerSpecCheck(SpecCheck check, Severity failureSeverity) {
        Objects.requireNonNull(check, "检查不能为空");
        String id = requireId(check.getId());
        if (specChecks.containsKey(id)) {
            throw new IllegalArgumentException(String.format("Spec check '%s' already registered", id));
        }
        specChecks.put(id, check);
        failureSeverities.put(id, failureSeverity == null ? Severity.ERROR : failureSeverity);
        log.info("已注册规范检查 '{}' (实现: {})", id, check.getClass().getName());
    }

    @Override
    public List<SystemCheck> getSystemChecks() {
        return Collections.unmodifiableList(new ArrayList<>(systemChecks.values()));
    }

    @Override
    public List<SpecCheck> getSpecChecks() {
        return Collections.unmodifiableList(new ArrayList<>(specChecks.values()));
    }

    @Override
    public Severity getFailureSeverity(String checkId) {
        return failureSeverities.getOrDefault(checkId, Severity.ERROR);
    }

    private static String requireId(String id) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Check id must not be blank");
        }
        return id;
    }
}

package xyz.vvrf.gds.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.lang.NonNull;
import xyz.vvrf.gds.annotation.GdsCheck;
import xyz.vvrf.gds.verification.Finding;
import xyz.vvrf.gds.verification.Severity;
import xyz.vvrf.gds.verification.SpecCheck;
import xyz.vvrf.gds.verification.SystemCheck;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 一个 {@link CheckRegistry} 实现，它会自动发现并注册使用 {@link GdsCheck} 注解的 Spring Bean。
 * <p>
 * Bean 可以实现 {@link SystemCheck}、{@link SpecCheck} 或两者皆有。
 * 注解中声明的 ID 与检查自身的 ID 不一致时，以注解为准。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SpringScanningCheckRegistry implements CheckRegistry, ApplicationContextAware, InitializingBean {

    private ApplicationContext applicationContext;
    // 内部使用 SimpleCheckRegistry 存储注册信息
    private final SimpleCheckRegistry delegateRegistry = new SimpleCheckRegistry();

    @Override
    public void setApplicationContext(@NonNull ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterPropertiesSet() {
        if (applicationContext == null) {
            throw new BeanCreationException("SpringScanningCheckRegistry 中 ApplicationContext 未设置");
        }
        log.info("开始扫描 @GdsCheck Bean...");
        scanAndRegisterChecks();
    }

    private void scanAndRegisterChecks() {
        Map<String, Object> beansWithAnnotation = applicationContext.getBeansWithAnnotation(GdsCheck.class);
        int registeredCount = 0;

        for (Map.Entry<String, Object> entry : beansWithAnnotation.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();
            GdsCheck annotation = applicationContext.findAnnotationOnBean(beanName, GdsCheck.class);
            if (annotation == null) {
                log.warn("在 Bean '{}' 上找不到 @GdsCheck 注解，尽管 getBeansWithAnnotation 返回了它。", beanName);
                continue;
            }
            if (!(bean instanceof SystemCheck) && !(bean instanceof SpecCheck)) {
                log.error("Bean '{}' 使用了 @GdsCheck 注解，但既未实现 SystemCheck 也未实现 SpecCheck。跳过注册。",
                        beanName);
                continue;
            }
            try {
                if (bean instanceof SystemCheck) {
                    SystemCheck check = (SystemCheck) bean;
                    String id = determineCheckId(annotation, check.getId(), beanName);
                    delegateRegistry.registerSystemCheck(
                            id.equals(check.getId()) ? check : SystemCheck.of(id, system -> relabel(id, check.check(system))),
                            annotation.severity());
                    registeredCount++;
                }
                if (bean instanceof SpecCheck) {
                    SpecCheck check = (SpecCheck) bean;
                    String id = determineCheckId(annotation, check.getId(), beanName);
                    delegateRegistry.registerSpecCheck(
                            id.equals(check.getId()) ? check : SpecCheck.of(id, spec -> relabel(id, check.check(spec))),
                            annotation.severity());
                    registeredCount++;
                }
            } catch (IllegalArgumentException e) {
                // 记录注册错误 (例如重复 ID)，但继续扫描
                log.error("注册检查 Bean '{}' 失败: {}", beanName, e.getMessage());
            }
        }
        log.info("@GdsCheck 扫描完成。共注册了 {} 个检查。", registeredCount);
    }

    private String determineCheckId(GdsCheck annotation, String checkId, String beanName) {
        String id = annotation.id();
        if (id.isEmpty()) {
            id = annotation.value();
        }
        if (!id.isEmpty()) {
            return id;
        }
        if (checkId != null && !checkId.isEmpty()) {
            return checkId;
        }
        log.warn("Bean '{}' 的 @GdsCheck 注解与检查本身都未提供 ID。将使用 Bean 名称作为检查 ID。", beanName);
        return beanName;
    }

    // 检查返回的结果统一使用注册时的 ID
    private static List<Finding> relabel(String id, List<Finding> findings) {
        List<Finding> result = new ArrayList<>(findings.size());
        for (Finding f : findings) {
            result.add(id.equals(f.getCheckId()) ? f
                    : Finding.of(id, f.getSeverity(), f.getMessage(), f.getSourceElements(), f.isPassed()));
        }
        return result;
    }

    @Override
    public void registerSystemCheck(SystemCheck check, Severity failureSeverity) {
        log.warn("尝试在 SpringScanningCheckRegistry 上手动注册检查 '{}'。推荐使用 @GdsCheck 自动扫描。", check.getId());
        delegateRegistry.registerSystemCheck(check, failureSeverity);
    }

    @Override
    public void registerSpecCheck(SpecCheck check, Severity failureSeverity) {
        log.warn("尝试在 SpringScanningCheckRegistry 上手动注册检查 '{}'。推荐使用 @GdsCheck 自动扫描。", check.getId());
        delegateRegistry.registerSpecCheck(check, failureSeverity);
    }

    @Override
    public List<SystemCheck> getSystemChecks() {
        return delegateRegistry.getSystemChecks();
    }

    @Override
    public List<SpecCheck> getSpecChecks() {
        return delegateRegistry.getSpecChecks();
    }

    @Override
    public Severity getFailureSeverity(String checkId) {
        return delegateRegistry.getFailureSeverity(checkId);
    }
}

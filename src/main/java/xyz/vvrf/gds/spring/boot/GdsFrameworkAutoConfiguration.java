package xyz.vvrf.gds.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import xyz.vvrf.gds.compiler.SystemCompiler;
import xyz.vvrf.gds.ir.IRSerializer;
import xyz.vvrf.gds.monitor.LoggingVerificationListener;
import xyz.vvrf.gds.monitor.MicrometerVerificationListener;
import xyz.vvrf.gds.monitor.VerificationListener;
import xyz.vvrf.gds.registry.CheckRegistry;
import xyz.vvrf.gds.registry.SpringScanningCheckRegistry;
import xyz.vvrf.gds.verification.VerificationEngine;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * GDS 工具链的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link GdsFrameworkProperties}。
 * 2. 提供 {@link SystemCompiler}、{@link IRSerializer} 与扫描 {@link xyz.vvrf.gds.annotation.GdsCheck} 的 {@link CheckRegistry}。
 * 3. 按配置提供日志与 Micrometer 监听器，并收集所有 {@link VerificationListener} Bean。
 * 4. 组装 {@link VerificationEngine} 与 {@link GdsToolchain}。
 * <p>
 * 所有 Bean 都可以由用户自行定义覆盖。
 *
 * @author ruifeng.wen
 */
@Configuration
@AutoConfigureAfter(name = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@PropertySource("classpath:gds-framework-default.properties")
@EnableConfigurationProperties(GdsFrameworkProperties.class)
@Slf4j
public class GdsFrameworkAutoConfiguration {

    public GdsFrameworkAutoConfiguration() {
        log.info("GDS 工具链自动配置 (GdsFrameworkAutoConfiguration) 已加载。");
    }

    @Bean
    @ConditionalOnMissingBean(SystemCompiler.class)
    public SystemCompiler gdsSystemCompiler() {
        return new SystemCompiler();
    }

    @Bean
    @ConditionalOnMissingBean(IRSerializer.class)
    public IRSerializer gdsIrSerializer(GdsFrameworkProperties properties) {
        return new IRSerializer(properties.getIr().isPrettyPrint());
    }

    @Bean
    @ConditionalOnMissingBean(CheckRegistry.class)
    public CheckRegistry gdsCheckRegistry() {
        log.info("正在创建 SpringScanningCheckRegistry Bean...");
        return new SpringScanningCheckRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(LoggingVerificationListener.class)
    @ConditionalOnProperty(prefix = "gds.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingVerificationListener gdsLoggingVerificationListener() {
        return new LoggingVerificationListener();
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean(MicrometerVerificationListener.class)
    @ConditionalOnProperty(prefix = "gds.monitor", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public MicrometerVerificationListener gdsMicrometerVerificationListener(MeterRegistry meterRegistry) {
        return new MicrometerVerificationListener(meterRegistry);
    }

    /**
     * 收集在应用上下文中定义的所有 VerificationListener Bean，作为名为 "gdsVerificationListeners" 的不可变列表提供。
     */
    @Bean(name = "gdsVerificationListeners")
    @ConditionalOnMissingBean(name = "gdsVerificationListeners")
    public List<VerificationListener> gdsVerificationListeners(ObjectProvider<VerificationListener> listenersProvider) {
        List<VerificationListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 VerificationListener Bean。");
        } else {
            log.info("收集到 {} 个 VerificationListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }

    @Bean
    @ConditionalOnMissingBean(VerificationEngine.class)
    public VerificationEngine gdsVerificationEngine(CheckRegistry checkRegistry,
                                                    List<VerificationListener> gdsVerificationListeners,
                                                    GdsFrameworkProperties properties) {
        GdsFrameworkProperties.Verification verification = properties.getVerification();
        return new VerificationEngine(checkRegistry, gdsVerificationListeners,
                verification.getDisabledChecks(), verification.isIncludeCustomChecks());
    }

    @Bean
    @ConditionalOnMissingBean(GdsToolchain.class)
    public GdsToolchain gdsToolchain(SystemCompiler compiler, VerificationEngine verificationEngine,
                                     IRSerializer serializer, GdsFrameworkProperties properties) {
        log.info("正在创建 GdsToolchain Bean，配置: {}", properties);
        return new GdsToolchain(compiler, verificationEngine, serializer, properties);
    }
}

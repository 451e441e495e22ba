package xyz.vvrf.gds.annotation;

import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;
import xyz.vvrf.gds.verification.Severity;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记一个类为可被发现的自定义验证检查。
 * 类必须实现 {@link xyz.vvrf.gds.verification.SystemCheck} 或
 * {@link xyz.vvrf.gds.verification.SpecCheck}，才会被
 * {@link xyz.vvrf.gds.registry.SpringScanningCheckRegistry} 自动注册。
 * <p>
 * 包含 {@link Component} 以便 Spring 在组件扫描期间自动检测这些类。
 *
 * @author ruifeng.wen
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
@Component
public @interface GdsCheck {

    /**
     * 检查 ID，{@link #id()} 的别名。
     */
    @AliasFor("id")
    String value() default "";

    /**
     * 检查 ID。为空时使用检查自身的 {@code getId()}。
     */
    @AliasFor("value")
    String id() default "";

    /**
     * 检查执行抛出异常时，生成的失败结果所用的严重级别。
     */
    Severity severity() default Severity.ERROR;
}

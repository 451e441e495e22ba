package xyz.vvrf.gds.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * GDS 工具链的配置属性类。
 * 绑定 'gds' 前缀下的属性。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "gds")
@Validated
public class GdsFrameworkProperties {

    @Valid
    private final Verification verification = new Verification();
    @Valid
    private final Ir ir = new Ir();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Verification {
        /**
         * 要跳过的检查 ID，例如 G-003。
         */
        private Set<String> disabledChecks = new LinkedHashSet<>();

        /**
         * 默认检查集是否包含通过 @GdsCheck 注册的自定义检查。
         */
        private boolean includeCustomChecks = true;

        /**
         * verifyOrThrow 是否把未通过的 WARNING 也视为失败。
         */
        private boolean failOnWarning = false;
    }

    @Getter
    @Setter
    public static class Ir {
        /**
         * 写出的 IR 文档的 schema 版本。
         */
        @NotBlank
        private String schemaVersion = "1.0";

        /**
         * 写入 IR 元数据的工具版本。
         */
        @NotBlank
        private String toolVersion = "0.2.1";

        /**
         * IR JSON 是否缩进输出。
         */
        private boolean prettyPrint = true;
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册 LoggingVerificationListener。
         */
        private boolean loggingEnabled = true;

        /**
         * 是否注册 MicrometerVerificationListener (需要 MeterRegistry Bean)。
         */
        private boolean metricsEnabled = true;
    }

    @Override
    public String toString() {
        return "GdsFrameworkProperties{" +
                "verification={disabledChecks=" + verification.disabledChecks +
                ", includeCustomChecks=" + verification.includeCustomChecks +
                ", failOnWarning=" + verification.failOnWarning +
                "}, ir={schemaVersion='" + ir.schemaVersion + '\'' +
                ", toolVersion='" + ir.toolVersion + '\'' +
                ", prettyPrint=" + ir.prettyPrint +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                ", metricsEnabled=" + monitor.metricsEnabled +
                "}}";
    }
}

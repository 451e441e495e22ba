package xyz.vvrf.gds.spring.boot;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.gds.block.Block;
import xyz.vvrf.gds.compiler.SystemCompiler;
import xyz.vvrf.gds.exception.ValidationException;
import xyz.vvrf.gds.ir.IRDocument;
import xyz.vvrf.gds.ir.IRMetadata;
import xyz.vvrf.gds.ir.IRSerializer;
import xyz.vvrf.gds.ir.SystemIR;
import xyz.vvrf.gds.serialize.ReportSerializer;
import xyz.vvrf.gds.spec.GdsSpec;
import xyz.vvrf.gds.verification.Finding;
import xyz.vvrf.gds.verification.Severity;
import xyz.vvrf.gds.verification.VerificationEngine;
import xyz.vvrf.gds.verification.VerificationReport;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 编译、验证与 IR 读写的统一入口。
 * <p>
 * 在 Spring 环境中由 {@link GdsFrameworkAutoConfiguration} 创建；
 * 也可以直接用构造函数组装。
 * </p>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class GdsToolchain {

    private final SystemCompiler compiler;
    private final VerificationEngine verificationEngine;
    private final IRSerializer serializer;
    private final GdsFrameworkProperties properties;
    private final ReportSerializer reportSerializer = new ReportSerializer();

    public GdsToolchain(SystemCompiler compiler, VerificationEngine verificationEngine,
                        IRSerializer serializer, GdsFrameworkProperties properties) {
        this.compiler = Objects.requireNonNull(compiler, "SystemCompiler 不能为空");
        this.verificationEngine = Objects.requireNonNull(verificationEngine, "VerificationEngine 不能为空");
        this.serializer = Objects.requireNonNull(serializer, "IRSerializer 不能为空");
        this.properties = Objects.requireNonNull(properties, "GdsFrameworkProperties 不能为空");
    }

    public SystemIR compile(String name, Block root) {
        return compiler.compile(name, root);
    }

    public VerificationReport verify(SystemIR system) {
        return verificationEngine.verify(system);
    }

    public VerificationReport verifySpec(GdsSpec spec) {
        return verificationEngine.verifySpec(spec);
    }

    /**
     * 验证系统，存在未通过的 ERROR (开启 failOnWarning 时还包括 WARNING) 则抛出异常。
     *
     * @throws ValidationException 列出所有导致失败的结果
     */
    public VerificationReport verifyOrThrow(SystemIR system) {
        VerificationReport report = verify(system);
        boolean failOnWarning = properties.getVerification().isFailOnWarning();
        List<String> violations = new ArrayList<>();
        for (Finding finding : report.getFailures()) {
            if (finding.getSeverity() == Severity.ERROR
                    || (failOnWarning && finding.getSeverity() == Severity.WARNING)) {
                violations.add(String.format("[%s] %s", finding.getCheckId(), finding.getMessage()));
            }
        }
        if (!violations.isEmpty()) {
            log.warn("系统 '{}' 验证未通过，共 {} 条", system.getName(), violations.size());
            throw new ValidationException(violations);
        }
        return report;
    }

    /**
     * 用配置中的 schema 版本和工具版本包装一个或多个系统。
     */
    public IRDocument document(SystemIR... systems) {
        List<String> sources = new ArrayList<>();
        for (SystemIR system : systems) {
            if (system.getSource() != null && !system.getSource().isEmpty()) {
                sources.add(system.getSource());
            }
        }
        return IRDocument.builder()
                .version(properties.getIr().getSchemaVersion())
                .systems(Arrays.asList(systems))
                .metadata(IRMetadata.builder()
                        .sources(sources)
                        .generatedAt(Instant.now())
                        .toolVersion(properties.getIr().getToolVersion())
                        .build())
                .build();
    }

    public void writeDocument(IRDocument document, Path path) {
        serializer.write(document, path);
        log.info("IR 文档已写入 {} (系统数: {})", path, document.getSystems().size());
    }

    public IRDocument readDocument(Path path) {
        IRDocument document = serializer.read(path);
        log.info("已从 {} 读取 IR 文档 (版本: {}, 系统数: {})", path, document.getVersion(), document.getSystems().size());
        return document;
    }

    /**
     * 把验证报告写成 JSON 结果报告。
     */
    public void writeReport(VerificationReport report, Path path) {
        reportSerializer.write(report, path);
    }

    public SystemCompiler getCompiler() {
        return compiler;
    }

    public VerificationEngine getVerificationEngine() {
        return verificationEngine;
    }

    public IRSerializer getSerializer() {
        return serializer;
    }
}

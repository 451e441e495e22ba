package xyz.vvrf.gds.serialize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.gds.ir.IRSerializer;
import xyz.vvrf.gds.verification.VerificationReport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 把 {@link VerificationReport} 写成 JSON 结果报告。与 IR 共用同一套 ObjectMapper 配置。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ReportSerializer {

    private final ObjectMapper objectMapper;

    public ReportSerializer() {
        this.objectMapper = IRSerializer.createObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(VerificationReport report) {
        Objects.requireNonNull(report, "VerificationReport 不能为空");
        try {
            return objectMapper.writeValueAsString(FindingsReport.from(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize findings report for '" + report.getSystemName() + "'", e);
        }
    }

    public FindingsReport fromJson(String json) {
        Objects.requireNonNull(json, "JSON 不能为空");
        try {
            return objectMapper.readValue(json, FindingsReport.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse findings report", e);
        }
    }

    public void write(VerificationReport report, Path path) {
        String json = toJson(report);
        try {
            Files.write(path, json.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write findings report to " + path, e);
        }
        log.info("结果报告已写入 {} ({} 条, 错误 {} 条)", path, report.getChecksTotal(), report.getErrors());
    }
}

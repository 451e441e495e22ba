package xyz.vvrf.gds.serialize;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import xyz.vvrf.gds.verification.Finding;
import xyz.vvrf.gds.verification.VerificationReport;

import java.util.Collections;
import java.util.List;

/**
 * 验证报告的交换格式：目标名、汇总计数与完整的结果列表。
 */
@Value
@Builder
@Jacksonized
public class FindingsReport {

    String system;
    int total;
    int passed;
    int errors;
    int warnings;
    int info;
    boolean successful;
    @Builder.Default
    List<Finding> findings = Collections.emptyList();

    public static FindingsReport from(VerificationReport report) {
        return FindingsReport.builder()
                .system(report.getSystemName())
                .total(report.getChecksTotal())
                .passed(report.getChecksPassed())
                .errors(report.getErrors())
                .warnings(report.getWarnings())
                .info(report.getInfoCount())
                .successful(report.isSuccessful())
                .findings(report.getFindings())
                .build();
    }
}

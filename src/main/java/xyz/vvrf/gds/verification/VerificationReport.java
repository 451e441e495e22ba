package xyz.vvrf.gds.verification;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 某个系统或规范的聚合验证结果。
 * <p>
 * errors / warnings / infoCount 只统计未通过的 Finding；
 * checksPassed 是通过的条数，checksTotal 是全部条数。
 * </p>
 *
 * @author ruifeng.wen
 */
@Value
public class VerificationReport {

    String systemName;
    List<Finding> findings;

    public VerificationReport(String systemName, List<Finding> findings) {
        this.systemName = systemName;
        this.findings = Collections.unmodifiableList(new ArrayList<>(findings));
    }

    public int getErrors() {
        return countFailures(Severity.ERROR);
    }

    public int getWarnings() {
        return countFailures(Severity.WARNING);
    }

    public int getInfoCount() {
        return countFailures(Severity.INFO);
    }

    public int getChecksPassed() {
        int n = 0;
        for (Finding f : findings) {
            if (f.isPassed()) {
                n++;
            }
        }
        return n;
    }

    public int getChecksTotal() {
        return findings.size();
    }

    /**
     * 没有未通过的 ERROR。
     */
    public boolean isSuccessful() {
        return getErrors() == 0;
    }

    public List<Finding> getFailures() {
        List<Finding> result = new ArrayList<>();
        for (Finding f : findings) {
            if (!f.isPassed()) {
                result.add(f);
            }
        }
        return result;
    }

    public List<Finding> findingsFor(String checkId) {
        List<Finding> result = new ArrayList<>();
        for (Finding f : findings) {
            if (f.getCheckId().equals(checkId)) {
                result.add(f);
            }
        }
        return result;
    }

    private int countFailures(Severity severity) {
        int n = 0;
        for (Finding f : findings) {
            if (!f.isPassed() && f.getSeverity() == severity) {
                n++;
            }
        }
        return n;
    }

    @Override
    public String toString() {
        return String.format("VerificationReport[%s: %d/%d passed, errors=%d, warnings=%d, info=%d]",
                systemName, getChecksPassed(), getChecksTotal(), getErrors(), getWarnings(), getInfoCount());
    }
}

package xyz.vvrf.gds.verification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.gds.builder.SpecBuilder;
import xyz.vvrf.gds.ir.BlockIR;
import xyz.vvrf.gds.ir.SystemIR;
import xyz.vvrf.gds.ir.WiringIR;
import xyz.vvrf.gds.monitor.VerificationListener;
import xyz.vvrf.gds.registry.SimpleCheckRegistry;
import xyz.vvrf.gds.spec.GdsSpec;
import xyz.vvrf.gds.test.util.TestSpecs;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static xyz.vvrf.gds.test.util.TestSystems.abc;
import static xyz.vvrf.gds.test.util.TestSystems.block;
import static xyz.vvrf.gds.test.util.TestSystems.covariant;
import static xyz.vvrf.gds.test.util.TestSystems.system;

class VerificationEngineTest {

    private SimpleCheckRegistry registry;
    private RecordingListener recorder;

    @BeforeEach
    void setUp() {
        registry = new SimpleCheckRegistry();
        recorder = new RecordingListener();
    }

    private VerificationEngine engine(String... disabled) {
        return new VerificationEngine(registry, Collections.<VerificationListener>singletonList(recorder),
                Arrays.asList(disabled), true);
    }

    private static SystemIR cyclic() {
        return system("loop", abc(),
                covariant("A", "B", "X"), covariant("B", "C", "X"), covariant("C", "A", "X"));
    }

    @Test
    void reportAggregatesEveryGenericCheck() {
        VerificationReport report = engine().verify(cyclic());

        assertThat(report.getSystemName()).isEqualTo("loop");
        assertThat(report.findingsFor("G-006")).hasSize(1);
        assertThat(report.findingsFor("G-003")).hasSize(3);
        assertThat(report.getErrors()).isEqualTo(1);
        assertThat(report.isSuccessful()).isFalse();
        assertThat(report.getChecksTotal()).isEqualTo(report.getChecksPassed() + report.getFailures().size());
    }

    @Test
    void longCovariantChainIsVerifiedWithoutError() {
        List<BlockIR> blocks = new ArrayList<>();
        List<WiringIR> wirings = new ArrayList<>();
        for (int i = 0; i < 10000; i++) {
            blocks.add(block("B" + i, "X", "X"));
            if (i > 0) {
                wirings.add(covariant("B" + (i - 1), "B" + i, "X"));
            }
        }

        VerificationReport report = engine().verify(
                system("chain", blocks, wirings.toArray(new WiringIR[0])));

        List<Finding> acyclic = report.findingsFor("G-006");
        assertThat(acyclic).hasSize(1);
        assertThat(acyclic.get(0).isPassed()).isTrue();
        assertThat(recorder.events).doesNotContain("error:G-006");
    }

    @Test
    void throwingCheckBecomesAFailedFinding() {
        registry.registerSystemCheck(SystemCheck.of("X-BOOM", system -> {
            throw new IllegalStateException("kaput");
        }), Severity.WARNING);

        VerificationReport report = engine().verify(cyclic());

        List<Finding> boom = report.findingsFor("X-BOOM");
        assertThat(boom).hasSize(1);
        assertThat(boom.get(0).isPassed()).isFalse();
        assertThat(boom.get(0).getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(boom.get(0).getMessage()).isEqualTo("Check 'X-BOOM' raised IllegalStateException: kaput");
        // 其它检查照常执行
        assertThat(report.findingsFor("G-006")).hasSize(1);
        assertThat(recorder.events).contains("error:X-BOOM", "complete:X-BOOM");
    }

    @Test
    void customChecksCanBeExcluded() {
        registry.registerSystemCheck(SystemCheck.of("X-ONE", system ->
                Collections.singletonList(Finding.pass("X-ONE", Severity.INFO, "ok"))));

        VerificationEngine withoutCustom = new VerificationEngine(registry, null, null, false);

        assertThat(withoutCustom.verify(cyclic()).findingsFor("X-ONE")).isEmpty();
        assertThat(engine().verify(cyclic()).findingsFor("X-ONE")).hasSize(1);
    }

    @Test
    void disabledChecksAreSkipped() {
        VerificationReport report = engine("G-006", "G-003").verify(cyclic());

        assertThat(report.findingsFor("G-006")).isEmpty();
        assertThat(report.findingsFor("G-003")).isEmpty();
        assertThat(report.isSuccessful()).isTrue();
        assertThat(recorder.events.get(0)).isEqualTo("start:loop:4");
    }

    @Test
    void disablingSevenKeepsSix() {
        GdsSpec empty = new SpecBuilder("empty").build();

        VerificationReport report = engine("SC-007").verifySpec(empty);

        assertThat(report.findingsFor("SC-006")).hasSize(1);
        assertThat(report.findingsFor("SC-007")).isEmpty();
    }

    @Test
    void explicitCheckListRunsInOrder() {
        VerificationReport report = engine().verify(cyclic(),
                Arrays.asList(GenericChecks.COVARIANT_ACYCLICITY, GenericChecks.DANGLING_WIRINGS));

        assertThat(report.getFindings()).extracting(Finding::getCheckId)
                .containsExactly("G-006", "G-004", "G-004", "G-004");
    }

    @Test
    void specVerificationRunsDefaultsAndExplicitReachability() {
        GdsSpec spec = TestSpecs.thermostat();

        VerificationReport defaults = engine().verifySpec(spec);
        VerificationReport reach = engine().verifySpec(spec,
                Collections.singletonList(SpecChecks.reachability("Heater", "Sensor")));

        assertThat(defaults.isSuccessful()).isTrue();
        assertThat(defaults.getFailures()).isEmpty();
        assertThat(defaults.findingsFor("SC-003")).isEmpty();
        assertThat(reach.getWarnings()).isEqualTo(1);
        assertThat(reach.isSuccessful()).isTrue();
    }

    @Test
    void listenerFailureDoesNotBreakVerification() {
        VerificationListener broken = new RecordingListener() {
            @Override
            public void onVerificationStart(String target, int checkCount) {
                throw new IllegalStateException("listener down");
            }
        };
        VerificationEngine engine = new VerificationEngine(registry, Arrays.asList(broken, recorder), null, true);

        VerificationReport report = engine.verify(cyclic());

        assertThat(report.getChecksTotal()).isPositive();
        assertThat(recorder.events.get(0)).isEqualTo("start:loop:6");
        assertThat(recorder.events.get(recorder.events.size() - 1)).startsWith("done:loop");
    }

    @Test
    void listenerSeesEachCheck() {
        engine().verify(cyclic());

        assertThat(recorder.events).containsExactly(
                "start:loop:6",
                "complete:G-001", "complete:G-002", "complete:G-003",
                "complete:G-004", "complete:G-005", "complete:G-006",
                "done:loop:1");
    }

    private static class RecordingListener implements VerificationListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void onVerificationStart(String target, int checkCount) {
            events.add("start:" + target + ":" + checkCount);
        }

        @Override
        public void onCheckComplete(String target, String checkId, Duration elapsed, List<Finding> findings) {
            events.add("complete:" + checkId);
        }

        @Override
        public void onCheckError(String target, String checkId, Duration elapsed, Throwable error) {
            events.add("error:" + checkId);
        }

        @Override
        public void onVerificationComplete(VerificationReport report, Duration elapsed) {
            events.add("done:" + report.getSystemName() + ":" + report.getErrors());
        }
    }
}

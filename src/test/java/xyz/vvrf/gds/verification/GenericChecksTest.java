package xyz.vvrf.gds.verification;

import org.junit.jupiter.api.Test;
import xyz.vvrf.gds.compiler.SystemCompiler;
import xyz.vvrf.gds.ir.BlockIR;
import xyz.vvrf.gds.ir.Signature;
import xyz.vvrf.gds.ir.SystemIR;
import xyz.vvrf.gds.test.util.TestSpecs;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static xyz.vvrf.gds.test.util.TestSystems.abc;
import static xyz.vvrf.gds.test.util.TestSystems.block;
import static xyz.vvrf.gds.test.util.TestSystems.contravariant;
import static xyz.vvrf.gds.test.util.TestSystems.covariant;
import static xyz.vvrf.gds.test.util.TestSystems.system;
import static xyz.vvrf.gds.test.util.TestSystems.temporal;

class GenericChecksTest {

    private static SystemIR thermostatSystem() {
        return new SystemCompiler().compile("thermostat",
                TestSpecs.sensor().then(TestSpecs.controller()).then(TestSpecs.heater()));
    }

    // 边界块没有输入、Mechanism 没有输出，G-002 在这里必然失败
    @Test
    void compiledThermostatPassesEveryGenericCheck() {
        SystemIR system = thermostatSystem();

        for (SystemCheck check : GenericChecks.all()) {
            List<Finding> findings = check.check(system);
            assertThat(findings)
                    .as("check %s", check.getId())
                    .filteredOn(f -> !f.isPassed() && f.getSeverity() == Severity.ERROR)
                    .filteredOn(f -> !f.getCheckId().equals(GenericChecks.G002))
                    .isEmpty();
        }
    }

    @Test
    void allChecksAreListedInOrder() {
        assertThat(GenericChecks.all()).extracting(SystemCheck::getId)
                .containsExactly("G-001", "G-002", "G-003", "G-004", "G-005", "G-006");
    }

    // ── G-001 ─────────────────────────────────────────────

    @Test
    void domainCodomainMatchingAcceptsLabelOnEitherSide() {
        SystemIR system = system("s",
                Arrays.asList(block("A", "", "Temperature"), block("B", "Temperature + Pressure", "Y")),
                covariant("A", "B", "Pressure"));

        List<Finding> findings = GenericChecks.domainCodomainMatching(system);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).isPassed()).isTrue();
        assertThat(findings.get(0).getMessage())
                .isEqualTo("Wiring 'Pressure': A out='Temperature' -> B in='Temperature + Pressure'");
    }

    @Test
    void domainCodomainMatchingFlagsMismatch() {
        SystemIR system = system("s",
                Arrays.asList(block("A", "", "Temperature"), block("B", "Pressure", "Y")),
                covariant("A", "B", "Humidity"));

        Finding finding = GenericChecks.domainCodomainMatching(system).get(0);

        assertThat(finding.isPassed()).isFalse();
        assertThat(finding.getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(finding.getMessage()).endsWith(" - MISMATCH");
        assertThat(finding.getSourceElements()).containsExactly("A", "B");
    }

    @Test
    void domainCodomainMatchingFailsWhenASlotIsEmpty() {
        SystemIR system = system("s",
                Arrays.asList(block("A", "X", ""), block("B", "X", "Y")),
                covariant("A", "B", "X"));

        Finding finding = GenericChecks.domainCodomainMatching(system).get(0);

        assertThat(finding.isPassed()).isFalse();
        assertThat(finding.getMessage()).isEqualTo("Cannot verify domain/codomain: A out='', B in='X'");
    }

    @Test
    void domainCodomainMatchingSkipsTemporalAndContravariantWirings() {
        SystemIR system = system("s", abc(),
                temporal("C", "A", "Nope"),
                contravariant("B", "A", "Nope"));

        assertThat(GenericChecks.domainCodomainMatching(system)).isEmpty();
        assertThat(GenericChecks.sequentialTypeCompatibility(system)).isEmpty();
    }

    // ── G-002 ─────────────────────────────────────────────

    @Test
    void signatureCompletenessReportsMissingSides() {
        BlockIR sink = BlockIR.builder().name("Sink").signature(Signature.of("X", "", "", "")).build();
        BlockIR island = BlockIR.builder().name("Island").build();
        BlockIR feedbackOnly = BlockIR.builder().name("Critic").signature(Signature.of("", "", "Cost", "Grad")).build();
        SystemIR system = system("s", Arrays.asList(sink, island, feedbackOnly));

        List<Finding> findings = GenericChecks.signatureCompleteness(system);

        assertThat(findings).extracting(Finding::isPassed).containsExactly(false, false, true);
        assertThat(findings.get(0).getMessage()).isEqualTo("Sink: signature ('X', '', '', '') - no outputs");
        assertThat(findings.get(1).getMessage()).endsWith(" - no inputs, no outputs");
        assertThat(findings.get(2).getMessage()).isEqualTo("Critic: signature ('', '', 'Cost', 'Grad')");
    }

    // ── G-003 ─────────────────────────────────────────────

    @Test
    void directionConsistencyIsInformational() {
        SystemIR system = system("s", abc(), covariant("A", "B", "X"), contravariant("B", "A", "X"));

        List<Finding> findings = GenericChecks.directionConsistency(system);

        assertThat(findings).allMatch(Finding::isPassed).allMatch(f -> f.getSeverity() == Severity.INFO);
        assertThat(findings).extracting(Finding::getMessage).containsExactly(
                "Wiring 'X' (A -> B): direction=covariant",
                "Wiring 'X' (B -> A): direction=contravariant");
    }

    // ── G-004 ─────────────────────────────────────────────

    @Test
    void danglingWiringNamesTheUnknownEndpoint() {
        SystemIR system = system("s", abc(), covariant("A", "Ghost", "X"), covariant("A", "B", "X"));

        List<Finding> findings = GenericChecks.danglingWirings(system);

        assertThat(findings).extracting(Finding::isPassed).containsExactly(false, true);
        assertThat(findings.get(0).getMessage()).isEqualTo("Wiring 'X' (A -> Ghost) - target 'Ghost' unknown");
    }

    @Test
    void externalInputsCountAsKnownEndpoints() {
        SystemIR system = SystemIR.builder()
                .name("s")
                .blocks(abc())
                .inputs(Collections.singletonList(Collections.<String, Object>singletonMap("name", "Outside")))
                .wirings(Collections.singletonList(covariant("Outside", "A", "X")))
                .build();

        assertThat(GenericChecks.danglingWirings(system)).allMatch(Finding::isPassed);
        assertThat(system.blockNames()).doesNotContain("Outside");
    }

    // ── G-005 ─────────────────────────────────────────────

    @Test
    void sequentialCompatibilityRequiresBothSides() {
        SystemIR system = system("s",
                Arrays.asList(block("A", "", "Temperature"), block("B", "Temperature + Pressure", "Y")),
                covariant("A", "B", "Pressure"),
                covariant("A", "B", "temperature"));

        List<Finding> findings = GenericChecks.sequentialTypeCompatibility(system);

        assertThat(findings).extracting(Finding::isPassed).containsExactly(false, true);
        assertThat(findings.get(0).getMessage()).isEqualTo(
                "Stack A ; B: out='Temperature', in='Temperature + Pressure', wiring='Pressure' - type mismatch");
    }

    // ── G-006 ─────────────────────────────────────────────

    @Test
    void chainIsAcyclic() {
        SystemIR system = system("s", abc(), covariant("A", "B", "X"), covariant("B", "C", "X"));

        List<Finding> findings = GenericChecks.covariantAcyclicity(system);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).isPassed()).isTrue();
        assertThat(findings.get(0).getMessage()).isEqualTo("Covariant flow graph is acyclic (DAG)");
    }

    @Test
    void covariantCycleIsReportedOnce() {
        SystemIR system = system("s", abc(),
                covariant("A", "B", "X"), covariant("B", "C", "X"), covariant("C", "A", "X"));

        List<Finding> findings = GenericChecks.covariantAcyclicity(system);

        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.isPassed()).isFalse();
        assertThat(finding.getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(finding.getSourceElements()).containsExactlyInAnyOrder("A", "B", "C");
        assertThat(finding.getMessage()).isEqualTo("Covariant flow graph contains a cycle: A -> B -> C -> A");
    }

    @Test
    void temporalBackEdgeDoesNotCloseACycle() {
        SystemIR system = system("s", abc(),
                covariant("A", "B", "X"), covariant("B", "C", "X"), temporal("C", "A", "X"));

        assertThat(GenericChecks.covariantAcyclicity(system)).allMatch(Finding::isPassed);
    }

    @Test
    void contravariantBackEdgeDoesNotCloseACycle() {
        SystemIR system = system("s", abc(),
                covariant("A", "B", "X"), covariant("B", "C", "X"), contravariant("C", "A", "X"));

        assertThat(GenericChecks.covariantAcyclicity(system)).allMatch(Finding::isPassed);
    }

    @Test
    void addingAnyBackEdgeToAChainCreatesACycle() {
        String[] names = {"A", "B", "C"};
        for (int i = 1; i < names.length; i++) {
            for (int j = 0; j < i; j++) {
                SystemIR system = system("s", abc(),
                        covariant("A", "B", "X"), covariant("B", "C", "X"), covariant(names[i], names[j], "X"));

                List<Finding> findings = GenericChecks.covariantAcyclicity(system);

                assertThat(findings).hasSize(1);
                assertThat(findings.get(0).isPassed()).as("%s -> %s", names[i], names[j]).isFalse();
                assertThat(findings.get(0).getSourceElements()).contains(names[i], names[j]);
            }
        }
    }

    @Test
    void emptySystemIsTriviallyAcyclic() {
        SystemIR system = system("empty", Collections.<BlockIR>emptyList());

        assertThat(GenericChecks.covariantAcyclicity(system)).extracting(Finding::isPassed).containsExactly(true);
        assertThat(GenericChecks.signatureCompleteness(system)).isEmpty();
    }
}

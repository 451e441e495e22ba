package xyz.vvrf.gds.verification;

import org.junit.jupiter.api.Test;
import xyz.vvrf.gds.builder.BlockBuilder;
import xyz.vvrf.gds.builder.SpecBuilder;
import xyz.vvrf.gds.core.Entity;
import xyz.vvrf.gds.core.StateVariable;
import xyz.vvrf.gds.spec.GdsSpec;
import xyz.vvrf.gds.spec.SpecWiring;
import xyz.vvrf.gds.spec.Wire;
import xyz.vvrf.gds.test.util.TestSpecs;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SpecChecksTest {

    @Test
    void thermostatPassesDefaultChecks() {
        GdsSpec spec = TestSpecs.thermostat();

        for (SpecCheck check : SpecChecks.all()) {
            assertThat(check.check(spec)).as("check %s", check.getId()).allMatch(Finding::isPassed);
        }
    }

    @Test
    void defaultChecksLeaveReachabilityOut() {
        assertThat(SpecChecks.all()).extracting(SpecCheck::getId)
                .containsExactly("SC-001", "SC-002", "SC-004", "SC-005", "SC-006");
    }

    // ── SC-001 ────────────────────────────────────────────

    @Test
    void orphanVariablesAreCollectedIntoOneWarning() {
        GdsSpec spec = TestSpecs.thermostatBuilder()
                .registerEntity(Entity.of("Outside",
                        StateVariable.of("temperature", TestSpecs.TEMPERATURE),
                        StateVariable.of("humidity", TestSpecs.TEMPERATURE)))
                .build();

        List<Finding> findings = SpecChecks.completeness(spec);

        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.isPassed()).isFalse();
        assertThat(finding.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(finding.getSourceElements()).containsExactly("Outside.temperature", "Outside.humidity");
        assertThat(finding.getMessage()).startsWith("Orphan state variables never updated by any mechanism: ");
    }

    // ── SC-002 ────────────────────────────────────────────

    private static GdsSpec doubleWriter(boolean sameGroup) {
        return TestSpecs.thermostatBuilder()
                .registerBlock(BlockBuilder.mechanism("Radiator")
                        .forwardIn("Heater Command")
                        .updates("Room", "temperature")
                        .build())
                .registerWiring(sameGroup
                        ? SpecWiring.of("backup", Arrays.asList("Controller", "Heater", "Radiator"),
                                Wire.of("Controller", "Heater"), Wire.of("Controller", "Radiator"))
                        : SpecWiring.of("backup", Arrays.asList("Controller", "Radiator"),
                                Wire.of("Controller", "Radiator")))
                .build();
    }

    @Test
    void twoWritersInOneGroupConflict() {
        List<Finding> findings = SpecChecks.determinism(doubleWriter(true));

        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.isPassed()).isFalse();
        assertThat(finding.getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(finding.getSourceElements()).containsExactly("Heater", "Radiator");
        assertThat(finding.getMessage())
                .isEqualTo("Write conflict in wiring 'backup': Room.temperature updated by [Heater, Radiator]");
    }

    @Test
    void writersInDifferentGroupsDoNotConflict() {
        List<Finding> findings = SpecChecks.determinism(doubleWriter(false));

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).isPassed()).isTrue();
        assertThat(findings.get(0).getMessage()).isEqualTo("No write conflicts detected");
    }

    @Test
    void repeatedBlockNameInOneGroupIsNotAConflict() {
        GdsSpec spec = TestSpecs.thermostatBuilder()
                .registerWiring(SpecWiring.of("twice", Arrays.asList("Heater", "Heater")))
                .build();

        assertThat(SpecChecks.determinism(spec)).allMatch(Finding::isPassed);
    }

    // ── SC-003 ────────────────────────────────────────────

    @Test
    void reachabilityFollowsWireDirection() {
        GdsSpec spec = TestSpecs.thermostat();

        Finding forward = SpecChecks.reachability(spec, "Sensor", "Heater").get(0);
        Finding backward = SpecChecks.reachability(spec, "Heater", "Sensor").get(0);

        assertThat(forward.isPassed()).isTrue();
        assertThat(forward.getMessage()).isEqualTo("Block 'Sensor' can reach 'Heater'");
        assertThat(backward.isPassed()).isFalse();
        assertThat(backward.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(backward.getMessage()).isEqualTo("Block 'Heater' cannot reach 'Sensor'");
    }

    @Test
    void reachabilityCheckCarriesItsId() {
        SpecCheck check = SpecChecks.reachability("Sensor", "Controller");

        assertThat(check.getId()).isEqualTo(SpecChecks.SC003);
        assertThat(check.check(TestSpecs.thermostat())).extracting(Finding::isPassed).containsExactly(true);
    }

    @Test
    void blockReachesItself() {
        assertThat(SpecChecks.reachability(TestSpecs.thermostat(), "Heater", "Heater"))
                .extracting(Finding::isPassed).containsExactly(true);
    }

    // ── SC-004 ────────────────────────────────────────────

    @Test
    void unregisteredWireSpaceIsAnError() {
        GdsSpec spec = TestSpecs.thermostatBuilder()
                .registerWiring(SpecWiring.of("extra", Arrays.asList("Sensor", "Controller"),
                        Wire.of("Sensor", "Controller", "PressureSpace"),
                        Wire.of("Sensor", "Controller")))
                .build();

        List<Finding> findings = SpecChecks.typeSafety(spec);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).isPassed()).isFalse();
        assertThat(findings.get(0).getMessage())
                .isEqualTo("Wire Sensor -> Controller references unregistered space 'PressureSpace'");
        assertThat(findings.get(0).getSourceElements()).containsExactly("Sensor", "Controller");
    }

    // ── SC-005 ────────────────────────────────────────────

    @Test
    void unresolvedParametersAreCollected() {
        GdsSpec spec = TestSpecs.minimalBuilder("E")
                .registerBlock(BlockBuilder.policy("Zeta").forwardIn("X").forwardOut("Y").params("rate").build())
                .registerBlock(BlockBuilder.policy("Alpha").forwardIn("X").forwardOut("Y").params("beta", "rate").build())
                .build();

        List<Finding> findings = SpecChecks.parameterReferences(spec);

        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.isPassed()).isFalse();
        assertThat(finding.getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(finding.getSourceElements()).containsExactly("Zeta -> rate", "Alpha -> beta", "Alpha -> rate");
        assertThat(finding.getMessage())
                .isEqualTo("Unresolved parameter references: [Zeta -> rate, Alpha -> beta, Alpha -> rate]");
    }

    // ── SC-006 / SC-007 ───────────────────────────────────

    @Test
    void emptyRegistryFailsBothCanonicalChecks() {
        GdsSpec spec = new SpecBuilder("empty").build();

        List<Finding> findings = SpecChecks.canonicalWellformedness(spec);

        assertThat(findings).extracting(Finding::getCheckId).containsExactly("SC-006", "SC-007");
        assertThat(findings).noneMatch(Finding::isPassed).allMatch(f -> f.getSeverity() == Severity.WARNING);
        assertThat(findings).extracting(Finding::getMessage).containsExactly(
                "No mechanisms found - state transition f is empty",
                "State space X is empty - no entity variables defined");
    }

    @Test
    void canonicalChecksAreIndependent() {
        GdsSpec thermostat = TestSpecs.thermostat();
        GdsSpec stateless = new SpecBuilder("stateless")
                .registerBlock(BlockBuilder.mechanism("Tick").forwardIn("Clock").build())
                .build();

        assertThat(SpecChecks.canonicalWellformedness(thermostat)).extracting(Finding::getMessage).containsExactly(
                "State transition f has 1 mechanism(s)", "State space X has 1 variable(s)");
        assertThat(SpecChecks.canonicalWellformedness(stateless)).extracting(Finding::isPassed)
                .containsExactly(true, false);
    }
}

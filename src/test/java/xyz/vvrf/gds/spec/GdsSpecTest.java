package xyz.vvrf.gds.spec;

import org.junit.jupiter.api.Test;
import xyz.vvrf.gds.builder.BlockBuilder;
import xyz.vvrf.gds.builder.SpecBuilder;
import xyz.vvrf.gds.canonical.CanonicalGds;
import xyz.vvrf.gds.canonical.CanonicalProjection;
import xyz.vvrf.gds.core.Entity;
import xyz.vvrf.gds.core.Space;
import xyz.vvrf.gds.core.StateVariable;
import xyz.vvrf.gds.core.TypeDefs;
import xyz.vvrf.gds.exception.ValidationException;
import xyz.vvrf.gds.test.util.TestSpecs;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class GdsSpecTest {

    @Test
    void minimalRegistryValidatesAndProjects() {
        GdsSpec spec = TestSpecs.minimalBuilder("E").build();

        assertThat(spec.validateSpec()).isEmpty();
        CanonicalGds canonical = CanonicalProjection.project(spec);
        assertThat(canonical.getBoundaryBlocks()).containsExactly("S");
        assertThat(canonical.getMechanismBlocks()).containsExactly("M");
        assertThat(canonical.getStateVariables()).hasSize(1);
    }

    @Test
    void mechanismUpdatingUnknownEntityIsReported() {
        GdsSpec spec = TestSpecs.minimalBuilder("Z").build();

        List<String> errors = spec.validateSpec();
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0)).contains("Z").contains("unknown entity");
    }

    @Test
    void mechanismUpdatingUnknownVariableIsReported() {
        GdsSpec spec = new SpecBuilder("bad-var")
                .registerEntity(Entity.of("E", StateVariable.of("v", TypeDefs.PROBABILITY)))
                .registerBlock(BlockBuilder.mechanism("M").forwardIn("X").updates("E", "w").build())
                .build();

        assertThat(spec.validateSpec()).containsExactly("Mechanism 'M' updates unknown variable 'E.w'");
    }

    @Test
    void allViolationsAreCollectedInOrder() {
        GdsSpec spec = new SpecBuilder("broken")
                .registerSpace(Space.of("Signal", Collections.singletonMap("p", TypeDefs.PROBABILITY)))
                .registerBlock(BlockBuilder.policy("P").forwardIn("X").forwardOut("Y").params("alpha").build())
                .registerBlock(BlockBuilder.mechanism("M").forwardIn("Y").updates("Ghost", "v").build())
                .registerWiring(SpecWiring.of("w", Arrays.asList("P", "Missing"),
                        Wire.of("P", "Nowhere", "Noise")))
                .build();

        assertThat(spec.validateSpec()).containsExactly(
                "Space 'Signal' field 'p' uses unregistered type 'Probability'",
                "Wiring 'w' references unregistered block 'Missing'",
                "Wiring 'w' wire target 'Nowhere' not in registered blocks",
                "Wiring 'w' wire references unregistered space 'Noise'",
                "Mechanism 'M' updates unknown entity 'Ghost'",
                "Block 'P' references unregistered parameter 'alpha'");
    }

    @Test
    void requireValidRaisesWithEveryViolation() {
        GdsSpec spec = TestSpecs.minimalBuilder("Z").build();

        ValidationException e = catchThrowableOfType(spec::requireValid, ValidationException.class);
        assertThat(e.getViolations()).hasSize(1);
        assertThat(e.getMessage()).contains("unknown entity 'Z'");
        assertThat(TestSpecs.thermostat().requireValid()).isNotNull();
    }

    @Test
    void roleViewsFollowRegistrationOrder() {
        GdsSpec spec = TestSpecs.thermostat();
        assertThat(spec.getMechanisms()).extracting("name").containsExactly("Heater");
        assertThat(spec.getAtomicBlocks()).extracting("name").containsExactly("Sensor", "Controller", "Heater");
        assertThat(spec.getParameters()).containsOnlyKeys("gain");
    }

    @Test
    void registryMapsAreReadOnly() {
        GdsSpec spec = TestSpecs.thermostat();
        assertThatThrownBy(() -> spec.getEntities().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}

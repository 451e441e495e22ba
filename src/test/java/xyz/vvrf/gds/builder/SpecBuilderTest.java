package xyz.vvrf.gds.builder;

import org.junit.jupiter.api.Test;
import xyz.vvrf.gds.block.Block;
import xyz.vvrf.gds.core.ParameterDef;
import xyz.vvrf.gds.core.TypeDefs;
import xyz.vvrf.gds.spec.GdsSpec;
import xyz.vvrf.gds.test.util.TestSpecs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpecBuilderTest {

    @Test
    void shouldRejectDuplicateRegistrationsImmediately() {
        SpecBuilder builder = TestSpecs.thermostatBuilder();

        assertThatThrownBy(() -> builder.registerType(TestSpecs.TEMPERATURE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Type 'Temperature' already registered");
        assertThatThrownBy(() -> builder.registerBlock(TestSpecs.heater()))
                .hasMessage("Block 'Heater' already registered");
        assertThatThrownBy(() -> builder.registerEntity(TestSpecs.room()))
                .hasMessage("Entity 'Room' already registered");
        assertThatThrownBy(() -> builder.registerParameter("gain", TestSpecs.GAIN))
                .hasMessage("Parameter 'gain' already registered");
    }

    @Test
    void collectDispatchesByType() {
        GdsSpec spec = new SpecBuilder("bulk")
                .collect(TestSpecs.TEMPERATURE, TestSpecs.temperatureSpace(), TestSpecs.room(),
                        TestSpecs.sensor(), ParameterDef.of("gain", TypeDefs.NON_NEGATIVE_FLOAT))
                .build();

        assertThat(spec.getTypes()).containsOnlyKeys("Temperature");
        assertThat(spec.getSpaces()).containsOnlyKeys("TemperatureSpace");
        assertThat(spec.getEntities()).containsOnlyKeys("Room");
        assertThat(spec.getBlocks()).containsOnlyKeys("Sensor");
        assertThat(spec.getParameterSchema().names()).containsExactly("gain");
    }

    @Test
    void collectRejectsUnsupportedObjects() {
        assertThatThrownBy(() -> new SpecBuilder("bulk").collect("not a model object"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("String");
    }

    @Test
    void builtSpecIsAFrozenSnapshot() {
        SpecBuilder builder = TestSpecs.thermostatBuilder();
        GdsSpec before = builder.build();
        builder.registerType(TypeDefs.AGENT_ID);

        assertThat(before.getTypes()).doesNotContainKey("AgentID");
        assertThat(builder.build().getTypes()).containsKey("AgentID");
        assertThatThrownBy(() -> before.getBlocks().put("x", TestSpecs.sensor()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void chainBuilderFoldsBlocksLeftToRight() {
        Block chain = ChainBuilder.stack(TestSpecs.sensor(), TestSpecs.controller(), TestSpecs.heater());
        assertThat(chain.getName()).isEqualTo("Sensor >> Controller >> Heater");
        assertThat(chain.flatten()).extracting(Block::getName).containsExactly("Sensor", "Controller", "Heater");

        Block par = ChainBuilder.parallel(TestSpecs.sensor(), TestSpecs.heater());
        assertThat(par.getName()).isEqualTo("Sensor | Heater");
    }

    @Test
    void chainBuilderRequiresAtLeastOneBlock() {
        assertThatThrownBy(ChainBuilder::stack).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void specTagsAreCarried() {
        GdsSpec spec = TestSpecs.thermostatBuilder().tag("domain", "hvac").build();
        assertThat(spec.getTag("domain")).contains("hvac");
        assertThat(spec.withTag("stage", "draft").getTags()).containsOnlyKeys("domain", "stage");
    }
}

package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.model.EnhancementAlgorithm;
import com.ttennebkram.enhancer.processing.UnsupportedAlgorithmException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnhancementProcessorRegistryTest {

    @Test
    void discoversEveryAlgorithm() {
        String[] ids = Arrays.stream(EnhancementAlgorithm.values())
            .map(EnhancementAlgorithm::getId)
            .toArray(String[]::new);

        assertThat(EnhancementProcessorRegistry.getRegisteredAlgorithms()).containsExactlyInAnyOrder(ids);
    }

    @Test
    void scannerFindsOnlyAnnotatedConcreteClasses() {
        assertThat(EnhancementProcessorScanner.findProcessorClasses())
            .containsExactlyInAnyOrder(ContrastGammaProcessor.class, ToneMapDragoProcessor.class);
    }

    @Test
    void createsProcessorsByAlgorithmId() throws Exception {
        assertThat(EnhancementProcessorRegistry.createProcessor("ContrastGamma")).isInstanceOf(ContrastGammaProcessor.class);
        assertThat(EnhancementProcessorRegistry.createProcessor("ToneMapDrago")).isInstanceOf(ToneMapDragoProcessor.class);
    }

    @Test
    void eachCallReturnsAFreshInstance() throws Exception {
        assertThat(EnhancementProcessorRegistry.createProcessor("ToneMapDrago"))
            .isNotSameAs(EnhancementProcessorRegistry.createProcessor("ToneMapDrago"));
    }

    @Test
    void appliesPropertiesOnCreation() throws Exception {
        JsonObject props = new JsonObject();
        props.addProperty("tileSize", 16);

        EnhancementProcessor processor = EnhancementProcessorRegistry.createProcessor("ContrastGamma", props);

        assertThat(((ContrastGammaProcessor) processor).getTileSize()).isEqualTo(16);
    }

    @Test
    void unknownAlgorithmIsRejected() {
        assertThat(EnhancementProcessorRegistry.hasProcessor("Sepia")).isFalse();
        assertThatThrownBy(() -> EnhancementProcessorRegistry.createProcessor("Sepia"))
            .isInstanceOf(UnsupportedAlgorithmException.class)
            .extracting(e -> ((UnsupportedAlgorithmException) e).getAlgorithmId())
            .isEqualTo("Sepia");
    }

    @Test
    void exposesDisplayNames() {
        assertThat(EnhancementProcessorRegistry.getDisplayName("ToneMapDrago")).isEqualTo("Drago Tone Map");
        assertThat(EnhancementProcessorRegistry.getDisplayName("Other")).isEqualTo("Other");
    }
}

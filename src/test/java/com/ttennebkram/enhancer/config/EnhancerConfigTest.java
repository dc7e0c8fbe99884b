package com.ttennebkram.enhancer.config;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.model.EnhancementAlgorithm;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnhancerConfigTest {

    @Test
    void defaultsUseToneMapping() {
        EnhancerConfig config = EnhancerConfig.defaults();

        assertThat(config.getAlgorithm()).isEqualTo("ToneMapDrago");
        assertThat(config.getMaxDimension()).isEqualTo(12000);
        assertThat(config.getProcessorProperties("ContrastGamma")).isNull();
    }

    @Test
    void missingKeysFallBackToDefaults() throws IOException {
        EnhancerConfig config = EnhancerConfig.read(new StringReader("{\"algorithm\": \"ContrastGamma\"}"));

        assertThat(config.getAlgorithm()).isEqualTo("ContrastGamma");
        assertThat(config.getMaxDimension()).isEqualTo(EnhancerConfig.DEFAULT_MAX_DIMENSION);
    }

    @Test
    void readsProcessorBlocks() throws IOException {
        String json = "{\"maxDimension\": 4096, \"processors\": {\"ContrastGamma\": {\"gamma\": 0.6}}}";

        EnhancerConfig config = EnhancerConfig.read(new StringReader(json));

        assertThat(config.getMaxDimension()).isEqualTo(4096);
        assertThat(config.getProcessorProperties("ContrastGamma").get("gamma").getAsDouble()).isEqualTo(0.6);
        assertThat(config.getProcessorProperties("ToneMapDrago")).isNull();
    }

    @Test
    void bundledResourceMatchesDefaults() throws IOException {
        EnhancerConfig config = EnhancerConfig.loadDefault();

        assertThat(config.getAlgorithm()).isEqualTo(EnhancerConfig.DEFAULT_ALGORITHM);
        assertThat(config.getMaxDimension()).isEqualTo(EnhancerConfig.DEFAULT_MAX_DIMENSION);
        assertThat(config.getProcessorProperties("ToneMapDrago").get("saturation").getAsDouble()).isEqualTo(0.7);
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("enhancer.json");
        Files.write(file, "{\"algorithm\": \"ContrastGamma\", \"maxDimension\": 800}".getBytes(StandardCharsets.UTF_8));

        EnhancerConfig config = EnhancerConfig.load(file);

        assertThat(config.getAlgorithm()).isEqualTo("ContrastGamma");
        assertThat(config.getMaxDimension()).isEqualTo(800);
    }

    @Test
    void survivesJsonRoundTrip() throws IOException {
        JsonObject props = new JsonObject();
        props.addProperty("bias", 0.5);
        EnhancerConfig config = EnhancerConfig.defaults()
            .withAlgorithm(EnhancementAlgorithm.CONTRAST_GAMMA)
            .withProcessorProperties("ToneMapDrago", props);

        EnhancerConfig copy = EnhancerConfig.read(new StringReader(config.toJson().toString()));

        assertThat(copy.toJson()).isEqualTo(config.toJson());
    }

    @Test
    void returnedPropertiesAreCopies() {
        JsonObject props = new JsonObject();
        props.addProperty("gamma", 0.9);
        EnhancerConfig config = EnhancerConfig.defaults().withProcessorProperties("ContrastGamma", props);

        props.addProperty("gamma", 5.0);
        config.getProcessorProperties("ContrastGamma").addProperty("gamma", 7.0);

        assertThat(config.getProcessorProperties("ContrastGamma").get("gamma").getAsDouble()).isEqualTo(0.9);
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> EnhancerConfig.read(new StringReader("{\"algorithm\": ")))
            .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> EnhancerConfig.read(new StringReader("[1, 2]")))
            .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> EnhancerConfig.read(new StringReader("{\"maxDimension\": \"big\"}")))
            .isInstanceOf(IOException.class);
    }

    @Test
    void rejectsNonPositiveMaxDimension() {
        assertThatThrownBy(() -> EnhancerConfig.read(new StringReader("{\"maxDimension\": 0}")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("maxDimension");
    }
}

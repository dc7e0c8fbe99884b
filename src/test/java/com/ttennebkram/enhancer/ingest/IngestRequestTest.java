package com.ttennebkram.enhancer.ingest;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestRequestTest {

    @Test
    void parsesAllFields() {
        IngestRequest request = IngestRequest.fromJson(
            "{\"image\": \"aGVsbG8=\", \"fileName\": \"lake.png\", \"fileType\": \"image/png\"}");

        assertThat(request.getFileName()).isEqualTo("lake.png");
        assertThat(request.getFileType()).isEqualTo("image/png");
        assertThat(new String(request.decodeImage(), StandardCharsets.UTF_8)).isEqualTo("hello");
    }

    @Test
    void fileTypeDefaultsToJpeg() {
        IngestRequest request = IngestRequest.fromJson("{\"image\": \"aGVsbG8=\", \"fileName\": \"x\"}");

        assertThat(request.getFileType()).isEqualTo("image/jpeg");
    }

    @Test
    void missingFieldsAreNull() {
        IngestRequest request = IngestRequest.fromJson("{\"image\": null, \"fileName\": {\"nested\": true}}");

        assertThat(request.getImage()).isNull();
        assertThat(request.getFileName()).isNull();
    }

    @Test
    void acceptsDataUrlAndLineBreaks() {
        IngestRequest request = new IngestRequest("data:image/png;base64,aGVs\nbG8=", "a.png", null);

        assertThat(new String(request.decodeImage(), StandardCharsets.UTF_8)).isEqualTo("hello");
    }

    @Test
    void rejectsInvalidBase64() {
        IngestRequest request = new IngestRequest("not*base64", "a.png", null);

        assertThatThrownBy(request::decodeImage).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonObjectBodies() {
        assertThatThrownBy(() -> IngestRequest.fromJson("[]")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IngestRequest.fromJson("{\"image\": ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IngestRequest.fromJson(null)).isInstanceOf(IllegalArgumentException.class);
    }
}

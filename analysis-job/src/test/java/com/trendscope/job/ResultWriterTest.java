package com.trendscope.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.trendscope.core.model.PredictedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResultWriter}.
 */
class ResultWriterTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should create the output directory and write ISO dates")
    void shouldWriteReport() throws IOException {
        ResultWriter writer = new ResultWriter(tempDir.resolve("nested/out"));
        PredictedEvent event = new PredictedEvent("Oslo", LocalDate.of(2024, 7, 3), 9.0, 0.75);

        Path file = writer.write("events.json", Map.of("Oslo", List.of(event)));

        assertThat(file).exists();
        String json = Files.readString(file);
        assertThat(json).contains("\"2024-07-03\"");
        JsonNode root = writer.mapper().readTree(file.toFile());
        assertThat(root.get("Oslo").get(0).get("predictedValue").asDouble()).isEqualTo(9.0);
        assertThat(root.get("Oslo").get(0).get("confidence").asDouble()).isEqualTo(0.75);
    }
}

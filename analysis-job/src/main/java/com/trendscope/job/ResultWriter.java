package com.trendscope.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes analysis reports as pretty-printed JSON files, dates in ISO form.
 *
 * @since 1.0.0
 */
public final class ResultWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResultWriter.class);

    private final Path outputDir;
    private final ObjectMapper mapper;

    public ResultWriter(Path outputDir) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Serialize {@code report} to {@code fileName} inside the output
     * directory, creating the directory if needed.
     *
     * @return path of the written file
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path write(String fileName, Object report) {
        Path target = outputDir.resolve(fileName);
        try {
            Files.createDirectories(outputDir);
            mapper.writeValue(target.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        LOG.info("Wrote {}", target);
        return target;
    }

    ObjectMapper mapper() {
        return mapper;
    }

    public Path getOutputDir() {
        return outputDir;
    }
}

package com.trendscope.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trendscope.core.model.MentionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads a mentions export: a JSON array of {@link MentionRecord} objects.
 *
 * <p>
 * Unknown properties are ignored so exports may carry extra columns.
 * </p>
 *
 * @since 1.0.0
 */
public final class MentionFileLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MentionFileLoader.class);

    private static final TypeReference<List<MentionRecord>> RECORDS = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public MentionFileLoader() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @throws UncheckedIOException if the file cannot be read or is not a
     *                              JSON array of mention records
     */
    public List<MentionRecord> load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new UncheckedIOException(new IOException("Mentions file not found: " + path));
        }
        try (InputStream in = Files.newInputStream(path)) {
            List<MentionRecord> records = load(in);
            LOG.info("Loaded {} mention record(s) from {}", records.size(), path);
            return records;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read mentions file: " + path, e);
        }
    }

    public List<MentionRecord> load(InputStream in) throws IOException {
        Objects.requireNonNull(in, "input stream must not be null");
        return mapper.readValue(in, RECORDS);
    }
}

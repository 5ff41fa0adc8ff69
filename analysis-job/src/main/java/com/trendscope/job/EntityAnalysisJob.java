package com.trendscope.job;

import com.trendscope.core.AnalysisEngine;
import com.trendscope.core.EntityNotFoundException;
import com.trendscope.core.config.AnalysisConfig;
import com.trendscope.core.config.ConfigLoader;
import com.trendscope.core.config.EventSettings;
import com.trendscope.core.config.ForecastSettings;
import com.trendscope.core.event.EntityEventDetector;
import com.trendscope.core.event.EntityEventReport;
import com.trendscope.core.forecast.EntityForecast;
import com.trendscope.core.model.MentionRecord;
import com.trendscope.core.series.InMemoryMentionRepository;
import com.trendscope.core.series.MentionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point of the batch entity analysis.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   mentions export (JSON array)
 *     → InMemoryMentionRepository
 *     → pick entities (configured list, or the most mentioned)
 *     → per-entity events, correlated / co-occurring / causal events,
 *       cross-entity article events, mention and event predictions
 *     → one JSON file per report in the output directory
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings come from environment variables via {@link JobConfig};
 * analysis settings from {@link ConfigLoader}, or the file named by
 * {@code ANALYSIS_CONFIG_PATH}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EntityAnalysisJob {

    private static final Logger LOG = LoggerFactory.getLogger(EntityAnalysisJob.class);

    static final String ENTITY_EVENTS_FILE = "entity_events.json";
    static final String CORRELATED_EVENTS_FILE = "correlated_events.json";
    static final String CO_OCCURRING_EVENTS_FILE = "co_occurring_events.json";
    static final String CAUSAL_EVENTS_FILE = "causal_events.json";
    static final String CROSS_ENTITY_EVENTS_FILE = "cross_entity_events.json";
    static final String PREDICTIONS_FILE = "predictions.json";

    private EntityAnalysisJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting entity analysis with config: {}", config);
        AnalysisConfig analysisConfig = loadAnalysisConfig(config);

        // 2. Load mentions
        List<MentionRecord> records = new MentionFileLoader().load(Paths.get(config.getInputPath()));
        if (records.isEmpty()) {
            throw new IllegalStateException("No mention records in " + config.getInputPath());
        }

        // 3. Analyse and write
        List<Path> written = run(config, analysisConfig, new InMemoryMentionRepository(records));
        LOG.info("Entity analysis finished: {} file(s) written to {}", written.size(), config.getOutputDir());
    }

    /**
     * Run every analysis over the selected entities and write the reports.
     *
     * @return the files written, in a fixed order
     */
    static List<Path> run(JobConfig config, AnalysisConfig analysisConfig, MentionRepository repository) {
        List<String> entities = selectEntities(config, repository);
        if (entities.isEmpty()) {
            throw new IllegalStateException("No entities to analyse");
        }
        LOG.info("Analysing {} entit(y/ies): {}", entities.size(), entities);

        LocalDate start = config.getStartDate();
        LocalDate end = config.getEndDate();
        EventSettings events = analysisConfig.getEvents();
        ForecastSettings forecast = analysisConfig.getForecast();
        ResultWriter writer = new ResultWriter(Paths.get(config.getOutputDir()));
        List<Path> written = new ArrayList<>();

        try (AnalysisEngine engine = new AnalysisEngine(analysisConfig, repository)) {
            Map<String, EntityEventReport> entityEvents = engine.entityEvents()
                    .detectEventsForMultipleEntities(entities, start, end, EntityEventDetector.DEFAULT_METHODS);
            written.add(writer.write(ENTITY_EVENTS_FILE, entityEvents));

            written.add(writer.write(CORRELATED_EVENTS_FILE, orEmpty(engine.multiEntityEvents()
                    .detectCorrelatedEvents(entities, start, end, events.getCorrelatedMinCorrelation()))));
            written.add(writer.write(CO_OCCURRING_EVENTS_FILE, orEmpty(engine.multiEntityEvents()
                    .detectCoOccurringEvents(entities, start, end, Math.max(1, events.getMaxDaysGap())))));
            written.add(writer.write(CAUSAL_EVENTS_FILE, orEmpty(engine.multiEntityEvents()
                    .detectCausalEvents(entities, start, end, analysisConfig.getCorrelation().getMaxLag(),
                            events.getCausalMinCorrelation()))));

            written.add(writer.write(CROSS_ENTITY_EVENTS_FILE, engine.crossEntityEvents()
                    .identifyCrossEntityEvents(entities, events.getClusterThreshold(), events.getMinArticles(),
                            start, end, events.getMinTrustScore())));

            Map<String, EntityPrediction> predictions = new LinkedHashMap<>();
            for (String entity : entities) {
                predict(engine, entity, forecast, start, end).ifPresent(p -> predictions.put(entity, p));
            }
            written.add(writer.write(PREDICTIONS_FILE, predictions));
        }
        return written;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static List<String> selectEntities(JobConfig config, MentionRepository repository) {
        if (!config.getEntities().isEmpty()) {
            return config.getEntities();
        }
        List<String> known = repository.listEntities();
        return known.subList(0, Math.min(config.getTopEntities(), known.size()));
    }

    private static Optional<EntityPrediction> predict(AnalysisEngine engine, String entity,
            ForecastSettings settings, LocalDate start, LocalDate end) {
        try {
            Optional<EntityForecast> forecast = engine.predictor()
                    .predictEntityMentions(entity, settings.getHorizonDays(), start, end);
            return forecast.map(f -> new EntityPrediction(f,
                    engine.predictor().eventsOf(f, settings.getEventThreshold())));
        } catch (EntityNotFoundException e) {
            LOG.warn("Skipping prediction for '{}': {}", entity, e.getMessage());
            return Optional.empty();
        }
    }

    private static Object orEmpty(Optional<?> report) {
        return report.isPresent() ? report.get() : Collections.emptyMap();
    }

    private static AnalysisConfig loadAnalysisConfig(JobConfig config) {
        String path = config.getAnalysisConfigPath();
        if (path != null && !path.isBlank()) {
            return new ConfigLoader().loadFile(path);
        }
        return new ConfigLoader().load();
    }
}

package com.trendscope.core;

import com.trendscope.core.concurrent.AnalysisExecutor;
import com.trendscope.core.config.AnalysisConfig;
import com.trendscope.core.correlation.CorrelationAnalyzer;
import com.trendscope.core.detection.AnomalyDetector;
import com.trendscope.core.detection.BurstDetector;
import com.trendscope.core.detection.Detector;
import com.trendscope.core.detection.DetectorFactory;
import com.trendscope.core.event.CrossEntityEventDetector;
import com.trendscope.core.event.EntityEventDetector;
import com.trendscope.core.event.MultiEntityEventDetector;
import com.trendscope.core.forecast.EventPredictor;
import com.trendscope.core.series.MentionRepository;
import com.trendscope.core.series.TimeSeriesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Wires every analysis component from one {@link AnalysisConfig} over one
 * {@link MentionRepository}.
 *
 * <p>
 * The engine owns the worker pool shared by its components; closing the
 * engine shuts the pool down. Components are created once and are safe to
 * use from several threads, except {@link AnomalyDetector}, which keeps its
 * fitted model: {@link #newAnomalyDetector()} hands out a fresh one per call.
 * </p>
 *
 * <pre>{@code
 * try (AnalysisEngine engine = new AnalysisEngine(new ConfigLoader().load(), repository)) {
 *     engine.entityEvents().detectEntityEvents("Acme Corp", null, null);
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class AnalysisEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisEngine.class);

    private final AnalysisConfig config;
    private final AnalysisExecutor executor;
    private final TimeSeriesProvider provider;
    private final BurstDetector burstDetector;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final EntityEventDetector entityEvents;
    private final MultiEntityEventDetector multiEntityEvents;
    private final CrossEntityEventDetector crossEntityEvents;
    private final EventPredictor predictor;
    private final List<Detector> detectors;

    /**
     * @throws IllegalStateException if the configuration is invalid
     */
    public AnalysisEngine(AnalysisConfig config, MentionRepository repository) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(repository, "repository must not be null");
        config.validate();

        this.executor = AnalysisExecutor.fromSettings(config.getExecution());
        this.provider = new TimeSeriesProvider(repository);
        this.burstDetector = BurstDetector.fromSettings(config.getBurst());
        this.correlationAnalyzer = CorrelationAnalyzer.fromSettings(config.getCorrelation(), executor);
        this.entityEvents = new EntityEventDetector(provider, config.getAnomaly(), burstDetector,
                config.getEvents().getMaxDaysGap(), executor);
        this.multiEntityEvents = new MultiEntityEventDetector(provider, correlationAnalyzer, burstDetector);
        this.crossEntityEvents = new CrossEntityEventDetector(repository);
        this.predictor = EventPredictor.fromSettings(provider, config.getForecast(), executor);
        this.detectors = DetectorFactory.createAll(config);

        LOG.info("Analysis engine ready: {} detector(s), correlation={}, forecast models={}",
                detectors.size(), correlationAnalyzer.getMethod(), config.getForecast().getModels());
    }

    public AnomalyDetector newAnomalyDetector() {
        return AnomalyDetector.fromSettings(config.getAnomaly());
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    public AnalysisExecutor executor() {
        return executor;
    }

    public TimeSeriesProvider timeSeries() {
        return provider;
    }

    public BurstDetector burstDetector() {
        return burstDetector;
    }

    public CorrelationAnalyzer correlationAnalyzer() {
        return correlationAnalyzer;
    }

    public EntityEventDetector entityEvents() {
        return entityEvents;
    }

    public MultiEntityEventDetector multiEntityEvents() {
        return multiEntityEvents;
    }

    public CrossEntityEventDetector crossEntityEvents() {
        return crossEntityEvents;
    }

    public EventPredictor predictor() {
        return predictor;
    }

    /** One detector per family, as configured. */
    public List<Detector> detectors() {
        return detectors;
    }

    @Override
    public void close() {
        executor.close();
    }
}

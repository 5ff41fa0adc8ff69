package com.trendscope.core.event;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.correlation.CommunityDetection;
import com.trendscope.core.correlation.CorrelationAnalyzer;
import com.trendscope.core.correlation.CorrelationMatrix;
import com.trendscope.core.correlation.EntityGraph;
import com.trendscope.core.detection.BurstDetector;
import com.trendscope.core.model.CausalRelationship;
import com.trendscope.core.model.CoOccurringBurst;
import com.trendscope.core.model.CorrelationResult;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.series.TimeSeriesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Events that involve several entities at once.
 *
 * <p>
 * Three independent analyses, each loading the series of the requested
 * entities (unknown entities and entities without data are skipped) and
 * returning empty when none of them has data:
 * </p>
 * <ul>
 * <li>{@link #detectCorrelatedEvents}: static correlation matrix, strongly
 * correlated pairs, correlation network and its communities</li>
 * <li>{@link #detectCoOccurringEvents}: dates on which several entities
 * burst together</li>
 * <li>{@link #detectCausalEvents}: lead/lag relationships from the best lag
 * of every pair</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class MultiEntityEventDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MultiEntityEventDetector.class);

    private final TimeSeriesProvider provider;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final BurstDetector burstDetector;

    public MultiEntityEventDetector(TimeSeriesProvider provider, CorrelationAnalyzer correlationAnalyzer,
            BurstDetector burstDetector) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.correlationAnalyzer = Objects.requireNonNull(correlationAnalyzer, "correlationAnalyzer must not be null");
        this.burstDetector = Objects.requireNonNull(burstDetector, "burstDetector must not be null");
    }

    /**
     * Pairs whose static correlation reaches {@code minCorrelation} in
     * absolute value, plus the network and communities at that cut-off.
     */
    public Optional<CorrelatedEventsReport> detectCorrelatedEvents(List<String> entities, LocalDate start,
            LocalDate end, double minCorrelation) {
        LOG.info("Detecting correlated events for {} entities", entities.size());
        Map<String, EntityTimeSeries> series = load(entities, start, end);
        if (series.isEmpty()) {
            return Optional.empty();
        }

        CorrelationAnalyzer analyzer = correlationAnalyzer.withMinCorrelation(minCorrelation);
        CorrelationMatrix matrix = analyzer.calculateEntityCorrelations(series);
        EntityGraph network = analyzer.createCorrelationNetwork(matrix);
        List<SortedSet<String>> communities = CommunityDetection.greedyModularity(network);

        List<String> names = matrix.getEntities();
        List<CorrelationResult> pairs = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                double r = matrix.correlationAt(i, j);
                if (Math.abs(r) >= minCorrelation) {
                    pairs.add(new CorrelationResult(names.get(i), names.get(j), r, matrix.pValueAt(i, j), null));
                }
            }
        }
        LOG.info("{} correlated pair(s), communities: {}", pairs.size(), communities.size());
        return Optional.of(new CorrelatedEventsReport(names, minCorrelation, matrix, communities, pairs, network));
    }

    /**
     * Bursts shared by at least two entities, merged across gaps of up to
     * {@code maxDaysGap} days.
     */
    public Optional<CoOccurringEventsReport> detectCoOccurringEvents(List<String> entities, LocalDate start,
            LocalDate end, int maxDaysGap) {
        InvalidParameterException.requireAtLeast("maxDaysGap", maxDaysGap, 1);
        LOG.info("Detecting co-occurring events for {} entities", entities.size());
        Map<String, EntityTimeSeries> series = load(entities, start, end);
        if (series.isEmpty()) {
            return Optional.empty();
        }

        BurstDetector detector = new BurstDetector(burstDetector.getSensitivity(), burstDetector.getWindowSize(),
                burstDetector.getMinBurstDuration(), maxDaysGap);
        List<CoOccurringBurst> bursts = detector.detectEntityCorrelationBursts(series);
        LOG.info("{} co-occurring burst(s)", bursts.size());
        return Optional.of(new CoOccurringEventsReport(new ArrayList<>(series.keySet()), maxDaysGap, bursts));
    }

    /**
     * Directed lead/lag relationships whose best-lag correlation reaches
     * {@code minCorrelation}.
     */
    public Optional<CausalEventsReport> detectCausalEvents(List<String> entities, LocalDate start, LocalDate end,
            int maxLag, double minCorrelation) {
        LOG.info("Detecting causal events for {} entities", entities.size());
        Map<String, EntityTimeSeries> series = load(entities, start, end);
        if (series.isEmpty()) {
            return Optional.empty();
        }

        EntityGraph network = correlationAnalyzer.withMinCorrelation(minCorrelation)
                .createLaggedCorrelationNetwork(series, maxLag);
        List<CausalRelationship> relationships = CorrelationAnalyzer.causalRelationships(network);
        LOG.info("{} causal relationship(s)", relationships.size());
        return Optional.of(new CausalEventsReport(new ArrayList<>(series.keySet()), maxLag, minCorrelation,
                relationships, network));
    }

    private Map<String, EntityTimeSeries> load(List<String> entities, LocalDate start, LocalDate end) {
        Objects.requireNonNull(entities, "entities must not be null");
        Map<String, EntityTimeSeries> series = provider.getMultipleEntityTimeSeries(entities, start, end);
        if (series.isEmpty()) {
            LOG.warn("No data available for any of {}", entities);
        }
        return series;
    }
}

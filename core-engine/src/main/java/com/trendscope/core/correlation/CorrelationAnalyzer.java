package com.trendscope.core.correlation;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.AnalysisExecutor;
import com.trendscope.core.concurrent.TaskOutcome;
import com.trendscope.core.config.CorrelationSettings;
import com.trendscope.core.model.CausalRelationship;
import com.trendscope.core.model.CorrelationResult;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.LaggedCorrelation;
import com.trendscope.core.model.LaggedCorrelation.LagPoint;
import org.apache.commons.math3.distribution.TDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Pairwise, lagged and network-level correlation of entity mention series.
 *
 * <p>
 * Two series are compared on the dates they share. Fewer than
 * {@code minDataPoints} shared dates, or a constant series, give the
 * "no evidence" result {@code (0, 1.0)}, never an error. P-values are
 * two-sided, from Student's t distribution with {@code n - 2} degrees of
 * freedom.
 * </p>
 *
 * <h3>Lags</h3>
 * <p>
 * A lag {@code k} correlates the first series on day {@code t} with the
 * second on day {@code t + k}. A positive best lag therefore means the first
 * entity leads the second by {@code k} days.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * When built with an {@link AnalysisExecutor}, per-pair work of the
 * multi-entity operations runs on its worker pool. A pair whose task fails
 * or times out counts as "no evidence".
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationAnalyzer.class);

    private final CorrelationMethod method;
    private final double minCorrelation;
    private final int minDataPoints;
    private final double significanceThreshold;
    private final boolean significantOnly;
    private final AnalysisExecutor executor;

    /**
     * Analyzer that keeps only significant edges at {@code p <= 0.05} and runs
     * on the calling thread.
     */
    public CorrelationAnalyzer(CorrelationMethod method, double minCorrelation, int minDataPoints) {
        this(method, minCorrelation, minDataPoints, 0.05, true, null);
    }

    /**
     * @param executor worker pool for per-pair work, or {@code null} to run on
     *                 the calling thread
     * @throws InvalidParameterException if {@code minDataPoints < 3}, the
     *                                   minimum correlation is outside
     *                                   {@code [0, 1]} or the threshold is
     *                                   outside {@code (0, 1]}
     */
    public CorrelationAnalyzer(CorrelationMethod method, double minCorrelation, int minDataPoints,
            double significanceThreshold, boolean significantOnly, AnalysisExecutor executor) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        if (!(minCorrelation >= 0 && minCorrelation <= 1)) {
            throw new InvalidParameterException("minCorrelation", "must be in [0, 1], got: " + minCorrelation);
        }
        this.minCorrelation = minCorrelation;
        this.minDataPoints = InvalidParameterException.requireAtLeast("minDataPoints", minDataPoints, 3);
        this.significanceThreshold = InvalidParameterException.requireInRange("significanceThreshold",
                significanceThreshold, 0.0, 1.0);
        this.significantOnly = significantOnly;
        this.executor = executor;
    }

    public static CorrelationAnalyzer fromSettings(CorrelationSettings settings, AnalysisExecutor executor) {
        Objects.requireNonNull(settings, "CorrelationSettings must not be null");
        return new CorrelationAnalyzer(settings.correlationMethod(), settings.getMinCorrelation(),
                settings.getMinDataPoints(), settings.getSignificanceThreshold(),
                settings.isSignificantOnly(), executor);
    }

    /**
     * @return a copy of this analyzer with another minimum correlation
     */
    public CorrelationAnalyzer withMinCorrelation(double newMinCorrelation) {
        return new CorrelationAnalyzer(method, newMinCorrelation, minDataPoints, significanceThreshold,
                significantOnly, executor);
    }

    // ---------------------------------------------------------------
    // Pairs
    // ---------------------------------------------------------------

    /**
     * Correlation of two series over their shared dates.
     */
    public CorrelationResult calculateCorrelation(EntityTimeSeries series1, EntityTimeSeries series2) {
        Aligned aligned = Aligned.of(series1, series2);
        return correlate(series1.getEntity(), series2.getEntity(), aligned.first, aligned.second, null);
    }

    /**
     * Correlation at every lag in {@code [-maxLag, maxLag]}.
     *
     * @return the full curve and its best lag (largest absolute correlation,
     *         the most negative lag winning ties)
     */
    public LaggedCorrelation calculateLaggedCorrelation(EntityTimeSeries series1, EntityTimeSeries series2,
            int maxLag) {
        InvalidParameterException.requireAtLeast("maxLag", maxLag, 0);
        Aligned aligned = Aligned.of(series1, series2);
        int n = aligned.first.length;

        List<LagPoint> curve = new ArrayList<>(2 * maxLag + 1);
        for (int lag = -maxLag; lag <= maxLag; lag++) {
            int overlap = Math.max(0, n - Math.abs(lag));
            double[] x = new double[overlap];
            double[] y = new double[overlap];
            for (int t = 0; t < overlap; t++) {
                x[t] = aligned.first[lag >= 0 ? t : t - lag];
                y[t] = aligned.second[lag >= 0 ? t + lag : t];
            }
            CorrelationResult result = correlate(series1.getEntity(), series2.getEntity(), x, y, lag);
            curve.add(new LagPoint(lag, result.getCorrelation(), result.getPValue()));
        }
        return new LaggedCorrelation(series1.getEntity(), series2.getEntity(), curve);
    }

    private CorrelationResult correlate(String entity1, String entity2, double[] x, double[] y, Integer lag) {
        int n = x.length;
        if (n < minDataPoints) {
            LOG.trace("{} / {}: {} shared day(s), below minimum {}", entity1, entity2, n, minDataPoints);
            return new CorrelationResult(entity1, entity2, 0.0, CorrelationResult.NO_EVIDENCE_P_VALUE, lag);
        }
        double r = method.coefficient(x, y);
        if (Double.isNaN(r)) {
            LOG.trace("{} / {}: constant series, no correlation", entity1, entity2);
            return new CorrelationResult(entity1, entity2, 0.0, CorrelationResult.NO_EVIDENCE_P_VALUE, lag);
        }
        r = Math.max(-1.0, Math.min(1.0, r));
        return new CorrelationResult(entity1, entity2, r, pValue(r, n), lag);
    }

    /**
     * Two-sided p-value of a correlation coefficient from {@code n} pairs.
     */
    static double pValue(double r, int n) {
        if (Math.abs(r) >= 1.0) {
            return 0.0;
        }
        int degrees = n - 2;
        double t = Math.abs(r) * Math.sqrt(degrees / (1.0 - r * r));
        double p = 2.0 * (1.0 - new TDistribution(degrees).cumulativeProbability(t));
        return Math.max(0.0, Math.min(1.0, p));
    }

    // ---------------------------------------------------------------
    // Entity sets
    // ---------------------------------------------------------------

    /**
     * Static correlations of every pair of entities.
     */
    public CorrelationMatrix calculateEntityCorrelations(Map<String, EntityTimeSeries> seriesByEntity) {
        Objects.requireNonNull(seriesByEntity, "seriesByEntity must not be null");
        List<String> entities = new ArrayList<>(seriesByEntity.keySet());
        int n = entities.size();
        if (n == 0) {
            return CorrelationMatrix.empty();
        }

        Map<String, Callable<CorrelationResult>> tasks = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                EntityTimeSeries first = seriesByEntity.get(entities.get(i));
                EntityTimeSeries second = seriesByEntity.get(entities.get(j));
                tasks.put(pairKey(entities.get(i), entities.get(j)), () -> calculateCorrelation(first, second));
            }
        }
        Map<String, CorrelationResult> results = run(tasks, key -> CorrelationResult.noEvidence(
                entityOf(key, 0), entityOf(key, 1)));

        double[][] correlations = new double[n][n];
        double[][] pValues = new double[n][n];
        for (int i = 0; i < n; i++) {
            correlations[i][i] = 1.0;
            pValues[i][i] = 0.0;
            for (int j = i + 1; j < n; j++) {
                CorrelationResult result = results.get(pairKey(entities.get(i), entities.get(j)));
                correlations[i][j] = result.getCorrelation();
                correlations[j][i] = result.getCorrelation();
                pValues[i][j] = result.getPValue();
                pValues[j][i] = result.getPValue();
            }
        }
        LOG.debug("Computed {} pairwise correlation(s) over {} entities", tasks.size(), n);
        return new CorrelationMatrix(entities, correlations, pValues);
    }

    /**
     * Best-lag correlation of every unordered pair, in entity order.
     */
    public List<LaggedCorrelation> calculateEntityLaggedCorrelations(Map<String, EntityTimeSeries> seriesByEntity,
            int maxLag) {
        Objects.requireNonNull(seriesByEntity, "seriesByEntity must not be null");
        InvalidParameterException.requireAtLeast("maxLag", maxLag, 0);
        List<String> entities = new ArrayList<>(seriesByEntity.keySet());

        Map<String, Callable<LaggedCorrelation>> tasks = new LinkedHashMap<>();
        for (int i = 0; i < entities.size(); i++) {
            for (int j = i + 1; j < entities.size(); j++) {
                EntityTimeSeries first = seriesByEntity.get(entities.get(i));
                EntityTimeSeries second = seriesByEntity.get(entities.get(j));
                tasks.put(pairKey(entities.get(i), entities.get(j)),
                        () -> calculateLaggedCorrelation(first, second, maxLag));
            }
        }
        Map<String, LaggedCorrelation> results = run(tasks, key -> new LaggedCorrelation(entityOf(key, 0),
                entityOf(key, 1), List.of(new LagPoint(0, 0.0, CorrelationResult.NO_EVIDENCE_P_VALUE))));
        return new ArrayList<>(results.values());
    }

    // ---------------------------------------------------------------
    // Graphs
    // ---------------------------------------------------------------

    /**
     * Undirected graph whose edges are the strong (and, when configured,
     * significant) correlations. Every entity is a node.
     */
    public EntityGraph createCorrelationNetwork(Map<String, EntityTimeSeries> seriesByEntity) {
        return createCorrelationNetwork(calculateEntityCorrelations(seriesByEntity));
    }

    public EntityGraph createCorrelationNetwork(CorrelationMatrix matrix) {
        List<String> entities = matrix.getEntities();
        EntityGraph graph = EntityGraph.undirected(entities);
        for (int i = 0; i < entities.size(); i++) {
            for (int j = i + 1; j < entities.size(); j++) {
                double r = matrix.correlationAt(i, j);
                double p = matrix.pValueAt(i, j);
                if (accepts(r, p)) {
                    graph.addEdge(entities.get(i), entities.get(j), r, p, null);
                }
            }
        }
        LOG.debug("Correlation network: {} node(s), {} edge(s)", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /**
     * Directed graph from each leading entity to the entity it leads. Pairs
     * whose best lag is zero have no direction and get no edge.
     */
    public EntityGraph createLaggedCorrelationNetwork(Map<String, EntityTimeSeries> seriesByEntity, int maxLag) {
        return createLaggedCorrelationNetwork(new ArrayList<>(seriesByEntity.keySet()),
                calculateEntityLaggedCorrelations(seriesByEntity, maxLag));
    }

    public EntityGraph createLaggedCorrelationNetwork(List<String> entities, List<LaggedCorrelation> pairs) {
        EntityGraph graph = EntityGraph.directed(entities);
        for (LaggedCorrelation pair : pairs) {
            LagPoint best = pair.getBest();
            if (!accepts(best.getCorrelation(), best.getPValue())) {
                continue;
            }
            if (best.getLag() > 0) {
                graph.addEdge(pair.getEntity1(), pair.getEntity2(), best.getCorrelation(), best.getPValue(),
                        best.getLag());
            } else if (best.getLag() < 0) {
                graph.addEdge(pair.getEntity2(), pair.getEntity1(), best.getCorrelation(), best.getPValue(),
                        -best.getLag());
            }
        }
        LOG.debug("Lagged network: {} node(s), {} edge(s)", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /**
     * Modularity communities of the correlation network, largest first.
     */
    public List<SortedSet<String>> findEntityCommunities(Map<String, EntityTimeSeries> seriesByEntity) {
        return CommunityDetection.greedyModularity(createCorrelationNetwork(seriesByEntity));
    }

    /**
     * Lead/lag relationships of the lagged network, strongest first.
     */
    public List<CausalRelationship> findCausalRelationships(Map<String, EntityTimeSeries> seriesByEntity,
            int maxLag) {
        return causalRelationships(createLaggedCorrelationNetwork(seriesByEntity, maxLag));
    }

    /**
     * Read the edges of a directed lagged network as causal relationships,
     * sorted by absolute correlation, strongest first.
     */
    public static List<CausalRelationship> causalRelationships(EntityGraph laggedNetwork) {
        List<CausalRelationship> relationships = new ArrayList<>();
        for (GraphEdge edge : laggedNetwork.getEdges()) {
            relationships.add(new CausalRelationship(edge.getSourceEntity(), edge.getTargetEntity(),
                    edge.getLag(), edge.getWeight(), edge.getPValue()));
        }
        relationships.sort(Comparator.comparingDouble((CausalRelationship c) -> Math.abs(c.getCorrelation()))
                .reversed());
        return relationships;
    }

    private boolean accepts(double correlation, double pValue) {
        return Math.abs(correlation) >= minCorrelation && (!significantOnly || pValue <= significanceThreshold);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private <V> Map<String, V> run(Map<String, Callable<V>> tasks,
            Function<String, V> fallback) {
        Map<String, V> results = new LinkedHashMap<>();
        if (executor == null) {
            for (Map.Entry<String, Callable<V>> entry : tasks.entrySet()) {
                try {
                    results.put(entry.getKey(), entry.getValue().call());
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IllegalStateException("Correlation task " + entry.getKey() + " failed", e);
                }
            }
            return results;
        }
        Map<String, TaskOutcome<V>> outcomes = executor.invokeAll(tasks);
        outcomes.forEach((key, outcome) -> {
            if (outcome.isSuccess()) {
                results.put(key, outcome.getValue().orElseThrow());
            } else {
                LOG.warn("Pair {} treated as no evidence: {}", key, outcome.describeFailure());
                results.put(key, fallback.apply(key));
            }
        });
        return results;
    }

    private static String pairKey(String entity1, String entity2) {
        return entity1 + '\u0000' + entity2;
    }

    private static String entityOf(String pairKey, int position) {
        return pairKey.split("\u0000", 2)[position];
    }

    public CorrelationMethod getMethod() {
        return method;
    }

    public double getMinCorrelation() {
        return minCorrelation;
    }

    public int getMinDataPoints() {
        return minDataPoints;
    }

    public double getSignificanceThreshold() {
        return significanceThreshold;
    }

    public boolean isSignificantOnly() {
        return significantOnly;
    }

    /** Values of two series on the dates both cover. */
    private static final class Aligned {
        private final double[] first;
        private final double[] second;

        private Aligned(double[] first, double[] second) {
            this.first = first;
            this.second = second;
        }

        static Aligned of(EntityTimeSeries series1, EntityTimeSeries series2) {
            Objects.requireNonNull(series1, "series1 must not be null");
            Objects.requireNonNull(series2, "series2 must not be null");
            if (series1.isEmpty() || series2.isEmpty()) {
                return new Aligned(new double[0], new double[0]);
            }
            LocalDate start = series1.getStartDate().isAfter(series2.getStartDate())
                    ? series1.getStartDate() : series2.getStartDate();
            LocalDate end = series1.getEndDate().isBefore(series2.getEndDate())
                    ? series1.getEndDate() : series2.getEndDate();
            if (start.isAfter(end)) {
                return new Aligned(new double[0], new double[0]);
            }
            int offset1 = series1.indexOf(start);
            int offset2 = series2.indexOf(start);
            int length = series1.indexOf(end) - offset1 + 1;
            double[] first = new double[length];
            double[] second = new double[length];
            for (int t = 0; t < length; t++) {
                first[t] = series1.valueAt(offset1 + t);
                second[t] = series2.valueAt(offset2 + t);
            }
            return new Aligned(first, second);
        }
    }
}

package com.trendscope.core.correlation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Community detection over an {@link EntityGraph}.
 *
 * @since 1.0.0
 */
public final class CommunityDetection {

    private static final double MIN_GAIN = 1e-12;

    private CommunityDetection() {
        // utility class, not instantiable
    }

    /**
     * Greedy modularity maximisation (Clauset, Newman and Moore).
     *
     * <p>
     * Every node starts in its own community. The pair of connected
     * communities whose merge raises modularity the most is merged, until no
     * merge raises it any further. Edges count once each and direction is
     * ignored. Isolated nodes remain singleton communities.
     * </p>
     *
     * @return communities, largest first, ties broken by their first member
     */
    public static List<SortedSet<String>> greedyModularity(EntityGraph graph) {
        int n = graph.nodeCount();
        List<String> nodes = graph.getNodes();
        List<SortedSet<String>> members = new ArrayList<>(n);
        for (String node : nodes) {
            SortedSet<String> community = new TreeSet<>();
            community.add(node);
            members.add(community);
        }

        int m = graph.edgeCount();
        if (m > 0) {
            double[][] between = new double[n][n];
            double[] degree = new double[n];
            for (GraphEdge edge : graph.getEdges()) {
                between[edge.getSource()][edge.getTarget()] += 1;
                between[edge.getTarget()][edge.getSource()] += 1;
                degree[edge.getSource()] += 1;
                degree[edge.getTarget()] += 1;
            }
            boolean[] alive = new boolean[n];
            Arrays.fill(alive, true);

            while (true) {
                double bestGain = MIN_GAIN;
                int keep = -1;
                int absorb = -1;
                for (int a = 0; a < n; a++) {
                    if (!alive[a]) {
                        continue;
                    }
                    for (int b = a + 1; b < n; b++) {
                        if (!alive[b] || between[a][b] == 0) {
                            continue;
                        }
                        double gain = between[a][b] / m - degree[a] * degree[b] / (2.0 * m * m);
                        if (gain > bestGain) {
                            bestGain = gain;
                            keep = a;
                            absorb = b;
                        }
                    }
                }
                if (keep < 0) {
                    break;
                }
                members.get(keep).addAll(members.get(absorb));
                degree[keep] += degree[absorb];
                for (int c = 0; c < n; c++) {
                    if (c != keep && c != absorb) {
                        between[keep][c] += between[absorb][c];
                        between[c][keep] = between[keep][c];
                    }
                }
                alive[absorb] = false;
            }

            List<SortedSet<String>> merged = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if (alive[i]) {
                    merged.add(members.get(i));
                }
            }
            members = merged;
        }

        members.sort(Comparator.comparingInt((SortedSet<String> c) -> c.size()).reversed()
                .thenComparing(SortedSet::first));
        return members;
    }
}

package com.trendscope.core.correlation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CommunityDetection} and {@link EntityGraph}.
 */
class CommunityDetectionTest {

    @Test
    @DisplayName("Should split two triangles joined by one bridge")
    void shouldSplitBarbell() {
        EntityGraph graph = EntityGraph.undirected(List.of("a", "b", "c", "d", "e", "f", "g"));
        graph.addEdge("a", "b", 0.9, 0.01, null);
        graph.addEdge("b", "c", 0.9, 0.01, null);
        graph.addEdge("a", "c", 0.9, 0.01, null);
        graph.addEdge("d", "e", 0.9, 0.01, null);
        graph.addEdge("e", "f", 0.9, 0.01, null);
        graph.addEdge("d", "f", 0.9, 0.01, null);
        graph.addEdge("c", "d", 0.6, 0.04, null);

        List<SortedSet<String>> communities = CommunityDetection.greedyModularity(graph);

        assertThat(communities).hasSize(3);
        assertThat(communities.get(0)).containsExactly("a", "b", "c");
        assertThat(communities.get(1)).containsExactly("d", "e", "f");
        assertThat(communities.get(2)).containsExactly("g");
    }

    @Test
    @DisplayName("Should keep every node alone in a graph without edges")
    void shouldReturnSingletonsWithoutEdges() {
        EntityGraph graph = EntityGraph.undirected(List.of("y", "x"));

        assertThat(CommunityDetection.greedyModularity(graph)).hasSize(2);
    }

    @Test
    @DisplayName("Should find undirected edges from either end")
    void shouldLookUpUndirectedEdgesBothWays() {
        EntityGraph graph = EntityGraph.undirected(List.of("a", "b"));
        graph.addEdge("b", "a", 0.8, 0.01, null);

        assertThat(graph.hasEdge("a", "b")).isTrue();
        assertThat(graph.getEdges().get(0).getSourceEntity()).isEqualTo("a");
    }

    @Test
    @DisplayName("Should find directed edges only from their source")
    void shouldRespectDirection() {
        EntityGraph graph = EntityGraph.directed(List.of("a", "b"));
        graph.addEdge("b", "a", 0.8, 0.01, 2);

        assertThat(graph.hasEdge("b", "a")).isTrue();
        assertThat(graph.hasEdge("a", "b")).isFalse();
        assertThat(graph.edge("b", "a").orElseThrow().getLag()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject self loops and duplicate edges")
    void shouldRejectInvalidEdges() {
        EntityGraph graph = EntityGraph.undirected(List.of("a", "b"));
        graph.addEdge("a", "b", 0.8, 0.01, null);

        assertThatThrownBy(() -> graph.addEdge("a", "a", 1.0, 0.0, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Self loop");
        assertThatThrownBy(() -> graph.addEdge("b", "a", 0.8, 0.01, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already exists");
    }
}

package com.sc2.replay.summary;

import com.sc2.replay.exception.LengthMismatchException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for score-screen graphs.
 */
class GraphTest {

    @Test
    void testFromPointsMatchesParallelLists() {
        Graph parallel = new Graph(List.of(0L, 60L, 120L), List.of(0L, 450L, 1200L));
        Graph unzipped = Graph.fromPoints(List.of(
                new GraphPoint(0, 0), new GraphPoint(60, 450), new GraphPoint(120, 1200)));

        assertThat(unzipped.getTimes()).isEqualTo(parallel.getTimes());
        assertThat(unzipped.getValues()).isEqualTo(parallel.getValues());
        assertThat(unzipped).isEqualTo(parallel);
    }

    @Test
    void testLengthMismatch() {
        assertThatThrownBy(() -> new Graph(List.of(0L, 60L), List.of(5L)))
                .isInstanceOf(LengthMismatchException.class)
                .hasMessageContaining("2 times but 1 values");
    }

    @Test
    void testAsPointsIsRestartable() {
        Graph graph = new Graph(List.of(30L, 10L), List.of(7L, 3L));
        Iterable<GraphPoint> points = graph.asPoints();

        assertThat(points).containsExactly(new GraphPoint(30, 7), new GraphPoint(10, 3));
        assertThat(points).hasSize(2);
    }

    @Test
    void testAsPointsLengthEqualsSize() {
        Graph graph = new Graph(List.of(1L, 2L, 3L), List.of(4L, 5L, 6L));
        List<GraphPoint> collected = new ArrayList<>();
        graph.asPoints().forEach(collected::add);

        assertThat(collected).hasSize(graph.size());
    }

    @Test
    void testEmptyGraph() {
        Graph graph = Graph.fromPoints(List.of());

        assertThat(graph.asPoints()).isEmpty();
        assertThat(graph).hasToString("Graph with 0 values");
    }
}

package xyz.vvrf.gds.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class GraphUtilsTest {

    private static List<String[]> edges(String... pairs) {
        List<String[]> result = new ArrayList<>();
        for (String pair : pairs) {
            result.add(pair.split("->"));
        }
        return result;
    }

    private static Map<String, List<String>> graph(List<String> nodes, String... pairs) {
        return GraphUtils.buildAdjacencyList(nodes, edges(pairs));
    }

    @Test
    void adjacencyListKeepsEveryNodeAndDropsUnknownEndpoints() {
        Map<String, List<String>> adj = graph(Arrays.asList("A", "B", "C"), "A->B", "A->C", "B->Z", "Y->A");

        assertThat(adj).containsOnlyKeys("A", "B", "C");
        assertThat(adj.get("A")).containsExactly("B", "C");
        assertThat(adj.get("B")).isEmpty();
        assertThat(adj.get("C")).isEmpty();
    }

    @Test
    void acyclicGraphHasNoCycle() {
        Map<String, List<String>> adj = graph(Arrays.asList("A", "B", "C", "D"), "A->B", "A->C", "B->D", "C->D");

        assertThat(GraphUtils.findCycle(adj)).isEmpty();
    }

    @Test
    void cycleIsReturnedInPathOrder() {
        Map<String, List<String>> adj = graph(Arrays.asList("S", "A", "B", "C"), "S->A", "A->B", "B->C", "C->A");

        Optional<List<String>> cycle = GraphUtils.findCycle(adj);

        assertThat(cycle).isPresent();
        assertThat(cycle.get()).containsExactly("A", "B", "C");
    }

    @Test
    void selfLoopIsACycleOfOne() {
        Map<String, List<String>> adj = graph(Collections.singletonList("A"), "A->A");

        assertThat(GraphUtils.findCycle(adj)).contains(Collections.singletonList("A"));
    }

    @Test
    void longChainDoesNotExhaustTheStack() {
        List<String> nodes = new ArrayList<>();
        List<String[]> chain = new ArrayList<>();
        for (int i = 0; i < 20000; i++) {
            nodes.add("n" + i);
            if (i > 0) {
                chain.add(new String[]{"n" + (i - 1), "n" + i});
            }
        }
        Map<String, List<String>> adj = GraphUtils.buildAdjacencyList(nodes, chain);

        assertThat(GraphUtils.findCycle(adj)).isEmpty();

        adj.get("n19999").add("n0");
        Optional<List<String>> cycle = GraphUtils.findCycle(adj);
        assertThat(cycle).isPresent();
        assertThat(cycle.get()).hasSize(20000).startsWith("n0", "n1").endsWith("n19999");
    }

    @Test
    void reachableFromIncludesStart() {
        Map<String, List<String>> adj = graph(Arrays.asList("A", "B", "C", "D"), "A->B", "B->C");

        assertThat(GraphUtils.reachableFrom(adj, "A")).containsExactly("A", "B", "C");
        assertThat(GraphUtils.reachableFrom(adj, "D")).containsExactly("D");
    }

    @Test
    void reachabilityFollowsEdgeDirection() {
        Map<String, List<String>> adj = graph(Arrays.asList("A", "B", "C"), "A->B", "B->C");

        assertThat(GraphUtils.isReachable(adj, "A", "C")).isTrue();
        assertThat(GraphUtils.isReachable(adj, "C", "A")).isFalse();
        assertThat(GraphUtils.isReachable(adj, "B", "B")).isTrue();
    }
}

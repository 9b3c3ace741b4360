package org.calista.decipher.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GreedyModularityDetectorTest {

    private final GreedyModularityDetector detector = new GreedyModularityDetector();

    private static void clique(CooccurrenceGraph.Builder b, String... nodes) {
        for (int i = 0; i < nodes.length; i++) {
            for (int j = i + 1; j < nodes.length; j++) b.addEdge(nodes[i], nodes[j], 1);
        }
    }

    @Test
    @DisplayName("two disjoint cliques become two communities")
    void twoCliques() {
        CooccurrenceGraph.Builder b = CooccurrenceGraph.builder();
        clique(b, "a", "b", "c", "d");
        clique(b, "e", "f", "g", "h");
        CooccurrenceGraph g = b.build();

        CommunityPartition p = detector.detect(g);

        assertThat(p.asLists()).containsExactly(
                List.of("a", "b", "c", "d"),
                List.of("e", "f", "g", "h"));
        assertThat(p.covers(g)).isTrue();
        assertThat(GreedyModularityDetector.modularity(g, p)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("a single bridge does not join two cliques")
    void bridgedCliques() {
        CooccurrenceGraph.Builder b = CooccurrenceGraph.builder();
        clique(b, "a", "b", "c", "d");
        clique(b, "e", "f", "g", "h");
        b.addEdge("d", "e", 1);

        CommunityPartition p = detector.detect(b.build());

        assertThat(p.size()).isEqualTo(2);
        assertThat(p.communityOf("d")).isNotEqualTo(p.communityOf("e"));
    }

    @Test
    @DisplayName("equal gains merge the earliest pair first")
    void tiePolicy() {
        // a-b-c-d: gains of a-b and c-d are equal; a-b is merged first
        CooccurrenceGraph g = CooccurrenceGraph.builder()
                .addEdge("a", "b", 1)
                .addEdge("b", "c", 1)
                .addEdge("c", "d", 1)
                .build();

        assertThat(detector.detect(g).asLists()).containsExactly(List.of("a", "b"), List.of("c", "d"));
    }

    @Test
    @DisplayName("isolated nodes stay singletons")
    void isolatedNodes() {
        CooccurrenceGraph g = CooccurrenceGraph.builder()
                .addNode("lonely")
                .addEdge("a", "b", 2)
                .addNode("z")
                .build();

        CommunityPartition p = detector.detect(g);

        assertThat(p.asLists()).containsExactly(List.of("a", "b"), List.of("lonely"), List.of("z"));
        assertThat(p.covers(g)).isTrue();
    }

    @Test
    @DisplayName("graph without edges gives all singletons")
    void noEdges() {
        CooccurrenceGraph g = new CooccurrenceGraphBuilder().build(List.of("qo", "kch", "ar"), 1);

        CommunityPartition p = detector.detect(g);

        assertThat(p.asLists()).containsExactly(List.of("qo"), List.of("kch"), List.of("ar"));
        assertThat(GreedyModularityDetector.modularity(g, p)).isZero();
    }

    @Test
    @DisplayName("empty graph gives an empty partition")
    void emptyGraph() {
        assertThat(detector.detect(CooccurrenceGraph.empty()).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("reference tokens form one community covering every node")
    void referenceTokens() {
        CooccurrenceGraph g = new CooccurrenceGraphBuilder()
                .build(List.of("qo", "kch", "ar", "qo", "kch", "arin"), 5);

        CommunityPartition p = detector.detect(g);

        assertThat(p.covers(g)).isTrue();
        assertThat(p.asLists()).containsExactly(List.of("qo", "kch", "ar", "arin"));
        assertThat(detector.detect(g)).isEqualTo(p);
    }

    @Test
    @DisplayName("partitions reject a node in two communities")
    void partitionDisjoint() {
        assertThatThrownBy(() -> CommunityPartition.of(List.of(Set.of("a", "b"), Set.of("b"))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

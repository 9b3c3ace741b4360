package org.calista.decipher.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CooccurrenceGraph — undirected, integer-weighted token graph. Immutable.
 *
 * <p>Nodes keep first-seen order; that order is the stable enumeration used for
 * community tie-breaking. No self-loops.</p>
 */
public final class CooccurrenceGraph {

    private static final CooccurrenceGraph EMPTY = new CooccurrenceGraph(List.of(), Map.of(), 0L);

    private final List<String> nodes;
    private final Map<String, Integer> index;

    /** adjacency[node] = (neighbor -> weight), both directions stored */
    private final Map<String, Map<String, Integer>> adjacency;

    private final long totalWeight;

    private CooccurrenceGraph(List<String> nodes, Map<String, Map<String, Integer>> adjacency, long totalWeight) {
        this.nodes = nodes;
        this.adjacency = adjacency;
        this.totalWeight = totalWeight;

        HashMap<String, Integer> idx = new HashMap<>(nodes.size() * 2);
        for (int i = 0; i < nodes.size(); i++) idx.put(nodes.get(i), i);
        this.index = Collections.unmodifiableMap(idx);
    }

    public static CooccurrenceGraph empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public List<String> nodes() { return nodes; }

    public int nodeCount() { return nodes.size(); }

    public boolean isEmpty() { return nodes.isEmpty(); }

    public boolean containsNode(String node) { return index.containsKey(node); }

    /** First-seen position, -1 if absent. */
    public int indexOf(String node) {
        Integer i = index.get(node);
        return i == null ? -1 : i;
    }

    public int weight(String a, String b) {
        Map<String, Integer> out = adjacency.get(a);
        if (out == null) return 0;
        Integer w = out.get(b);
        return w == null ? 0 : w;
    }

    public Map<String, Integer> neighbors(String node) {
        Map<String, Integer> out = adjacency.get(node);
        return out == null ? Map.of() : out;
    }

    /** Sum of incident edge weights. */
    public long strength(String node) {
        long s = 0;
        for (int w : neighbors(node).values()) s += w;
        return s;
    }

    /** Sum of all edge weights (each undirected edge once), the "m" of modularity. */
    public long totalWeight() { return totalWeight; }

    public int edgeCount() {
        int n = 0;
        for (String a : nodes) {
            for (String b : neighbors(a).keySet()) {
                if (index.get(a) < index.get(b)) n++;
            }
        }
        return n;
    }

    /** Edges as (a, b, weight) with a before b in node order; deterministic. */
    public List<Edge> edges() {
        ArrayList<Edge> out = new ArrayList<>();
        for (String a : nodes) {
            for (Map.Entry<String, Integer> e : neighbors(a).entrySet()) {
                if (index.get(a) < index.get(e.getKey())) out.add(new Edge(a, e.getKey(), e.getValue()));
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CooccurrenceGraph other)) return false;
        return nodes.equals(other.nodes) && adjacency.equals(other.adjacency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, adjacency);
    }

    @Override
    public String toString() {
        return "CooccurrenceGraph{nodes=" + nodes.size()
                + ", edges=" + edgeCount()
                + ", totalWeight=" + totalWeight + '}';
    }

    // ---------------------------------------------------------------------

    public static final class Edge {
        public final String a;
        public final String b;
        public final int weight;

        public Edge(String a, String b, int weight) {
            this.a = a;
            this.b = b;
            this.weight = weight;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Edge e)) return false;
            return weight == e.weight && a.equals(e.a) && b.equals(e.b);
        }

        @Override
        public int hashCode() {
            return Objects.hash(a, b, weight);
        }

        @Override
        public String toString() {
            return a + "--" + b + "(" + weight + ")";
        }
    }

    /**
     * Accumulating builder. Weight increments commute, so insertion order of edges does not
     * change the final weights; node order follows first mention.
     */
    public static final class Builder {
        private final LinkedHashMap<String, LinkedHashMap<String, Integer>> adj = new LinkedHashMap<>();
        private long total = 0L;

        private Builder() {}

        public Builder addNode(String node) {
            Objects.requireNonNull(node, "node");
            adj.computeIfAbsent(node, k -> new LinkedHashMap<>());
            return this;
        }

        /** Adds {@code w} to the a--b edge; equal endpoints are ignored (no self-loops). */
        public Builder addEdge(String a, String b, int w) {
            addNode(a);
            addNode(b);
            if (a.equals(b) || w == 0) return this;
            if (w < 0) throw new IllegalArgumentException("edge weight must be positive: " + w);

            adj.get(a).merge(b, w, Integer::sum);
            adj.get(b).merge(a, w, Integer::sum);
            total += w;
            return this;
        }

        public CooccurrenceGraph build() {
            if (adj.isEmpty()) return EMPTY;

            LinkedHashMap<String, Map<String, Integer>> frozen = new LinkedHashMap<>(adj.size() * 2);
            for (Map.Entry<String, LinkedHashMap<String, Integer>> e : adj.entrySet()) {
                frozen.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
            }
            return new CooccurrenceGraph(
                    List.copyOf(adj.keySet()),
                    Collections.unmodifiableMap(frozen),
                    total);
        }
    }
}

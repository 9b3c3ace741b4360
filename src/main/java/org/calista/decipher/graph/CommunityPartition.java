package org.calista.decipher.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Disjoint node sets covering a graph. Immutable.
 */
public final class CommunityPartition {

    private static final CommunityPartition EMPTY = new CommunityPartition(List.of());

    private final List<Set<String>> communities;

    private CommunityPartition(List<Set<String>> communities) {
        this.communities = communities;
    }

    public static CommunityPartition empty() {
        return EMPTY;
    }

    /**
     * Copies the given sets (order kept). Rejects a node that appears in two communities.
     */
    public static CommunityPartition of(List<? extends Set<String>> communities) {
        if (communities == null || communities.isEmpty()) return EMPTY;

        HashSet<String> seen = new HashSet<>();
        ArrayList<Set<String>> out = new ArrayList<>(communities.size());
        for (Set<String> c : communities) {
            if (c == null || c.isEmpty()) continue;
            for (String node : c) {
                if (!seen.add(node)) throw new IllegalArgumentException("node in two communities: " + node);
            }
            out.add(Collections.unmodifiableSet(new LinkedHashSet<>(c)));
        }
        return new CommunityPartition(List.copyOf(out));
    }

    public List<Set<String>> communities() { return communities; }

    public int size() { return communities.size(); }

    public boolean isEmpty() { return communities.isEmpty(); }

    /** Index of the community holding {@code node}, -1 if none. */
    public int communityOf(String node) {
        for (int i = 0; i < communities.size(); i++) {
            if (communities.get(i).contains(node)) return i;
        }
        return -1;
    }

    /** True if every graph node is in exactly one community and no foreign node appears. */
    public boolean covers(CooccurrenceGraph graph) {
        int total = 0;
        for (Set<String> c : communities) {
            total += c.size();
            for (String n : c) if (!graph.containsNode(n)) return false;
        }
        return total == graph.nodeCount();
    }

    /** Plain nested lists, for JSON output. */
    public List<List<String>> asLists() {
        ArrayList<List<String>> out = new ArrayList<>(communities.size());
        for (Set<String> c : communities) out.add(List.copyOf(c));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommunityPartition other)) return false;
        return communities.equals(other.communities);
    }

    @Override
    public int hashCode() {
        return communities.hashCode();
    }

    @Override
    public String toString() {
        return "CommunityPartition" + communities;
    }
}

package org.calista.decipher.graph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * GreedyModularityDetector — weighted greedy agglomeration (Clauset–Newman–Moore).
 *
 * <p>Starts from singletons and repeatedly applies the merge with the largest strictly positive
 * modularity gain {@code dQ = 2 * (w_ij / 2m - a_i * a_j)}, {@code a_i = strength_i / 2m}.
 * Only communities joined by an edge are candidates (others can never gain).</p>
 *
 * <p>Tie policy: a community is identified by the first-seen index of its earliest node; pairs are
 * scanned with ascending (i, j), i &lt; j, and a later pair wins only with a gain larger by more than
 * {@link #TIE_EPSILON}. So among equal gains the first pair in that enumeration is merged.</p>
 *
 * <p>Output order: larger communities first, then by earliest node; nodes in first-seen order.</p>
 */
public final class GreedyModularityDetector implements CommunityDetector {

    private static final Logger log = LogManager.getLogger(GreedyModularityDetector.class);

    public static final double TIE_EPSILON = 1e-12;

    @Override
    public CommunityPartition detect(CooccurrenceGraph graph) {
        if (graph == null || graph.isEmpty()) return CommunityPartition.empty();

        final List<String> nodes = graph.nodes();
        final int n = nodes.size();
        final double twoM = 2.0 * graph.totalWeight();

        // community id -> members (node indices, ascending)
        TreeMap<Integer, List<Integer>> members = new TreeMap<>();
        // community id -> strength / 2m
        TreeMap<Integer, Double> share = new TreeMap<>();
        // community id -> (other id -> inter-community weight)
        TreeMap<Integer, TreeMap<Integer, Long>> links = new TreeMap<>();

        for (int i = 0; i < n; i++) {
            ArrayList<Integer> m = new ArrayList<>(4);
            m.add(i);
            members.put(i, m);
            share.put(i, twoM > 0 ? graph.strength(nodes.get(i)) / twoM : 0.0);

            TreeMap<Integer, Long> out = new TreeMap<>();
            for (Map.Entry<String, Integer> e : graph.neighbors(nodes.get(i)).entrySet()) {
                out.put(graph.indexOf(e.getKey()), (long) e.getValue());
            }
            links.put(i, out);
        }

        int merges = 0;
        if (twoM > 0) {
            while (true) {
                int bi = -1, bj = -1;
                double bestGain = 0.0;

                for (Map.Entry<Integer, TreeMap<Integer, Long>> ci : links.entrySet()) {
                    final int i = ci.getKey();
                    final double ai = share.get(i);
                    for (Map.Entry<Integer, Long> cj : ci.getValue().tailMap(i, false).entrySet()) {
                        final int j = cj.getKey();
                        double gain = 2.0 * (cj.getValue() / twoM - ai * share.get(j));
                        boolean better = (bi < 0) ? gain > TIE_EPSILON : gain > bestGain + TIE_EPSILON;
                        if (better) {
                            bestGain = gain;
                            bi = i;
                            bj = j;
                        }
                    }
                }

                if (bi < 0) break;
                merge(bi, bj, members, share, links);
                merges++;
            }
        }

        ArrayList<Map.Entry<Integer, List<Integer>>> ordered = new ArrayList<>(members.entrySet());
        ordered.sort(Comparator
                .comparingInt((Map.Entry<Integer, List<Integer>> e) -> -e.getValue().size())
                .thenComparingInt(Map.Entry::getKey));

        ArrayList<Set<String>> out = new ArrayList<>(ordered.size());
        for (Map.Entry<Integer, List<Integer>> e : ordered) {
            List<Integer> idx = new ArrayList<>(e.getValue());
            idx.sort(Integer::compareTo);
            LinkedHashSet<String> c = new LinkedHashSet<>(idx.size() * 2);
            for (int k : idx) c.add(nodes.get(k));
            out.add(c);
        }

        CommunityPartition p = CommunityPartition.of(out);
        if (log.isDebugEnabled()) {
            log.debug("communities nodes={} merges={} communities={} Q={}",
                    n, merges, p.size(), modularity(graph, p));
        }
        return p;
    }

    /** Folds community {@code j} into {@code i} (i &lt; j keeps ids = earliest node). */
    private static void merge(int i, int j,
                              TreeMap<Integer, List<Integer>> members,
                              TreeMap<Integer, Double> share,
                              TreeMap<Integer, TreeMap<Integer, Long>> links) {
        members.get(i).addAll(members.remove(j));
        share.put(i, share.get(i) + share.remove(j));

        TreeMap<Integer, Long> li = links.get(i);
        TreeMap<Integer, Long> lj = links.remove(j);
        li.remove(j);

        for (Map.Entry<Integer, Long> e : lj.entrySet()) {
            int k = e.getKey();
            if (k == i) continue;
            long w = e.getValue();
            li.merge(k, w, Long::sum);

            TreeMap<Integer, Long> lk = links.get(k);
            lk.remove(j);
            lk.merge(i, w, Long::sum);
        }
    }

    /**
     * Newman modularity of a partition: sum over communities of (L_c / m - (d_c / 2m)^2).
     * 0 for a graph without edges.
     */
    public static double modularity(CooccurrenceGraph graph, CommunityPartition partition) {
        if (graph == null || graph.totalWeight() == 0 || partition == null) return 0.0;
        final double m = graph.totalWeight();

        double q = 0.0;
        for (Set<String> c : partition.communities()) {
            double inside = 0.0;
            double degree = 0.0;
            for (String a : c) {
                for (Map.Entry<String, Integer> e : graph.neighbors(a).entrySet()) {
                    degree += e.getValue();
                    if (c.contains(e.getKey())) inside += e.getValue();
                }
            }
            inside /= 2.0; // each internal edge was seen from both ends
            q += inside / m - Math.pow(degree / (2.0 * m), 2);
        }
        return q;
    }
}

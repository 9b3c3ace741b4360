package org.calista.decipher.graph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.decipher.core.InvalidConfigurationException;

import java.util.List;

/**
 * Sliding-window co-occurrence counting.
 *
 * For every position i and offset j in [1, window), tokens[i] and tokens[i+j] co-occur once.
 * Pairs of identical tokens are skipped. No randomness: same input, same graph.
 */
public final class CooccurrenceGraphBuilder {

    private static final Logger log = LogManager.getLogger(CooccurrenceGraphBuilder.class);

    public static final int DEFAULT_WINDOW_SIZE = 5;

    public CooccurrenceGraph build(List<String> tokens, int windowSize) {
        if (windowSize < 1) throw new InvalidConfigurationException("windowSize must be >= 1: " + windowSize);
        if (tokens == null || tokens.isEmpty()) return CooccurrenceGraph.empty();

        CooccurrenceGraph.Builder b = CooccurrenceGraph.builder();
        final int n = tokens.size();
        for (int i = 0; i < n; i++) {
            String a = tokens.get(i);
            if (a == null) continue;
            b.addNode(a);
            for (int j = 1; j < windowSize && i + j < n; j++) {
                String c = tokens.get(i + j);
                if (c == null) continue;
                b.addEdge(a, c, 1);
            }
        }

        CooccurrenceGraph g = b.build();
        if (log.isDebugEnabled()) log.debug("graph.build tokens={} window={} -> {}", n, windowSize, g);
        return g;
    }
}

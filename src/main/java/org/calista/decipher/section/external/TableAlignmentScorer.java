package org.calista.decipher.section.external;

import java.util.Map;

/**
 * Fixed alignment scores keyed by section.
 */
public final class TableAlignmentScorer implements AlignmentScorer {

    private final Map<String, Double> scores;
    private final double defaultScore;

    public TableAlignmentScorer(Map<String, Double> scores, double defaultScore) {
        this.scores = (scores == null) ? Map.of() : Map.copyOf(scores);
        this.defaultScore = defaultScore;
    }

    @Override
    public double alignmentScore(String section) {
        Double s = scores.get(section);
        return (s == null || !Double.isFinite(s)) ? defaultScore : s;
    }
}

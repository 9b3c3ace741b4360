package org.calista.decipher.fitness;

import org.calista.decipher.mapping.FeedbackTable;
import org.calista.decipher.mapping.Mapping;

import java.util.Map;
import java.util.Objects;

/**
 * FeedbackFitness — agreement of a mapping with the expert feedback table.
 * +reward per matching entry, -penalty per mismatch, symbols outside the table add nothing.
 */
public final class FeedbackFitness {

    public static final int DEFAULT_REWARD = 10;
    public static final int DEFAULT_PENALTY = 5;

    private final int reward;
    private final int penalty;

    public FeedbackFitness() {
        this(DEFAULT_REWARD, DEFAULT_PENALTY);
    }

    public FeedbackFitness(int reward, int penalty) {
        this.reward = reward;
        this.penalty = penalty;
    }

    public int score(Mapping mapping, FeedbackTable feedback) {
        Objects.requireNonNull(mapping, "mapping");
        if (feedback == null || feedback.isEmpty()) return 0;

        int s = 0;
        for (Map.Entry<String, String> e : feedback.entries().entrySet()) {
            if (e.getValue().equals(mapping.get(e.getKey()))) s += reward;
            else s -= penalty;
        }
        return s;
    }

    public int reward() { return reward; }

    public int penalty() { return penalty; }
}

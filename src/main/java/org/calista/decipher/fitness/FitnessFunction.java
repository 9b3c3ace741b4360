package org.calista.decipher.fitness;

import org.calista.decipher.mapping.FeedbackTable;
import org.calista.decipher.mapping.Mapping;

import java.util.List;

/**
 * Scores a mapping for selection.
 *
 * Contract:
 *  - deterministic: same (mapping, tokens, feedback) gives the same breakdown
 *  - no hidden state: section data comes in as arguments on every call,
 *    so one instance may serve several sections concurrently
 */
public interface FitnessFunction {

    Breakdown evaluate(Mapping mapping, List<String> tokens, FeedbackTable feedback);

    default double fitness(Mapping mapping, List<String> tokens, FeedbackTable feedback) {
        return evaluate(mapping, tokens, feedback).total;
    }

    /**
     * Per-term scores. {@code total} is the only value selection looks at.
     */
    final class Breakdown {
        public final double frequency;
        public final double feedback;
        public final double total;

        public Breakdown(double frequency, double feedback) {
            this.frequency = frequency;
            this.feedback = feedback;
            this.total = frequency + feedback;
        }

        @Override
        public String toString() {
            return "Breakdown{frequency=" + frequency + ", feedback=" + feedback + ", total=" + total + '}';
        }
    }
}

package org.calista.decipher.fitness;

import org.calista.decipher.mapping.FeedbackTable;
import org.calista.decipher.mapping.Mapping;

import java.util.List;
import java.util.Objects;

/**
 * fitness = frequency term + feedback term.
 */
public final class CompositeFitness implements FitnessFunction {

    private final FrequencyFitness frequency;
    private final FeedbackFitness feedback;

    public CompositeFitness() {
        this(new FrequencyFitness(), new FeedbackFitness());
    }

    public CompositeFitness(FrequencyFitness frequency, FeedbackFitness feedback) {
        this.frequency = Objects.requireNonNull(frequency, "frequency");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
    }

    @Override
    public Breakdown evaluate(Mapping mapping, List<String> tokens, FeedbackTable table) {
        int f = frequency.score(mapping, tokens);
        int e = feedback.score(mapping, table);
        return new Breakdown(f, e);
    }

    public FrequencyFitness frequency() { return frequency; }

    public FeedbackFitness feedback() { return feedback; }
}

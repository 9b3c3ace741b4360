package org.calista.decipher.search;

import org.calista.decipher.mapping.FeedbackTable;
import org.calista.decipher.mapping.MappingSpace;

import java.util.List;
import java.util.Objects;

/**
 * Everything one search needs, passed at call time.
 * The engine keeps none of it between calls.
 */
public final class SearchRequest {

    public final MappingSpace space;
    public final List<String> tokens;
    public final FeedbackTable feedback;
    public final SearchParameters parameters;
    public final long seed;

    public SearchRequest(MappingSpace space,
                         List<String> tokens,
                         FeedbackTable feedback,
                         SearchParameters parameters,
                         long seed) {
        this.space = Objects.requireNonNull(space, "space");
        this.tokens = (tokens == null) ? List.of() : List.copyOf(tokens);
        this.feedback = ((feedback == null) ? FeedbackTable.empty() : feedback).checkAgainst(space);
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.seed = seed;
    }

    @Override
    public String toString() {
        return "SearchRequest{symbols=" + space.size()
                + ", candidates=" + space.candidates().size()
                + ", tokens=" + tokens.size()
                + ", feedback=" + feedback.size()
                + ", seed=" + seed
                + ", " + parameters + '}';
    }
}

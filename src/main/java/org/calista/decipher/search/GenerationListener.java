package org.calista.decipher.search;

/**
 * Observer of a running search. Called on the search thread after every generation
 * (and once for the initial population), so implementations must be cheap.
 */
@FunctionalInterface
public interface GenerationListener {

    GenerationListener NONE = (state, stats, population) -> { };

    void onGeneration(MappingSearchEngine.State state, GenerationStats stats, Population population);
}

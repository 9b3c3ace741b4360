package org.calista.decipher.mapping;

import org.calista.decipher.core.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MappingSpace — the fixed symbol alphabet and the fixed candidate-token set.
 *
 * <p>Symbol order is significant: it is the slot order of every {@link Mapping}
 * and the substitution order used by the frequency fitness.</p>
 */
public final class MappingSpace {

    private final List<String> symbols;
    private final List<String> candidates;

    private final Map<String, Integer> slotBySymbol;
    private final Map<String, Integer> candidateIndex;

    private MappingSpace(List<String> symbols, List<String> candidates) {
        this.symbols = symbols;
        this.candidates = candidates;

        HashMap<String, Integer> slots = new HashMap<>(symbols.size() * 2);
        for (int i = 0; i < symbols.size(); i++) slots.put(symbols.get(i), i);
        this.slotBySymbol = Map.copyOf(slots);

        HashMap<String, Integer> cand = new HashMap<>(candidates.size() * 2);
        for (int i = 0; i < candidates.size(); i++) cand.put(candidates.get(i), i);
        this.candidateIndex = Map.copyOf(cand);
    }

    public static MappingSpace of(Collection<String> symbols, Collection<String> candidates) {
        List<String> s = distinct(symbols, "symbol alphabet");
        List<String> c = distinct(candidates, "candidate token set");
        return new MappingSpace(s, c);
    }

    private static List<String> distinct(Collection<String> in, String what) {
        if (in == null || in.isEmpty()) {
            throw new InvalidConfigurationException(what + " must not be empty");
        }
        LinkedHashSet<String> seen = new LinkedHashSet<>(in.size() * 2);
        for (String x : in) {
            if (x == null || x.isEmpty()) {
                throw new InvalidConfigurationException(what + " contains an empty entry");
            }
            if (!seen.add(x)) {
                throw new InvalidConfigurationException(what + " contains duplicate entry: " + x);
            }
        }
        return List.copyOf(new ArrayList<>(seen));
    }

    // ---------------------------------------------------------------------

    public List<String> symbols() { return symbols; }

    public List<String> candidates() { return candidates; }

    public int size() { return symbols.size(); }

    public int slotOf(String symbol) {
        Integer i = slotBySymbol.get(symbol);
        return i == null ? -1 : i;
    }

    public boolean hasSymbol(String symbol) {
        return symbol != null && slotBySymbol.containsKey(symbol);
    }

    public boolean hasCandidate(String token) {
        return token != null && candidateIndex.containsKey(token);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MappingSpace other)) return false;
        return symbols.equals(other.symbols) && candidates.equals(other.candidates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbols, candidates);
    }

    @Override
    public String toString() {
        return "MappingSpace{symbols=" + symbols + ", candidates=" + candidates + '}';
    }
}

package org.calista.decipher.search;

import org.calista.decipher.mapping.Mapping;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Population — ordered, fixed-size list of (mapping, fitness).
 *
 * Fitness lives here, never on the mapping. A population is immutable; each generation
 * produces a new instance.
 */
public final class Population {

    private final List<Member> members;

    public Population(List<Member> members) {
        this.members = List.copyOf(Objects.requireNonNull(members, "members"));
    }

    public static Population of(List<Mapping> mappings, double[] fitness) {
        Objects.requireNonNull(mappings, "mappings");
        Objects.requireNonNull(fitness, "fitness");
        if (mappings.size() != fitness.length) {
            throw new IllegalArgumentException("mappings/fitness size mismatch: " + mappings.size() + " vs " + fitness.length);
        }
        ArrayList<Member> out = new ArrayList<>(mappings.size());
        for (int i = 0; i < fitness.length; i++) out.add(new Member(mappings.get(i), fitness[i]));
        return new Population(out);
    }

    public int size() { return members.size(); }

    public Member get(int i) { return members.get(i); }

    public List<Member> members() { return members; }

    public List<Mapping> mappings() {
        ArrayList<Mapping> out = new ArrayList<>(members.size());
        for (Member m : members) out.add(m.mapping);
        return out;
    }

    public double[] fitness() {
        double[] f = new double[members.size()];
        for (int i = 0; i < f.length; i++) f[i] = members.get(i).fitness;
        return f;
    }

    /** First maximal member in population order. */
    public Member best() {
        if (members.isEmpty()) throw new IllegalStateException("empty population");
        Member best = members.get(0);
        for (int i = 1; i < members.size(); i++) {
            Member m = members.get(i);
            if (m.fitness > best.fitness) best = m;
        }
        return best;
    }

    public GenerationStats stats(int generation) {
        if (members.isEmpty()) return new GenerationStats(generation, 0, 0, 0, 0, 0);

        double best = Double.NEGATIVE_INFINITY;
        double worst = Double.POSITIVE_INFINITY;
        double sum = 0.0;
        HashSet<Mapping> distinct = new HashSet<>(members.size() * 2);
        for (Member m : members) {
            best = Math.max(best, m.fitness);
            worst = Math.min(worst, m.fitness);
            sum += m.fitness;
            distinct.add(m.mapping);
        }
        return new GenerationStats(generation, members.size(), best, sum / members.size(), worst, distinct.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Population other)) return false;
        return members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return "Population{size=" + members.size() + '}';
    }

    // ---------------------------------------------------------------------

    public static final class Member {
        public final Mapping mapping;
        public final double fitness;

        public Member(Mapping mapping, double fitness) {
            this.mapping = Objects.requireNonNull(mapping, "mapping");
            this.fitness = fitness;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Member other)) return false;
            return Double.doubleToLongBits(fitness) == Double.doubleToLongBits(other.fitness)
                    && mapping.equals(other.mapping);
        }

        @Override
        public int hashCode() {
            return Objects.hash(mapping, Double.doubleToLongBits(fitness));
        }

        @Override
        public String toString() {
            return "Member{fitness=" + fitness + ", mapping=" + mapping + '}';
        }
    }
}

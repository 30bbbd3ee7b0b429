package org.calista.grila.crossword.dictionary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * CandidateQuery — immutable description of a ranked lookup.
 *
 * <p>Pattern: one entry per position, {@code null} = wildcard. No pattern means "any word of this length".</p>
 */
public final class CandidateQuery {

    public static final int DEFAULT_LIMIT = 50;

    private final int length;
    private final List<Character> pattern; // nullable
    private final Set<String> banned;
    private final Set<String> preferred;
    private final int limit;
    private final double fallbackFraction;

    private CandidateQuery(Builder b) {
        this.length = b.length;
        this.pattern = (b.pattern == null) ? null : Collections.unmodifiableList(new ArrayList<>(b.pattern));
        this.banned = Set.copyOf(b.banned);
        this.preferred = Set.copyOf(b.preferred);
        this.limit = b.limit;
        this.fallbackFraction = b.fallbackFraction;
    }

    public static Builder builder(int length) {
        return new Builder(length);
    }

    public int length() { return length; }

    /** @return pattern or {@code null} when unconstrained */
    public List<Character> pattern() { return pattern; }

    public Set<String> banned() { return banned; }

    public Set<String> preferred() { return preferred; }

    public int limit() { return limit; }

    public double fallbackFraction() { return fallbackFraction; }

    public static final class Builder {
        private final int length;
        private List<Character> pattern;
        private final Set<String> banned = new HashSet<>();
        private final Set<String> preferred = new HashSet<>();
        private int limit = DEFAULT_LIMIT;
        private double fallbackFraction = 0.0;

        private Builder(int length) {
            if (length < 1) throw new IllegalArgumentException("length must be >= 1: " + length);
            this.length = length;
        }

        public Builder pattern(List<Character> pattern) {
            if (pattern != null && pattern.size() != length) {
                throw new IllegalArgumentException("pattern size " + pattern.size() + " != length " + length);
            }
            this.pattern = pattern;
            return this;
        }

        public Builder pattern(Character... pattern) {
            return pattern(pattern == null ? null : Arrays.asList(pattern));
        }

        public Builder banned(Collection<String> words) {
            if (words != null) banned.addAll(words);
            return this;
        }

        public Builder preferred(Collection<String> words) {
            if (words != null) preferred.addAll(words);
            return this;
        }

        public Builder limit(int limit) {
            this.limit = Math.max(1, limit);
            return this;
        }

        public Builder fallbackFraction(double fraction) {
            if (!Double.isFinite(fraction) || fraction < 0.0) fraction = 0.0;
            this.fallbackFraction = Math.min(1.0, fraction);
            return this;
        }

        public CandidateQuery build() {
            return new CandidateQuery(this);
        }
    }
}

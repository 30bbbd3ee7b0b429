package org.calista.grila.crossword.dictionary;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * DictionaryEntry — one normalized surface with the metadata of its most frequent inflected form.
 *
 * <p>Immutable after load. {@code difficultyScore} is a precomputed 0..1 attribute of the source data.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DictionaryEntry {

    private static final double COMPOUND_PENALTY = 0.15;
    private static final double STOPWORD_PENALTY = 0.30;
    private static final double AFFINITY_SLOPE = 3.5;

    private final String surface;
    private final String lemma;
    private final String definition;
    private final double frequency;
    private final double difficultyScore;
    private final boolean compound;
    private final boolean stopword;
    private final List<String> rawForms;

    @JsonCreator
    public DictionaryEntry(@JsonProperty("surface") String surface,
                           @JsonProperty("lemma") String lemma,
                           @JsonProperty("definition") String definition,
                           @JsonProperty("frequency") double frequency,
                           @JsonProperty("difficultyScore") double difficultyScore,
                           @JsonProperty("compound") boolean compound,
                           @JsonProperty("stopword") boolean stopword,
                           @JsonProperty("rawForms") Collection<String> rawForms) {
        this.surface = Objects.requireNonNull(surface, "surface");
        if (surface.isEmpty()) throw new IllegalArgumentException("surface is empty");
        this.lemma = (lemma == null) ? "" : lemma;
        this.definition = (definition == null) ? "" : definition;
        this.frequency = Double.isFinite(frequency) ? frequency : 0.0;
        this.difficultyScore = Double.isFinite(difficultyScore) ? Math.max(0.0, Math.min(1.0, difficultyScore)) : 0.0;
        this.compound = compound;
        this.stopword = stopword;
        this.rawForms = (rawForms == null) ? List.of() : List.copyOf(new TreeSet<>(rawForms));
    }

    public static DictionaryEntry of(String surface, double frequency, double difficultyScore) {
        return new DictionaryEntry(surface, "", "", frequency, difficultyScore, false, false, List.of());
    }

    @JsonProperty("surface")
    public String surface() { return surface; }

    @JsonIgnore
    public int length() { return surface.length(); }

    @JsonProperty("lemma")
    public String lemma() { return lemma; }

    @JsonProperty("definition")
    public String definition() { return definition; }

    @JsonProperty("frequency")
    public double frequency() { return frequency; }

    @JsonProperty("difficultyScore")
    public double difficultyScore() { return difficultyScore; }

    @JsonProperty("compound")
    public boolean isCompound() { return compound; }

    @JsonProperty("stopword")
    public boolean isStopword() { return stopword; }

    @JsonProperty("rawForms")
    public List<String> rawForms() { return rawForms; }

    /**
     * Ranking score for a target tier: frequency term, closeness to the tier centre, and a direction bonus
     * that keeps EASY &lt; MEDIUM &lt; HARD ordering for off-tier words.
     */
    public double score(Difficulty difficulty) {
        Objects.requireNonNull(difficulty, "difficulty");

        double base = frequency;
        if (compound) base -= COMPOUND_PENALTY;
        if (stopword) base -= STOPWORD_PENALTY;

        double distance = Math.abs(difficultyScore - difficulty.center());
        double affinity = Math.max(0.0, 1.0 - distance * AFFINITY_SLOPE);

        double direction;
        switch (difficulty) {
            case EASY:
                direction = 1.0 - difficultyScore;
                break;
            case HARD:
                direction = difficultyScore;
                break;
            default:
                direction = 0.5;
        }

        return Math.max(0.0, base * 0.15 + affinity * 0.55 + direction * 0.30);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DictionaryEntry)) return false;
        return surface.equals(((DictionaryEntry) o).surface);
    }

    @Override
    public int hashCode() {
        return surface.hashCode();
    }

    @Override
    public String toString() {
        return "DictionaryEntry{" + surface + ", f=" + frequency + ", ds=" + difficultyScore + '}';
    }
}

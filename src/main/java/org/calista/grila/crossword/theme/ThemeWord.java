package org.calista.grila.crossword.theme;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Theme-driven seed word with its clue and the provider that produced it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ThemeWord {

    private final String word;
    private final String clue;
    private final String source;

    @JsonCreator
    public ThemeWord(@JsonProperty("word") String word,
                     @JsonProperty("clue") String clue,
                     @JsonProperty("source") String source) {
        this.word = Objects.requireNonNull(word, "word");
        this.clue = clue == null ? "" : clue;
        this.source = (source == null || source.isBlank()) ? "unknown" : source;
    }

    @JsonProperty("word")
    public String word() { return word; }

    @JsonProperty("clue")
    public String clue() { return clue; }

    @JsonProperty("source")
    public String source() { return source; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ThemeWord)) return false;
        ThemeWord t = (ThemeWord) o;
        return word.equals(t.word) && clue.equals(t.clue) && source.equals(t.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(word, clue, source);
    }

    @Override
    public String toString() {
        return word + " (" + source + ")";
    }
}

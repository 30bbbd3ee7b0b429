package org.calista.grila.crossword.dictionary;

/**
 * Maps a raw dictionary or theme form to the surface used by the grid: uppercase A-Z only.
 * An empty result means the form has no usable letters.
 */
@FunctionalInterface
public interface WordNormalizer {

    String normalize(String raw);
}

package org.calista.grila.crossword.clue;

import java.util.List;
import java.util.Map;

/**
 * Writes clue texts. The result maps slot id to text; missing ids fall back to the raw word.
 */
@FunctionalInterface
public interface ClueTextProvider {

    Map<String, String> generate(List<ClueRequest> requests);
}

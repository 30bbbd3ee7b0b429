package org.calista.grila.crossword.clue;

import org.calista.grila.crossword.grid.Direction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Offline clue writer: "Cerb (oriz.)" / "Cerb (vert.)".
 */
public final class TemplateClueTextProvider implements ClueTextProvider {

    @Override
    public Map<String, String> generate(List<ClueRequest> requests) {
        Map<String, String> out = new LinkedHashMap<>();
        for (ClueRequest r : requests) {
            out.put(r.slotId, capitalize(r.word) + (r.direction == Direction.ACROSS ? " (oriz.)" : " (vert.)"));
        }
        return out;
    }

    static String capitalize(String word) {
        if (word.isEmpty()) return word;
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}

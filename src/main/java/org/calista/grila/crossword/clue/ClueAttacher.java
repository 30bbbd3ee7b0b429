package org.calista.grila.crossword.clue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.grid.Clue;
import org.calista.grila.crossword.grid.CrosswordGrid;
import org.calista.grila.crossword.grid.WordSlot;

import java.util.*;

/**
 * ClueAttacher — final clue records for a filled grid.
 *
 * <p>
 * Все записи в clue box пересоздаются: одна запись {@code <slotId>-clue} на слот, в clue box этого слота.
 * Тематические слоты сохраняют тематическую подсказку, остальные получают текст провайдера,
 * а без него само слово.
 * </p>
 */
public final class ClueAttacher {

    private static final Logger log = LogManager.getLogger(ClueAttacher.class);

    private final ClueTextProvider provider;

    public ClueAttacher(ClueTextProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public List<ClueRequest> requests(CrosswordGrid grid) {
        List<ClueRequest> out = new ArrayList<>();
        for (WordSlot slot : grid.slots()) {
            if (slot.isFilled() && !slot.isTheme()) out.add(ClueRequest.of(slot));
        }
        return out;
    }

    /**
     * @return attached clues by slot id, in slot order
     */
    public Map<String, Clue> attach(CrosswordGrid grid) {
        Objects.requireNonNull(grid, "grid");

        Map<String, String> themeTexts = themeClueTexts(grid);
        List<ClueRequest> requests = requests(grid);
        Map<String, String> texts = Map.of();
        if (!requests.isEmpty()) {
            try {
                Map<String, String> generated = provider.generate(requests);
                if (generated != null) texts = generated;
            } catch (RuntimeException e) {
                log.warn("Clue provider failed, using raw words: {}", e.toString());
            }
        }

        grid.clearHostedClues();
        Map<String, Clue> out = new LinkedHashMap<>();
        for (WordSlot slot : grid.slots()) {
            String text = themeTexts.get(slot.id());
            if (text == null || text.isBlank()) text = texts.get(slot.id());
            if (text == null || text.isBlank()) text = slot.text() == null ? "" : slot.text();

            Clue clue = Clue.forSlot(slot.id() + "-clue", text, slot, slot.clueBox());
            grid.hostClue(slot.clueBox(), clue, null);
            out.put(slot.id(), clue);
        }
        log.debug("Attached {} clues ({} theme)", out.size(), themeTexts.size());
        return out;
    }

    private static Map<String, String> themeClueTexts(CrosswordGrid grid) {
        Map<String, String> out = new HashMap<>();
        for (WordSlot slot : grid.slots()) {
            if (!slot.isTheme()) continue;
            for (Clue c : grid.cell(slot.clueBox()).clues()) {
                if (c.slotId().equals(slot.id())) {
                    out.put(slot.id(), c.text());
                    break;
                }
            }
        }
        return out;
    }
}

package org.calista.grila.crossword.clue;

import org.calista.grila.crossword.grid.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClueAttacherTest {

    /** Row 1 across is a theme word with its clue already hosted; column 1 down is fill. */
    private static CrosswordGrid grid() {
        CrosswordGrid grid = new CrosswordGrid(GridConfig.builder(3, 3).build());
        grid.addClueBox(0, 0);
        GridPos box = GridPos.of(0, 0);
        WordSlot theme = new WordSlot("A0001", GridPos.of(1, 0), Direction.ACROSS, 3, box, true);
        grid.placeWord(theme, "LUP");
        grid.hostClue(box, Clue.forSlot("A0001-theme", "Animal salbatic", theme, box), null);
        grid.placeWord(new WordSlot("D0002", GridPos.of(0, 1), Direction.DOWN, 3, box, false), "MUT");
        return grid;
    }

    @Test
    void themeClueIsKeptAndFillGetsProviderText() {
        CrosswordGrid grid = grid();

        Map<String, Clue> clues = new ClueAttacher(new TemplateClueTextProvider()).attach(grid);

        assertEquals(List.of("A0001", "D0002"), List.copyOf(clues.keySet()));
        assertEquals("Animal salbatic", clues.get("A0001").text());
        assertEquals("Mut (vert.)", clues.get("D0002").text());
        assertEquals("A0001-clue", clues.get("A0001").id());

        List<Clue> hosted = grid.cell(0, 0).clues();
        assertEquals(2, hosted.size());
        assertTrue(hosted.stream().noneMatch(c -> c.id().endsWith("-theme")));
    }

    @Test
    void providerFailureFallsBackToRawWord() {
        ClueTextProvider broken = requests -> {
            throw new IllegalStateException("offline");
        };

        Map<String, Clue> clues = new ClueAttacher(broken).attach(grid());

        assertEquals("MUT", clues.get("D0002").text());
        assertEquals("Animal salbatic", clues.get("A0001").text());
    }

    @Test
    void blankProviderTextFallsBackToRawWord() {
        Map<String, Clue> clues = new ClueAttacher(requests -> Map.of("D0002", " ")).attach(grid());
        assertEquals("MUT", clues.get("D0002").text());
    }

    @Test
    void onlyFillSlotsAreRequested() {
        List<ClueRequest> requests = new ClueAttacher(new TemplateClueTextProvider()).requests(grid());

        assertEquals(1, requests.size());
        ClueRequest r = requests.get(0);
        assertEquals("D0002", r.slotId);
        assertEquals("MUT", r.word);
        assertEquals(0, r.clueRow);
        assertEquals(0, r.clueCol);
    }

    @Test
    void attachingTwiceDoesNotDuplicate() {
        CrosswordGrid grid = grid();
        ClueAttacher attacher = new ClueAttacher(new TemplateClueTextProvider());
        attacher.attach(grid);
        attacher.attach(grid);
        assertEquals(2, grid.cell(0, 0).clues().size());
    }

    @Test
    void templateCapitalizes() {
        assertEquals("Cerb", TemplateClueTextProvider.capitalize("CERB"));
        assertEquals("", TemplateClueTextProvider.capitalize(""));
    }
}

package org.calista.grila.crossword.grid;

import org.calista.grila.crossword.dictionary.DictionaryEntry;
import org.calista.grila.crossword.dictionary.WordIndex;

import java.util.*;
import java.util.function.Consumer;

/**
 * GridFormatter — text rendering of grids for logs and the console runner.
 *
 * <p>Символы: {@code #} clue box, {@code X} blocker, {@code .} пустая клетка, иначе буква.</p>
 */
public final class GridFormatter {

    private GridFormatter() {}

    public static char symbol(Cell cell) {
        return switch (cell.type()) {
            case LETTER -> cell.hasLetter() ? cell.letter() : '?';
            case CLUE_BOX -> '#';
            case BLOCKER_ZONE -> 'X';
            case EMPTY -> '.';
        };
    }

    /**
     * Column header, a rule, then one line per row: {@code " 3 |  A  B  #"}.
     */
    public static String render(CrosswordGrid grid) {
        Objects.requireNonNull(grid, "grid");
        int width = grid.cols();
        StringBuilder out = new StringBuilder((grid.rows() + 2) * (3 * width + 6));

        out.append("    ");
        for (int c = 0; c < width; c++) {
            if (c > 0) out.append(' ');
            out.append(String.format("%2d", c));
        }
        out.append('\n').append("    ").append(repeat("-", 3 * width - 1));

        for (int r = 0; r < grid.rows(); r++) {
            out.append('\n').append(String.format("%2d | ", r));
            for (int c = 0; c < width; c++) {
                if (c > 0) out.append(' ');
                out.append(String.format("%2s", symbol(grid.cell(r, c))));
            }
        }
        return out.toString();
    }

    /**
     * Geometry, word and (with an index) difficulty statistics in a box.
     *
     * @param index nullable; enables the difficulty section for fill words
     */
    public static String stats(CrosswordGrid grid, WordIndex index) {
        Objects.requireNonNull(grid, "grid");

        int total = grid.bounds().area();
        int letters = 0, clues = 0, blockers = 0, empty = 0;
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                switch (grid.cell(r, c).type()) {
                    case LETTER -> letters++;
                    case CLUE_BOX -> clues++;
                    case BLOCKER_ZONE -> blockers++;
                    case EMPTY -> empty++;
                }
            }
        }

        List<WordSlot> slots = new ArrayList<>(grid.slots());
        int words = 0, longWords = 0, theme = 0;
        List<WordSlot> fill = new ArrayList<>();
        SortedMap<Integer, Integer> lengths = new TreeMap<>();
        for (WordSlot s : slots) {
            if (s.text() == null || s.text().length() < 2) continue;
            words++;
            if (s.isTheme()) theme++;
            if (s.text().length() >= 3) {
                longWords++;
                lengths.merge(s.text().length(), 1, Integer::sum);
                if (!s.isTheme()) fill.add(s);
            }
        }

        final int fLetters = letters, fClues = clues, fBlockers = blockers, fEmpty = empty;
        final int fWords = words, fLong = longWords, fTheme = theme;
        return box("crossword " + grid.bounds(), b -> {
            b.kv("size", grid.rows() + " x " + grid.cols() + " (" + total + " cells)")
                    .kv("letters", fLetters + " (" + Math.round(fLetters * 100.0 / total) + "%)")
                    .kv("clue boxes", fClues)
                    .kv("blocker zone", fBlockers);
            if (fEmpty > 0) b.kv("unfilled", fEmpty);
            b.sep()
                    .kv("slots", slots.size() + " (" + fLong + " words >= 3 letters, " + (fWords - fLong) + " short)")
                    .kv("theme words", fTheme)
                    .kv("fill words", fill.size());
            if (!lengths.isEmpty()) {
                StringBuilder dist = new StringBuilder();
                for (Map.Entry<Integer, Integer> e : lengths.entrySet()) {
                    if (dist.length() > 0) dist.append(' ');
                    dist.append(e.getKey()).append(':').append(e.getValue());
                }
                b.kv("lengths", lengths.firstKey() + "-" + lengths.lastKey() + " [" + dist + "]");
            }
            if (index != null && !fill.isEmpty()) difficultySection(b, fill, index);
        });
    }

    private static void difficultySection(BoxBuilder b, List<WordSlot> fill, WordIndex index) {
        int easy = 0, medium = 0, hard = 0, missing = 0;
        double sum = 0.0;
        for (WordSlot s : fill) {
            Optional<DictionaryEntry> e = index.get(s.text());
            if (e.isEmpty()) {
                missing++;
                continue;
            }
            double ds = e.get().difficultyScore();
            sum += ds;
            if (ds < 0.3) easy++;
            else if (ds < 0.6) medium++;
            else hard++;
        }
        int found = fill.size() - missing;
        b.sep()
                .kv("difficulty", "easy=" + easy + " medium=" + medium + " hard=" + hard)
                .kv("avg difficulty", found == 0 ? "n/a" : String.format(Locale.ROOT, "%.2f", sum / found));
        if (missing > 0) b.kv("not in dictionary", missing);
    }

    // ---------------------------------------------------------------------
    // Box rendering
    // ---------------------------------------------------------------------

    public static String box(String title, Consumer<BoxBuilder> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");
        BoxBuilder b = new BoxBuilder();
        fill.accept(b);
        return renderBox(title, b.lines);
    }

    public static final class BoxBuilder {
        private final List<String> lines = new ArrayList<>(24);

        public BoxBuilder kv(String key, Object value) {
            lines.add((key == null ? "" : key) + ": " + value);
            return this;
        }

        public BoxBuilder sep() {
            lines.add("--");
            return this;
        }
    }

    private static String renderBox(String title, List<String> lines) {
        int contentWidth = title.length();
        for (String l : lines) {
            if (!"--".equals(l)) contentWidth = Math.max(contentWidth, l.length());
        }
        int w = Math.max(24, contentWidth + 2);

        StringBuilder out = new StringBuilder((lines.size() + 5) * (w + 8));
        out.append("┌").append(repeat("─", w)).append("┐\n");
        out.append("│ ").append(padRight(title, w - 1)).append("│\n");
        out.append("├").append(repeat("─", w)).append("┤\n");
        for (String l : lines) {
            if ("--".equals(l)) {
                out.append("│").append(repeat("─", w)).append("│\n");
            } else {
                out.append("│ ").append(padRight(l, w - 1)).append("│\n");
            }
        }
        out.append("└").append(repeat("─", w)).append("┘");
        return out.toString();
    }

    private static String padRight(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder b = new StringBuilder(width).append(s);
        while (b.length() < width) b.append(' ');
        return b.toString();
    }

    private static String repeat(String s, int n) {
        return n <= 0 ? "" : s.repeat(n);
    }
}

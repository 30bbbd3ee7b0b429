package org.calista.grila.crossword.layout;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.dictionary.WordIndex;
import org.calista.grila.crossword.grid.*;
import org.calista.grila.crossword.theme.ThemeWord;
import org.calista.grila.crossword.theme.ThemeWordException;

import java.util.*;

/**
 * ThemePlacer — randomized, retry-bounded seeding of theme words before fill.
 *
 * <p>
 * Для каждого слова: сначала разбираем очередь pending starts (продолжения уже начатых областей),
 * затем до {@code placementAttempts} случайных стартов. Размещение = лицензия clue box + коммит слова +
 * терминальная граница + проверка всех пересечений; всё пишется в один {@link UndoStack}
 * и откатывается целиком при любом отказе.
 * </p>
 */
public final class ThemePlacer {

    private static final Logger log = LogManager.getLogger(ThemePlacer.class);

    // =========================
    // Config
    // =========================

    public static final class Config {
        /** Placed theme letters must reach this fraction of playable cells. */
        public double minThemeCoverage = 0.10;
        /** Seeding stops once this fraction of playable cells is used. */
        public double maxThemeRatio = 0.40;
        /** Random start picks per word after the pending queue is drained. */
        public int placementAttempts = 30;
        /** 3-letter crossings need at least this many candidates. */
        public int minThreeLetterCandidates = 3;

        public Config validate() {
            if (!Double.isFinite(minThemeCoverage) || minThemeCoverage < 0.0) minThemeCoverage = 0.0;
            if (minThemeCoverage > 1.0) minThemeCoverage = 1.0;
            if (!Double.isFinite(maxThemeRatio) || maxThemeRatio < minThemeCoverage) maxThemeRatio = minThemeCoverage;
            if (maxThemeRatio > 1.0) maxThemeRatio = 1.0;
            if (placementAttempts < 0) placementAttempts = 0;
            if (minThreeLetterCandidates < 1) minThreeLetterCandidates = 1;
            return this;
        }
    }

    private final WordIndex index;
    private final Config cfg;
    private final Random rng;

    public ThemePlacer(WordIndex index, Config cfg, Random rng) {
        this.index = Objects.requireNonNull(index, "index");
        this.cfg = (cfg == null ? new Config() : cfg).validate();
        this.rng = Objects.requireNonNull(rng, "rng");
    }

    /** Letters the theme must cover on a grid with {@code playable} cells. */
    public int minThemeLetters(int playable) {
        return Math.max(1, (int) (playable * cfg.minThemeCoverage));
    }

    public int letterBudget(int playable) {
        return Math.max(minThemeLetters(playable), (int) (playable * cfg.maxThemeRatio));
    }

    /**
     * Places theme words in order until the letter budget is reached.
     *
     * @throws ThemeWordException when {@code words} is empty or coverage stays below the minimum
     */
    public ThemePlacement seed(CrosswordGrid grid, PlacementLedger ledger, List<ThemeWord> words) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(ledger, "ledger");
        if (words == null || words.isEmpty()) throw new ThemeWordException("No theme words available");

        int playable = grid.playableCount();
        int minLetters = minThemeLetters(playable);
        int budget = letterBudget(playable);

        int letters = 0;
        List<ThemeWord> placed = new ArrayList<>();
        List<WordSlot> slots = new ArrayList<>();
        for (ThemeWord tw : words) {
            String word = index.normalizer().normalize(tw.word());
            if (word.length() < 2 || ledger.usedWords().contains(word)) continue;
            if (letters >= budget) {
                log.debug("Theme letter budget reached: {} letters of {} playable", letters, playable);
                break;
            }
            Optional<WordSlot> slot = placeSpecific(grid, ledger, word, tw);
            if (slot.isEmpty()) continue;
            placed.add(tw);
            slots.add(slot.get());
            letters += word.length();
        }

        if (letters < minLetters) {
            throw new ThemeWordException(String.format(Locale.ROOT,
                    "Insufficient theme coverage: %d/%d letters (%.0f%% vs %.0f%% target)",
                    letters, minLetters, playable == 0 ? 0.0 : letters * 100.0 / playable, cfg.minThemeCoverage * 100));
        }
        log.info("Placed {} theme words ({} letters, {}% of {} playable)",
                placed.size(), letters, playable == 0 ? 0 : letters * 100 / playable, playable);
        return new ThemePlacement(placed, slots, letters, minLetters, budget);
    }

    /**
     * Pending starts first, then random direction and start picks.
     *
     * @param theme nullable; when present the slot is a theme slot and hosts the theme clue
     */
    public Optional<WordSlot> placeSpecific(CrosswordGrid grid, PlacementLedger ledger, String word, ThemeWord theme) {
        Optional<PlacementLedger.PendingStart> next;
        while ((next = ledger.pollPending()).isPresent()) {
            Optional<WordSlot> slot = placeAt(grid, ledger, word, theme, next.get().direction, next.get().start);
            if (slot.isPresent()) return slot;
        }

        for (int i = 0; i < cfg.placementAttempts; i++) {
            Direction dir = rng.nextBoolean() ? Direction.ACROSS : Direction.DOWN;
            List<GridPos> starts = SlotScanner.candidateStarts(grid, word.length(), dir);
            if (starts.isEmpty()) continue;
            GridPos start = starts.get(rng.nextInt(starts.size()));
            Optional<WordSlot> slot = placeAt(grid, ledger, word, theme, dir, start);
            if (slot.isPresent()) return slot;
        }
        return Optional.empty();
    }

    /**
     * One journaled placement. Any rejection rolls the grid back to its prior state.
     */
    public Optional<WordSlot> placeAt(CrosswordGrid grid, PlacementLedger ledger, String word, ThemeWord theme,
                                      Direction dir, GridPos start) {
        if (!SlotScanner.canPlaceWord(grid, start, dir, word)) return Optional.empty();

        UndoStack journal = new UndoStack();
        WordSlot slot = null;
        Optional<GridPos> extension;
        try {
            GridPos box = grid.ensureClueBox(start, dir, journal);
            slot = new WordSlot(ledger.nextSlotId(dir), start, dir, word.length(), box, theme != null);
            journal.push(grid.placeWordUndoable(slot, word));
            extension = grid.ensureTerminalBoundary(slot, journal);
            requireWholeRun(grid, slot);
            validateCrossings(grid, ledger, slot);
            if (theme != null) {
                grid.hostClue(box, Clue.forSlot(slot.id() + "-theme", theme.clue(), slot, box), journal);
            }
        } catch (PlacementException | ClueBoxException e) {
            journal.rollback();
            log.debug("Rejected {} {} at {}: {}", word, dir, start, e.getMessage());
            return Optional.empty();
        }
        journal.commit();

        ledger.register(slot);
        ledger.markUsed(word);
        if (theme != null) ledger.addThemeSurface(word);
        extension.ifPresent(p -> ledger.queueStart(grid, p, dir));
        log.debug("Placed {} as {}", word, slot);
        return Optional.of(slot);
    }

    /** The committed word must span its whole run; otherwise the run would hold a different word. */
    private static void requireWholeRun(CrosswordGrid grid, WordSlot slot) {
        Optional<SlotSignature> run = SlotScanner.signatureThrough(grid, slot.start(), slot.direction());
        if (run.isEmpty() || !run.get().key().equals(slot.key())) {
            throw new PlacementException("Word " + slot.id() + " does not fill its run " + run.map(SlotSignature::key).orElse("-"));
        }
    }

    /**
     * Every run through the word's cells, in both directions, excluding registered runs and the word's own run:
     * a licensing clue box must be securable; runs of length 3+ must be a complete valid word or keep enough
     * candidates.
     */
    void validateCrossings(CrosswordGrid grid, PlacementLedger ledger, WordSlot slot) {
        String own = slot.key();
        for (Direction dir : Direction.values()) {
            for (GridPos p : slot.cells()) {
                Optional<SlotSignature> sig = SlotScanner.signatureThrough(grid, p, dir);
                if (sig.isEmpty()) continue;
                SlotSignature s = sig.get();
                String key = s.key();
                if (key.equals(own) || ledger.isOccupied(key)) continue;

                if (!SlotScanner.startHasClueCapacity(grid, s.start(), dir)) {
                    throw new ClueBoxException("No available clue position for start " + s.start());
                }
                if (s.length() < 3) continue;

                String word = grid.wordAt(s.cells());
                if (word != null && (ledger.themeSurfaces().contains(word) || index.contains(word))) continue;

                List<Character> pattern = grid.pattern(s.cells());
                if (s.length() == 3) {
                    int count = index.countCandidates(3, pattern, ledger.usedWords());
                    if (count < cfg.minThreeLetterCandidates) {
                        throw new PlacementException("Too few candidates (" + count + ") for 3-letter crossing at " + s.start());
                    }
                } else if (!index.hasCandidates(s.length(), pattern, ledger.usedWords())) {
                    throw new PlacementException("No viable candidates for crossing slot at " + s.start());
                }
            }
        }
    }

    // =========================
    // Result
    // =========================

    public static final class ThemePlacement {
        public final List<ThemeWord> placed;
        public final List<WordSlot> slots;
        public final int letters;
        public final int minLetters;
        public final int budget;

        public ThemePlacement(List<ThemeWord> placed, List<WordSlot> slots, int letters, int minLetters, int budget) {
            this.placed = Collections.unmodifiableList(new ArrayList<>(placed));
            this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
            this.letters = letters;
            this.minLetters = minLetters;
            this.budget = budget;
        }
    }
}

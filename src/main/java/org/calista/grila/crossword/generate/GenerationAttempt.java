package org.calista.grila.crossword.generate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.clue.ClueAttacher;
import org.calista.grila.crossword.clue.ClueTextProvider;
import org.calista.grila.crossword.core.CrosswordException;
import org.calista.grila.crossword.dictionary.WordIndex;
import org.calista.grila.crossword.grid.Clue;
import org.calista.grila.crossword.grid.CrosswordGrid;
import org.calista.grila.crossword.grid.SlotSignature;
import org.calista.grila.crossword.grid.WordSlot;
import org.calista.grila.crossword.layout.*;
import org.calista.grila.crossword.model.*;
import org.calista.grila.crossword.theme.ThemeWord;
import org.calista.grila.crossword.theme.ThemeWordException;
import org.calista.grila.crossword.theme.ThemeWordMerger;
import org.calista.grila.crossword.validate.GridValidator;
import org.calista.grila.crossword.validate.ValidationReport;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * GenerationAttempt — one isolated, single-threaded pass of the pipeline.
 *
 * <p>
 * anneal layout -> theme placement -> completion passes -> model build -> solve -> commit -> clues -> validate.
 * Попытка владеет своей сеткой и ledger; разделяется только read-only индекс.
 * Любой отказ = RETRY с причиной, частичный результат не выживает.
 * </p>
 */
public final class GenerationAttempt {

    private static final Logger log = LogManager.getLogger(GenerationAttempt.class);

    private final WordIndex index;
    private final GenerationSettings settings;
    private final ThemeWordMerger themeWords;
    private final ClueTextProvider clueProvider;
    private final ConstraintSolver solver;

    public GenerationAttempt(WordIndex index, GenerationSettings settings, ThemeWordMerger themeWords,
                             ClueTextProvider clueProvider, ConstraintSolver solver) {
        this.index = Objects.requireNonNull(index, "index");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.themeWords = Objects.requireNonNull(themeWords, "themeWords");
        this.clueProvider = Objects.requireNonNull(clueProvider, "clueProvider");
        this.solver = Objects.requireNonNull(solver, "solver");
    }

    /**
     * @param seed     run seed, recorded in the result
     * @param gridSeed seed of this attempt; drives layout and theme placement
     * @param deadline nullable hard stop for the solver
     */
    public AttemptOutcome run(int attempt, long seed, long gridSeed, Instant deadline) {
        long t0 = System.nanoTime();
        Random rng = new Random(gridSeed);

        try {
            CrosswordGrid grid = LayoutAnnealer.forRetryLimit(settings.retryLimit).anneal(settings.gridConfig(gridSeed), rng);
            PlacementLedger ledger = new PlacementLedger();

            // 1) theme
            ThemePlacer placer = new ThemePlacer(index, settings.themePlacement, rng);
            int minLetters = placer.minThemeLetters(grid.playableCount());
            int target = Math.max(settings.themeRequestSize, ((minLetters / 5) + 2) * 3);
            List<ThemeWord> words = themeWords.forAttempt(gridSeed).merge(settings.theme, target, settings.difficulty, settings.language);
            if (words.isEmpty()) return AttemptOutcome.fatal("No theme words available for '" + settings.theme + "'");
            ThemePlacer.ThemePlacement placement = placer.seed(grid, ledger, words);

            // 2) layout
            LayoutCompleter completer = new LayoutCompleter(index, settings.layout);
            completer.complete(grid, ledger);

            // 3) fill
            FillCommitter committer = new FillCommitter();
            committer.registerPrefilledRuns(grid, ledger);
            List<SlotSignature> runs = SlotScanner.openRuns(grid, ledger);
            if (!runs.isEmpty()) {
                ModelBuilder.Result built = new ModelBuilder(index, settings.model).build(grid, runs, ledger.usedWords());
                if (!built.isOk()) return AttemptOutcome.retry(built.failure());

                ConstraintModel model = built.model();
                Solution solution = solver.solve(model, Duration.ofMillis(settings.solveBudgetMs()), deadline);
                if (!solution.isFeasible()) {
                    return AttemptOutcome.retry("Solver " + solution.status() + ": " + solution.detail());
                }
                committer.commit(grid, ledger, model, solution);
                completer.repairOrphanClues(grid);
            } else {
                log.debug("No open runs left after layout; skipping the solver");
            }

            // 4) clues + validation
            Map<String, Clue> clues = new ClueAttacher(clueProvider).attach(grid);
            ValidationReport report = new GridValidator(index).validate(grid, ledger.themeSurfaces());
            if (!report.ok()) return AttemptOutcome.retry("Grid validation failed: " + report.messages());

            List<WordSlot> slots = new ArrayList<>(grid.slots());
            long tookMs = (System.nanoTime() - t0) / 1_000_000L;
            log.info("Attempt {} produced {} words ({} theme) in {} ms", attempt, slots.size(), placement.placed.size(), tookMs);
            return AttemptOutcome.ok(new GenerationResult(grid, slots, placement.placed, clues, report,
                    seed, gridSeed, attempt, tookMs));
        } catch (ThemeWordException | LayoutException e) {
            return AttemptOutcome.retry(e.getMessage());
        } catch (CrosswordException e) {
            log.debug("Attempt {} failed", attempt, e);
            return AttemptOutcome.retry(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}

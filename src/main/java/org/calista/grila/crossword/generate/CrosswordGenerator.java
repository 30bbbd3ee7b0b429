package org.calista.grila.crossword.generate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.clue.ClueTextProvider;
import org.calista.grila.crossword.clue.TemplateClueTextProvider;
import org.calista.grila.crossword.dictionary.WordIndex;
import org.calista.grila.crossword.model.CpSatSolver;
import org.calista.grila.crossword.model.ConstraintSolver;
import org.calista.grila.crossword.theme.BucketThemeWordProvider;
import org.calista.grila.crossword.theme.ThemeWordMerger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * CrosswordGenerator — bounded sequential retry loop over {@link GenerationAttempt}s.
 *
 * <p>
 * Каждая попытка получает свой grid seed из master RNG ({@code nextInt(1_000_001)}), поэтому
 * один seed + один словарь = одна и та же сетка. FATAL прерывает цикл сразу,
 * исчерпание {@code retryLimit} -> {@link GenerationException}.
 * </p>
 */
public final class CrosswordGenerator {

    private static final Logger log = LogManager.getLogger(CrosswordGenerator.class);

    static final int GRID_SEED_BOUND = 1_000_001;

    private final WordIndex index;
    private final GenerationSettings settings;
    private final ThemeWordMerger themeWords;
    private final ClueTextProvider clueProvider;
    private final ConstraintSolver solver;
    private final GenerationListener listener;
    private final long seed;

    private CrosswordGenerator(Builder b) {
        this.index = b.index;
        this.settings = b.settings;
        this.seed = settings.seed != null ? settings.seed : System.currentTimeMillis();
        this.themeWords = b.themeWords != null
                ? b.themeWords
                : new ThemeWordMerger(null, List.of(new BucketThemeWordProvider(seed)), index.normalizer());
        this.clueProvider = b.clueProvider != null ? b.clueProvider : new TemplateClueTextProvider();
        this.solver = b.solver != null ? b.solver : new CpSatSolver();
        this.listener = b.listener != null ? b.listener : GenerationListener.NOOP;
    }

    public static Builder builder(WordIndex index, GenerationSettings settings) {
        return new Builder(index, settings);
    }

    public GenerationSettings settings() { return settings; }

    public long seed() { return seed; }

    /**
     * @throws GenerationException when a precondition is fatal or every attempt asked for a retry
     */
    public GenerationResult generate() {
        String fatal = preflight();
        if (fatal != null) {
            listener.generationFailed(fatal);
            throw new GenerationException("Cannot generate", List.of(fatal));
        }

        Random rng = new Random(seed);
        List<String> reasons = new ArrayList<>();
        for (int attempt = 1; attempt <= settings.retryLimit; attempt++) {
            long gridSeed = rng.nextInt(GRID_SEED_BOUND);
            log.info("Generation attempt {}/{} (grid seed {})", attempt, settings.retryLimit, gridSeed);
            listener.attemptStarted(attempt, gridSeed);

            AttemptOutcome outcome = newAttempt().run(attempt, seed, gridSeed, attemptDeadline());
            switch (outcome.kind()) {
                case OK -> {
                    listener.attemptOk(attempt, outcome.result());
                    return outcome.result();
                }
                case FATAL -> {
                    reasons.add(outcome.reason());
                    listener.generationFailed(outcome.reason());
                    throw new GenerationException("Generation failed on attempt " + attempt, reasons);
                }
                case RETRY -> {
                    log.warn("Generation attempt {} failed: {}", attempt, outcome.reason());
                    reasons.add(outcome.reason());
                    listener.attemptRetry(attempt, gridSeed, outcome.reason());
                }
            }
        }
        String msg = "Unable to generate crossword after " + settings.retryLimit + " attempts";
        listener.generationFailed(msg);
        throw new GenerationException(msg, reasons);
    }

    // ---------------------------------------------------------------------
    // Shared with ParallelGenerator
    // ---------------------------------------------------------------------

    /** Non-null = the run cannot succeed with any seed. */
    String preflight() {
        if (settings.rows < 3 || settings.cols < 3) {
            return "Grid " + settings.rows + "x" + settings.cols + " is smaller than 3x3";
        }
        if (index.size() == 0) return "Dictionary is empty";
        return null;
    }

    GenerationAttempt newAttempt() {
        return new GenerationAttempt(index, settings, themeWords, clueProvider, solver);
    }

    Instant attemptDeadline() {
        return Instant.now().plusMillis((long) (settings.fillTimeoutSeconds * 1000.0));
    }

    GenerationListener listener() { return listener; }

    // =========================
    // Builder
    // =========================

    public static final class Builder {
        private final WordIndex index;
        private final GenerationSettings settings;

        private ThemeWordMerger themeWords;
        private ClueTextProvider clueProvider;
        private ConstraintSolver solver;
        private GenerationListener listener;

        private Builder(WordIndex index, GenerationSettings settings) {
            this.index = Objects.requireNonNull(index, "index");
            this.settings = Objects.requireNonNull(settings, "settings").validate();
        }

        public Builder themeWords(ThemeWordMerger themeWords) {
            this.themeWords = Objects.requireNonNull(themeWords, "themeWords");
            return this;
        }

        public Builder clueProvider(ClueTextProvider clueProvider) {
            this.clueProvider = Objects.requireNonNull(clueProvider, "clueProvider");
            return this;
        }

        public Builder solver(ConstraintSolver solver) {
            this.solver = Objects.requireNonNull(solver, "solver");
            return this;
        }

        public Builder listener(GenerationListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        public CrosswordGenerator build() {
            return new CrosswordGenerator(this);
        }
    }
}

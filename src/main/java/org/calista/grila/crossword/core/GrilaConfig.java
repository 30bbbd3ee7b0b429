package org.calista.grila.crossword.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.grila.crossword.dictionary.DictionaryLoader;
import org.calista.grila.crossword.dictionary.Difficulty;
import org.calista.grila.crossword.generate.GenerationSettings;
import org.calista.grila.crossword.generate.ParallelGenerator;
import org.calista.grila.crossword.model.CpSatSolver;
import org.calista.grila.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * GrilaConfig — простой POJO конфиг:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GrilaConfig {

    private static final Logger log = LoggerFactory.getLogger(GrilaConfig.class);

    public String baseDir = "data";
    public Dictionary dictionary = new Dictionary();
    public Grid grid = new Grid();
    public Generation generation = new Generation();
    public Solver solver = new Solver();
    public Output output = new Output();
    public Parallel parallel = new Parallel();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Dictionary {
        /** Raw TSV (may be .gz); relative paths resolve against baseDir. */
        public String path = "dictionary/dex_words.tsv";
        /** JSONL cache inside baseDir; blank disables caching. */
        public String processedCache = "dictionary/processed.jsonl";
        public int minLength = 2;
        public int maxLength = 24;
        public double minFrequency = 0.0;
        public boolean excludeStopwords = true;
        public boolean allowCompounds = false;
        public int maxEntriesPerLength = 0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Grid {
        public int rows = 10;
        public int cols = 10;
        public boolean blockerZone = true;
        public boolean plantOriginClue = true;
        public int minBlockerSize = 3;
        public int maxBlockerSize = 6;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Generation {
        public String theme = "natura";
        public String difficulty = "MEDIUM";
        public String language = "Romanian";
        /** null => seeded from the clock. */
        public Long seed = null;
        public int retryLimit = 3;
        public int themeRequestSize = 80;
        public double minThemeCoverage = 0.10;
        public double maxThemeRatio = 0.40;
        public int themePlacementAttempts = 30;
        /** Ask the dictionary for theme words before the built-in buckets. */
        public boolean dictionaryThemes = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Solver {
        public double fillTimeoutSeconds = 180.0;
        public double solveBudgetCapSeconds = 30.0;
        public int maxCandidates = 8000;
        public double fallbackFraction = 0.0;
        public Double maxDifficultyScore = null;
        public Integer mediumSlotLimit = null;
        /** CP-SAT search workers; 1 keeps a seeded run reproducible. */
        public int numWorkers = 1;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Output {
        public String crosswordsDir = "crosswords";
        public String eventsFile = "events.jsonl";
        public boolean printGrid = true;
        public boolean printStats = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Parallel {
        public boolean enabled = false;
        /** 0 => auto. */
        public int parallelism = 0;
        public int queueCapacity = 64;
        public String threadNamePrefix = "grila-gen-";
        public long shutdownTimeoutMs = 2000;
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой), создаёт дефолтный и пишет на диск.
     */
    public static GrilaConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            GrilaConfig created = new GrilaConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            GrilaConfig created = new GrilaConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        GrilaConfig cfg = mapper.readValue(json, GrilaConfig.class);
        if (cfg == null) cfg = new GrilaConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, GrilaConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, GrilaConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (dictionary == null) dictionary = new Dictionary();
        if (dictionary.path == null || dictionary.path.isBlank()) dictionary.path = "dictionary/dex_words.tsv";
        if (dictionary.processedCache != null && dictionary.processedCache.isBlank()) dictionary.processedCache = null;
        if (dictionary.minLength < 1) dictionary.minLength = 1;
        if (dictionary.maxLength < dictionary.minLength) dictionary.maxLength = dictionary.minLength;
        if (!Double.isFinite(dictionary.minFrequency)) dictionary.minFrequency = 0.0;
        if (dictionary.maxEntriesPerLength < 0) dictionary.maxEntriesPerLength = 0;

        // grid: 3x3 floor is enforced by the generator as a fatal precondition
        if (grid == null) grid = new Grid();
        if (grid.rows < 1) grid.rows = 1;
        if (grid.cols < 1) grid.cols = 1;
        if (grid.minBlockerSize < 1) grid.minBlockerSize = 1;
        if (grid.maxBlockerSize < grid.minBlockerSize) grid.maxBlockerSize = grid.minBlockerSize;

        if (generation == null) generation = new Generation();
        if (generation.theme == null) generation.theme = "";
        generation.difficulty = Difficulty.parse(generation.difficulty).name();
        if (generation.language == null || generation.language.isBlank()) generation.language = "Romanian";
        if (generation.retryLimit < 1) generation.retryLimit = 1;
        if (generation.themeRequestSize < 1) generation.themeRequestSize = 1;
        if (!Double.isFinite(generation.minThemeCoverage) || generation.minThemeCoverage < 0.0) generation.minThemeCoverage = 0.0;
        if (generation.minThemeCoverage > 1.0) generation.minThemeCoverage = 1.0;
        if (!Double.isFinite(generation.maxThemeRatio) || generation.maxThemeRatio < generation.minThemeCoverage)
            generation.maxThemeRatio = generation.minThemeCoverage;
        if (generation.maxThemeRatio > 1.0) generation.maxThemeRatio = 1.0;
        if (generation.themePlacementAttempts < 0) generation.themePlacementAttempts = 0;

        if (solver == null) solver = new Solver();
        if (!(solver.fillTimeoutSeconds > 0.0) || !Double.isFinite(solver.fillTimeoutSeconds)) solver.fillTimeoutSeconds = 180.0;
        if (!(solver.solveBudgetCapSeconds > 0.0) || !Double.isFinite(solver.solveBudgetCapSeconds)) solver.solveBudgetCapSeconds = 30.0;
        if (solver.maxCandidates < 1) solver.maxCandidates = 1;
        if (!Double.isFinite(solver.fallbackFraction) || solver.fallbackFraction < 0.0) solver.fallbackFraction = 0.0;
        if (solver.fallbackFraction > 1.0) solver.fallbackFraction = 1.0;
        if (solver.maxDifficultyScore != null && !Double.isFinite(solver.maxDifficultyScore)) solver.maxDifficultyScore = null;
        if (solver.mediumSlotLimit != null && solver.mediumSlotLimit < 0) solver.mediumSlotLimit = 0;
        if (solver.numWorkers < 1) solver.numWorkers = 1;

        if (output == null) output = new Output();
        if (output.crosswordsDir == null || output.crosswordsDir.isBlank()) output.crosswordsDir = "crosswords";
        if (output.eventsFile == null || output.eventsFile.isBlank()) output.eventsFile = "events.jsonl";

        if (parallel == null) parallel = new Parallel();
        if (parallel.parallelism < 0) parallel.parallelism = 0;
        if (parallel.queueCapacity < 1) parallel.queueCapacity = 1;
        if (parallel.threadNamePrefix == null || parallel.threadNamePrefix.isBlank()) parallel.threadNamePrefix = "grila-gen-";
        if (parallel.shutdownTimeoutMs < 250) parallel.shutdownTimeoutMs = 250;
    }

    // -------------------- Views --------------------

    public DictionaryLoader.Config loaderConfig() {
        DictionaryLoader.Config c = new DictionaryLoader.Config();
        c.minLength = dictionary.minLength;
        c.maxLength = dictionary.maxLength;
        c.minFrequency = dictionary.minFrequency;
        c.excludeStopwords = dictionary.excludeStopwords;
        c.allowCompounds = dictionary.allowCompounds;
        c.maxEntriesPerLength = dictionary.maxEntriesPerLength;
        c.difficulty = Difficulty.parse(generation.difficulty);
        return c.validate();
    }

    public GenerationSettings generationSettings() {
        GenerationSettings s = new GenerationSettings();
        s.rows = grid.rows;
        s.cols = grid.cols;
        s.blockerZone = grid.blockerZone;
        s.plantOriginClue = grid.plantOriginClue;
        s.minBlockerSize = grid.minBlockerSize;
        s.maxBlockerSize = grid.maxBlockerSize;

        s.theme = generation.theme;
        s.difficulty = Difficulty.parse(generation.difficulty);
        s.language = generation.language;
        s.seed = generation.seed;
        s.retryLimit = generation.retryLimit;
        s.themeRequestSize = generation.themeRequestSize;
        s.themePlacement.minThemeCoverage = generation.minThemeCoverage;
        s.themePlacement.maxThemeRatio = generation.maxThemeRatio;
        s.themePlacement.placementAttempts = generation.themePlacementAttempts;

        s.fillTimeoutSeconds = solver.fillTimeoutSeconds;
        s.solveBudgetCapSeconds = solver.solveBudgetCapSeconds;
        s.model.maxCandidates = solver.maxCandidates;
        s.model.fallbackFraction = solver.fallbackFraction;
        s.model.maxDifficultyScore = solver.maxDifficultyScore;
        s.model.mediumSlotLimit = solver.mediumSlotLimit;
        return s.validate();
    }

    public CpSatSolver.Config solverConfig() {
        CpSatSolver.Config c = new CpSatSolver.Config();
        c.numWorkers = solver.numWorkers;
        return c.validate();
    }

    public ParallelGenerator.Config parallelConfig() {
        ParallelGenerator.Config c = new ParallelGenerator.Config();
        if (parallel.parallelism > 0) c.parallelism = parallel.parallelism;
        c.queueCapacity = parallel.queueCapacity;
        c.threadNamePrefix = parallel.threadNamePrefix;
        c.shutdownTimeoutMs = parallel.shutdownTimeoutMs;
        return c.validate();
    }
}

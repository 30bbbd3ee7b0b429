package org.calista.grila.crossword.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.grila.crossword.dictionary.Difficulty;
import org.calista.grila.crossword.generate.GenerationSettings;
import org.calista.grila.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GrilaConfigTest {

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = tmp.resolve("grila.json");

        GrilaConfig cfg = GrilaConfig.loadOrCreate(io, file, mapper);

        assertTrue(Files.exists(file));
        assertEquals("data", cfg.baseDir);
        assertEquals(10, cfg.grid.rows);
        assertEquals("MEDIUM", cfg.generation.difficulty);
        assertEquals(3, cfg.generation.retryLimit);

        GrilaConfig again = GrilaConfig.loadOrCreate(io, file, mapper);
        assertEquals(cfg.dictionary.path, again.dictionary.path);
    }

    @Test
    void blankFileIsRecreated() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = tmp.resolve("grila.json");
        Files.writeString(file, "   ");

        GrilaConfig cfg = GrilaConfig.loadOrCreate(io, file, mapper);
        assertEquals("natura", cfg.generation.theme);
        assertFalse(Files.readString(file).isBlank());
    }

    @Test
    void valuesAreNormalized() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = tmp.resolve("grila.json");
        Files.writeString(file, "{\"baseDir\":\"\",\"unknown\":1,"
                + "\"dictionary\":{\"processedCache\":\" \",\"minLength\":0,\"maxLength\":-3},"
                + "\"generation\":{\"difficulty\":\"hard\",\"retryLimit\":0,\"minThemeCoverage\":0.5,\"maxThemeRatio\":0.2},"
                + "\"solver\":{\"fallbackFraction\":2.5,\"fillTimeoutSeconds\":-1},"
                + "\"parallel\":{\"shutdownTimeoutMs\":10}}");

        GrilaConfig cfg = GrilaConfig.loadOrCreate(io, file, mapper);

        assertEquals("data", cfg.baseDir);
        assertNull(cfg.dictionary.processedCache);
        assertEquals(1, cfg.dictionary.minLength);
        assertEquals(1, cfg.dictionary.maxLength);
        assertEquals("HARD", cfg.generation.difficulty);
        assertEquals(1, cfg.generation.retryLimit);
        assertEquals(0.5, cfg.generation.maxThemeRatio);
        assertEquals(1.0, cfg.solver.fallbackFraction);
        assertEquals(180.0, cfg.solver.fillTimeoutSeconds);
        assertEquals(250, cfg.parallel.shutdownTimeoutMs);
    }

    @Test
    void unknownDifficultyFallsBackToMedium() {
        GrilaConfig cfg = new GrilaConfig();
        cfg.generation.difficulty = "impossible";
        cfg.validate();
        assertEquals("MEDIUM", cfg.generation.difficulty);
    }

    @Test
    void generationSettingsFollowTheSections() {
        GrilaConfig cfg = new GrilaConfig();
        cfg.grid.rows = 7;
        cfg.grid.cols = 9;
        cfg.grid.blockerZone = false;
        cfg.generation.theme = "mitologie";
        cfg.generation.difficulty = "EASY";
        cfg.generation.seed = 5L;
        cfg.generation.minThemeCoverage = 0.2;
        cfg.solver.maxCandidates = 500;
        cfg.solver.maxDifficultyScore = 0.4;
        cfg.validate();

        GenerationSettings s = cfg.generationSettings();
        assertEquals(7, s.rows);
        assertEquals(9, s.cols);
        assertFalse(s.blockerZone);
        assertEquals("mitologie", s.theme);
        assertEquals(Difficulty.EASY, s.difficulty);
        assertEquals(5L, s.seed);
        assertEquals(0.2, s.themePlacement.minThemeCoverage);
        assertEquals(500, s.model.maxCandidates);
        assertEquals(0.4, s.model.maxDifficultyScore);

        assertEquals(Difficulty.EASY, cfg.loaderConfig().difficulty);
    }

    @Test
    void solverSectionConfiguresCpSat() {
        GrilaConfig cfg = new GrilaConfig();
        assertEquals(1, cfg.solverConfig().numWorkers);

        cfg.solver.numWorkers = 4;
        assertEquals(4, cfg.solverConfig().numWorkers);

        cfg.solver.numWorkers = -2;
        cfg.validate();
        assertEquals(1, cfg.solver.numWorkers);
        assertEquals(1, cfg.solverConfig().numWorkers);
    }

    @Test
    void autoParallelismKeepsTheDefault() {
        GrilaConfig cfg = new GrilaConfig();
        cfg.parallel.parallelism = 3;
        assertEquals(3, cfg.parallelConfig().parallelism);

        cfg.parallel.parallelism = 0;
        assertTrue(cfg.parallelConfig().parallelism >= 1);
    }

    @Test
    void saveWritesValidatedConfig() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = tmp.resolve("nested/grila.json");
        GrilaConfig cfg = new GrilaConfig();
        cfg.generation.retryLimit = -4;

        GrilaConfig.save(io, file, mapper, cfg);

        GrilaConfig loaded = GrilaConfig.loadOrCreate(io, file, mapper);
        assertEquals(1, loaded.generation.retryLimit);
    }
}

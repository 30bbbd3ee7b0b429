package org.calista.grila.crossword;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.grila.crossword.core.GrilaConfig;
import org.calista.grila.crossword.core.GrilaKernel;
import org.calista.grila.crossword.events.GenerationEvent;
import org.calista.grila.crossword.store.GridDocument;
import org.calista.grila.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class GrilaAppTest {

    @TempDir
    Path tmp;

    @Test
    void failedRunIsPersistedAndLogged() throws Exception {
        Path tsv = tmp.resolve("mini.tsv");
        try (InputStream in = getClass().getResourceAsStream("/dictionary/mini.tsv")) {
            assertNotNull(in, "fixture missing");
            Files.copy(in, tsv);
        }
        GrilaConfig cfg = new GrilaConfig();
        cfg.dictionary.path = tsv.toString();
        cfg.grid.rows = 2;
        cfg.generation.seed = 1L;
        cfg.output.printGrid = false;
        cfg.output.printStats = false;
        GrilaConfig.save(new FileIO(tmp), tmp.resolve("grila.json"), new ObjectMapper(), cfg);

        assertEquals(1, new GrilaApp(tmp, Path.of("grila.json")).run());

        List<Path> docs;
        try (Stream<Path> s = Files.list(tmp.resolve("data/crosswords"))) {
            docs = s.collect(Collectors.toList());
        }
        assertEquals(1, docs.size());

        try (GrilaKernel k = GrilaKernel.builder().configRoot(tmp).build(Path.of("grila.json"))) {
            String id = docs.get(0).getFileName().toString().replace(".json", "");
            GridDocument doc = k.documentStore().load(id);
            assertEquals(GridDocument.STATUS_FAILED, doc.status);
            assertEquals(List.of("Grid 2x10 is smaller than 3x3"), doc.reasons);

            List<GenerationEvent> events = k.eventStore().readAll();
            assertEquals(1, events.size());
            assertEquals(GenerationEvent.GENERATION_FAILED, events.get(0).type);
        }
    }
}

package org.calista.grila.crossword.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.dictionary.WordIndex;
import org.calista.grila.crossword.generate.GenerationResult;
import org.calista.grila.crossword.generate.GenerationSettings;
import org.calista.grila.crossword.grid.CrosswordGrid;
import org.calista.grila.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Writes every run, successful or not, as {@code <dir>/<id>.json} (atomic write through {@link FileIO}).
 */
public final class CrosswordDocumentStore {

    private static final Logger log = LogManager.getLogger(CrosswordDocumentStore.class);

    private static final DateTimeFormatter ID_TS = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final String dir;
    private final Clock clock;

    /**
     * @param dir directory relative to the IO base dir, e.g. {@code crosswords}
     */
    public CrosswordDocumentStore(FileIO io, ObjectMapper mapper, String dir, Clock clock) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.dir = Objects.requireNonNull(dir, "dir");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public String saveSuccess(GenerationResult result, GenerationSettings settings, WordIndex index) throws IOException {
        Instant now = clock.instant();
        GridDocument doc = GridDocument.success(newId(now), now.toString(), result, settings, index);
        write(doc);
        log.info("Crossword saved: {}", doc.id);
        return doc.id;
    }

    /**
     * @param grid nullable partial grid
     */
    public String saveFailure(GenerationSettings settings, String error, List<String> reasons, CrosswordGrid grid) throws IOException {
        Instant now = clock.instant();
        GridDocument doc = GridDocument.failure(newId(now), now.toString(), settings, error, reasons, grid);
        write(doc);
        log.info("Crossword failure saved: {}", doc.id);
        return doc.id;
    }

    public GridDocument load(String id) throws IOException {
        return mapper.readValue(io.readString(pathOf(id)), GridDocument.class);
    }

    public Path pathOf(String id) {
        return io.resolve(dir + "/" + id + ".json");
    }

    private void write(GridDocument doc) throws IOException {
        io.writeString(pathOf(doc.id), mapper.writerWithDefaultPrettyPrinter().writeValueAsString(doc));
    }

    private static String newId(Instant now) {
        return ID_TS.format(now) + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}

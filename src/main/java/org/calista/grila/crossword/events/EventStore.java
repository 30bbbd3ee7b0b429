package org.calista.grila.crossword.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.generate.GenerationListener;
import org.calista.grila.crossword.generate.GenerationResult;
import org.calista.grila.io.FileIO;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only JSONL log of generation events.
 */
public final class EventStore {

    private static final Logger log = LogManager.getLogger(EventStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public void append(GenerationEvent e) throws IOException {
        String line = mapper.writeValueAsString(e);
        io.appendJsonl(file, line);
    }

    public List<String> readAllRawLines() throws IOException {
        return io.readJsonl(file);
    }

    public List<GenerationEvent> readAll() throws IOException {
        List<GenerationEvent> out = new ArrayList<>();
        for (String line : readAllRawLines()) out.add(mapper.readValue(line, GenerationEvent.class));
        return out;
    }

    /**
     * Listener that records one run. Write failures surface as {@link UncheckedIOException}.
     */
    public GenerationListener listener(String runId) {
        return new GenerationListener() {
            @Override
            public void attemptStarted(int attempt, long gridSeed) {
                record(GenerationEvent.of(GenerationEvent.ATTEMPT_STARTED, runId, attempt, gridSeed, null, now()));
            }

            @Override
            public void attemptRetry(int attempt, long gridSeed, String reason) {
                record(GenerationEvent.of(GenerationEvent.ATTEMPT_RETRY, runId, attempt, gridSeed, reason, now()));
            }

            @Override
            public void attemptOk(int attempt, GenerationResult result) {
                record(GenerationEvent.of(GenerationEvent.ATTEMPT_OK, runId, attempt, result.gridSeed,
                        result.slots.size() + " words", now()));
            }

            @Override
            public void generationFailed(String reason) {
                record(GenerationEvent.of(GenerationEvent.GENERATION_FAILED, runId, 0, null, reason, now()));
            }
        };
    }

    private void record(GenerationEvent e) {
        try {
            append(e);
        } catch (IOException ex) {
            log.warn("Failed to append {} event to {}", e.type, file);
            throw new UncheckedIOException(ex);
        }
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}

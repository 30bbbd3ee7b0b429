package org.calista.grila.crossword.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.grila.crossword.generate.GenerationListener;
import org.calista.grila.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventStoreTest {

    @TempDir
    Path tmp;

    @Test
    void appendedEventsAreReadBackInOrder() throws Exception {
        FileIO io = new FileIO(tmp);
        EventStore store = new EventStore(io, new ObjectMapper(), io.resolve("events/events.jsonl"));

        store.append(GenerationEvent.of(GenerationEvent.ATTEMPT_STARTED, "run-1", 1, 42L, null, 1000L));
        store.append(GenerationEvent.of(GenerationEvent.GENERATION_FAILED, "run-1", 0, null, "boom", 2000L));

        assertEquals(2, store.readAllRawLines().size());
        List<GenerationEvent> events = store.readAll();
        assertEquals(GenerationEvent.ATTEMPT_STARTED, events.get(0).type);
        assertEquals(42L, events.get(0).gridSeed);
        assertEquals(1000L, events.get(0).tsEpochMs);
        assertEquals("boom", events.get(1).text);
        assertNull(events.get(1).gridSeed);
    }

    @Test
    void listenerRecordsOneRun() throws Exception {
        FileIO io = new FileIO(tmp);
        EventStore store = new EventStore(io, new ObjectMapper(), io.resolve("events.jsonl"));
        GenerationListener l = store.listener("run-7");

        l.attemptStarted(1, 11L);
        l.attemptRetry(1, 11L, "Solver TIMEOUT");
        l.generationFailed("gave up");

        List<GenerationEvent> events = store.readAll();
        assertEquals(3, events.size());
        assertEquals(GenerationEvent.ATTEMPT_RETRY, events.get(1).type);
        assertEquals("Solver TIMEOUT", events.get(1).text);
        assertEquals(11L, events.get(1).gridSeed);
        for (GenerationEvent e : events) assertEquals("run-7", e.runId);
        assertTrue(events.get(2).tsEpochMs > 0);
    }

    @Test
    void writeFailureSurfacesFromListener() throws Exception {
        FileIO io = new FileIO(tmp);
        Files.writeString(tmp.resolve("blocked"), "not a directory");
        EventStore store = new EventStore(io, new ObjectMapper(), io.resolve("blocked/events.jsonl"));

        assertThrows(UncheckedIOException.class, () -> store.listener("r").attemptStarted(1, 1L));
    }
}

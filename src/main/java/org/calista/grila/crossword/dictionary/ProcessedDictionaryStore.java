package org.calista.grila.crossword.dictionary;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * ProcessedDictionaryStore — JSONL cache of grouped dictionary entries.
 *
 * <p>
 * Первая строка: {"_schema":"grila-dict-v1"}. Пишем атомарно через FileIO.
 * При чтении битые строки пропускаются с warning, загрузка не падает.
 * </p>
 */
public final class ProcessedDictionaryStore {

    private static final Logger log = LogManager.getLogger(ProcessedDictionaryStore.class);

    static final String SCHEMA_LINE = "{\"_schema\":\"grila-dict-v1\"}";

    private final FileIO io;
    private final ObjectMapper mapper;

    public ProcessedDictionaryStore(FileIO io, ObjectMapper mapper) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public void save(Path file, List<DictionaryEntry> entries) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(entries, "entries");

        FileIO.WriterHandle h = io.openWriter(file);
        try {
            h.writer.write(SCHEMA_LINE);
            h.writer.newLine();
            for (DictionaryEntry e : entries) {
                h.writer.write(mapper.writeValueAsString(e));
                h.writer.newLine();
            }
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            io.rollback(h);
            if (e instanceof IOException) throw (IOException) e;
            throw new IOException("Failed to save processed dictionary: " + file, e);
        }
        log.debug("Processed dictionary saved: {} ({} entries)", file, entries.size());
    }

    public List<DictionaryEntry> load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");

        List<DictionaryEntry> out = new ArrayList<>();
        int broken = 0;
        try (Stream<String> lines = io.jsonlStream(file)) {
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                if (line.contains("\"_schema\"")) continue;
                try {
                    DictionaryEntry e = mapper.readValue(line, DictionaryEntry.class);
                    if (e != null) out.add(e);
                } catch (IOException | IllegalArgumentException | NullPointerException rowErr) {
                    broken++;
                    log.warn("Skip broken processed dictionary row in {}: {}", file, rowErr.getMessage());
                }
            }
        }
        log.debug("Processed dictionary loaded: {} (entries={}, broken={})", file, out.size(), broken);
        return out;
    }
}

package org.calista.grila.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class FileIOTest {

    @TempDir
    Path tmp;

    @Test
    void resolveStaysInsideBaseDir() {
        FileIO io = new FileIO(tmp.resolve("base"));

        assertEquals(io.baseDir().resolve("a/b.json"), io.resolve("a/b.json"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve("../escape.json"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve(tmp.toAbsolutePath().toString()));
        assertTrue(Files.isDirectory(tmp.resolve("base")));
    }

    @Test
    void externalPathsOnlyNormalize() {
        FileIO io = new FileIO(tmp.resolve("base"));
        assertEquals(tmp.resolve("dict.tsv").toAbsolutePath().normalize(), io.resolveExternal("../dict.tsv"));
    }

    @Test
    void atomicWriteLeavesNoTempFile() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = io.resolve("out/doc.json");

        io.writeString(file, "ăîșț");
        io.writeString(file, "{}");

        assertEquals("{}", io.readString(file));
        assertFalse(Files.exists(tmp.resolve("out/doc.json.tmp")));
    }

    @Test
    void jsonlSkipsBlankLines() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = io.resolve("events.jsonl");

        io.appendJsonl(file, "{\"a\":1}");
        io.appendJsonl(file, "   ");
        io.appendLine(file, "");
        io.appendJsonl(file, "  {\"a\":2}  ");

        assertEquals(List.of("{\"a\":1}", "{\"a\":2}"), io.readJsonl(file));
    }

    @Test
    void gzipIsReadTransparently() throws Exception {
        FileIO io = new FileIO(tmp);
        Path gz = tmp.resolve("words.tsv.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(gz))) {
            out.write("entry_word\nmunte\n".getBytes(StandardCharsets.UTF_8));
        }

        assertEquals("entry_word\nmunte\n", io.readString(gz));
        try (BufferedReader r = io.openReader(gz)) {
            assertEquals("entry_word", r.readLine());
            assertEquals("munte", r.readLine());
        }
    }

    @Test
    void rollbackDropsUncommittedContent() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = io.resolve("cache.jsonl");
        io.writeString(file, "old");

        FileIO.WriterHandle h = io.openWriter(file);
        h.writer.write("new");
        io.rollback(h);
        assertEquals("old", io.readString(file));
        assertFalse(Files.exists(h.tmpFile));

        FileIO.WriterHandle h2 = io.openWriter(file);
        h2.writer.write("new");
        io.commit(h2);
        assertEquals("new", io.readString(file));
    }
}

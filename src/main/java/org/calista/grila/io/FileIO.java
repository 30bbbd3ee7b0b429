package org.calista.grila.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * FileIO — единая точка I/O для словарей, конфигов и выходных документов.
 *
 * <ul>
 *   <li>sandboxed resolve внутри baseDir (anti path traversal)</li>
 *   <li>атомарная запись: temp sibling + move, опционально fsync</li>
 *   <li>прозрачное чтение .gz словарей</li>
 *   <li>JSONL helpers для журнала событий и кэша словаря</li>
 * </ul>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    // ----------------------------
    // Options / Builder
    // ----------------------------

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean fsyncOnCommit;

        private Options(Builder b) {
            this.charset = b.charset;
            this.atomicWrites = b.atomicWrites;
            this.fsyncOnCommit = b.fsyncOnCommit;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean fsyncOnCommit = false;

            public Builder charset(Charset v) {
                this.charset = Objects.requireNonNull(v, "charset");
                return this;
            }

            public Builder atomicWrites(boolean v) {
                this.atomicWrites = v;
                return this;
            }

            public Builder fsyncOnCommit(boolean v) {
                this.fsyncOnCommit = v;
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }

    private final Path baseDir;
    private final Options opt;

    public FileIO(Path baseDir) {
        this(baseDir, Options.builder().build());
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this(baseDir, Options.builder()
                .charset(Objects.requireNonNull(charset, "charset"))
                .atomicWrites(atomicWrites)
                .build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, fsyncOnCommit={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.fsyncOnCommit);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists: " + this.baseDir, e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    public Options options() {
        return opt;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Резолвит относительный путь внутри baseDir. Абсолютные пути и выход через ".." запрещены.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    /**
     * Внешние пути (словарь может лежать вне sandbox): относительные считаются от baseDir, только нормализация.
     */
    public Path resolveExternal(String anyPath) {
        Objects.requireNonNull(anyPath, "anyPath");
        Path p = Paths.get(anyPath);
        if (!p.isAbsolute()) p = baseDir.resolve(p);
        return p.toAbsolutePath().normalize();
    }

    public void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (isGzip(file)) {
            try (InputStream in = openInputStream(file)) {
                return new String(in.readAllBytes(), opt.charset);
            }
        }
        return Files.readString(file, opt.charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            Files.writeString(file, content, opt.charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return;
        }

        Path tmp = tempSibling(file);
        Files.writeString(tmp, content, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        atomicCommit(tmp, file);
    }

    public synchronized void appendLine(Path file, String line) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(line, "line");
        ensureParentDir(file);
        Files.writeString(file, line + System.lineSeparator(), opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    /**
     * Reader for a text file; .gz/.gzip are decompressed on the fly. Caller closes.
     */
    public BufferedReader openReader(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return new BufferedReader(new InputStreamReader(openInputStream(file), opt.charset));
    }

    // ----------------------------
    // JSONL helpers
    // ----------------------------

    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) return;
        appendLine(file, s);
    }

    public List<String> readJsonl(Path file) throws IOException {
        try (Stream<String> s = jsonlStream(file)) {
            return s.collect(Collectors.toList());
        }
    }

    /**
     * JSONL records (trim + skip empty). The stream must be closed.
     */
    public Stream<String> jsonlStream(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        BufferedReader br = openReader(file);
        return br.lines()
                .onClose(() -> {
                    try {
                        br.close();
                    } catch (IOException e) {
                        log.warn("Failed to close reader for {}: {}", file, e.toString());
                    }
                })
                .map(x -> x == null ? "" : x.trim())
                .filter(x -> !x.isEmpty());
    }

    // ----------------------------
    // Safe Writer API
    // ----------------------------

    /**
     * atomicWrites=true: пишет во временный файл, target заменяется только в {@link #commit(WriterHandle)}.
     */
    public WriterHandle openWriter(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            BufferedWriter w = Files.newBufferedWriter(file, opt.charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return new WriterHandle(file, null, w);
        }

        Path tmp = tempSibling(file);
        BufferedWriter w = Files.newBufferedWriter(tmp, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return new WriterHandle(file, tmp, w);
    }

    public void commit(WriterHandle h) throws IOException {
        Objects.requireNonNull(h, "handle");
        h.writer.close();
        if (h.tmpFile != null) atomicCommit(h.tmpFile, h.targetFile);
    }

    public void rollback(WriterHandle h) {
        if (h == null) return;
        try {
            h.writer.close();
        } catch (IOException e) {
            log.debug("rollback: close failed for {}: {}", h.targetFile, e.toString());
        }
        if (h.tmpFile != null) {
            try {
                Files.deleteIfExists(h.tmpFile);
            } catch (IOException e) {
                log.warn("rollback: failed to delete tmp {}", h.tmpFile, e);
            }
        }
    }

    public static final class WriterHandle {
        public final Path targetFile;
        public final Path tmpFile; // null если не atomicWrites
        public final BufferedWriter writer;

        private WriterHandle(Path targetFile, Path tmpFile, BufferedWriter writer) {
            this.targetFile = targetFile;
            this.tmpFile = tmpFile;
            this.writer = writer;
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static Path tempSibling(Path target) {
        return target.resolveSibling(target.getFileName().toString() + ".tmp");
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        if (opt.fsyncOnCommit) fsyncFile(tmp);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (non-atomic fallback)", tmp, target);
        }
    }

    private void fsyncFile(Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsyncFile ignored for {}: {}", file, e.toString());
        }
    }

    private static boolean isGzip(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".gz") || name.endsWith(".gzip");
    }

    private static InputStream openInputStream(Path file) throws IOException {
        if (isGzip(file)) return new GZIPInputStream(Files.newInputStream(file));
        return Files.newInputStream(file);
    }
}

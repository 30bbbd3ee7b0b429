package org.calista.grila.crossword.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.grila.crossword.dictionary.DictionaryLoader;
import org.calista.grila.crossword.dictionary.ProcessedDictionaryStore;
import org.calista.grila.crossword.dictionary.RomanianWordNormalizer;
import org.calista.grila.crossword.dictionary.WordIndex;
import org.calista.grila.crossword.events.EventStore;
import org.calista.grila.crossword.generate.CrosswordGenerator;
import org.calista.grila.crossword.generate.GenerationListener;
import org.calista.grila.crossword.generate.GenerationSettings;
import org.calista.grila.crossword.model.CpSatSolver;
import org.calista.grila.crossword.store.CrosswordDocumentStore;
import org.calista.grila.crossword.theme.BucketThemeWordProvider;
import org.calista.grila.crossword.theme.DictionaryThemeWordProvider;
import org.calista.grila.crossword.theme.ThemeWordMerger;
import org.calista.grila.crossword.theme.ThemeWordProvider;
import org.calista.grila.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * GrilaKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(config)  -> loadOrCreate config + init IO/stores (NO dictionary load)
 *   2) bootstrap()    -> load the dictionary index (explicit, controllable)
 *   3) use            -> newGenerator(...)
 *   4) close()
 */
public final class GrilaKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GrilaKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final GrilaConfig cfg;

    private final EventStore events;
    private final CrosswordDocumentStore documents;

    private volatile WordIndex index;

    private GrilaKernel(FileIO io, ObjectMapper mapper, GrilaConfig cfg, EventStore events,
                        CrosswordDocumentStore documents, WordIndex index) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.events = Objects.requireNonNull(events, "events");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.index = index; // nullable until bootstrap
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /** Config is read BEFORE baseDir is known (baseDir is inside config). */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private WordIndex index;
        private Clock clock;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Pre-built index; bootstrap() becomes a no-op. */
        public Builder index(WordIndex index) {
            this.index = Objects.requireNonNull(index, "index");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public GrilaKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            GrilaConfig cfg = GrilaConfig.loadOrCreate(external, cfgPath, om);

            // relative baseDir lives next to the config root
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base, charset, true);
            io.ensureBaseDir();

            EventStore events = new EventStore(io, om, io.resolve(cfg.output.eventsFile));
            CrosswordDocumentStore documents = new CrosswordDocumentStore(io, om, cfg.output.crosswordsDir, clock);

            GrilaKernel k = new GrilaKernel(io, om, cfg, events, documents, index);
            log.info("GrilaKernel created: config={}, baseDir={}, dictionary={}",
                    cfgPath, io.baseDir(), index != null ? "<injected>" : "<not loaded>");
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Bootstrap (explicit)
    // ---------------------------------------------------------------------

    /**
     * Loads the dictionary index. Repeated calls are no-ops.
     */
    public synchronized void bootstrap() throws IOException {
        if (index != null) return;

        Path source = io.resolveExternal(cfg.dictionary.path);
        Path cache = cfg.dictionary.processedCache == null ? null : io.resolve(cfg.dictionary.processedCache);
        DictionaryLoader loader = new DictionaryLoader(io, RomanianWordNormalizer.INSTANCE, new ProcessedDictionaryStore(io, mapper));
        DictionaryLoader.Result result = loader.load(source, cache, cfg.loaderConfig());
        index = result.index;

        log.info("GrilaKernel bootstrap done: dictionary={}, entries={}, fromCache={}",
                result.report.file, result.report.kept, result.report.fromCache);
    }

    public boolean isBootstrapped() {
        return index != null;
    }

    // ---------------------------------------------------------------------
    // Composition
    // ---------------------------------------------------------------------

    /**
     * Sequential generator wired from config: dictionary themes (optional) + buckets, template clues,
     * CP-SAT solver.
     */
    public CrosswordGenerator newGenerator(GenerationListener listener) {
        WordIndex idx = index();
        GenerationSettings settings = cfg.generationSettings();
        long seed = settings.seed != null ? settings.seed : System.currentTimeMillis();
        settings.seed = seed;

        List<ThemeWordProvider> fallbacks = new ArrayList<>();
        fallbacks.add(new BucketThemeWordProvider(seed));
        ThemeWordProvider primary = cfg.generation.dictionaryThemes ? new DictionaryThemeWordProvider(idx) : null;

        return CrosswordGenerator.builder(idx, settings)
                .themeWords(new ThemeWordMerger(primary, fallbacks, idx.normalizer()))
                .solver(new CpSatSolver(cfg.solverConfig()))
                .listener(listener == null ? GenerationListener.NOOP : listener)
                .build();
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public GrilaConfig config() { return cfg; }
    public EventStore eventStore() { return events; }
    public CrosswordDocumentStore documentStore() { return documents; }

    public WordIndex index() {
        WordIndex idx = index;
        if (idx == null) throw new IllegalStateException("GrilaKernel not bootstrapped: dictionary not loaded");
        return idx;
    }

    @Override
    public void close() {
        // nothing owned beyond the heap; generators and pools are closed by their callers
        log.debug("GrilaKernel closed");
    }
}

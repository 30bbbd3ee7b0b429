package org.calista.grila.crossword.dictionary;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.io.FileIO;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * DictionaryLoader — raw TSV to {@link PositionalWordIndex}.
 *
 * <p>Pipeline: read rows (Jackson CSV, tab separated, header line) → normalize {@code entry_word} → group
 * inflected forms by surface (highest frequency row wins the metadata) → filter → cap per length → index.</p>
 *
 * <p>When a processed cache exists it is loaded instead of the TSV; otherwise the grouped entries are written
 * to the cache for the next run.</p>
 */
public final class DictionaryLoader {

    private static final Logger log = LogManager.getLogger(DictionaryLoader.class);

    public static final String COL_ENTRY_WORD = "entry_word";
    public static final String COL_LEMMA = "lemma";
    public static final String COL_DEFINITION = "definition";
    public static final String COL_FREQUENCY = "lexeme_frequency";
    public static final String COL_COMPOUND = "is_compound";
    public static final String COL_STOPWORD = "is_stopword";
    public static final String COL_DIFFICULTY = "difficulty_score";

    // =========================
    // Config
    // =========================

    public static final class Config {
        public int minLength = 2;
        public int maxLength = 24;
        public double minFrequency = 0.0;
        public boolean excludeStopwords = true;
        public boolean allowCompounds = false;
        /** 0 = unlimited. */
        public int maxEntriesPerLength = 0;
        public Difficulty difficulty = Difficulty.MEDIUM;

        public Config validate() {
            if (minLength < 1) minLength = 1;
            if (maxLength < minLength) maxLength = minLength;
            if (!Double.isFinite(minFrequency)) minFrequency = 0.0;
            if (maxEntriesPerLength < 0) maxEntriesPerLength = 0;
            if (difficulty == null) difficulty = Difficulty.MEDIUM;
            return this;
        }
    }

    private final FileIO io;
    private final WordNormalizer normalizer;
    private final ProcessedDictionaryStore cacheStore; // nullable => no cache

    public DictionaryLoader(FileIO io, WordNormalizer normalizer, ProcessedDictionaryStore cacheStore) {
        this.io = Objects.requireNonNull(io, "io");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.cacheStore = cacheStore;
    }

    /**
     * @param source         raw TSV (may be .gz)
     * @param processedCache JSONL cache path, {@code null} to skip caching
     */
    public Result load(Path source, Path processedCache, Config cfg) throws IOException {
        Objects.requireNonNull(source, "source");
        Config c = (cfg == null ? new Config() : cfg).validate();

        boolean useCache = cacheStore != null && processedCache != null;
        List<DictionaryEntry> grouped;
        boolean fromCache = false;

        if (useCache && io.exists(processedCache)) {
            grouped = cacheStore.load(processedCache);
            fromCache = true;
        } else {
            if (!io.exists(source)) throw new DictionaryLoadException("Missing dictionary TSV: " + source);
            grouped = preprocess(source);
            if (useCache) cacheStore.save(processedCache, grouped);
        }

        List<DictionaryEntry> kept = filter(grouped, c);
        if (kept.isEmpty()) {
            throw new DictionaryLoadException("Dictionary has no usable entries after filtering: " + source);
        }

        PositionalWordIndex index = PositionalWordIndex.builder()
                .difficulty(c.difficulty)
                .normalizer(normalizer)
                .addAll(kept)
                .build();

        Report report = new Report(fromCache ? processedCache : source, grouped.size(), kept.size(), fromCache);
        log.info("Dictionary loaded: {} (surfaces={}, kept={}, cache={})",
                report.file, report.surfaces, report.kept, report.fromCache);
        return new Result(index, report);
    }

    /**
     * Groups raw rows by normalized surface. Output sorted by surface.
     */
    public List<DictionaryEntry> preprocess(Path source) throws IOException {
        Map<String, Group> groups = new TreeMap<>();
        int rows = 0, skipped = 0;

        CsvMapper csv = new CsvMapper();
        CsvSchema schema = CsvSchema.emptySchema()
                .withHeader()
                .withColumnSeparator('\t')
                .withoutQuoteChar();

        try (BufferedReader reader = io.openReader(source);
             MappingIterator<Map<String, String>> it = csv.readerFor(Map.class).with(schema).readValues(reader)) {
            while (it.hasNextValue()) {
                Map<String, String> row = it.nextValue();
                rows++;

                String raw = trim(row.get(COL_ENTRY_WORD));
                String surface = normalizer.normalize(raw);
                if (surface.isEmpty()) {
                    skipped++;
                    continue;
                }

                groups.computeIfAbsent(surface, Group::new).merge(
                        raw,
                        trim(row.get(COL_LEMMA)),
                        trim(row.get(COL_DEFINITION)),
                        parseDouble(row.get(COL_FREQUENCY)),
                        parseDouble(row.get(COL_DIFFICULTY)),
                        parseBool(row.get(COL_COMPOUND)),
                        parseBool(row.get(COL_STOPWORD)));
            }
        } catch (RuntimeException e) {
            throw new DictionaryLoadException("Failed to parse dictionary TSV " + source + ": " + e.getMessage(), e);
        }

        List<DictionaryEntry> out = new ArrayList<>(groups.size());
        for (Group g : groups.values()) out.add(g.toEntry());

        log.debug("Preprocessed {}: rows={}, skipped={}, surfaces={}", source, rows, skipped, out.size());
        return out;
    }

    List<DictionaryEntry> filter(List<DictionaryEntry> all, Config c) {
        Map<Integer, List<DictionaryEntry>> byLength = new TreeMap<>();
        for (DictionaryEntry e : all) {
            if (e.length() < c.minLength || e.length() > c.maxLength) continue;
            if (e.frequency() < c.minFrequency) continue;
            if (c.excludeStopwords && e.isStopword()) continue;
            if (e.isCompound() && !c.allowCompounds) continue;
            byLength.computeIfAbsent(e.length(), k -> new ArrayList<>()).add(e);
        }

        List<DictionaryEntry> out = new ArrayList<>();
        for (List<DictionaryEntry> bucket : byLength.values()) {
            if (c.maxEntriesPerLength > 0 && bucket.size() > c.maxEntriesPerLength) {
                bucket.sort(Comparator.comparingDouble((DictionaryEntry e) -> -e.score(c.difficulty))
                        .thenComparing(DictionaryEntry::surface));
                out.addAll(bucket.subList(0, c.maxEntriesPerLength));
            } else {
                out.addAll(bucket);
            }
        }
        return out;
    }

    // =========================
    // Parsing helpers
    // =========================

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }

    private static double parseDouble(String s) {
        if (s == null || s.isBlank()) return 0.0;
        try {
            double v = Double.parseDouble(s.trim());
            return Double.isFinite(v) ? v : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static boolean parseBool(String s) {
        if (s == null) return false;
        String v = s.trim().toLowerCase(Locale.ROOT);
        return v.equals("1") || v.equals("true") || v.equals("yes");
    }

    private static final class Group {
        final String surface;
        final Set<String> rawForms = new TreeSet<>();
        String lemma = "";
        String definition = "";
        double frequency = 0.0;
        double difficultyScore = 0.0;
        boolean compound;
        boolean stopword;
        boolean seeded;

        Group(String surface) {
            this.surface = surface;
        }

        void merge(String raw, String lemma, String definition, double frequency, double difficultyScore,
                   boolean compound, boolean stopword) {
            if (!raw.isEmpty()) rawForms.add(raw);
            this.compound |= compound;
            this.stopword |= stopword;
            if (!seeded || frequency > this.frequency) {
                this.frequency = frequency;
                this.lemma = lemma;
                this.definition = definition;
                this.difficultyScore = difficultyScore;
                seeded = true;
            }
        }

        DictionaryEntry toEntry() {
            return new DictionaryEntry(surface, lemma, definition, frequency, difficultyScore,
                    compound, stopword, rawForms);
        }
    }

    // =========================
    // Result / Report
    // =========================

    public static final class Result {
        public final PositionalWordIndex index;
        public final Report report;

        public Result(PositionalWordIndex index, Report report) {
            this.index = index;
            this.report = report;
        }
    }

    public static final class Report {
        public final Path file;
        public final int surfaces;
        public final int kept;
        public final boolean fromCache;

        public Report(Path file, int surfaces, int kept, boolean fromCache) {
            this.file = file;
            this.surfaces = surfaces;
            this.kept = kept;
            this.fromCache = fromCache;
        }
    }
}

package org.calista.grila.crossword.dictionary;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * PositionalWordIndex — per-length positional index {@code (position, letter) -> surfaces}.
 *
 * <p>
 * Цели:
 * - lookup = пересечение множеств по известным позициям, от самого маленького, с ранним выходом на пустом
 * - стоимость ограничена самым селективным ограничением, а не размером словаря
 * - детерминизм ранжирования (score desc, tie-break by surface)
 * - immutable после build(): безопасно делится между параллельными попытками
 * </p>
 */
public final class PositionalWordIndex implements WordIndex {

    private static final Logger log = LogManager.getLogger(PositionalWordIndex.class);

    private static final double PREFERRED_BOOST = 1.4;

    private final Map<String, DictionaryEntry> bySurface;
    private final Map<Integer, LengthBucket> byLength;
    private final Difficulty difficulty;
    private final WordNormalizer normalizer;

    /** keyword -> ranked matches; the only mutable state, filled lazily. */
    private final Map<String, List<DictionaryEntry>> themeCache = new ConcurrentHashMap<>();

    private PositionalWordIndex(Builder b) {
        this.difficulty = b.difficulty;
        this.normalizer = b.normalizer;

        Map<String, DictionaryEntry> surfaces = new HashMap<>(b.entries.size() * 2);
        Map<Integer, LengthBucket> lengths = new TreeMap<>();
        for (DictionaryEntry e : b.entries.values()) {
            surfaces.put(e.surface(), e);
            lengths.computeIfAbsent(e.length(), LengthBucket::new).add(e.surface());
        }
        for (LengthBucket bucket : lengths.values()) bucket.freeze();

        this.bySurface = Collections.unmodifiableMap(surfaces);
        this.byLength = Collections.unmodifiableMap(lengths);

        log.debug("PositionalWordIndex built: entries={}, lengths={}, difficulty={}",
                bySurface.size(), byLength.keySet(), difficulty);
    }

    public static Builder builder() {
        return new Builder();
    }

    // =========================
    // Lookup
    // =========================

    @Override
    public List<DictionaryEntry> findCandidates(CandidateQuery query) {
        Objects.requireNonNull(query, "query");

        Set<String> matching = lookup(query.length(), query.pattern());
        if (matching.isEmpty()) return List.of();

        Set<String> preferred = query.preferred();
        Set<String> banned = query.banned();

        List<DictionaryEntry> entries = new ArrayList<>(matching.size());
        for (String s : matching) {
            if (banned.contains(s)) continue;
            DictionaryEntry e = bySurface.get(s);
            if (e != null) entries.add(e);
        }

        Map<String, Double> scores = new HashMap<>(entries.size() * 2);
        for (DictionaryEntry e : entries) {
            double sc = e.score(difficulty);
            if (preferred.contains(e.surface())) sc *= PREFERRED_BOOST;
            scores.put(e.surface(), sc);
        }
        entries.sort(rankBy(scores));

        int limit = query.limit();
        double fraction = query.fallbackFraction();
        if (fraction <= 0.0 || difficulty == Difficulty.MEDIUM) {
            return entries.size() <= limit ? entries : new ArrayList<>(entries.subList(0, limit));
        }

        // backup pool: part of the limit goes to the best MEDIUM-ranked words outside the primary cut
        int fallbackN = Math.max(1, (int) Math.round(limit * fraction));
        int primaryN = Math.max(0, limit - fallbackN);

        List<DictionaryEntry> out = new ArrayList<>(Math.min(limit, entries.size()));
        out.addAll(entries.subList(0, Math.min(primaryN, entries.size())));

        if (entries.size() > primaryN) {
            List<DictionaryEntry> rest = new ArrayList<>(entries.subList(primaryN, entries.size()));
            Map<String, Double> medium = new HashMap<>(rest.size() * 2);
            for (DictionaryEntry e : rest) medium.put(e.surface(), e.score(Difficulty.MEDIUM));
            rest.sort(rankBy(medium));
            out.addAll(rest.subList(0, Math.min(fallbackN, rest.size())));
        }
        return out;
    }

    @Override
    public Set<String> matchingSurfaces(int length, List<Character> pattern) {
        return Collections.unmodifiableSet(lookup(length, pattern));
    }

    @Override
    public boolean hasCandidates(int length, List<Character> pattern, Collection<String> banned) {
        return countCandidates(length, pattern, banned) > 0;
    }

    @Override
    public int countCandidates(int length, List<Character> pattern, Collection<String> banned) {
        LengthBucket bucket = byLength.get(length);
        if (bucket == null) return 0;

        List<Set<String>> constraints = bucket.constraints(pattern);
        if (constraints == null) return 0;

        Set<String> matching;
        if (constraints.isEmpty()) {
            matching = bucket.surfaces;
        } else if (constraints.size() == 1) {
            matching = constraints.get(0);
        } else {
            matching = intersect(constraints);
        }

        int n = matching.size();
        if (n == 0 || banned == null || banned.isEmpty()) return n;
        for (String b : (banned instanceof Set ? banned : new HashSet<>(banned))) {
            if (b != null && b.length() == length && matching.contains(b)) n--;
        }
        return n;
    }

    @Override
    public boolean contains(String word) {
        if (word == null) return false;
        return bySurface.containsKey(normalizer.normalize(word));
    }

    @Override
    public Optional<DictionaryEntry> get(String word) {
        if (word == null) return Optional.empty();
        return Optional.ofNullable(bySurface.get(normalizer.normalize(word)));
    }

    @Override
    public List<DictionaryEntry> themeCandidates(String keyword, int limit) {
        if (keyword == null) return List.of();
        String key = keyword.trim().toLowerCase(Locale.ROOT);
        if (key.isEmpty()) return List.of();

        List<DictionaryEntry> ranked = themeCache.computeIfAbsent(key, this::scanTheme);
        int n = Math.max(0, Math.min(limit, ranked.size()));
        return ranked.subList(0, n);
    }

    @Override
    public WordNormalizer normalizer() { return normalizer; }

    @Override
    public Difficulty difficulty() { return difficulty; }

    @Override
    public int size() { return bySurface.size(); }

    @Override
    public Set<Integer> lengths() { return byLength.keySet(); }

    // =========================
    // Internals
    // =========================

    /** Mutable result; callers never see the bucket's own sets. */
    private Set<String> lookup(int length, List<Character> pattern) {
        LengthBucket bucket = byLength.get(length);
        if (bucket == null) return new HashSet<>();

        List<Set<String>> constraints = bucket.constraints(pattern);
        if (constraints == null) return new HashSet<>();
        if (constraints.isEmpty()) return new HashSet<>(bucket.surfaces);
        return intersect(constraints);
    }

    private static Set<String> intersect(List<Set<String>> constraints) {
        constraints.sort(Comparator.comparingInt(Set::size));
        Set<String> result = new HashSet<>(constraints.get(0));
        for (int i = 1; i < constraints.size() && !result.isEmpty(); i++) {
            result.retainAll(constraints.get(i));
        }
        return result;
    }

    private List<DictionaryEntry> scanTheme(String key) {
        List<DictionaryEntry> matches = new ArrayList<>();
        Map<String, Double> scores = new HashMap<>();
        for (DictionaryEntry e : bySurface.values()) {
            String haystack = (e.definition() + " " + e.lemma()).toLowerCase(Locale.ROOT);
            if (haystack.contains(key)) {
                matches.add(e);
                scores.put(e.surface(), e.score(difficulty));
            }
        }
        matches.sort(rankBy(scores));
        return Collections.unmodifiableList(matches);
    }

    private static Comparator<DictionaryEntry> rankBy(Map<String, Double> scores) {
        return (a, b) -> {
            int c = Double.compare(scores.get(b.surface()), scores.get(a.surface()));
            if (c != 0) return c;
            return a.surface().compareTo(b.surface());
        };
    }

    private static final class LengthBucket {
        final int length;
        Set<String> surfaces = new HashSet<>();
        Map<Integer, Set<String>> positional = new HashMap<>();

        LengthBucket(int length) {
            this.length = length;
        }

        void add(String surface) {
            surfaces.add(surface);
            for (int pos = 0; pos < surface.length(); pos++) {
                positional.computeIfAbsent(key(pos, surface.charAt(pos)), k -> new HashSet<>()).add(surface);
            }
        }

        void freeze() {
            surfaces = Collections.unmodifiableSet(surfaces);
            Map<Integer, Set<String>> frozen = new HashMap<>(positional.size() * 2);
            for (Map.Entry<Integer, Set<String>> e : positional.entrySet()) {
                frozen.put(e.getKey(), Collections.unmodifiableSet(e.getValue()));
            }
            positional = Collections.unmodifiableMap(frozen);
        }

        /**
         * @return sets to intersect; empty list = unconstrained; {@code null} = some position can never match
         */
        List<Set<String>> constraints(List<Character> pattern) {
            if (pattern == null) return new ArrayList<>();
            if (pattern.size() != length) {
                throw new IllegalArgumentException("pattern size " + pattern.size() + " != length " + length);
            }
            List<Set<String>> out = new ArrayList<>();
            for (int pos = 0; pos < pattern.size(); pos++) {
                Character ch = pattern.get(pos);
                if (ch == null) continue;
                Set<String> set = positional.get(key(pos, Character.toUpperCase(ch)));
                if (set == null) return null;
                out.add(set);
            }
            return out;
        }

        private static int key(int pos, char letter) {
            return (pos << 16) | letter;
        }
    }

    // =========================
    // Builder
    // =========================

    public static final class Builder {
        private final Map<String, DictionaryEntry> entries = new LinkedHashMap<>();
        private Difficulty difficulty = Difficulty.MEDIUM;
        private WordNormalizer normalizer = RomanianWordNormalizer.INSTANCE;

        public Builder difficulty(Difficulty difficulty) {
            this.difficulty = Objects.requireNonNull(difficulty, "difficulty");
            return this;
        }

        public Builder normalizer(WordNormalizer normalizer) {
            this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
            return this;
        }

        /** Later entries with the same surface replace earlier ones. */
        public Builder add(DictionaryEntry entry) {
            Objects.requireNonNull(entry, "entry");
            for (int i = 0; i < entry.surface().length(); i++) {
                char ch = entry.surface().charAt(i);
                if (ch < 'A' || ch > 'Z') {
                    throw new IllegalArgumentException("surface must be uppercase A-Z: " + entry.surface());
                }
            }
            entries.put(entry.surface(), entry);
            return this;
        }

        public Builder addAll(Collection<DictionaryEntry> all) {
            for (DictionaryEntry e : all) add(e);
            return this;
        }

        /** Convenience for fixtures: plain words with neutral metadata. */
        public Builder addWords(String... words) {
            for (String w : words) {
                String s = normalizer.normalize(w);
                if (!s.isEmpty()) add(DictionaryEntry.of(s, 0.5, 0.45));
            }
            return this;
        }

        public PositionalWordIndex build() {
            return new PositionalWordIndex(this);
        }
    }
}

package org.calista.grila.crossword.theme;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.dictionary.Difficulty;

import java.util.*;

/**
 * BucketThemeWordProvider — offline provider over fixed word buckets per theme and tier.
 *
 * <p>
 * Сначала слова своего уровня сложности, затем остальных; обе группы перемешиваются
 * RNG, созданным из seed на каждый вызов: generate() чистая функция, один seed даёт один и тот же список.
 * Попытки генерации получают свой экземпляр через {@link #forAttempt(long)}. Неизвестная тема -> общий резервный набор.
 * </p>
 */
public final class BucketThemeWordProvider implements ThemeWordProvider {

    private static final Logger log = LogManager.getLogger(BucketThemeWordProvider.class);

    public static final String SOURCE = "bucket";

    private static final Map<String, Map<Difficulty, List<String>>> DEFAULT_BUCKETS = defaultBuckets();

    private static final Map<Difficulty, List<String>> FALLBACK_BUCKET = tiers(
            List.of("ROMA", "DUNARE", "SOLAR", "VIATA", "LUMEA", "PIATA", "PORT", "CETATE"),
            List.of("CARPA", "RITUAL", "LEGAT", "CLIPA", "CAMPIE", "RAZBOI", "ACORD"),
            List.of("PATRU", "POD", "CLASA", "COLINA"));

    private final Map<String, Map<Difficulty, List<String>>> buckets;
    private final long seed;

    public BucketThemeWordProvider(long seed) {
        this(DEFAULT_BUCKETS, seed);
    }

    /**
     * @param buckets theme key (lowercase) -> tier -> words; words are uppercased, blanks dropped
     */
    public BucketThemeWordProvider(Map<String, Map<Difficulty, List<String>>> buckets, long seed) {
        Objects.requireNonNull(buckets, "buckets");
        Map<String, Map<Difficulty, List<String>>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<Difficulty, List<String>>> e : buckets.entrySet()) {
            Map<Difficulty, List<String>> tiers = new EnumMap<>(Difficulty.class);
            for (Map.Entry<Difficulty, List<String>> t : e.getValue().entrySet()) {
                List<String> words = new ArrayList<>();
                for (String w : t.getValue()) {
                    if (w != null && !w.isBlank()) words.add(w.trim().toUpperCase(Locale.ROOT));
                }
                tiers.put(t.getKey(), words);
            }
            copy.put(e.getKey().trim().toLowerCase(Locale.ROOT), tiers);
        }
        this.buckets = copy;
        this.seed = seed;
    }

    private BucketThemeWordProvider(long seed, Map<String, Map<Difficulty, List<String>>> normalized) {
        this.buckets = normalized;
        this.seed = seed;
    }

    /** Same buckets, shuffled by a seed mixed from this provider's seed and {@code attemptSeed}. */
    @Override
    public ThemeWordProvider forAttempt(long attemptSeed) {
        return new BucketThemeWordProvider(seed * 31L + attemptSeed, buckets);
    }

    public Set<String> themes() {
        return Collections.unmodifiableSet(buckets.keySet());
    }

    @Override
    public List<ThemeWord> generate(String theme, int limit, Difficulty difficulty, String language) {
        String key = theme == null ? "" : theme.trim().toLowerCase(Locale.ROOT);
        Difficulty tier = difficulty == null ? Difficulty.MEDIUM : difficulty;
        Map<Difficulty, List<String>> tierMap = buckets.getOrDefault(key, FALLBACK_BUCKET);

        List<String> onTier = new ArrayList<>(tierMap.getOrDefault(tier, List.of()));
        List<String> offTier = new ArrayList<>();
        for (Map.Entry<Difficulty, List<String>> e : tierMap.entrySet()) {
            if (e.getKey() != tier) offTier.addAll(e.getValue());
        }
        Random rng = new Random(seed);
        Collections.shuffle(onTier, rng);
        Collections.shuffle(offTier, rng);

        List<String> combined = new ArrayList<>(onTier);
        combined.addAll(offTier);
        if (combined.isEmpty()) {
            for (List<String> words : FALLBACK_BUCKET.values()) combined.addAll(words);
        }

        String label = key.isEmpty() ? "tema" : theme.trim();
        List<ThemeWord> out = new ArrayList<>();
        for (String word : combined) {
            if (out.size() >= Math.max(0, limit)) break;
            out.add(new ThemeWord(word, "Rezerva " + label + ": " + word.toLowerCase(Locale.ROOT), SOURCE));
        }
        log.info("Bucket provider produced {} theme words (theme={}, tier={})", out.size(), label, tier);
        return out;
    }

    @Override
    public String name() {
        return SOURCE;
    }

    // ---------------------------------------------------------------------
    // Defaults
    // ---------------------------------------------------------------------

    private static Map<String, Map<Difficulty, List<String>>> defaultBuckets() {
        Map<String, Map<Difficulty, List<String>>> m = new LinkedHashMap<>();
        m.put("mitologie", tiers(
                List.of("APOLON", "ARES", "ATHENA", "HERA", "IRIS", "HERMES", "ODIN", "THOR", "DIANA", "EROS",
                        "AURORA", "TITAN", "ATLAS", "PAN", "ZEUS", "POSEIDON", "ISIS", "RA"),
                List.of("ANUBIS", "FREIA", "MINERVA", "CERES", "NEMESIS", "HELIOS", "SIRENA", "FAUN", "OSIRIS",
                        "DEMETER", "JANUS", "BALDER", "TETHYS"),
                List.of("HESTIA", "SATIR", "EOL", "MORPHEU", "ORACOL", "NEREIDA", "LIBER", "CHARON", "ERINIE",
                        "HYPERION", "PROTEU")));
        m.put("istorie", tiers(
                List.of("REGAT", "ARMATA", "REGE", "PATRIA", "SENAT", "FORT", "OPERA", "PACT", "COLONIE",
                        "CRONICA", "STEAG", "SCUT", "HARTA", "CRUCE"),
                List.of("LEGIE", "TRON", "VOIEVOD", "ARHIVA", "ARMURA", "CANON", "DOMNIE", "TRIBUT", "LEGAT",
                        "TABELA", "DINASTIE", "HERALD", "ARMISTITIU", "CRONOGRAF"),
                List.of("CRONIC", "CASTRA", "ARCA", "DICTUM", "RELICVA", "PORTIC", "CRONICAR", "EDICT",
                        "SIGILIU", "PAPIRUS", "PALIMPSEST", "TRIREMA")));
        m.put("natura", tiers(
                List.of("MUNTE", "BRAD", "LUP", "CERB", "PLOAIE", "CAMP", "IARBA", "PAMANT", "OCEAN", "DELTA",
                        "FRUNZA", "LAC", "NISIP", "VANT", "RAPITA"),
                List.of("CODRU", "IZVOR", "STANCA", "LUNCA", "PODIS", "OGOR", "APUS", "CASCADA", "FAG",
                        "AURORA", "DESERT", "GROTA", "PENINSULA", "ECOSISTEM"),
                List.of("RAPID", "VALURI", "ALBIA", "MOLID", "RACHIT", "SIRET", "TRESTIE", "PRAFUL", "ARIN",
                        "GORUN", "ESTUAR", "ZADA", "LIMAN")));
        return Collections.unmodifiableMap(m);
    }

    private static Map<Difficulty, List<String>> tiers(List<String> easy, List<String> medium, List<String> hard) {
        Map<Difficulty, List<String>> m = new EnumMap<>(Difficulty.class);
        m.put(Difficulty.EASY, easy);
        m.put(Difficulty.MEDIUM, medium);
        m.put(Difficulty.HARD, hard);
        return Collections.unmodifiableMap(m);
    }
}

package org.calista.grila.crossword.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.dictionary.CandidateQuery;
import org.calista.grila.crossword.dictionary.DictionaryEntry;
import org.calista.grila.crossword.dictionary.WordIndex;
import org.calista.grila.crossword.grid.*;

import java.util.*;

/**
 * ModelBuilder — translates unresolved slots into a {@link ConstraintModel}.
 *
 * <p>
 * Клетки с буквой: константы, пустые: переменные A..Z (одна переменная на клетку, общая для пересечений).
 * Слоты длины 3+ получают таблицу кандидатов из индекса (pattern + banned + потолок сложности),
 * слоты длины 2: все пары букв, совместимые с фиксированными.
 * </p>
 */
public final class ModelBuilder {

    private static final Logger log = LogManager.getLogger(ModelBuilder.class);

    // =========================
    // Config
    // =========================

    public static final class Config {
        public int maxCandidates = 8000;
        public double fallbackFraction = 0.0;
        /** Keep only candidates with difficulty score below this; {@code null} = no ceiling. */
        public Double maxDifficultyScore = null;
        /**
         * With a ceiling: how many slots may fall back to their full pool when no candidate is below it.
         * {@code null} = none may.
         */
        public Integer mediumSlotLimit = null;

        public Config validate() {
            if (maxCandidates < 1) maxCandidates = 1;
            if (!Double.isFinite(fallbackFraction) || fallbackFraction < 0.0) fallbackFraction = 0.0;
            if (fallbackFraction > 1.0) fallbackFraction = 1.0;
            if (maxDifficultyScore != null && !Double.isFinite(maxDifficultyScore)) maxDifficultyScore = null;
            if (mediumSlotLimit != null && mediumSlotLimit < 0) mediumSlotLimit = 0;
            return this;
        }
    }

    private final WordIndex index;
    private final Config cfg;

    public ModelBuilder(WordIndex index, Config cfg) {
        this.index = Objects.requireNonNull(index, "index");
        this.cfg = (cfg == null ? new Config() : cfg).validate();
    }

    /**
     * @param runs       open runs to fill (length 2+)
     * @param usedWords  words already in the grid; excluded from candidates and forbidden per slot
     */
    public Result build(CrosswordGrid grid, List<SlotSignature> runs, Set<String> usedWords) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(runs, "runs");
        Set<String> used = usedWords == null ? Set.of() : usedWords;

        Map<GridPos, Integer> varIndex = new LinkedHashMap<>();
        List<ModelSlot> slots = new ArrayList<>(runs.size());
        List<TableConstraint> tables = new ArrayList<>();
        int mediumSlots = 0;

        for (SlotSignature run : runs) {
            Optional<GridPos> clueBox = grid.findLicensingClueBox(run.start(), run.direction());
            if (clueBox.isEmpty()) {
                return Result.failed("Slot " + run.key() + " has no licensing clue box");
            }

            List<Term> terms = new ArrayList<>(run.length());
            for (GridPos p : run.cells()) {
                Cell cell = grid.cell(p);
                if (cell.hasLetter()) {
                    terms.add(Term.constant(cell.letter()));
                } else {
                    Integer v = varIndex.get(p);
                    if (v == null) {
                        v = varIndex.size();
                        varIndex.put(p, v);
                    }
                    terms.add(Term.variable(v));
                }
            }
            List<Character> pattern = grid.pattern(run.cells());

            List<String> surfaces;
            if (run.length() >= 3) {
                List<DictionaryEntry> candidates = index.findCandidates(CandidateQuery.builder(run.length())
                        .pattern(pattern)
                        .banned(used)
                        .limit(cfg.maxCandidates)
                        .fallbackFraction(cfg.fallbackFraction)
                        .build());
                if (cfg.maxDifficultyScore != null) {
                    List<DictionaryEntry> easy = new ArrayList<>();
                    for (DictionaryEntry e : candidates) {
                        if (e.difficultyScore() < cfg.maxDifficultyScore) easy.add(e);
                    }
                    if (!easy.isEmpty()) {
                        candidates = easy;
                    } else if (!candidates.isEmpty()) {
                        mediumSlots++;
                        if (cfg.mediumSlotLimit == null || mediumSlots > cfg.mediumSlotLimit) {
                            return Result.failed("No candidates below difficulty " + cfg.maxDifficultyScore
                                    + " for " + run.key() + " (medium slots " + mediumSlots + ", limit " + cfg.mediumSlotLimit + ")");
                        }
                        log.debug("Slot {} falls back to its full pool ({}/{})", run.key(), mediumSlots, cfg.mediumSlotLimit);
                    }
                }
                surfaces = new ArrayList<>(candidates.size());
                for (DictionaryEntry e : candidates) surfaces.add(e.surface());
            } else {
                surfaces = twoLetterCandidates(pattern);
            }

            if (surfaces.isEmpty()) {
                return Result.failed("No candidates for slot " + run.key());
            }

            ModelSlot slot = new ModelSlot(run, clueBox.get(), terms, surfaces.size());
            slots.add(slot);
            if (slot.hasVariables()) tables.add(new TableConstraint(run.key(), terms, encode(surfaces)));
        }

        String infeasible = null;
        List<DifferenceConstraint> differences = new ArrayList<>();
        for (int i = 0; i < slots.size() && infeasible == null; i++) {
            for (int j = i + 1; j < slots.size(); j++) {
                ModelSlot a = slots.get(i), b = slots.get(j);
                if (a.length() != b.length()) continue;
                List<Term[]> pairs = Disjunction.differingPairs(a.terms(), b.terms());
                if (pairs == null) continue;
                if (pairs.isEmpty()) {
                    infeasible = "Slots " + a.key() + " and " + b.key() + " are fixed to the same word";
                    break;
                }
                differences.add(new DifferenceConstraint(a.key(), b.key(), pairs));
            }
        }

        List<ForbiddenWordConstraint> forbidden = new ArrayList<>();
        for (ModelSlot slot : slots) {
            if (infeasible != null) break;
            for (String word : used) {
                if (word.length() != slot.length()) continue;
                List<Term> wordTerms = new ArrayList<>(word.length());
                for (int k = 0; k < word.length(); k++) wordTerms.add(Term.constant(word.charAt(k)));
                List<Term[]> pairs = Disjunction.differingPairs(slot.terms(), wordTerms);
                if (pairs == null) continue;
                if (pairs.isEmpty()) {
                    infeasible = "Slot " + slot.key() + " is fixed to the placed word " + word;
                    break;
                }
                forbidden.add(new ForbiddenWordConstraint(slot.key(), word, pairs));
            }
        }

        ConstraintModel model = new ConstraintModel(new ArrayList<>(varIndex.keySet()), slots, tables,
                differences, forbidden, infeasible);
        log.debug("Model built: {}", model);
        return Result.ok(model);
    }

    /** All pairs over A..Z consistent with the fixed letters, in alphabetical order. */
    static List<String> twoLetterCandidates(List<Character> pattern) {
        List<String> out = new ArrayList<>();
        if (pattern == null || pattern.size() != 2) return out;
        for (char a = 'A'; a <= 'Z'; a++) {
            if (pattern.get(0) != null && pattern.get(0) != a) continue;
            for (char b = 'A'; b <= 'Z'; b++) {
                if (pattern.get(1) != null && pattern.get(1) != b) continue;
                out.add("" + a + b);
            }
        }
        return out;
    }

    private static List<int[]> encode(List<String> surfaces) {
        List<int[]> out = new ArrayList<>(surfaces.size());
        for (String s : surfaces) {
            int[] t = new int[s.length()];
            for (int i = 0; i < t.length; i++) t[i] = Term.encode(s.charAt(i));
            out.add(t);
        }
        return out;
    }

    // =========================
    // Result
    // =========================

    /**
     * Either a model or a retryable reason why none could be built.
     */
    public static final class Result {
        private final ConstraintModel model;
        private final String failure;

        private Result(ConstraintModel model, String failure) {
            this.model = model;
            this.failure = failure;
        }

        static Result ok(ConstraintModel model) {
            return new Result(model, null);
        }

        static Result failed(String reason) {
            log.debug("Model build failed: {}", reason);
            return new Result(null, reason);
        }

        public boolean isOk() { return model != null; }

        public ConstraintModel model() {
            if (model == null) throw new IllegalStateException("No model: " + failure);
            return model;
        }

        public String failure() { return failure; }
    }
}

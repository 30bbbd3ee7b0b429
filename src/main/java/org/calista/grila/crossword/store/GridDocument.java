package org.calista.grila.crossword.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.calista.grila.crossword.dictionary.DictionaryEntry;
import org.calista.grila.crossword.dictionary.WordIndex;
import org.calista.grila.crossword.generate.GenerationResult;
import org.calista.grila.crossword.generate.GenerationSettings;
import org.calista.grila.crossword.grid.*;
import org.calista.grila.crossword.theme.ThemeWord;

import java.util.*;

/**
 * Serialized crossword: frontend-ready grid state, slots, clues and stats.
 * Failed runs keep {@code error} and whatever partial state exists.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GridDocument {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";

    public String id;
    public String createdAt;
    public String status;
    public String error;
    public List<String> reasons = new ArrayList<>();

    public SettingsDoc config;
    public List<ThemeWord> themeWords = new ArrayList<>();
    public List<SlotDoc> slots = new ArrayList<>();
    public List<ClueDoc> clues = new ArrayList<>();
    public List<String> validation = new ArrayList<>();
    public Long seed;
    public Long gridSeed;
    public Integer attempt;

    /** Row-major; {@code null} when no grid was produced. */
    public List<List<CellDoc>> grid;
    public Stats stats;

    // =========================
    // Parts
    // =========================

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SettingsDoc {
        public int rows;
        public int cols;
        public String theme;
        public String difficulty;
        public String language;
        public Long seed;
        public double minThemeCoverage;
        public boolean blockerZone;

        static SettingsDoc of(GenerationSettings s) {
            SettingsDoc d = new SettingsDoc();
            d.rows = s.rows;
            d.cols = s.cols;
            d.theme = s.theme;
            d.difficulty = s.difficulty == null ? null : s.difficulty.name();
            d.language = s.language;
            d.seed = s.seed;
            d.minThemeCoverage = s.themePlacement == null ? 0.0 : s.themePlacement.minThemeCoverage;
            d.blockerZone = s.blockerZone;
            return d;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CellDoc {
        public String type;
        /** {@code null} unless LETTER. */
        public String letter;
        public List<ClueDoc> clues = new ArrayList<>();
        public List<String> slotIds = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SlotDoc {
        public String id;
        public int[] start;
        public String direction;
        public int length;
        public String text;
        public int[] clueBox;
        public boolean theme;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ClueDoc {
        public String id;
        public String text;
        public String slotId;
        public int solutionLength;
        public String direction;
        /** Hosting clue box; only set in the flat clue list. */
        public int[] clueBox;
        public int offsetRow;
        public int offsetCol;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Stats {
        public int rows;
        public int cols;
        public int totalCells;
        public int letterCells;
        public int clueBoxes;
        public int blockerCells;
        public int unfilledCells;

        public int totalSlots;
        public int words3plus;
        public int themeWords;
        public int fillWords;
        public int lengthMin;
        public int lengthMax;
        public double lengthAvg;
        public Map<String, Integer> lengthDistribution = new TreeMap<>();

        /** Omitted without a dictionary or scored fill words. */
        public DifficultyStats difficulty;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DifficultyStats {
        public double avgScore;
        public double avgFrequency;
        public int easyCount;
        public int mediumCount;
        public int hardCount;
        public String dictCoverage;
        public Double themeAvgScore;
    }

    // =========================
    // Factories
    // =========================

    public static GridDocument success(String id, String createdAt, GenerationResult result,
                                       GenerationSettings settings, WordIndex index) {
        GridDocument d = base(id, createdAt, STATUS_SUCCESS, settings);
        d.themeWords = new ArrayList<>(result.themeWords);
        d.slots = slots(result.slots);
        d.clues = flatClues(result.grid);
        d.validation = new ArrayList<>(result.validation.messages());
        d.seed = result.seed;
        d.gridSeed = result.gridSeed;
        d.attempt = result.attempt;
        d.grid = cells(result.grid);
        d.stats = stats(result.grid, result.slots, index);
        return d;
    }

    /**
     * @param grid nullable partial grid
     */
    public static GridDocument failure(String id, String createdAt, GenerationSettings settings, String error,
                                       List<String> reasons, CrosswordGrid grid) {
        GridDocument d = base(id, createdAt, STATUS_FAILED, settings);
        d.error = error;
        d.reasons = reasons == null ? new ArrayList<>() : new ArrayList<>(reasons);
        d.seed = settings.seed;
        if (grid != null) {
            List<WordSlot> s = new ArrayList<>(grid.slots());
            d.slots = slots(s);
            d.grid = cells(grid);
            d.stats = stats(grid, s, null);
        }
        return d;
    }

    private static GridDocument base(String id, String createdAt, String status, GenerationSettings settings) {
        GridDocument d = new GridDocument();
        d.id = Objects.requireNonNull(id, "id");
        d.createdAt = createdAt;
        d.status = status;
        d.config = SettingsDoc.of(Objects.requireNonNull(settings, "settings"));
        return d;
    }

    static List<List<CellDoc>> cells(CrosswordGrid grid) {
        List<List<CellDoc>> rows = new ArrayList<>(grid.rows());
        for (int r = 0; r < grid.rows(); r++) {
            List<CellDoc> row = new ArrayList<>(grid.cols());
            for (int c = 0; c < grid.cols(); c++) {
                Cell cell = grid.cell(r, c);
                CellDoc cd = new CellDoc();
                cd.type = cell.type().name();
                cd.letter = cell.hasLetter() ? String.valueOf(cell.letter()) : null;
                for (Clue clue : cell.clues()) cd.clues.add(clue(clue, null));
                cd.slotIds = new ArrayList<>(cell.slotIds());
                row.add(cd);
            }
            rows.add(row);
        }
        return rows;
    }

    static List<SlotDoc> slots(List<WordSlot> slots) {
        List<SlotDoc> out = new ArrayList<>(slots.size());
        for (WordSlot s : slots) {
            SlotDoc d = new SlotDoc();
            d.id = s.id();
            d.start = new int[]{s.start().row, s.start().col};
            d.direction = s.direction().name();
            d.length = s.length();
            d.text = s.text();
            d.clueBox = new int[]{s.clueBox().row, s.clueBox().col};
            d.theme = s.isTheme();
            out.add(d);
        }
        return out;
    }

    static List<ClueDoc> flatClues(CrosswordGrid grid) {
        List<ClueDoc> out = new ArrayList<>();
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                Cell cell = grid.cell(r, c);
                if (!cell.isClueBox()) continue;
                for (Clue clue : cell.clues()) out.add(clue(clue, new int[]{r, c}));
            }
        }
        return out;
    }

    private static ClueDoc clue(Clue clue, int[] box) {
        ClueDoc d = new ClueDoc();
        d.id = clue.id();
        d.text = clue.text();
        d.slotId = clue.slotId();
        d.solutionLength = clue.solutionLength();
        d.direction = clue.direction().name();
        d.clueBox = box;
        d.offsetRow = clue.offsetRow();
        d.offsetCol = clue.offsetCol();
        return d;
    }

    /**
     * @param index nullable; without it the difficulty section is omitted
     */
    static Stats stats(CrosswordGrid grid, List<WordSlot> slots, WordIndex index) {
        Stats s = new Stats();
        s.rows = grid.rows();
        s.cols = grid.cols();
        s.totalCells = grid.rows() * grid.cols();
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                switch (grid.cell(r, c).type()) {
                    case LETTER -> s.letterCells++;
                    case CLUE_BOX -> s.clueBoxes++;
                    case BLOCKER_ZONE -> s.blockerCells++;
                    case EMPTY -> s.unfilledCells++;
                }
            }
        }

        List<WordSlot> themeSlots = new ArrayList<>();
        List<WordSlot> fillSlots = new ArrayList<>();
        List<Integer> lengths = new ArrayList<>();
        for (WordSlot slot : slots) {
            String text = slot.text();
            if (slot.isTheme()) themeSlots.add(slot);
            if (text == null || text.length() < 3) continue;
            lengths.add(text.length());
            if (!slot.isTheme()) fillSlots.add(slot);
        }
        s.totalSlots = slots.size();
        s.words3plus = lengths.size();
        s.themeWords = themeSlots.size();
        s.fillWords = fillSlots.size();
        if (!lengths.isEmpty()) {
            int sum = 0;
            s.lengthMin = Integer.MAX_VALUE;
            for (int len : lengths) {
                sum += len;
                s.lengthMin = Math.min(s.lengthMin, len);
                s.lengthMax = Math.max(s.lengthMax, len);
                s.lengthDistribution.merge(String.valueOf(len), 1, Integer::sum);
            }
            s.lengthAvg = Math.round(sum * 10.0 / lengths.size()) / 10.0;
        }

        if (index != null && !lengths.isEmpty()) s.difficulty = difficulty(fillSlots, themeSlots, index);
        return s;
    }

    private static DifficultyStats difficulty(List<WordSlot> fillSlots, List<WordSlot> themeSlots, WordIndex index) {
        double scoreSum = 0.0, freqSum = 0.0;
        int scored = 0;
        DifficultyStats d = new DifficultyStats();
        for (WordSlot slot : fillSlots) {
            Optional<DictionaryEntry> e = index.get(slot.text());
            if (e.isEmpty()) continue;
            double ds = e.get().difficultyScore();
            scoreSum += ds;
            freqSum += e.get().frequency();
            scored++;
            if (ds < 0.3) d.easyCount++;
            else if (ds < 0.6) d.mediumCount++;
            else d.hardCount++;
        }
        if (scored == 0) return null;
        d.avgScore = Math.round(scoreSum / scored * 1000.0) / 1000.0;
        d.avgFrequency = Math.round(freqSum / scored * 1000.0) / 1000.0;
        d.dictCoverage = scored + "/" + fillSlots.size();

        double themeSum = 0.0;
        int themeScored = 0;
        for (WordSlot slot : themeSlots) {
            if (slot.text() == null) continue;
            Optional<DictionaryEntry> e = index.get(slot.text());
            if (e.isPresent()) {
                themeSum += e.get().difficultyScore();
                themeScored++;
            }
        }
        d.themeAvgScore = themeScored == 0 ? null : Math.round(themeSum / themeScored * 1000.0) / 1000.0;
        return d;
    }
}

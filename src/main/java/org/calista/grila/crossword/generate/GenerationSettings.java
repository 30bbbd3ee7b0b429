package org.calista.grila.crossword.generate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.calista.grila.crossword.dictionary.Difficulty;
import org.calista.grila.crossword.grid.GridConfig;
import org.calista.grila.crossword.layout.LayoutCompleter;
import org.calista.grila.crossword.layout.ThemePlacer;
import org.calista.grila.crossword.model.ModelBuilder;

/**
 * Everything one generation run needs besides its collaborators. Public fields, defaults, {@link #validate()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GenerationSettings {
    public int rows = 10;
    public int cols = 10;

    public String theme = "natura";
    public Difficulty difficulty = Difficulty.MEDIUM;
    public String language = "Romanian";

    /** {@code null} = seed from the clock. */
    public Long seed = null;

    public int retryLimit = 3;
    public int themeRequestSize = 80;

    /** Overall fill limit; one solve gets at most {@link #solveBudgetCapSeconds} of it. */
    public double fillTimeoutSeconds = 180.0;
    public double solveBudgetCapSeconds = 30.0;

    public boolean blockerZone = true;
    public boolean plantOriginClue = true;
    public int minBlockerSize = 3;
    public int maxBlockerSize = 6;

    public ThemePlacer.Config themePlacement = new ThemePlacer.Config();
    public LayoutCompleter.Config layout = new LayoutCompleter.Config();
    public ModelBuilder.Config model = new ModelBuilder.Config();

    public GenerationSettings validate() {
        if (retryLimit < 1) retryLimit = 1;
        if (themeRequestSize < 1) themeRequestSize = 1;
        if (difficulty == null) difficulty = Difficulty.MEDIUM;
        if (theme == null) theme = "";
        if (language == null || language.isBlank()) language = "Romanian";
        if (!Double.isFinite(fillTimeoutSeconds) || fillTimeoutSeconds <= 0.0) fillTimeoutSeconds = 180.0;
        if (!Double.isFinite(solveBudgetCapSeconds) || solveBudgetCapSeconds <= 0.0) solveBudgetCapSeconds = 30.0;
        if (minBlockerSize < 1) minBlockerSize = 1;
        if (maxBlockerSize < minBlockerSize) maxBlockerSize = minBlockerSize;

        if (themePlacement == null) themePlacement = new ThemePlacer.Config();
        if (layout == null) layout = new LayoutCompleter.Config();
        if (model == null) model = new ModelBuilder.Config();
        themePlacement.validate();
        layout.validate();
        model.validate();
        return this;
    }

    /** Grid geometry for one attempt. */
    public GridConfig gridConfig(long gridSeed) {
        return GridConfig.builder(rows, cols)
                .blockerZone(blockerZone)
                .plantOriginClue(plantOriginClue)
                .blockerSize(minBlockerSize, maxBlockerSize)
                .seed(gridSeed)
                .build();
    }

    /** Budget of a single solver call, in milliseconds. */
    public long solveBudgetMs() {
        return (long) (Math.min(solveBudgetCapSeconds, fillTimeoutSeconds) * 1000.0);
    }
}

package org.calista.grila.crossword.layout;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.grid.*;

import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * LayoutAnnealer — picks the starting geometry (blocker zone and planted clue boxes) of an attempt.
 *
 * <p>Builds the base grid plus {@code trials} alternatives with seeds drawn from the attempt RNG and keeps
 * the best by {@link #score(CrosswordGrid)}; the first grid wins ties.</p>
 */
public final class LayoutAnnealer {

    private static final Logger log = LogManager.getLogger(LayoutAnnealer.class);

    private final int trials;

    public LayoutAnnealer(int trials) {
        this.trials = Math.max(0, trials);
    }

    /** Trial count used by the generator: {@code max(3, min(8, retryLimit * 2))}. */
    public static LayoutAnnealer forRetryLimit(int retryLimit) {
        return new LayoutAnnealer(Math.max(3, Math.min(8, retryLimit * 2)));
    }

    public int trials() {
        return trials;
    }

    public CrosswordGrid anneal(GridConfig base, Random rng) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(rng, "rng");

        CrosswordGrid best = new CrosswordGrid(base);
        double bestScore = score(best);

        if (!base.blockerZone() || base.blockerOverride() != null) return best;

        for (int i = 0; i < trials; i++) {
            CrosswordGrid trial = new CrosswordGrid(base.withSeed(rng.nextLong()));
            double s = score(trial);
            if (s > bestScore) {
                best = trial;
                bestScore = s;
            }
        }
        log.debug("Annealed layout: score={}, blocker={}", bestScore, best.blockerZone().map(Object::toString).orElse("none"));
        return best;
    }

    /**
     * {@code playable - 3 * cluePenalty - |blockerHeight - blockerWidth|}; the clue penalty counts each orphan
     * clue box once and each clue-box neighbour of a clue box twice.
     */
    public static double score(CrosswordGrid grid) {
        int playable = grid.playableCount();
        if (playable == 0) return 0.0;

        int cluePenalty = 0;
        for (GridPos p : grid.clueBoxes()) {
            if (grid.licensesOf(p).isEmpty()) cluePenalty += 1;
            for (GridPos n : grid.neighbors(p)) {
                if (grid.cell(n).isClueBox()) cluePenalty += 2;
            }
        }

        Optional<BlockerZone> zone = grid.blockerZone();
        int blockerPenalty = zone.map(z -> Math.abs(z.height - z.width)).orElse(0);
        return playable - 3.0 * cluePenalty - blockerPenalty;
    }
}

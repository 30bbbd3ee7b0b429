package org.calista.grila.crossword;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.grila.crossword.core.GrilaConfig;
import org.calista.grila.crossword.core.GrilaKernel;
import org.calista.grila.crossword.generate.CrosswordGenerator;
import org.calista.grila.crossword.generate.GenerationException;
import org.calista.grila.crossword.generate.GenerationResult;
import org.calista.grila.crossword.generate.ParallelGenerator;
import org.calista.grila.crossword.grid.GridFormatter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * GrilaApp — console runner: {@code GrilaApp [config.json]}.
 *
 * Lifecycle:
 *  1) build kernel (config + stores)
 *  2) kernel.bootstrap() (dictionary)
 *  3) one generation run, sequential or parallel
 *  4) print grid/stats, persist the document (success or failure)
 */
public final class GrilaApp {

    private static final Logger log = LogManager.getLogger(GrilaApp.class);

    private final Path cfgPath;
    private final Path configRoot;

    public static void main(String[] args) throws Exception {
        Path cfg = Path.of(args.length > 0 ? args[0] : "config/grila.json");
        int code = new GrilaApp(Path.of("."), cfg).run();
        if (code != 0) System.exit(code);
    }

    public GrilaApp(Path configRoot, Path cfgPath) {
        this.configRoot = configRoot;
        this.cfgPath = cfgPath;
    }

    /**
     * @return 0 on success, 1 when generation failed (a failure document is still written)
     */
    public int run() throws IOException, InterruptedException {
        try (GrilaKernel kernel = GrilaKernel.builder().configRoot(configRoot).build(cfgPath)) {
            kernel.bootstrap();
            return generateOnce(kernel) != null ? 0 : 1;
        }
    }

    /**
     * @return stored document id on success, {@code null} on failure
     */
    public static String generateOnce(GrilaKernel kernel) throws IOException, InterruptedException {
        GrilaConfig cfg = kernel.config();
        String runId = "run-" + Long.toHexString(System.nanoTime());
        CrosswordGenerator generator = kernel.newGenerator(kernel.eventStore().listener(runId));

        GenerationResult result;
        try {
            if (cfg.parallel.enabled) {
                try (ParallelGenerator parallel = new ParallelGenerator(generator, cfg.parallelConfig())) {
                    result = parallel.generate();
                }
            } else {
                result = generator.generate();
            }
        } catch (GenerationException e) {
            log.error("Generation failed: {}", e.getMessage());
            String id = kernel.documentStore().saveFailure(generator.settings(), e.getMessage(), e.reasons(), null);
            System.out.println("Generation failed, report saved as " + id);
            return null;
        }

        if (cfg.output.printGrid) System.out.println(GridFormatter.render(result.grid));
        if (cfg.output.printStats) System.out.println(GridFormatter.stats(result.grid, kernel.index()));

        String id = kernel.documentStore().saveSuccess(result, generator.settings(), kernel.index());
        System.out.println("Crossword saved as " + id + " (seed " + result.seed + ", attempt " + result.attempt + ")");
        return id;
    }
}

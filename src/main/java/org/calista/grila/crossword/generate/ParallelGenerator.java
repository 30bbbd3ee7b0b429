package org.calista.grila.crossword.generate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ParallelGenerator — runs independent attempts concurrently and keeps the first OK one.
 *
 * <p>
 * Пул принадлежит генератору: bounded queue + CallerRunsPolicy, daemon-потоки, закрывается в {@link #close()}.
 * Попытки ничего не делят, кроме read-only индекса; проигравшие отменяются и их сетки просто выбрасываются.
 * Seeds берутся из того же master RNG, что и у последовательного цикла, но победитель зависит от планирования.
 * </p>
 */
public final class ParallelGenerator implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(ParallelGenerator.class);

    // =========================
    // Config
    // =========================

    public static final class Config {
        public int parallelism = Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
        public int queueCapacity = 64;
        public String threadNamePrefix = "grila-gen-";
        public long shutdownTimeoutMs = 2_000L;

        public Config validate() {
            if (parallelism < 1) parallelism = 1;
            if (queueCapacity < 1) queueCapacity = 1;
            if (threadNamePrefix == null || threadNamePrefix.isBlank()) threadNamePrefix = "grila-gen-";
            if (shutdownTimeoutMs < 0) shutdownTimeoutMs = 0;
            return this;
        }
    }

    private final CrosswordGenerator generator;
    private final Config cfg;
    private final ExecutorService pool;

    public ParallelGenerator(CrosswordGenerator generator, Config cfg) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.cfg = (cfg == null ? new Config() : cfg).validate();
        this.pool = createPool(this.cfg);
    }

    /**
     * Submits {@code retryLimit} attempts and returns the first OK result.
     *
     * @throws GenerationException when all attempts fail or one is FATAL
     */
    public GenerationResult generate() throws InterruptedException {
        GenerationSettings settings = generator.settings();
        GenerationListener listener = generator.listener();
        String fatal = generator.preflight();
        if (fatal != null) {
            listener.generationFailed(fatal);
            throw new GenerationException("Cannot generate", List.of(fatal));
        }

        long seed = generator.seed();
        Random rng = new Random(seed);
        CompletionService<AttemptOutcome> ecs = new ExecutorCompletionService<>(pool);
        List<Future<AttemptOutcome>> futures = new ArrayList<>(settings.retryLimit);

        for (int attempt = 1; attempt <= settings.retryLimit; attempt++) {
            final int n = attempt;
            final long gridSeed = rng.nextInt(CrosswordGenerator.GRID_SEED_BOUND);
            futures.add(ecs.submit(() -> {
                listener.attemptStarted(n, gridSeed);
                AttemptOutcome outcome = generator.newAttempt().run(n, seed, gridSeed, generator.attemptDeadline());
                if (outcome.kind() == AttemptOutcome.Kind.RETRY) listener.attemptRetry(n, gridSeed, outcome.reason());
                return outcome;
            }));
        }

        List<String> reasons = new ArrayList<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                AttemptOutcome outcome;
                try {
                    outcome = ecs.take().get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Generation attempt crashed", cause);
                    reasons.add(cause.toString());
                    continue;
                }
                if (outcome.isOk()) {
                    listener.attemptOk(outcome.result().attempt, outcome.result());
                    return outcome.result();
                }
                reasons.add(outcome.reason());
                if (outcome.kind() == AttemptOutcome.Kind.FATAL) {
                    listener.generationFailed(outcome.reason());
                    throw new GenerationException("Generation failed", reasons);
                }
                log.warn("Parallel attempt failed: {}", outcome.reason());
            }
        } finally {
            for (Future<AttemptOutcome> f : futures) f.cancel(true);
        }

        String msg = "Unable to generate crossword after " + settings.retryLimit + " parallel attempts";
        listener.generationFailed(msg);
        throw new GenerationException(msg, reasons);
    }

    @Override
    public void close() {
        shutdownExecutor(pool, cfg.shutdownTimeoutMs);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private static ExecutorService createPool(Config cfg) {
        final AtomicLong tid = new AtomicLong(1);
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, cfg.threadNamePrefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(
                cfg.parallelism,
                cfg.parallelism,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(cfg.queueCapacity),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    private static void shutdownExecutor(ExecutorService es, long timeoutMs) {
        es.shutdown();
        try {
            if (!es.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                es.shutdownNow();
                es.awaitTermination(Math.max(250, timeoutMs / 2), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            es.shutdownNow();
        }
    }
}

package com.pinery.ai.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Converts many scripts in parallel through one selector.
 *
 * Each script is an independent task; a failure is reported on its own result. Results keep
 * input order.
 */
public class BatchConverter {

    private static final Logger log = LoggerFactory.getLogger(BatchConverter.class);

    private final StrategySelector selector;
    private final int threads;

    public BatchConverter(StrategySelector selector) {
        this(selector, selector.settings().getBatchThreads());
    }

    public BatchConverter(StrategySelector selector, int threads) {
        this.selector = selector;
        this.threads = Math.max(1, threads);
    }

    /**
     * Outcome of one script. Exactly one of {@code outcome} and {@code error} is set.
     */
    public record BatchResult(int index, ConversionOutcome outcome, Exception error) {

        public boolean isSuccess() {
            return outcome != null;
        }
    }

    public List<BatchResult> convertAll(List<String> sources) throws InterruptedException {
        if (sources.isEmpty()) {
            return List.of();
        }
        AtomicInteger threadCount = new AtomicInteger(0);
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, sources.size()), r -> {
            Thread t = new Thread(r, "pinery-batch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<ConversionOutcome>> futures = new ArrayList<>(sources.size());
            for (String source : sources) {
                futures.add(pool.submit(() -> selector.convert(source)));
            }
            List<BatchResult> results = new ArrayList<>(sources.size());
            int failed = 0;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(new BatchResult(i, futures.get(i).get(), null));
                } catch (ExecutionException e) {
                    failed++;
                    Throwable cause = e.getCause();
                    Exception error = cause instanceof Exception ex ? ex : e;
                    log.warn("Script {} failed: {}", i, error.getMessage());
                    results.add(new BatchResult(i, null, error));
                }
            }
            log.info("Batch finished: {} converted, {} failed", sources.size() - failed, failed);
            return results;
        } finally {
            pool.shutdownNow();
        }
    }
}

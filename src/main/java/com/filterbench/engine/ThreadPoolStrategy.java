package com.filterbench.engine;

import com.filterbench.concurrent.BoundedGate;
import com.filterbench.concurrent.RunContext;
import com.filterbench.config.AppConfig;
import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import com.filterbench.model.RunOutcome;
import com.filterbench.service.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-size thread pool where every execution additionally holds the run's
 * {@link BoundedGate}.
 *
 * Pool size (the run's worker count) sets how many threads are scheduled; the
 * gate capacity sets how many of them may execute at once. With a gate smaller
 * than the pool, the extra threads block in {@code acquire}. Results are
 * collected in completion order.
 */
@Component
public class ThreadPoolStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ThreadPoolStrategy.class);

    private final ImageProcessor processor;
    private final long shutdownTimeoutMs;

    @Autowired
    public ThreadPoolStrategy(ImageProcessor processor, AppConfig appConfig) {
        this(processor, appConfig.getShutdownTimeoutMs());
    }

    public ThreadPoolStrategy(ImageProcessor processor, long shutdownTimeoutMs) {
        this.processor = processor;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.THREAD_POOL;
    }

    @Override
    public RunOutcome execute(List<FilterTask> tasks, RunContext context) {
        long start = System.nanoTime();
        ExecutorService pool = Executors.newFixedThreadPool(context.getWorkers(),
                new CustomizableThreadFactory("thread-pool-"));
        List<FilterResult> results = new ArrayList<>(tasks.size());
        try {
            CompletionService<FilterResult> completion = new ExecutorCompletionService<>(pool);
            for (FilterTask task : tasks) {
                completion.submit(() -> context.getGate().withPermit(() -> processor.execute(task)));
            }
            for (int i = 0; i < tasks.size(); i++) {
                FilterResult result = completion.take().get();
                context.record(result);
                results.add(result);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StrategyExecutionException("Interrupted while collecting thread-pool results", e);
        } catch (ExecutionException e) {
            throw new StrategyExecutionException("Thread-pool task failed unexpectedly", e.getCause());
        } finally {
            shutdown(pool);
        }

        double elapsed = (System.nanoTime() - start) / 1e9;
        log.info("Thread-pool run of {} task(s) on {} thread(s), gate {}: {} s (peak admitted {})",
                tasks.size(), context.getWorkers(), context.getGate().getCapacity(),
                String.format("%.3f", elapsed), context.getGate().peakActiveCount());
        return new RunOutcome(getType(), results, elapsed, context.getWorkers());
    }

    private void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Thread pool did not terminate within {} ms; forcing shutdown", shutdownTimeoutMs);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

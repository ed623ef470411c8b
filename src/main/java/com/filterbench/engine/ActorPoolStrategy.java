package com.filterbench.engine;

import com.filterbench.actor.ActorPool;
import com.filterbench.actor.ShutdownPolicy;
import com.filterbench.concurrent.RunContext;
import com.filterbench.config.AppConfig;
import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import com.filterbench.model.RunOutcome;
import com.filterbench.service.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Message passing instead of futures: tasks are dealt round-robin to a pool
 * of actors and exactly one result per task is read back from their shared
 * outbox, after which every actor is stopped and awaited.
 */
@Component
public class ActorPoolStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ActorPoolStrategy.class);

    private final ImageProcessor processor;
    private final long pollTimeoutMs;
    private final ShutdownPolicy shutdownPolicy;
    private final long shutdownTimeoutMs;

    @Autowired
    public ActorPoolStrategy(ImageProcessor processor, AppConfig appConfig) {
        this(processor, appConfig.getActorPollTimeoutMs(), appConfig.getActorShutdownPolicy(),
                appConfig.getShutdownTimeoutMs());
    }

    public ActorPoolStrategy(ImageProcessor processor, long pollTimeoutMs, ShutdownPolicy shutdownPolicy,
            long shutdownTimeoutMs) {
        this.processor = processor;
        this.pollTimeoutMs = pollTimeoutMs;
        this.shutdownPolicy = shutdownPolicy;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.ACTOR_POOL;
    }

    @Override
    public RunOutcome execute(List<FilterTask> tasks, RunContext context) {
        long start = System.nanoTime();
        ActorPool pool = new ActorPool(context.getWorkers(), processor, pollTimeoutMs, shutdownPolicy);
        pool.start();
        List<FilterResult> results;
        try {
            pool.dispatch(tasks);
            results = pool.collect(tasks.size(), context::record);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StrategyExecutionException("Interrupted while collecting actor results", e);
        } finally {
            int discarded = pool.stop();
            if (discarded > 0) {
                log.warn("{} queued task(s) discarded while stopping the actor pool", discarded);
            }
            awaitActors(pool);
        }

        double elapsed = (System.nanoTime() - start) / 1e9;
        log.info("Actor run of {} task(s) on {} actor(s) finished in {} s",
                tasks.size(), pool.size(), String.format("%.3f", elapsed));
        return new RunOutcome(getType(), results, elapsed, pool.size());
    }

    private void awaitActors(ActorPool pool) {
        try {
            if (!pool.awaitTermination(shutdownTimeoutMs)) {
                log.warn("Not all actors stopped within {} ms", shutdownTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

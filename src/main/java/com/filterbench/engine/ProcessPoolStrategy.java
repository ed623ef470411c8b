package com.filterbench.engine;

import com.filterbench.concurrent.BoundedGate;
import com.filterbench.concurrent.RunContext;
import com.filterbench.config.AppConfig;
import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import com.filterbench.model.RunOutcome;
import com.filterbench.worker.WorkerLauncher;
import com.filterbench.worker.WorkerProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Runs every task in a pool of separate worker JVMs, so a task shares no
 * memory with the caller.
 *
 * One dispatcher thread per worker borrows an idle process, sends it the task
 * as a JSON line and waits for the result line. Results are collected in
 * completion order. If a worker dies mid-task, that task becomes an ERROR
 * result and a fresh worker takes its place; failing to start the initial
 * pool aborts the run.
 *
 * Optionally the run's {@link BoundedGate} also wraps each dispatch, giving
 * the process pool the same admission control as the thread pool.
 */
@Component
public class ProcessPoolStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ProcessPoolStrategy.class);

    private final WorkerLauncher launcher;
    private final boolean gated;
    private final long shutdownTimeoutMs;

    @Autowired
    public ProcessPoolStrategy(AppConfig appConfig) {
        this(WorkerLauncher.fromConfig(appConfig), appConfig.isGateProcessPool(), appConfig.getShutdownTimeoutMs());
    }

    public ProcessPoolStrategy(WorkerLauncher launcher, boolean gated, long shutdownTimeoutMs) {
        this.launcher = launcher;
        this.gated = gated;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.PROCESS_POOL;
    }

    @Override
    public RunOutcome execute(List<FilterTask> tasks, RunContext context) {
        long start = System.nanoTime();
        int size = context.getWorkers();
        List<WorkerProcess> started = Collections.synchronizedList(new ArrayList<>());
        BlockingQueue<WorkerProcess> idle = new LinkedBlockingQueue<>();
        ExecutorService dispatchers = Executors.newFixedThreadPool(size,
                new CustomizableThreadFactory("process-dispatch-"));
        List<FilterResult> results = new ArrayList<>(tasks.size());

        try {
            for (int i = 0; i < size; i++) {
                WorkerProcess worker = launcher.launch(i);
                started.add(worker);
                idle.add(worker);
            }
            log.debug("Started {} worker process(es)", size);

            CompletionService<FilterResult> completion = new ExecutorCompletionService<>(dispatchers);
            for (FilterTask task : tasks) {
                completion.submit(() -> dispatch(task, idle, started, context.getGate()));
            }
            for (int i = 0; i < tasks.size(); i++) {
                FilterResult result = completion.take().get();
                context.record(result);
                results.add(result);
            }
        } catch (IOException e) {
            throw new StrategyExecutionException("Failed to start worker process pool", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StrategyExecutionException("Interrupted while collecting process-pool results", e);
        } catch (ExecutionException e) {
            throw new StrategyExecutionException("Process-pool dispatch failed unexpectedly", e.getCause());
        } finally {
            dispatchers.shutdownNow();
            synchronized (started) {
                for (WorkerProcess worker : started) {
                    worker.shutdown(shutdownTimeoutMs);
                }
            }
        }

        double elapsed = (System.nanoTime() - start) / 1e9;
        log.info("Process-pool run of {} task(s) on {} process(es) finished in {} s",
                tasks.size(), size, String.format("%.3f", elapsed));
        return new RunOutcome(getType(), results, elapsed, size);
    }

    private FilterResult dispatch(FilterTask task, BlockingQueue<WorkerProcess> idle,
            List<WorkerProcess> started, BoundedGate gate) throws InterruptedException {
        if (gated) {
            gate.acquire();
        }
        try {
            WorkerProcess worker = idle.take();
            try {
                return worker.execute(task);
            } catch (IOException e) {
                log.warn("Worker {} failed on {}: {}", worker.getId(), task.getSourceFileName(), e.getMessage());
                worker = replace(worker, started);
                return FilterResult.error(task, "Error in " + task.getSourceFileName()
                        + ": worker process failed: " + e.getMessage());
            } finally {
                idle.add(worker);
            }
        } finally {
            if (gated) {
                gate.release();
            }
        }
    }

    /**
     * Swaps a dead worker for a new one. If the replacement cannot start, the
     * dead worker goes back to the pool and fails fast on its next task.
     */
    private WorkerProcess replace(WorkerProcess dead, List<WorkerProcess> started) {
        dead.shutdown(0);
        try {
            WorkerProcess replacement = launcher.launch(dead.getId());
            started.add(replacement);
            log.info("Replaced worker {} with pid {}", dead.getId(), replacement.pid());
            return replacement;
        } catch (IOException e) {
            log.error("Could not replace worker {}: {}", dead.getId(), e.getMessage());
            return dead;
        }
    }
}

package com.filterbench.concurrent;

import com.filterbench.model.FilterResult;

import java.util.function.Consumer;

/**
 * Per-run state shared by the execution units of one strategy invocation:
 * the processed and error tallies, the admission gate and the configured
 * parallelism width.
 *
 * A fresh context is built for every run, so nothing leaks from one run into
 * the next.
 */
public class RunContext {

    private final SharedCounter processedCounter = new SharedCounter();
    private final SharedCounter errorCounter = new SharedCounter();
    private final BoundedGate gate;
    private final int workers;
    private final Consumer<FilterResult> resultListener;

    public RunContext(int workers, int gateCapacity) {
        this(workers, gateCapacity, result -> {
        });
    }

    public RunContext(int workers, int gateCapacity, Consumer<FilterResult> resultListener) {
        if (workers <= 0) {
            throw new IllegalArgumentException("Worker count must be positive, got " + workers);
        }
        this.workers = workers;
        this.gate = new BoundedGate(gateCapacity);
        this.resultListener = resultListener;
    }

    /**
     * Tallies a collected result and forwards it to the listener.
     */
    public void record(FilterResult result) {
        if (result.isOk()) {
            processedCounter.increment();
        } else {
            errorCounter.increment();
        }
        resultListener.accept(result);
    }

    public int getProcessed() {
        return processedCounter.get();
    }

    public int getErrors() {
        return errorCounter.get();
    }

    public BoundedGate getGate() {
        return gate;
    }

    public int getWorkers() {
        return workers;
    }
}

package com.filterbench.model;

import com.filterbench.engine.StrategyType;

import java.util.List;

/**
 * Results of one strategy execution together with its wall-clock time and the
 * parallelism width it ran with.
 */
public final class RunOutcome {

    private final StrategyType strategy;
    private final List<FilterResult> results;
    private final double elapsedSeconds;
    private final int workerCount;

    public RunOutcome(StrategyType strategy, List<FilterResult> results, double elapsedSeconds, int workerCount) {
        this.strategy = strategy;
        this.results = List.copyOf(results);
        this.elapsedSeconds = elapsedSeconds;
        this.workerCount = workerCount;
    }

    public StrategyType getStrategy() {
        return strategy;
    }

    public List<FilterResult> getResults() {
        return results;
    }

    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public long countOk() {
        return results.stream().filter(FilterResult::isOk).count();
    }

    public long countErrors() {
        return results.size() - countOk();
    }
}

package com.filterbench.dto;

import com.filterbench.concurrent.RunContext;
import com.filterbench.model.FilterResult;
import com.filterbench.model.RunOutcome;

import java.util.List;

/**
 * Summary of one finished strategy run, with every result for the log view.
 */
public class RunReport {

    private final String strategy;
    private final double elapsedSeconds;
    private final int workerCount;
    private final int processed;
    private final int errors;
    private final List<FilterResult> results;

    public RunReport(String strategy, double elapsedSeconds, int workerCount, int processed, int errors,
            List<FilterResult> results) {
        this.strategy = strategy;
        this.elapsedSeconds = elapsedSeconds;
        this.workerCount = workerCount;
        this.processed = processed;
        this.errors = errors;
        this.results = List.copyOf(results);
    }

    public static RunReport from(RunOutcome outcome, RunContext context) {
        return new RunReport(outcome.getStrategy().getLabel(), outcome.getElapsedSeconds(),
                outcome.getWorkerCount(), context.getProcessed(), context.getErrors(), outcome.getResults());
    }

    public String getStrategy() {
        return strategy;
    }

    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public int getProcessed() {
        return processed;
    }

    public int getErrors() {
        return errors;
    }

    public List<FilterResult> getResults() {
        return results;
    }
}

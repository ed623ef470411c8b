package com.filterbench.service;

import com.filterbench.concurrent.RunContext;
import com.filterbench.engine.StrategyRegistry;
import com.filterbench.engine.StrategyType;
import com.filterbench.model.FilterTask;
import com.filterbench.model.RunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Runs strategies and keeps the elapsed-time history per strategy for the
 * lifetime of the process.
 *
 * Speedup is mean(baseline) / mean(candidate); efficiency is speedup divided
 * by the candidate's worker count, as a percentage of ideal linear scaling.
 * History is append-only until {@link #reset()}.
 */
@Service
public class BenchmarkService {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkService.class);

    private final StrategyRegistry strategyRegistry;

    private final Map<StrategyType, List<Double>> history = new EnumMap<>(StrategyType.class);
    private final Map<StrategyType, Integer> lastWorkerCount = new EnumMap<>(StrategyType.class);

    public BenchmarkService(StrategyRegistry strategyRegistry) {
        this.strategyRegistry = strategyRegistry;
        for (StrategyType type : StrategyType.values()) {
            history.put(type, new ArrayList<>());
        }
    }

    /**
     * Executes the strategy and appends its elapsed time to the history.
     */
    public RunOutcome runAndRecord(StrategyType strategy, List<FilterTask> tasks, RunContext context) {
        RunOutcome outcome = strategyRegistry.get(strategy).execute(tasks, context);
        record(strategy, outcome.getElapsedSeconds());
        synchronized (this) {
            lastWorkerCount.put(strategy, outcome.getWorkerCount());
        }
        log.info("{}: {} ok, {} error(s) in {} s", strategy.getLabel(), outcome.countOk(),
                outcome.countErrors(), String.format("%.3f", outcome.getElapsedSeconds()));
        return outcome;
    }

    public synchronized void record(StrategyType strategy, double elapsedSeconds) {
        if (elapsedSeconds < 0 || Double.isNaN(elapsedSeconds)) {
            throw new IllegalArgumentException("Elapsed time must be a non-negative number, got " + elapsedSeconds);
        }
        history.get(strategy).add(elapsedSeconds);
    }

    /**
     * Mean elapsed time per strategy; 0.0 for strategies without samples.
     */
    public synchronized Map<StrategyType, Double> compare() {
        Map<StrategyType, Double> averages = new EnumMap<>(StrategyType.class);
        for (StrategyType type : StrategyType.values()) {
            averages.put(type, mean(history.get(type)).orElse(0.0));
        }
        return averages;
    }

    public OptionalDouble speedup(StrategyType candidate) {
        return speedup(StrategyType.SEQUENTIAL, candidate);
    }

    /**
     * mean(baseline) / mean(candidate); empty when either history is empty or
     * the candidate mean is zero.
     */
    public synchronized OptionalDouble speedup(StrategyType baseline, StrategyType candidate) {
        OptionalDouble baselineMean = mean(history.get(baseline));
        OptionalDouble candidateMean = mean(history.get(candidate));
        if (baselineMean.isEmpty() || candidateMean.isEmpty()) {
            return OptionalDouble.empty();
        }
        return ratio(baselineMean.getAsDouble(), candidateMean.getAsDouble());
    }

    /**
     * @param workerCount the candidate's configured parallelism width
     * @return speedup / workerCount * 100
     */
    public static double efficiency(double speedup, int workerCount) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be positive, got " + workerCount);
        }
        return speedup / workerCount * 100.0;
    }

    /** baseline / candidate, empty when the candidate time is zero. */
    public static OptionalDouble ratio(double baselineSeconds, double candidateSeconds) {
        if (candidateSeconds <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(baselineSeconds / candidateSeconds);
    }

    public synchronized List<Double> history(StrategyType strategy) {
        return List.copyOf(history.get(strategy));
    }

    /** Worker count of the most recent recorded run of the strategy. */
    public synchronized OptionalInt lastWorkerCount(StrategyType strategy) {
        Integer count = lastWorkerCount.get(strategy);
        return count != null ? OptionalInt.of(count) : OptionalInt.empty();
    }

    public synchronized void reset() {
        history.values().forEach(List::clear);
        lastWorkerCount.clear();
        log.info("Benchmark history cleared");
    }

    private static OptionalDouble mean(List<Double> samples) {
        return samples.stream().mapToDouble(Double::doubleValue).average();
    }
}

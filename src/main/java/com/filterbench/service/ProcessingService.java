package com.filterbench.service;

import com.filterbench.concurrent.RunContext;
import com.filterbench.config.AppConfig;
import com.filterbench.dto.ComparisonReport;
import com.filterbench.dto.RunReport;
import com.filterbench.dto.RunRequest;
import com.filterbench.dto.RunStatusDto;
import com.filterbench.engine.StrategyType;
import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import com.filterbench.model.FilterType;
import com.filterbench.model.RunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates filter runs for the REST layer.
 *
 * Supported flows:
 * - a single strategy over the selected images
 * - Sequential followed by one parallel strategy, with speedup and efficiency
 * - Sequential followed by every parallel strategy in turn
 *
 * Only one run is active at a time. Each strategy invocation gets its own
 * {@link RunContext}; the live status reads the counters and gate of the
 * current context. Every collected result is published as a
 * {@link RunProgressEvent} for the progress stream.
 */
@Service
public class ProcessingService {

    private static final Logger log = LoggerFactory.getLogger(ProcessingService.class);

    public static final String ALL_STRATEGIES = "ALL";

    private final BenchmarkService benchmarkService;
    private final ImageCatalogService catalogService;
    private final AppConfig appConfig;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor processingExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<RunContext> currentContext = new AtomicReference<>();
    private final AtomicReference<StrategyType> currentStrategy = new AtomicReference<>();
    private final AtomicInteger currentTotal = new AtomicInteger(0);
    private final AtomicReference<RunReport> lastReport = new AtomicReference<>();
    private final AtomicReference<ComparisonReport> lastComparison = new AtomicReference<>();

    public ProcessingService(BenchmarkService benchmarkService,
            ImageCatalogService catalogService,
            AppConfig appConfig,
            ApplicationEventPublisher eventPublisher,
            @Qualifier("processingExecutor") Executor processingExecutor) {
        this.benchmarkService = benchmarkService;
        this.catalogService = catalogService;
        this.appConfig = appConfig;
        this.eventPublisher = eventPublisher;
        this.processingExecutor = processingExecutor;
    }

    // ───────────── Synchronous entry points ─────────────

    /**
     * Runs one strategy and waits for it.
     *
     * @throws IllegalArgumentException if the request is invalid
     * @throws IllegalStateException    if another run is in progress
     */
    public RunReport run(RunRequest request) {
        PreparedRun prepared = prepare(request, false);
        begin();
        try {
            return executeRun(prepared, prepared.strategies.get(0));
        } finally {
            end();
        }
    }

    /**
     * Runs Sequential, then the requested parallel strategy (or all of them),
     * and reports speedup and efficiency against this run's Sequential time.
     */
    public ComparisonReport compare(RunRequest request) {
        PreparedRun prepared = prepare(request, true);
        begin();
        try {
            return executeComparison(prepared);
        } finally {
            end();
        }
    }

    // ───────────── Asynchronous entry points ─────────────

    /**
     * Validates the request, then runs it on the processing executor.
     * Validation and the one-run-at-a-time check happen before returning.
     */
    public void submitRun(RunRequest request) {
        PreparedRun prepared = prepare(request, false);
        submit(() -> executeRun(prepared, prepared.strategies.get(0)));
    }

    public void submitComparison(RunRequest request) {
        PreparedRun prepared = prepare(request, true);
        submit(() -> executeComparison(prepared));
    }

    private void submit(Runnable work) {
        begin();
        try {
            processingExecutor.execute(() -> {
                try {
                    work.run();
                } catch (RuntimeException e) {
                    log.error("Run failed: {}", e.getMessage(), e);
                    publish(RunProgressEvent.TYPE_ERROR, currentStrategy.get(), "Run failed: " + e.getMessage(), null);
                } finally {
                    end();
                }
            });
        } catch (RejectedExecutionException e) {
            end();
            throw new IllegalStateException("Processing executor rejected the run", e);
        }
    }

    // ───────────── Status accessors ─────────────

    public boolean isRunning() {
        return running.get();
    }

    public RunStatusDto status() {
        RunStatusDto dto = new RunStatusDto();
        dto.setRunning(running.get());
        StrategyType strategy = currentStrategy.get();
        dto.setStrategy(strategy != null ? strategy.getLabel() : null);
        dto.setTotal(currentTotal.get());
        RunContext context = currentContext.get();
        if (context != null) {
            dto.setProcessed(context.getProcessed());
            dto.setErrors(context.getErrors());
            dto.setActiveExecutions(context.getGate().activeCount());
            dto.setGateCapacity(context.getGate().getCapacity());
        } else {
            dto.setGateCapacity(appConfig.getGateCapacity());
        }
        return dto;
    }

    public RunReport getLastReport() {
        return lastReport.get();
    }

    public ComparisonReport getLastComparison() {
        return lastComparison.get();
    }

    // ───────────── Run execution ─────────────

    private RunReport executeRun(PreparedRun prepared, StrategyType strategy) {
        List<FilterTask> tasks = catalogService.buildTasks(prepared.images, prepared.filter,
                prepared.outputDir, strategy.getMethodTag());
        int workers = strategy.isParallel() ? prepared.workers : 1;
        RunContext context = new RunContext(workers, prepared.gateCapacity,
                result -> publish(RunProgressEvent.TYPE_RESULT, strategy, result.getMessage(), result));

        currentContext.set(context);
        currentStrategy.set(strategy);
        currentTotal.set(tasks.size());
        log.info("Starting {} run: {} image(s), filter {}, {} worker(s), output {}",
                strategy.getLabel(), tasks.size(), prepared.filter.getLabel(), workers, prepared.outputDir);

        RunOutcome outcome = benchmarkService.runAndRecord(strategy, tasks, context);
        RunReport report = RunReport.from(outcome, context);
        lastReport.set(report);

        publish(RunProgressEvent.TYPE_COMPLETE, strategy, String.format("%s finished in %.2f s (%d ok, %d errors)",
                strategy.getLabel(), outcome.getElapsedSeconds(), report.getProcessed(), report.getErrors()), null);
        return report;
    }

    private ComparisonReport executeComparison(PreparedRun prepared) {
        ComparisonReport comparison = new ComparisonReport();
        comparison.setFilter(prepared.filter.getLabel());
        comparison.setImageCount(prepared.images.size());

        RunReport sequential = executeRun(prepared, StrategyType.SEQUENTIAL);
        comparison.setSequentialSeconds(sequential.getElapsedSeconds());
        comparison.getRuns().add(sequential);

        for (StrategyType strategy : prepared.strategies) {
            RunReport parallel = executeRun(prepared, strategy);
            comparison.getRuns().add(parallel);

            ComparisonReport.Row row = new ComparisonReport.Row();
            row.setStrategy(strategy.getLabel());
            row.setSeconds(parallel.getElapsedSeconds());
            row.setWorkers(parallel.getWorkerCount());
            OptionalDouble speedup = BenchmarkService.ratio(sequential.getElapsedSeconds(),
                    parallel.getElapsedSeconds());
            if (speedup.isPresent()) {
                row.setSpeedup(speedup.getAsDouble());
                row.setEfficiency(BenchmarkService.efficiency(speedup.getAsDouble(), parallel.getWorkerCount()));
            }
            comparison.getRows().add(row);
            log.info("{} vs Sequential: {} s vs {} s, speedup {}", strategy.getLabel(),
                    String.format("%.3f", parallel.getElapsedSeconds()),
                    String.format("%.3f", sequential.getElapsedSeconds()),
                    speedup.isPresent() ? String.format("%.2fx", speedup.getAsDouble()) : "n/a");
        }

        lastComparison.set(comparison);
        return comparison;
    }

    // ───────────── Request handling ─────────────

    private PreparedRun prepare(RunRequest request, boolean comparison) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        FilterType filter = FilterType.fromString(request.getFilter());
        List<StrategyType> strategies = comparison
                ? comparisonStrategies(request.getStrategy())
                : List.of(StrategyType.fromString(request.getStrategy()));

        int workers = request.getWorkers() != null ? request.getWorkers() : appConfig.getDefaultWorkers();
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive, got " + workers);
        }
        int gateCapacity = request.getGateCapacity() != null ? request.getGateCapacity()
                : appConfig.getGateCapacity();
        if (gateCapacity <= 0) {
            throw new IllegalArgumentException("gateCapacity must be positive, got " + gateCapacity);
        }

        List<Path> images = catalogService.collectImages(request.getPaths());
        if (images.isEmpty()) {
            throw new IllegalArgumentException("No supported images found in the given paths");
        }

        Path outputDir;
        try {
            outputDir = catalogService.prepareOutputDirectory(request.getOutputDir());
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot create output folder: " + e.getMessage(), e);
        }
        return new PreparedRun(images, filter, outputDir, strategies, workers, gateCapacity);
    }

    private static List<StrategyType> comparisonStrategies(String requested) {
        List<StrategyType> strategies = new ArrayList<>();
        if (requested == null || requested.isBlank()
                || ALL_STRATEGIES.equals(requested.trim().toUpperCase(Locale.ROOT))) {
            for (StrategyType type : StrategyType.values()) {
                if (type.isParallel()) {
                    strategies.add(type);
                }
            }
            return strategies;
        }
        StrategyType type = StrategyType.fromString(requested);
        if (!type.isParallel()) {
            throw new IllegalArgumentException("A comparison needs a parallel strategy or ALL");
        }
        strategies.add(type);
        return strategies;
    }

    private void begin() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A run is already in progress");
        }
    }

    private void end() {
        running.set(false);
    }

    private void publish(String type, StrategyType strategy, String message, FilterResult result) {
        RunContext context = currentContext.get();
        eventPublisher.publishEvent(new RunProgressEvent(this, type, strategy, message, result,
                context != null ? context.getProcessed() : 0,
                context != null ? context.getErrors() : 0,
                currentTotal.get()));
    }

    private static final class PreparedRun {
        private final List<Path> images;
        private final FilterType filter;
        private final Path outputDir;
        private final List<StrategyType> strategies;
        private final int workers;
        private final int gateCapacity;

        private PreparedRun(List<Path> images, FilterType filter, Path outputDir,
                List<StrategyType> strategies, int workers, int gateCapacity) {
            this.images = images;
            this.filter = filter;
            this.outputDir = outputDir;
            this.strategies = strategies;
            this.workers = workers;
            this.gateCapacity = gateCapacity;
        }
    }

    /**
     * Published for every collected result, on run completion and on run
     * failure.
     */
    public static class RunProgressEvent extends ApplicationEvent {

        public static final String TYPE_RESULT = "RESULT";
        public static final String TYPE_COMPLETE = "COMPLETE";
        public static final String TYPE_ERROR = "ERROR";

        private final String type;
        private final StrategyType strategy;
        private final String message;
        private final FilterResult result;
        private final int processed;
        private final int errors;
        private final int total;

        public RunProgressEvent(Object source, String type, StrategyType strategy, String message,
                FilterResult result, int processed, int errors, int total) {
            super(source);
            this.type = type;
            this.strategy = strategy;
            this.message = message;
            this.result = result;
            this.processed = processed;
            this.errors = errors;
            this.total = total;
        }

        public String getType() {
            return type;
        }

        public StrategyType getStrategy() {
            return strategy;
        }

        public String getMessage() {
            return message;
        }

        public FilterResult getResult() {
            return result;
        }

        public int getProcessed() {
            return processed;
        }

        public int getErrors() {
            return errors;
        }

        public int getTotal() {
            return total;
        }
    }
}

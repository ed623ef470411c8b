package com.filterbench.service;

import com.filterbench.concurrent.RunContext;
import com.filterbench.engine.ExecutionStrategy;
import com.filterbench.engine.StrategyRegistry;
import com.filterbench.engine.StrategyType;
import com.filterbench.model.FilterTask;
import com.filterbench.model.RunOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BenchmarkServiceTest {

    private BenchmarkService benchmarkService;

    @BeforeEach
    void setUp() {
        benchmarkService = new BenchmarkService(new StrategyRegistry(List.of(
                new FixedTimeStrategy(StrategyType.SEQUENTIAL, 1.5, 1),
                new FixedTimeStrategy(StrategyType.THREAD_POOL, 0.5, 3))));
    }

    @Test
    void speedupAndEfficiencyFromMeans() {
        benchmarkService.record(StrategyType.SEQUENTIAL, 2.0);
        benchmarkService.record(StrategyType.THREAD_POOL, 0.5);

        double speedup = benchmarkService.speedup(StrategyType.THREAD_POOL).getAsDouble();

        assertThat(speedup).isCloseTo(4.0, within(1e-9));
        assertThat(BenchmarkService.efficiency(speedup, 4)).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void compareAveragesEachStrategy() {
        benchmarkService.record(StrategyType.SEQUENTIAL, 1.0);
        benchmarkService.record(StrategyType.SEQUENTIAL, 3.0);

        Map<StrategyType, Double> averages = benchmarkService.compare();

        assertThat(averages.get(StrategyType.SEQUENTIAL)).isEqualTo(2.0);
        assertThat(averages.get(StrategyType.PROCESS_POOL)).isEqualTo(0.0);
        assertThat(averages).containsOnlyKeys(StrategyType.values());
    }

    @Test
    void speedupIsUndefinedWithoutBothHistories() {
        assertThat(benchmarkService.speedup(StrategyType.THREAD_POOL)).isEmpty();

        benchmarkService.record(StrategyType.SEQUENTIAL, 1.0);
        assertThat(benchmarkService.speedup(StrategyType.THREAD_POOL)).isEmpty();
    }

    @Test
    void speedupIsUndefinedForZeroCandidateTime() {
        benchmarkService.record(StrategyType.SEQUENTIAL, 1.0);
        benchmarkService.record(StrategyType.THREAD_POOL, 0.0);

        assertThat(benchmarkService.speedup(StrategyType.THREAD_POOL)).isEmpty();
    }

    @Test
    void efficiencyRequiresPositiveWorkers() {
        assertThatThrownBy(() -> BenchmarkService.efficiency(2.0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativeElapsedTime() {
        assertThatThrownBy(() -> benchmarkService.record(StrategyType.SEQUENTIAL, -0.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(benchmarkService.history(StrategyType.SEQUENTIAL)).isEmpty();
    }

    @Test
    void runAndRecordAppendsElapsedTimeAndWorkerCount() {
        RunOutcome first = benchmarkService.runAndRecord(StrategyType.THREAD_POOL, List.of(), new RunContext(3, 3));
        benchmarkService.runAndRecord(StrategyType.THREAD_POOL, List.of(), new RunContext(3, 3));
        benchmarkService.runAndRecord(StrategyType.SEQUENTIAL, List.of(), new RunContext(1, 1));

        assertThat(first.getElapsedSeconds()).isEqualTo(0.5);
        assertThat(benchmarkService.history(StrategyType.THREAD_POOL)).containsExactly(0.5, 0.5);
        assertThat(benchmarkService.lastWorkerCount(StrategyType.THREAD_POOL)).hasValue(3);
        assertThat(benchmarkService.speedup(StrategyType.THREAD_POOL).getAsDouble()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void historyIsACopyAndResetClearsEverything() {
        benchmarkService.record(StrategyType.SEQUENTIAL, 1.0);
        List<Double> snapshot = benchmarkService.history(StrategyType.SEQUENTIAL);
        assertThatThrownBy(() -> snapshot.add(9.0)).isInstanceOf(UnsupportedOperationException.class);

        benchmarkService.reset();

        assertThat(benchmarkService.history(StrategyType.SEQUENTIAL)).isEmpty();
        assertThat(benchmarkService.lastWorkerCount(StrategyType.SEQUENTIAL)).isEmpty();
        assertThat(snapshot).containsExactly(1.0);
    }

    @Test
    void ratioIsUndefinedForZeroCandidate() {
        assertThat(BenchmarkService.ratio(1.0, 0.0)).isEmpty();
        assertThat(BenchmarkService.ratio(3.0, 1.5)).hasValue(2.0);
    }

    /** Reports a fixed elapsed time without doing any work. */
    private static final class FixedTimeStrategy implements ExecutionStrategy {

        private final StrategyType type;
        private final double seconds;
        private final int workers;

        FixedTimeStrategy(StrategyType type, double seconds, int workers) {
            this.type = type;
            this.seconds = seconds;
            this.workers = workers;
        }

        @Override
        public StrategyType getType() {
            return type;
        }

        @Override
        public RunOutcome execute(List<FilterTask> tasks, RunContext context) {
            return new RunOutcome(type, List.of(), seconds, workers);
        }
    }
}

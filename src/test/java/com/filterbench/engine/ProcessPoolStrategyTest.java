package com.filterbench.engine;

import com.filterbench.TestImages;
import com.filterbench.concurrent.RunContext;
import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import com.filterbench.model.FilterType;
import com.filterbench.model.RunOutcome;
import com.filterbench.worker.FilterWorkerMain;
import com.filterbench.worker.WorkerLauncher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Starts real worker JVMs from the test class path.
 */
class ProcessPoolStrategyTest {

    @TempDir
    Path tempDir;

    @Test
    void processesImagesInWorkerProcesses() throws Exception {
        Path out = tempDir.resolve("out");
        List<FilterTask> tasks = new ArrayList<>(TestImages.tasks(TestImages.writeBatch(tempDir, 4),
                FilterType.GRAYSCALE, out, StrategyType.PROCESS_POOL));
        tasks.add(new FilterTask(tempDir.resolve("ghost.png").toString(), FilterType.GRAYSCALE,
                out.toString(), StrategyType.PROCESS_POOL.getMethodTag()));
        RunContext context = new RunContext(2, 2);

        ProcessPoolStrategy strategy = new ProcessPoolStrategy(
                WorkerLauncher.forMainClass(FilterWorkerMain.class.getName(), 0), false, 5_000);
        RunOutcome outcome = strategy.execute(tasks, context);

        assertThat(outcome.getResults()).hasSize(5);
        assertThat(outcome.getWorkerCount()).isEqualTo(2);
        assertThat(outcome.countOk()).isEqualTo(4);
        assertThat(context.getProcessed()).isEqualTo(4);
        assertThat(context.getErrors()).isEqualTo(1);
        assertThat(out.resolve("img0_multiprocess.png")).exists();
        assertThat(outcome.getResults()).filteredOn(r -> !r.isOk())
                .singleElement()
                .satisfies(r -> assertThat(r.getMessage()).startsWith("Error in ghost.png"));
    }

    @Test
    void crashedWorkerYieldsErrorAndIsReplaced() throws Exception {
        Path out = tempDir.resolve("out");
        List<FilterTask> tasks = new ArrayList<>(TestImages.tasks(TestImages.writeBatch(tempDir, 3),
                FilterType.BLUR, out, StrategyType.PROCESS_POOL));
        Path crash = TestImages.write(tempDir, "crash.png", 4, 4);
        tasks.add(1, new FilterTask(crash.toString(), FilterType.BLUR, out.toString(),
                StrategyType.PROCESS_POOL.getMethodTag()));
        RunContext context = new RunContext(1, 1);

        ProcessPoolStrategy strategy = new ProcessPoolStrategy(
                WorkerLauncher.forMainClass("com.filterbench.worker.CrashingWorkerMain", 0), true, 5_000);
        RunOutcome outcome = strategy.execute(tasks, context);

        assertThat(outcome.getResults()).hasSize(4);
        assertThat(outcome.getResults()).filteredOn(FilterResult::isOk).hasSize(3);
        assertThat(outcome.getResults()).filteredOn(r -> !r.isOk())
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.getOriginal()).isEqualTo(crash.toString());
                    assertThat(r.getMessage()).contains("worker process failed");
                });
        assertThat(context.getGate().activeCount()).isZero();
    }

    @Test
    void unresolvablePathIsAnsweredByWorker() throws Exception {
        Path out = tempDir.resolve("out");
        List<FilterTask> tasks = new ArrayList<>(TestImages.tasks(TestImages.writeBatch(tempDir, 2),
                FilterType.EDGE_DETECT, out, StrategyType.PROCESS_POOL));
        String badPath = tempDir.resolve("bad").toString() + "\u0000name.png";
        tasks.add(new FilterTask(badPath, FilterType.EDGE_DETECT, out.toString(),
                StrategyType.PROCESS_POOL.getMethodTag()));
        RunContext context = new RunContext(1, 1);

        RunOutcome outcome = new ProcessPoolStrategy(
                WorkerLauncher.forMainClass(FilterWorkerMain.class.getName(), 0), false, 5_000)
                .execute(tasks, context);

        assertThat(outcome.getResults()).hasSize(3);
        assertThat(outcome.countOk()).isEqualTo(2);
        assertThat(outcome.getResults()).filteredOn(r -> !r.isOk())
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.getOriginal()).isEqualTo(badPath);
                    // answered by the worker itself, not by a crash-and-replace
                    assertThat(r.getMessage()).startsWith("Error in bad\u0000name.png: ")
                            .doesNotContain("worker process failed");
                });
    }

    @Test
    void unstartableWorkerAbortsRun() throws Exception {
        List<FilterTask> tasks = TestImages.tasks(TestImages.writeBatch(tempDir, 1), FilterType.BLUR,
                tempDir.resolve("out"), StrategyType.PROCESS_POOL);
        ProcessPoolStrategy strategy = new ProcessPoolStrategy(
                new WorkerLauncher(tempDir.resolve("no-such-java").toString(), "", "x.Main", 0), false, 1_000);

        assertThatThrownBy(() -> strategy.execute(tasks, new RunContext(2, 2)))
                .isInstanceOf(StrategyExecutionException.class)
                .hasMessageContaining("Failed to start worker process pool");
    }
}

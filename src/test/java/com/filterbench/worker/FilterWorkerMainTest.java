package com.filterbench.worker;

import com.filterbench.TestImages;
import com.filterbench.filter.FilterTransforms;
import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import com.filterbench.model.FilterType;
import com.filterbench.service.ImageProcessor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class FilterWorkerMainTest {

    @TempDir
    Path tempDir;

    private final WorkerProtocol protocol = new WorkerProtocol();

    @Test
    void answersEachTaskLineWithOneResultLine() throws Exception {
        Path image = TestImages.write(tempDir, "w.png", 6, 6);
        FilterTask good = new FilterTask(image.toString(), FilterType.EMBOSS, tempDir.toString(), "multiprocess");
        FilterTask missing = new FilterTask(tempDir.resolve("gone.png").toString(), FilterType.EMBOSS,
                tempDir.toString(), "multiprocess");
        String input = protocol.writeTask(good) + "\n\n" + protocol.writeTask(missing) + "\n";

        List<String> lines = serve(input);

        assertThat(lines).hasSize(2);
        FilterResult first = protocol.readResult(lines.get(0));
        FilterResult second = protocol.readResult(lines.get(1));
        assertThat(first.isOk()).isTrue();
        assertThat(first.getOutput()).endsWith("w_multiprocess.png");
        assertThat(second.isOk()).isFalse();
        assertThat(second.getOriginal()).isEqualTo(missing.getSourcePath());
    }

    @Test
    void malformedLineGetsErrorAndWorkerContinues() throws Exception {
        Path image = TestImages.write(tempDir, "ok.png", 6, 6);
        FilterTask good = new FilterTask(image.toString(), FilterType.BLUR, tempDir.toString(), "multiprocess");
        String input = "{not json\n" + protocol.writeTask(good) + "\n";

        List<String> lines = serve(input);

        assertThat(lines).hasSize(2);
        FilterResult malformed = protocol.readResult(lines.get(0));
        assertThat(malformed.isOk()).isFalse();
        assertThat(malformed.getMessage()).startsWith("Malformed task");
        assertThat(malformed.getMethod()).isEqualTo("multiprocess");
        assertThat(protocol.readResult(lines.get(1)).isOk()).isTrue();
    }

    @Test
    void unexpectedProcessorFailureIsAnsweredAndWorkerContinues() throws Exception {
        ImageProcessor flaky = new ImageProcessor(FilterTransforms.defaults(), 0) {
            @Override
            public FilterResult execute(FilterTask task) {
                if (task.getSourcePath().endsWith("first.png")) {
                    throw new IllegalStateException("transform blew up");
                }
                return super.execute(task);
            }
        };
        Path image = TestImages.write(tempDir, "second.png", 6, 6);
        FilterTask first = new FilterTask(tempDir.resolve("first.png").toString(), FilterType.BLUR,
                tempDir.toString(), "multiprocess");
        FilterTask second = new FilterTask(image.toString(), FilterType.BLUR, tempDir.toString(), "multiprocess");
        String input = protocol.writeTask(first) + "\n" + protocol.writeTask(second) + "\n";

        List<String> lines = serve(flaky, input);

        assertThat(lines).hasSize(2);
        FilterResult failed = protocol.readResult(lines.get(0));
        assertThat(failed.isOk()).isFalse();
        assertThat(failed.getOriginal()).isEqualTo(first.getSourcePath());
        assertThat(failed.getMessage()).startsWith("Error in first.png: ").contains("transform blew up");
        assertThat(protocol.readResult(lines.get(1)).isOk()).isTrue();
    }

    @Test
    void parsesLatencyArgument() {
        assertThat(FilterWorkerMain.parseLatency(new String[] { "--min-latency-ms=250" })).isEqualTo(250);
        assertThat(FilterWorkerMain.parseLatency(new String[0])).isZero();
    }

    @Test
    void launcherCommandRunsWorkerHeadlessWithLatency() {
        WorkerLauncher launcher = new WorkerLauncher("/opt/jdk/bin/java", "/app/classes", "a.b.Main", 75);
        assertThat(launcher.command()).containsExactly("/opt/jdk/bin/java", "-Djava.awt.headless=true",
                "-cp", "/app/classes", "a.b.Main", "--min-latency-ms=75");
    }

    private List<String> serve(String input) throws Exception {
        return serve(new ImageProcessor(FilterTransforms.defaults(), 0), input);
    }

    private List<String> serve(ImageProcessor processor, String input) throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        FilterWorkerMain.serve(processor,
                new BufferedReader(new StringReader(input)), out,
                LoggerFactory.getLogger(FilterWorkerMainTest.class));
        return buffer.toString(StandardCharsets.UTF_8).lines().collect(Collectors.toList());
    }
}

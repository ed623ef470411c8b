package com.filterbench.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.filterbench.engine.StrategyType;
import com.filterbench.filter.FilterTransforms;
import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import com.filterbench.service.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Entry point of a process-pool worker JVM.
 *
 * Reads tasks line by line from stdin, runs each through an
 * {@link ImageProcessor} and answers with one result line on stdout. Exits
 * when stdin is closed. Everything else the JVM prints goes to stderr.
 */
public class FilterWorkerMain {

    static final String LATENCY_ARG = "--min-latency-ms=";

    public static void main(String[] args) throws IOException {
        PrintStream protocolOut = new PrintStream(System.out, false, StandardCharsets.UTF_8);
        System.setOut(System.err);
        Logger log = LoggerFactory.getLogger(FilterWorkerMain.class);

        long latencyMs = parseLatency(args);
        ImageProcessor processor = new ImageProcessor(FilterTransforms.defaults(), latencyMs);
        serve(processor, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                protocolOut, log);
    }

    static void serve(ImageProcessor processor, BufferedReader in, PrintStream out, Logger log) throws IOException {
        WorkerProtocol protocol = new WorkerProtocol();
        log.debug("Worker ready (latency floor {} ms)", processor.getMinLatencyMs());

        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            FilterResult result;
            FilterTask task = null;
            try {
                task = protocol.readTask(line);
                result = processor.execute(task);
            } catch (JsonProcessingException e) {
                log.error("Malformed task line: {}", e.getOriginalMessage());
                result = FilterResult.error("", "Malformed task: " + e.getOriginalMessage(),
                        StrategyType.PROCESS_POOL.getMethodTag());
            } catch (RuntimeException e) {
                // the worker must answer every line, or the dispatcher sees a dead process
                log.error("Task failed: {}", task, e);
                result = task != null
                        ? FilterResult.error(task, "Error in " + task.getSourceFileName() + ": " + e)
                        : FilterResult.error("", "Malformed task: " + e, StrategyType.PROCESS_POOL.getMethodTag());
            }
            out.println(protocol.writeResult(result));
            out.flush();
        }
        log.debug("Worker input closed; exiting");
    }

    static long parseLatency(String[] args) {
        for (String arg : args) {
            if (arg.startsWith(LATENCY_ARG)) {
                return Long.parseLong(arg.substring(LATENCY_ARG.length()));
            }
        }
        return 0;
    }
}

package com.filterbench.worker;

import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Handle on one running worker JVM. Not thread-safe: the pool lends a worker
 * to one dispatcher at a time.
 */
public class WorkerProcess implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcess.class);

    private static final long EXIT_WAIT_MS = 1000;

    private final int id;
    private final Process process;
    private final BufferedWriter toWorker;
    private final BufferedReader fromWorker;
    private final WorkerProtocol protocol = new WorkerProtocol();

    WorkerProcess(int id, Process process) {
        this.id = id;
        this.process = process;
        this.toWorker = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.fromWorker = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
    }

    /**
     * Sends one task and blocks for its result.
     *
     * @throws IOException if the worker is gone or answers with something unreadable
     */
    public FilterResult execute(FilterTask task) throws IOException {
        if (!process.isAlive()) {
            throw new EOFException("worker " + id + " is not running (exit code " + process.exitValue() + ")");
        }
        toWorker.write(protocol.writeTask(task));
        toWorker.newLine();
        toWorker.flush();

        String line = fromWorker.readLine();
        if (line == null) {
            throw new EOFException("worker " + id + " exited" + exitCodeSuffix());
        }
        return protocol.readResult(line);
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public int getId() {
        return id;
    }

    public long pid() {
        return process.pid();
    }

    /**
     * Closes the worker's stdin so it exits on its own, then waits up to
     * {@code timeoutMs} before killing it.
     */
    public void shutdown(long timeoutMs) {
        try {
            toWorker.close();
        } catch (IOException e) {
            log.debug("Worker {} stdin already closed: {}", id, e.getMessage());
        }
        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Worker {} (pid {}) did not exit within {} ms; killing it", id, process.pid(), timeoutMs);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        } finally {
            closeQuietly(fromWorker);
        }
    }

    @Override
    public void close() {
        shutdown(EXIT_WAIT_MS);
    }

    private String exitCodeSuffix() {
        try {
            if (process.waitFor(EXIT_WAIT_MS, TimeUnit.MILLISECONDS)) {
                return " with code " + process.exitValue();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "";
    }

    private void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Worker {} stream close failed: {}", id, e.getMessage());
        }
    }
}

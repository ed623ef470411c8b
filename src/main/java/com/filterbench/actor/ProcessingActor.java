package com.filterbench.actor;

import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import com.filterbench.service.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker with a private FIFO inbox that pushes its results onto an outbox
 * shared with the other actors of its pool.
 *
 * The actor runs on its own daemon thread and polls the inbox with a timeout.
 * Stopping is a message, not a flag: {@link #stop()} enqueues a STOP entry
 * behind whatever is already queued. Under {@link ShutdownPolicy#DRAIN} the
 * queued tasks run first; under {@link ShutdownPolicy#DISCARD} they are
 * removed from the inbox before STOP is enqueued. Work in flight is never
 * interrupted.
 */
public class ProcessingActor {

    private static final Logger log = LoggerFactory.getLogger(ProcessingActor.class);

    private final int id;
    private final BlockingQueue<ActorMessage> inbox = new LinkedBlockingQueue<>();
    private final BlockingQueue<FilterResult> outbox;
    private final ImageProcessor processor;
    private final long pollTimeoutMs;
    private final ShutdownPolicy shutdownPolicy;
    private final Thread thread;

    private final AtomicInteger assignedCount = new AtomicInteger();
    private final AtomicInteger processedCount = new AtomicInteger();
    private volatile ActorState state = ActorState.CREATED;
    private boolean stopRequested;

    public ProcessingActor(int id, BlockingQueue<FilterResult> outbox, ImageProcessor processor,
            long pollTimeoutMs, ShutdownPolicy shutdownPolicy) {
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException("Poll timeout must be positive, got " + pollTimeoutMs);
        }
        this.id = id;
        this.outbox = outbox;
        this.processor = processor;
        this.pollTimeoutMs = pollTimeoutMs;
        this.shutdownPolicy = shutdownPolicy;
        this.thread = new Thread(this::runLoop, "actor-" + id);
        this.thread.setDaemon(true);
    }

    public synchronized void start() {
        if (state != ActorState.CREATED) {
            throw new IllegalStateException("Actor " + id + " already started");
        }
        state = ActorState.RUNNING;
        thread.start();
    }

    /**
     * Queues a task. Never blocks and does not require the actor to be idle.
     *
     * @throws IllegalStateException if the actor has been asked to stop
     */
    public synchronized void submit(FilterTask task) {
        if (stopRequested) {
            throw new IllegalStateException("Actor " + id + " is stopping; cannot accept " + task);
        }
        assignedCount.incrementAndGet();
        inbox.add(ActorMessage.task(task));
    }

    /**
     * Asks the actor to exit once it reaches the stop message. Returns
     * immediately; use {@link #awaitTermination(long)} to wait for the thread.
     *
     * @return the number of queued tasks dropped by the DISCARD policy, 0 under DRAIN
     */
    public synchronized int stop() {
        if (stopRequested) {
            return 0;
        }
        stopRequested = true;

        int discarded = 0;
        if (shutdownPolicy == ShutdownPolicy.DISCARD) {
            List<ActorMessage> dropped = new ArrayList<>();
            inbox.drainTo(dropped);
            discarded = dropped.size();
            if (discarded > 0) {
                log.warn("Actor {} discarded {} queued task(s) on stop", id, discarded);
            }
        }
        inbox.add(ActorMessage.stop());
        if (state == ActorState.CREATED) {
            state = ActorState.STOPPED;
        }
        return discarded;
    }

    /**
     * Waits for the actor thread to exit.
     *
     * @return true if the actor stopped within the timeout
     */
    public boolean awaitTermination(long timeoutMs) throws InterruptedException {
        if (state == ActorState.STOPPED) {
            return true;
        }
        thread.join(Math.max(1, timeoutMs));
        return !thread.isAlive();
    }

    private void runLoop() {
        log.debug("Actor {} started", id);
        try {
            while (true) {
                ActorMessage message = inbox.poll(pollTimeoutMs, TimeUnit.MILLISECONDS);
                if (message == null) {
                    continue;
                }
                if (message.getKind() == ActorMessage.Kind.STOP) {
                    break;
                }
                outbox.add(process(message.getTask()));
                processedCount.incrementAndGet();
            }
        } catch (InterruptedException e) {
            log.warn("Actor {} interrupted with {} message(s) still queued", id, inbox.size());
            Thread.currentThread().interrupt();
        } finally {
            state = ActorState.STOPPED;
            log.debug("Actor {} stopped after {} task(s)", id, processedCount.get());
        }
    }

    private FilterResult process(FilterTask task) {
        try {
            return processor.execute(task);
        } catch (RuntimeException e) {
            // keeps one result per task so the pool's collector never waits forever
            log.error("Actor {} failed on {}", id, task.getSourcePath(), e);
            return FilterResult.error(task, "Error in " + task.getSourceFileName() + ": " + e);
        }
    }

    public int getId() {
        return id;
    }

    public ActorState getState() {
        return state;
    }

    public int getAssignedCount() {
        return assignedCount.get();
    }

    public int getProcessedCount() {
        return processedCount.get();
    }

    public int getQueuedCount() {
        return inbox.size();
    }
}

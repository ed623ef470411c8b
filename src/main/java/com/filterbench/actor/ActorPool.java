package com.filterbench.actor;

import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import com.filterbench.service.ImageProcessor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * A fixed group of {@link ProcessingActor}s sharing one outbox, with a
 * round-robin dispatcher in front of them.
 *
 * Results arrive in completion order across actors; each actor still handles
 * its own tasks in the order they were dispatched to it.
 */
public class ActorPool {

    private final List<ProcessingActor> actors;
    private final BlockingQueue<FilterResult> outbox = new LinkedBlockingQueue<>();

    public ActorPool(int size, ImageProcessor processor, long pollTimeoutMs, ShutdownPolicy shutdownPolicy) {
        if (size <= 0) {
            throw new IllegalArgumentException("Actor count must be positive, got " + size);
        }
        List<ProcessingActor> created = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            created.add(new ProcessingActor(i, outbox, processor, pollTimeoutMs, shutdownPolicy));
        }
        this.actors = Collections.unmodifiableList(created);
    }

    public void start() {
        for (ProcessingActor actor : actors) {
            actor.start();
        }
    }

    /**
     * Sends task {@code i} to actor {@code i mod size}.
     */
    public void dispatch(List<FilterTask> tasks) {
        for (int i = 0; i < tasks.size(); i++) {
            actors.get(i % actors.size()).submit(tasks.get(i));
        }
    }

    /**
     * Blocks until {@code expected} results have been taken from the shared
     * outbox, handing each to {@code onResult} as it arrives.
     */
    public List<FilterResult> collect(int expected, Consumer<FilterResult> onResult) throws InterruptedException {
        List<FilterResult> results = new ArrayList<>(expected);
        for (int i = 0; i < expected; i++) {
            FilterResult result = outbox.take();
            onResult.accept(result);
            results.add(result);
        }
        return results;
    }

    /**
     * Sends the stop message to every actor.
     *
     * @return total number of tasks dropped under the DISCARD policy
     */
    public int stop() {
        int discarded = 0;
        for (ProcessingActor actor : actors) {
            discarded += actor.stop();
        }
        return discarded;
    }

    /**
     * Waits for every actor thread to exit, sharing one overall deadline.
     *
     * @return true if all actors stopped in time
     */
    public boolean awaitTermination(long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        boolean all = true;
        for (ProcessingActor actor : actors) {
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            all &= actor.awaitTermination(Math.max(1, remaining));
        }
        return all;
    }

    public List<ProcessingActor> getActors() {
        return actors;
    }

    public int size() {
        return actors.size();
    }
}

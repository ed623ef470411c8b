package com.filterbench.concurrent;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counting admission gate that limits how many task executions run at once,
 * independently of the size of the pool that schedules them.
 *
 * The number of admitted holders is tracked next to the semaphore so the live
 * metrics can show it. A holder is counted only after its permit is granted
 * and uncounted before the permit is handed back, which keeps
 * {@code 0 <= active <= capacity} at every observable instant.
 */
public class BoundedGate {

    private final int capacity;
    private final Semaphore permits;
    private final Lock lock = new ReentrantLock();
    private int active;
    private int peakActive;

    public BoundedGate(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Gate capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity);
    }

    /**
     * Blocks until a permit is available, then admits the caller.
     */
    public void acquire() throws InterruptedException {
        permits.acquire();
        lock.lock();
        try {
            active++;
            if (active > peakActive) {
                peakActive = active;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases one admission and lets the next waiter in.
     *
     * @throws IllegalStateException if nobody holds the gate
     */
    public void release() {
        lock.lock();
        try {
            if (active == 0) {
                throw new IllegalStateException("release() without a matching acquire()");
            }
            active--;
        } finally {
            lock.unlock();
        }
        permits.release();
    }

    /**
     * Runs the action while holding the gate. The gate is released on every
     * exit path, including when the action throws.
     */
    public <T> T withPermit(Callable<T> action) throws Exception {
        acquire();
        try {
            return action.call();
        } finally {
            release();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    /** Highest number of simultaneous holders seen so far. */
    public int peakActiveCount() {
        lock.lock();
        try {
            return peakActive;
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}

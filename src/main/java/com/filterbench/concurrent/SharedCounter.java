package com.filterbench.concurrent;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock-protected monotonic counter shared between execution units.
 * Reads and increments are mutually exclusive, so a read always reflects every
 * increment that completed before it.
 */
public class SharedCounter {

    private final Lock lock = new ReentrantLock();
    private int value;

    /**
     * Adds one and returns the new value.
     */
    public int increment() {
        lock.lock();
        try {
            value++;
            return value;
        } finally {
            lock.unlock();
        }
    }

    public int get() {
        lock.lock();
        try {
            return value;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return String.valueOf(get());
    }
}

package io.blockchain.mining.chain;

import io.blockchain.mining.protocol.Hash;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Monitor announcing best-block changes to waiting threads. The chain index publishes after it has
 * released its own lock, so announcements may arrive out of order; waiters therefore track the
 * publish sequence and re-read the live tip themselves.
 */
public final class BestBlockSignal {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private Hash latest;
    private long sequence;

    public void publish(Hash tip) {
        lock.lock();
        try {
            latest = tip;
            sequence++;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Wakes every waiter without changing the announced tip (used on shutdown). */
    public void wakeAll() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public Hash latest() {
        lock.lock();
        try {
            return latest;
        } finally {
            lock.unlock();
        }
    }

    /** Number of announcements so far. */
    public long sequence() {
        lock.lock();
        try {
            return sequence;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until an announcement newer than {@code seen} arrives, for at most {@code timeoutNanos}.
     * Returns early when {@code abort} becomes true; it is evaluated under the monitor lock, so a
     * {@link #wakeAll()} issued after setting the flag cannot be missed.
     *
     * @return the current sequence, equal to {@code seen} on timeout or abort
     */
    public long awaitPublish(long seen, long timeoutNanos, BooleanSupplier abort) throws InterruptedException {
        lock.lock();
        try {
            long remaining = timeoutNanos;
            while (sequence == seen && !abort.getAsBoolean()) {
                if (remaining <= 0) {
                    break;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return sequence;
        } finally {
            lock.unlock();
        }
    }
}

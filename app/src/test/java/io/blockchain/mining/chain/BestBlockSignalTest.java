package io.blockchain.mining.chain;

import io.blockchain.mining.support.TestChain;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class BestBlockSignalTest {

    @Test
    void returnsImmediatelyWhenAlreadyPublished() throws Exception {
        BestBlockSignal signal = new BestBlockSignal();
        long seen = signal.sequence();
        signal.publish(TestChain.hashOf(2));
        assertEquals(seen + 1, signal.awaitPublish(seen, 0, () -> false));
        assertEquals(TestChain.hashOf(2), signal.latest());
    }

    @Test
    void timesOutWithoutPublish() throws Exception {
        BestBlockSignal signal = new BestBlockSignal();
        signal.publish(TestChain.hashOf(1));
        long seen = signal.sequence();
        long start = System.nanoTime();
        assertEquals(seen, signal.awaitPublish(seen, TimeUnit.MILLISECONDS.toNanos(50), () -> false));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(40));
    }

    @Test
    void republishingSameTipStillCounts() throws Exception {
        BestBlockSignal signal = new BestBlockSignal();
        signal.publish(TestChain.hashOf(1));
        long seen = signal.sequence();
        signal.publish(TestChain.hashOf(1));
        assertEquals(seen + 1, signal.awaitPublish(seen, 0, () -> false));
    }

    @Test
    void wakesOnPublish() throws Exception {
        BestBlockSignal signal = new BestBlockSignal();
        signal.publish(TestChain.hashOf(1));
        long seen = signal.sequence();
        CountDownLatch waiting = new CountDownLatch(1);
        Thread publisher = new Thread(() -> {
            try {
                waiting.await();
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.publish(TestChain.hashOf(2));
        });
        publisher.start();
        waiting.countDown();
        assertEquals(seen + 1, signal.awaitPublish(seen, TimeUnit.SECONDS.toNanos(5), () -> false));
        publisher.join();
    }

    @Test
    void abortFlagEndsWaitOnWakeAll() throws Exception {
        BestBlockSignal signal = new BestBlockSignal();
        signal.publish(TestChain.hashOf(1));
        long seen = signal.sequence();
        AtomicBoolean abort = new AtomicBoolean();
        Thread waker = new Thread(() -> {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            abort.set(true);
            signal.wakeAll();
        });
        waker.start();
        assertEquals(seen, signal.awaitPublish(seen, TimeUnit.SECONDS.toNanos(5), abort::get));
        waker.join();
    }
}

package io.blockchain.mining.validation;

import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.support.TestChain;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ValidationEventsTest {

    @Test
    void failingListenerDoesNotStopOthers() {
        ValidationEvents events = new ValidationEvents();
        AtomicInteger calls = new AtomicInteger();
        events.register((b, o) -> { throw new IllegalStateException("boom"); });
        events.register((b, o) -> calls.incrementAndGet());
        Block block = TestChain.regtest().childOfTip(List.of());

        assertDoesNotThrow(() -> events.fireBlockChecked(block, ValidationOutcome.valid()));
        assertEquals(1, calls.get());
    }

    @Test
    void unregisteredListenerIsNotCalled() {
        ValidationEvents events = new ValidationEvents();
        List<ValidationOutcome> seen = new ArrayList<>();
        ValidationListener listener = (b, o) -> seen.add(o);
        events.register(listener);
        events.unregister(listener);

        events.fireBlockChecked(TestChain.regtest().childOfTip(List.of()), ValidationOutcome.invalid("x"));

        assertTrue(seen.isEmpty());
        assertEquals(0, events.listenerCount());
    }

    @Test
    void executorControlsDelivery() {
        List<Runnable> queued = new ArrayList<>();
        ValidationEvents events = new ValidationEvents(queued::add);
        List<ValidationOutcome> seen = new ArrayList<>();
        events.register((b, o) -> seen.add(o));

        events.fireBlockChecked(TestChain.regtest().childOfTip(List.of()), ValidationOutcome.error("late"));
        assertTrue(seen.isEmpty());

        queued.forEach(Runnable::run);
        assertEquals(List.of(ValidationOutcome.error("late")), seen);
    }
}

package io.blockchain.mining.submit;

import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.validation.ValidationEvents;
import io.blockchain.mining.validation.ValidationListener;
import io.blockchain.mining.validation.ValidationOutcome;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Captures the validation outcome of one block. Use with try-with-resources so the listener is
 * always unregistered; events for other blocks and any event after the first are ignored.
 */
public final class SubmissionObserver implements ValidationListener, AutoCloseable {
    private final ValidationEvents events;
    private final Hash target;
    private final AtomicReference<ValidationOutcome> captured = new AtomicReference<>();

    private SubmissionObserver(ValidationEvents events, Hash target) {
        this.events = events;
        this.target = target;
    }

    public static SubmissionObserver register(ValidationEvents events, Hash target) {
        SubmissionObserver observer = new SubmissionObserver(events, target);
        events.register(observer);
        return observer;
    }

    @Override
    public void blockChecked(Block block, ValidationOutcome outcome) {
        if (block.hash().equals(target)) {
            captured.compareAndSet(null, outcome);
        }
    }

    public boolean found() {
        return captured.get() != null;
    }

    public Optional<ValidationOutcome> outcome() {
        return Optional.ofNullable(captured.get());
    }

    @Override
    public void close() {
        events.unregister(this);
    }
}

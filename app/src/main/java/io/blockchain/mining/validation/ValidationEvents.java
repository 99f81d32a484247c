package io.blockchain.mining.validation;

import io.blockchain.mining.protocol.Block;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fan-out of validation events. Delivery is on the calling thread unless an executor is supplied,
 * in which case a listener may be unregistered before its event arrives.
 */
public final class ValidationEvents {
    private static final Logger LOG = Logger.getLogger(ValidationEvents.class.getName());

    private final List<ValidationListener> listeners = new CopyOnWriteArrayList<>();
    private final Executor executor;

    public ValidationEvents() {
        this(Runnable::run);
    }

    public ValidationEvents(Executor executor) {
        this.executor = executor;
    }

    public void register(ValidationListener listener) {
        listeners.add(listener);
    }

    public void unregister(ValidationListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void fireBlockChecked(Block block, ValidationOutcome outcome) {
        executor.execute(() -> {
            for (ValidationListener l : listeners) {
                try {
                    l.blockChecked(block, outcome);
                } catch (RuntimeException e) {
                    LOG.log(Level.WARNING, "Validation listener failed for " + block.hash().hex(), e);
                }
            }
        });
    }
}

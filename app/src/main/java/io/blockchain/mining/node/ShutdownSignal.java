package io.blockchain.mining.node;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Process-wide stop request. Listeners run once, on the thread that first calls {@link #request()}.
 */
public final class ShutdownSignal {
    private static final Logger LOG = Logger.getLogger(ShutdownSignal.class.getName());

    private final AtomicBoolean requested = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void request() {
        if (requested.compareAndSet(false, true)) {
            LOG.info("Shutdown requested");
            for (Runnable r : listeners) {
                r.run();
            }
        }
    }

    public boolean isRequested() {
        return requested.get();
    }

    public void addListener(Runnable listener) {
        listeners.add(listener);
    }
}

package io.blockchain.mining.template;

import io.blockchain.mining.chain.BestBlockSignal;
import io.blockchain.mining.chain.ChainState;
import io.blockchain.mining.mempool.Mempool;
import io.blockchain.mining.metrics.MiningMetrics;
import io.blockchain.mining.node.ShutdownSignal;

import java.time.Duration;
import java.util.logging.Logger;

/**
 * Holds a template request until the chain tip moves, the mempool changes, or the node shuts down.
 *
 * <p>The wait runs against an outer deadline. When it passes, a changed mempool version ends the wait;
 * otherwise the deadline is pushed out by the re-check interval. Tip changes end the wait at once and a
 * shutdown request supersedes both. No chain lock is held while suspended.
 */
public final class LongPollCoordinator {
    private static final Logger LOG = Logger.getLogger(LongPollCoordinator.class.getName());

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(1);
    public static final Duration DEFAULT_RECHECK = Duration.ofSeconds(10);

    public enum WaitResult { TIP_CHANGED, MEMPOOL_CHANGED, SHUTDOWN_REQUESTED }

    private final ChainState chain;
    private final Mempool mempool;
    private final BestBlockSignal signal;
    private final ShutdownSignal shutdown;
    private final Duration timeout;
    private final Duration recheck;

    public LongPollCoordinator(ChainState chain, Mempool mempool, BestBlockSignal signal, ShutdownSignal shutdown,
                               Duration timeout, Duration recheck) {
        if (timeout.isNegative() || recheck.isNegative() || recheck.isZero()) {
            throw new IllegalArgumentException("timeout must be >= 0 and recheck > 0");
        }
        this.chain = chain;
        this.mempool = mempool;
        this.signal = signal;
        this.shutdown = shutdown;
        this.timeout = timeout;
        this.recheck = recheck;
    }

    public LongPollCoordinator(ChainState chain, Mempool mempool, BestBlockSignal signal, ShutdownSignal shutdown) {
        this(chain, mempool, signal, shutdown, DEFAULT_TIMEOUT, DEFAULT_RECHECK);
    }

    public WaitResult await(LongPollToken token) throws InterruptedException {
        WaitResult result = awaitInternal(token);
        MiningMetrics.recordLongPoll(result.name());
        LOG.fine(() -> "Long poll on " + token.identity() + " finished: " + result);
        return result;
    }

    private WaitResult awaitInternal(LongPollToken token) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        long seen = signal.sequence();
        while (true) {
            if (shutdown.isRequested()) {
                return WaitResult.SHUTDOWN_REQUESTED;
            }
            if (!chain.currentTip().hash().equals(token.watchedTip())) {
                return WaitResult.TIP_CHANGED;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                if (mempool.transactionsUpdated() != token.watchedVersion()) {
                    return WaitResult.MEMPOOL_CHANGED;
                }
                deadline = System.nanoTime() + recheck.toNanos();
                continue;
            }
            // a publish only wakes us; the live tip decides
            seen = signal.awaitPublish(seen, remaining, shutdown::isRequested);
        }
    }
}

package io.blockchain.mining.miner;

import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.consensus.NetworkMode;
import io.blockchain.mining.error.ErrorCode;
import io.blockchain.mining.error.MiningException;
import io.blockchain.mining.node.PeerManager;
import io.blockchain.mining.node.ShutdownSignal;
import io.blockchain.mining.protocol.Script;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background mining threads. Each thread mines one block at a time with a bounded try budget so that
 * stop requests are noticed between chunks.
 */
public final class MinerController {
    private static final Logger LOG = Logger.getLogger(MinerController.class.getName());

    static final long TRIES_PER_CHUNK = 100_000;
    private static final long RETRY_PAUSE_MS = 500;

    private final DirectMiner miner;
    private final ConsensusParams params;
    private final PeerManager peers;
    private final ShutdownSignal shutdown;
    private final Script payout;

    private ExecutorService workers;
    private volatile boolean running;
    private final AtomicInteger liveWorkers = new AtomicInteger();
    private int threads;
    private long startNanos;
    private long startHashes;

    /** {@code payout} null mines to an anyone-can-spend output; {@code peers} null means no peer-to-peer. */
    public MinerController(DirectMiner miner, ConsensusParams params, PeerManager peers,
                           ShutdownSignal shutdown, Script payout) {
        this.miner = miner;
        this.params = params;
        this.peers = peers;
        this.shutdown = shutdown;
        this.payout = payout != null ? payout : Script.ANYONE_CAN_SPEND;
        shutdown.addListener(this::stop);
    }

    /**
     * Starts {@code nThreads} mining threads, replacing any running ones. Negative means one per core,
     * zero stops mining.
     */
    public synchronized MinerStatus start(int nThreads) {
        if (params.mode() == NetworkMode.PROOF_OF_STAKE) {
            throw new MiningException(ErrorCode.INVALID_REQUEST, "Action impossible on " + params.name());
        }
        if (peers == null) {
            throw new MiningException(ErrorCode.CLIENT_P2P_DISABLED,
                    "Error: Peer-to-peer functionality missing or disabled");
        }
        stop();
        int n = nThreads < 0 ? Runtime.getRuntime().availableProcessors() : nThreads;
        if (n == 0) {
            return new MinerStatus(MinerStatus.STOPPED, 0);
        }

        AtomicInteger seq = new AtomicInteger();
        workers = Executors.newFixedThreadPool(n, r -> {
            Thread t = new Thread(r, "mining-miner-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        running = true;
        liveWorkers.set(n);
        threads = n;
        startNanos = System.nanoTime();
        startHashes = miner.hashesTried();
        for (int i = 0; i < n; i++) {
            workers.submit(this::mineLoop);
        }
        LOG.info(() -> "Miner started with " + n + " threads");
        return new MinerStatus(MinerStatus.ACTIVE, n);
    }

    public synchronized MinerStatus stop() {
        if (workers != null) {
            running = false;
            workers.shutdown();
            try {
                if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
            workers = null;
            LOG.info("Miner stopped");
        }
        threads = 0;
        return new MinerStatus(MinerStatus.STOPPED, 0);
    }

    public MinerStatus status() {
        return new MinerStatus(isRunning() ? MinerStatus.ACTIVE : MinerStatus.STOPPED, null);
    }

    /** True while a run is requested and at least one worker is still alive. */
    public boolean isRunning() {
        return running && liveWorkers.get() > 0;
    }

    public synchronized int threadCount() {
        return threads;
    }

    /** Hashes per minute since the current run started; 0 when idle. */
    public synchronized double hashesPerMinute() {
        if (!running) {
            return 0.0;
        }
        long elapsed = System.nanoTime() - startNanos;
        if (elapsed <= 0) {
            return 0.0;
        }
        return (miner.hashesTried() - startHashes) * 60e9 / elapsed;
    }

    private void mineLoop() {
        try {
            while (running && !shutdown.isRequested() && !Thread.currentThread().isInterrupted()) {
                try {
                    miner.mineBlocks(payout, 1, TRIES_PER_CHUNK);
                } catch (RuntimeException e) {
                    LOG.log(Level.WARNING, "Mining attempt failed", e);
                    pause();
                }
            }
        } finally {
            if (liveWorkers.decrementAndGet() == 0 && running) {
                running = false;
                if (!shutdown.isRequested()) {
                    LOG.warning("All mining threads exited");
                }
            }
        }
    }

    private static void pause() {
        try {
            Thread.sleep(RETRY_PAUSE_MS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}

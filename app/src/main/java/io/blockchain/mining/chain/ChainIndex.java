package io.blockchain.mining.chain;

import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.consensus.ProofOfWork;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.storage.ChainStore;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Block index over a {@link ChainStore}: tracks every known header, the best tip by cumulative work,
 * and announces tip changes on a {@link BestBlockSignal} once the write lock is released.
 */
public final class ChainIndex implements ChainState {
    private static final Logger LOG = Logger.getLogger(ChainIndex.class.getName());

    private final ChainStore store;
    private final ConsensusParams params;
    private final BestBlockSignal signal;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Consumer<Block>> tipListeners = new CopyOnWriteArrayList<>();

    private ChainTip tip;
    private BigInteger tipWork;
    private volatile boolean leftInitialSync;

    /**
     * Opens the index. An empty store is seeded with {@code genesis}; otherwise the persisted tip is resumed.
     */
    public ChainIndex(ChainStore store, ConsensusParams params, BestBlockSignal signal, Clock clock, Block genesis) {
        this.store = store;
        this.params = params;
        this.signal = signal;
        this.clock = clock;

        Optional<Hash> persisted = store.getBestTip();
        if (persisted.isPresent()) {
            BlockRecord rec = store.getRecord(persisted.get())
                    .orElseThrow(() -> new IllegalStateException("best tip record missing: " + persisted.get().hex()));
            setTipLocked(rec);
            LOG.info(() -> "Resumed chain at height " + rec.height() + " (" + rec.hash().hex() + ")");
        } else {
            BlockHeader h = genesis.header();
            BlockRecord rec = new BlockRecord(h.hash(), h, 0, BlockStatus.FULLY_VALID,
                    ProofOfWork.blockWork(h.bits()), true);
            store.putBlock(genesis);
            store.putRecord(rec);
            store.setBestTip(rec.hash());
            setTipLocked(rec);
            LOG.info(() -> "Initialised chain with genesis " + rec.hash().hex());
        }
        signal.publish(tip.hash());
    }

    public ConsensusParams params() { return params; }

    /** Called with the new tip block after every tip change, outside the chain lock. */
    public void addTipListener(Consumer<Block> listener) {
        tipListeners.add(listener);
    }

    @Override
    public ChainTip currentTip() {
        lock.readLock().lock();
        try {
            return tip;
        } finally {
            lock.readLock().unlock();
        }
    }

    public BigInteger tipChainWork() {
        lock.readLock().lock();
        try {
            return tipWork;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<BlockRecord> lookup(Hash hash) {
        lock.readLock().lock();
        try {
            return store.getRecord(hash);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Block> block(Hash hash) {
        lock.readLock().lock();
        try {
            return store.getBlock(hash);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long medianTimePast(Hash hash) {
        lock.readLock().lock();
        try {
            return medianTimePastLocked(hash);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isInitialSync() {
        if (leftInitialSync) {
            return false;
        }
        ChainTip t = currentTip();
        long tipTime = lookup(t.hash()).map(r -> r.header().time()).orElse(0L);
        long age = clock.instant().getEpochSecond() - tipTime;
        if (age < params.maxTipAgeSeconds()) {
            leftInitialSync = true;
            LOG.info("Leaving initial sync");
            return false;
        }
        return true;
    }

    /** Records a header whose parent is known. Existing records are returned unchanged. */
    public BlockRecord storeHeader(BlockHeader header) {
        lock.writeLock().lock();
        try {
            Optional<BlockRecord> existing = store.getRecord(header.hash());
            if (existing.isPresent()) {
                return existing.get();
            }
            BlockRecord rec = newRecord(header, BlockStatus.HEADER_VALID, false);
            store.putRecord(rec);
            return rec;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Records a block with the given status. Bodies are kept only for blocks that did not fail. */
    public BlockRecord storeBlock(Block block, BlockStatus status) {
        lock.writeLock().lock();
        try {
            boolean keepData = status != BlockStatus.FAILED;
            BlockRecord rec = store.getRecord(block.hash())
                    .map(r -> new BlockRecord(r.hash(), r.header(), r.height(), status, r.chainWork(), r.hasData() || keepData))
                    .orElseGet(() -> newRecord(block.header(), status, keepData));
            if (keepData) {
                store.putBlock(block);
            }
            store.putRecord(rec);
            return rec;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Makes {@code candidate} the tip if it is fully valid and carries more cumulative work.
     *
     * @return true if the tip changed
     */
    public boolean activateBestChain(Hash candidate) {
        BlockRecord activated = null;
        lock.writeLock().lock();
        try {
            Optional<BlockRecord> rec = store.getRecord(candidate);
            if (rec.isPresent() && rec.get().status() == BlockStatus.FULLY_VALID
                    && rec.get().chainWork().compareTo(tipWork) > 0) {
                activated = rec.get();
                store.setBestTip(activated.hash());
                setTipLocked(activated);
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (activated == null) {
            return false;
        }
        BlockRecord newTip = activated;
        LOG.fine(() -> "New tip " + newTip.hash().hex() + " at height " + newTip.height());
        signal.publish(newTip.hash());
        Optional<Block> body = block(newTip.hash());
        if (body.isPresent()) {
            for (Consumer<Block> listener : tipListeners) {
                listener.accept(body.get());
            }
        }
        return true;
    }

    private BlockRecord newRecord(BlockHeader header, BlockStatus status, boolean hasData) {
        BlockRecord parent = store.getRecord(header.parentHash())
                .orElseThrow(() -> new IllegalStateException("parent not indexed: " + header.parentHash().hex()));
        BigInteger work = parent.chainWork().add(ProofOfWork.blockWork(header.bits()));
        return new BlockRecord(header.hash(), header, parent.height() + 1, status, work, hasData);
    }

    private void setTipLocked(BlockRecord rec) {
        this.tip = new ChainTip(rec.hash(), rec.height(), medianTimePastLocked(rec.hash()));
        this.tipWork = rec.chainWork();
    }

    private long medianTimePastLocked(Hash hash) {
        List<Long> times = new ArrayList<>(ConsensusParams.MEDIAN_TIME_SPAN);
        Optional<BlockRecord> cursor = store.getRecord(hash);
        while (cursor.isPresent() && times.size() < ConsensusParams.MEDIAN_TIME_SPAN) {
            BlockRecord rec = cursor.get();
            times.add(rec.header().time());
            if (rec.height() == 0) break;
            cursor = store.getRecord(rec.parentHash());
        }
        if (times.isEmpty()) {
            return 0;
        }
        Collections.sort(times);
        return times.get(times.size() / 2);
    }
}

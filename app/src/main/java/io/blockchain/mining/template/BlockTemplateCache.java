package io.blockchain.mining.template;

import io.blockchain.mining.assembler.BlockAssembler;
import io.blockchain.mining.assembler.BlockAssemblyException;
import io.blockchain.mining.assembler.CandidateBlock;
import io.blockchain.mining.chain.ChainState;
import io.blockchain.mining.chain.ChainTip;
import io.blockchain.mining.error.ErrorCode;
import io.blockchain.mining.error.MiningException;
import io.blockchain.mining.mempool.Mempool;
import io.blockchain.mining.metrics.MiningMetrics;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.Script;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caches the last assembled candidate block.
 *
 * <p>An entry is reused while the chain tip is unchanged and either the mempool version is unchanged
 * or the rebuild cooldown has not yet elapsed. Rebuilds are serialized; readers see the published entry
 * through a volatile reference and never observe a half-built one.
 */
public final class BlockTemplateCache {
    private static final Logger LOG = Logger.getLogger(BlockTemplateCache.class.getName());

    public static final Duration DEFAULT_REBUILD_COOLDOWN = Duration.ofSeconds(5);

    private final ChainState chain;
    private final Mempool mempool;
    private final BlockAssembler assembler;
    private final Clock clock;
    private final Duration rebuildCooldown;
    private final ReentrantLock rebuildLock = new ReentrantLock();

    private volatile TemplateCacheEntry entry;

    public BlockTemplateCache(ChainState chain, Mempool mempool, BlockAssembler assembler,
                              Clock clock, Duration rebuildCooldown) {
        this.chain = chain;
        this.mempool = mempool;
        this.assembler = assembler;
        this.clock = clock;
        this.rebuildCooldown = rebuildCooldown;
    }

    public BlockTemplateCache(ChainState chain, Mempool mempool, BlockAssembler assembler, Clock clock) {
        this(chain, mempool, assembler, clock, DEFAULT_REBUILD_COOLDOWN);
    }

    /**
     * Returns the cached candidate, rebuilding it first when stale.
     *
     * @throws MiningException {@link ErrorCode#OUT_OF_MEMORY} if the assembler fails; the previous entry stays
     */
    public CandidateBlock getOrBuild(Script coinbaseScript) {
        TemplateCacheEntry e = entry;
        if (e != null && !isStale(e, coinbaseScript)) {
            return e.candidate();
        }
        rebuildLock.lock();
        try {
            e = entry;
            if (e != null && !isStale(e, coinbaseScript)) {
                return e.candidate();
            }
            return rebuildLocked(coinbaseScript);
        } finally {
            rebuildLock.unlock();
        }
    }

    /** Unconditional rebuild, for callers that must not reuse a template they already exhausted. */
    public CandidateBlock rebuild(Script coinbaseScript) {
        rebuildLock.lock();
        try {
            return rebuildLocked(coinbaseScript);
        } finally {
            rebuildLock.unlock();
        }
    }

    public Optional<TemplateCacheEntry> current() {
        return Optional.ofNullable(entry);
    }

    /** Mempool version the published entry was built against; 0 before the first build. */
    public long lastBuiltVersion() {
        TemplateCacheEntry e = entry;
        return e == null ? 0 : e.mempoolVersion();
    }

    private boolean isStale(TemplateCacheEntry e, Script coinbaseScript) {
        if (!e.coinbaseScript().equals(coinbaseScript)) {
            return true;
        }
        if (!chain.currentTip().hash().equals(e.tip().hash())) {
            return true;
        }
        if (mempool.transactionsUpdated() != e.mempoolVersion()) {
            Duration age = Duration.between(e.builtAt(), clock.instant());
            return age.compareTo(rebuildCooldown) >= 0;
        }
        return false;
    }

    private CandidateBlock rebuildLocked(Script coinbaseScript) {
        // Snapshot before assembling so the entry is keyed to the state it was actually built from.
        ChainTip tip = chain.currentTip();
        long version = mempool.transactionsUpdated();
        Instant start = clock.instant();

        CandidateBlock built;
        long startNanos = System.nanoTime();
        try {
            built = assembler.createNewBlock(coinbaseScript);
        } catch (BlockAssemblyException e) {
            LOG.log(Level.WARNING, "Block assembly failed on " + tip.hash().hex(), e);
            throw new MiningException(ErrorCode.OUT_OF_MEMORY, "Out of memory", e);
        }
        MiningMetrics.recordTemplateBuild(Duration.ofNanos(System.nanoTime() - startNanos));

        CandidateBlock stamped = stamp(built, tip);
        entry = new TemplateCacheEntry(stamped, tip, version, start, coinbaseScript);
        MiningMetrics.incrementTemplateRebuilds();
        LOG.fine(() -> "Rebuilt template at height " + stamped.block().header().height()
                + " with " + (stamped.block().transactions().size() - 1) + " transactions");
        return stamped;
    }

    /** Copy with time = max(mtp + 1, now) and nonce 0. */
    CandidateBlock stamp(CandidateBlock candidate, ChainTip tip) {
        Block block = candidate.block();
        long time = Math.max(tip.medianTimePast() + 1, clock.instant().getEpochSecond());
        BlockHeader header = block.header().withTime(time).withNonce(0);
        return candidate.withBlock(block.withHeader(header));
    }
}

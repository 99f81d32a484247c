package io.blockchain.mining.miner;

import io.blockchain.mining.assembler.CandidateBlock;
import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.consensus.ProofOfWork;
import io.blockchain.mining.error.ErrorCode;
import io.blockchain.mining.error.MiningException;
import io.blockchain.mining.metrics.MiningMetrics;
import io.blockchain.mining.node.ShutdownSignal;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.protocol.Script;
import io.blockchain.mining.template.BlockTemplateCache;
import io.blockchain.mining.validation.AcceptResult;
import io.blockchain.mining.validation.ValidationEngine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Mines blocks in-process with a sequential nonce search.
 *
 * <p>Each height starts from a freshly built template with a new extra nonce. A spent try budget or a
 * shutdown request ends the run with whatever was mined so far; an exhausted nonce space skips to a
 * fresh template with a new extra nonce without counting the attempt. Every evaluated hash, including a
 * winning one, is charged to the try budget.
 */
public final class DirectMiner {
    private static final Logger LOG = Logger.getLogger(DirectMiner.class.getName());

    private final BlockTemplateCache cache;
    private final ValidationEngine engine;
    private final ShutdownSignal shutdown;
    private final BigInteger powLimit;
    private final ExtraNonce extraNonce = new ExtraNonce();
    private final AtomicLong hashesTried = new AtomicLong();
    private final long startNonce;

    public DirectMiner(BlockTemplateCache cache, ValidationEngine engine, ShutdownSignal shutdown,
                       ConsensusParams params) {
        this(cache, engine, shutdown, params, 0);
    }

    DirectMiner(BlockTemplateCache cache, ValidationEngine engine, ShutdownSignal shutdown,
                ConsensusParams params, long startNonce) {
        this.cache = cache;
        this.engine = engine;
        this.shutdown = shutdown;
        this.powLimit = params.powLimit();
        this.startNonce = startNonce;
    }

    /**
     * @param maxTries total nonce attempts allowed across all blocks of this call; every hash counts
     * @return hashes of the accepted blocks, in mining order
     * @throws IllegalArgumentException if {@code maxTries} is negative
     * @throws MiningException {@link ErrorCode#INTERNAL_ERROR} if a solved block is not accepted
     */
    public List<Hash> mineBlocks(Script coinbaseScript, int count, long maxTries) {
        if (maxTries < 0) {
            throw new IllegalArgumentException("maxTries must be >= 0: " + maxTries);
        }
        List<Hash> mined = new ArrayList<>();
        long triesLeft = maxTries;
        while (mined.size() < count && triesLeft > 0 && !shutdown.isRequested()) {
            CandidateBlock candidate = cache.rebuild(coinbaseScript);
            Block block = extraNonce.increment(candidate.block());
            BlockHeader header = block.header().withNonce(startNonce);

            long tried = 0;
            boolean found = false;
            while (triesLeft > 0 && !shutdown.isRequested()) {
                tried++;
                --triesLeft;
                if (ProofOfWork.checkProofOfWork(header.hash(), header.bits(), powLimit)) {
                    found = true;
                    break;
                }
                if (header.nonce() == BlockHeader.MAX_NONCE) {
                    break;
                }
                header = header.withNonce(header.nonce() + 1);
            }
            hashesTried.addAndGet(tried);
            MiningMetrics.recordHashes(tried);

            if (shutdown.isRequested()) {
                break;
            }
            if (!found) {
                if (triesLeft > 0) {
                    LOG.fine(() -> "Nonce space exhausted at height " + block.header().height() + ", rebuilding");
                }
                continue;
            }

            Block solved = block.withHeader(header);
            AcceptResult result = engine.acceptBlock(solved, true);
            if (!result.accepted()) {
                throw new MiningException(ErrorCode.INTERNAL_ERROR, "ProcessNewBlock, block not accepted");
            }
            mined.add(solved.hash());
            MiningMetrics.incrementBlocksMined();
            LOG.info(() -> "Mined block " + solved.hash().hex() + " at height " + solved.header().height());
        }
        return mined;
    }

    ExtraNonce extraNonce() {
        return extraNonce;
    }

    /** Total nonces evaluated since construction. */
    public long hashesTried() {
        return hashesTried.get();
    }
}

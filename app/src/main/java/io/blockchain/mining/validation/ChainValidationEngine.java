package io.blockchain.mining.validation;

import io.blockchain.mining.chain.BlockRecord;
import io.blockchain.mining.chain.BlockStatus;
import io.blockchain.mining.chain.ChainIndex;
import io.blockchain.mining.chain.ChainTip;
import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.consensus.ConsensusRules;
import io.blockchain.mining.consensus.ProofOfWork;
import io.blockchain.mining.consensus.RuleViolation;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.Hash;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Structural validation engine over a {@link ChainIndex}.
 * - Invalid blocks with a known parent are recorded as FAILED.
 * - Events are fired after the engine lock is released.
 */
public final class ChainValidationEngine implements ValidationEngine {
    private static final Logger LOG = Logger.getLogger(ChainValidationEngine.class.getName());

    private final ChainIndex chain;
    private final ConsensusParams params;
    private final ValidationEvents events;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public ChainValidationEngine(ChainIndex chain, ConsensusParams params, ValidationEvents events, Clock clock) {
        this.chain = chain;
        this.params = params;
        this.events = events;
        this.clock = clock;
    }

    @Override
    public AcceptResult acceptBlock(Block block, boolean forceProcessing) {
        ValidationOutcome outcome;
        AcceptResult result;
        Hash hash = block.hash();
        lock.lock();
        try {
            Optional<BlockRecord> existing = chain.lookup(hash);
            if (existing.isPresent() && existing.get().status() == BlockStatus.FULLY_VALID) {
                return new AcceptResult(true, false);
            }
            if (existing.isPresent() && existing.get().status() == BlockStatus.FAILED) {
                outcome = ValidationOutcome.invalid("duplicate");
                result = new AcceptResult(false, false);
            } else {
                Optional<BlockRecord> parent = chain.lookup(block.header().parentHash());
                if (parent.isEmpty()) {
                    outcome = ValidationOutcome.invalid("prev-blk-not-found");
                    result = new AcceptResult(false, false);
                } else {
                    outcome = check(block, parent.get(), true);
                    if (!outcome.isValid()) {
                        chain.storeBlock(block, BlockStatus.FAILED);
                        result = new AcceptResult(false, false);
                    } else {
                        BigInteger work = parent.get().chainWork().add(ProofOfWork.blockWork(block.header().bits()));
                        boolean moreWork = work.compareTo(chain.tipChainWork()) > 0;
                        if (!forceProcessing && !moreWork) {
                            return new AcceptResult(true, false);
                        }
                        chain.storeBlock(block, BlockStatus.FULLY_VALID);
                        result = new AcceptResult(true, true);
                    }
                }
            }
        } finally {
            lock.unlock();
        }

        ValidationOutcome checked = outcome;
        LOG.fine(() -> "Block " + hash.hex() + " checked: " + checked);
        events.fireBlockChecked(block, outcome);
        if (outcome.isValid()) {
            chain.activateBestChain(hash);
        }
        return result;
    }

    @Override
    public ValidationOutcome acceptHeaders(List<BlockHeader> headers) {
        lock.lock();
        try {
            for (BlockHeader header : headers) {
                Optional<BlockRecord> existing = chain.lookup(header.hash());
                if (existing.isPresent()) {
                    if (existing.get().status() == BlockStatus.FAILED) {
                        return ValidationOutcome.invalid("duplicate");
                    }
                    continue;
                }
                Optional<BlockRecord> parent = chain.lookup(header.parentHash());
                if (parent.isEmpty()) {
                    return ValidationOutcome.invalid("prev-blk-not-found");
                }
                if (parent.get().status() == BlockStatus.FAILED) {
                    return ValidationOutcome.invalid("bad-prevblk");
                }
                try {
                    ConsensusRules.checkHeader(header, params, true);
                    ConsensusRules.checkContextual(header, parent.get().height(),
                            chain.medianTimePast(parent.get().hash()), now(), params);
                } catch (RuleViolation v) {
                    return ValidationOutcome.invalid(v.reason());
                }
                chain.storeHeader(header);
            }
            return ValidationOutcome.valid();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ValidationOutcome checkBlockOnly(Block block, ChainTip tip) {
        lock.lock();
        try {
            if (!block.header().parentHash().equals(tip.hash())) {
                return ValidationOutcome.invalid("inconclusive-not-best-prevblk");
            }
            Optional<BlockRecord> parent = chain.lookup(tip.hash());
            if (parent.isEmpty()) {
                return ValidationOutcome.error("tip " + tip.hash().hex() + " is not indexed");
            }
            return check(block, parent.get(), false);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Block updateUncommittedBlockStructures(Block block, BlockRecord parent) {
        return block;
    }

    private ValidationOutcome check(Block block, BlockRecord parent, boolean checkPow) {
        if (parent.status() == BlockStatus.FAILED) {
            return ValidationOutcome.invalid("bad-prevblk");
        }
        try {
            ConsensusRules.checkBlock(block, params, checkPow, true);
            ConsensusRules.checkContextual(block.header(), parent.height(),
                    chain.medianTimePast(parent.hash()), now(), params);
            return ValidationOutcome.valid();
        } catch (RuleViolation v) {
            return ValidationOutcome.invalid(v.reason());
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}

package io.blockchain.mining.consensus;

import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.protocol.Transaction;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural block rules. Every check throws {@link RuleViolation} carrying the reject reason.
 */
public final class ConsensusRules {
    private ConsensusRules() {}

    public static void checkHeader(BlockHeader header, ConsensusParams params, boolean checkPow) {
        if (checkPow && !ProofOfWork.checkProofOfWork(header.hash(), header.bits(), params.powLimit())) {
            throw new RuleViolation("high-hash", "proof of work failed");
        }
    }

    /** Checks that need nothing but the block itself. */
    public static void checkBlock(Block block, ConsensusParams params, boolean checkPow, boolean checkMerkleRoot) {
        checkHeader(block.header(), params, checkPow);

        List<Transaction> txs = block.transactions();
        if (checkMerkleRoot) {
            if (!block.computeMerkleRoot().equals(block.header().merkleRoot())) {
                throw new RuleViolation("bad-txnmrklroot", "hashMerkleRoot mismatch");
            }
            Set<Hash> seen = new HashSet<>();
            for (Transaction tx : txs) {
                if (!seen.add(tx.txid())) {
                    throw new RuleViolation("bad-txns-duplicate", "duplicate transaction");
                }
            }
        }

        if (txs.isEmpty() || block.serialize().length > params.maxBlockSize()) {
            throw new RuleViolation("bad-blk-length", "size limits failed");
        }
        if (!txs.get(0).isCoinbase()) {
            throw new RuleViolation("bad-cb-missing", "first tx is not coinbase");
        }
        for (int i = 1; i < txs.size(); i++) {
            if (txs.get(i).isCoinbase()) {
                throw new RuleViolation("bad-cb-multiple", "more than one coinbase");
            }
        }
        if (block.weight() > params.maxBlockWeight()) {
            throw new RuleViolation("bad-blk-weight", "weight limit failed");
        }
        long sigOps = 0;
        for (Transaction tx : txs) sigOps += tx.sigOpCost();
        if (sigOps > params.maxBlockSigOpsCost()) {
            throw new RuleViolation("bad-blk-sigops", "out-of-bounds SigOpCount");
        }
    }

    /**
     * Checks against the parent: height, difficulty and the time window
     * {@code (parentMedianTimePast, now + 2h]}.
     */
    public static void checkContextual(BlockHeader header, long parentHeight, long parentMedianTimePast,
                                       long nowSeconds, ConsensusParams params) {
        if (header.height() != parentHeight + 1) {
            throw new RuleViolation("bad-height", "expected " + (parentHeight + 1) + ", got " + header.height());
        }
        if (header.bits() != params.targetBits()) {
            throw new RuleViolation("bad-diffbits", "incorrect proof of work");
        }
        if (header.time() <= parentMedianTimePast) {
            throw new RuleViolation("time-too-old", "block's timestamp is too early");
        }
        if (header.time() > nowSeconds + ConsensusParams.MAX_FUTURE_BLOCK_TIME_SECONDS) {
            throw new RuleViolation("time-too-new", "block timestamp too far in the future");
        }
    }
}

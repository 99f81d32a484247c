package io.blockchain.mining.assembler;

import io.blockchain.mining.protocol.Block;

import java.util.List;
import java.util.Objects;

/**
 * An assembled, unsolved block together with per-transaction fee and sigop cost.
 * Index 0 belongs to the coinbase; its fee entry is the negated total of the other fees.
 */
public final class CandidateBlock {
    private final Block block;
    private final List<Long> fees;
    private final List<Integer> sigOpCosts;

    public CandidateBlock(Block block, List<Long> fees, List<Integer> sigOpCosts) {
        this.block = Objects.requireNonNull(block, "block");
        this.fees = List.copyOf(fees);
        this.sigOpCosts = List.copyOf(sigOpCosts);
        int n = block.transactions().size();
        if (this.fees.size() != n || this.sigOpCosts.size() != n) {
            throw new IllegalArgumentException("fee/sigop lists must match transaction count " + n);
        }
    }

    public Block block() { return block; }
    public List<Long> fees() { return fees; }
    public List<Integer> sigOpCosts() { return sigOpCosts; }

    /** Same fees and sigops, different header or coinbase. Transaction count must not change. */
    public CandidateBlock withBlock(Block replacement) {
        return new CandidateBlock(replacement, fees, sigOpCosts);
    }

    public long coinbaseValue() {
        return block.transactions().get(0).totalOutput();
    }

    @Override public String toString() {
        return "CandidateBlock{height=" + block.header().height() + ", txs=" + block.transactions().size() + "}";
    }
}

package io.blockchain.mining.chain;

import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.Hash;

import java.util.Optional;

/**
 * Read side of the block index. Every call takes the chain read lock only for its own duration,
 * so callers never hold it while waiting.
 */
public interface ChainState {

    ChainTip currentTip();

    Optional<BlockRecord> lookup(Hash hash);

    Optional<Block> block(Hash hash);

    /** Median of the last eleven block times ending at {@code hash}. */
    long medianTimePast(Hash hash);

    /** True while the node is still catching up; once false it stays false. */
    boolean isInitialSync();
}

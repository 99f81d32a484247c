package io.blockchain.mining.validation;

import io.blockchain.mining.chain.BlockRecord;
import io.blockchain.mining.chain.ChainTip;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockHeader;

import java.util.List;

/**
 * Block and header acceptance. Results for full blocks are reported through {@link ValidationEvents}.
 */
public interface ValidationEngine {

    /**
     * Validates and, if valid, stores the block and lets fork choice consider it.
     * Unforced blocks that would not add work to the best chain are ignored.
     */
    AcceptResult acceptBlock(Block block, boolean forceProcessing);

    ValidationOutcome acceptHeaders(List<BlockHeader> headers);

    /** Checks the block as if it extended {@code tip}, without proof of work and without storing it. */
    ValidationOutcome checkBlockOnly(Block block, ChainTip tip);

    /** Fills in commitments a miner may have left out. */
    Block updateUncommittedBlockStructures(Block block, BlockRecord parent);
}

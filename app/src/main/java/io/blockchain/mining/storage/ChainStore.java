package io.blockchain.mining.storage;

import io.blockchain.mining.chain.BlockRecord;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.Hash;

import java.util.Optional;

/**
 * Persistence for the block index.
 * - Records carry header, status and cumulative work; bodies are stored separately.
 * - The best-tip pointer is written by the chain index after fork choice.
 */
public interface ChainStore extends AutoCloseable {

    /** Insert or replace the record for {@code record.hash()}. */
    void putRecord(BlockRecord record);

    Optional<BlockRecord> getRecord(Hash hash);

    /** Persist a block body (idempotent). */
    void putBlock(Block block);

    Optional<Block> getBlock(Hash hash);

    Optional<Hash> getBestTip();

    void setBestTip(Hash hash);

    /** Number of records stored. */
    long size();

    @Override
    default void close() {}
}

package io.blockchain.mining.chain;

import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.Hash;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Index entry for a known block. {@code chainWork} is the cumulative work up to and including this block.
 */
public record BlockRecord(Hash hash, BlockHeader header, long height, BlockStatus status,
                          BigInteger chainWork, boolean hasData) {
    public BlockRecord {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(chainWork, "chainWork");
    }

    public Hash parentHash() { return header.parentHash(); }

    public BlockRecord withStatus(BlockStatus s) {
        return new BlockRecord(hash, header, height, s, chainWork, hasData);
    }

    public BlockRecord withData() {
        return new BlockRecord(hash, header, height, status, chainWork, true);
    }
}

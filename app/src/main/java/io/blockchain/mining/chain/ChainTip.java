package io.blockchain.mining.chain;

import io.blockchain.mining.protocol.Hash;

import java.util.Objects;

/** Snapshot of the best block: hash, height and median time past (seconds). */
public record ChainTip(Hash hash, long height, long medianTimePast) {
    public ChainTip {
        Objects.requireNonNull(hash, "hash");
    }
}

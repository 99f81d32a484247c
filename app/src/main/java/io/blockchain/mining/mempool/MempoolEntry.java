package io.blockchain.mining.mempool;

import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.protocol.Transaction;

import java.util.Objects;

public record MempoolEntry(Transaction tx, long fee, int sigOpCost) {
    public MempoolEntry {
        Objects.requireNonNull(tx, "tx");
    }

    public Hash txid() { return tx.txid(); }
}

package io.blockchain.mining.protocol;

import java.util.Objects;

/** Reference to an output of an earlier transaction. */
public record OutPoint(Hash txid, int index) {
    /** Prevout of a coinbase input. */
    public static final OutPoint NULL = new OutPoint(Hash.ZERO, -1);

    public OutPoint {
        Objects.requireNonNull(txid, "txid");
    }

    public boolean isNull() {
        return index == -1 && txid.isZero();
    }
}

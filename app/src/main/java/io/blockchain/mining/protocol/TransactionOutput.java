package io.blockchain.mining.protocol;

import java.util.Objects;

public record TransactionOutput(long value, Script scriptPubKey) {
    public TransactionOutput {
        Objects.requireNonNull(scriptPubKey, "scriptPubKey");
        if (value < 0) throw new IllegalArgumentException("value must be >= 0");
    }
}

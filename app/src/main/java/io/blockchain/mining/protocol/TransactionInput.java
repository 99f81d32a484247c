package io.blockchain.mining.protocol;

import java.util.Objects;

public record TransactionInput(OutPoint prevout, Script scriptSig, int sequence) {
    public static final int SEQUENCE_FINAL = 0xffffffff;

    public TransactionInput {
        Objects.requireNonNull(prevout, "prevout");
        scriptSig = scriptSig != null ? scriptSig : Script.EMPTY;
    }

    public TransactionInput withScriptSig(Script script) {
        return new TransactionInput(prevout, script, sequence);
    }
}

package io.blockchain.mining.mempool;

import io.blockchain.mining.protocol.OutPoint;
import io.blockchain.mining.protocol.ProtocolLimits;
import io.blockchain.mining.protocol.Transaction;
import io.blockchain.mining.protocol.TransactionInput;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural admission checks. Inputs are not looked up; this node keeps no UTXO set.
 */
public class TxValidator {
    private final long minFee;

    public TxValidator(long minFee) {
        this.minFee = minFee;
    }

    public TxValidator() {
        this(0);
    }

    public void validate(Transaction tx, long fee) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        if (tx.isCoinbase()) {
            throw new IllegalArgumentException("Coinbase transactions are not relayed");
        }
        if (tx.inputs().isEmpty()) {
            throw new IllegalArgumentException("Transaction has no inputs");
        }
        if (tx.outputs().isEmpty()) {
            throw new IllegalArgumentException("Transaction has no outputs");
        }
        if (tx.size() > ProtocolLimits.MAX_TX_BYTES) {
            throw new IllegalArgumentException("Transaction too large");
        }
        if (fee < minFee) {
            throw new IllegalArgumentException("Fee below minimum");
        }
        Set<OutPoint> spent = new HashSet<>();
        for (TransactionInput in : tx.inputs()) {
            if (in.prevout().isNull()) {
                throw new IllegalArgumentException("Null prevout");
            }
            if (!spent.add(in.prevout())) {
                throw new IllegalArgumentException("Duplicate input");
            }
        }
    }
}

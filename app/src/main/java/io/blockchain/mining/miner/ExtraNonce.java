package io.blockchain.mining.miner;

import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.protocol.Script;
import io.blockchain.mining.protocol.Transaction;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites the coinbase scriptSig to {@code <height> <extraNonce>} so successive templates on the same
 * parent hash differently. The counter restarts whenever the parent changes.
 */
public final class ExtraNonce {
    private Hash lastParent;
    private long counter;

    public synchronized Block increment(Block block) {
        Hash parent = block.header().parentHash();
        if (!parent.equals(lastParent)) {
            counter = 0;
            lastParent = parent;
        }
        counter++;

        List<Transaction> txs = new ArrayList<>(block.transactions());
        Transaction coinbase = txs.get(0);
        Script scriptSig = Script.builder()
                .number(block.header().height())
                .number(counter)
                .build();
        txs.set(0, coinbase.toBuilder()
                .inputs(List.of(coinbase.inputs().get(0).withScriptSig(scriptSig)))
                .build());

        Block updated = block.withTransactions(txs);
        return updated.withHeader(updated.header().withMerkleRoot(updated.computeMerkleRoot()));
    }

    public synchronized long current() {
        return counter;
    }
}

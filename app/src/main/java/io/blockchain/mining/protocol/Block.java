package io.blockchain.mining.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Block = header + list of transactions, encoded as header || count || (len || tx)*.
 */
public final class Block {
    private final BlockHeader header;
    private final List<Transaction> transactions;

    public Block(BlockHeader header, List<Transaction> txs) {
        this.header = Objects.requireNonNull(header, "header");
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        if (transactions.size() > ProtocolLimits.MAX_TXS_PER_BLOCK) throw new IllegalArgumentException("too many txs");
    }

    public BlockHeader header() { return header; }
    public List<Transaction> transactions() { return transactions; }
    public Hash hash() { return header.hash(); }

    public Block withHeader(BlockHeader h) { return new Block(h, transactions); }
    public Block withTransactions(List<Transaction> txs) { return new Block(header, txs); }

    /** True when the first transaction is a coinbase. */
    public boolean startsWithCoinbase() {
        return !transactions.isEmpty() && transactions.get(0).isCoinbase();
    }

    public Hash computeMerkleRoot() {
        List<Hash> leaves = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) leaves.add(tx.txid());
        return Merkle.rootOf(leaves);
    }

    public int weight() {
        int weight = BlockHeader.ENCODED_LENGTH * Transaction.WITNESS_SCALE_FACTOR;
        for (Transaction tx : transactions) weight += tx.weight();
        return weight;
    }

    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(header.serialize());
        out.writeBytes(ByteBuffer.allocate(4).putInt(transactions.size()).array());
        for (Transaction tx : transactions) {
            byte[] b = tx.serialize();
            out.writeBytes(ByteBuffer.allocate(4).putInt(b.length).array());
            out.writeBytes(b);
        }
        return out.toByteArray();
    }

    @Override public String toString() {
        return "Block{height=" + header.height() + ", txs=" + transactions.size() + "}";
    }
}

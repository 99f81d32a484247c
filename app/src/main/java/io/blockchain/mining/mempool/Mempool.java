package io.blockchain.mining.mempool;

import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.protocol.Transaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Pending transactions in arrival order.
 * - {@link #transactionsUpdated()} increases on every add, removal and priority change.
 * - Fee deltas may be registered for transactions that have not arrived yet.
 */
public final class Mempool {
    private static final Logger LOG = Logger.getLogger(Mempool.class.getName());

    private final Map<Hash, MempoolEntry> entries = new LinkedHashMap<>();
    private final Map<Hash, Long> feeDeltas = new HashMap<>();
    private final AtomicLong transactionsUpdated = new AtomicLong();
    private final TxValidator validator;

    public Mempool(TxValidator validator) {
        this.validator = validator;
    }

    public Mempool() {
        this(new TxValidator());
    }

    /** Validate and add a transaction. Returns false if it is already pooled. */
    public synchronized boolean add(Transaction tx, long fee) {
        validator.validate(tx, fee);
        if (entries.containsKey(tx.txid())) {
            return false;
        }
        entries.put(tx.txid(), new MempoolEntry(tx, fee, tx.sigOpCost()));
        transactionsUpdated.incrementAndGet();
        LOG.fine(() -> "Accepted " + tx.txid().hex() + " into mempool (fee=" + fee + ")");
        return true;
    }

    public synchronized boolean remove(Hash txid) {
        if (entries.remove(txid) == null) {
            return false;
        }
        transactionsUpdated.incrementAndGet();
        return true;
    }

    /** Drops every transaction included in {@code block}. */
    public synchronized int removeConfirmed(Block block) {
        int removed = 0;
        for (Transaction tx : block.transactions()) {
            if (entries.remove(tx.txid()) != null) {
                feeDeltas.remove(tx.txid());
                removed++;
            }
        }
        if (removed > 0) {
            transactionsUpdated.incrementAndGet();
            int n = removed;
            LOG.fine(() -> "Removed " + n + " confirmed transactions");
        }
        return removed;
    }

    /** Adds {@code delta} to the fee used for ordering {@code txid}, present or not. */
    public synchronized void prioritise(Hash txid, long delta) {
        feeDeltas.merge(txid, delta, Long::sum);
        transactionsUpdated.incrementAndGet();
        LOG.info(() -> "PrioritiseTransaction: " + txid.hex() + " fee += " + delta);
    }

    public synchronized long feeDelta(Hash txid) {
        return feeDeltas.getOrDefault(txid, 0L);
    }

    /** Fee plus any registered delta. */
    public synchronized long modifiedFee(MempoolEntry entry) {
        return entry.fee() + feeDeltas.getOrDefault(entry.txid(), 0L);
    }

    public synchronized Optional<MempoolEntry> get(Hash txid) {
        return Optional.ofNullable(entries.get(txid));
    }

    public synchronized boolean contains(Hash txid) {
        return entries.containsKey(txid);
    }

    /** Snapshot in arrival order. */
    public synchronized List<MempoolEntry> entries() {
        return new ArrayList<>(entries.values());
    }

    public synchronized int size() { return entries.size(); }

    public long transactionsUpdated() {
        return transactionsUpdated.get();
    }
}

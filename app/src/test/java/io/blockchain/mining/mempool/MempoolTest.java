package io.blockchain.mining.mempool;

import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.protocol.Transaction;
import io.blockchain.mining.support.TestChain;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MempoolTest {

    @Test
    void addKeepsArrivalOrderAndRejectsDuplicates() {
        Mempool pool = new Mempool();
        Transaction a = TestChain.spend(TestChain.hashOf(1), 0, 100);
        Transaction b = TestChain.spend(TestChain.hashOf(2), 0, 100);

        assertTrue(pool.add(a, 10));
        assertTrue(pool.add(b, 20));
        assertFalse(pool.add(a, 10));

        List<MempoolEntry> entries = pool.entries();
        assertEquals(List.of(a.txid(), b.txid()), List.of(entries.get(0).txid(), entries.get(1).txid()));
        assertEquals(2, pool.transactionsUpdated());
    }

    @Test
    void everyChangeBumpsTheUpdateCounter() {
        Mempool pool = new Mempool();
        Transaction tx = TestChain.spend(TestChain.hashOf(3), 0, 50);
        pool.add(tx, 1);
        long before = pool.transactionsUpdated();

        pool.prioritise(tx.txid(), 5);
        assertEquals(before + 1, pool.transactionsUpdated());

        assertTrue(pool.remove(tx.txid()));
        assertEquals(before + 2, pool.transactionsUpdated());

        assertFalse(pool.remove(tx.txid()));
        assertEquals(before + 2, pool.transactionsUpdated());
    }

    @Test
    void feeDeltasAccumulateAndApplyBeforeArrival() {
        Mempool pool = new Mempool();
        Transaction tx = TestChain.spend(TestChain.hashOf(4), 1, 50);

        pool.prioritise(tx.txid(), 1_000);
        pool.prioritise(tx.txid(), -250);
        assertEquals(750, pool.feeDelta(tx.txid()));

        pool.add(tx, 100);
        MempoolEntry entry = pool.get(tx.txid()).orElseThrow();
        assertEquals(100, entry.fee());
        assertEquals(850, pool.modifiedFee(entry));
    }

    @Test
    void removeConfirmedDropsIncludedTransactionsAndTheirDeltas() {
        Mempool pool = new Mempool();
        Transaction confirmed = TestChain.spend(TestChain.hashOf(5), 0, 10);
        Transaction pending = TestChain.spend(TestChain.hashOf(6), 0, 10);
        pool.add(confirmed, 1);
        pool.add(pending, 1);
        pool.prioritise(confirmed.txid(), 99);

        BlockHeader header = new BlockHeader(4, Hash.ZERO, Hash.ZERO, 1, 1, 0x207fffff, 0);
        int removed = pool.removeConfirmed(new Block(header, List.of(confirmed)));

        assertEquals(1, removed);
        assertFalse(pool.contains(confirmed.txid()));
        assertTrue(pool.contains(pending.txid()));
        assertEquals(0, pool.feeDelta(confirmed.txid()));
    }

    @Test
    void invalidTransactionsAreNotPooled() {
        Mempool pool = new Mempool(new TxValidator(10));
        Transaction tx = TestChain.spend(TestChain.hashOf(7), 0, 10);

        assertThrows(IllegalArgumentException.class, () -> pool.add(tx, 9));
        assertEquals(0, pool.size());
        assertEquals(0, pool.transactionsUpdated());
    }
}

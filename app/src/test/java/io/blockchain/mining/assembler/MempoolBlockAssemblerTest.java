package io.blockchain.mining.assembler;

import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.protocol.Script;
import io.blockchain.mining.protocol.Transaction;
import io.blockchain.mining.support.TestChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MempoolBlockAssemblerTest {
    private TestChain t;

    @BeforeEach
    void setUp() {
        t = TestChain.regtest();
    }

    @Test
    void emptyMempoolYieldsCoinbaseOnlyBlockOnTip() throws Exception {
        CandidateBlock candidate = t.assembler.createNewBlock(Script.ANYONE_CAN_SPEND);
        Block block = candidate.block();

        assertEquals(1, block.transactions().size());
        assertTrue(block.transactions().get(0).isCoinbase());
        assertEquals(t.chain.currentTip().hash(), block.header().parentHash());
        assertEquals(1, block.header().height());
        assertEquals(t.params.targetBits(), block.header().bits());
        assertEquals(block.computeMerkleRoot(), block.header().merkleRoot());
        assertEquals(t.params.subsidy(1), candidate.coinbaseValue());
        assertEquals(List.of(0L), candidate.fees());
        assertEquals(0, t.assembler.lastStats().orElseThrow().txCount());
    }

    @Test
    void coinbaseCollectsSubsidyPlusFees() throws Exception {
        t.mempool.add(TestChain.spend(TestChain.hashOf(1), 0, 1_000), 300);
        t.mempool.add(TestChain.spend(TestChain.hashOf(2), 0, 1_000), 200);

        CandidateBlock candidate = t.assembler.createNewBlock(Script.ANYONE_CAN_SPEND);

        assertEquals(t.params.subsidy(1) + 500, candidate.coinbaseValue());
        assertEquals(-500L, candidate.fees().get(0));
        assertEquals(3, candidate.block().transactions().size());
        assertEquals(2, t.assembler.lastStats().orElseThrow().txCount());
    }

    @Test
    void ordersByModifiedFee() throws Exception {
        Transaction low = TestChain.spend(TestChain.hashOf(3), 0, 1_000);
        Transaction high = TestChain.spend(TestChain.hashOf(4), 0, 1_000);
        t.mempool.add(low, 10);
        t.mempool.add(high, 20);
        t.mempool.prioritise(low.txid(), 100);

        List<Hash> order = txids(t.assembler.createNewBlock(Script.ANYONE_CAN_SPEND).block());

        assertEquals(List.of(low.txid(), high.txid()), order.subList(1, 3));
    }

    @Test
    void parentsPrecedeChildrenRegardlessOfFee() throws Exception {
        Transaction parent = TestChain.spend(TestChain.hashOf(5), 0, 1_000);
        Transaction child = TestChain.spend(parent.txid(), 0, 900);
        t.mempool.add(parent, 1);
        t.mempool.add(child, 100);

        List<Hash> order = txids(t.assembler.createNewBlock(Script.ANYONE_CAN_SPEND).block());

        assertEquals(List.of(parent.txid(), child.txid()), order.subList(1, 3));
    }

    @Test
    void blockTimeNeverBelowMedianTimePastPlusOne() throws Exception {
        t.extendTip();
        t.clock.set(Instant.ofEpochSecond(t.params.genesisTime() - 10_000));

        Block block = t.assembler.createNewBlock(Script.ANYONE_CAN_SPEND).block();

        assertEquals(t.chain.currentTip().medianTimePast() + 1, block.header().time());
    }

    @Test
    void coinbaseScriptSigStartsWithHeight() throws Exception {
        t.extendTip();
        Transaction coinbase = t.assembler.createNewBlock(Script.ANYONE_CAN_SPEND).block().transactions().get(0);

        assertEquals("52", coinbase.inputs().get(0).scriptSig().hex().substring(0, 2));
        assertEquals(Script.ANYONE_CAN_SPEND, coinbase.outputs().get(0).scriptPubKey());
    }

    @Test
    void usesNetworkDifficulty() throws Exception {
        TestChain hard = new TestChain(ConsensusParams.regtest().withTargetBits(0x1f00ffff));
        assertEquals(0x1f00ffff, hard.assembler.createNewBlock(Script.ANYONE_CAN_SPEND).block().header().bits());
    }

    private static List<Hash> txids(Block block) {
        return block.transactions().stream().map(Transaction::txid).collect(Collectors.toList());
    }
}

package io.blockchain.mining.miner;

import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.Script;
import io.blockchain.mining.support.TestChain;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExtraNonceTest {

    @Test
    void counterGrowsOnSameParentAndResetsOnNewOne() {
        TestChain t = TestChain.regtest();
        ExtraNonce extraNonce = new ExtraNonce();
        Block template = t.childOfTip(List.of());

        Block first = extraNonce.increment(template);
        Block second = extraNonce.increment(template);
        assertEquals(2, extraNonce.current());
        assertNotEquals(first.hash(), second.hash());

        t.extendTip();
        extraNonce.increment(t.childOfTip(List.of()));
        assertEquals(1, extraNonce.current());
    }

    @Test
    void rewritesCoinbaseScriptSigAndMerkleRoot() {
        TestChain t = TestChain.regtest();
        Block updated = new ExtraNonce().increment(t.childOfTip(List.of(TestChain.spend(TestChain.hashOf(1), 0, 5))));

        Script expected = Script.builder().number(1).number(1).build();
        assertEquals(expected, updated.transactions().get(0).inputs().get(0).scriptSig());
        assertEquals(updated.computeMerkleRoot(), updated.header().merkleRoot());
        assertEquals(2, updated.transactions().size());
    }
}

package io.blockchain.mining.validation;

import io.blockchain.mining.chain.BlockStatus;
import io.blockchain.mining.chain.ChainTip;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.support.TestChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChainValidationEngineTest {
    private TestChain t;
    private final List<ValidationOutcome> checked = new ArrayList<>();

    @BeforeEach
    void setUp() {
        t = TestChain.regtest();
        t.events.register((block, outcome) -> checked.add(outcome));
    }

    @Test
    void validBlockBecomesTip() {
        Block block = t.solvedChild(List.of());

        AcceptResult result = t.engine.acceptBlock(block, true);

        assertEquals(new AcceptResult(true, true), result);
        assertEquals(block.hash(), t.chain.currentTip().hash());
        assertEquals(List.of(ValidationOutcome.valid()), checked);
    }

    @Test
    void resubmittingValidBlockIsNotNew() {
        Block block = t.extendTip();
        checked.clear();

        assertEquals(new AcceptResult(true, false), t.engine.acceptBlock(block, true));
        assertTrue(checked.isEmpty());
    }

    @Test
    void highHashIsRecordedAsFailed() {
        Block block = TestChain.unsolve(t.childOfTip(List.of()), t.params);

        AcceptResult result = t.engine.acceptBlock(block, true);

        assertFalse(result.accepted());
        assertEquals(List.of(ValidationOutcome.invalid("high-hash")), checked);
        assertEquals(BlockStatus.FAILED, t.chain.lookup(block.hash()).orElseThrow().status());

        checked.clear();
        t.engine.acceptBlock(block, true);
        assertEquals(List.of(ValidationOutcome.invalid("duplicate")), checked);
    }

    @Test
    void unknownParentIsRejectedAndNotStored() {
        Block child = t.childOfTip(List.of());
        BlockHeader h = child.header();
        BlockHeader orphan = new BlockHeader(h.version(), TestChain.hashOf(9), h.merkleRoot(), h.height(),
                h.time(), h.bits(), 0);
        Block block = TestChain.solve(child.withHeader(orphan), t.params);

        assertFalse(t.engine.acceptBlock(block, true).accepted());
        assertEquals(List.of(ValidationOutcome.invalid("prev-blk-not-found")), checked);
        assertTrue(t.chain.lookup(block.hash()).isEmpty());
    }

    @Test
    void unforcedBlockWithoutMoreWorkIsIgnored() {
        Block first = t.solvedChild(List.of());
        Block sibling = TestChain.solve(first.withHeader(first.header().withTime(first.header().time() + 1)), t.params);
        t.engine.acceptBlock(first, true);

        AcceptResult result = t.engine.acceptBlock(sibling, false);

        assertEquals(new AcceptResult(true, false), result);
        assertTrue(t.chain.lookup(sibling.hash()).isEmpty());
        assertEquals(first.hash(), t.chain.currentTip().hash());
    }

    @Test
    void checkBlockOnlySkipsProofOfWorkAndStorage() {
        ChainTip tip = t.chain.currentTip();
        Block unsolved = TestChain.unsolve(t.childOfTip(List.of()), t.params);

        assertEquals(ValidationOutcome.valid(), t.engine.checkBlockOnly(unsolved, tip));
        assertTrue(t.chain.lookup(unsolved.hash()).isEmpty());
        assertTrue(checked.isEmpty());
    }

    @Test
    void checkBlockOnlyNeedsTheTipAsParent() {
        Block stale = t.childOfTip(List.of());
        t.extendTip();

        ValidationOutcome outcome = t.engine.checkBlockOnly(stale, t.chain.currentTip());

        assertEquals(ValidationOutcome.invalid("inconclusive-not-best-prevblk"), outcome);
    }

    @Test
    void checkBlockOnlyReportsBadMerkleRoot() {
        Block block = t.childOfTip(List.of());
        Block broken = block.withHeader(block.header().withMerkleRoot(Hash.ZERO));

        assertEquals(ValidationOutcome.invalid("bad-txnmrklroot"), t.engine.checkBlockOnly(broken, t.chain.currentTip()));
    }

    @Test
    void headersAreStoredWithoutBlockData() {
        Block block = t.solvedChild(List.of());

        assertEquals(ValidationOutcome.valid(), t.engine.acceptHeaders(List.of(block.header())));
        assertFalse(t.chain.lookup(block.hash()).orElseThrow().hasData());
        assertEquals(ValidationOutcome.valid(), t.engine.acceptHeaders(List.of(block.header())));
    }

    @Test
    void headerWithUnknownParentIsRejected() {
        BlockHeader h = t.childOfTip(List.of()).header();
        BlockHeader orphan = new BlockHeader(h.version(), TestChain.hashOf(11), h.merkleRoot(), h.height(),
                h.time(), h.bits(), h.nonce());

        assertEquals(ValidationOutcome.invalid("prev-blk-not-found"), t.engine.acceptHeaders(List.of(orphan)));
    }
}

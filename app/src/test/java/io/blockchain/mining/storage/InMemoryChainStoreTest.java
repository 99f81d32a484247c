package io.blockchain.mining.storage;

import io.blockchain.mining.chain.BlockRecord;
import io.blockchain.mining.chain.BlockStatus;
import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.consensus.ProofOfWork;
import io.blockchain.mining.node.GenesisBuilder;
import io.blockchain.mining.protocol.Block;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryChainStoreTest {

    @Test
    void putGetRecordAndTip() {
        ChainStore store = new InMemoryChainStore();
        Block genesis = GenesisBuilder.build(ConsensusParams.regtest());
        BlockRecord rec = new BlockRecord(genesis.hash(), genesis.header(), 0, BlockStatus.FULLY_VALID,
                ProofOfWork.blockWork(genesis.header().bits()), true);

        store.putRecord(rec);
        store.putBlock(genesis);
        store.setBestTip(genesis.hash());

        assertEquals(1, store.size());
        assertEquals(rec, store.getRecord(genesis.hash()).orElseThrow());
        assertEquals(genesis.hash(), store.getBlock(genesis.hash()).orElseThrow().hash());
        assertEquals(genesis.hash(), store.getBestTip().orElseThrow());
    }

    @Test
    void missingEntriesAreEmpty() {
        ChainStore store = new InMemoryChainStore();
        Block genesis = GenesisBuilder.build(ConsensusParams.regtest());
        assertTrue(store.getRecord(genesis.hash()).isEmpty());
        assertTrue(store.getBlock(genesis.hash()).isEmpty());
        assertTrue(store.getBestTip().isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void recordsAreReplaced() {
        ChainStore store = new InMemoryChainStore();
        Block genesis = GenesisBuilder.build(ConsensusParams.regtest());
        BlockRecord rec = new BlockRecord(genesis.hash(), genesis.header(), 0, BlockStatus.HEADER_VALID,
                ProofOfWork.blockWork(genesis.header().bits()), false);
        store.putRecord(rec);
        store.putRecord(rec.withStatus(BlockStatus.FAILED));
        assertEquals(BlockStatus.FAILED, store.getRecord(genesis.hash()).orElseThrow().status());
        assertEquals(1, store.size());
    }
}

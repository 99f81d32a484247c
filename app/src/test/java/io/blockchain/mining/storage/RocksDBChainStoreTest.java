package io.blockchain.mining.storage;

import io.blockchain.mining.chain.BestBlockSignal;
import io.blockchain.mining.chain.BlockRecord;
import io.blockchain.mining.chain.BlockStatus;
import io.blockchain.mining.chain.ChainIndex;
import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.node.GenesisBuilder;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.support.MutableClock;
import io.blockchain.mining.support.TestChain;
import io.blockchain.mining.validation.ChainValidationEngine;
import io.blockchain.mining.validation.ValidationEvents;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBChainStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void recordsBlocksAndTipSurviveReopen() {
        ConsensusParams params = ConsensusParams.regtest();
        MutableClock clock = new MutableClock(Instant.ofEpochSecond(params.genesisTime() + 600));
        Block genesis = GenesisBuilder.build(params);
        Block mined;

        try (RocksDBChainStore store = RocksDBChainStore.open(tempDir.toString())) {
            ChainIndex chain = new ChainIndex(store, params, new BestBlockSignal(), clock, genesis);
            ChainValidationEngine engine = new ChainValidationEngine(chain, params, new ValidationEvents(), clock);
            Block child = TestChain.solve(
                    TestChain.childOf(chain, params, clock.instant().getEpochSecond(), List.of()), params);
            assertTrue(engine.acceptBlock(child, true).newBlock());
            mined = child;
            assertEquals(2, store.size());
        }

        try (RocksDBChainStore store = RocksDBChainStore.open(tempDir.toString())) {
            assertEquals(mined.hash(), store.getBestTip().orElseThrow());
            BlockRecord rec = store.getRecord(mined.hash()).orElseThrow();
            assertEquals(1, rec.height());
            assertEquals(BlockStatus.FULLY_VALID, rec.status());
            assertTrue(rec.hasData());
            assertEquals(mined.transactions(), store.getBlock(mined.hash()).orElseThrow().transactions());

            ChainIndex resumed = new ChainIndex(store, params, new BestBlockSignal(), clock, genesis);
            assertEquals(mined.hash(), resumed.currentTip().hash());
        }
    }
}

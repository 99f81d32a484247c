package io.blockchain.mining.storage;

import io.blockchain.mining.chain.BlockRecord;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.Hash;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory chain store for tests and throwaway regtest nodes.
 */
public final class InMemoryChainStore implements ChainStore {

    private final Map<Hash, BlockRecord> records = new HashMap<>();
    private final Map<Hash, Block> blocks = new HashMap<>();
    private Hash bestTip;

    @Override
    public synchronized void putRecord(BlockRecord record) {
        records.put(record.hash(), record);
    }

    @Override
    public synchronized Optional<BlockRecord> getRecord(Hash hash) {
        if (hash == null) return Optional.empty();
        return Optional.ofNullable(records.get(hash));
    }

    @Override
    public synchronized void putBlock(Block block) {
        blocks.put(block.hash(), block);
    }

    @Override
    public synchronized Optional<Block> getBlock(Hash hash) {
        if (hash == null) return Optional.empty();
        return Optional.ofNullable(blocks.get(hash));
    }

    @Override
    public synchronized Optional<Hash> getBestTip() {
        return Optional.ofNullable(bestTip);
    }

    @Override
    public synchronized void setBestTip(Hash hash) {
        if (hash != null && !records.containsKey(hash)) {
            throw new IllegalArgumentException("Unknown tip hash (store the record first)");
        }
        bestTip = hash;
    }

    @Override
    public synchronized long size() {
        return records.size();
    }
}

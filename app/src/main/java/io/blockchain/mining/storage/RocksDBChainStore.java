package io.blockchain.mining.storage;

import io.blockchain.mining.chain.BlockRecord;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockCodec;
import io.blockchain.mining.protocol.Hash;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent ChainStore using RocksDB.
 *
 * Layout (column families):
 *  - "records" : key = blockHash(32), val = BlockRecordCodec bytes
 *  - "blocks"  : key = blockHash(32), val = block.serialize()
 *  - "meta"    : key = "tip",         val = blockHash(32)
 */
public final class RocksDBChainStore implements ChainStore {
    private static final Logger LOG = Logger.getLogger(RocksDBChainStore.class.getName());
    private static final byte[] TIP_KEY = "tip".getBytes(StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfRecords;
    private final ColumnFamilyHandle cfBlocks;
    private final ColumnFamilyHandle cfMeta;
    private final List<ColumnFamilyHandle> handles;
    private final DBOptions dbOptions;

    private RocksDBChainStore(RocksDB db, List<ColumnFamilyHandle> handles, DBOptions dbOptions) {
        this.db = db;
        this.handles = handles;
        this.cfRecords = handles.get(1);
        this.cfBlocks = handles.get(2);
        this.cfMeta = handles.get(3);
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBChainStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        List<ColumnFamilyDescriptor> cfDescs = List.of(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("records".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("blocks".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8)));
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            return new RocksDBChainStore(db, cfHandles, dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public synchronized void putRecord(BlockRecord record) {
        try {
            db.put(cfRecords, record.hash().bytes(), BlockRecordCodec.encode(record));
        } catch (RocksDBException e) {
            throw new IllegalStateException("putRecord failed", e);
        }
    }

    @Override
    public synchronized Optional<BlockRecord> getRecord(Hash hash) {
        if (hash == null) return Optional.empty();
        try {
            byte[] data = db.get(cfRecords, hash.bytes());
            return data == null ? Optional.empty() : Optional.of(BlockRecordCodec.decode(data));
        } catch (RocksDBException e) {
            throw new IllegalStateException("getRecord failed", e);
        }
    }

    @Override
    public synchronized void putBlock(Block block) {
        try {
            db.put(cfBlocks, block.hash().bytes(), block.serialize());
        } catch (RocksDBException e) {
            throw new IllegalStateException("putBlock failed", e);
        }
    }

    @Override
    public synchronized Optional<Block> getBlock(Hash hash) {
        if (hash == null) return Optional.empty();
        try {
            byte[] body = db.get(cfBlocks, hash.bytes());
            return body == null ? Optional.empty() : Optional.of(BlockCodec.fromBytes(body));
        } catch (RocksDBException e) {
            throw new IllegalStateException("getBlock failed", e);
        }
    }

    @Override
    public synchronized Optional<Hash> getBestTip() {
        try {
            byte[] tip = db.get(cfMeta, TIP_KEY);
            return tip == null ? Optional.empty() : Optional.of(new Hash(tip));
        } catch (RocksDBException e) {
            throw new IllegalStateException("getBestTip failed", e);
        }
    }

    @Override
    public synchronized void setBestTip(Hash hash) {
        try {
            if (hash == null) {
                db.delete(cfMeta, TIP_KEY);
                return;
            }
            if (db.get(cfRecords, hash.bytes()) == null) {
                throw new IllegalArgumentException("Unknown tip hash (store the record first)");
            }
            db.put(cfMeta, TIP_KEY, hash.bytes());
        } catch (RocksDBException e) {
            throw new IllegalStateException("setBestTip failed", e);
        }
    }

    @Override
    public synchronized long size() {
        try (RocksIterator it = db.newIterator(cfRecords)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized void close() {
        try {
            db.syncWal();
        } catch (RocksDBException e) {
            LOG.log(Level.WARNING, "WAL sync failed on close", e);
        }
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        db.close();
        dbOptions.close();
    }
}

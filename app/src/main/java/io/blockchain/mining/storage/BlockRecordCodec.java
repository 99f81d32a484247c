package io.blockchain.mining.storage;

import io.blockchain.mining.chain.BlockRecord;
import io.blockchain.mining.chain.BlockStatus;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.BlockHeaderCodec;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * Record layout: header(92) || height(8) || status(1) || hasData(1) || workLen(4) || work.
 */
final class BlockRecordCodec {
    private BlockRecordCodec() {}

    static byte[] encode(BlockRecord record) {
        byte[] header = record.header().serialize();
        byte[] work = record.chainWork().toByteArray();
        ByteBuffer buf = ByteBuffer.allocate(header.length + 8 + 1 + 1 + 4 + work.length);
        buf.put(header);
        buf.putLong(record.height());
        buf.put((byte) record.status().ordinal());
        buf.put((byte) (record.hasData() ? 1 : 0));
        buf.putInt(work.length);
        buf.put(work);
        return buf.array();
    }

    static BlockRecord decode(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            byte[] headerBytes = new byte[BlockHeader.ENCODED_LENGTH];
            buf.get(headerBytes);
            BlockHeader header = BlockHeaderCodec.fromBytes(headerBytes);
            long height = buf.getLong();
            BlockStatus status = BlockStatus.values()[buf.get()];
            boolean hasData = buf.get() != 0;
            int workLen = buf.getInt();
            if (workLen < 0 || workLen > buf.remaining()) {
                throw new IllegalArgumentException("bad work length: " + workLen);
            }
            byte[] work = new byte[workLen];
            buf.get(work);
            return new BlockRecord(header.hash(), header, height, status, new BigInteger(work), hasData);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed BlockRecord bytes", ex);
        }
    }
}

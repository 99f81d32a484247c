package io.blockchain.mining.protocol;

import java.nio.ByteBuffer;

public final class BlockHeaderCodec {
    private BlockHeaderCodec() {}

    public static BlockHeader fromBytes(byte[] bytes) {
        try {
            if (bytes.length != BlockHeader.ENCODED_LENGTH) {
                throw new IllegalArgumentException("header must be " + BlockHeader.ENCODED_LENGTH + " bytes, got " + bytes.length);
            }
            return read(ByteBuffer.wrap(bytes));
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed BlockHeader bytes", ex);
        }
    }

    static BlockHeader read(ByteBuffer buf) {
        int version = buf.getInt();
        Hash parent = readHash(buf);
        Hash merkle = readHash(buf);
        long height = buf.getLong();
        long time = buf.getLong();
        int bits = buf.getInt();
        long nonce = Integer.toUnsignedLong(buf.getInt());
        return new BlockHeader(version, parent, merkle, height, time, bits, nonce);
    }

    private static Hash readHash(ByteBuffer buf) {
        byte[] out = new byte[Hash.LENGTH];
        buf.get(out);
        return new Hash(out);
    }
}

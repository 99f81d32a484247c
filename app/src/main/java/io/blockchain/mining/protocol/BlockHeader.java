package io.blockchain.mining.protocol;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Immutable block header. Encoded as 92 big-endian bytes:
 * version, parent, merkle root, height, time (seconds), compact bits, nonce (uint32).
 */
public final class BlockHeader {
    public static final int ENCODED_LENGTH = 4 + Hash.LENGTH + Hash.LENGTH + 8 + 8 + 4 + 4;
    public static final long MAX_NONCE = 0xffffffffL;

    private final int version;
    private final Hash parentHash;
    private final Hash merkleRoot;
    private final long height;
    private final long time;
    private final int bits;
    private final int nonce;

    private final byte[] encoded;
    private final Hash hash;

    public BlockHeader(int version, Hash parentHash, Hash merkleRoot, long height, long time, int bits, long nonce) {
        if (height < 0) throw new IllegalArgumentException("height must be >= 0");
        if (nonce < 0 || nonce > MAX_NONCE) throw new IllegalArgumentException("nonce out of range: " + nonce);
        this.version = version;
        this.parentHash = Objects.requireNonNull(parentHash, "parentHash");
        this.merkleRoot = Objects.requireNonNull(merkleRoot, "merkleRoot");
        this.height = height;
        this.time = time;
        this.bits = bits;
        this.nonce = (int) nonce;
        this.encoded = encode();
        this.hash = Hashes.sha256d(encoded);
    }

    public int version() { return version; }
    public Hash parentHash() { return parentHash; }
    public Hash merkleRoot() { return merkleRoot; }
    public long height() { return height; }
    public long time() { return time; }
    public int bits() { return bits; }
    public long nonce() { return Integer.toUnsignedLong(nonce); }
    public Hash hash() { return hash; }

    public BlockHeader withNonce(long n) { return new BlockHeader(version, parentHash, merkleRoot, height, time, bits, n); }
    public BlockHeader withTime(long t) { return new BlockHeader(version, parentHash, merkleRoot, height, t, bits, nonce()); }
    public BlockHeader withMerkleRoot(Hash root) { return new BlockHeader(version, parentHash, root, height, time, bits, nonce()); }

    public byte[] serialize() { return encoded.clone(); }

    private byte[] encode() {
        ByteBuffer buf = ByteBuffer.allocate(ENCODED_LENGTH);
        buf.putInt(version);
        buf.put(parentHash.bytes());
        buf.put(merkleRoot.bytes());
        buf.putLong(height);
        buf.putLong(time);
        buf.putInt(bits);
        buf.putInt(nonce);
        return buf.array();
    }

    @Override public boolean equals(Object o) { return o instanceof BlockHeader h && hash.equals(h.hash); }
    @Override public int hashCode() { return hash.hashCode(); }
    @Override public String toString() {
        return "BlockHeader{height=" + height + ", hash=" + hash.hex() + ", nonce=" + nonce() + "}";
    }
}

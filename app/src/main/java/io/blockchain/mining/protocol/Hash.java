package io.blockchain.mining.protocol;

import java.util.Arrays;

/**
 * 32-byte hash with value semantics. Hex form is lower-case in natural byte order.
 */
public final class Hash {
    public static final int LENGTH = 32;
    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Hash fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("hash must be of length 64 (not " + (hex == null ? 0 : hex.length()) + ")");
        }
        return new Hash(Hex.decode(hex));
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hex.encode(bytes); }
    public boolean isZero() { return Arrays.equals(bytes, ZERO.bytes); }

    @Override public boolean equals(Object o){ return o instanceof Hash && Arrays.equals(bytes, ((Hash)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Hash("+hex().substring(0,8)+"…)"; }
}

package io.blockchain.mining.consensus;

import io.blockchain.mining.protocol.Hash;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Compact-target proof of work.
 * - {@code bits} encodes a 256-bit target as exponent (high byte) and 23-bit mantissa.
 * - A header hash, read as a big-endian unsigned integer, must not exceed the target.
 */
public final class ProofOfWork {
    /** Target whose difficulty is defined as 1. */
    public static final int DIFFICULTY_ONE_BITS = 0x1d00ffff;

    private static final BigInteger TWO_256 = BigInteger.ONE.shiftLeft(256);

    private ProofOfWork() {}

    /** Decodes compact bits. Negative or overflowing encodings yield {@code BigInteger.ZERO}. */
    public static BigInteger decodeCompact(int bits) {
        int size = bits >>> 24;
        long word = bits & 0x007fffffL;
        boolean negative = word != 0 && (bits & 0x00800000) != 0;
        boolean overflow = word != 0 && (size > 34
                || (word > 0xff && size > 33)
                || (word > 0xffff && size > 32));
        if (negative || overflow) {
            return BigInteger.ZERO;
        }
        if (size <= 3) {
            return BigInteger.valueOf(word >>> (8 * (3 - size)));
        }
        return BigInteger.valueOf(word).shiftLeft(8 * (size - 3));
    }

    public static int encodeCompact(BigInteger target) {
        if (target.signum() <= 0) return 0;
        int size = (target.bitLength() + 7) / 8;
        long compact;
        if (size <= 3) {
            compact = target.longValue() << (8 * (3 - size));
        } else {
            compact = target.shiftRight(8 * (size - 3)).longValue();
        }
        if ((compact & 0x00800000L) != 0) {
            compact >>>= 8;
            size++;
        }
        return (int) (compact | ((long) size << 24));
    }

    /** True if the hash satisfies {@code bits} and {@code bits} does not exceed the network limit. */
    public static boolean checkProofOfWork(Hash hash, int bits, BigInteger powLimit) {
        BigInteger target = decodeCompact(bits);
        if (target.signum() <= 0 || target.compareTo(powLimit) > 0) {
            return false;
        }
        return new BigInteger(1, hash.bytes()).compareTo(target) <= 0;
    }

    /** Expected number of hashes to meet {@code bits}: 2^256 / (target + 1). */
    public static BigInteger blockWork(int bits) {
        BigInteger target = decodeCompact(bits);
        if (target.signum() <= 0) return BigInteger.ZERO;
        return TWO_256.divide(target.add(BigInteger.ONE));
    }

    public static double difficulty(int bits) {
        BigInteger target = decodeCompact(bits);
        if (target.signum() <= 0) return 0.0;
        return new BigDecimal(decodeCompact(DIFFICULTY_ONE_BITS))
                .divide(new BigDecimal(target), MathContext.DECIMAL64)
                .doubleValue();
    }

    /** Target as 64 lower-case hex characters. */
    public static String targetHex(int bits) {
        String hex = decodeCompact(bits).toString(16);
        return "0".repeat(Math.max(0, 64 - hex.length())) + hex;
    }
}

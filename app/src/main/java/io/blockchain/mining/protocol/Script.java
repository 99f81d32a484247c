package io.blockchain.mining.protocol;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Immutable script bytes plus the handful of opcodes the mining layer needs to build and inspect.
 */
public final class Script {
    public static final int OP_0 = 0x00;
    public static final int OP_PUSHDATA1 = 0x4c;
    public static final int OP_PUSHDATA2 = 0x4d;
    public static final int OP_PUSHDATA4 = 0x4e;
    public static final int OP_1NEGATE = 0x4f;
    public static final int OP_1 = 0x51;
    public static final int OP_TRUE = OP_1;
    public static final int OP_16 = 0x60;
    public static final int OP_DUP = 0x76;
    public static final int OP_EQUALVERIFY = 0x88;
    public static final int OP_HASH160 = 0xa9;
    public static final int OP_CHECKSIG = 0xac;
    public static final int OP_CHECKSIGVERIFY = 0xad;
    public static final int OP_CHECKMULTISIG = 0xae;
    public static final int OP_CHECKMULTISIGVERIFY = 0xaf;

    private static final int MAX_PUBKEYS_PER_MULTISIG = 20;

    public static final Script EMPTY = new Script(new byte[0]);

    /** Anyone-can-spend placeholder used for templates whose payout is decided by the miner. */
    public static final Script ANYONE_CAN_SPEND = builder().op(OP_TRUE).build();

    private final byte[] bytes;

    public Script(byte[] bytes) {
        this.bytes = bytes != null ? bytes.clone() : new byte[0];
    }

    public static Builder builder() { return new Builder(); }

    public static Script payToPubKeyHash(byte[] keyHash) {
        if (keyHash == null || keyHash.length != 20) {
            throw new IllegalArgumentException("key hash must be 20 bytes");
        }
        return builder()
                .op(OP_DUP)
                .op(OP_HASH160)
                .data(keyHash)
                .op(OP_EQUALVERIFY)
                .op(OP_CHECKSIG)
                .build();
    }

    public static Script payToPubKey(byte[] publicKey) {
        return builder().data(publicKey).op(OP_CHECKSIG).build();
    }

    public byte[] bytes() { return bytes.clone(); }
    public int length() { return bytes.length; }
    public String hex() { return Hex.encode(bytes); }

    /** Appends the raw bytes of {@code suffix}. */
    public Script concat(Script suffix) {
        byte[] out = Arrays.copyOf(bytes, bytes.length + suffix.bytes.length);
        System.arraycopy(suffix.bytes, 0, out, bytes.length, suffix.bytes.length);
        return new Script(out);
    }

    /**
     * Legacy signature-operation count: CHECKSIG counts one, CHECKMULTISIG counts the multisig maximum.
     * Parsing stops at the first malformed push.
     */
    public int sigOpCount() {
        int count = 0;
        int pc = 0;
        while (pc < bytes.length) {
            int op = bytes[pc++] & 0xff;
            int dataLen = -1;
            if (op > OP_0 && op < OP_PUSHDATA1) {
                dataLen = op;
            } else if (op == OP_PUSHDATA1) {
                if (pc + 1 > bytes.length) break;
                dataLen = bytes[pc] & 0xff;
                pc += 1;
            } else if (op == OP_PUSHDATA2) {
                if (pc + 2 > bytes.length) break;
                dataLen = (bytes[pc] & 0xff) | ((bytes[pc + 1] & 0xff) << 8);
                pc += 2;
            } else if (op == OP_PUSHDATA4) {
                if (pc + 4 > bytes.length) break;
                dataLen = (bytes[pc] & 0xff) | ((bytes[pc + 1] & 0xff) << 8)
                        | ((bytes[pc + 2] & 0xff) << 16) | ((bytes[pc + 3] & 0xff) << 24);
                pc += 4;
            }
            if (dataLen >= 0) {
                if (dataLen > bytes.length - pc) break;
                pc += dataLen;
                continue;
            }
            if (op == OP_CHECKSIG || op == OP_CHECKSIGVERIFY) {
                count++;
            } else if (op == OP_CHECKMULTISIG || op == OP_CHECKMULTISIGVERIFY) {
                count += MAX_PUBKEYS_PER_MULTISIG;
            }
        }
        return count;
    }

    @Override public boolean equals(Object o) { return o instanceof Script && Arrays.equals(bytes, ((Script) o).bytes); }
    @Override public int hashCode() { return Arrays.hashCode(bytes); }
    @Override public String toString() { return "Script(" + hex() + ")"; }

    public static final class Builder {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        public Builder op(int opcode) {
            out.write(opcode & 0xff);
            return this;
        }

        /** Minimal number push: small integers as opcodes, everything else as a script number. */
        public Builder number(long n) {
            if (n == 0) {
                return op(OP_0);
            }
            if (n == -1 || (n >= 1 && n <= 16)) {
                return op(n == -1 ? OP_1NEGATE : OP_1 + (int) n - 1);
            }
            return data(encodeNumber(n));
        }

        public Builder data(byte[] data) {
            int len = data.length;
            if (len < OP_PUSHDATA1) {
                out.write(len);
            } else if (len <= 0xff) {
                out.write(OP_PUSHDATA1);
                out.write(len);
            } else if (len <= 0xffff) {
                out.write(OP_PUSHDATA2);
                out.write(len & 0xff);
                out.write((len >>> 8) & 0xff);
            } else {
                out.write(OP_PUSHDATA4);
                out.write(len & 0xff);
                out.write((len >>> 8) & 0xff);
                out.write((len >>> 16) & 0xff);
                out.write((len >>> 24) & 0xff);
            }
            out.write(data, 0, len);
            return this;
        }

        public Script build() {
            return new Script(out.toByteArray());
        }

        /** Little-endian sign-magnitude encoding. */
        static byte[] encodeNumber(long value) {
            if (value == 0) {
                return new byte[0];
            }
            boolean negative = value < 0;
            long abs = negative ? -value : value;
            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            while (abs != 0) {
                buf.write((int) (abs & 0xff));
                abs >>>= 8;
            }
            byte[] result = buf.toByteArray();
            if ((result[result.length - 1] & 0x80) != 0) {
                byte[] extended = Arrays.copyOf(result, result.length + 1);
                extended[result.length] = (byte) (negative ? 0x80 : 0x00);
                return extended;
            }
            if (negative) {
                result[result.length - 1] |= (byte) 0x80;
            }
            return result;
        }
    }
}

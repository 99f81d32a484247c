package io.blockchain.mining.protocol;

import java.nio.ByteBuffer;

public final class TransactionCodec {
    private TransactionCodec(){}

    public static Transaction fromBytes(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            Transaction tx = read(buf);
            if (buf.hasRemaining()) {
                throw new IllegalArgumentException("trailing bytes: " + buf.remaining());
            }
            return tx;
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Transaction bytes", ex);
        }
    }

    static Transaction read(ByteBuffer buf) {
        Transaction.Builder b = Transaction.builder().version(buf.getInt());

        int nIn = readCount(buf, ProtocolLimits.MAX_TX_INPUTS, "input");
        for (int i = 0; i < nIn; i++) {
            byte[] txid = new byte[Hash.LENGTH];
            buf.get(txid);
            int index = buf.getInt();
            Script scriptSig = new Script(readBytes(buf));
            int sequence = buf.getInt();
            b.input(new TransactionInput(new OutPoint(new Hash(txid), index), scriptSig, sequence));
        }

        int nOut = readCount(buf, ProtocolLimits.MAX_TX_OUTPUTS, "output");
        for (int i = 0; i < nOut; i++) {
            long value = buf.getLong();
            b.output(value, new Script(readBytes(buf)));
        }
        return b.lockTime(buf.getInt()).build();
    }

    private static int readCount(ByteBuffer buf, int max, String what) {
        int n = buf.getInt();
        if (n < 0 || n > max) {
            throw new IllegalArgumentException("bad " + what + " count: " + n);
        }
        return n;
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + b.remaining() + ")");
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}

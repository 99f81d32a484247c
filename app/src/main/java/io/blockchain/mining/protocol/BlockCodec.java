package io.blockchain.mining.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

public final class BlockCodec {
    private BlockCodec(){}

    public static Block fromBytes(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            BlockHeader header = BlockHeaderCodec.read(buf);

            int count = buf.getInt();
            if (count < 0 || count > ProtocolLimits.MAX_TXS_PER_BLOCK) {
                throw new IllegalArgumentException("bad tx count: " + count);
            }

            List<Transaction> txs = new ArrayList<>(Math.min(count, 1024));
            for (int i = 0; i < count; i++) {
                int len = buf.getInt();
                if (len < 0 || len > ProtocolLimits.MAX_TX_BYTES || len > buf.remaining()) {
                    throw new IllegalArgumentException("bad tx length: " + len);
                }
                byte[] txBytes = new byte[len];
                buf.get(txBytes);
                txs.add(TransactionCodec.fromBytes(txBytes));
            }
            if (buf.hasRemaining()) {
                throw new IllegalArgumentException("trailing bytes: " + buf.remaining());
            }
            return new Block(header, txs);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Block bytes", ex);
        }
    }
}

package io.blockchain.mining.protocol;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockCodecTest {

    private static Block sampleBlock() {
        Transaction coinbase = Transaction.builder()
                .input(OutPoint.NULL, Script.builder().number(3).op(Script.OP_0).build())
                .output(50, Script.ANYONE_CAN_SPEND)
                .build();
        BlockHeader header = new BlockHeader(4, Hashes.sha256d(new byte[]{1}),
                Merkle.rootOf(List.of(coinbase.txid())), 3, 1_700_000_100L, 0x207fffff, 0xfffffffeL);
        return new Block(header, List.of(coinbase));
    }

    @Test
    void headerIsFixedLength() {
        BlockHeader header = sampleBlock().header();
        assertEquals(BlockHeader.ENCODED_LENGTH, header.serialize().length);
        BlockHeader decoded = BlockHeaderCodec.fromBytes(header.serialize());
        assertEquals(header.hash(), decoded.hash());
        assertEquals(0xfffffffeL, decoded.nonce());
    }

    @Test
    void headerWithWrongLengthIsRejected() {
        byte[] bytes = sampleBlock().header().serialize();
        assertThrows(IllegalArgumentException.class, () -> BlockHeaderCodec.fromBytes(Arrays.copyOf(bytes, bytes.length - 1)));
    }

    @Test
    void blockDecodesWithSameHashAndTransactions() {
        Block block = sampleBlock();
        Block decoded = BlockCodec.fromBytes(block.serialize());
        assertEquals(block.hash(), decoded.hash());
        assertEquals(block.transactions(), decoded.transactions());
        assertTrue(decoded.startsWithCoinbase());
        assertEquals(decoded.header().merkleRoot(), decoded.computeMerkleRoot());
    }

    @Test
    void garbageIsMalformed() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> BlockCodec.fromBytes(new byte[]{0, 1, 2}));
        assertTrue(ex.getMessage().startsWith("Malformed"));
    }

    @Test
    void withNonceKeepsOtherFields() {
        BlockHeader header = sampleBlock().header();
        BlockHeader changed = header.withNonce(5);
        assertEquals(5, changed.nonce());
        assertEquals(header.time(), changed.time());
        assertEquals(header.merkleRoot(), changed.merkleRoot());
        assertNotEquals(header.hash(), changed.hash());
    }
}

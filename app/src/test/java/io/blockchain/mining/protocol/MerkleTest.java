package io.blockchain.mining.protocol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MerkleTest {

    private static Hash leaf(int n) {
        return Hashes.sha256d(new byte[]{(byte) n});
    }

    private static Hash pair(Hash a, Hash b) {
        byte[] buf = new byte[64];
        System.arraycopy(a.bytes(), 0, buf, 0, 32);
        System.arraycopy(b.bytes(), 0, buf, 32, 32);
        return Hashes.sha256d(buf);
    }

    @Test
    void emptyTreeIsZero() {
        assertEquals(Hash.ZERO, Merkle.rootOf(List.of()));
    }

    @Test
    void singleLeafIsRoot() {
        assertEquals(leaf(1), Merkle.rootOf(List.of(leaf(1))));
    }

    @Test
    void oddLevelDuplicatesLastNode() {
        Hash a = leaf(1), b = leaf(2), c = leaf(3);
        Hash expected = pair(pair(a, b), pair(c, c));
        assertEquals(expected, Merkle.rootOf(List.of(a, b, c)));
    }
}

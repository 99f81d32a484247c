package io.blockchain.mining.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Merkle tree over txids.
 * - No leaves: root = zero hash.
 * - Odd count at a level: the last node is paired with itself.
 */
public final class Merkle {
    private Merkle(){}

    public static Hash rootOf(List<Hash> leaves) {
        if (leaves == null || leaves.isEmpty()) return Hash.ZERO;
        List<Hash> level = new ArrayList<>(leaves);
        while (level.size() > 1) {
            List<Hash> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                Hash left = level.get(i);
                Hash right = (i + 1 < level.size()) ? level.get(i + 1) : left;
                next.add(Hashes.sha256d(concat(left.bytes(), right.bytes())));
            }
            level = next;
        }
        return level.get(0);
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}

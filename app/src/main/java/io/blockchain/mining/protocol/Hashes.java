package io.blockchain.mining.protocol;

import org.bouncycastle.crypto.digests.RIPEMD160Digest;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    /** SHA-256 applied twice; used for txids, block hashes and merkle nodes. */
    public static Hash sha256d(byte[] in) {
        return new Hash(sha256(sha256(in)));
    }

    /** RIPEMD-160 of SHA-256; the 20-byte key hash carried by pay-to-key-hash scripts. */
    public static byte[] hash160(byte[] in) {
        byte[] sha = sha256(in);
        RIPEMD160Digest digest = new RIPEMD160Digest();
        digest.update(sha, 0, sha.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}

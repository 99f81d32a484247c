package io.blockchain.mining.protocol;

/**
 * Payout address: the 20-byte key hash written as 40 hex characters.
 */
public final class Address {
    public static final int KEY_HASH_LENGTH = 20;

    private final byte[] keyHash;

    private Address(byte[] keyHash) {
        this.keyHash = keyHash;
    }

    public static Address parse(String text) {
        if (text == null || text.length() != KEY_HASH_LENGTH * 2 || !Hex.isHex(text)) {
            throw new IllegalArgumentException("Invalid address");
        }
        return new Address(Hex.decode(text));
    }

    public static boolean isValid(String text) {
        return text != null && text.length() == KEY_HASH_LENGTH * 2 && Hex.isHex(text);
    }

    public static Address fromPublicKey(byte[] publicKey) {
        return new Address(Hashes.hash160(publicKey));
    }

    public byte[] keyHash() { return keyHash.clone(); }

    public Script toScript() {
        return Script.payToPubKeyHash(keyHash);
    }

    @Override public String toString() { return Hex.encode(keyHash); }
}

package io.blockchain.mining.template;

import io.blockchain.mining.protocol.Hash;

import java.util.Objects;

/**
 * What a long-polling client has already seen: a chain tip and a mempool version.
 * Its string identity is the tip hex followed by the decimal version.
 */
public record LongPollToken(Hash watchedTip, long watchedVersion) {
    public LongPollToken {
        Objects.requireNonNull(watchedTip, "watchedTip");
    }

    /**
     * Parses an identity string. The first 64 characters must be a hash; an unparsable remainder reads as 0.
     *
     * @throws IllegalArgumentException if the hash part is malformed
     */
    public static LongPollToken parse(String id) {
        if (id == null || id.length() < Hash.LENGTH * 2) {
            throw new IllegalArgumentException("longpollid must start with a 64 character hash");
        }
        Hash tip = Hash.fromHex(id.substring(0, Hash.LENGTH * 2));
        long version;
        try {
            version = Long.parseLong(id.substring(Hash.LENGTH * 2));
        } catch (NumberFormatException e) {
            version = 0;
        }
        return new LongPollToken(tip, version);
    }

    public String identity() {
        return watchedTip.hex() + watchedVersion;
    }
}

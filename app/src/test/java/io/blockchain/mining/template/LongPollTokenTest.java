package io.blockchain.mining.template;

import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.support.TestChain;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LongPollTokenTest {

    @Test
    void identityIsTipHexThenVersion() {
        Hash tip = TestChain.hashOf(7);
        LongPollToken token = new LongPollToken(tip, 42);

        assertEquals(tip.hex() + "42", token.identity());
        assertEquals(token, LongPollToken.parse(token.identity()));
    }

    @Test
    void unparsableVersionReadsAsZero() {
        Hash tip = TestChain.hashOf(8);
        assertEquals(new LongPollToken(tip, 0), LongPollToken.parse(tip.hex() + "abc"));
        assertEquals(new LongPollToken(tip, 0), LongPollToken.parse(tip.hex()));
    }

    @Test
    void shortOrMalformedHashIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> LongPollToken.parse("00ff"));
        assertThrows(IllegalArgumentException.class, () -> LongPollToken.parse("zz".repeat(32) + "1"));
    }
}

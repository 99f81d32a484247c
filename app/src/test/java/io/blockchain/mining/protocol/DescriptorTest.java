package io.blockchain.mining.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DescriptorTest {

    private static final String KEY = "03a34b99f22c790c4e36b2b3c2c35a36db06226e41c692fc82b8b56ac1c540c5bd";

    @Test
    void knownChecksumVerifies() {
        assertEquals("89f8spxm", Descriptor.checksum("raw(deadbeef)"));
        Descriptor d = Descriptor.parse("raw(deadbeef)#89f8spxm");
        assertEquals("deadbeef", d.script().hex());
    }

    @Test
    void wrongChecksumIsReported() {
        Descriptor.ParseException ex = assertThrows(Descriptor.ParseException.class,
                () -> Descriptor.parse("raw(deadbeef)#89f8spxn"));
        assertEquals("Provided checksum '89f8spxn' does not match computed checksum '89f8spxm'", ex.getMessage());
    }

    @Test
    void checksumLengthIsChecked() {
        Descriptor.ParseException ex = assertThrows(Descriptor.ParseException.class,
                () -> Descriptor.parse("raw(deadbeef)#89f8spx"));
        assertEquals("Expected 8 character checksum, not 7 characters", ex.getMessage());
    }

    @Test
    void addrAndKeyDescriptors() {
        String addr = "00112233445566778899aabbccddeeff00112233";
        assertEquals(Address.parse(addr).toScript(), Descriptor.parse("addr(" + addr + ")").script());
        assertEquals(Script.payToPubKey(Hex.decode(KEY)), Descriptor.parse("pk(" + KEY + ")").script());
        assertEquals(Address.fromPublicKey(Hex.decode(KEY)).toScript(), Descriptor.parse("pkh(" + KEY + ")").script());
    }

    @Test
    void withChecksumParsesBack() {
        Descriptor d = Descriptor.parse("pkh(" + KEY + ")");
        Descriptor again = Descriptor.parse(d.withChecksum());
        assertEquals(d.script(), again.script());
    }

    @Test
    void wildcardKeysAreRanged() {
        Descriptor d = Descriptor.parse("pkh(xpub/0/*)");
        assertTrue(d.isRanged());
        assertThrows(IllegalStateException.class, d::script);
    }

    @Test
    void unknownFunctionIsRejected() {
        assertThrows(Descriptor.ParseException.class, () -> Descriptor.parse("wsh(" + KEY + ")"));
        assertThrows(Descriptor.ParseException.class, () -> Descriptor.parse("pk(0011)"));
    }
}

package io.blockchain.mining.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScriptTest {

    @Test
    void smallNumbersUseOpcodes() {
        assertEquals("00", Script.builder().number(0).build().hex());
        assertEquals("51", Script.builder().number(1).build().hex());
        assertEquals("60", Script.builder().number(16).build().hex());
        assertEquals("4f", Script.builder().number(-1).build().hex());
    }

    @Test
    void largerNumbersArePushedMinimally() {
        assertEquals("0111", Script.builder().number(17).build().hex());
        assertEquals("028000", Script.builder().number(128).build().hex());
        assertEquals("02ff00", Script.builder().number(255).build().hex());
        assertEquals("020001", Script.builder().number(256).build().hex());
        assertEquals("0191", Script.builder().number(-17).build().hex());
    }

    @Test
    void payToPubKeyHashLayout() {
        byte[] keyHash = new byte[20];
        keyHash[0] = 0x11;
        Script script = Script.payToPubKeyHash(keyHash);
        assertEquals("76a914" + Hex.encode(keyHash) + "88ac", script.hex());
        assertEquals(1, script.sigOpCount());
    }

    @Test
    void multisigCountsAsTwentySigOps() {
        Script script = Script.builder().op(Script.OP_1).op(Script.OP_CHECKMULTISIG).op(Script.OP_CHECKSIG).build();
        assertEquals(21, script.sigOpCount());
    }

    @Test
    void pushedBytesAreNotCountedAsOpcodes() {
        byte[] data = {(byte) Script.OP_CHECKSIG, (byte) Script.OP_CHECKSIG};
        assertEquals(0, Script.builder().data(data).build().sigOpCount());
    }

    @Test
    void longPushesUsePushData() {
        Script script = Script.builder().data(new byte[80]).build();
        assertEquals(Script.OP_PUSHDATA1, script.bytes()[0] & 0xff);
        assertEquals(80, script.bytes()[1] & 0xff);
        assertEquals(82, script.length());
    }
}

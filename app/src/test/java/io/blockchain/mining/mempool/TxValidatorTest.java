package io.blockchain.mining.mempool;

import io.blockchain.mining.assembler.MempoolBlockAssembler;
import io.blockchain.mining.protocol.OutPoint;
import io.blockchain.mining.protocol.Script;
import io.blockchain.mining.protocol.Transaction;
import io.blockchain.mining.support.TestChain;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TxValidatorTest {
    private final TxValidator validator = new TxValidator(5);

    @Test
    void acceptsPlainSpend() {
        assertDoesNotThrow(() -> validator.validate(TestChain.spend(TestChain.hashOf(1), 0, 10), 5));
    }

    @Test
    void rejectsCoinbase() {
        Transaction coinbase = MempoolBlockAssembler.coinbase(1, Script.ANYONE_CAN_SPEND, 10);
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> validator.validate(coinbase, 5));
        assertEquals("Coinbase transactions are not relayed", ex.getMessage());
    }

    @Test
    void rejectsMissingInputsOrOutputs() {
        Transaction noInputs = Transaction.builder().output(1, Script.ANYONE_CAN_SPEND).build();
        Transaction noOutputs = Transaction.builder().input(new OutPoint(TestChain.hashOf(2), 0), Script.EMPTY).build();

        assertEquals("Transaction has no inputs",
                assertThrows(IllegalArgumentException.class, () -> validator.validate(noInputs, 5)).getMessage());
        assertEquals("Transaction has no outputs",
                assertThrows(IllegalArgumentException.class, () -> validator.validate(noOutputs, 5)).getMessage());
    }

    @Test
    void rejectsDuplicateInputs() {
        OutPoint prev = new OutPoint(TestChain.hashOf(3), 1);
        Transaction tx = Transaction.builder()
                .input(prev, Script.EMPTY)
                .input(prev, Script.EMPTY)
                .output(1, Script.ANYONE_CAN_SPEND)
                .build();

        assertEquals("Duplicate input",
                assertThrows(IllegalArgumentException.class, () -> validator.validate(tx, 5)).getMessage());
    }

    @Test
    void rejectsFeeBelowMinimum() {
        Transaction tx = TestChain.spend(TestChain.hashOf(4), 0, 10);
        assertEquals("Fee below minimum",
                assertThrows(IllegalArgumentException.class, () -> validator.validate(tx, 4)).getMessage());
    }
}

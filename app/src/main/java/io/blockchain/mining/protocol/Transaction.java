package io.blockchain.mining.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic input/output transaction. Encoding (big-endian):
 * version, input count, inputs, output count, outputs, lock time.
 */
public final class Transaction {
    public static final int WITNESS_SCALE_FACTOR = 4;

    private final int version;
    private final List<TransactionInput> inputs;
    private final List<TransactionOutput> outputs;
    private final int lockTime;

    private final byte[] encoded;
    private final Hash txid;

    private Transaction(int version, List<TransactionInput> inputs, List<TransactionOutput> outputs, int lockTime) {
        this.version = version;
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.lockTime = lockTime;
        basicValidate();
        this.encoded = encode();
        this.txid = Hashes.sha256d(encoded);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int version = 1;
        private final List<TransactionInput> inputs = new ArrayList<>();
        private final List<TransactionOutput> outputs = new ArrayList<>();
        private int lockTime;

        public Builder version(int v) { this.version = v; return this; }
        public Builder lockTime(int t) { this.lockTime = t; return this; }
        public Builder input(TransactionInput in) { this.inputs.add(in); return this; }
        public Builder input(OutPoint prevout, Script scriptSig) {
            return input(new TransactionInput(prevout, scriptSig, TransactionInput.SEQUENCE_FINAL));
        }
        public Builder inputs(List<TransactionInput> ins) { this.inputs.clear(); this.inputs.addAll(ins); return this; }
        public Builder output(TransactionOutput out) { this.outputs.add(out); return this; }
        public Builder output(long value, Script scriptPubKey) { return output(new TransactionOutput(value, scriptPubKey)); }
        public Builder outputs(List<TransactionOutput> outs) { this.outputs.clear(); this.outputs.addAll(outs); return this; }

        public Transaction build() {
            return new Transaction(version, inputs, outputs, lockTime);
        }
    }

    /** Builder pre-filled with this transaction's fields. */
    public Builder toBuilder() {
        return builder().version(version).inputs(inputs).outputs(outputs).lockTime(lockTime);
    }

    public int version() { return version; }
    public List<TransactionInput> inputs() { return inputs; }
    public List<TransactionOutput> outputs() { return outputs; }
    public int lockTime() { return lockTime; }
    public Hash txid() { return txid; }

    public byte[] serialize() { return encoded.clone(); }
    public int size() { return encoded.length; }
    public int weight() { return encoded.length * WITNESS_SCALE_FACTOR; }

    public boolean isCoinbase() {
        return inputs.size() == 1 && inputs.get(0).prevout().isNull();
    }

    public long totalOutput() {
        long total = 0;
        for (TransactionOutput out : outputs) total = Math.addExact(total, out.value());
        return total;
    }

    /** Legacy sigop count over every script, scaled to cost units. */
    public int sigOpCost() {
        int count = 0;
        for (TransactionInput in : inputs) count += in.scriptSig().sigOpCount();
        for (TransactionOutput out : outputs) count += out.scriptPubKey().sigOpCount();
        return count * WITNESS_SCALE_FACTOR;
    }

    private void basicValidate() {
        if (inputs.size() > ProtocolLimits.MAX_TX_INPUTS) throw new IllegalArgumentException("too many inputs");
        if (outputs.size() > ProtocolLimits.MAX_TX_OUTPUTS) throw new IllegalArgumentException("too many outputs");
        for (TransactionInput in : inputs) {
            if (in.scriptSig().length() > ProtocolLimits.MAX_SCRIPT_BYTES) {
                throw new IllegalArgumentException("scriptSig too large");
            }
        }
        for (TransactionOutput out : outputs) {
            if (out.scriptPubKey().length() > ProtocolLimits.MAX_SCRIPT_BYTES) {
                throw new IllegalArgumentException("scriptPubKey too large");
            }
        }
    }

    private byte[] encode() {
        int size = 4 + 4 + 4 + 4;
        for (TransactionInput in : inputs) size += Hash.LENGTH + 4 + 4 + in.scriptSig().length() + 4;
        for (TransactionOutput out : outputs) size += 8 + 4 + out.scriptPubKey().length();

        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putInt(version);
        buf.putInt(inputs.size());
        for (TransactionInput in : inputs) {
            buf.put(in.prevout().txid().bytes());
            buf.putInt(in.prevout().index());
            putBytes(buf, in.scriptSig().bytes());
            buf.putInt(in.sequence());
        }
        buf.putInt(outputs.size());
        for (TransactionOutput out : outputs) {
            buf.putLong(out.value());
            putBytes(buf, out.scriptPubKey().bytes());
        }
        buf.putInt(lockTime);
        return buf.array();
    }

    private static void putBytes(ByteBuffer buf, byte[] b) {
        buf.putInt(b.length);
        buf.put(b);
    }

    @Override public boolean equals(Object o) { return o instanceof Transaction t && txid.equals(t.txid); }
    @Override public int hashCode() { return txid.hashCode(); }
    @Override public String toString() {
        return "Transaction{txid=" + txid.hex() + ", in=" + inputs.size() + ", out=" + outputs.size() + "}";
    }
}

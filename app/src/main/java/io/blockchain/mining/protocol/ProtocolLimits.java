package io.blockchain.mining.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_TXS_PER_BLOCK = 1_000_000;
    public static final int MAX_TX_BYTES = 4_000_000;
    public static final int MAX_SCRIPT_BYTES = 10_000;
    public static final int MAX_TX_INPUTS = 100_000;
    public static final int MAX_TX_OUTPUTS = 100_000;
}

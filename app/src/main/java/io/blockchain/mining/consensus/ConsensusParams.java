package io.blockchain.mining.consensus;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Per-network consensus constants. Difficulty is fixed per network: every block carries {@link #targetBits()}.
 */
public final class ConsensusParams {
    public static final long COIN = 100_000_000L;
    public static final long MAX_FUTURE_BLOCK_TIME_SECONDS = 2 * 60 * 60;
    public static final int MEDIAN_TIME_SPAN = 11;

    private final String name;
    private final NetworkMode mode;
    private final int blockVersion;
    private final int targetBits;
    private final int powLimitBits;
    private final long targetSpacingSeconds;
    private final long initialSubsidy;
    private final long halvingInterval;
    private final int maxBlockWeight;
    private final int maxBlockSize;
    private final int maxBlockSigOpsCost;
    private final long maxTipAgeSeconds;
    private final long genesisTime;

    private ConsensusParams(String name, NetworkMode mode, int blockVersion, int targetBits, int powLimitBits,
                            long targetSpacingSeconds, long initialSubsidy, long halvingInterval,
                            int maxBlockWeight, int maxBlockSize, int maxBlockSigOpsCost,
                            long maxTipAgeSeconds, long genesisTime) {
        this.name = name;
        this.mode = mode;
        this.blockVersion = blockVersion;
        this.targetBits = targetBits;
        this.powLimitBits = powLimitBits;
        this.targetSpacingSeconds = targetSpacingSeconds;
        this.initialSubsidy = initialSubsidy;
        this.halvingInterval = halvingInterval;
        this.maxBlockWeight = maxBlockWeight;
        this.maxBlockSize = maxBlockSize;
        this.maxBlockSigOpsCost = maxBlockSigOpsCost;
        this.maxTipAgeSeconds = maxTipAgeSeconds;
        this.genesisTime = genesisTime;
    }

    /** Local test network: trivial difficulty, never considered in initial sync. */
    public static ConsensusParams regtest() {
        return new ConsensusParams("regtest", NetworkMode.PROOF_OF_WORK, 4, 0x207fffff, 0x207fffff,
                600, 50 * COIN, 150, 4_000_000, 4_000_000, 80_000, Long.MAX_VALUE, 1_700_000_000L);
    }

    public static ConsensusParams main() {
        return new ConsensusParams("main", NetworkMode.PROOF_OF_WORK, 4, 0x1e0fffff, 0x1e0fffff,
                300, 50 * COIN, 210_000, 4_000_000, 4_000_000, 80_000, 24 * 60 * 60, 1_700_000_000L);
    }

    /** Proof-of-stake flavoured regtest; direct mining is refused on it. */
    public static ConsensusParams posRegtest() {
        return new ConsensusParams("posregtest", NetworkMode.PROOF_OF_STAKE, 4, 0x207fffff, 0x207fffff,
                600, 50 * COIN, 150, 4_000_000, 4_000_000, 80_000, Long.MAX_VALUE, 1_700_000_000L);
    }

    public static ConsensusParams forName(String network) {
        switch (network == null ? "" : network.toLowerCase(Locale.ROOT)) {
            case "regtest": return regtest();
            case "main": return main();
            case "posregtest": return posRegtest();
            default: throw new IllegalArgumentException("Unknown network: " + network);
        }
    }

    /** Copy with a different fixed difficulty; the proof-of-work limit follows if the new target is easier. */
    public ConsensusParams withTargetBits(int bits) {
        BigInteger limit = ProofOfWork.decodeCompact(powLimitBits);
        int limitBits = ProofOfWork.decodeCompact(bits).compareTo(limit) > 0 ? bits : powLimitBits;
        return new ConsensusParams(name, mode, blockVersion, bits, limitBits, targetSpacingSeconds, initialSubsidy,
                halvingInterval, maxBlockWeight, maxBlockSize, maxBlockSigOpsCost, maxTipAgeSeconds, genesisTime);
    }

    public ConsensusParams withMaxTipAgeSeconds(long seconds) {
        return new ConsensusParams(name, mode, blockVersion, targetBits, powLimitBits, targetSpacingSeconds,
                initialSubsidy, halvingInterval, maxBlockWeight, maxBlockSize, maxBlockSigOpsCost, seconds, genesisTime);
    }

    public String name() { return name; }
    public NetworkMode mode() { return mode; }
    public int blockVersion() { return blockVersion; }
    public int targetBits() { return targetBits; }
    public BigInteger powLimit() { return ProofOfWork.decodeCompact(powLimitBits); }
    public long targetSpacingSeconds() { return targetSpacingSeconds; }
    public int maxBlockWeight() { return maxBlockWeight; }
    public int maxBlockSize() { return maxBlockSize; }
    public int maxBlockSigOpsCost() { return maxBlockSigOpsCost; }
    public long maxTipAgeSeconds() { return maxTipAgeSeconds; }
    public long genesisTime() { return genesisTime; }

    /** Block subsidy at {@code height}, halving every {@code halvingInterval} blocks. */
    public long subsidy(long height) {
        long halvings = height / halvingInterval;
        if (halvings >= 64) return 0;
        return initialSubsidy >> halvings;
    }

    @Override public String toString() { return "ConsensusParams{" + name + ", " + mode + "}"; }
}

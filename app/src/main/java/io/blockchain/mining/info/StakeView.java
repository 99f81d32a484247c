package io.blockchain.mining.info;

/**
 * Stake figures owned by the wallet side of a proof-of-stake node.
 */
public interface StakeView {

    StakeView NONE = new StakeView() {
        @Override public double proofOfStakeDifficulty() { return 0.0; }
        @Override public long searchInterval() { return 0; }
        @Override public long stakeWeight() { return 0; }
        @Override public double interestRate() { return 0.0; }
        @Override public double inflationRate() { return 0.0; }
        @Override public double averageNetworkStakeWeight() { return 0.0; }
    };

    double proofOfStakeDifficulty();

    /** Seconds covered by the last coin-stake search. */
    long searchInterval();

    long stakeWeight();

    double interestRate();

    double inflationRate();

    double averageNetworkStakeWeight();
}

package io.blockchain.mining.info;

/**
 * {@code getmininginfo} response. The network mode decides which variant is produced.
 */
public interface MiningInfo {
    long blocks();
    double networkhashps();
    String chain();
}

package io.blockchain.mining.consensus;

public enum NetworkMode {
    PROOF_OF_WORK,
    PROOF_OF_STAKE
}

package io.blockchain.mining.chain;

public enum BlockStatus {
    /** Header accepted, body not (yet) validated. */
    HEADER_VALID,
    FULLY_VALID,
    FAILED
}

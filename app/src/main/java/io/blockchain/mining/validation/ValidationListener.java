package io.blockchain.mining.validation;

import io.blockchain.mining.protocol.Block;

public interface ValidationListener {
    /** Fired once per fully checked block, valid or not. */
    void blockChecked(Block block, ValidationOutcome outcome);
}

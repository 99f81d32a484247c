package io.blockchain.mining.node;

import io.blockchain.mining.assembler.MempoolBlockAssembler;
import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.protocol.Merkle;
import io.blockchain.mining.protocol.Script;
import io.blockchain.mining.protocol.Transaction;

import java.util.List;

/**
 * Deterministic genesis block per network: height 0, zero parent, a single anyone-can-spend coinbase
 * and the network's genesis time. Its proof of work is never checked.
 */
public final class GenesisBuilder {
    private GenesisBuilder() {}

    public static Block build(ConsensusParams params) {
        Transaction coinbase = MempoolBlockAssembler.coinbase(0, Script.ANYONE_CAN_SPEND, params.subsidy(0));
        BlockHeader header = new BlockHeader(
                params.blockVersion(),
                Hash.ZERO,
                Merkle.rootOf(List.of(coinbase.txid())),
                0L,
                params.genesisTime(),
                params.targetBits(),
                0L
        );
        return new Block(header, List.of(coinbase));
    }
}

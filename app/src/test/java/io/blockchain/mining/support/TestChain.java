package io.blockchain.mining.support;

import io.blockchain.mining.assembler.MempoolBlockAssembler;
import io.blockchain.mining.chain.BestBlockSignal;
import io.blockchain.mining.chain.ChainIndex;
import io.blockchain.mining.chain.ChainState;
import io.blockchain.mining.chain.ChainTip;
import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.consensus.ProofOfWork;
import io.blockchain.mining.mempool.Mempool;
import io.blockchain.mining.node.GenesisBuilder;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.protocol.OutPoint;
import io.blockchain.mining.protocol.Script;
import io.blockchain.mining.protocol.Transaction;
import io.blockchain.mining.storage.InMemoryChainStore;
import io.blockchain.mining.validation.AcceptResult;
import io.blockchain.mining.validation.ChainValidationEngine;
import io.blockchain.mining.validation.ValidationEvents;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** In-memory chain, mempool, engine and assembler sharing one test clock. */
public final class TestChain {
    public final ConsensusParams params;
    public final MutableClock clock;
    public final InMemoryChainStore store = new InMemoryChainStore();
    public final BestBlockSignal signal = new BestBlockSignal();
    public final ChainIndex chain;
    public final Mempool mempool = new Mempool();
    public final ValidationEvents events = new ValidationEvents();
    public final ChainValidationEngine engine;
    public final MempoolBlockAssembler assembler;

    public TestChain(ConsensusParams params) {
        this.params = params;
        this.clock = new MutableClock(Instant.ofEpochSecond(params.genesisTime() + 600));
        this.chain = new ChainIndex(store, params, signal, clock, GenesisBuilder.build(params));
        this.engine = new ChainValidationEngine(chain, params, events, clock);
        this.assembler = new MempoolBlockAssembler(chain, mempool, params, clock);
    }

    public static TestChain regtest() {
        return new TestChain(ConsensusParams.regtest());
    }

    /** Child of the current tip with a coinbase to OP_TRUE followed by {@code txs}; nonce 0, not solved. */
    public Block childOfTip(List<Transaction> txs) {
        return childOf(chain, params, clock.instant().getEpochSecond(), txs);
    }

    public static Block childOf(ChainState chain, ConsensusParams params, long now, List<Transaction> txs) {
        ChainTip tip = chain.currentTip();
        long height = tip.height() + 1;
        List<Transaction> all = new ArrayList<>();
        all.add(MempoolBlockAssembler.coinbase(height, Script.ANYONE_CAN_SPEND, params.subsidy(height)));
        all.addAll(txs);
        long time = Math.max(tip.medianTimePast() + 1, now);
        BlockHeader header = new BlockHeader(params.blockVersion(), tip.hash(), Hash.ZERO, height, time,
                params.targetBits(), 0);
        Block block = new Block(header, all);
        return block.withHeader(header.withMerkleRoot(block.computeMerkleRoot()));
    }

    public Block solvedChild(List<Transaction> txs) {
        return solve(childOfTip(txs), params);
    }

    /** Mines one empty block on the tip through the engine. */
    public Block extendTip() {
        Block block = solvedChild(List.of());
        AcceptResult result = engine.acceptBlock(block, true);
        if (!result.accepted()) {
            throw new IllegalStateException("test block rejected: " + block.hash().hex());
        }
        return block;
    }

    public static Block solve(Block block, ConsensusParams params) {
        BlockHeader h = block.header();
        while (!ProofOfWork.checkProofOfWork(h.hash(), h.bits(), params.powLimit())) {
            h = h.withNonce(h.nonce() + 1);
        }
        return block.withHeader(h);
    }

    /** Same block with a nonce whose hash misses the target. */
    public static Block unsolve(Block block, ConsensusParams params) {
        BlockHeader h = block.header();
        while (ProofOfWork.checkProofOfWork(h.hash(), h.bits(), params.powLimit())) {
            h = h.withNonce(h.nonce() + 1);
        }
        return block.withHeader(h);
    }

    /** One-input, one-output transaction spending {@code (txid, index)}. */
    public static Transaction spend(Hash txid, int index, long value) {
        return Transaction.builder()
                .input(new OutPoint(txid, index), Script.EMPTY)
                .output(value, Script.ANYONE_CAN_SPEND)
                .build();
    }

    public static Hash hashOf(int seed) {
        byte[] b = new byte[Hash.LENGTH];
        b[0] = (byte) seed;
        b[31] = (byte) (seed >>> 8);
        b[15] = 1;
        return new Hash(b);
    }
}

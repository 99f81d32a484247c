package io.blockchain.mining.assembler;

import io.blockchain.mining.chain.ChainState;
import io.blockchain.mining.chain.ChainTip;
import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.mempool.Mempool;
import io.blockchain.mining.mempool.MempoolEntry;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.protocol.OutPoint;
import io.blockchain.mining.protocol.Script;
import io.blockchain.mining.protocol.Transaction;
import io.blockchain.mining.protocol.TransactionInput;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Fills a block from the mempool by modified fee, never placing a transaction before an
 * in-mempool parent, within the network's weight and sigop limits.
 */
public final class MempoolBlockAssembler implements BlockAssembler {
    private static final Logger LOG = Logger.getLogger(MempoolBlockAssembler.class.getName());

    /** Room kept for the header and coinbase. */
    static final int COINBASE_WEIGHT_RESERVE = 4_000;
    static final int COINBASE_SIGOPS_RESERVE = 400;

    private final ChainState chain;
    private final Mempool mempool;
    private final ConsensusParams params;
    private final Clock clock;

    private volatile AssemblyStats lastStats;

    public MempoolBlockAssembler(ChainState chain, Mempool mempool, ConsensusParams params, Clock clock) {
        this.chain = chain;
        this.mempool = mempool;
        this.params = params;
        this.clock = clock;
    }

    @Override
    public CandidateBlock createNewBlock(Script coinbaseScript) throws BlockAssemblyException {
        ChainTip tip = chain.currentTip();
        if (chain.lookup(tip.hash()).isEmpty()) {
            throw new BlockAssemblyException("tip " + tip.hash().hex() + " is not indexed");
        }
        long height = tip.height() + 1;

        List<MempoolEntry> selected = select();
        long totalFees = 0;
        int weight = BlockHeader.ENCODED_LENGTH * Transaction.WITNESS_SCALE_FACTOR;
        List<Transaction> txs = new ArrayList<>(selected.size() + 1);
        List<Long> fees = new ArrayList<>(selected.size() + 1);
        List<Integer> sigOps = new ArrayList<>(selected.size() + 1);
        for (MempoolEntry e : selected) {
            totalFees += e.fee();
            weight += e.tx().weight();
        }

        try {
            Transaction coinbase = coinbase(height, coinbaseScript, params.subsidy(height) + totalFees);
            txs.add(coinbase);
            fees.add(-totalFees);
            sigOps.add(coinbase.sigOpCost());
            for (MempoolEntry e : selected) {
                txs.add(e.tx());
                fees.add(e.fee());
                sigOps.add(e.sigOpCost());
            }

            long now = clock.instant().getEpochSecond();
            Block draft = new Block(new BlockHeader(params.blockVersion(), tip.hash(), Hash.ZERO, height,
                    Math.max(tip.medianTimePast() + 1, now), params.targetBits(), 0), txs);
            Block block = draft.withHeader(draft.header().withMerkleRoot(draft.computeMerkleRoot()));

            lastStats = new AssemblyStats(weight + coinbase.weight(), selected.size());
            LOG.fine(() -> "Assembled block at height " + height + " with " + selected.size() + " transactions");
            return new CandidateBlock(block, fees, sigOps);
        } catch (IllegalArgumentException | ArithmeticException ex) {
            throw new BlockAssemblyException("could not assemble block at height " + height, ex);
        }
    }

    @Override
    public Optional<AssemblyStats> lastStats() {
        return Optional.ofNullable(lastStats);
    }

    /** Coinbase whose scriptSig starts with the block height, as extra-nonce updates expect. */
    public static Transaction coinbase(long height, Script payout, long value) {
        Script scriptSig = Script.builder().number(height).op(Script.OP_0).build();
        return Transaction.builder()
                .input(new TransactionInput(OutPoint.NULL, scriptSig, TransactionInput.SEQUENCE_FINAL))
                .output(value, payout)
                .build();
    }

    private List<MempoolEntry> select() {
        List<MempoolEntry> pool = mempool.entries();
        Map<Hash, MempoolEntry> byId = new HashMap<>();
        for (MempoolEntry e : pool) byId.put(e.txid(), e);

        Map<Hash, Long> modified = new HashMap<>();
        for (MempoolEntry e : pool) modified.put(e.txid(), mempool.modifiedFee(e));
        List<MempoolEntry> ordered = new ArrayList<>(pool);
        ordered.sort(Comparator.comparingLong((MempoolEntry e) -> modified.get(e.txid())).reversed());

        int weightLimit = params.maxBlockWeight() - COINBASE_WEIGHT_RESERVE;
        int sigOpLimit = params.maxBlockSigOpsCost() - COINBASE_SIGOPS_RESERVE;
        long weight = 0;
        long sigOps = 0;

        Set<Hash> chosen = new LinkedHashSet<>();
        Set<Hash> rejected = new HashSet<>();
        List<MempoolEntry> out = new ArrayList<>();
        boolean progress = true;
        while (progress) {
            progress = false;
            for (MempoolEntry e : ordered) {
                Hash id = e.txid();
                if (chosen.contains(id) || rejected.contains(id)) continue;
                boolean parentsReady = true;
                for (TransactionInput in : e.tx().inputs()) {
                    Hash parent = in.prevout().txid();
                    if (byId.containsKey(parent) && !chosen.contains(parent)) {
                        parentsReady = false;
                        if (rejected.contains(parent)) rejected.add(id);
                        break;
                    }
                }
                if (!parentsReady) continue;
                if (weight + e.tx().weight() > weightLimit || sigOps + e.sigOpCost() > sigOpLimit) {
                    rejected.add(id);
                    continue;
                }
                weight += e.tx().weight();
                sigOps += e.sigOpCost();
                chosen.add(id);
                out.add(e);
                progress = true;
                break;
            }
        }
        return out;
    }
}

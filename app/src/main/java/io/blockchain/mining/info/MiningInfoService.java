package io.blockchain.mining.info;

import io.blockchain.mining.assembler.AssemblyStats;
import io.blockchain.mining.assembler.BlockAssembler;
import io.blockchain.mining.chain.BlockRecord;
import io.blockchain.mining.chain.ChainState;
import io.blockchain.mining.chain.ChainTip;
import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.consensus.NetworkMode;
import io.blockchain.mining.consensus.ProofOfWork;
import io.blockchain.mining.mempool.Mempool;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.DoubleSupplier;

/**
 * Builds the {@code getmininginfo} response.
 */
public final class MiningInfoService {
    static final int HASHRATE_WINDOW = 120;
    /** Scale applied to (network hashes per block interval / local hashes per minute). */
    private static final double BLOCK_RATE_FACTOR = 16.666667;

    private final ChainState chain;
    private final Mempool mempool;
    private final BlockAssembler assembler;
    private final ConsensusParams params;
    private final DoubleSupplier localHashesPerMinute;
    private final StakeView stake;
    private final Clock clock;

    public MiningInfoService(ChainState chain, Mempool mempool, BlockAssembler assembler, ConsensusParams params,
                             DoubleSupplier localHashesPerMinute, StakeView stake, Clock clock) {
        this.chain = chain;
        this.mempool = mempool;
        this.assembler = assembler;
        this.params = params;
        this.localHashesPerMinute = localHashesPerMinute;
        this.stake = stake;
        this.clock = clock;
    }

    public MiningInfo info() {
        ChainTip tip = chain.currentTip();
        List<BlockRecord> recent = recentBlocks(tip, HASHRATE_WINDOW);
        BlockRecord tipRecord = recent.get(0);

        Optional<AssemblyStats> stats = assembler.lastStats();
        Long weight = stats.map(AssemblyStats::weight).orElse(null);
        Long txCount = stats.map(AssemblyStats::txCount).orElse(null);
        double netHashesPerSecond = networkHashesPerSecond(recent);
        double blockReward = (double) params.subsidy(tip.height() + 1) / ConsensusParams.COIN;
        long blocksPerHour = blocksInLastHour(tip);
        double powDifficulty = ProofOfWork.difficulty(tipRecord.header().bits());

        if (params.mode() == NetworkMode.PROOF_OF_STAKE) {
            return new ProofOfStakeInfo(tip.height(), weight, txCount, netHashesPerSecond, mempool.size(),
                    params.name(), "", blockReward, blocksPerHour,
                    new ProofOfStakeInfo.Difficulty(powDifficulty, stake.proofOfStakeDifficulty(), stake.searchInterval()),
                    new ProofOfStakeInfo.StakeWeight(stake.stakeWeight()),
                    stake.interestRate(), stake.inflationRate(), stake.averageNetworkStakeWeight());
        }

        double blockTimeMinutes = averageSpacingSeconds(recent) / 60.0;
        double localRate = localHashesPerMinute.getAsDouble();
        double netHashesPerMinute = netHashesPerSecond * 60.0;
        double estimate = localRate == 0.0 ? 0.0 : BLOCK_RATE_FACTOR * (netHashesPerMinute * blockTimeMinutes) / localRate;
        return new ProofOfWorkInfo(tip.height(), weight, txCount, netHashesPerSecond, mempool.size(), params.name(),
                "", blockReward, blocksPerHour, blockTimeMinutes, powDifficulty, estimate, localRate);
    }

    /** Tip first, walking back at most {@code limit} blocks. */
    List<BlockRecord> recentBlocks(ChainTip tip, int limit) {
        List<BlockRecord> out = new ArrayList<>();
        Optional<BlockRecord> cursor = chain.lookup(tip.hash());
        while (cursor.isPresent() && out.size() < limit) {
            BlockRecord rec = cursor.get();
            out.add(rec);
            if (rec.height() == 0) break;
            cursor = chain.lookup(rec.parentHash());
        }
        if (out.isEmpty()) {
            throw new IllegalStateException("tip " + tip.hash().hex() + " is not indexed");
        }
        return out;
    }

    /** Work of the window (excluding its oldest block) divided by the time it spans. */
    static double networkHashesPerSecond(List<BlockRecord> recent) {
        if (recent.size() < 2) {
            return 0.0;
        }
        BlockRecord newest = recent.get(0);
        BlockRecord oldest = recent.get(recent.size() - 1);
        long span = newest.header().time() - oldest.header().time();
        if (span <= 0) {
            return 0.0;
        }
        BigInteger work = newest.chainWork().subtract(oldest.chainWork());
        return work.doubleValue() / span;
    }

    static double averageSpacingSeconds(List<BlockRecord> recent) {
        if (recent.size() < 2) {
            return 0.0;
        }
        long span = recent.get(0).header().time() - recent.get(recent.size() - 1).header().time();
        return Math.max(0, span) / (double) (recent.size() - 1);
    }

    private long blocksInLastHour(ChainTip tip) {
        long cutoff = clock.instant().getEpochSecond() - 3600;
        long count = 0;
        Optional<BlockRecord> cursor = chain.lookup(tip.hash());
        while (cursor.isPresent()) {
            BlockRecord rec = cursor.get();
            if (rec.header().time() < cutoff || rec.height() == 0) break;
            count++;
            cursor = chain.lookup(rec.parentHash());
        }
        return count;
    }
}

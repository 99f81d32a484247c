package io.blockchain.mining.template;

import io.blockchain.mining.assembler.CandidateBlock;
import io.blockchain.mining.chain.BlockRecord;
import io.blockchain.mining.chain.ChainState;
import io.blockchain.mining.chain.ChainTip;
import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.consensus.ProofOfWork;
import io.blockchain.mining.error.ErrorCode;
import io.blockchain.mining.error.MiningException;
import io.blockchain.mining.metrics.MiningMetrics;
import io.blockchain.mining.node.PeerManager;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockCodec;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.Hash;
import io.blockchain.mining.protocol.Hex;
import io.blockchain.mining.protocol.Script;
import io.blockchain.mining.protocol.Transaction;
import io.blockchain.mining.protocol.TransactionInput;
import io.blockchain.mining.submit.ValidationResultClassifier;
import io.blockchain.mining.validation.ValidationEngine;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * {@code getblocktemplate}: hands out block templates (optionally after a long poll) and checks proposals.
 */
public final class TemplateService {
    private static final Logger LOG = Logger.getLogger(TemplateService.class.getName());

    private final ChainState chain;
    private final BlockTemplateCache cache;
    private final LongPollCoordinator longPoll;
    private final ValidationEngine engine;
    private final PeerManager peers;
    private final ConsensusParams params;
    private final Clock clock;
    private final String nodeName;

    /** {@code peers} may be null when the node runs without peer-to-peer support. */
    public TemplateService(ChainState chain, BlockTemplateCache cache, LongPollCoordinator longPoll,
                           ValidationEngine engine, PeerManager peers, ConsensusParams params,
                           Clock clock, String nodeName) {
        this.chain = chain;
        this.cache = cache;
        this.longPoll = longPoll;
        this.engine = engine;
        this.peers = peers;
        this.params = params;
        this.clock = clock;
        this.nodeName = nodeName;
    }

    /** Returns a {@link BlockTemplate} in template mode, a result string or null in proposal mode. */
    public Object handle(TemplateRequest request) throws InterruptedException {
        String mode = request.mode() == null ? "template" : request.mode();
        if (mode.equals("proposal")) {
            if (request.data() == null) {
                throw new MiningException(ErrorCode.TYPE_ERROR, "Missing data String key for proposal");
            }
            if (!Hex.isHex(request.data())) {
                throw new MiningException(ErrorCode.DESERIALIZATION_ERROR, "Block decode failed");
            }
            return propose(Hex.decode(request.data()));
        }
        if (!mode.equals("template")) {
            throw new MiningException(ErrorCode.INVALID_PARAMETER, "Invalid mode");
        }

        LongPollToken token = null;
        if (request.longPoll()) {
            if (request.longPollId() != null) {
                try {
                    token = LongPollToken.parse(request.longPollId());
                } catch (IllegalArgumentException e) {
                    throw new MiningException(ErrorCode.INVALID_PARAMETER, e.getMessage(), e);
                }
            } else {
                token = new LongPollToken(chain.currentTip().hash(), cache.lastBuiltVersion());
            }
        }
        return template(token);
    }

    /**
     * Template mode. With a token, first waits for new work; any wake reason leads to answering with current state.
     */
    public BlockTemplate template(LongPollToken token) throws InterruptedException {
        if (peers == null) {
            throw new MiningException(ErrorCode.CLIENT_P2P_DISABLED,
                    "Error: Peer-to-peer functionality missing or disabled");
        }
        if (peers.requiresPeers() && peers.connectedPeerCount() == 0) {
            throw new MiningException(ErrorCode.CLIENT_NOT_CONNECTED, nodeName + " is not connected!");
        }
        if (chain.isInitialSync()) {
            throw new MiningException(ErrorCode.CLIENT_IN_INITIAL_DOWNLOAD,
                    nodeName + " is in initial sync and waiting for blocks...");
        }

        if (token != null) {
            longPoll.await(token);
        }

        CandidateBlock candidate = cache.getOrBuild(Script.ANYONE_CAN_SPEND);
        return toResponse(candidate);
    }

    /** Proposal mode: checks a complete block against the live tip without storing it. */
    public String propose(byte[] data) {
        Block block;
        try {
            block = BlockCodec.fromBytes(data);
        } catch (IllegalArgumentException e) {
            throw new MiningException(ErrorCode.DESERIALIZATION_ERROR, "Block decode failed", e);
        }
        String result = proposalResult(block);
        MiningMetrics.recordSubmission("proposal", result == null ? "accepted" : result);
        return result;
    }

    private String proposalResult(Block block) {
        Optional<BlockRecord> known = chain.lookup(block.hash());
        if (known.isPresent()) {
            switch (known.get().status()) {
                case FULLY_VALID: return "duplicate";
                case FAILED: return "duplicate-invalid";
                default: return "duplicate-inconclusive";
            }
        }
        ChainTip tip = chain.currentTip();
        if (!block.header().parentHash().equals(tip.hash())) {
            return "inconclusive-not-best-prevblk";
        }
        return ValidationResultClassifier.classify(engine.checkBlockOnly(block, tip));
    }

    private BlockTemplate toResponse(CandidateBlock candidate) {
        Block block = candidate.block();
        BlockHeader header = block.header();
        long minTime = chain.medianTimePast(header.parentHash()) + 1;
        long curTime = Math.max(minTime, clock.instant().getEpochSecond());
        header = header.withTime(curTime).withNonce(0);

        List<Transaction> txs = block.transactions();
        Map<Hash, Integer> position = new HashMap<>();
        List<TemplateTransaction> entries = new ArrayList<>(txs.size());
        for (int i = 0; i < txs.size(); i++) {
            Transaction tx = txs.get(i);
            position.put(tx.txid(), i);
            if (tx.isCoinbase()) {
                continue;
            }
            TreeSet<Integer> depends = new TreeSet<>();
            for (TransactionInput in : tx.inputs()) {
                Integer p = position.get(in.prevout().txid());
                if (p != null && p > 0) {
                    depends.add(p);
                }
            }
            entries.add(new TemplateTransaction(Hex.encode(tx.serialize()), tx.txid().hex(), tx.txid().hex(),
                    new ArrayList<>(depends), candidate.fees().get(i), candidate.sigOpCosts().get(i), tx.weight()));
        }

        String longPollId = chain.currentTip().hash().hex() + cache.lastBuiltVersion();
        LOG.fine(() -> "Serving template at height " + block.header().height() + ", longpollid " + longPollId);
        return new BlockTemplate(
                BlockTemplate.CAPABILITIES,
                header.version(),
                BlockTemplate.RULES,
                header.parentHash().hex(),
                entries,
                Map.of(),
                candidate.coinbaseValue(),
                longPollId,
                ProofOfWork.targetHex(header.bits()),
                minTime,
                BlockTemplate.MUTABLE,
                BlockTemplate.NONCE_RANGE,
                params.maxBlockSigOpsCost(),
                params.maxBlockSize(),
                params.maxBlockWeight(),
                header.time(),
                String.format("%08x", header.bits()),
                header.height());
    }
}

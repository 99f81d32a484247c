package io.blockchain.mining.submit;

import io.blockchain.mining.chain.BlockRecord;
import io.blockchain.mining.chain.ChainState;
import io.blockchain.mining.error.ErrorCode;
import io.blockchain.mining.error.MiningException;
import io.blockchain.mining.metrics.MiningMetrics;
import io.blockchain.mining.protocol.Block;
import io.blockchain.mining.protocol.BlockCodec;
import io.blockchain.mining.protocol.BlockHeader;
import io.blockchain.mining.protocol.BlockHeaderCodec;
import io.blockchain.mining.validation.AcceptResult;
import io.blockchain.mining.validation.ValidationEngine;
import io.blockchain.mining.validation.ValidationEvents;
import io.blockchain.mining.validation.ValidationOutcome;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@code submitblock} and {@code submitheader}. Rejections come back as result strings; only malformed
 * input and engine errors are thrown.
 */
public final class SubmissionService {
    private static final Logger LOG = Logger.getLogger(SubmissionService.class.getName());

    private final ChainState chain;
    private final ValidationEngine engine;
    private final ValidationEvents events;

    public SubmissionService(ChainState chain, ValidationEngine engine, ValidationEvents events) {
        this.chain = chain;
        this.engine = engine;
        this.events = events;
    }

    /** Returns null when the block was accepted, otherwise a BIP22 result string. */
    public String submitBlock(byte[] data) {
        Block block;
        try {
            block = BlockCodec.fromBytes(data);
        } catch (IllegalArgumentException e) {
            throw new MiningException(ErrorCode.DESERIALIZATION_ERROR, "Block decode failed", e);
        }
        if (!block.startsWithCoinbase()) {
            throw new MiningException(ErrorCode.DESERIALIZATION_ERROR, "Block does not start with a coinbase");
        }
        String result = submit(block);
        MiningMetrics.recordSubmission("block", result == null ? "accepted" : result);
        LOG.info(() -> "submitblock " + block.hash().hex() + ": " + (result == null ? "accepted" : result));
        return result;
    }

    private String submit(Block block) {
        Optional<BlockRecord> known = chain.lookup(block.hash());
        if (known.isPresent()) {
            switch (known.get().status()) {
                case FULLY_VALID: return "duplicate";
                case FAILED: return "duplicate-invalid";
                default: break;
            }
        }

        Optional<BlockRecord> parent = chain.lookup(block.header().parentHash());
        if (parent.isPresent()) {
            block = engine.updateUncommittedBlockStructures(block, parent.get());
        }

        AcceptResult accepted;
        ValidationOutcome outcome;
        try (SubmissionObserver observer = SubmissionObserver.register(events, block.hash())) {
            accepted = engine.acceptBlock(block, true);
            outcome = observer.outcome().orElse(null);
        }
        if (accepted.accepted() && !accepted.newBlock()) {
            return "duplicate";
        }
        if (outcome == null) {
            return "inconclusive";
        }
        return ValidationResultClassifier.classify(outcome);
    }

    /**
     * Accepts a single header whose parent is already known.
     *
     * @throws MiningException {@link ErrorCode#VERIFY_ERROR} when the header is rejected or cannot be checked
     */
    public void submitHeader(byte[] data) {
        BlockHeader header;
        try {
            header = BlockHeaderCodec.fromBytes(data);
        } catch (IllegalArgumentException e) {
            throw new MiningException(ErrorCode.DESERIALIZATION_ERROR, "Block header decode failed", e);
        }
        if (chain.lookup(header.parentHash()).isEmpty()) {
            throw new MiningException(ErrorCode.VERIFY_ERROR,
                    "Must submit previous header (" + header.parentHash().hex() + ") first");
        }

        ValidationOutcome outcome = engine.acceptHeaders(List.of(header));
        MiningMetrics.recordSubmission("header", outcome.isValid() ? "accepted" : outcome.kind().name());
        if (!outcome.isValid()) {
            // Error message or reject reason, verbatim
            throw new MiningException(ErrorCode.VERIFY_ERROR, outcome.reason());
        }
    }
}

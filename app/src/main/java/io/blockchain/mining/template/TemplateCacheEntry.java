package io.blockchain.mining.template;

import io.blockchain.mining.assembler.CandidateBlock;
import io.blockchain.mining.chain.ChainTip;
import io.blockchain.mining.protocol.Script;

import java.time.Instant;

/** A built candidate plus the chain tip, mempool version and payout script it was built for. */
public record TemplateCacheEntry(CandidateBlock candidate, ChainTip tip, long mempoolVersion,
                                 Instant builtAt, Script coinbaseScript) {}

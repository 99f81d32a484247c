package io.blockchain.mining.info;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Mining info for proof-of-work networks. {@code hashrate} is the local miner's hashes per minute;
 * {@code blocktime} is the recent average block spacing in minutes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"blocks", "currentblockweight", "currentblocktx", "networkhashps", "pooledtx", "chain",
        "warnings", "blockreward", "blocksperhour", "blocktime", "difficulty", "estimateblockrate", "hashrate"})
public record ProofOfWorkInfo(
        long blocks,
        Long currentblockweight,
        Long currentblocktx,
        double networkhashps,
        long pooledtx,
        String chain,
        String warnings,
        double blockreward,
        long blocksperhour,
        double blocktime,
        double difficulty,
        double estimateblockrate,
        double hashrate) implements MiningInfo {}

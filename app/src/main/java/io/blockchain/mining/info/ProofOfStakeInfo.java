package io.blockchain.mining.info;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"blocks", "currentblockweight", "currentblocktx", "networkhashps", "pooledtx", "chain",
        "warnings", "blockreward", "blocksperhour", "difficulty", "stakeweight", "stakeinterest",
        "stakeinflation", "netstakeweight"})
public record ProofOfStakeInfo(
        long blocks,
        Long currentblockweight,
        Long currentblocktx,
        double networkhashps,
        long pooledtx,
        String chain,
        String warnings,
        double blockreward,
        long blocksperhour,
        Difficulty difficulty,
        StakeWeight stakeweight,
        double stakeinterest,
        double stakeinflation,
        double netstakeweight) implements MiningInfo {

    @JsonPropertyOrder({"proof-of-work", "proof-of-stake", "search-interval"})
    public record Difficulty(
            @JsonProperty("proof-of-work") double proofOfWork,
            @JsonProperty("proof-of-stake") double proofOfStake,
            @JsonProperty("search-interval") long searchInterval) {}

    public record StakeWeight(long combined) {}
}

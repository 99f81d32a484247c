package io.blockchain.mining.miner;

import com.fasterxml.jackson.annotation.JsonInclude;

/** {@code minerstart}/{@code minerstop}/{@code minerstatus} response; {@code nthreads} is omitted by minerstatus. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MinerStatus(String status, Integer nthreads) {
    public static final String ACTIVE = "active";
    public static final String STOPPED = "stopped";
}

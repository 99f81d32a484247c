package io.blockchain.mining.node;

import io.blockchain.mining.consensus.ConsensusParams;
import io.blockchain.mining.template.BlockTemplateCache;
import io.blockchain.mining.template.LongPollCoordinator;

import java.time.Duration;

/** Settings for a mining node. */
public final class NodeConfig {
    public static final String DEFAULT_NODE_NAME = "blockchain-mining";

    public final ConsensusParams params;
    public final String nodeName;
    public final boolean peerToPeer;
    public final String minerAddress;
    public final int minerThreads;
    public final Duration longPollTimeout;
    public final Duration longPollRecheck;
    public final Duration templateCooldown;
    public final long minRelayFee;

    public NodeConfig(ConsensusParams params, String nodeName, boolean peerToPeer, String minerAddress,
                      int minerThreads, Duration longPollTimeout, Duration longPollRecheck,
                      Duration templateCooldown, long minRelayFee) {
        this.params = params;
        this.nodeName = nodeName;
        this.peerToPeer = peerToPeer;
        this.minerAddress = minerAddress;
        this.minerThreads = minerThreads;
        this.longPollTimeout = longPollTimeout;
        this.longPollRecheck = longPollRecheck;
        this.templateCooldown = templateCooldown;
        this.minRelayFee = minRelayFee;
    }

    public static NodeConfig defaultLocal() {
        return new NodeConfig(
                ConsensusParams.regtest(),
                DEFAULT_NODE_NAME,
                true,
                null,                 // OP_TRUE payout
                0,                    // miner off until minerstart
                LongPollCoordinator.DEFAULT_TIMEOUT,
                LongPollCoordinator.DEFAULT_RECHECK,
                BlockTemplateCache.DEFAULT_REBUILD_COOLDOWN,
                0L
        );
    }

    public NodeConfig withParams(ConsensusParams params) {
        return new NodeConfig(params, nodeName, peerToPeer, minerAddress, minerThreads,
                longPollTimeout, longPollRecheck, templateCooldown, minRelayFee);
    }

    public NodeConfig withMiner(String minerAddress, int minerThreads) {
        return new NodeConfig(params, nodeName, peerToPeer, minerAddress, minerThreads,
                longPollTimeout, longPollRecheck, templateCooldown, minRelayFee);
    }

    public NodeConfig withLongPoll(Duration timeout, Duration recheck) {
        return new NodeConfig(params, nodeName, peerToPeer, minerAddress, minerThreads,
                timeout, recheck, templateCooldown, minRelayFee);
    }

    public NodeConfig withTemplateCooldown(Duration cooldown) {
        return new NodeConfig(params, nodeName, peerToPeer, minerAddress, minerThreads,
                longPollTimeout, longPollRecheck, cooldown, minRelayFee);
    }

    /** Without peer-to-peer the template and miner calls answer CLIENT_P2P_DISABLED. */
    public NodeConfig withPeerToPeer(boolean enabled) {
        return new NodeConfig(params, nodeName, enabled, minerAddress, minerThreads,
                longPollTimeout, longPollRecheck, templateCooldown, minRelayFee);
    }
}

package io.blockchain.mining.node;

/**
 * Peer connectivity as seen by the mining layer.
 */
public interface PeerManager {

    int connectedPeerCount();

    /** False for networks that mine without peers, such as a local regtest node. */
    default boolean requiresPeers() {
        return true;
    }

    static PeerManager standalone() {
        return new PeerManager() {
            @Override public int connectedPeerCount() { return 0; }
            @Override public boolean requiresPeers() { return false; }
        };
    }
}

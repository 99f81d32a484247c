package io.blockchain.mining.error;

/**
 * JSON-RPC error codes reported for mining calls.
 */
public enum ErrorCode {
    MISC_ERROR(-1),
    TYPE_ERROR(-3),
    INVALID_ADDRESS_OR_KEY(-5),
    OUT_OF_MEMORY(-7),
    INVALID_PARAMETER(-8),
    CLIENT_NOT_CONNECTED(-9),
    CLIENT_IN_INITIAL_DOWNLOAD(-10),
    DESERIALIZATION_ERROR(-22),
    VERIFY_ERROR(-25),
    CLIENT_P2P_DISABLED(-31),
    INVALID_REQUEST(-32600),
    METHOD_NOT_FOUND(-32601),
    INVALID_PARAMS(-32602),
    INTERNAL_ERROR(-32603);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() { return code; }
}

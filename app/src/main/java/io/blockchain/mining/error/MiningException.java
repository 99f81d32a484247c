package io.blockchain.mining.error;

import java.util.Objects;

/**
 * Failure surfaced to a mining client. Rejections of submitted work are results, not exceptions.
 */
public class MiningException extends RuntimeException {
    private final ErrorCode code;

    public MiningException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public MiningException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() { return code; }

    @Override public String toString() {
        return "MiningException{" + code + " (" + code.code() + "): " + getMessage() + "}";
    }
}

package io.blockchain.mining.validation;

import java.util.Objects;

/**
 * Result of validating a block or header: valid, invalid with a reject reason, or an internal error.
 */
public final class ValidationOutcome {
    public enum Kind { VALID, INVALID, ERROR }

    private static final ValidationOutcome VALID = new ValidationOutcome(Kind.VALID, "");

    private final Kind kind;
    private final String detail;

    private ValidationOutcome(Kind kind, String detail) {
        this.kind = kind;
        this.detail = detail;
    }

    public static ValidationOutcome valid() { return VALID; }

    /** Consensus rejection; an empty reason is allowed. */
    public static ValidationOutcome invalid(String reason) {
        return new ValidationOutcome(Kind.INVALID, reason == null ? "" : reason);
    }

    /** Validation could not be completed. */
    public static ValidationOutcome error(String message) {
        return new ValidationOutcome(Kind.ERROR, message == null ? "" : message);
    }

    public Kind kind() { return kind; }
    public boolean isValid() { return kind == Kind.VALID; }
    public boolean isInvalid() { return kind == Kind.INVALID; }
    public boolean isError() { return kind == Kind.ERROR; }

    /** Reject reason for INVALID, message for ERROR, empty for VALID. */
    public String reason() { return detail; }

    @Override public boolean equals(Object o) {
        return o instanceof ValidationOutcome v && kind == v.kind && detail.equals(v.detail);
    }
    @Override public int hashCode() { return Objects.hash(kind, detail); }
    @Override public String toString() {
        return detail.isEmpty() ? kind.name() : kind + "(" + detail + ")";
    }
}

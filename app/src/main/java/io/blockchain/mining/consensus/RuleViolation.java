package io.blockchain.mining.consensus;

/**
 * A consensus rule a block or header broke. {@link #reason()} is the short reject code
 * reported to submitters (for example {@code bad-txnmrklroot}).
 */
public final class RuleViolation extends IllegalArgumentException {
    private final String reason;

    public RuleViolation(String reason, String detail) {
        super(detail == null ? reason : reason + ": " + detail);
        this.reason = reason;
    }

    public RuleViolation(String reason) {
        this(reason, null);
    }

    public String reason() { return reason; }
}

package io.blockchain.mining.submit;

import io.blockchain.mining.error.ErrorCode;
import io.blockchain.mining.error.MiningException;
import io.blockchain.mining.validation.ValidationOutcome;

/**
 * Maps a validation outcome to the BIP22 result: null when valid, the reject reason when invalid.
 */
public final class ValidationResultClassifier {
    private ValidationResultClassifier() {}

    /**
     * @throws MiningException {@link ErrorCode#VERIFY_ERROR} carrying the engine's message on an error outcome
     */
    public static String classify(ValidationOutcome outcome) {
        if (outcome.isValid()) {
            return null;
        }
        if (outcome.isError()) {
            throw new MiningException(ErrorCode.VERIFY_ERROR, outcome.reason());
        }
        if (outcome.isInvalid()) {
            String reason = outcome.reason();
            return reason.isEmpty() ? "rejected" : reason;
        }
        // Should be impossible
        return "valid?";
    }
}

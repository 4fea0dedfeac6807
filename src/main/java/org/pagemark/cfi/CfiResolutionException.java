package org.pagemark.cfi;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a parsed CFI cannot be walked against the supplied document trees.
 *
 * <p>Messages are prefixed with the reason code. Resolution failures are surfaced to the caller
 * and never retried internally.</p>
 */
@Getter
@Accessors(fluent = true)
public final class CfiResolutionException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded resolution failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public CfiResolutionException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}

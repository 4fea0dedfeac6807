package org.pagemark.cfi;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Malformed CFI syntax with a deterministic reason code and the offending character offset.
 */
@Getter
@Accessors(fluent = true)
public final class CfiParseException extends RuntimeException {
    private final String reasonCode;
    private final int position;

    /**
     * Creates a reason-coded parse failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param position zero-based offset of the offending character in the input string.
     */
    public CfiParseException(String reasonCode, String message, int position) {
        super(formatMessage(reasonCode, message, position));
        this.reasonCode = requireReasonCode(reasonCode);
        this.position = position;
    }

    private static String formatMessage(String reasonCode, String message, int position) {
        return "[" + requireReasonCode(reasonCode) + "] "
                + Objects.requireNonNull(message, "message")
                + " at position " + position;
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}

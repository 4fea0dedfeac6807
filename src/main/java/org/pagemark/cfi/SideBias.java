package org.pagemark.cfi;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Side-bias parameter ({@code ;s=b} / {@code ;s=a}) of a CFI assertion block.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum SideBias {
    /** The location sticks to the content before the addressed boundary. */
    BEFORE("b"),
    /** The location sticks to the content after the addressed boundary. */
    AFTER("a");

    /** Serialized parameter value. */
    private final String token;

    /**
     * Resolves a serialized side-bias value, or null when the token is unknown.
     */
    public static SideBias fromToken(String token) {
        for (SideBias bias : values()) {
            if (bias.token.equals(token)) {
                return bias;
            }
        }
        return null;
    }
}

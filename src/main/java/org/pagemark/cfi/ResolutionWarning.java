package org.pagemark.cfi;

/**
 * Non-fatal drift detected while resolving an identifier.
 *
 * @param reasonCode deterministic reason code.
 * @param message descriptive message.
 */
public record ResolutionWarning(String reasonCode, String message) {
}

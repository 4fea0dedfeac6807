package org.pagemark.progress;

import lombok.Builder;
import lombok.Value;

/**
 * Size units used to derive locations and reading time from byte sizes.
 */
@Value
@Builder(toBuilder = true)
public class ProgressPolicy {
    public static final String REASON_INVALID_PROGRESS_POLICY = "PROGRESS_INVALID_POLICY";

    /**
     * Bytes per virtual location.
     */
    @Builder.Default
    long sizePerLocation = 1500L;

    /**
     * Bytes read per minute.
     */
    @Builder.Default
    long sizePerTimeUnit = 1600L;

    /**
     * Default policy instance.
     */
    public static ProgressPolicy defaults() {
        return ProgressPolicy.builder().build();
    }

    ProgressPolicy validate() {
        if (sizePerLocation <= 0L) {
            throw new IllegalArgumentException(REASON_INVALID_PROGRESS_POLICY + ": sizePerLocation must be > 0");
        }
        if (sizePerTimeUnit <= 0L) {
            throw new IllegalArgumentException(REASON_INVALID_PROGRESS_POLICY + ": sizePerTimeUnit must be > 0");
        }
        return this;
    }
}

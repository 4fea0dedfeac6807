package org.pagemark.progress;

import java.util.Objects;

/**
 * Size metadata for one section, in document order.
 *
 * @param id opaque section key (typically the manifest href).
 * @param byteSize uncompressed content size, non-negative.
 * @param linear whether the section counts toward reading progress.
 */
public record SectionMeta(String id, long byteSize, boolean linear) {

    /**
     * Validates metadata fields.
     */
    public SectionMeta {
        Objects.requireNonNull(id, "id");
        if (byteSize < 0L) {
            throw new IllegalArgumentException("byteSize must be >= 0");
        }
    }

    /**
     * Creates linear section metadata.
     */
    public static SectionMeta linear(String id, long byteSize) {
        return new SectionMeta(id, byteSize, true);
    }

    /**
     * Creates non-linear section metadata.
     */
    public static SectionMeta nonLinear(String id, long byteSize) {
        return new SectionMeta(id, byteSize, false);
    }

    /**
     * Returns the size this section contributes to progress accumulation.
     */
    public long effectiveSize() {
        return linear ? byteSize : 0L;
    }
}

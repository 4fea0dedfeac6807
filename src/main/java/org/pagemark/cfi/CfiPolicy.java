package org.pagemark.cfi;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Addressing policy shared by {@link CfiResolver} and {@link CfiGenerator}.
 */
@Value
@Builder(toBuilder = true)
public class CfiPolicy {
    public static final String REASON_INVALID_PACKAGE_PREFIX = "CFI_INVALID_PACKAGE_PREFIX";

    /**
     * Where the section reference sits in the first indirection group.
     */
    public enum SectionAddressing {
        /**
         * The first step of the first group is the section step ({@code /6} is section 2);
         * later steps of that group walk the section tree and every {@code !} enters the
         * sub-document of the node reached.
         */
        LEADING_STEP,

        /**
         * Package-document convention: the last step of the first group references the
         * section ({@code /6/4!} is section 1), earlier steps form the package prefix and the
         * first {@code !} enters the section tree.
         */
        SPINE_REFERENCE
    }

    /**
     * Behavior when an identifier assertion does not match the positionally addressed node.
     */
    public enum IdAssertionMode {
        /**
         * Keep the positional node and record a warning.
         */
        POSITIONAL,

        /**
         * Search the current tree for the asserted identifier and continue from the match;
         * fall back to the positional node when no node carries it.
         */
        PREFER_IDENTIFIER
    }

    @Builder.Default
    SectionAddressing sectionAddressing = SectionAddressing.LEADING_STEP;

    /**
     * Steps emitted before the section step under {@link SectionAddressing#SPINE_REFERENCE}.
     */
    @Builder.Default
    List<Integer> packagePrefix = List.of(6);

    @Builder.Default
    IdAssertionMode idAssertionMode = IdAssertionMode.POSITIONAL;

    /**
     * Whether generated paths carry identifier assertions for elements exposing an identifier.
     */
    @Builder.Default
    boolean emitIdAssertions = true;

    /**
     * Whether generated strings are wrapped as {@code epubcfi(...)}.
     */
    @Builder.Default
    boolean wrapOutput = false;

    /**
     * Default policy instance.
     */
    public static CfiPolicy defaults() {
        return CfiPolicy.builder().build();
    }

    /**
     * Policy matching identifiers written against an EPUB package document
     * ({@code epubcfi(/6/4!/4/2:10)}).
     */
    public static CfiPolicy epub() {
        return CfiPolicy.builder()
                .sectionAddressing(SectionAddressing.SPINE_REFERENCE)
                .wrapOutput(true)
                .build();
    }

    /**
     * Converts a zero-based section index into its doubled section step index.
     */
    public static int sectionStepIndex(int sectionIndex) {
        if (sectionIndex < 0) {
            throw new IllegalArgumentException("sectionIndex must be >= 0");
        }
        return (sectionIndex + 1) * 2;
    }

    /**
     * Validates policy invariants and returns this instance.
     */
    CfiPolicy validate() {
        if (sectionAddressing == null || idAssertionMode == null || packagePrefix == null) {
            throw new IllegalArgumentException("policy fields must be non-null");
        }
        for (Integer index : packagePrefix) {
            if (index == null || index < 0 || (index & 1) == 1) {
                throw new IllegalArgumentException(
                        REASON_INVALID_PACKAGE_PREFIX + ": package prefix steps must be non-negative even indices"
                );
            }
        }
        return this;
    }
}

package org.pagemark.cfi;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One immutable CFI path segment.
 *
 * <p>Index parity is part of the addressing scheme: an even index {@code 2k} addresses the
 * {@code k}-th element child (1-based), an odd index {@code 2k+1} addresses the run of text
 * between element children {@code k} and {@code k+1}. Terminal data (character offset,
 * temporal offset, spatial point, text assertion) is only legal on the last step of a path.</p>
 */
@Value
public class CfiStep {
    /**
     * Doubled child index.
     */
    int index;

    /**
     * Identifier assertion checked against the addressed element, or null.
     */
    String idAssertion;

    /**
     * Character offset ({@code :n}), or null.
     */
    Integer offset;

    /**
     * Temporal offset in seconds ({@code ~n}), or null.
     */
    Double temporalOffset;

    /**
     * Spatial x coordinate ({@code @x:y}), or null.
     */
    Double spatialX;

    /**
     * Spatial y coordinate ({@code @x:y}), or null.
     */
    Double spatialY;

    /**
     * Text-location assertion (text before and optionally after the offset), or null.
     */
    List<String> textAssertion;

    /**
     * Side bias, or null.
     */
    SideBias sideBias;

    @Builder(toBuilder = true)
    private CfiStep(
            int index,
            String idAssertion,
            Integer offset,
            Double temporalOffset,
            Double spatialX,
            Double spatialY,
            List<String> textAssertion,
            SideBias sideBias
    ) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (offset != null && (temporalOffset != null || spatialX != null)) {
            throw new IllegalArgumentException("character offset excludes temporal and spatial offsets");
        }
        if ((spatialX == null) != (spatialY == null)) {
            throw new IllegalArgumentException("spatial offset requires both x and y");
        }
        if (textAssertion != null && (textAssertion.isEmpty() || textAssertion.size() > 2)) {
            throw new IllegalArgumentException("text assertion holds one or two values");
        }
        this.index = index;
        this.idAssertion = idAssertion;
        this.offset = offset;
        this.temporalOffset = temporalOffset;
        this.spatialX = spatialX;
        this.spatialY = spatialY;
        this.textAssertion = textAssertion == null ? null : List.copyOf(textAssertion);
        this.sideBias = sideBias;
    }

    /**
     * Creates a bare step without assertions.
     */
    public static CfiStep of(int index) {
        return builder().index(index).build();
    }

    /**
     * Creates a step carrying an identifier assertion.
     */
    public static CfiStep of(int index, String idAssertion) {
        return builder().index(index).idAssertion(idAssertion).build();
    }

    /**
     * Creates a terminal step carrying a character offset.
     */
    public static CfiStep withOffset(int index, int offset) {
        return builder().index(index).offset(offset).build();
    }

    /**
     * Returns true when this step addresses an element child.
     */
    public boolean isElementStep() {
        return (index & 1) == 0;
    }

    /**
     * Returns true when this step addresses a text gap between element children.
     */
    public boolean isTextStep() {
        return (index & 1) == 1;
    }

    /**
     * Returns true when this step carries any terminal data.
     */
    public boolean hasTerminal() {
        return offset != null || temporalOffset != null || spatialX != null || textAssertion != null;
    }

    @Override
    public String toString() {
        return CfiFormatter.formatStep(this);
    }
}

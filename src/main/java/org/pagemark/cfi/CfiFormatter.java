package org.pagemark.cfi;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Canonical CFI serializer.
 *
 * <p>{@code format(CfiParser.parse(s))} is the canonical form of {@code s}: assertion values are
 * re-escaped, numbers are written without redundant zeros and the {@code epubcfi(...)} wrapper is
 * dropped unless requested through {@link #wrap(String)}.</p>
 */
public final class CfiFormatter {
    static final String RESERVED = "^[](),;=!/";
    static final String WRAPPER_PREFIX = "epubcfi(";
    static final String WRAPPER_SUFFIX = ")";

    private CfiFormatter() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Serializes a point or range identifier.
     */
    public static String format(Cfi cfi) {
        Objects.requireNonNull(cfi, "cfi");
        if (!cfi.isRange()) {
            return format(cfi.getPath());
        }
        return format(cfi.getParent()) + ',' + format(cfi.getStart()) + ',' + format(cfi.getEnd());
    }

    /**
     * Serializes one path, joining groups with {@code !}.
     */
    public static String format(CfiPath path) {
        Objects.requireNonNull(path, "path");
        StringBuilder out = new StringBuilder();
        List<List<CfiStep>> groups = path.groups();
        for (int g = 0; g < groups.size(); g++) {
            if (g > 0) {
                out.append('!');
            }
            for (CfiStep step : groups.get(g)) {
                appendStep(out, step);
            }
        }
        return out.toString();
    }

    /**
     * Serializes one step including its terminal data.
     */
    public static String formatStep(CfiStep step) {
        StringBuilder out = new StringBuilder();
        appendStep(out, Objects.requireNonNull(step, "step"));
        return out.toString();
    }

    /**
     * Wraps a serialized identifier as {@code epubcfi(...)}.
     */
    public static String wrap(String cfi) {
        return WRAPPER_PREFIX + Objects.requireNonNull(cfi, "cfi") + WRAPPER_SUFFIX;
    }

    /**
     * Escapes reserved characters of an assertion value with a {@code ^} prefix.
     */
    public static String escape(String value) {
        StringBuilder out = new StringBuilder(value.length() + 4);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (RESERVED.indexOf(c) >= 0) {
                out.append('^');
            }
            out.append(c);
        }
        return out.toString();
    }

    private static void appendStep(StringBuilder out, CfiStep step) {
        out.append('/').append(step.getIndex());
        boolean terminal = step.hasTerminal();
        if (step.getIdAssertion() != null || (!terminal && step.getSideBias() != null)) {
            out.append('[');
            if (step.getIdAssertion() != null) {
                out.append(escape(step.getIdAssertion()));
            }
            if (!terminal) {
                appendSideBias(out, step.getSideBias());
            }
            out.append(']');
        }
        if (!terminal) {
            return;
        }
        if (step.getTemporalOffset() != null) {
            out.append('~').append(formatNumber(step.getTemporalOffset()));
        }
        if (step.getSpatialX() != null) {
            out.append('@')
                    .append(formatNumber(step.getSpatialX()))
                    .append(':')
                    .append(formatNumber(step.getSpatialY()));
        }
        if (step.getOffset() != null) {
            out.append(':').append(step.getOffset());
        }
        if (step.getTextAssertion() != null || step.getSideBias() != null) {
            out.append('[');
            if (step.getTextAssertion() != null) {
                List<String> text = step.getTextAssertion();
                for (int i = 0; i < text.size(); i++) {
                    if (i > 0) {
                        out.append(',');
                    }
                    out.append(escape(text.get(i)));
                }
            }
            appendSideBias(out, step.getSideBias());
            out.append(']');
        }
    }

    private static void appendSideBias(StringBuilder out, SideBias bias) {
        if (bias != null) {
            out.append(";s=").append(bias.token());
        }
    }

    private static String formatNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}

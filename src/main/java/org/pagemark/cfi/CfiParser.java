package org.pagemark.cfi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parser for CFI strings.
 *
 * <p>Accepts bare identifiers ({@code /6/4!/4/2:10}) and wrapped ones
 * ({@code epubcfi(/6/4!/4/2:10)}). Parsing is pure: it either returns a complete {@link Cfi} or
 * throws a {@link CfiParseException} naming the offending character position.</p>
 *
 * <p>Grammar:</p>
 * <pre>
 * cfi       := path ( "," suffix "," suffix )?
 * path      := group ( "!" group )*
 * group     := step+ terminal?
 * suffix    := path | terminal
 * step      := "/" integer assertion?
 * terminal  := ":" integer assertion?
 *            | ( "~" number )? ( "@" number ":" number )? assertion?
 * assertion := "[" value? ( "," value )? ( ";" name "=" value )* "]"
 * </pre>
 */
public final class CfiParser {
    public static final String REASON_EMPTY_PATH = "CFI_EMPTY_PATH";
    public static final String REASON_EMPTY_GROUP = "CFI_EMPTY_GROUP";
    public static final String REASON_MISSING_INDEX = "CFI_MISSING_INDEX";
    public static final String REASON_NEGATIVE_INDEX = "CFI_NEGATIVE_INDEX";
    public static final String REASON_INVALID_NUMBER = "CFI_INVALID_NUMBER";
    public static final String REASON_UNBALANCED_BRACKET = "CFI_UNBALANCED_BRACKET";
    public static final String REASON_UNESCAPED_RESERVED = "CFI_UNESCAPED_RESERVED";
    public static final String REASON_INVALID_ESCAPE = "CFI_INVALID_ESCAPE";
    public static final String REASON_INVALID_ASSERTION = "CFI_INVALID_ASSERTION";
    public static final String REASON_INVALID_SIDE_BIAS = "CFI_INVALID_SIDE_BIAS";
    public static final String REASON_WHITESPACE = "CFI_WHITESPACE";
    public static final String REASON_UNEXPECTED_CHARACTER = "CFI_UNEXPECTED_CHARACTER";
    public static final String REASON_INCOMPLETE_RANGE = "CFI_INCOMPLETE_RANGE";
    public static final String REASON_RANGE_PARENT_TERMINAL = "CFI_RANGE_PARENT_TERMINAL";
    public static final String REASON_RANGE_SUFFIX_WITHOUT_STEP = "CFI_RANGE_SUFFIX_WITHOUT_STEP";
    public static final String REASON_UNTERMINATED_WRAPPER = "CFI_UNTERMINATED_WRAPPER";
    public static final String REASON_UNEXPECTED_RANGE = "CFI_UNEXPECTED_RANGE";

    private static final String SIDE_BIAS_PARAMETER = "s";

    private CfiParser() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Parses a point or range identifier.
     *
     * @param text CFI string, optionally wrapped as {@code epubcfi(...)}.
     * @return parsed identifier.
     * @throws CfiParseException when the text is malformed.
     */
    public static Cfi parse(String text) {
        Scanner scanner = new Scanner(Objects.requireNonNull(text, "text"));
        scanner.unwrap();
        ParsedPath head = scanner.path(false);
        if (scanner.atEnd()) {
            return Cfi.point(head.path());
        }
        if (scanner.peek() != ',') {
            throw scanner.unexpected();
        }
        int rangePosition = scanner.pos;
        scanner.advance();
        ParsedPath start = scanner.suffix();
        if (scanner.atEnd() || scanner.peek() != ',') {
            throw scanner.error(REASON_INCOMPLETE_RANGE, "range requires a start and an end suffix");
        }
        scanner.advance();
        ParsedPath end = scanner.suffix();
        if (!scanner.atEnd()) {
            throw scanner.unexpected();
        }
        return buildRange(head.path(), start, end, rangePosition);
    }

    /**
     * Parses a point identifier and rejects ranges.
     *
     * @throws CfiParseException when the text is malformed or denotes a range.
     */
    public static CfiPath parsePath(String text) {
        Scanner scanner = new Scanner(Objects.requireNonNull(text, "text"));
        scanner.unwrap();
        ParsedPath path = scanner.path(false);
        if (!scanner.atEnd()) {
            if (scanner.peek() == ',') {
                throw scanner.error(REASON_UNEXPECTED_RANGE, "range identifier where a point path was expected");
            }
            throw scanner.unexpected();
        }
        return path.path();
    }

    /**
     * Returns true when {@code text} parses as a CFI.
     */
    public static boolean isWellFormed(String text) {
        if (text == null) {
            return false;
        }
        try {
            parse(text);
            return true;
        } catch (CfiParseException ex) {
            return false;
        }
    }

    private static Cfi buildRange(CfiPath parent, ParsedPath start, ParsedPath end, int rangePosition) {
        if (parent.lastStep().hasTerminal()) {
            throw new CfiParseException(
                    REASON_RANGE_PARENT_TERMINAL,
                    "range parent must not carry terminal data",
                    rangePosition
            );
        }
        if (start.terminalOnly() == null && end.terminalOnly() == null) {
            return Cfi.range(parent, start.path(), end.path());
        }

        // ",:2,:9" style suffixes address the parent's last step; move that step into both suffixes.
        List<List<CfiStep>> groups = parent.groups();
        List<CfiStep> lastGroup = groups.get(groups.size() - 1);
        if (lastGroup.size() < 2) {
            throw new CfiParseException(
                    REASON_RANGE_SUFFIX_WITHOUT_STEP,
                    "offset-only range suffix needs a parent group with at least two steps",
                    rangePosition
            );
        }
        CfiStep shared = lastGroup.get(lastGroup.size() - 1);
        List<List<CfiStep>> trimmed = new ArrayList<>(groups);
        trimmed.set(groups.size() - 1, lastGroup.subList(0, lastGroup.size() - 1));
        CfiPath newParent = new CfiPath(trimmed);
        return Cfi.range(newParent, rebase(shared, start), rebase(shared, end));
    }

    private static CfiPath rebase(CfiStep shared, ParsedPath suffix) {
        if (suffix.terminalOnly() != null) {
            return CfiPath.of(suffix.terminalOnly().applyTo(shared));
        }
        return CfiPath.of(shared).append(suffix.path());
    }

    /**
     * Parsed path, or a bare terminal for offset-only range suffixes.
     */
    private record ParsedPath(CfiPath path, Terminal terminalOnly) {
    }

    /**
     * Terminal data parsed after the last step.
     */
    private record Terminal(
            Integer offset,
            Double temporalOffset,
            Double spatialX,
            Double spatialY,
            List<String> textAssertion,
            SideBias sideBias
    ) {
        CfiStep applyTo(CfiStep step) {
            return step.toBuilder()
                    .offset(offset)
                    .temporalOffset(temporalOffset)
                    .spatialX(spatialX)
                    .spatialY(spatialY)
                    .textAssertion(textAssertion)
                    .sideBias(sideBias != null ? sideBias : step.getSideBias())
                    .build();
        }
    }

    /**
     * Bracketed assertion block content.
     */
    private record Assertion(List<String> values, SideBias sideBias) {
    }

    private static final class Scanner {
        private final String text;
        private int pos;
        private int limit;

        private Scanner(String text) {
            this.text = text;
            this.pos = 0;
            this.limit = text.length();
        }

        void unwrap() {
            if (text.startsWith(CfiFormatter.WRAPPER_PREFIX)) {
                if (!text.endsWith(CfiFormatter.WRAPPER_SUFFIX) || text.length() == CfiFormatter.WRAPPER_PREFIX.length()) {
                    throw new CfiParseException(
                            REASON_UNTERMINATED_WRAPPER,
                            "epubcfi( wrapper is not closed",
                            text.length()
                    );
                }
                pos = CfiFormatter.WRAPPER_PREFIX.length();
                limit = text.length() - 1;
            }
            if (atEnd()) {
                throw error(REASON_EMPTY_PATH, "CFI must contain at least one step");
            }
        }

        boolean atEnd() {
            return pos >= limit;
        }

        char peek() {
            return text.charAt(pos);
        }

        void advance() {
            pos++;
        }

        ParsedPath suffix() {
            if (atEnd() || peek() == ',') {
                throw error(REASON_INCOMPLETE_RANGE, "range suffix must not be empty");
            }
            return path(true);
        }

        ParsedPath path(boolean suffix) {
            List<List<CfiStep>> groups = new ArrayList<>();
            while (true) {
                int groupStart = pos;
                List<CfiStep> steps = new ArrayList<>();
                while (!atEnd() && peek() == '/') {
                    steps.add(step());
                }
                if (!atEnd() && isTerminalStart(peek())) {
                    Terminal terminal = terminal();
                    if (!atEnd() && peek() != ',') {
                        throw unexpected();
                    }
                    if (steps.isEmpty()) {
                        if (!suffix || !groups.isEmpty()) {
                            throw new CfiParseException(REASON_EMPTY_GROUP, "terminal data without a step", groupStart);
                        }
                        return new ParsedPath(null, terminal);
                    }
                    steps.set(steps.size() - 1, terminal.applyTo(steps.get(steps.size() - 1)));
                }
                if (steps.isEmpty()) {
                    if (!atEnd() && Character.isWhitespace(peek())) {
                        throw unexpected();
                    }
                    if (groups.isEmpty()) {
                        if (!atEnd() && peek() != '!' && peek() != ',') {
                            throw unexpected();
                        }
                        throw new CfiParseException(REASON_EMPTY_PATH, "CFI must start with a step", groupStart);
                    }
                    throw new CfiParseException(REASON_EMPTY_GROUP, "indirection must be followed by a step", groupStart);
                }
                groups.add(steps);
                if (!atEnd() && peek() == '!') {
                    advance();
                    continue;
                }
                return new ParsedPath(new CfiPath(groups), null);
            }
        }

        private CfiStep step() {
            advance();
            int index = integer();
            CfiStep.CfiStepBuilder builder = CfiStep.builder().index(index);
            if (!atEnd() && peek() == '[') {
                int open = pos;
                Assertion assertion = assertion(false);
                if (assertion.values().size() > 1) {
                    throw new CfiParseException(
                            REASON_INVALID_ASSERTION,
                            "step assertion takes a single identifier",
                            open
                    );
                }
                if (!assertion.values().isEmpty()) {
                    builder.idAssertion(assertion.values().get(0));
                }
                builder.sideBias(assertion.sideBias());
            }
            return builder.build();
        }

        private Terminal terminal() {
            Integer offset = null;
            Double temporal = null;
            Double spatialX = null;
            Double spatialY = null;
            if (peek() == ':') {
                advance();
                offset = integer();
            } else {
                if (peek() == '~') {
                    advance();
                    temporal = decimal();
                }
                if (!atEnd() && peek() == '@') {
                    advance();
                    spatialX = decimal();
                    if (atEnd() || peek() != ':') {
                        throw error(REASON_INVALID_NUMBER, "spatial offset requires x:y");
                    }
                    advance();
                    spatialY = decimal();
                }
            }
            List<String> text = null;
            SideBias bias = null;
            if (!atEnd() && peek() == '[') {
                Assertion assertion = assertion(true);
                text = assertion.values().isEmpty() ? null : assertion.values();
                bias = assertion.sideBias();
            }
            return new Terminal(offset, temporal, spatialX, spatialY, text, bias);
        }

        private Assertion assertion(boolean textual) {
            int open = pos;
            advance();
            List<String> values = new ArrayList<>(2);
            StringBuilder current = new StringBuilder();
            SideBias bias = null;
            while (true) {
                if (atEnd()) {
                    throw new CfiParseException(REASON_UNBALANCED_BRACKET, "assertion is not closed", open);
                }
                char c = peek();
                if (c == '^') {
                    current.append(escaped());
                } else if (c == ']') {
                    advance();
                    values.add(current.toString());
                    break;
                } else if (c == ',') {
                    if (!textual && values.size() > 0) {
                        throw error(REASON_INVALID_ASSERTION, "too many assertion values");
                    }
                    values.add(current.toString());
                    current.setLength(0);
                    advance();
                } else if (c == ';') {
                    values.add(current.toString());
                    bias = parameters();
                    break;
                } else if (c == '[') {
                    throw error(REASON_UNBALANCED_BRACKET, "nested assertion bracket");
                } else if (CfiFormatter.RESERVED.indexOf(c) >= 0) {
                    throw error(REASON_UNESCAPED_RESERVED, "reserved character '" + c + "' must be escaped with ^");
                } else if (!textual && Character.isWhitespace(c)) {
                    throw error(REASON_WHITESPACE, "whitespace is not allowed in an identifier assertion");
                } else {
                    current.append(c);
                    advance();
                }
            }
            if (values.size() == 1 && values.get(0).isEmpty()) {
                values.clear();
            }
            return new Assertion(List.copyOf(values), bias);
        }

        private SideBias parameters() {
            SideBias bias = null;
            while (true) {
                // positioned on ';'
                advance();
                int nameStart = pos;
                while (!atEnd() && peek() != '=' && peek() != ']' && peek() != ';') {
                    char c = peek();
                    if (!Character.isLetterOrDigit(c) && c != '-' && c != '_') {
                        throw unexpected();
                    }
                    advance();
                }
                if (atEnd()) {
                    throw new CfiParseException(REASON_UNBALANCED_BRACKET, "assertion is not closed", nameStart);
                }
                if (peek() != '=' || pos == nameStart) {
                    throw error(REASON_INVALID_ASSERTION, "assertion parameter must be name=value");
                }
                String name = text.substring(nameStart, pos);
                advance();
                int valueStart = pos;
                StringBuilder value = new StringBuilder();
                while (!atEnd() && peek() != ';' && peek() != ']') {
                    char c = peek();
                    if (c == '^') {
                        value.append(escaped());
                        continue;
                    }
                    if (CfiFormatter.RESERVED.indexOf(c) >= 0) {
                        throw error(REASON_UNESCAPED_RESERVED, "reserved character '" + c + "' must be escaped with ^");
                    }
                    if (Character.isWhitespace(c)) {
                        throw error(REASON_WHITESPACE, "whitespace is not allowed in an assertion parameter");
                    }
                    value.append(c);
                    advance();
                }
                if (atEnd()) {
                    throw new CfiParseException(REASON_UNBALANCED_BRACKET, "assertion is not closed", nameStart);
                }
                if (SIDE_BIAS_PARAMETER.equals(name)) {
                    bias = SideBias.fromToken(value.toString());
                    if (bias == null) {
                        throw new CfiParseException(REASON_INVALID_SIDE_BIAS, "side bias must be 'a' or 'b'", valueStart);
                    }
                }
                if (peek() == ']') {
                    advance();
                    return bias;
                }
            }
        }

        private char escaped() {
            advance();
            if (atEnd()) {
                throw error(REASON_INVALID_ESCAPE, "escape character ^ must be followed by a character");
            }
            char c = peek();
            advance();
            return c;
        }

        private int integer() {
            if (atEnd()) {
                throw error(REASON_MISSING_INDEX, "expected a non-negative integer");
            }
            char first = peek();
            if (first == '-') {
                throw error(REASON_NEGATIVE_INDEX, "integers must be non-negative");
            }
            if (!isDigit(first)) {
                if (Character.isWhitespace(first)) {
                    throw error(REASON_WHITESPACE, "whitespace is not allowed");
                }
                throw error(REASON_INVALID_NUMBER, "expected a digit but found '" + first + "'");
            }
            int start = pos;
            long value = 0L;
            while (!atEnd() && isDigit(peek())) {
                value = value * 10L + (peek() - '0');
                if (value > Integer.MAX_VALUE) {
                    throw new CfiParseException(REASON_INVALID_NUMBER, "integer is out of range", start);
                }
                advance();
            }
            return (int) value;
        }

        private double decimal() {
            if (atEnd() || !isDigit(peek())) {
                if (!atEnd() && peek() == '-') {
                    throw error(REASON_NEGATIVE_INDEX, "numbers must be non-negative");
                }
                throw error(REASON_INVALID_NUMBER, "expected a number");
            }
            int start = pos;
            while (!atEnd() && isDigit(peek())) {
                advance();
            }
            if (!atEnd() && peek() == '.') {
                advance();
                if (atEnd() || !isDigit(peek())) {
                    throw error(REASON_INVALID_NUMBER, "expected digits after decimal point");
                }
                while (!atEnd() && isDigit(peek())) {
                    advance();
                }
            }
            return Double.parseDouble(text.substring(start, pos));
        }

        CfiParseException unexpected() {
            if (atEnd()) {
                return error(REASON_UNEXPECTED_CHARACTER, "unexpected end of input");
            }
            char c = peek();
            if (Character.isWhitespace(c)) {
                return error(REASON_WHITESPACE, "whitespace is not allowed");
            }
            if (c == ']') {
                return error(REASON_UNBALANCED_BRACKET, "unmatched ]");
            }
            return error(REASON_UNEXPECTED_CHARACTER, "unexpected character '" + c + "'");
        }

        CfiParseException error(String reasonCode, String message) {
            return new CfiParseException(reasonCode, message, pos);
        }

        private static boolean isTerminalStart(char c) {
            return c == ':' || c == '~' || c == '@';
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }
    }
}

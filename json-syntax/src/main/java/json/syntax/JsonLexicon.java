package json.syntax;

import java.math.BigInteger;

/// Character classes and literal decoding shared by the tokenizer and parser.
final class JsonLexicon {

    static final String TRUE = "true";
    static final String FALSE = "false";
    static final String NULL = "null";
    static final String INFINITY = "Infinity";
    static final String NAN = "NaN";

    private static final char LINE_SEPARATOR = '\u2028';
    private static final char PARAGRAPH_SEPARATOR = '\u2029';
    private static final char ZWNJ = '\u200C';
    private static final char ZWJ = '\u200D';

    static boolean isWhitespace(char c, boolean json5) {
        if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
            return true;
        }
        if (!json5) {
            return false;
        }
        return c == '\u000B'
                || c == '\f'
                || c == '\u00A0'
                || c == '\uFEFF'
                || c == LINE_SEPARATOR
                || c == PARAGRAPH_SEPARATOR
                || Character.getType(c) == Character.SPACE_SEPARATOR;
    }

    /// Line terminators that end a line comment and advance the line count.
    static boolean isLineTerminator(char c, boolean json5) {
        return c == '\n' || c == '\r' || (json5 && (c == LINE_SEPARATOR || c == PARAGRAPH_SEPARATOR));
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    static boolean isPunctuator(char c) {
        return c == '{' || c == '}' || c == '[' || c == ']' || c == ':' || c == ',';
    }

    /// ECMAScript IdentifierStart, excluding the `\` escape form.
    static boolean isIdentifierStart(int codePoint) {
        if (codePoint == '$' || codePoint == '_') {
            return true;
        }
        if (Character.isLetter(codePoint)) {
            return true;
        }
        return Character.getType(codePoint) == Character.LETTER_NUMBER;
    }

    /// ECMAScript IdentifierPart, excluding the `\` escape form.
    static boolean isIdentifierPart(int codePoint) {
        if (isIdentifierStart(codePoint) || codePoint == ZWNJ || codePoint == ZWJ) {
            return true;
        }
        return switch (Character.getType(codePoint)) {
            case Character.NON_SPACING_MARK,
                    Character.COMBINING_SPACING_MARK,
                    Character.DECIMAL_DIGIT_NUMBER,
                    Character.CONNECTOR_PUNCTUATION -> true;
            default -> false;
        };
    }

    /// Decodes the raw text of a string token, quotes included.
    /// The token has already been validated by the tokenizer, so every escape is well formed
    /// and the JSON5-only escapes appear only in JSON5 sources.
    static String decodeString(String raw) {
        final int end = raw.length() - 1;
        if (raw.indexOf('\\') < 0) {
            return raw.substring(1, end);
        }

        final var sb = new StringBuilder(end);
        int i = 1;
        while (i < end) {
            final char c = raw.charAt(i++);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            final char e = raw.charAt(i++);
            switch (e) {
                case '"', '\\', '/' -> sb.append(e);
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'u' -> {
                    sb.append((char) Integer.parseInt(raw, i, i + 4, 16));
                    i += 4;
                }
                default -> {
                    // only JSON5 reaches here
                    switch (e) {
                        case 'v' -> sb.append('\u000B');
                        case '0' -> sb.append('\0');
                        case 'x' -> {
                            sb.append((char) Integer.parseInt(raw, i, i + 2, 16));
                            i += 2;
                        }
                        case '\r' -> {
                            // escaped CRLF is a single line continuation
                            if (i < end && raw.charAt(i) == '\n') {
                                i++;
                            }
                        }
                        case '\n', LINE_SEPARATOR, PARAGRAPH_SEPARATOR -> {
                            // line continuation
                        }
                        default -> sb.append(e);
                    }
                }
            }
        }
        return sb.toString();
    }

    /// Decodes the raw text of a number token.
    static double decodeNumber(String raw) {
        final char first = raw.charAt(0);
        final boolean signed = first == '-' || first == '+';
        final boolean negative = first == '-';
        final String unsigned = signed ? raw.substring(1) : raw;

        if (unsigned.equals(INFINITY)) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (unsigned.equals(NAN)) {
            return Double.NaN;
        }
        if (unsigned.length() > 2 && unsigned.charAt(0) == '0'
                && (unsigned.charAt(1) == 'x' || unsigned.charAt(1) == 'X')) {
            final double magnitude = new BigInteger(unsigned.substring(2), 16).doubleValue();
            return negative ? -magnitude : magnitude;
        }
        return Double.parseDouble(raw);
    }

    private JsonLexicon() {}
}

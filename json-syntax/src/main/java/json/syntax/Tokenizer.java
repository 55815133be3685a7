package json.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Cursor over the tokens of a JSON, JSONC or JSON5 source text.
///
/// Each call to [#advance()] scans the next token and makes it [#current()].
/// Whitespace separates tokens and is never reported; comments are reported as
/// [TokenType#LINE_COMMENT] and [TokenType#BLOCK_COMMENT] tokens. A cursor is
/// consumed once: it cannot be rewound, and scanning stops at the first
/// malformed lexeme with a [JsonLexicalException].
public final class Tokenizer {

    private static final Logger LOG = Logger.getLogger(Tokenizer.class.getName());

    private final String text;
    private final Mode mode;
    private final boolean json5;

    private int offset;
    private int line = 1;
    private int lineStart;
    private Token current;

    /// Creates a cursor positioned before the first token of `text`.
    /// @throws NullPointerException if either argument is null
    public Tokenizer(String text, Mode mode) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.json5 = mode.isJson5();
    }

    /// Scans every token of `text`.
    /// @return the tokens in source order
    /// @throws JsonLexicalException at the first malformed lexeme
    public static List<Token> tokenize(String text, Mode mode) {
        final var tokenizer = new Tokenizer(text, mode);
        final var tokens = new ArrayList<Token>();
        while (tokenizer.advance()) {
            tokens.add(tokenizer.current());
        }
        LOG.fine(() -> "Tokenized " + tokens.size() + " tokens in " + mode.modeName() + " mode");
        return tokens;
    }

    /// Scans the next token.
    /// @return true if a token was scanned, false at the end of the input
    /// @throws JsonLexicalException if the next lexeme is malformed
    public boolean advance() {
        skipWhitespace();
        if (offset >= text.length()) {
            current = null;
            return false;
        }
        current = scanToken();
        LOG.finest(() -> "Token " + current.type().label() + " " + current.value());
        return true;
    }

    /// {@return the most recently scanned token, or null before the first and after the last}
    public Token current() {
        return current;
    }

    /// {@return the position of the next unread character}
    public Position position() {
        return new Position(line, offset - lineStart, offset);
    }

    public Mode mode() {
        return mode;
    }

    private Token scanToken() {
        final Position start = position();
        final char c = text.charAt(offset);

        if (JsonLexicon.isPunctuator(c)) {
            consume();
            return token(TokenType.PUNCTUATOR, start);
        }
        if (c == '"' || (json5 && c == '\'')) {
            readString(c);
            return token(TokenType.STRING, start);
        }
        if (c == '/' && mode.allowsComments()) {
            return readComment(start);
        }
        if (json5) {
            if (c == '\\' || JsonLexicon.isIdentifierStart(text.codePointAt(offset))) {
                readIdentifier();
                return token(classifyWord(text.substring(start.offset(), offset)), start);
            }
            if (JsonLexicon.isDigit(c) || c == '-' || c == '+' || c == '.') {
                readNumber();
                return token(TokenType.NUMBER, start);
            }
        } else {
            if (c == 't' || c == 'f' || c == 'n') {
                return readKeyword(start, c);
            }
            if (JsonLexicon.isDigit(c) || c == '-') {
                readNumber();
                return token(TokenType.NUMBER, start);
            }
        }
        throw unexpected();
    }

    private Token token(TokenType type, Position start) {
        final String value = text.substring(start.offset(), offset);
        return new Token(type, value, new Range(start.offset(), offset), new Location(start, position()));
    }

    // ========== Character handling ==========

    private boolean atEnd() {
        return offset >= text.length();
    }

    private char peek() {
        return offset < text.length() ? text.charAt(offset) : '\0';
    }

    /// Consumes one UTF-16 unit, tracking line starts.
    private void consume() {
        final char c = text.charAt(offset++);
        if (c == '\n') {
            newLine();
        } else if (c == '\r') {
            // CRLF counts once, on the LF
            if (peek() != '\n') {
                newLine();
            }
        } else if (json5 && JsonLexicon.isLineTerminator(c, true)) {
            newLine();
        }
    }

    private void consumeCodePoint() {
        final int cp = text.codePointAt(offset);
        if (Character.isSupplementaryCodePoint(cp)) {
            offset += 2;
        } else {
            consume();
        }
    }

    private void newLine() {
        line++;
        lineStart = offset;
    }

    private void skipWhitespace() {
        while (!atEnd() && JsonLexicon.isWhitespace(text.charAt(offset), json5)) {
            consume();
        }
    }

    private void expect(char expected) {
        if (atEnd() || peek() != expected) {
            throw unexpected();
        }
        consume();
    }

    private void readHexDigits(int count) {
        for (int i = 0; i < count; i++) {
            if (atEnd() || !JsonLexicon.isHexDigit(peek())) {
                throw unexpected();
            }
            consume();
        }
    }

    // ========== Lexemes ==========

    private Token readKeyword(Position start, char first) {
        final String keyword = switch (first) {
            case 't' -> JsonLexicon.TRUE;
            case 'f' -> JsonLexicon.FALSE;
            default -> JsonLexicon.NULL;
        };
        for (int i = 0; i < keyword.length(); i++) {
            expect(keyword.charAt(i));
        }
        return token(first == 'n' ? TokenType.NULL : TokenType.BOOLEAN, start);
    }

    private void readIdentifier() {
        boolean first = true;
        while (!atEnd()) {
            final char c = peek();
            if (c == '\\') {
                consume();
                expect('u');
                readHexDigits(4);
            } else {
                final int cp = text.codePointAt(offset);
                final boolean accepted = first ? JsonLexicon.isIdentifierStart(cp) : JsonLexicon.isIdentifierPart(cp);
                if (!accepted) {
                    break;
                }
                consumeCodePoint();
            }
            first = false;
        }
    }

    private static TokenType classifyWord(String word) {
        return switch (word) {
            case JsonLexicon.TRUE, JsonLexicon.FALSE -> TokenType.BOOLEAN;
            case JsonLexicon.NULL -> TokenType.NULL;
            case JsonLexicon.INFINITY, JsonLexicon.NAN -> TokenType.NUMBER;
            default -> TokenType.IDENTIFIER;
        };
    }

    private void readNumber() {
        if (peek() == '-' || (json5 && peek() == '+')) {
            consume();
            if (json5 && (text.startsWith(JsonLexicon.INFINITY, offset) || text.startsWith(JsonLexicon.NAN, offset))) {
                final int length = peek() == 'I' ? JsonLexicon.INFINITY.length() : JsonLexicon.NAN.length();
                for (int i = 0; i < length; i++) {
                    consume();
                }
                return;
            }
        }

        boolean integerDigits = false;
        if (peek() == '0' && !atEnd()) {
            consume();
            integerDigits = true;
            if (json5 && (peek() == 'x' || peek() == 'X')) {
                consume();
                readHexDigits(1);
                while (!atEnd() && JsonLexicon.isHexDigit(peek())) {
                    consume();
                }
                return;
            }
            if (!atEnd() && JsonLexicon.isDigit(peek())) {
                throw unexpected();
            }
        } else if (!atEnd() && JsonLexicon.isDigit(peek())) {
            while (!atEnd() && JsonLexicon.isDigit(peek())) {
                consume();
            }
            integerDigits = true;
        } else if (!(json5 && peek() == '.')) {
            throw unexpected();
        }

        if (!atEnd() && peek() == '.') {
            consume();
            int fractionDigits = 0;
            while (!atEnd() && JsonLexicon.isDigit(peek())) {
                consume();
                fractionDigits++;
            }
            // JSON needs digits after the point; JSON5 needs digits on at least one side
            if (fractionDigits == 0 && (!json5 || !integerDigits)) {
                throw unexpected();
            }
        }

        if (!atEnd() && (peek() == 'e' || peek() == 'E')) {
            consume();
            if (!atEnd() && (peek() == '+' || peek() == '-')) {
                consume();
            }
            if (atEnd() || !JsonLexicon.isDigit(peek())) {
                throw unexpected();
            }
            while (!atEnd() && JsonLexicon.isDigit(peek())) {
                consume();
            }
        }
    }

    private void readString(char delimiter) {
        consume();
        while (true) {
            if (atEnd()) {
                throw unexpected();
            }
            final char c = peek();
            if (c == delimiter) {
                consume();
                return;
            }
            if (c == '\\') {
                consume();
                readEscape();
            } else if (c < 0x20 && (!json5 || c == '\n' || c == '\r')) {
                throw unexpected();
            } else {
                consume();
            }
        }
    }

    private void readEscape() {
        if (atEnd()) {
            throw unexpected();
        }
        final char c = peek();
        switch (c) {
            case '"', '\\', '/', 'b', 'f', 'n', 'r', 't' -> consume();
            case 'u' -> {
                consume();
                readHexDigits(4);
            }
            default -> {
                if (!json5 || (c >= '1' && c <= '9')) {
                    throw unexpected();
                }
                if (c == 'x') {
                    consume();
                    readHexDigits(2);
                } else if (c == '\r') {
                    consume();
                    if (!atEnd() && peek() == '\n') {
                        consume();
                    }
                } else {
                    // \' \v \0, line continuations and identity escapes
                    consumeCodePoint();
                }
            }
        }
    }

    private Token readComment(Position start) {
        consume();
        if (atEnd()) {
            throw unexpected();
        }
        if (peek() == '/') {
            while (!atEnd() && !JsonLexicon.isLineTerminator(peek(), json5)) {
                consume();
            }
            return token(TokenType.LINE_COMMENT, start);
        }
        if (peek() != '*') {
            throw unexpected();
        }
        consume();
        while (true) {
            if (atEnd()) {
                throw unexpected();
            }
            if (peek() == '*' && offset + 1 < text.length() && text.charAt(offset + 1) == '/') {
                consume();
                consume();
                return token(TokenType.BLOCK_COMMENT, start);
            }
            consume();
        }
    }

    // ========== Errors ==========

    /// Builds the error for the character at the cursor, or for the end of input.
    private JsonLexicalException unexpected() {
        final Position at = position();
        if (atEnd()) {
            LOG.fine(() -> "Unexpected end of input at offset " + at.offset());
            return new JsonLexicalException("Unexpected end of input found.", at);
        }
        final String found = new String(Character.toChars(text.codePointAt(offset)));
        LOG.fine(() -> "Unexpected character '" + found + "' at offset " + at.offset());
        return new JsonLexicalException("Unexpected character '" + found + "' found.", at);
    }
}

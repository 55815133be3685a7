package json.syntax;

import java.util.Objects;

/// A classified lexeme.
/// @param type the token classification
/// @param value the raw source text of the lexeme, quotes and comment markers included
/// @param range offsets of the lexeme in the source
/// @param loc line and column of the lexeme in the source
public record Token(TokenType type, String value, Range range, Location loc) {
    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(loc, "loc must not be null");
    }

    /// {@return true if this is the punctuator `c`}
    public boolean isPunctuator(char c) {
        return type == TokenType.PUNCTUATOR && value.length() == 1 && value.charAt(0) == c;
    }
}

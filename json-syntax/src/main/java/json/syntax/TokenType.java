package json.syntax;

/// Classification of a lexeme produced by the tokenizer.
public enum TokenType {
    STRING("String"),
    NUMBER("Number"),
    BOOLEAN("Boolean"),
    NULL("Null"),
    /// One of `{ } [ ] : ,`
    PUNCTUATOR("Punctuator"),
    /// JSON5 unquoted member name
    IDENTIFIER("Identifier"),
    LINE_COMMENT("LineComment"),
    BLOCK_COMMENT("BlockComment");

    private final String label;

    TokenType(String label) {
        this.label = label;
    }

    /// {@return the type name used in messages and in exported token shapes}
    public String label() {
        return label;
    }

    public boolean isComment() {
        return this == LINE_COMMENT || this == BLOCK_COMMENT;
    }
}

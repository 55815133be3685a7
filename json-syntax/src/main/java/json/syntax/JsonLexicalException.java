package json.syntax;

/// Exception thrown by the tokenizer for an unexpected character or a premature
/// end of input. It is a [JsonSyntaxException] so that callers of
/// [JsonSyntax#parse(String)] can handle every read failure in one place.
public class JsonLexicalException extends JsonSyntaxException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    public JsonLexicalException(String message, Position position) {
        super(message, position);
    }
}

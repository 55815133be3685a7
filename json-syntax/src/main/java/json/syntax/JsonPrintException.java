package json.syntax;

/// Exception thrown when a node cannot be represented as JSON text,
/// for example a JSON5 `Infinity` or `NaN` number.
public class JsonPrintException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    public JsonPrintException(String message) {
        super(message);
    }
}

package json.syntax;

import java.util.Objects;

/// Exception thrown when text cannot be read as a document of the requested dialect.
/// Carries the position of the first offending token or character; the message
/// is suffixed with `(line:column)`.
public class JsonSyntaxException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;
    private final int offset;

    /// Creates a new exception positioned at `position`.
    /// @param message the error message, without location
    /// @param position where the error occurred
    public JsonSyntaxException(String message, Position position) {
        super(formatMessage(message, Objects.requireNonNull(position, "position must not be null")));
        this.line = position.line();
        this.column = position.column();
        this.offset = position.offset();
    }

    /// Returns the 1-based line on which the error occurred.
    public int line() {
        return line;
    }

    /// Returns the 0-based column on which the error occurred.
    public int column() {
        return column;
    }

    /// Returns the index into the source text where the error occurred.
    public int offset() {
        return offset;
    }

    public Position position() {
        return new Position(line, column, offset);
    }

    private static String formatMessage(String message, Position position) {
        return message + " (" + position.line() + ":" + position.column() + ")";
    }
}

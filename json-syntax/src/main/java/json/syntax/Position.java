package json.syntax;

/// A point in the source text.
/// @param line 1-based line number
/// @param column 0-based column within the line
/// @param offset 0-based UTF-16 index into the source text
public record Position(int line, int column, int offset) {
    public Position {
        if (line < 1) {
            throw new IllegalArgumentException("line must be positive: " + line);
        }
        if (column < 0 || offset < 0) {
            throw new IllegalArgumentException("column and offset must not be negative");
        }
    }
}

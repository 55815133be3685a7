package json.syntax;

import java.util.Objects;

/// Start and end positions of a token or node. The end position is exclusive.
public record Location(Position start, Position end) {
    public Location {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
    }
}

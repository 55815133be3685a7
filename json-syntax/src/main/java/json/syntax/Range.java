package json.syntax;

/// Half-open `[start, end)` offset interval into the source text.
public record Range(int start, int end) {
    public Range {
        if (start < 0 || start > end) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
    }

    /// {@return true if `other` lies entirely within this range}
    public boolean contains(Range other) {
        return start <= other.start && other.end <= end;
    }
}

package json.syntax;

import java.util.Objects;

/// Options for [JsonSyntax#parse(String, ParseOptions)].
/// @param mode the dialect to read
/// @param ranges attach `range` and `loc` to every node
/// @param tokens attach every token, comments included, to the document node
/// @param allowTrailingCommas accept a trailing comma in objects and arrays in every mode, not only JSON5
public record ParseOptions(Mode mode, boolean ranges, boolean tokens, boolean allowTrailingCommas) {

    private static final ParseOptions DEFAULTS = new ParseOptions(Mode.JSON, false, false, false);

    public ParseOptions {
        Objects.requireNonNull(mode, "mode must not be null");
    }

    /// {@return strict JSON, no ranges, no tokens}
    public static ParseOptions defaults() {
        return DEFAULTS;
    }

    /// {@return the default options in the given dialect}
    public static ParseOptions of(Mode mode) {
        return DEFAULTS.withMode(mode);
    }

    public ParseOptions withMode(Mode mode) {
        return new ParseOptions(mode, ranges, tokens, allowTrailingCommas);
    }

    public ParseOptions withRanges(boolean ranges) {
        return new ParseOptions(mode, ranges, tokens, allowTrailingCommas);
    }

    public ParseOptions withTokens(boolean tokens) {
        return new ParseOptions(mode, ranges, tokens, allowTrailingCommas);
    }

    public ParseOptions withAllowTrailingCommas(boolean allowTrailingCommas) {
        return new ParseOptions(mode, ranges, tokens, allowTrailingCommas);
    }

    /// {@return true if a comma may directly precede a closing bracket or brace}
    boolean trailingCommas() {
        return allowTrailingCommas || mode.isJson5();
    }
}

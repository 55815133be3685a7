package json.syntax;

import java.util.Locale;
import java.util.Objects;

/// The JSON dialect a document is read in.
///
/// Each dialect is a strict superset of the previous one:
/// - `JSON`: RFC 8259 only
/// - `JSONC`: JSON plus `//` line comments and `/* */` block comments
/// - `JSON5`: JSONC plus unquoted keys, single-quoted strings, trailing commas
///   and the extended numeric literals of JSON5
public enum Mode {
    JSON("json"),
    JSONC("jsonc"),
    JSON5("json5");

    private final String modeName;

    Mode(String modeName) {
        this.modeName = modeName;
    }

    /// {@return the lowercase name used for this dialect, e.g. `jsonc`}
    public String modeName() {
        return modeName;
    }

    /// {@return true if comment tokens are recognized in this dialect}
    public boolean allowsComments() {
        return this != JSON;
    }

    /// {@return true if this is the JSON5 dialect}
    public boolean isJson5() {
        return this == JSON5;
    }

    /// Looks up a dialect by its lowercase name.
    /// @param name one of `json`, `jsonc`, `json5`, case insensitive
    /// @return the matching mode
    /// @throws IllegalArgumentException if the name is not a known dialect
    public static Mode fromName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        final var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Mode mode : values()) {
            if (mode.modeName.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown mode: " + name);
    }
}

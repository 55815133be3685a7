package json.syntax;

import json.syntax.JsonNode.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Renders a syntax tree as strict JSON text, matching `JSON.stringify(value, null, indent)`.
///
/// - keys are always double quoted, whether written as strings or identifiers
/// - members keep their sequence order; a repeated name is printed once, at its first
///   position, with its last value
/// - empty objects and arrays print as `{}` and `[]` at every indent
/// - with an indent, each member or element takes its own line, `:` is followed
///   by one space, and there is no trailing newline
final class JsonPrinter {

    private static final Logger LOG = Logger.getLogger(JsonPrinter.class.getName());

    /// `JSON.stringify` caps its indent at ten spaces.
    static final int MAX_INDENT = 10;

    private final String gap;

    private JsonPrinter(String gap) {
        this.gap = gap;
    }

    /// Prints `node` and its descendants.
    /// @param indent spaces per nesting level, 0 for compact output
    /// @throws NullPointerException if `node` is null
    /// @throws IllegalArgumentException if `indent` is negative
    /// @throws JsonPrintException if the tree holds a non-finite number, or `node` is a bare member
    static String print(JsonNode node, int indent) {
        Objects.requireNonNull(node, "node must not be null");
        if (indent < 0) {
            throw new IllegalArgumentException("indent is negative");
        }
        LOG.fine(() -> "Printing " + node.type().label() + " with indent " + indent);
        return new JsonPrinter(" ".repeat(Math.min(indent, MAX_INDENT))).render(node, "");
    }

    private String render(JsonNode node, String indentation) {
        return switch (node.type()) {
            case DOCUMENT -> render(((DocumentNode) node).body(), indentation);
            case OBJECT -> renderObject((ObjectNode) node, indentation);
            case MEMBER -> throw new JsonPrintException("Cannot print a Member outside of an Object.");
            case ARRAY -> renderArray((ArrayNode) node, indentation);
            case STRING -> quote(((StringNode) node).value());
            case NUMBER -> renderNumber(((NumberNode) node).value());
            case BOOLEAN -> String.valueOf(((BooleanNode) node).value());
            case NULL -> "null";
            case IDENTIFIER -> quote(((IdentifierNode) node).name());
        };
    }

    private String renderObject(ObjectNode object, String indentation) {
        if (object.members().isEmpty()) {
            return "{}";
        }
        // a repeated name keeps its first position and takes the last value
        final Map<String, ValueNode> members = new LinkedHashMap<>();
        for (MemberNode member : object.members()) {
            members.put(memberName(member.name()), member.value());
        }

        final String inner = indentation + gap;
        final var sb = new StringBuilder("{");
        String separator = "";
        for (Map.Entry<String, ValueNode> member : members.entrySet()) {
            sb.append(separator);
            newLine(sb, inner);
            sb.append(quote(member.getKey()))
                    .append(gap.isEmpty() ? ":" : ": ")
                    .append(render(member.getValue(), inner));
            separator = ",";
        }
        newLine(sb, indentation);
        return sb.append('}').toString();
    }

    private String renderArray(ArrayNode array, String indentation) {
        if (array.elements().isEmpty()) {
            return "[]";
        }
        final String inner = indentation + gap;
        final var sb = new StringBuilder("[");
        String separator = "";
        for (ValueNode element : array.elements()) {
            sb.append(separator);
            newLine(sb, inner);
            sb.append(render(element, inner));
            separator = ",";
        }
        newLine(sb, indentation);
        return sb.append(']').toString();
    }

    private void newLine(StringBuilder sb, String indentation) {
        if (!gap.isEmpty()) {
            sb.append('\n').append(indentation);
        }
    }

    private static String memberName(MemberName name) {
        return name instanceof StringNode string ? string.value() : ((IdentifierNode) name).name();
    }

    private static String renderNumber(double value) {
        if (!Double.isFinite(value)) {
            throw new JsonPrintException("Cannot print non-finite number " + value + " as JSON.");
        }
        return EcmaNumberFormat.format(value);
    }

    /// Quotes a string as `JSON.stringify` does, escaping unpaired surrogates.
    static String quote(String value) {
        final var sb = new StringBuilder(value.length() + 2).append('"');
        final int length = value.length();
        for (int i = 0; i < length; i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        appendUnicodeEscape(sb, c);
                    } else if (Character.isHighSurrogate(c)) {
                        if (i + 1 < length && Character.isLowSurrogate(value.charAt(i + 1))) {
                            sb.append(c).append(value.charAt(++i));
                        } else {
                            appendUnicodeEscape(sb, c);
                        }
                    } else if (Character.isLowSurrogate(c)) {
                        appendUnicodeEscape(sb, c);
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private static void appendUnicodeEscape(StringBuilder sb, char c) {
        sb.append("\\u");
        final String hex = Integer.toHexString(c);
        sb.append("0".repeat(4 - hex.length())).append(hex);
    }
}

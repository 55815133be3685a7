package json.syntax;

import json.syntax.JsonNode.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static json.syntax.JsonNodes.*;

/// Describes a syntax tree as a JSON object tree, in the serialization-facing shape
/// `{"type": ..., fields..., "range"?: [start, end], "loc"?: {"start": {...}, "end": {...}}}`.
///
/// The result is itself a syntax tree, so it can be printed with [JsonPrinter].
/// Non-finite numbers are described as the strings `"Infinity"`, `"-Infinity"` and `"NaN"`.
final class NodeShapes {

    static ObjectNode toShape(JsonNode node) {
        Objects.requireNonNull(node, "node must not be null");
        final List<MemberNode> fields = new ArrayList<>();
        fields.add(member("type", string(node.type().label())));

        switch (node.type()) {
            case DOCUMENT -> {
                final var document = (DocumentNode) node;
                fields.add(member("body", toShape(document.body())));
                if (document.tokens() != null) {
                    fields.add(member("tokens", array(document.tokens().stream().map(NodeShapes::tokenShape).toList())));
                }
            }
            case OBJECT -> fields.add(member("members",
                    array(((ObjectNode) node).members().stream().map(NodeShapes::toShape).toList())));
            case MEMBER -> {
                final var member = (MemberNode) node;
                fields.add(member("name", toShape(member.name())));
                fields.add(member("value", toShape(member.value())));
            }
            case ARRAY -> fields.add(member("elements",
                    array(((ArrayNode) node).elements().stream().map(NodeShapes::toShape).toList())));
            case STRING -> fields.add(member("value", string(((StringNode) node).value())));
            case NUMBER -> fields.add(member("value", numberShape(((NumberNode) node).value())));
            case BOOLEAN -> fields.add(member("value", bool(((BooleanNode) node).value())));
            case NULL -> {
                // no payload
            }
            case IDENTIFIER -> fields.add(member("name", string(((IdentifierNode) node).name())));
        }

        addLocation(fields, node.range(), node.loc());
        return object(fields);
    }

    private static ObjectNode tokenShape(Token token) {
        final List<MemberNode> fields = new ArrayList<>();
        fields.add(member("type", string(token.type().label())));
        fields.add(member("value", string(token.value())));
        addLocation(fields, token.range(), token.loc());
        return object(fields);
    }

    private static ValueNode numberShape(double value) {
        if (Double.isNaN(value)) {
            return string(JsonLexicon.NAN);
        }
        if (Double.isInfinite(value)) {
            return string(value > 0 ? JsonLexicon.INFINITY : "-" + JsonLexicon.INFINITY);
        }
        return number(value);
    }

    private static void addLocation(List<MemberNode> fields, Range range, Location loc) {
        if (range != null) {
            fields.add(member("range", array(number(range.start()), number(range.end()))));
        }
        if (loc != null) {
            fields.add(member("loc", object(
                    member("start", positionShape(loc.start())),
                    member("end", positionShape(loc.end())))));
        }
    }

    private static ObjectNode positionShape(Position position) {
        return object(
                member("line", number(position.line())),
                member("column", number(position.column())),
                member("offset", number(position.offset())));
    }

    private NodeShapes() {}
}

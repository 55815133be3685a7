package json.syntax;

import json.syntax.JsonNode.*;

import java.util.List;

/// Factory methods for building syntax trees by hand, without source locations.
///
/// ```java
/// DocumentNode doc = JsonNodes.document(JsonNodes.object(
///         JsonNodes.member("name", JsonNodes.string("Alice")),
///         JsonNodes.member("tags", JsonNodes.array(JsonNodes.string("a"), JsonNodes.number(1)))));
/// JsonSyntax.print(doc); // {"name":"Alice","tags":["a",1]}
/// ```
public final class JsonNodes {

    public static DocumentNode document(ValueNode body) {
        return new DocumentNode(body, null, null, null);
    }

    public static ObjectNode object(MemberNode... members) {
        return new ObjectNode(List.of(members), null, null);
    }

    public static ObjectNode object(List<MemberNode> members) {
        return new ObjectNode(members, null, null);
    }

    public static MemberNode member(MemberName name, ValueNode value) {
        return new MemberNode(name, value, null, null);
    }

    /// {@return a member named by a string key}
    public static MemberNode member(String name, ValueNode value) {
        return new MemberNode(string(name), value, null, null);
    }

    public static ArrayNode array(ValueNode... elements) {
        return new ArrayNode(List.of(elements), null, null);
    }

    public static ArrayNode array(List<? extends ValueNode> elements) {
        return new ArrayNode(List.copyOf(elements), null, null);
    }

    public static StringNode string(String value) {
        return new StringNode(value, null, null);
    }

    public static NumberNode number(double value) {
        return new NumberNode(value, null, null);
    }

    public static BooleanNode bool(boolean value) {
        return new BooleanNode(value, null, null);
    }

    public static NullNode nul() {
        return new NullNode(null, null);
    }

    public static IdentifierNode identifier(String name) {
        return new IdentifierNode(name, null, null);
    }

    private JsonNodes() {}
}

package json.syntax;

import java.util.function.BiConsumer;

/// Callbacks for [JsonSyntax#traverse(JsonNode, TraversalVisitor)].
/// Both callbacks receive the visited node and its parent, which is null for
/// the root. Either callback may be null.
/// @param enter called before a node's children are visited
/// @param exit called after a node's children are visited
public record TraversalVisitor(BiConsumer<JsonNode, JsonNode> enter, BiConsumer<JsonNode, JsonNode> exit) {

    public static TraversalVisitor of(BiConsumer<JsonNode, JsonNode> enter, BiConsumer<JsonNode, JsonNode> exit) {
        return new TraversalVisitor(enter, exit);
    }

    public static TraversalVisitor onEnter(BiConsumer<JsonNode, JsonNode> enter) {
        return new TraversalVisitor(enter, null);
    }

    public static TraversalVisitor onExit(BiConsumer<JsonNode, JsonNode> exit) {
        return new TraversalVisitor(null, exit);
    }
}

package json.syntax;

import java.util.List;

/// A child-bearing property of a [JsonNode].
public enum VisitorKey {
    BODY("body"),
    MEMBERS("members"),
    NAME("name"),
    VALUE("value"),
    ELEMENTS("elements");

    private final String propertyName;

    VisitorKey(String propertyName) {
        this.propertyName = propertyName;
    }

    public String propertyName() {
        return propertyName;
    }

    /// Reads this property from `node`. Single-valued properties yield a one-element list.
    /// @throws IllegalArgumentException if `node` has no such property
    public List<? extends JsonNode> children(JsonNode node) {
        if (!node.type().visitorKeys().contains(this)) {
            throw new IllegalArgumentException(node.type().label() + " has no property '" + propertyName + "'");
        }
        return switch (this) {
            case BODY -> List.of(((JsonNode.DocumentNode) node).body());
            case MEMBERS -> ((JsonNode.ObjectNode) node).members();
            case NAME -> List.of(((JsonNode.MemberNode) node).name());
            case VALUE -> List.of(((JsonNode.MemberNode) node).value());
            case ELEMENTS -> ((JsonNode.ArrayNode) node).elements();
        };
    }
}

package json.syntax;

import java.util.List;

/// Type tags of [JsonNode] together with the visitor-key table: the ordered
/// child-bearing properties that fix the order of a traversal.
public enum NodeType {
    DOCUMENT("Document", VisitorKey.BODY),
    OBJECT("Object", VisitorKey.MEMBERS),
    MEMBER("Member", VisitorKey.NAME, VisitorKey.VALUE),
    ARRAY("Array", VisitorKey.ELEMENTS),
    STRING("String"),
    NUMBER("Number"),
    BOOLEAN("Boolean"),
    NULL("Null"),
    IDENTIFIER("Identifier");

    private final String label;
    private final List<VisitorKey> visitorKeys;

    NodeType(String label, VisitorKey... visitorKeys) {
        this.label = label;
        this.visitorKeys = List.of(visitorKeys);
    }

    /// {@return the `type` value of this node in its exported JSON shape}
    public String label() {
        return label;
    }

    /// {@return the child-bearing properties of this node type, in traversal order}
    public List<VisitorKey> visitorKeys() {
        return visitorKeys;
    }

    public boolean isLeaf() {
        return visitorKeys.isEmpty();
    }
}

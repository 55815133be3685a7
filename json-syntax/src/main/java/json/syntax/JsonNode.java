package json.syntax;

import java.util.List;
import java.util.Objects;

/// Syntax tree for JSON, JSONC and JSON5 documents.
///
/// A tree is rooted at a [DocumentNode] wrapping exactly one [ValueNode]:
/// - [ObjectNode]: ordered [MemberNode]s, duplicates retained
/// - [ArrayNode]: ordered elements
/// - [StringNode], [NumberNode], [BooleanNode], [NullNode]: literals
/// - [IdentifierNode]: an unquoted JSON5 member name
///
/// `range` and `loc` are `null` unless the parser was asked for ranges.
/// Nodes hold no behavior; consumers dispatch on [#type()].
public sealed interface JsonNode {

    /// {@return the type tag of this node}
    NodeType type();

    /// {@return the source offsets of this node, or null if not recorded}
    Range range();

    /// {@return the source line and column span of this node, or null if not recorded}
    Location loc();

    /// Nodes that can appear as a document body, array element or member value.
    sealed interface ValueNode extends JsonNode permits
            ObjectNode,
            ArrayNode,
            StringNode,
            NumberNode,
            BooleanNode,
            NullNode {}

    /// Nodes that can name an object member.
    sealed interface MemberName extends JsonNode permits StringNode, IdentifierNode {}

    /// Root of every parsed tree.
    /// @param tokens every token of the source, comments included, when requested at parse time; otherwise null
    record DocumentNode(ValueNode body, List<Token> tokens, Range range, Location loc) implements JsonNode {
        public DocumentNode {
            Objects.requireNonNull(body, "body must not be null");
            tokens = tokens == null ? null : List.copyOf(tokens);
        }

        @Override
        public NodeType type() {
            return NodeType.DOCUMENT;
        }
    }

    record ObjectNode(List<MemberNode> members, Range range, Location loc) implements ValueNode {
        public ObjectNode {
            Objects.requireNonNull(members, "members must not be null");
            members = List.copyOf(members);
        }

        @Override
        public NodeType type() {
            return NodeType.OBJECT;
        }
    }

    record MemberNode(MemberName name, ValueNode value, Range range, Location loc) implements JsonNode {
        public MemberNode {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public NodeType type() {
            return NodeType.MEMBER;
        }
    }

    record ArrayNode(List<ValueNode> elements, Range range, Location loc) implements ValueNode {
        public ArrayNode {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }

        @Override
        public NodeType type() {
            return NodeType.ARRAY;
        }
    }

    /// @param value the decoded text; may contain unpaired surrogates
    record StringNode(String value, Range range, Location loc) implements ValueNode, MemberName {
        public StringNode {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public NodeType type() {
            return NodeType.STRING;
        }
    }

    /// @param value the decoded number; non-finite only for JSON5 `Infinity` and `NaN`
    record NumberNode(double value, Range range, Location loc) implements ValueNode {
        @Override
        public NodeType type() {
            return NodeType.NUMBER;
        }
    }

    record BooleanNode(boolean value, Range range, Location loc) implements ValueNode {
        @Override
        public NodeType type() {
            return NodeType.BOOLEAN;
        }
    }

    record NullNode(Range range, Location loc) implements ValueNode {
        @Override
        public NodeType type() {
            return NodeType.NULL;
        }
    }

    /// @param name the identifier exactly as written in the source
    record IdentifierNode(String name, Range range, Location loc) implements MemberName {
        public IdentifierNode {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public NodeType type() {
            return NodeType.IDENTIFIER;
        }
    }
}

package json.syntax;

import json.syntax.JsonNode.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Converts a syntax tree into plain Java values.
///
/// | Node | Java value |
/// |------|------------|
/// | `Document` | value of its body |
/// | `Object` | `LinkedHashMap<String, Object>`; a repeated name keeps its first position and last value |
/// | `Array` | `ArrayList<Object>` |
/// | `String` | `String` |
/// | `Number` | `Double`, including JSON5 infinities and NaN |
/// | `Boolean` | `Boolean` |
/// | `Null` | `null` |
/// | `Identifier` | its name as a `String` |
final class JsonEvaluator {

    /// @throws IllegalArgumentException if `node` is a member outside of an object
    static Object evaluate(JsonNode node) {
        Objects.requireNonNull(node, "node must not be null");
        return switch (node.type()) {
            case DOCUMENT -> evaluate(((DocumentNode) node).body());
            case OBJECT -> {
                final var members = ((ObjectNode) node).members();
                final Map<String, Object> map = new LinkedHashMap<>();
                for (MemberNode member : members) {
                    map.put((String) evaluate(member.name()), evaluate(member.value()));
                }
                yield map;
            }
            case MEMBER -> throw new IllegalArgumentException("Cannot evaluate a Member outside of an Object.");
            case ARRAY -> {
                final var elements = ((ArrayNode) node).elements();
                final List<Object> list = new ArrayList<>(elements.size());
                for (ValueNode element : elements) {
                    list.add(evaluate(element));
                }
                yield list;
            }
            case STRING -> ((StringNode) node).value();
            case NUMBER -> ((NumberNode) node).value();
            case BOOLEAN -> ((BooleanNode) node).value();
            case NULL -> null;
            case IDENTIFIER -> ((IdentifierNode) node).name();
        };
    }

    private JsonEvaluator() {}
}

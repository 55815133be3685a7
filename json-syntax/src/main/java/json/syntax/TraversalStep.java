package json.syntax;

import java.util.Objects;

/// One event of a traversal, as produced by [JsonSyntax#iterator(JsonNode)] and by
/// [JsonSyntax#iterator(JsonNode, java.util.function.Predicate)] for the steps its filter keeps.
/// @param node the visited node
/// @param parent the parent of `node`, or null for the root
/// @param phase whether the node is being entered or exited
public record TraversalStep(JsonNode node, JsonNode parent, Phase phase) {

    public TraversalStep {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
    }

    public enum Phase {
        ENTER,
        EXIT
    }
}

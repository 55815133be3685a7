package json.syntax;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.logging.Logger;

/// Depth-first walk of a syntax tree in the order fixed by [NodeType#visitorKeys()].
final class Traversal {

    private static final Logger LOG = Logger.getLogger(Traversal.class.getName());

    private final TraversalVisitor visitor;

    private Traversal(TraversalVisitor visitor) {
        this.visitor = visitor;
    }

    /// Visits `root` and every descendant. Exceptions thrown by a callback stop the
    /// walk and propagate unchanged.
    static void traverse(JsonNode root, TraversalVisitor visitor) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(visitor, "visitor must not be null");
        LOG.finer(() -> "Traversing from " + root.type().label());
        new Traversal(visitor).visit(root, null);
    }

    /// Records the enter and exit steps of a full traversal, keeping those accepted by `filter`.
    static Iterator<TraversalStep> iterator(JsonNode root, Predicate<TraversalStep> filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        final List<TraversalStep> steps = new ArrayList<>();
        traverse(root, TraversalVisitor.of(
                (node, parent) -> steps.add(new TraversalStep(node, parent, TraversalStep.Phase.ENTER)),
                (node, parent) -> steps.add(new TraversalStep(node, parent, TraversalStep.Phase.EXIT))));
        return steps.stream().filter(filter).iterator();
    }

    private void visit(JsonNode node, JsonNode parent) {
        if (visitor.enter() != null) {
            visitor.enter().accept(node, parent);
        }

        for (VisitorKey key : node.type().visitorKeys()) {
            for (JsonNode child : key.children(node)) {
                visit(child, node);
            }
        }

        if (visitor.exit() != null) {
            visitor.exit().accept(node, parent);
        }
    }
}

package json.syntax;

import json.syntax.JsonNode.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

import static json.syntax.JsonNodes.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for Traversal - visit order, parents and step iteration.
class TraversalTest extends JsonSyntaxLoggingConfig {

    private static final Logger LOG = Logger.getLogger(TraversalTest.class.getName());

    private record Visit(JsonNode node, JsonNode parent) {}

    @Test
    void testSingleValueDocument() {
        LOG.info(() -> "TEST: testSingleValueDocument");
        final DocumentNode root = document(string("Hello world!"));
        final List<Visit> entered = new ArrayList<>();
        final List<Visit> exited = new ArrayList<>();

        JsonSyntax.traverse(root, TraversalVisitor.of(
                (node, parent) -> entered.add(new Visit(node, parent)),
                (node, parent) -> exited.add(new Visit(node, parent))));

        assertThat(entered).containsExactly(new Visit(root, null), new Visit(root.body(), root));
        assertThat(exited).containsExactly(new Visit(root.body(), root), new Visit(root, null));
    }

    @Test
    void testEnterOnlyAndExitOnly() {
        LOG.info(() -> "TEST: testEnterOnlyAndExitOnly");
        final DocumentNode root = document(number(1));
        final List<JsonNode> entered = new ArrayList<>();
        final List<JsonNode> exited = new ArrayList<>();

        JsonSyntax.traverse(root, TraversalVisitor.onEnter((node, parent) -> entered.add(node)));
        JsonSyntax.traverse(root, TraversalVisitor.onExit((node, parent) -> exited.add(node)));

        assertThat(entered).containsExactly(root, root.body());
        assertThat(exited).containsExactly(root.body(), root);
    }

    @Test
    void testObjectMemberOrder() {
        LOG.info(() -> "TEST: testObjectMemberOrder");
        final MemberNode member = member("a", bool(true));
        final ObjectNode object = object(member);
        final DocumentNode root = document(object);
        final List<Visit> entered = new ArrayList<>();
        final List<Visit> exited = new ArrayList<>();

        JsonSyntax.traverse(root, TraversalVisitor.of(
                (node, parent) -> entered.add(new Visit(node, parent)),
                (node, parent) -> exited.add(new Visit(node, parent))));

        assertThat(entered).containsExactly(
                new Visit(root, null),
                new Visit(object, root),
                new Visit(member, object),
                new Visit(member.name(), member),
                new Visit(member.value(), member));
        assertThat(exited).containsExactly(
                new Visit(member.name(), member),
                new Visit(member.value(), member),
                new Visit(member, object),
                new Visit(object, root),
                new Visit(root, null));
    }

    @Test
    void testArrayElementsInOrder() {
        LOG.info(() -> "TEST: testArrayElementsInOrder");
        final DocumentNode root = JsonSyntax.parse("[1, [2, 3], {\"k\": 4}]");
        final List<String> labels = new ArrayList<>();

        JsonSyntax.traverse(root, TraversalVisitor.onEnter((node, parent) -> {
            if (node instanceof NumberNode number) {
                labels.add(EcmaNumberFormat.format(number.value()));
            } else {
                labels.add(node.type().label());
            }
        }));

        assertThat(labels).containsExactly(
                "Document", "Array", "1", "Array", "2", "3", "Object", "Member", "String", "4");
    }

    @Test
    void testParentsAreIdentical() {
        LOG.info(() -> "TEST: testParentsAreIdentical");
        final DocumentNode root = JsonSyntax.parse("{\"a\": [null]}");
        final ObjectNode object = (ObjectNode) root.body();
        final MemberNode member = object.members().get(0);
        final ArrayNode array = (ArrayNode) member.value();

        JsonSyntax.traverse(root, TraversalVisitor.onEnter((node, parent) -> {
            if (node == array.elements().get(0)) {
                assertThat(parent).isSameAs(array);
            } else if (node == array) {
                assertThat(parent).isSameAs(member);
            } else if (node == member) {
                assertThat(parent).isSameAs(object);
            } else if (node == root) {
                assertThat(parent).isNull();
            }
        }));
    }

    @Test
    void testTraversalFromInnerNode() {
        LOG.info(() -> "TEST: testTraversalFromInnerNode");
        final ArrayNode array = array(number(1), number(2));
        final List<Visit> entered = new ArrayList<>();

        JsonSyntax.traverse(array, TraversalVisitor.onEnter((node, parent) -> entered.add(new Visit(node, parent))));

        assertThat(entered).containsExactly(
                new Visit(array, null),
                new Visit(array.elements().get(0), array),
                new Visit(array.elements().get(1), array));
    }

    @Test
    void testCallbackExceptionStopsTraversal() {
        LOG.info(() -> "TEST: testCallbackExceptionStopsTraversal");
        final DocumentNode root = JsonSyntax.parse("[1, 2, 3]");
        final List<JsonNode> entered = new ArrayList<>();

        assertThatThrownBy(() -> JsonSyntax.traverse(root, TraversalVisitor.onEnter((node, parent) -> {
            entered.add(node);
            if (node instanceof NumberNode number && number.value() == 2) {
                throw new IllegalStateException("stop");
            }
        }))).isInstanceOf(IllegalStateException.class).hasMessage("stop");

        assertThat(entered).hasSize(4);
    }

    @Test
    void testIteratorYieldsEnterAndExitSteps() {
        LOG.info(() -> "TEST: testIteratorYieldsEnterAndExitSteps");
        final DocumentNode root = document(array(nul()));
        final ArrayNode array = (ArrayNode) root.body();

        final Iterator<TraversalStep> steps = JsonSyntax.iterator(root);
        final List<TraversalStep> collected = new ArrayList<>();
        steps.forEachRemaining(collected::add);

        assertThat(collected).containsExactly(
                new TraversalStep(root, null, TraversalStep.Phase.ENTER),
                new TraversalStep(array, root, TraversalStep.Phase.ENTER),
                new TraversalStep(array.elements().get(0), array, TraversalStep.Phase.ENTER),
                new TraversalStep(array.elements().get(0), array, TraversalStep.Phase.EXIT),
                new TraversalStep(array, root, TraversalStep.Phase.EXIT),
                new TraversalStep(root, null, TraversalStep.Phase.EXIT));
    }

    @Test
    void testIteratorFilter() {
        LOG.info(() -> "TEST: testIteratorFilter");
        final DocumentNode root = JsonSyntax.parse("{\"a\": \"x\", \"b\": [\"y\", 1]}");
        final List<String> strings = new ArrayList<>();

        JsonSyntax.iterator(root, step -> step.phase() == TraversalStep.Phase.ENTER
                        && step.node() instanceof StringNode
                        && !(step.parent() instanceof MemberNode member && member.name() == step.node()))
                .forEachRemaining(step -> strings.add(((StringNode) step.node()).value()));

        assertThat(strings).containsExactly("x", "y");
    }

    @Test
    void testVisitorKeysMatchNodeTypes() {
        LOG.info(() -> "TEST: testVisitorKeysMatchNodeTypes");
        assertThat(NodeType.DOCUMENT.visitorKeys()).containsExactly(VisitorKey.BODY);
        assertThat(NodeType.OBJECT.visitorKeys()).containsExactly(VisitorKey.MEMBERS);
        assertThat(NodeType.MEMBER.visitorKeys()).containsExactly(VisitorKey.NAME, VisitorKey.VALUE);
        assertThat(NodeType.ARRAY.visitorKeys()).containsExactly(VisitorKey.ELEMENTS);
        assertThat(NodeType.STRING.isLeaf()).isTrue();
        assertThat(NodeType.IDENTIFIER.visitorKeys()).isEmpty();

        assertThatThrownBy(() -> VisitorKey.BODY.children(string("x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("String has no property 'body'");
    }

    @Test
    void testNullArgumentsRejected() {
        LOG.info(() -> "TEST: testNullArgumentsRejected");
        assertThatThrownBy(() -> JsonSyntax.traverse(null, TraversalVisitor.onEnter((n, p) -> {})))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> JsonSyntax.traverse(nul(), null))
                .isInstanceOf(NullPointerException.class);
    }
}

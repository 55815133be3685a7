package json.syntax;

import json.syntax.JsonNode.DocumentNode;
import json.syntax.JsonNode.ObjectNode;

import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/// Entry point for reading JSON, JSONC and JSON5 text into a location-aware
/// syntax tree, walking that tree, and writing it back out as JSON.
///
/// ## Example Usage
/// ```java
/// DocumentNode doc = JsonSyntax.parse("""
///     {
///         // JSON5 allows comments, unquoted keys and trailing commas
///         name: 'Alice',
///         tags: ["a", "b",],
///     }
///     """, ParseOptions.of(Mode.JSON5).withRanges(true));
///
/// JsonSyntax.traverse(doc, TraversalVisitor.onEnter((node, parent) -> {
///     if (node instanceof JsonNode.StringNode s) {
///         System.out.println(s.value() + " at " + s.loc().start());
///     }
/// }));
///
/// String json = JsonSyntax.print(doc, 2);
/// ```
///
/// Every operation is a pure function of its arguments, so calls on independent
/// inputs may run concurrently.
public final class JsonSyntax {

    /// Scans strict JSON text into tokens.
    /// @throws JsonLexicalException at the first malformed lexeme
    public static List<Token> tokenize(String text) {
        return tokenize(text, Mode.JSON);
    }

    /// Scans `text` into tokens, comments included.
    /// @param text the source text. Non-null.
    /// @param mode the dialect to scan. Non-null.
    /// @return the tokens in source order
    /// @throws JsonLexicalException at the first malformed lexeme
    public static List<Token> tokenize(String text, Mode mode) {
        return Tokenizer.tokenize(text, mode);
    }

    /// Parses strict JSON text without ranges or tokens.
    /// @throws JsonSyntaxException if `text` is not a JSON document
    public static DocumentNode parse(String text) {
        return parse(text, ParseOptions.defaults());
    }

    /// Parses `text` into a syntax tree.
    /// @param text the source text. Non-null.
    /// @param options dialect and what to record on the tree. Non-null.
    /// @return the document node
    /// @throws JsonSyntaxException if `text` is not a document of the requested dialect;
    ///         a [JsonLexicalException] when the failure is lexical
    public static DocumentNode parse(String text, ParseOptions options) {
        return JsonParser.parse(text, options);
    }

    /// Walks `root` depth first, calling `visitor.enter` before and `visitor.exit`
    /// after each node's children. Children are visited in the order given by
    /// [NodeType#visitorKeys()]. The tree must not be modified during the walk.
    public static void traverse(JsonNode root, TraversalVisitor visitor) {
        Traversal.traverse(root, visitor);
    }

    /// {@return every enter and exit step of a traversal of `root`, in order}
    public static Iterator<TraversalStep> iterator(JsonNode root) {
        return Traversal.iterator(root, step -> true);
    }

    /// {@return the steps of a traversal of `root` accepted by `filter`, in order}
    public static Iterator<TraversalStep> iterator(JsonNode root, Predicate<TraversalStep> filter) {
        return Traversal.iterator(root, filter);
    }

    /// Prints `node` as compact JSON.
    /// @throws JsonPrintException if the tree holds `Infinity` or `NaN`
    public static String print(JsonNode node) {
        return print(node, 0);
    }

    /// Prints `node` as JSON, in the format of `JSON.stringify(value, null, indent)`.
    /// @param node the node to print. Non-null.
    /// @param indent spaces per nesting level; 0 for compact output, capped at 10
    /// @throws IllegalArgumentException if `indent` is negative
    /// @throws JsonPrintException if the tree holds `Infinity` or `NaN`
    public static String print(JsonNode node, int indent) {
        return JsonPrinter.print(node, indent);
    }

    /// {@return the plain Java value of `node`} Objects become insertion-ordered maps,
    /// arrays lists, numbers `Double`s.
    /// @throws IllegalArgumentException if `node` is a member outside of an object
    public static Object evaluate(JsonNode node) {
        return JsonEvaluator.evaluate(node);
    }

    /// {@return a tree describing `node` in its serialization-facing JSON shape}
    /// Print the result to export a tree for tooling in other languages.
    public static ObjectNode toShape(JsonNode node) {
        return NodeShapes.toShape(node);
    }

    // no instantiation is allowed for this class
    private JsonSyntax() {}
}

/// Location-aware parsing of JSON, JSONC and JSON5.
///
/// ## Design
/// Source text flows through three stages, each usable on its own:
/// - [json.syntax.Tokenizer] scans text into [json.syntax.Token]s with exact
///   ranges and line/column locations, comments included.
/// - [json.syntax.JsonSyntax#parse(String, json.syntax.ParseOptions)] builds a
///   [json.syntax.JsonNode] tree rooted at a `DocumentNode`.
/// - [json.syntax.JsonSyntax#traverse], [json.syntax.JsonSyntax#print] and
///   [json.syntax.JsonSyntax#evaluate] consume the tree.
///
/// The tree is a closed sum type: a sealed `JsonNode` interface whose records are
/// tagged with a [json.syntax.NodeType]. Consumers switch on the tag, so adding a
/// node kind is a compile error at every consumer until handled.
///
/// ## Dialects
/// | Feature | `JSON` | `JSONC` | `JSON5` |
/// |---------|--------|---------|---------|
/// | Comments | no | yes | yes |
/// | Unquoted keys | no | no | yes |
/// | Single-quoted strings | no | no | yes |
/// | Trailing commas | option | option | yes |
/// | Hex, `+`, leading/trailing `.`, `Infinity`, `NaN` | no | no | yes |
///
/// ## Errors
/// Reading fails fast with a [json.syntax.JsonSyntaxException] (or its lexical
/// subtype [json.syntax.JsonLexicalException]) carrying the line, column and
/// offset of the first problem. Printing fails with a
/// [json.syntax.JsonPrintException] when a value has no JSON representation.
package json.syntax;

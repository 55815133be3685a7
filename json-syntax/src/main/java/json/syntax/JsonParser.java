package json.syntax;

import json.syntax.JsonNode.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Recursive descent parser from JSON, JSONC or JSON5 text to a [DocumentNode].
///
/// Grammar, gated by dialect:
/// ```
/// Document := Value EOF
/// Value    := Object | Array | String | Number | Boolean | Null
/// Object   := '{' ( Member (',' Member)* (',')? )? '}'
/// Member   := (String | Identifier) ':' Value
/// Array    := '[' ( Value (',' Value)* (',')? )? ']'
/// ```
/// One token of lookahead, no backtracking; the first error ends the parse.
/// Comment tokens are skipped between any two tokens.
final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    private static final Position DOCUMENT_START = new Position(1, 0, 0);

    private final ParseOptions options;
    private final Tokenizer tokenizer;
    private final List<Token> tokens;

    private JsonParser(String text, ParseOptions options) {
        this.options = options;
        this.tokenizer = new Tokenizer(text, options.mode());
        this.tokens = options.tokens() ? new ArrayList<>() : null;
    }

    /// Parses `text` into a syntax tree.
    /// @throws NullPointerException if either argument is null
    /// @throws JsonSyntaxException if the text is not a document of the requested dialect
    static DocumentNode parse(String text, ParseOptions options) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(options, "options must not be null");
        LOG.fine(() -> "Parsing " + text.length() + " chars as " + options.mode().modeName()
                + " (ranges=" + options.ranges() + ", tokens=" + options.tokens() + ")");
        return new JsonParser(text, options).parseDocument();
    }

    private DocumentNode parseDocument() {
        final ValueNode body = parseValue(next());

        final Token trailing = next();
        if (trailing != null) {
            throw unexpected(trailing);
        }

        if (!options.ranges()) {
            return new DocumentNode(body, tokens, null, null);
        }
        final Location loc = new Location(DOCUMENT_START, body.loc().end());
        return new DocumentNode(body, tokens, new Range(0, loc.end().offset()), loc);
    }

    /// Advances past comments to the next significant token, or null at end of input.
    private Token next() {
        while (tokenizer.advance()) {
            final Token token = tokenizer.current();
            if (tokens != null) {
                tokens.add(token);
            }
            if (!token.type().isComment()) {
                return token;
            }
        }
        return null;
    }

    private ValueNode parseValue(Token token) {
        if (token == null) {
            throw endOfInput();
        }
        return switch (token.type()) {
            case STRING -> new StringNode(JsonLexicon.decodeString(token.value()), range(token), loc(token));
            case NUMBER -> new NumberNode(decodeNumber(token), range(token), loc(token));
            case BOOLEAN -> new BooleanNode(JsonLexicon.TRUE.equals(token.value()), range(token), loc(token));
            case NULL -> new NullNode(range(token), loc(token));
            case PUNCTUATOR -> {
                if (token.isPunctuator('{')) {
                    yield parseObject(token);
                }
                if (token.isPunctuator('[')) {
                    yield parseArray(token);
                }
                throw unexpected(token);
            }
            case IDENTIFIER, LINE_COMMENT, BLOCK_COMMENT -> throw unexpected(token);
        };
    }

    private ObjectNode parseObject(Token open) {
        final var members = new ArrayList<MemberNode>();
        Token token = next();

        if (!isPunctuator(token, '}')) {
            while (true) {
                members.add(parseMember(token));
                token = next();
                if (!isPunctuator(token, ',')) {
                    break;
                }
                token = next();
                if (options.trailingCommas() && isPunctuator(token, '}')) {
                    break;
                }
            }
        }

        final Token close = expect(token, '}');
        LOG.finer(() -> "Parsed object with " + members.size() + " members");
        return new ObjectNode(members, range(open, close), loc(open, close));
    }

    private MemberNode parseMember(Token token) {
        final MemberName name = parseMemberName(token);
        expect(next(), ':');
        final ValueNode value = parseValue(next());

        if (!options.ranges()) {
            return new MemberNode(name, value, null, null);
        }
        return new MemberNode(name, value,
                new Range(name.range().start(), value.range().end()),
                new Location(name.loc().start(), value.loc().end()));
    }

    private MemberName parseMemberName(Token token) {
        if (token == null) {
            throw endOfInput();
        }
        if (token.type() == TokenType.STRING) {
            return new StringNode(JsonLexicon.decodeString(token.value()), range(token), loc(token));
        }
        if (!options.mode().isJson5()) {
            throw unexpected(token);
        }
        return switch (token.type()) {
            // true, false and null are value tokens here, and signed numbers may not name a member
            case IDENTIFIER -> new IdentifierNode(token.value(), range(token), loc(token));
            case NUMBER -> {
                if (token.value().equals(JsonLexicon.INFINITY) || token.value().equals(JsonLexicon.NAN)) {
                    yield new IdentifierNode(token.value(), range(token), loc(token));
                }
                throw unexpected(token);
            }
            default -> throw unexpected(token);
        };
    }

    private ArrayNode parseArray(Token open) {
        final var elements = new ArrayList<ValueNode>();
        Token token = next();

        if (!isPunctuator(token, ']')) {
            while (true) {
                elements.add(parseValue(token));
                token = next();
                if (!isPunctuator(token, ',')) {
                    break;
                }
                token = next();
                if (options.trailingCommas() && isPunctuator(token, ']')) {
                    break;
                }
            }
        }

        final Token close = expect(token, ']');
        LOG.finer(() -> "Parsed array with " + elements.size() + " elements");
        return new ArrayNode(elements, range(open, close), loc(open, close));
    }

    /// Only JSON5 spells non-finite numbers, so a JSON or JSONC literal that overflows a double is rejected.
    private double decodeNumber(Token token) {
        final double value = JsonLexicon.decodeNumber(token.value());
        if (!options.mode().isJson5() && !Double.isFinite(value)) {
            LOG.fine(() -> "Number out of range at offset " + token.range().start());
            throw new JsonSyntaxException("Number " + token.value() + " is out of range.", token.loc().start());
        }
        return value;
    }

    // ========== Helpers ==========

    private static boolean isPunctuator(Token token, char c) {
        return token != null && token.isPunctuator(c);
    }

    private Token expect(Token token, char punctuator) {
        if (token == null) {
            throw endOfInput();
        }
        if (!token.isPunctuator(punctuator)) {
            throw unexpected(token);
        }
        return token;
    }

    private Range range(Token token) {
        return options.ranges() ? token.range() : null;
    }

    private Location loc(Token token) {
        return options.ranges() ? token.loc() : null;
    }

    private Range range(Token first, Token last) {
        return options.ranges() ? new Range(first.range().start(), last.range().end()) : null;
    }

    private Location loc(Token first, Token last) {
        return options.ranges() ? new Location(first.loc().start(), last.loc().end()) : null;
    }

    private JsonSyntaxException unexpected(Token token) {
        LOG.fine(() -> "Unexpected " + token.type().label() + " at offset " + token.range().start());
        return new JsonSyntaxException(
                "Unexpected token " + token.type().label() + "(" + token.value() + ") found.",
                token.loc().start());
    }

    private JsonSyntaxException endOfInput() {
        final Position at = tokenizer.position();
        LOG.fine(() -> "Unexpected end of input at offset " + at.offset());
        return new JsonSyntaxException("Unexpected end of input found.", at);
    }
}

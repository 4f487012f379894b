// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.abbrev;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import shorthand.dom.Attribute;
import shorthand.dom.Node;
import shorthand.util.condition.ConditionContext;
import shorthand.util.condition.UnhandledErrorError;

/**
 * The abbreviation parser: a recursive-descent reader turning an abbreviation into a forest of {@link Node}s.
 * <p>
 * The grammar, from the loosest binding operator to the tightest:
 * <pre>
 * Expression := Term ('+' Term)*
 * Term       := Primary ('*' Integer)? ('&gt;' Expression)?
 * Primary    := '(' Expression ')' | Element
 * Element    := Identifier? ('#' Identifier | '.' Identifier | '[' Attributes ']' | '{' Text '}')*
 * </pre>
 * A multiplier applies to its primary before any children are attached, so {@code a*3>b} is three {@code a}
 * elements, each with its own copy of {@code b}. Those copies are not numbered. A group is a unit for a following
 * multiplier or {@code >}.
 * <p>
 * No single multiplier or child attachment may produce more than a million elements.
 * <p>
 * A parser instance reads a single abbreviation once and is not reusable.
 */
public final class AbbreviationParser {
    /**
     * Initializes a new parser for the given abbreviation.
     */
    public AbbreviationParser(final String abbreviation) {
        this.abbreviation = abbreviation;
    }

    /**
     * Parses the whole abbreviation into a non-empty list of root nodes.
     * <p>
     * If the abbreviation is blank or malformed, a fatal {@link AbbreviationErrorCondition} is signaled. No partial
     * result is ever produced.
     */
    public List<Node> parse() {
        assert position == 0 : "AbbreviationParser reused";
        if (abbreviation.isBlank()) {
            throw ConditionContext.error(new AbbreviationErrorCondition(
                new AbbreviationError(ErrorKind.EMPTY_ABBREVIATION, "Abbreviation is empty", OptionalInt.empty()),
                abbreviation
            ));
        }
        final var nodes = parseExpression(false);
        skipWhitespace();
        if (!reachedEnd()) {
            throw signalUnexpectedCharacter();
        }
        return nodes;
    }

    private List<Node> parseExpression(final boolean closingParenTerminates) {
        currentDepth += 1;
        try {
            if (currentDepth > maxDepth) {
                throw signalError(ErrorKind.NESTING_TOO_DEEP, "Nesting limit reached, try to limit nesting", position);
            }
            final var nodes = new ArrayList<Node>();
            while (true) {
                nodes.addAll(parseTerm());
                if (onlyWhitespaceLeft()) {
                    break;
                }
                final var c = peek();
                if (c == '+') {
                    position += 1;
                } else if (c == ')' && closingParenTerminates) {
                    break;
                } else {
                    throw signalUnexpectedCharacter();
                }
            }
            return nodes;
        } finally {
            currentDepth -= 1;
        }
    }

    private List<Node> parseTerm() {
        var nodes = parsePrimary();
        if (!reachedEnd() && peek() == '*') {
            final var starPosition = position;
            final var count = parseMultiplier();
            if (Numbering.countElements(nodes) * count > maxElements) {
                throw signalError(
                    ErrorKind.INVALID_MULTIPLIER,
                    "Repeat count " + count + " would produce more than " + maxElements + " elements",
                    starPosition
                );
            }
            nodes = Numbering.repeatNodes(nodes, count);
        }
        if (reachedEnd() || peek() != '>') {
            return nodes;
        }
        final var childPosition = position;
        position += 1;
        final var children = parseExpression(true);
        if (nodes.size() * Numbering.countElements(children) > maxElements) {
            throw signalError(
                ErrorKind.EXPANSION_TOO_LARGE,
                "Attaching these children would produce more than " + maxElements + " elements",
                childPosition
            );
        }
        final var parents = new ArrayList<Node>(nodes.size());
        for (final var node : nodes) {
            parents.add(node.withAppendedChildren(Numbering.cloneNodes(children)));
        }
        return parents;
    }

    private List<Node> parsePrimary() {
        if (reachedEnd() || peek() != '(') {
            return List.of(parseElement());
        }
        final var groupStart = position;
        position += 1;
        final var nodes = parseExpression(true);
        if (reachedEnd() || peek() != ')') {
            throw signalError(ErrorKind.UNCLOSED_GROUP, "Expected closing ')' for this group", groupStart);
        }
        position += 1;
        return nodes;
    }

    private int parseMultiplier() {
        final var starPosition = position;
        position += 1;
        final var digits = readWhile(AbbreviationParser::isAsciiDigit);
        if (digits.isEmpty()) {
            throw signalError(ErrorKind.INVALID_MULTIPLIER, "Expected a repeat count after '*'", starPosition);
        }
        final int count;
        try {
            count = Integer.parseInt(digits);
        } catch (final NumberFormatException e) {
            throw signalError(ErrorKind.INVALID_MULTIPLIER, "Repeat count " + digits + " is too large", starPosition);
        }
        if (count < 1) {
            throw signalError(ErrorKind.INVALID_MULTIPLIER, "Repeat count must be at least 1", starPosition);
        }
        return count;
    }

    private Node parseElement() {
        final var start = position;
        final var builder = new Node.Builder().tag(readWhile(AbbreviationParser::isIdentifierChar));
        elementLoop:
        while (!reachedEnd()) {
            final var c = peek();
            switch (c) {
                case '#' -> {
                    if (builder.hasId()) {
                        throw signalError(ErrorKind.DUPLICATE_ID, "Element already has an id", position);
                    }
                    builder.id(readModifierIdentifier("id"));
                }
                case '.' -> builder.addClass(readModifierIdentifier("class name"));
                case '[' -> parseAttributes(builder);
                case '{' -> builder.appendText(parseText());
                case '>', '+', '*', ')' -> {
                    break elementLoop;
                }
                default -> {
                    if (Character.isWhitespace(c)) {
                        break elementLoop;
                    }
                    throw signalUnexpectedCharacter();
                }
            }
        }
        if (position == start) {
            throw onlyWhitespaceLeft()
                ? signalError(ErrorKind.UNEXPECTED_END, "Expected an element but found end of input", position)
                : signalUnexpectedCharacter();
        }
        return builder.build();
    }

    private String readModifierIdentifier(final String what) {
        final var markerPosition = position;
        final var marker = peek();
        position += 1;
        final var identifier = readWhile(AbbreviationParser::isIdentifierChar);
        if (identifier.isEmpty()) {
            throw signalError(
                ErrorKind.EXPECTED_IDENTIFIER,
                "Expected " + what + " after '" + marker + "'",
                markerPosition
            );
        }
        return identifier;
    }

    private void parseAttributes(final Node.Builder builder) {
        final var openPosition = position;
        position += 1;
        while (true) {
            readWhile(AbbreviationParser::isAttributeSeparator);
            if (reachedEnd()) {
                throw signalError(ErrorKind.UNCLOSED_ATTRIBUTE_SET, "Expected closing ']'", openPosition);
            }
            if (peek() == ']') {
                position += 1;
                return;
            }
            final var name = readWhile(AbbreviationParser::isAttributeNameChar);
            if (name.isEmpty()) {
                throw signalUnexpectedCharacter();
            }
            if (!reachedEnd() && peek() == '=') {
                position += 1;
                builder.attribute(Attribute.of(name, parseAttributeValue()));
            } else {
                builder.attribute(Attribute.flag(name));
            }
            if (!reachedEnd() && !isAttributeSeparator(peek()) && peek() != ']') {
                throw signalUnexpectedCharacter();
            }
        }
    }

    private String parseAttributeValue() {
        if (!reachedEnd() && (peek() == '"' || peek() == '\'')) {
            return parseQuotedValue();
        }
        final var valuePosition = position;
        final var value = readWhile(c -> c != ']' && !isAttributeSeparator(c));
        if (value.isEmpty()) {
            throw signalError(ErrorKind.EXPECTED_ATTRIBUTE_VALUE, "Expected attribute value after '='", valuePosition);
        }
        return value;
    }

    private String parseQuotedValue() {
        final var quotePosition = position;
        final var quote = peek();
        position += 1;
        final var value = new StringBuilder();
        while (true) {
            if (reachedEnd()) {
                throw signalError(ErrorKind.UNCLOSED_QUOTE, "Expected closing " + quote + " but found end of input",
                    quotePosition);
            }
            final var c = peek();
            position += 1;
            if (c == quote) {
                return value.toString();
            }
            if (c != '\\') {
                value.append(c);
                continue;
            }
            if (reachedEnd()) {
                throw signalError(ErrorKind.UNCLOSED_QUOTE, "Expected closing " + quote + " but found end of input",
                    quotePosition);
            }
            final var escaped = peek();
            position += 1;
            if (escaped != quote && escaped != '\\') {
                value.append('\\');
            }
            value.append(escaped);
        }
    }

    private String parseText() {
        final var openPosition = position;
        position += 1;
        final var text = new StringBuilder();
        while (true) {
            if (reachedEnd()) {
                throw signalError(ErrorKind.UNCLOSED_TEXT, "Expected closing '}' but found end of input", openPosition);
            }
            final var c = peek();
            position += 1;
            if (c == '}') {
                return text.toString();
            }
            if (c == '\\') {
                if (reachedEnd()) {
                    throw signalError(ErrorKind.UNCLOSED_TEXT, "Expected closing '}' but found end of input",
                        openPosition);
                }
                text.append(peek());
                position += 1;
            } else {
                text.append(c);
            }
        }
    }

    private String readWhile(final CharPredicate predicate) {
        final var start = position;
        while (!reachedEnd() && predicate.test(peek())) {
            position += 1;
        }
        return abbreviation.substring(start, position);
    }

    private void skipWhitespace() {
        while (!reachedEnd() && Character.isWhitespace(peek())) {
            position += 1;
        }
    }

    private boolean onlyWhitespaceLeft() {
        for (int i = position; i < abbreviation.length(); i += 1) {
            if (!Character.isWhitespace(abbreviation.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private boolean reachedEnd() {
        return position >= abbreviation.length();
    }

    private char peek() {
        assert position < abbreviation.length();
        return abbreviation.charAt(position);
    }

    private UnhandledErrorError signalUnexpectedCharacter() {
        throw signalError(ErrorKind.UNEXPECTED_CHARACTER, "Unexpected character '" + peek() + "'", position);
    }

    private UnhandledErrorError signalError(final ErrorKind kind, final String message, final int errorPosition) {
        final var error = new AbbreviationError(kind, message, OptionalInt.of(errorPosition));
        throw ConditionContext.error(new AbbreviationErrorCondition(error, abbreviation));
    }

    private static boolean isIdentifierChar(final char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == Numbering.placeholder;
    }

    private static boolean isAttributeNameChar(final char c) {
        return isIdentifierChar(c) || c == ':';
    }

    private static boolean isAttributeSeparator(final char c) {
        return c == ',' || Character.isWhitespace(c);
    }

    private static boolean isAsciiDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static final int maxDepth = 150;
    private static final long maxElements = 1_000_000;

    private final String abbreviation;
    private int position = 0;
    private int currentDepth = 0;

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char c);
    }
}

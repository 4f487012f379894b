// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.dom;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.Objects;
import shorthand.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The tree-to-HTML serializer.
 * <p>
 * Every element is written with an explicit closing tag; void elements are not special-cased. Elements without
 * children and without multi-line text take a single line, all others are written as an opening tag line, the text
 * lines and children indented one level deeper, and a closing tag line.
 */
public final class Serializer {
    private Serializer(final Writer writer) {
        this.writer = writer;
    }

    /**
     * Serializes the given root nodes, each starting at indentation level zero, separated by line feeds.
     * <p>
     * No line feed is written after the last line. Any {@link IOException}s thrown by the writer are allowed to
     * propagate.
     */
    public static void serialize(final Writer writer, final List<Node> rootNodes) throws IOException {
        final var serializer = new Serializer(writer);
        for (final var node : rootNodes) {
            serializer.serializeNode(node, 0);
        }
    }

    /**
     * Serializes the given root nodes into a string.
     *
     * @see #serialize(Writer, List)
     */
    public static String toHtml(final List<Node> rootNodes) {
        final var writer = new StringWriter();
        try {
            serialize(writer, rootNodes);
        } catch (final IOException e) {
            throw new UnreachableCodeReachedError("StringWriter threw an IOException", e);
        }
        return writer.toString();
    }

    private void serializeNode(final Node node, final int level) throws IOException {
        final var text = nonEmptyText(node);
        if (node.children().isEmpty() && (text == null || text.indexOf('\n') < 0)) {
            startLine(level);
            writeOpeningTag(node);
            if (text != null) {
                serializeString(text, TextEscaper.instance);
            }
            writeClosingTag(node);
            return;
        }

        startLine(level);
        writeOpeningTag(node);
        if (text != null) {
            for (final var line : text.split("\n", -1)) {
                startLine(level + 1);
                serializeString(line, TextEscaper.instance);
            }
        }
        for (final var child : node.children()) {
            serializeNode(child, level + 1);
        }
        startLine(level);
        writeClosingTag(node);
    }

    private void startLine(final int level) throws IOException {
        if (wroteAnything) {
            writer.write('\n');
        }
        wroteAnything = true;
        for (int i = 0; i < level; i += 1) {
            writer.write(indentUnit);
        }
    }

    private void writeOpeningTag(final Node node) throws IOException {
        writer.write('<');
        writer.write(node.tag());
        serializeAttributes(node);
        writer.write('>');
    }

    private void writeClosingTag(final Node node) throws IOException {
        writer.write("</");
        writer.write(node.tag());
        writer.write('>');
    }

    private void serializeAttributes(final Node node) throws IOException {
        final var id = node.id();
        if (id != null) {
            serializeValueAttribute("id", id);
        }
        if (!node.classes().isEmpty()) {
            serializeValueAttribute("class", String.join(" ", node.classes()));
        }
        for (final var attribute : node.attributes()) {
            if (attribute instanceof Attribute.Flag flag) {
                serializeAttributeName(flag.name());
            } else if (attribute instanceof Attribute.Value value) {
                serializeValueAttribute(value.name(), value.value());
            } else {
                throw new UnreachableCodeReachedError();
            }
        }
    }

    private void serializeValueAttribute(final String name, final String value) throws IOException {
        serializeAttributeName(name);
        writer.write("=\"");
        serializeString(value, AttributeEscaper.instance);
        writer.write('"');
    }

    private void serializeAttributeName(final String name) throws IOException {
        writer.write(' ');
        writer.write(name);
    }

    private void serializeString(final String string, final Escaper escaper) throws IOException {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = findCharacterToEscape(string, index, escaper)) >= 0) {
            writer.write(string, index, indexToEscape - index);
            writer.write(Objects.requireNonNull(escaper.escape(string.charAt(indexToEscape))));
            index = indexToEscape + 1;
        }
        if (index < string.length()) {
            writer.write(string, index, string.length() - index);
        }
    }

    private static @Nullable String nonEmptyText(final Node node) {
        final var text = node.text();
        return (text == null || text.isEmpty()) ? null : text;
    }

    private static int findCharacterToEscape(final String string, final int startIndex, final Escaper escaper) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escaper.escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    private static final String indentUnit = "  ";

    private final Writer writer;
    private boolean wroteAnything = false;

    private sealed interface Escaper {
        @Nullable String escape(char character);
    }

    private static final class TextEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '&' -> "&amp;";
                default -> null;
            };
        }

        private static final TextEscaper instance = new TextEscaper();
    }

    private static final class AttributeEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return (character == '"') ? "&quot;" : TextEscaper.instance.escape(character);
        }

        private static final AttributeEscaper instance = new AttributeEscaper();
    }
}

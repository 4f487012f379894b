// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.dom;

import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An element of the expanded tree.
 * <p>
 * Nodes are immutable: all lists are copied on construction, and the "modifying" methods return new nodes. An element
 * may carry both text and children, in which case the text is serialized first.
 *
 * @param tag        The element name.
 * @param id         The value of the {@code id} attribute, or {@code null} if absent.
 * @param classes    Class names in the order they were written, duplicates included.
 * @param attributes Other attributes, with unique names, in the order they were first written.
 * @param text       Literal text content, or {@code null} if absent.
 * @param children   Child elements.
 */
public record Node(
    String tag,
    @Nullable String id,
    List<String> classes,
    List<Attribute> attributes,
    @Nullable String text,
    List<Node> children
) {
    /**
     * The element name used when an abbreviation doesn't spell one out.
     */
    public static final String defaultTag = "div";

    public Node {
        classes = List.copyOf(classes);
        attributes = List.copyOf(attributes);
        children = List.copyOf(children);
    }

    /**
     * Returns a new element with the given name and nothing else.
     */
    public static Node empty(final String tag) {
        return new Node(tag, null, List.of(), List.of(), null, List.of());
    }

    /**
     * Returns a copy of this node with {@code extraChildren} appended after the existing children.
     */
    @CheckReturnValue
    public Node withAppendedChildren(final List<Node> extraChildren) {
        final var newChildren = new ArrayList<Node>(children.size() + extraChildren.size());
        newChildren.addAll(children);
        newChildren.addAll(extraChildren);
        return new Node(tag, id, classes, attributes, text, newChildren);
    }

    /**
     * Returns a structurally equal copy of this node that shares no node objects with it.
     */
    @CheckReturnValue
    public Node deepCopy() {
        final var copiedChildren = new ArrayList<Node>(children.size());
        for (final var child : children) {
            copiedChildren.add(child.deepCopy());
        }
        return new Node(tag, id, classes, attributes, text, copiedChildren);
    }

    /**
     * A mutable accumulator for the parts of an element, used while its abbreviation is being read.
     */
    public static final class Builder {
        /**
         * Returns {@code true} iff an id has already been set.
         */
        public boolean hasId() {
            return id != null;
        }

        /**
         * Sets the element name.
         */
        public Builder tag(final String tag) {
            this.tag = tag;
            return this;
        }

        /**
         * Sets the id. Callers must check {@link #hasId()} first, an element has at most one id.
         */
        public Builder id(final String id) {
            assert this.id == null : "Element id set twice";
            this.id = id;
            return this;
        }

        /**
         * Appends a class name.
         */
        public Builder addClass(final String className) {
            classes.add(className);
            return this;
        }

        /**
         * Sets an attribute, replacing a previous one with the same name.
         */
        public Builder attribute(final Attribute attribute) {
            attributes = Attributes.updated(attributes, attribute);
            return this;
        }

        /**
         * Appends to the text content.
         */
        public Builder appendText(final String text) {
            this.text = (this.text == null) ? text : this.text + text;
            return this;
        }

        /**
         * Creates the node. Elements without an explicit name get {@link Node#defaultTag}.
         */
        public Node build() {
            final var tagName = (tag == null || tag.isEmpty()) ? defaultTag : tag;
            return new Node(tagName, id, classes, attributes, text, List.of());
        }

        private @Nullable String tag = null;
        private @Nullable String id = null;
        private final List<String> classes = new ArrayList<>();
        private List<Attribute> attributes = List.of();
        private @Nullable String text = null;
    }
}

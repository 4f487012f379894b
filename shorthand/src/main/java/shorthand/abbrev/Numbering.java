// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.abbrev;

import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import shorthand.dom.Attribute;
import shorthand.dom.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Cloning and numbering of repeated subtrees.
 * <p>
 * A <dfn>numbering placeholder</dfn> is a maximal run of {@code $} characters. Numbering a string with repetition
 * index {@code i} replaces each placeholder of length {@code n} with {@code i + 1} written in decimal and left-padded
 * with zeros to {@code n} digits, so {@code item$$} becomes {@code item01} for index 0. Numbering a node rewrites its
 * id, classes, string attribute values and text, and those of all its descendants. Element names, attribute names
 * and flag attributes are never rewritten.
 */
public final class Numbering {
    private Numbering() {
    }

    /**
     * Returns {@code count} copies of {@code nodes}, concatenated in repetition order, with copy {@code i} numbered
     * with index {@code i}.
     */
    @CheckReturnValue
    public static List<Node> repeatNodes(final List<Node> nodes, final int count) {
        assert count > 0 : "Non-positive repeat count " + count;
        final var result = new ArrayList<Node>(Math.multiplyExact(nodes.size(), count));
        for (int index = 0; index < count; index += 1) {
            for (final var node : nodes) {
                result.add(applyNumbering(node, index));
            }
        }
        return result;
    }

    /**
     * Returns a deep copy of {@code nodes} with placeholders left as they are.
     */
    @CheckReturnValue
    public static List<Node> cloneNodes(final List<Node> nodes) {
        final var result = new ArrayList<Node>(nodes.size());
        for (final var node : nodes) {
            result.add(node.deepCopy());
        }
        return result;
    }

    /**
     * Returns a copy of {@code nodes}, each numbered with the same repetition index.
     */
    @CheckReturnValue
    public static List<Node> numberNodes(final List<Node> nodes, final int index) {
        final var result = new ArrayList<Node>(nodes.size());
        for (final var node : nodes) {
            result.add(applyNumbering(node, index));
        }
        return result;
    }

    /**
     * Returns the number of elements in {@code nodes} and all their descendants.
     */
    public static long countElements(final List<Node> nodes) {
        long count = nodes.size();
        for (final var node : nodes) {
            count += countElements(node.children());
        }
        return count;
    }

    /**
     * Returns a copy of the subtree rooted at {@code node} with every placeholder replaced for the given 0-based
     * repetition index.
     */
    @CheckReturnValue
    public static Node applyNumbering(final Node node, final int index) {
        final var classes = new ArrayList<String>(node.classes().size());
        for (final var className : node.classes()) {
            classes.add(applyNumbering(className, index));
        }
        final var attributes = new ArrayList<Attribute>(node.attributes().size());
        for (final var attribute : node.attributes()) {
            attributes.add(
                (attribute instanceof Attribute.Value value)
                    ? Attribute.of(value.name(), applyNumbering(value.value(), index))
                    : attribute
            );
        }
        return new Node(
            node.tag(),
            applyNumberingIfPresent(node.id(), index),
            classes,
            attributes,
            applyNumberingIfPresent(node.text(), index),
            numberNodes(node.children(), index)
        );
    }

    /**
     * Returns {@code value} with every placeholder replaced for the given 0-based repetition index.
     */
    @CheckReturnValue
    public static String applyNumbering(final String value, final int index) {
        var runStart = value.indexOf(placeholder);
        if (runStart < 0) {
            return value;
        }
        final var number = Integer.toString(index + 1);
        final var builder = new StringBuilder(value.length() + number.length());
        var copiedUpTo = 0;
        while (runStart >= 0) {
            var runEnd = runStart;
            while (runEnd < value.length() && value.charAt(runEnd) == placeholder) {
                runEnd += 1;
            }
            builder.append(value, copiedUpTo, runStart);
            for (int i = number.length(); i < runEnd - runStart; i += 1) {
                builder.append('0');
            }
            builder.append(number);
            copiedUpTo = runEnd;
            runStart = value.indexOf(placeholder, runEnd);
        }
        builder.append(value, copiedUpTo, value.length());
        return builder.toString();
    }

    private static @Nullable String applyNumberingIfPresent(final @Nullable String value, final int index) {
        return (value == null) ? null : applyNumbering(value, index);
    }

    /**
     * The character runs of which are replaced with repetition numbers.
     */
    public static final char placeholder = '$';
}

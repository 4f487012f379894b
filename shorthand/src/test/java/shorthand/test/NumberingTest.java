// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.test;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.LongStream;
import shorthand.abbrev.Numbering;
import shorthand.dom.Attribute;
import shorthand.dom.Node;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

final class NumberingTest {
    static LongStream provideSeeds() {
        return LongStream.generate(RandomUtils::generateRandomSeed).limit(8);
    }

    @ParameterizedTest
    @CsvSource({
        "item,0,item",
        "item$,0,item1",
        "item$,11,item12",
        "item$$,0,item01",
        "item$$$,41,item042",
        "item$$,122,item123",
        "$-$$-x,2,3-03-x",
        "$$$$,9,0010",
    })
    void stringNumberingWorks(final String value, final int index, final String expected) {
        assertThat(Numbering.applyNumbering(value, index)).isEqualTo(expected);
    }

    @Test
    void nodeNumberingSkipsTagsNamesAndFlags() {
        final var node = new Node(
            "h$",
            "id$",
            List.of("c$", "plain"),
            List.of(Attribute.flag("flag$"), Attribute.of("data-$", "v$")),
            "text $$",
            List.of(Node.empty("child"))
        );
        final var numbered = Numbering.applyNumbering(node, 1);
        assertThat(numbered.tag()).isEqualTo("h$");
        assertThat(numbered.id()).isEqualTo("id2");
        assertThat(numbered.classes()).containsExactly("c2", "plain");
        assertThat(numbered.attributes()).containsExactly(Attribute.flag("flag$"), Attribute.of("data-$", "v2"));
        assertThat(numbered.text()).isEqualTo("text 02");
        assertThat(node.id()).isEqualTo("id$");
    }

    @Test
    void nodeNumberingReachesDescendants() {
        final var child = new Node("span", null, List.of("deep$"), List.of(), null, List.of());
        final var parent = Node.empty("p").withAppendedChildren(List.of(child));
        final var numbered = Numbering.applyNumbering(parent, 4);
        assertThat(numbered.children().get(0).classes()).containsExactly("deep5");
    }

    @Test
    void repeatNodesKeepsRepetitionOrder() {
        final var nodes = List.of(
            new Node("a", null, List.of("x$"), List.of(), null, List.of()),
            new Node("b", null, List.of("y$"), List.of(), null, List.of())
        );
        final var repeated = Numbering.repeatNodes(nodes, 3);
        assertThat(repeated).extracting(Node::tag).containsExactly("a", "b", "a", "b", "a", "b");
        assertThat(repeated).extracting(node -> node.classes().get(0))
            .containsExactly("x1", "y1", "x2", "y2", "x3", "y3");
    }

    @Test
    void cloneNodesCopiesWithoutNumbering() {
        final var child = new Node("i", null, List.of("n$"), List.of(), null, List.of());
        final var nodes = List.of(Node.empty("a").withAppendedChildren(List.of(child)));
        final var clones = Numbering.cloneNodes(nodes);
        assertThat(clones).isEqualTo(nodes);
        assertThat(clones.get(0)).isNotSameAs(nodes.get(0));
        assertThat(clones.get(0).children().get(0)).isNotSameAs(child);
        assertThat(clones.get(0).children().get(0).classes()).containsExactly("n$");
    }

    @Test
    void numberingOneCloneLeavesTheOtherAlone() {
        final var original = List.of(new Node("c", "c$", List.of(), List.of(), null, List.of()));
        final var first = Numbering.cloneNodes(original);
        final var second = Numbering.cloneNodes(original);
        final var numbered = Numbering.numberNodes(first, 6);
        assertThat(numbered.get(0).id()).isEqualTo("c7");
        assertThat(first.get(0).id()).isEqualTo("c$");
        assertThat(second.get(0).id()).isEqualTo("c$");
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void generatedNumbersArePaddedAndInRange(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        for (int round = 0; round < 25; round += 1) {
            final var count = random.nextInt(1, 150);
            final var width = random.nextInt(1, 5);
            final var nodes = ExpanderTest.expectNodes("i.c" + "$".repeat(width) + "*" + count);
            assertThat(nodes).hasSize(count);
            for (int i = 0; i < count; i += 1) {
                final var className = nodes.get(i).classes().get(0);
                assertThat(className).startsWith("c");
                final var digits = className.substring(1);
                assertThat(digits).matches(digitsPattern);
                assertThat(digits.length()).isGreaterThanOrEqualTo(width);
                final var value = Integer.parseInt(digits);
                assertThat(value).isEqualTo(i + 1).isBetween(1, count);
                if (digits.length() > width) {
                    assertThat(digits).doesNotStartWith("0");
                }
            }
        }
    }

    private static final Pattern digitsPattern = Pattern.compile("[0-9]+");
}

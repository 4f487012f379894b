// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.test;

import java.util.List;
import shorthand.abbrev.AbbreviationError;
import shorthand.abbrev.ErrorKind;
import shorthand.abbrev.Expander;
import shorthand.abbrev.Expansion;
import shorthand.dom.Node;
import shorthand.dom.Serializer;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class ExpanderTest {
    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t\n"})
    void blankAbbreviationIsRejected(final String abbreviation) {
        final var error = expectFailure(abbreviation);
        assertThat(error.kind()).isEqualTo(ErrorKind.EMPTY_ABBREVIATION);
        assertThat(error.message()).isEqualTo("Abbreviation is empty");
        assertThat(error.position()).isEmpty();
    }

    @Test
    void singleElementWorks() {
        assertThat(expectHtml("div")).isEqualTo("<div></div>");
    }

    @Test
    void implicitTagIsDiv() {
        assertThat(expectHtml(".foo")).isEqualTo("<div class=\"foo\"></div>");
        assertThat(expectHtml("#main")).isEqualTo("<div id=\"main\"></div>");
    }

    @Test
    void numberedListWorks() {
        assertThat(expectHtml("ul>li.item$*3")).isEqualTo("""
            <ul>
              <li class="item1"></li>
              <li class="item2"></li>
              <li class="item3"></li>
            </ul>""");
    }

    @Test
    void siblingsStayAtTopLevel() {
        assertThat(expectHtml("a+b")).isEqualTo("<a></a>\n<b></b>");
        assertThat(expectNodes("a+b")).extracting(Node::tag).containsExactly("a", "b");
    }

    @Test
    void siblingsInsideChildrenStayTogether() {
        assertThat(expectHtml("section>h2{Hello}+p")).isEqualTo("""
            <section>
              <h2>Hello</h2>
              <p></p>
            </section>""");
    }

    @Test
    void numberingIsZeroPadded() {
        assertThat(expectHtml("p#item$$.item$$*3")).isEqualTo("""
            <p id="item01" class="item01"></p>
            <p id="item02" class="item02"></p>
            <p id="item03" class="item03"></p>""");
    }

    @Test
    void elementNamesAreNeverNumbered() {
        assertThat(expectNodes("item$$*3")).extracting(Node::tag).containsExactly("item$$", "item$$", "item$$");
        assertThat(expectHtml(".item$$*2")).isEqualTo("""
            <div class="item01"></div>
            <div class="item02"></div>""");
    }

    @Test
    void groupChildrenAreIndependentCopies() {
        final var nodes = expectNodes("(a+b)>c");
        assertThat(nodes).extracting(Node::tag).containsExactly("a", "b");
        final var first = nodes.get(0).children().get(0);
        final var second = nodes.get(1).children().get(0);
        assertThat(first).isEqualTo(second);
        assertThat(first).isNotSameAs(second);
        assertThat(expectHtml("(a+b)>c")).isEqualTo("""
            <a>
              <c></c>
            </a>
            <b>
              <c></c>
            </b>""");
    }

    @Test
    void repeatedGroupIsNumberedPerRepetition() {
        assertThat(expectHtml("(a.x$+b.y$)*2")).isEqualTo("""
            <a class="x1"></a>
            <b class="y1"></b>
            <a class="x2"></a>
            <b class="y2"></b>""");
    }

    @Test
    void multiplierAppliesBeforeChildren() {
        final var nodes = expectNodes("a*3>b");
        assertThat(nodes).hasSize(3);
        for (final var node : nodes) {
            assertThat(node.tag()).isEqualTo("a");
            assertThat(node.children()).extracting(Node::tag).containsExactly("b");
        }
        assertThat(nodes.get(0).children().get(0)).isNotSameAs(nodes.get(1).children().get(0));
    }

    @Test
    void childrenOfRepeatedParentAreNotNumbered() {
        assertThat(expectHtml("ul>li.p$*2>a{Link $}")).isEqualTo("""
            <ul>
              <li class="p1">
                <a>Link $</a>
              </li>
              <li class="p2">
                <a>Link $</a>
              </li>
            </ul>""");
    }

    @Test
    void repeatedGroupNumbersItsWholeSubtree() {
        assertThat(expectHtml("(li>a{Link $})*2")).isEqualTo("""
            <li>
              <a>Link 1</a>
            </li>
            <li>
              <a>Link 2</a>
            </li>""");
    }

    @Test
    void nestedMultipliersNumberInnermostFirst() {
        assertThat(expectHtml("(li.in$*2)*2")).isEqualTo("""
            <li class="in1"></li>
            <li class="in2"></li>
            <li class="in1"></li>
            <li class="in2"></li>""");
    }

    @Test
    void childExpressionEndsAtGroupBoundary() {
        assertThat(expectHtml("(div>p)+footer")).isEqualTo("""
            <div>
              <p></p>
            </div>
            <footer></footer>""");
    }

    @Test
    void trailingWhitespaceIsIgnored() {
        assertThat(expectHtml("div  ")).isEqualTo("<div></div>");
        assertThat(expectHtml("(a+b)  \n")).isEqualTo("<a></a>\n<b></b>");
    }

    @Test
    void duplicateIdIsRejected() {
        assertError("div#x#y", ErrorKind.DUPLICATE_ID, 5);
    }

    @Test
    void unclosedAttributeSetIsRejected() {
        assertError("div[", ErrorKind.UNCLOSED_ATTRIBUTE_SET, 3);
        assertError("div[a=b", ErrorKind.UNCLOSED_ATTRIBUTE_SET, 3);
    }

    @Test
    void unclosedTextIsRejected() {
        assertError("div{hello", ErrorKind.UNCLOSED_TEXT, 3);
        assertError("div{hello\\", ErrorKind.UNCLOSED_TEXT, 3);
    }

    @Test
    void unclosedGroupIsRejected() {
        assertError("(a+b", ErrorKind.UNCLOSED_GROUP, 0);
        assertError("p>(a>(b)", ErrorKind.UNCLOSED_GROUP, 2);
    }

    @Test
    void unclosedQuoteIsRejected() {
        assertError("a[x=\"y]", ErrorKind.UNCLOSED_QUOTE, 4);
        assertError("a[x='y\\'", ErrorKind.UNCLOSED_QUOTE, 4);
    }

    @Test
    void invalidMultiplierIsRejected() {
        assertError("a*", ErrorKind.INVALID_MULTIPLIER, 1);
        assertError("a*>b", ErrorKind.INVALID_MULTIPLIER, 1);
        assertError("a*0", ErrorKind.INVALID_MULTIPLIER, 1);
        assertError("a*99999999999", ErrorKind.INVALID_MULTIPLIER, 1);
    }

    @Test
    void oversizedRepetitionIsRejected() {
        assertError("(a+b)*1500000000", ErrorKind.INVALID_MULTIPLIER, 5);
        assertError("a*1000001", ErrorKind.INVALID_MULTIPLIER, 1);
        assertError("(a>b)*600000", ErrorKind.INVALID_MULTIPLIER, 5);
        assertThat(expectNodes("(a+b)*1000")).hasSize(2000);
    }

    @Test
    void oversizedChildAttachmentIsRejected() {
        assertError("a*2000>b*1000", ErrorKind.EXPANSION_TOO_LARGE, 6);
        assertError("ul>li*1000>p*1001", ErrorKind.EXPANSION_TOO_LARGE, 10);
    }

    @Test
    void missingAttributeValueIsRejected() {
        assertError("a[x=]", ErrorKind.EXPECTED_ATTRIBUTE_VALUE, 4);
        assertError("a[x= y]", ErrorKind.EXPECTED_ATTRIBUTE_VALUE, 4);
    }

    @Test
    void missingIdentifierIsRejected() {
        assertError("a#", ErrorKind.EXPECTED_IDENTIFIER, 1);
        assertError("a.", ErrorKind.EXPECTED_IDENTIFIER, 1);
        assertError("a.b.>c", ErrorKind.EXPECTED_IDENTIFIER, 3);
    }

    @Test
    void unexpectedEndIsRejected() {
        assertError("a>", ErrorKind.UNEXPECTED_END, 2);
        assertError("a+", ErrorKind.UNEXPECTED_END, 2);
        assertError("a>  ", ErrorKind.UNEXPECTED_END, 2);
    }

    @Test
    void unexpectedCharacterIsRejected() {
        assertError("a b", ErrorKind.UNEXPECTED_CHARACTER, 1);
        assertError("a)", ErrorKind.UNEXPECTED_CHARACTER, 1);
        assertError("a!", ErrorKind.UNEXPECTED_CHARACTER, 1);
        assertError("()", ErrorKind.UNEXPECTED_CHARACTER, 1);
        assertError("+a", ErrorKind.UNEXPECTED_CHARACTER, 0);
        assertError("a*2*3", ErrorKind.UNEXPECTED_CHARACTER, 3);
        assertError("a[x=\"y\"z]", ErrorKind.UNEXPECTED_CHARACTER, 7);
        assertError("a{x}b", ErrorKind.UNEXPECTED_CHARACTER, 4);
    }

    @Test
    void excessiveNestingIsRejected() {
        final var error = expectFailure("a>".repeat(200) + "a");
        assertThat(error.kind()).isEqualTo(ErrorKind.NESTING_TOO_DEEP);
        assertThat(expectNodes("a>".repeat(100) + "a")).hasSize(1);
    }

    @Test
    void errorDescriptionPointsAtTheOffendingCharacter() {
        final var error = expectFailure("div#x#y");
        assertThat(error.describe("div#x#y")).isEqualTo("Element already has an id at offset 5\ndiv#x#y\n     ^");
    }

    @Test
    void renderingIsIdempotent() {
        final var expansion = (Expansion.Success) Expander.expand("nav>ul>li.nav-$*4>a[href=#$]{Item $}");
        final var first = Serializer.toHtml(expansion.nodes());
        final var second = Serializer.toHtml(expansion.nodes());
        assertThat(first).isEqualTo(second).isEqualTo(expansion.html());
    }

    @ParameterizedTest
    @ValueSource(strings = {"ul>li.item$*3", "(a+b)>c*2", "div#x#y", "a[x=\"y]", "p{text"})
    void expansionIsDeterministic(final String abbreviation) {
        assertThat(Expander.expand(abbreviation)).isEqualTo(Expander.expand(abbreviation));
    }

    static String expectHtml(final String abbreviation) {
        final var expansion = Expander.expand(abbreviation);
        assertThat(expansion).isInstanceOf(Expansion.Success.class);
        return ((Expansion.Success) expansion).html();
    }

    static List<Node> expectNodes(final String abbreviation) {
        final var expansion = Expander.expand(abbreviation);
        assertThat(expansion).isInstanceOf(Expansion.Success.class);
        return ((Expansion.Success) expansion).nodes();
    }

    static AbbreviationError expectFailure(final String abbreviation) {
        final var expansion = Expander.expand(abbreviation);
        assertThat(expansion).isInstanceOf(Expansion.Failure.class);
        return ((Expansion.Failure) expansion).error();
    }

    private static void assertError(final String abbreviation, final ErrorKind kind, final int position) {
        final var error = expectFailure(abbreviation);
        assertThat(error.kind()).as("error kind for %s", abbreviation).isEqualTo(kind);
        assertThat(error.position()).as("error position for %s", abbreviation).hasValue(position);
    }
}

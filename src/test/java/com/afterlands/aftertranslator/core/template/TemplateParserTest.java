package com.afterlands.aftertranslator.core.template;

import com.afterlands.aftertranslator.api.exception.TemplateException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateParserTest {

    private final TemplateParser parser = new TemplateParser();

    @Test
    void simpleTemplateHasNoBranches() throws TemplateException {
        ParsedTemplate parsed = parser.parse("Hello, {name}!");

        assertThat(parsed.isPluralized()).isFalse();
        assertThat(parsed.branches()).isEmpty();
        assertThat(parsed.defaultText().source()).isEqualTo("Hello, {name}!");
    }

    @Test
    void parsesEveryGuardForm() throws TemplateException {
        ParsedTemplate parsed = parser.parse("{0} foo | {1, 2} bar | {..5} baz | {10..} qux | {20..30} quux | fizz");

        assertThat(parsed.isPluralized()).isTrue();
        assertThat(parsed.branches()).extracting(PluralBranch::guard).containsExactly(
                new PluralGuard.Match(List.of(0L)),
                new PluralGuard.Match(List.of(1L, 2L)),
                new PluralGuard.RangeTo(5),
                new PluralGuard.RangeFrom(10),
                new PluralGuard.Range(20, 30)
        );
        assertThat(parsed.branches()).extracting(b -> b.text().source())
                .containsExactly("foo", "bar", "baz", "qux", "quux");
        assertThat(parsed.defaultText().source()).isEqualTo("fizz");
    }

    @Test
    void guardSyntaxRoundTrips() throws TemplateException {
        ParsedTemplate parsed = parser.parse("{-3, 4} a | {..-1} b | {7..} c | {1..2} d | e");

        assertThat(parsed.branches()).extracting(b -> b.guard().syntax())
                .containsExactly("{-3, 4}", "{..-1}", "{7..}", "{1..2}");
    }

    @Test
    void doublePipeIsLiteral() throws TemplateException {
        ParsedTemplate plural = parser.parse("{1} a || b | c || d");
        assertThat(plural.branches()).hasSize(1);
        assertThat(plural.branches().get(0).text().source()).isEqualTo("a | b");
        assertThat(plural.defaultText().source()).isEqualTo("c | d");

        ParsedTemplate simple = parser.parse("left || right");
        assertThat(simple.isPluralized()).isFalse();
        assertThat(simple.defaultText().source()).isEqualTo("left | right");
    }

    @Test
    void oddPipeRunEndsBranch() {
        assertThat(parser.splitBranches("{1} a ||| b")).containsExactly("{1} a ||", "b");
    }

    @Test
    void pipeInsideGraphemeClusterDoesNotSplit() {
        assertThat(parser.splitBranches("{1} a |\u0301 b")).containsExactly("{1} a |\u0301 b");
    }

    @Test
    void missingClosingBraceIsRejected() {
        assertThatThrownBy(() -> parser.parse("{0} foo | {1 bar | baz"))
                .isInstanceOf(TemplateException.class)
                .hasMessageContaining("failed to parse rule for '{1 bar', expected '}'");
    }

    @Test
    void missingOpeningBraceIsRejected() {
        assertThatThrownBy(() -> parser.parse("{0} foo | 1} bar | baz"))
                .isInstanceOf(TemplateException.class)
                .hasMessageContaining("failed to parse rule for '1} bar', expected '{'");

        assertThatThrownBy(() -> parser.parse("{0} foo | ..2} bar | baz"))
                .isInstanceOf(TemplateException.class)
                .hasMessageContaining("expected '{'");
    }

    @Test
    void nonNumericValuesAreRejected() {
        assertThatThrownBy(() -> parser.parse("{0} foo | {one} bar | baz"))
                .isInstanceOf(TemplateException.class)
                .hasMessageContaining("value 'one' in match rule for '{one} bar'");

        assertThatThrownBy(() -> parser.parse("{0} foo | {1, two} bar | baz"))
                .hasMessageContaining("value 'two' in match rule");

        assertThatThrownBy(() -> parser.parse("{0} foo | {..two} bar | baz"))
                .hasMessageContaining("'to' value in range-to rule");

        assertThatThrownBy(() -> parser.parse("{0} foo | {two..} bar | baz"))
                .hasMessageContaining("'from' value in range-from rule");

        assertThatThrownBy(() -> parser.parse("{0} foo | {one..5} bar | baz"))
                .hasMessageContaining("'from' value in range rule");

        assertThatThrownBy(() -> parser.parse("{0} foo | {2....5} bar | baz"))
                .hasMessageContaining("'to' value in range rule");

        assertThatThrownBy(() -> parser.parse("{0} foo | {2.5} bar | baz"))
                .hasMessageContaining("value '2.5' in match rule");
    }

    @Test
    void reversedRangeIsRejected() {
        assertThatThrownBy(() -> parser.parse("{5..2} foo | bar"))
                .isInstanceOf(TemplateException.class)
                .hasMessageContaining("'from' is greater than 'to'");
    }

    @Test
    void guardedLastBranchIsRejected() {
        assertThatThrownBy(() -> parser.parse("{0} none | {1} one"))
                .isInstanceOf(TemplateException.class)
                .hasMessageContaining("default branch")
                .satisfies(e -> assertThat(((TemplateException) e).getTemplate()).isEqualTo("{0} none | {1} one"));
    }

    @Test
    void defaultBranchMayStartWithPlaceholder() throws TemplateException {
        ParsedTemplate parsed = parser.parse("{0} none | {?} items");

        assertThat(parsed.defaultText().source()).isEqualTo("{?} items");
    }

    @Test
    void pipeRunsAndClustersInOneTemplate() {
        assertThat(parser.splitBranches("{1} a || b |\u0301 c | {2} d ||| e | f"))
                .containsExactly("{1} a || b |\u0301 c", "{2} d ||", "e", "f");
        assertThat(parser.splitBranches("{1} a ||\u0301 b")).containsExactly("{1} a", "|\u0301 b");
    }
}

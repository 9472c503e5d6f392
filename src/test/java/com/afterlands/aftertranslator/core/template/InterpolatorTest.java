package com.afterlands.aftertranslator.core.template;

import com.afterlands.aftertranslator.api.exception.TemplateException;
import com.afterlands.aftertranslator.api.model.Context;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class InterpolatorTest {

    private final Interpolator interpolator = new Interpolator();

    @Test
    void resolvesNamedPositionalAndCountTokens() {
        Context context = Context.of("a", 1).with("b", 2).with("c", 3).withCount(5);

        String result = interpolator.interpolate(
                "a = {a}, b = {1}, a = {}, b = {}, c = {}, c = {2}, c = {c}, count = {?}", context);

        assertThat(result).isEqualTo("a = 1, b = 2, a = 1, b = 2, c = 3, c = 3, c = 3, count = 5");
    }

    @Test
    void escapesBraces() {
        assertThat(interpolator.interpolate("a = {{{a}}}", Context.of("a", 1))).isEqualTo("a = {1}");
        assertThat(interpolator.interpolate("{{", Context.empty())).isEqualTo("{");
        assertThat(interpolator.interpolate("}}", Context.empty())).isEqualTo("}");
        assertThat(interpolator.interpolate("{{name}}", Context.of("name", "x"))).isEqualTo("{name}");
    }

    @Test
    void keepsUnmatchedTokensVerbatim() {
        Context context = Context.of("name", "Bob");

        assertThat(interpolator.interpolate("Hello {name}, {missing}!", context)).isEqualTo("Hello Bob, {missing}!");
        assertThat(interpolator.interpolate("{5} and {}{}", context)).isEqualTo("{5} and Bob{}");
        assertThat(interpolator.interpolate("count = {?}", context)).isEqualTo("count = {?}");
        assertThat(interpolator.interpolate("{ other }", context)).isEqualTo("{ other }");
    }

    @Test
    void keepsUnbalancedBracesVerbatim() {
        assertThat(interpolator.interpolate("foo {bar", Context.of("bar", 1))).isEqualTo("foo {bar");
        assertThat(interpolator.interpolate("}{", Context.empty())).isEqualTo("}{");
        assertThat(interpolator.interpolate("{", Context.empty())).isEqualTo("{");
        assertThat(interpolator.interpolate("{a {b}", Context.of("b", 2))).isEqualTo("{a 2");
    }

    @Test
    void trimsWhitespaceInsideBraces() {
        assertThat(interpolator.interpolate("Hi { name }", Context.of("name", "Ann"))).isEqualTo("Hi Ann");
    }

    @Test
    void countFallsBackToCountValue() {
        assertThat(interpolator.interpolate("{?} items", Context.of("count", 7))).isEqualTo("7 items");
    }

    @Test
    void formatsNumbersWithoutLocale() {
        assertThat(Interpolator.format(2.5)).isEqualTo("2.5");
        assertThat(Interpolator.format(3.0)).isEqualTo("3");
        assertThat(Interpolator.format(0.1)).isEqualTo("0.1");
        assertThat(Interpolator.format(1e20)).isEqualTo("100000000000000000000");
        assertThat(Interpolator.format(1.5f)).isEqualTo("1.5");
        assertThat(Interpolator.format(new BigDecimal("10.500"))).isEqualTo("10.5");
        assertThat(Interpolator.format(-42L)).isEqualTo("-42");
        assertThat(Interpolator.format(Double.NaN)).isEqualTo("NaN");
        assertThat(Interpolator.format(true)).isEqualTo("true");
    }

    @Test
    void compiledTextSplitsPartsAndTokens() {
        CompiledText compiled = interpolator.compile("Hello {name}, you have {?} new {}");

        assertThat(compiled.parts()).containsExactly("Hello ", ", you have ", " new ", "");
        assertThat(compiled.tokens()).extracting(CompiledText.Token::kind).containsExactly(
                CompiledText.Kind.NAMED, CompiledText.Kind.COUNT, CompiledText.Kind.POSITIONAL);
        assertThat(compiled.hasTokens()).isTrue();
        assertThat(interpolator.compile("plain").hasTokens()).isFalse();
    }

    @Test
    void countTokenFallsBackToExplicitCount() throws TemplateException {
        ParsedTemplate template = new TemplateParser(interpolator).parse("{1} one {count} | {count} many");

        assertThat(template.defaultText().render(Context.ofCount(5))).isEqualTo("5 many");
        assertThat(template.defaultText().render(Context.of("count", "all").withCount(5))).isEqualTo("all many");
        assertThat(interpolator.interpolate("{count}", Context.empty())).isEqualTo("{count}");
    }

    @Test
    void onlyAsciiDigitsArePositional() {
        Context context = Context.of("a", 1).with("b", 2).with("c", 3).with("\u0663", "three");

        assertThat(interpolator.interpolate("{2}", context)).isEqualTo("3");
        assertThat(interpolator.interpolate("{\u0663}", context)).isEqualTo("three");
        assertThat(interpolator.interpolate("{\u0663}", Context.of("a", 1))).isEqualTo("{\u0663}");
    }
}

package com.afterlands.aftertranslator.api.model;

import com.afterlands.aftertranslator.api.exception.LocaleParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocaleTest {

    @Test
    void everyTagParsesBackToItsLocale() throws LocaleParseException {
        for (Locale locale : Locale.values()) {
            assertThat(Locale.fromTag(locale.tag())).isSameAs(locale);
            assertThat(Locale.fromTag(locale.languageTag())).isSameAs(locale);
        }
    }

    @Test
    void parentChainsStopAfterOneStep() {
        for (Locale locale : Locale.values()) {
            if (locale.isBase()) {
                assertThat(locale.parentFallback()).isEmpty();
            } else {
                Locale parent = locale.parentFallback().orElseThrow();
                assertThat(parent.isBase()).isTrue();
                assertThat(parent.language()).isEqualTo(locale.language());
                assertThat(parent.parentFallback()).isEmpty();
            }
        }
    }

    @Test
    void regionalVariantFallsBackToBaseLanguage() {
        assertThat(Locale.ENGLISH_UNITED_STATES.parentFallback()).contains(Locale.ENGLISH);
        assertThat(Locale.CHINESE_TAIWAN.parentFallback()).contains(Locale.CHINESE);
        assertThat(Locale.ENGLISH.parentFallback()).isEmpty();
    }

    @Test
    void fromTagIgnoresCaseAndSeparator() throws LocaleParseException {
        assertThat(Locale.fromTag("en")).isSameAs(Locale.ENGLISH);
        assertThat(Locale.fromTag("EN-us")).isSameAs(Locale.ENGLISH_UNITED_STATES);
        assertThat(Locale.fromTag(" pt_br ")).isSameAs(Locale.PORTUGUESE_BRAZIL);
        assertThat(Locale.fromTag("zh-TW")).isSameAs(Locale.CHINESE_TAIWAN);
    }

    @Test
    void unknownTagIsRejected() {
        assertThatThrownBy(() -> Locale.fromTag("foo"))
                .isInstanceOf(LocaleParseException.class)
                .hasMessageContaining("'foo'")
                .satisfies(e -> assertThat(((LocaleParseException) e).getTag()).isEqualTo("foo"));

        assertThat(Locale.lookup("en_XX")).isEmpty();
        assertThat(Locale.lookup(null)).isEmpty();
        assertThat(Locale.lookup("")).isEmpty();
    }

    @Test
    void exposesTagForms() {
        Locale locale = Locale.PORTUGUESE_BRAZIL;

        assertThat(locale.tag()).isEqualTo("pt_BR");
        assertThat(locale.languageTag()).isEqualTo("pt-BR");
        assertThat(locale.language()).isEqualTo("pt");
        assertThat(locale.region()).isEqualTo("BR");
        assertThat(locale.toString()).isEqualTo("pt_BR");
        assertThat(locale.toJavaLocale()).isEqualTo(new java.util.Locale("pt", "BR"));
        assertThat(Locale.ENGLISH.region()).isNull();
    }

    @Test
    void baseLooksUpLanguageCode() {
        assertThat(Locale.base("fr")).contains(Locale.FRENCH);
        assertThat(Locale.base("FR")).contains(Locale.FRENCH);
        assertThat(Locale.base("xx")).isEmpty();
    }
}

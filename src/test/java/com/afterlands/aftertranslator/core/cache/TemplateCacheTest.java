package com.afterlands.aftertranslator.core.cache;

import com.afterlands.aftertranslator.api.exception.TemplateException;
import com.afterlands.aftertranslator.core.template.ParsedTemplate;
import com.afterlands.aftertranslator.core.template.TemplateParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateCacheTest {

    private final TemplateCache cache = new TemplateCache(new TemplateParser(), 100, 30);

    @Test
    void parsesOnceAndReusesResult() throws TemplateException {
        ParsedTemplate first = cache.get("{0} none | {?} some");
        ParsedTemplate second = cache.get("{0} none | {?} some");

        assertThat(second).isSameAs(first);
        assertThat(cache.getStats().hitCount()).isEqualTo(1);
        assertThat(cache.getStats().missCount()).isEqualTo(1);
        assertThat(cache.formatStats()).startsWith("Templates: ").contains("/100 entries");
    }

    @Test
    void malformedTemplateIsNeverCached() {
        String malformed = "{0} none | {1 one | other";

        assertThatThrownBy(() -> cache.get(malformed)).isInstanceOf(TemplateException.class);
        assertThat(cache.getIfPresent(malformed)).isNull();
        assertThatThrownBy(() -> cache.get(malformed)).isInstanceOf(TemplateException.class);
    }

    @Test
    void invalidateRemovesEntries() throws TemplateException {
        cache.get("a");
        cache.get("b");

        cache.invalidate("a");
        assertThat(cache.getIfPresent("a")).isNull();
        assertThat(cache.getIfPresent("b")).isNotNull();

        cache.invalidateAll();
        assertThat(cache.getIfPresent("b")).isNull();
    }
}

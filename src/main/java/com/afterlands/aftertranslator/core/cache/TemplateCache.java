package com.afterlands.aftertranslator.core.cache;

import com.afterlands.aftertranslator.api.exception.TemplateException;
import com.afterlands.aftertranslator.core.template.ParsedTemplate;
import com.afterlands.aftertranslator.core.template.TemplateParser;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Cache of parsed templates.
 *
 * <p>Keyed by the raw template text, so identical templates shared by
 * several locales or ids are parsed once. Malformed templates are never
 * cached: every lookup of one raises the same {@link TemplateException}.</p>
 */
public class TemplateCache {

    private final Cache<String, ParsedTemplate> templates;
    private final TemplateParser parser;
    private final long maxSize;

    /**
     * Creates a template cache.
     *
     * @param parser Parser used on a miss
     * @param maxSize Maximum number of templates
     * @param expireAfterAccessMinutes TTL after access (minutes)
     */
    public TemplateCache(@NotNull TemplateParser parser, long maxSize, long expireAfterAccessMinutes) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
        this.maxSize = maxSize;

        this.templates = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterAccess(expireAfterAccessMinutes, TimeUnit.MINUTES)
                .recordStats()
                .build();
    }

    /**
     * Gets a parsed template, parsing and caching it on a miss.
     *
     * @param template Raw template
     * @return Parsed template
     * @throws TemplateException If the template is malformed
     */
    @NotNull
    public ParsedTemplate get(@NotNull String template) throws TemplateException {
        ParsedTemplate cached = templates.getIfPresent(template);
        if (cached != null) {
            return cached;
        }

        ParsedTemplate parsed = parser.parse(template);
        templates.put(template, parsed);
        return parsed;
    }

    /**
     * Gets a parsed template without parsing.
     *
     * @param template Raw template
     * @return Cached template or null
     */
    @Nullable
    public ParsedTemplate getIfPresent(@NotNull String template) {
        return templates.getIfPresent(template);
    }

    public void invalidate(@NotNull String template) {
        templates.invalidate(template);
    }

    public void invalidateAll() {
        templates.invalidateAll();
    }

    @NotNull
    public CacheStats getStats() {
        return templates.stats();
    }

    public long getSize() {
        return templates.estimatedSize();
    }

    /**
     * Gets formatted statistics string.
     *
     * @return Statistics summary
     */
    @NotNull
    public String formatStats() {
        return String.format(
                "Templates: %d/%d entries (%.2f%% hit rate)",
                getSize(), maxSize, getStats().hitRate() * 100
        );
    }
}

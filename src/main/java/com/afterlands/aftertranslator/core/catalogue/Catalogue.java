package com.afterlands.aftertranslator.core.catalogue;

import com.afterlands.aftertranslator.api.model.Locale;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw message templates of one locale.
 *
 * <p>Structure: {@code domain -> id -> template}. Lookups are exact; fallback
 * between locales is the translator's job.</p>
 *
 * <p>A catalogue obtained from a frozen {@link CatalogueBag} is read-only:
 * every mutator throws {@link UnsupportedOperationException}.</p>
 */
public class Catalogue {

    private final Locale locale;
    private final Map<String, Map<String, String>> messages;
    private final boolean frozen;

    /**
     * Creates an empty catalogue.
     *
     * @param locale Locale of every message in this catalogue
     */
    public Catalogue(@NotNull Locale locale) {
        this(locale, new HashMap<>(), false);
    }

    private Catalogue(
            @NotNull Locale locale,
            @NotNull Map<String, Map<String, String>> messages,
            boolean frozen
    ) {
        this.locale = Objects.requireNonNull(locale, "locale cannot be null");
        this.messages = messages;
        this.frozen = frozen;
    }

    /**
     * Creates a catalogue pre-filled with messages.
     *
     * @param locale Locale
     * @param messages Domain -> id -> template (copied)
     * @return New catalogue
     */
    @NotNull
    public static Catalogue withMessages(
            @NotNull Locale locale,
            @NotNull Map<String, Map<String, String>> messages
    ) {
        Catalogue catalogue = new Catalogue(locale);
        messages.forEach((domain, ids) -> ids.forEach((id, template) -> catalogue.insert(domain, id, template)));
        return catalogue;
    }

    @NotNull
    public Locale locale() {
        return locale;
    }

    /**
     * Gets a template.
     *
     * @param domain Domain
     * @param id Message id
     * @return Template exactly as inserted, or empty
     */
    @NotNull
    public Optional<String> get(@NotNull String domain, @NotNull String id) {
        Map<String, String> domainMap = messages.get(domain);
        if (domainMap == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(domainMap.get(id));
    }

    /**
     * Inserts a template, overwriting any previous one for the same id.
     *
     * @param domain Domain
     * @param id Message id
     * @param template Raw template
     * @return Previous template, or null
     */
    @Nullable
    public String insert(@NotNull String domain, @NotNull String id, @NotNull String template) {
        checkMutable();
        Objects.requireNonNull(domain, "domain cannot be null");
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(template, "template cannot be null");

        return messages.computeIfAbsent(domain, k -> new HashMap<>()).put(id, template);
    }

    /**
     * Removes a template.
     *
     * @return Removed template, or null
     */
    @Nullable
    public String remove(@NotNull String domain, @NotNull String id) {
        checkMutable();
        Map<String, String> domainMap = messages.get(domain);
        if (domainMap == null) {
            return null;
        }

        String removed = domainMap.remove(id);
        if (domainMap.isEmpty()) {
            messages.remove(domain);
        }
        return removed;
    }

    /**
     * Removes a whole domain.
     *
     * @return Removed id -> template map, or null
     */
    @Nullable
    public Map<String, String> removeDomain(@NotNull String domain) {
        checkMutable();
        return messages.remove(domain);
    }

    /**
     * Gets all templates of a domain.
     *
     * @param domain Domain
     * @return Unmodifiable id -> template view, or empty
     */
    @NotNull
    public Optional<Map<String, String>> messages(@NotNull String domain) {
        Map<String, String> domainMap = messages.get(domain);
        return domainMap == null ? Optional.empty() : Optional.of(Collections.unmodifiableMap(domainMap));
    }

    /**
     * Gets domain names, sorted.
     */
    @NotNull
    public List<String> domains() {
        List<String> domains = new ArrayList<>(messages.keySet());
        Collections.sort(domains);
        return domains;
    }

    /**
     * Gets total number of templates.
     */
    public int size() {
        return messages.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Copies every template of another catalogue into this one.
     *
     * <p>Templates of {@code other} win on id collisions.</p>
     *
     * @param other Catalogue to merge (must share this locale)
     */
    void mergeFrom(@NotNull Catalogue other) {
        checkMutable();
        if (other.locale != locale) {
            throw new IllegalArgumentException(
                    "Cannot merge catalogue [" + other.locale.tag() + "] into [" + locale.tag() + "]");
        }
        other.messages.forEach((domain, ids) ->
                messages.computeIfAbsent(domain, k -> new HashMap<>()).putAll(ids));
    }

    @NotNull
    Catalogue copy() {
        Catalogue copy = new Catalogue(locale);
        copy.mergeFrom(this);
        return copy;
    }

    @NotNull
    Catalogue frozenCopy() {
        Map<String, Map<String, String>> copy = new HashMap<>();
        messages.forEach((domain, ids) -> copy.put(domain, Map.copyOf(ids)));
        return new Catalogue(locale, Collections.unmodifiableMap(copy), true);
    }

    private void checkMutable() {
        if (frozen) {
            throw new UnsupportedOperationException("Catalogue [" + locale.tag() + "] is frozen");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Catalogue)) {
            return false;
        }
        Catalogue other = (Catalogue) o;
        return locale == other.locale && messages.equals(other.messages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(locale, messages);
    }

    @Override
    public String toString() {
        return "Catalogue[" + locale.tag() + ", domains=" + domains() + ", messages=" + size() + "]";
    }
}

package com.afterlands.aftertranslator.core.catalogue;

import com.afterlands.aftertranslator.api.model.Locale;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * All catalogues known to a translator, at most one per locale.
 *
 * <p>Built incrementally (possibly from several loaders), then frozen with
 * {@link #freeze()} and shared read-only for the rest of the process.</p>
 *
 * <h3>Merging:</h3>
 * <ul>
 *     <li>Inserting a catalogue for a new locale stores a copy of it</li>
 *     <li>Inserting a catalogue for a known locale merges its domains; the
 *     later insert wins on id collisions</li>
 *     <li>Inserting the same catalogue twice leaves the bag as after one insert</li>
 * </ul>
 */
public class CatalogueBag {

    private final Map<Locale, Catalogue> catalogues;
    private final boolean frozen;

    /**
     * Creates an empty bag.
     */
    public CatalogueBag() {
        this(new EnumMap<>(Locale.class), false);
    }

    private CatalogueBag(@NotNull Map<Locale, Catalogue> catalogues, boolean frozen) {
        this.catalogues = catalogues;
        this.frozen = frozen;
    }

    /**
     * Creates a bag from catalogues, inserted in order.
     *
     * @param catalogues Catalogues
     * @return New bag
     */
    @NotNull
    public static CatalogueBag of(@NotNull Catalogue... catalogues) {
        CatalogueBag bag = new CatalogueBag();
        for (Catalogue catalogue : catalogues) {
            bag.insert(catalogue);
        }
        return bag;
    }

    /**
     * Inserts a catalogue, merging with the existing one of the same locale.
     *
     * @param catalogue Catalogue to insert (copied, not aliased)
     */
    public void insert(@NotNull Catalogue catalogue) {
        Objects.requireNonNull(catalogue, "catalogue cannot be null");
        checkMutable();

        Catalogue existing = catalogues.get(catalogue.locale());
        if (existing == null) {
            catalogues.put(catalogue.locale(), catalogue.copy());
        } else {
            existing.mergeFrom(catalogue);
        }
    }

    /**
     * Inserts every catalogue of another bag.
     *
     * @param other Bag to merge
     */
    public void merge(@NotNull CatalogueBag other) {
        Objects.requireNonNull(other, "other cannot be null");
        for (Catalogue catalogue : other.catalogues.values()) {
            insert(catalogue);
        }
    }

    /**
     * Gets the catalogue of a locale.
     *
     * @param locale Locale
     * @return Catalogue, or empty
     */
    @NotNull
    public Optional<Catalogue> get(@NotNull Locale locale) {
        return Optional.ofNullable(catalogues.get(locale));
    }

    /**
     * Gets every locale that has a catalogue.
     */
    @NotNull
    public Set<Locale> locales() {
        return Collections.unmodifiableSet(catalogues.keySet());
    }

    public int size() {
        return catalogues.size();
    }

    public boolean isEmpty() {
        return catalogues.isEmpty();
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Returns a deep read-only copy of this bag.
     *
     * <p>Later changes to this bag do not reach the copy.</p>
     *
     * @return Frozen bag (this instance if already frozen)
     */
    @NotNull
    public CatalogueBag freeze() {
        if (frozen) {
            return this;
        }

        Map<Locale, Catalogue> copy = new EnumMap<>(Locale.class);
        catalogues.forEach((locale, catalogue) -> copy.put(locale, catalogue.frozenCopy()));
        return new CatalogueBag(Collections.unmodifiableMap(copy), true);
    }

    /**
     * Gets statistics about the bag.
     *
     * @return Statistics string
     */
    @NotNull
    public String getStats() {
        int messages = catalogues.values().stream().mapToInt(Catalogue::size).sum();
        long domains = catalogues.values().stream().mapToLong(c -> c.domains().size()).sum();
        return String.format("Locales: %d, Domains: %d, Messages: %d", catalogues.size(), domains, messages);
    }

    private void checkMutable() {
        if (frozen) {
            throw new UnsupportedOperationException("CatalogueBag is frozen");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CatalogueBag)) {
            return false;
        }
        return catalogues.equals(((CatalogueBag) o).catalogues);
    }

    @Override
    public int hashCode() {
        return catalogues.hashCode();
    }

    @Override
    public String toString() {
        return "CatalogueBag[" + getStats() + "]";
    }
}

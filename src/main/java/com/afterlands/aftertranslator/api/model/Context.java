package com.afterlands.aftertranslator.api.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Values supplied to a single translation call.
 *
 * <p>Immutable. Holds named values in insertion order (so they can also be
 * referenced positionally with {@code {}} or {@code {0}}) and an optional
 * count that selects the plural branch.</p>
 *
 * <h3>Count resolution:</h3>
 * <ol>
 *     <li>The value set with {@link #withCount(Object)}, if any</li>
 *     <li>Otherwise the named value {@code count}, if any</li>
 * </ol>
 *
 * <p>A {@code {count}} token resolves the other way round: the named value
 * first, then the explicit count.</p>
 *
 * <h3>Example:</h3>
 * <pre>{@code
 * Context context = Context.of("name", "Saif").withCount(3);
 * translator.translate(Locale.ENGLISH, "messages", "apples", context);
 * }</pre>
 */
public final class Context {

    /**
     * Name of the implicit count value.
     */
    public static final String COUNT_KEY = "count";

    private static final Context EMPTY = new Context(Collections.emptyMap(), null);

    private final Map<String, Object> values;
    private final Object count;

    private Context(@NotNull Map<String, Object> values, @Nullable Object count) {
        this.values = values;
        this.count = count;
    }

    @NotNull
    public static Context empty() {
        return EMPTY;
    }

    @NotNull
    public static Context of(@NotNull String key, @NotNull Object value) {
        return EMPTY.with(key, value);
    }

    @NotNull
    public static Context of(@NotNull Placeholder... placeholders) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Placeholder p : placeholders) {
            map.put(p.key(), p.value());
        }
        return new Context(Collections.unmodifiableMap(map), null);
    }

    /**
     * Creates a context from a map, keeping the map's iteration order.
     *
     * @param values Named values
     * @return New context
     */
    @NotNull
    public static Context fromMap(@NotNull Map<String, ?> values) {
        Objects.requireNonNull(values, "values cannot be null");
        Map<String, Object> map = new LinkedHashMap<>();
        values.forEach((key, value) -> map.put(
                Objects.requireNonNull(key, "key cannot be null"),
                Objects.requireNonNull(value, "value cannot be null for key " + key)
        ));
        return new Context(Collections.unmodifiableMap(map), null);
    }

    /**
     * Creates a context carrying only a count.
     *
     * @param count Plural count
     * @return New context
     */
    @NotNull
    public static Context ofCount(@NotNull Object count) {
        return EMPTY.withCount(count);
    }

    /**
     * Returns a copy with one more named value (replacing an existing one).
     *
     * @param key Placeholder key
     * @param value Value
     * @return New context
     */
    @NotNull
    public Context with(@NotNull String key, @NotNull Object value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");

        Map<String, Object> map = new LinkedHashMap<>(values);
        map.put(key, value);
        return new Context(Collections.unmodifiableMap(map), count);
    }

    /**
     * Returns a copy with an explicit plural count.
     *
     * @param count Count (normally an integral number)
     * @return New context
     */
    @NotNull
    public Context withCount(@NotNull Object count) {
        Objects.requireNonNull(count, "count cannot be null");
        return new Context(values, count);
    }

    /**
     * Gets a named value.
     */
    @NotNull
    public Optional<Object> get(@NotNull String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Gets a value by position (insertion order).
     */
    @NotNull
    public Optional<Object> get(int index) {
        if (index < 0 || index >= values.size()) {
            return Optional.empty();
        }
        return Optional.of(new ArrayList<>(values.values()).get(index));
    }

    /**
     * Gets the plural count.
     *
     * @return Explicit count, else the {@code count} value, else empty
     */
    @NotNull
    public Optional<Object> count() {
        if (count != null) {
            return Optional.of(count);
        }
        return get(COUNT_KEY);
    }

    public boolean hasCount() {
        return count().isPresent();
    }

    @NotNull
    public List<Placeholder> placeholders() {
        List<Placeholder> list = new ArrayList<>(values.size());
        values.forEach((key, value) -> list.add(Placeholder.of(key, value)));
        return list;
    }

    /**
     * Named values, in insertion order.
     *
     * @return Unmodifiable view
     */
    @NotNull
    public Map<String, Object> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty() && count == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Context)) {
            return false;
        }
        Context other = (Context) o;
        return values.equals(other.values) && Objects.equals(count, other.count);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, count);
    }

    @Override
    public String toString() {
        return "Context{values=" + values + (count != null ? ", count=" + count : "") + "}";
    }
}

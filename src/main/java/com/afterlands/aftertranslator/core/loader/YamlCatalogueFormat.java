package com.afterlands.aftertranslator.core.loader;

import org.jetbrains.annotations.NotNull;
import org.yaml.snakeyaml.error.YAMLException;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * YAML catalogue files.
 *
 * <h3>Key Format:</h3>
 * <pre>
 * # Flat key
 * welcome: "Welcome!"
 *
 * # Nested sections are joined with dots: menu.title
 * menu:
 *   title: "Main menu"
 *
 * # Lists are joined with line breaks
 * motd:
 *   - "Line one"
 *   - "Line two"
 *
 * # Plural guards stay in one string
 * apples: "{0} no apples | {1} one apple | {?} apples"
 * </pre>
 */
public class YamlCatalogueFormat implements CatalogueFormat {

    private static final Set<String> EXTENSIONS = Set.of("yml", "yaml");

    @Override
    @NotNull
    public String name() {
        return "yaml";
    }

    @Override
    @NotNull
    public Set<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    @NotNull
    public Map<String, String> parse(@NotNull String content, @NotNull Path file) throws CatalogueLoadException {
        Object root;
        try {
            root = TextScalarResolver.newYaml().load(content);
        } catch (YAMLException e) {
            throw new CatalogueLoadException(CatalogueLoadException.Kind.INVALID_CONTENT, file,
                    "Failed to parse YAML file " + file.getFileName() + ": " + e.getMessage(), e);
        }

        Map<String, String> messages = new LinkedHashMap<>();
        if (root == null) {
            return messages;
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new CatalogueLoadException(CatalogueLoadException.Kind.INVALID_CONTENT, file,
                    "Invalid YAML file " + file.getFileName() + ": expected a mapping at the top level");
        }

        loadSection(map, "", messages, file);
        return messages;
    }

    /**
     * Recursively flattens a mapping.
     */
    private void loadSection(
            @NotNull Map<?, ?> section,
            @NotNull String currentPath,
            @NotNull Map<String, String> messages,
            @NotNull Path file
    ) throws CatalogueLoadException {
        for (Map.Entry<?, ?> entry : section.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String fullKey = currentPath.isEmpty() ? key : currentPath + "." + key;
            Object value = entry.getValue();

            if (value instanceof Map<?, ?> subsection) {
                loadSection(subsection, fullKey, messages, file);
            } else if (value instanceof String text) {
                messages.put(fullKey, text);
            } else if (value instanceof List<?> lines) {
                messages.put(fullKey, joinLines(lines, fullKey, file));
            } else {
                throw invalidType(value, fullKey, file);
            }
        }
    }

    private String joinLines(List<?> lines, String key, Path file) throws CatalogueLoadException {
        StringBuilder text = new StringBuilder();
        for (Object line : lines) {
            if (!(line instanceof String)) {
                throw invalidType(line, key, file);
            }
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append((String) line);
        }
        return text.toString();
    }

    private static CatalogueLoadException invalidType(Object value, String key, Path file) {
        String type = value == null ? "null" : value.getClass().getSimpleName();
        return new CatalogueLoadException(CatalogueLoadException.Kind.INVALID_CONTENT, file,
                "Invalid YAML file " + file.getFileName() + ": expected a string for key '" + key + "' but found " + type);
    }
}

package com.afterlands.aftertranslator.core.loader;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * JSON catalogue files.
 *
 * <p>Nested objects are joined with dots and arrays of strings with line
 * breaks, the same as {@link YamlCatalogueFormat}.</p>
 */
public class JsonCatalogueFormat implements CatalogueFormat {

    private static final Set<String> EXTENSIONS = Set.of("json");

    @Override
    @NotNull
    public String name() {
        return "json";
    }

    @Override
    @NotNull
    public Set<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    @NotNull
    public Map<String, String> parse(@NotNull String content, @NotNull Path file) throws CatalogueLoadException {
        Map<String, String> messages = new LinkedHashMap<>();
        if (content.isBlank()) {
            return messages;
        }

        JsonElement root;
        try {
            root = JsonParser.parseString(content);
        } catch (JsonParseException e) {
            throw new CatalogueLoadException(CatalogueLoadException.Kind.INVALID_CONTENT, file,
                    "Failed to parse JSON file " + file.getFileName() + ": " + e.getMessage(), e);
        }

        if (!root.isJsonObject()) {
            throw new CatalogueLoadException(CatalogueLoadException.Kind.INVALID_CONTENT, file,
                    "Invalid JSON file " + file.getFileName() + ": expected an object at the top level");
        }

        loadObject(root.getAsJsonObject(), "", messages, file);
        return messages;
    }

    private void loadObject(
            @NotNull JsonObject object,
            @NotNull String currentPath,
            @NotNull Map<String, String> messages,
            @NotNull Path file
    ) throws CatalogueLoadException {
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            String fullKey = currentPath.isEmpty() ? entry.getKey() : currentPath + "." + entry.getKey();
            JsonElement value = entry.getValue();

            if (value.isJsonObject()) {
                loadObject(value.getAsJsonObject(), fullKey, messages, file);
            } else if (isString(value)) {
                messages.put(fullKey, value.getAsString());
            } else if (value.isJsonArray()) {
                messages.put(fullKey, joinLines(value.getAsJsonArray(), fullKey, file));
            } else {
                throw invalidType(value, fullKey, file);
            }
        }
    }

    private String joinLines(JsonArray lines, String key, Path file) throws CatalogueLoadException {
        StringBuilder text = new StringBuilder();
        for (JsonElement line : lines) {
            if (!isString(line)) {
                throw invalidType(line, key, file);
            }
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(line.getAsString());
        }
        return text.toString();
    }

    private static boolean isString(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }

    private static CatalogueLoadException invalidType(JsonElement value, String key, Path file) {
        return new CatalogueLoadException(CatalogueLoadException.Kind.INVALID_CONTENT, file,
                "Invalid JSON file " + file.getFileName() + ": expected a string for key '" + key + "' but found " + value);
    }
}

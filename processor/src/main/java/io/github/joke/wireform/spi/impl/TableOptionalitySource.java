package io.github.joke.wireform.spi.impl;

import io.github.joke.wireform.spi.FieldOptionalitySource;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Optionality table keyed {@code Message.field}. The message part may be the wire class's simple
 * or canonical name; values are {@code true} (optional) or {@code false} (required).
 */
public final class TableOptionalitySource implements FieldOptionalitySource {

    private final Map<String, Boolean> entries;

    private TableOptionalitySource(Map<String, Boolean> entries) {
        this.entries = Map.copyOf(entries);
    }

    public static TableOptionalitySource of(Map<String, Boolean> entries) {
        return new TableOptionalitySource(entries);
    }

    public static TableOptionalitySource fromProperties(Properties properties) {
        Map<String, Boolean> entries = new HashMap<>();
        for (String key : properties.stringPropertyNames()) {
            String value = properties.getProperty(key).trim();
            if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                throw new IllegalArgumentException(
                        "Optionality entry " + key + " must be true or false but was '" + value + "'");
            }
            entries.put(key.trim(), Boolean.parseBoolean(value));
        }
        return new TableOptionalitySource(entries);
    }

    public static TableOptionalitySource load(Path path) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    @Override
    public Optional<Boolean> fieldOptionality(String wireMessage, String wireField) {
        Boolean answer = entries.get(wireMessage + "." + wireField);
        if (answer == null) {
            answer = entries.get(simpleName(wireMessage) + "." + wireField);
        }
        return Optional.ofNullable(answer);
    }

    public int size() {
        return entries.size();
    }

    private static String simpleName(String wireMessage) {
        return wireMessage.substring(wireMessage.lastIndexOf('.') + 1);
    }
}

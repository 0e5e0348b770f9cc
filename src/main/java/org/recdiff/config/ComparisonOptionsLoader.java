package org.recdiff.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.recdiff.engine.ComparisonOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads comparison options from JSON or YAML files.
 *
 * <p>The file holds one object whose keys are the option names accepted by
 * {@link ComparisonOptions#fromMap}; options that are not listed keep their defaults.
 */
public final class ComparisonOptionsLoader {
    private ComparisonOptionsLoader() {}

    public static ComparisonOptions load(final Path optionsPath) throws IOException {
        Objects.requireNonNull(optionsPath, "optionsPath");
        final Path normalized = optionsPath.toAbsolutePath().normalize();
        if (!Files.exists(normalized)) {
            throw new IllegalArgumentException("options path does not exist: " + normalized);
        }
        if (!Files.isRegularFile(normalized)) {
            throw new IllegalArgumentException("options path must be a file: " + normalized);
        }

        final String content = Files.readString(normalized, StandardCharsets.UTF_8);
        return parse(content, normalized.getFileName().toString());
    }

    public static ComparisonOptions parse(final String content, final String sourceName) {
        Objects.requireNonNull(content, "content");
        final String normalizedName = Objects.requireNonNull(sourceName, "sourceName")
                .trim()
                .toLowerCase(Locale.ROOT);
        if (content.isBlank()) {
            throw new IllegalArgumentException("options file is empty: " + sourceName);
        }
        if (normalizedName.endsWith(".yaml") || normalizedName.endsWith(".yml")) {
            return ComparisonOptions.fromMap(parseYaml(content));
        }
        return ComparisonOptions.fromMap(Document.parse(content));
    }

    private static Map<String, Object> parseYaml(final String content) {
        final Object root = new Yaml().load(content);
        if (root == null) {
            throw new IllegalArgumentException("options file is empty");
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new IllegalArgumentException("options root must be an object");
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : rawMap.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return normalized;
    }
}

package org.jsondelta.value;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a document from a JSON or YAML file, chosen by file extension.
 */
public final class DocumentLoader {
    private DocumentLoader() {}

    public static JsonValue load(final Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        final Path normalized = path.toAbsolutePath().normalize();
        if (!Files.isRegularFile(normalized)) {
            throw new IllegalArgumentException("document path must be a file: " + normalized);
        }
        final String content = Files.readString(normalized, StandardCharsets.UTF_8);
        return parse(content, normalized.getFileName().toString());
    }

    public static JsonValue parse(final String content, final String sourceName) {
        Objects.requireNonNull(content, "content");
        final String normalizedName = Objects.requireNonNull(sourceName, "sourceName")
                .trim()
                .toLowerCase(Locale.ROOT);
        if (normalizedName.endsWith(".yaml") || normalizedName.endsWith(".yml")) {
            return parseYaml(content);
        }
        return BsonJson.parse(content);
    }

    public static JsonValue parseYaml(final String content) {
        final Object root;
        try {
            root = new Yaml().load(content);
        } catch (final YAMLException exception) {
            throw new IllegalArgumentException("invalid YAML document: " + exception.getMessage(), exception);
        }
        if (root == null) {
            throw new IllegalArgumentException("document is empty");
        }
        return BsonJson.fromJava(root);
    }
}

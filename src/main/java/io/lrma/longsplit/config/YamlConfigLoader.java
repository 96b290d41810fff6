package io.lrma.longsplit.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a longsplit YAML file into the flat {@code key=value} form the CLI uses.
 *
 * <p>The {@code common} section applies to every command; the command's own section (for
 * example {@code segment}) is layered on top. Nested mappings become dotted keys. Other top-level
 * sections are ignored, so one file can serve several commands.
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * @param path YAML file; a missing file is not an error
   * @param command command whose section is merged over {@code common}
   * @return settings keyed like the CLI arguments, or empty when {@code path} does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or has an unsupported shape
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(command, "command").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Invalid YAML in " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException(path + " must hold a mapping of sections");
    }

    Map<String, String> settings = new LinkedHashMap<>();
    addSection(root, COMMON_SECTION, settings);
    addSection(root, section, settings);
    return Optional.of(Map.copyOf(settings));
  }

  private static void addSection(Map<?, ?> root, String name, Map<String, String> settings) {
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      // a null or non-text top-level key cannot name a section
      if (entry.getKey() instanceof String key && key.trim().toLowerCase(Locale.ROOT).equals(name)) {
        if (entry.getValue() == null) {
          return;
        }
        if (!(entry.getValue() instanceof Map<?, ?> body)) {
          throw new IllegalArgumentException("Section '" + name + "' must be a mapping");
        }
        collect(body, "", settings);
        return;
      }
    }
  }

  private static void collect(Map<?, ?> body, String prefix, Map<String, String> settings) {
    for (Map.Entry<?, ?> entry : body.entrySet()) {
      String key = keyOf(entry.getKey(), prefix);
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        collect(nested, dotted, settings);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("Setting '" + dotted + "' is a list; only scalars are supported");
      } else {
        settings.put(dotted, value == null ? "" : value.toString());
      }
    }
  }

  private static String keyOf(Object rawKey, String prefix) {
    String where = prefix.isEmpty() ? "top level of the section" : "'" + prefix + "'";
    if (rawKey == null) {
      throw new IllegalArgumentException("Null key (~) under " + where);
    }
    if (!(rawKey instanceof String key)) {
      throw new IllegalArgumentException("Key " + rawKey + " under " + where + " is not text");
    }
    if (key.isBlank()) {
      throw new IllegalArgumentException("Blank key under " + where);
    }
    return key;
  }
}

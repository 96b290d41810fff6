package io.lrma.longsplit.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active CLI command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    // A model chosen on the command line wins over a template file inherited from YAML.
    if (cliCopy.containsKey("model") && !cliCopy.containsKey("templateFile")) {
      merged.remove("templateFile");
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("segment".equalsIgnoreCase(mode)) {
      requirePresent(effective, "in", mode);
      requirePresent(effective, "out", mode);
    }
    String exporter = trim(effective.get("metricsExporter"));
    if (!exporter.isEmpty() && !exporter.equalsIgnoreCase("otlp") && !exporter.equalsIgnoreCase("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
  }

  private static void requirePresent(Map<String, String> effective, String key, String mode) {
    if (trim(effective.get(key)).isEmpty()) {
      throw new IllegalArgumentException(key + " is required for " + mode);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}

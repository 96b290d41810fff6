package io.lrma.longsplit.api;

import java.util.Locale;
import java.util.Map;

/**
 * Helpers shared by subcommands that mix flags with YAML/key-value configuration.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} (or {@code --config}) entry.
   *
   * @param args mutable key/value arguments
   * @return trimmed config path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Resolves a boolean that may be given either as a flag ({@code --dry-run}) or a key ({@code dryRun=true}).
   *
   * @param input parsed arguments
   * @param flag flag spelling
   * @param effective merged configuration
   * @param key configuration key
   * @return {@code true} when the flag is present or the key is truthy
   */
  static boolean flagOrKey(CliInput input, String flag, Map<String, String> effective, String key) {
    return input.hasFlag(flag) || parseBoolean(effective, key);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    return parseBoolean(map, key, false);
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return normalized.equals("true") || normalized.equals("yes") || normalized.equals("1");
  }
}

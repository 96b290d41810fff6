package io.lrma.longsplit.config;

import io.lrma.longsplit.application.pipeline.SegmentationUseCase;
import io.lrma.longsplit.domain.segment.SegmentTagCodec;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI options.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode CLI command ({@code segment})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for commands without configuration
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "segment" -> buildSegmentDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildSegmentDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("out", "");
    map.put("threads", Integer.toString(SegmentConfig.defaultThreads()));
    map.put("simple", "false");
    map.put("keepDelimiters", "false");
    map.put("model", ArrayModels.DEFAULT_MODEL);
    map.put("templateFile", "");
    map.put("segmentsTag", SegmentTagCodec.DEFAULT_TAG);
    map.put("progressInterval", Integer.toString(SegmentationUseCase.DEFAULT_PROGRESS_INTERVAL));
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }
}

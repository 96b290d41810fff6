package io.lrma.longsplit.config;

import io.lrma.longsplit.application.pipeline.SegmentationUseCase;
import io.lrma.longsplit.domain.segment.SegmentTagCodec;
import io.lrma.longsplit.domain.split.SplitMode;
import io.lrma.longsplit.infrastructure.exec.ExecutorFactories;
import io.lrma.longsplit.validation.Numbers;
import io.lrma.longsplit.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Settings for one {@code segment} run.
 * <p><strong>Why:</strong> Consolidates CLI flags, YAML values, and defaults so runs stay reproducible.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param input SAM/BAM file of annotated reads
 * @param output SAM/BAM file receiving array elements
 * @param threads requested worker count; values {@code <= 0} or above the processor count mean all processors
 * @param simple whether simple delimiter splitting replaces bounded-region splitting
 * @param keepDelimiters whether delimiter bases stay in the emitted elements
 * @param model built-in array model name
 * @param templateFile optional YAML layout overriding {@code model}
 * @param segmentsTag record tag carrying segment annotations
 * @param progressInterval reads between progress log lines; zero disables progress logging
 * @param allowOverwrite whether an existing output file may be replaced
 * @param dryRun whether to validate and report the plan without processing reads
 * @since 0.1.0
 * @see SegmentationUseCase
 */
public record SegmentConfig(
    Path input,
    Path output,
    int threads,
    boolean simple,
    boolean keepDelimiters,
    String model,
    Optional<Path> templateFile,
    String segmentsTag,
    int progressInterval,
    boolean allowOverwrite,
    boolean dryRun) {

  /** Largest accepted worker request. */
  public static final int MAX_THREADS = 1_024;

  /**
   * Normalizes values and enforces invariants.
   *
   * @throws IllegalArgumentException if the tag key, model, or progress interval is invalid
   */
  public SegmentConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
    model = Strings.requireNonBlank("model", Objects.requireNonNullElse(model, ArrayModels.DEFAULT_MODEL))
        .toLowerCase(Locale.ROOT);
    templateFile = Objects.requireNonNullElse(templateFile, Optional.empty());
    segmentsTag = Strings.requireTagKey("segmentsTag", Objects.requireNonNullElse(segmentsTag, SegmentTagCodec.DEFAULT_TAG));
    Numbers.requireRange("threads", threads, Integer.MIN_VALUE, MAX_THREADS);
    Numbers.requireRange("progressInterval", progressInterval, 0, Integer.MAX_VALUE);
    if (templateFile.isEmpty() && !ArrayModels.names().contains(model)) {
      throw new IllegalArgumentException("Unknown model '" + model + "'; expected one of " + ArrayModels.names());
    }
    if (input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
      throw new IllegalArgumentException("in and out must name different files");
    }
  }

  /**
   * Creates a configuration from flattened key/value options.
   *
   * @param options keys such as {@code in}, {@code out}, {@code threads}, {@code simple}
   * @return populated configuration
   * @throws IllegalArgumentException when values are invalid or {@code in}/{@code out} are missing
   */
  public static SegmentConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path input = parsePath("in", required(options, "in"));
    Path output = parsePath("out", required(options, "out"));

    String threadsRaw = trim(options.get("threads"));
    int threads =
        threadsRaw.isEmpty()
            ? defaultThreads()
            : Numbers.parseInt("threads", threadsRaw, Integer.MIN_VALUE, MAX_THREADS);

    String progressRaw = trim(options.get("progressInterval"));
    int progressInterval =
        progressRaw.isEmpty()
            ? SegmentationUseCase.DEFAULT_PROGRESS_INTERVAL
            : Numbers.parseInt("progressInterval", progressRaw, 0, Integer.MAX_VALUE);

    String templateRaw = trim(options.get("templateFile"));
    Optional<Path> templateFile =
        templateRaw.isEmpty() ? Optional.empty() : Optional.of(parsePath("templateFile", templateRaw));

    String model = trim(options.get("model"));
    String tag = trim(options.get("segmentsTag"));

    return new SegmentConfig(
        input,
        output,
        threads,
        parseBoolean("simple", options.get("simple"), false),
        parseBoolean("keepDelimiters", options.get("keepDelimiters"), false),
        model.isEmpty() ? ArrayModels.DEFAULT_MODEL : model,
        templateFile,
        tag.isEmpty() ? SegmentTagCodec.DEFAULT_TAG : tag,
        progressInterval,
        parseBoolean("allowOverwrite", options.get("allowOverwrite"), false),
        parseBoolean("dryRun", options.get("dryRun"), false));
  }

  /**
   * Returns the default worker request: one less than the available processors.
   *
   * @return default thread count before resolution
   */
  public static int defaultThreads() {
    return Runtime.getRuntime().availableProcessors() - 1;
  }

  /**
   * Resolves the worker count against the processors visible to the JVM.
   *
   * @return effective worker count, at least one
   */
  public int effectiveWorkers() {
    return ExecutorFactories.resolveWorkerCount(threads, Runtime.getRuntime().availableProcessors());
  }

  /**
   * Returns the configured matching policy.
   *
   * @return split mode
   */
  public SplitMode splitMode() {
    return simple ? SplitMode.SIMPLE : SplitMode.BOUNDED_REGION;
  }

  private static String required(Map<String, String> options, String key) {
    String value = trim(options.get(key));
    if (value.isEmpty()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  private static Path parsePath(String name, String raw) {
    String sanitized = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(sanitized);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + sanitized, ex);
    }
  }

  private static boolean parseBoolean(String name, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was '" + value + "')");
    };
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}

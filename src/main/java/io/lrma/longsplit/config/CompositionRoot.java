package io.lrma.longsplit.config;

import io.lrma.longsplit.application.pipeline.SegmentDecoder;
import io.lrma.longsplit.application.pipeline.SegmentationUseCase;
import io.lrma.longsplit.application.pipeline.SegmentationUseCase.PipelineSettings;
import io.lrma.longsplit.application.port.MetricsPort;
import io.lrma.longsplit.domain.split.ArrayElementStructure;
import io.lrma.longsplit.domain.split.BoundedRegionMatcher;
import io.lrma.longsplit.domain.split.DelimiterMatcher;
import io.lrma.longsplit.domain.split.SimpleDelimiterMatcher;
import io.lrma.longsplit.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.lrma.longsplit.infrastructure.sam.ProgramInfo;
import io.lrma.longsplit.infrastructure.sam.SamArrayElementSink;
import io.lrma.longsplit.infrastructure.sam.SamReadSource;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that wires the segmentation use case to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate configuration into a runnable pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the array layout from a built-in model or a template file.</li>
 *   <li>Pick the delimiter matcher for the configured split mode.</li>
 *   <li>Open the htsjdk read source and element sink and share the metrics adapter.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread.</p>
 *
 * @since 0.1.0
 * @see SegmentationUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;

  /** Creates a composition root exporting metrics through OpenTelemetry as configured by system properties. */
  public CompositionRoot() {
    this(new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param metrics metrics adapter handed to constructed use cases
   */
  public CompositionRoot(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the shared metrics adapter.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Resolves the array layout: the template file when configured, otherwise the named model.
   *
   * @param config run configuration
   * @return array layout
   * @throws IOException if the template file cannot be read
   * @throws IllegalArgumentException if the template or model is invalid
   */
  public static ArrayElementStructure structure(SegmentConfig config) throws IOException {
    if (config.templateFile().isPresent()) {
      return ArrayElementStructureLoader.load(config.templateFile().get());
    }
    return ArrayModels.get(config.model());
  }

  /**
   * Builds the matcher for the configured split mode.
   *
   * @param config run configuration
   * @param structure array layout
   * @return delimiter matcher
   */
  public static DelimiterMatcher matcher(SegmentConfig config, ArrayElementStructure structure) {
    return switch (config.splitMode()) {
      case SIMPLE -> SimpleDelimiterMatcher.fromStructure(structure, config.keepDelimiters());
      case BOUNDED_REGION -> new BoundedRegionMatcher(structure, config.keepDelimiters());
    };
  }

  /**
   * Opens the input and output files and assembles the segmentation pipeline.
   *
   * @param config run configuration
   * @param program provenance for the output header
   * @return ready-to-run use case owning the opened source and sink
   * @throws IOException if the template, input, or output cannot be opened
   */
  public SegmentationUseCase segmentUseCase(SegmentConfig config, ProgramInfo program) throws IOException {
    ArrayElementStructure structure = structure(config);
    DelimiterMatcher matcher = matcher(config, structure);
    PipelineSettings settings = new PipelineSettings(config.effectiveWorkers(), config.progressInterval());

    SamReadSource source = SamReadSource.open(config.input());
    SamArrayElementSink sink;
    try {
      sink = SamArrayElementSink.open(config.output(), source.header(), program);
    } catch (IOException | RuntimeException ex) {
      try {
        source.close();
      } catch (IOException closeFailure) {
        ex.addSuppressed(closeFailure);
      }
      throw ex;
    }
    log.debug(
        "Wired segmentation pipeline: {} elements in layout, {} matcher, {} workers",
        structure.size(),
        matcher.mode(),
        settings.workers());
    return new SegmentationUseCase(
        source, new SegmentDecoder(config.segmentsTag()), matcher, sink, metrics, settings);
  }

  /** Flushes and shuts down the metrics adapter when it holds exporter resources. */
  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter cleanly", ex);
      }
    }
  }
}

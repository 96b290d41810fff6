package io.lrma.longsplit.api;

import io.lrma.longsplit.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls telemetry keys out of the merged configuration and applies them as OpenTelemetry system
 * properties before the metrics adapter is built.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Validated telemetry options.
   *
   * @param exporter {@code otlp} or {@code none}; empty leaves the environment default
   * @param endpoint OTLP endpoint override
   * @param resourceAttributes {@code key=value} resource attribute override
   */
  record TelemetrySettings(
      Optional<String> exporter, Optional<String> endpoint, Optional<String> resourceAttributes) {

    boolean exportEnabled() {
      return exporter.map("otlp"::equals).orElse(false);
    }
  }

  /**
   * Removes telemetry keys from {@code args}, validates them, and sets the matching system properties.
   *
   * @param args mutable configuration map
   * @return the applied settings
   * @throws IllegalArgumentException when a value is invalid
   */
  static TelemetrySettings configureMetrics(Map<String, String> args) {
    TelemetrySettings settings = extract(args);
    settings.exporter().ifPresent(exporter -> {
      log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
      System.setProperty("otel.metrics.exporter", exporter);
    });
    settings.endpoint().ifPresent(endpoint -> {
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    });
    settings.resourceAttributes().ifPresent(attributes -> {
      log.debug("Configuring OTEL_RESOURCE_ATTRIBUTES override");
      System.setProperty("otel.resource.attributes", attributes);
    });
    return settings;
  }

  static TelemetrySettings extract(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return new TelemetrySettings(Optional.empty(), Optional.empty(), Optional.empty());
    }
    Optional<String> exporter = nonBlank(args.remove("metricsExporter"))
        .map(value -> value.toLowerCase(Locale.ROOT));
    exporter.ifPresent(value -> {
      if (!value.equals("otlp") && !value.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
    });
    Optional<String> endpoint = nonBlank(args.remove("otelEndpoint"));
    endpoint.ifPresent(TelemetryConfigurator::validateEndpoint);
    Optional<String> attributes = nonBlank(args.remove("otelResourceAttributes"));
    attributes.ifPresent(value ->
        Strings.requirePrintableAscii("otelResourceAttributes", value, MAX_RESOURCE_ATTRIBUTES_LENGTH));
    return new TelemetrySettings(exporter, endpoint, attributes);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static Optional<String> nonBlank(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }
}

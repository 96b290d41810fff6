package io.lrma.longsplit.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the meter used by {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Settings come from the {@code otel.*} system properties written by the CLI, falling back to
 * the matching {@code OTEL_*} environment variables. Exporter {@code none} (the default) yields a
 * no-op meter; {@code otlp} pushes to a gRPC collector every 30 seconds.
 */
public final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "io.lrma.longsplit";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;
  private static final String DEV_VERSION = "0.0.0-dev";

  private OpenTelemetryBootstrap() {}

  static MeterHandle initialize() {
    String exporter = setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "none")
        .toLowerCase(Locale.ROOT);
    if (exporter.equals("none")) {
      log.debug("Metrics export disabled");
      return MeterHandle.noop();
    }
    if (!exporter.equals("otlp")) {
      log.warn("Metrics exporter '{}' is not supported; metrics will not be exported", exporter);
      return MeterHandle.noop();
    }
    String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      MeterHandle handle = withReader(reader,
          parseResourceAttributes(setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", "")));
      log.info("Exporting metrics over OTLP to {}", endpoint);
      return handle;
    } catch (RuntimeException ex) {
      log.error("Could not start the OTLP metrics exporter for {}; metrics will not be exported", endpoint, ex);
      return MeterHandle.noop();
    }
  }

  static MeterHandle forTesting(MetricReader reader) {
    return withReader(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static MeterHandle withReader(MetricReader reader, Attributes extra) {
    String version = detectServiceVersion();
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "longsplit")
        .put(AttributeKey.stringKey("service.version"), version)
        .putAll(extra)
        .build()));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    return new MeterHandle(
        provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build(), provider);
  }

  /**
   * Parses {@code key=value} pairs separated by commas; entries without both parts are skipped.
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      int eq = entry.indexOf('=');
      String key = eq < 0 ? "" : entry.substring(0, eq).trim();
      String value = eq < 0 ? "" : entry.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        if (!entry.isBlank()) {
          log.warn("Skipping resource attribute '{}': expected key=value", entry.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  /**
   * Version of the running build, used for the service resource and the {@code @PG VN} field.
   *
   * @return jar manifest version, else the packaged Maven version, else {@code 0.0.0-dev}
   */
  public static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String manifest = pkg == null ? null : pkg.getImplementationVersion();
    if (manifest != null && !manifest.isBlank()) {
      return manifest;
    }
    try (InputStream in = OpenTelemetryBootstrap.class
        .getResourceAsStream("/META-INF/maven/io.lrma/longsplit/pom.properties")) {
      if (in == null) {
        return DEV_VERSION;
      }
      Properties props = new Properties();
      props.load(in);
      String version = props.getProperty("version", "");
      return version.isBlank() ? DEV_VERSION : version;
    } catch (IOException ex) {
      log.debug("pom.properties unreadable, reporting {}", DEV_VERSION, ex);
      return DEV_VERSION;
    }
  }

  private static String setting(String property, String envVar, String fallback) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(envVar);
    }
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  /** A meter plus the SDK provider behind it; the provider is null for the no-op meter. */
  static final class MeterHandle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterHandle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String action) {
      if (!result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("Metrics {} did not finish within {}s", action, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}

package io.lrma.longsplit.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttributeAndResource() {
    adapter.increment("segment.elements.written");
    adapter.increment("segment.elements.written");
    adapter.increment("segment.elements.written");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "segment.elements.written").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("segment.elements.written",
        point.getAttributes().get(AttributeKey.stringKey("longsplit.metric.key")));
    assertEquals("longsplit", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("io.lrma", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("segment.boundaries.found", 3);
    adapter.observe("segment.boundaries.found", 15);

    MetricData histogram = find(reader.collectAllMetrics(), "segment.boundaries.found").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(18.0, point.getSum());
  }

  @Test
  void sanitizeNameKeepsInstrumentNamesValid() {
    assertEquals("segment.reads.processed", OpenTelemetryMetricsAdapter.sanitizeName("segment.reads.processed"));
    assertEquals("m1st_pass", OpenTelemetryMetricsAdapter.sanitizeName("1st pass"));
    assertEquals("longsplit.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void resourceAttributesIgnoreMalformedEntries() {
    var attributes = OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=prod,broken, =x");

    assertEquals(1, attributes.size());
    assertEquals("prod", attributes.get(AttributeKey.stringKey("deployment.environment")));
  }

  @Test
  void serviceVersionIsAlwaysReported() {
    String version = OpenTelemetryBootstrap.detectServiceVersion();

    assertTrue(version != null && !version.isBlank());
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}

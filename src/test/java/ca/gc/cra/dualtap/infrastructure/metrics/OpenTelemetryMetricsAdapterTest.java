package ca.gc.cra.dualtap.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
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
    adapter.close();
  }

  private MetricData metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }

  @Test
  void counterCarriesKeyAndServiceResource() {
    adapter.increment("traffic.request.recorded");
    adapter.increment("traffic.request.recorded");
    adapter.forceFlush();

    MetricData counter = metric("traffic.request.recorded");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("traffic.request.recorded",
        point.getAttributes().get(AttributeKey.stringKey("dualtap.metric.key")));
    assertEquals("dualtap", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observationsBecomeHistograms() {
    adapter.observe("store.append.latencyNanos", 1_000L);
    adapter.observe("store.append.latencyNanos", 3_000L);
    adapter.forceFlush();

    MetricData histogram = metric("store.append.latencynanos");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000d, point.getSum());
  }

  @Test
  void namesAreSanitized() {
    assertEquals("m1st.metric", OpenTelemetryMetricsAdapter.sanitizeName("1st.metric"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.sanitizeName("A b"));
    assertEquals("dualtap.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("traffic.request.recorded", OpenTelemetryMetricsAdapter.sanitizeName("traffic.request.recorded"));
  }
}

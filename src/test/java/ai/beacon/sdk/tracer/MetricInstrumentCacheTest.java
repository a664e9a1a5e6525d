package ai.beacon.sdk.tracer;

import static org.assertj.core.api.Assertions.assertThat;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class MetricInstrumentCacheTest {
  private final InMemoryMetricReader reader = InMemoryMetricReader.create();
  private final SdkMeterProvider meterProvider =
      SdkMeterProvider.builder().registerMetricReader(reader).build();
  private final MetricInstrumentCache cache = new MetricInstrumentCache(meterProvider.get("test"));

  @AfterEach
  void tearDown() {
    meterProvider.close();
  }

  @Test
  void instrumentsAreCreatedOncePerName() {
    assertThat(cache.add("requests", 1, Attributes.empty())).isTrue();
    assertThat(cache.add("requests", 2, Attributes.empty())).isTrue();
    assertThat(cache.record("latency", 3.0, Attributes.empty())).isTrue();

    assertThat(cache.size()).isEqualTo(2);
    Collection<MetricData> metrics = reader.collectAllMetrics();
    assertThat(metrics)
        .filteredOn(metric -> metric.getName().equals("requests"))
        .singleElement()
        .satisfies(
            metric ->
                assertThat(metric.getLongSumData().getPoints())
                    .singleElement()
                    .satisfies(point -> assertThat(point.getValue()).isEqualTo(3L)));
  }

  @Test
  void otherKindForExistingNameIsDropped() {
    assertThat(cache.record("shared", 1.0, Attributes.empty())).isTrue();
    assertThat(cache.add("shared", 1, Attributes.empty())).isFalse();

    assertThat(cache.add("counter", 1, Attributes.empty())).isTrue();
    assertThat(cache.record("counter", 1.0, Attributes.empty())).isFalse();

    assertThat(cache.size()).isEqualTo(2);
  }
}

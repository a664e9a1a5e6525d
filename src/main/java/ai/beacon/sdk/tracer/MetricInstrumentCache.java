package ai.beacon.sdk.tracer;

import ai.beacon.sdk.constants.BeaconConstants;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazily created metric instruments keyed by name.
 *
 * <p>The first use of a name fixes its kind. A later call of the other kind for the same name is
 * dropped, it never re-creates the instrument.
 */
class MetricInstrumentCache {
  private static final Logger logger = LoggerFactory.getLogger(MetricInstrumentCache.class);

  private final Meter meter;
  private final Map<String, Object> instruments = new ConcurrentHashMap<>();

  MetricInstrumentCache(Meter meter) {
    this.meter = meter;
  }

  boolean record(String name, double value, Attributes attributes) {
    Object instrument =
        instruments.computeIfAbsent(name, key -> meter.histogramBuilder(key).build());
    if (!(instrument instanceof DoubleHistogram)) {
      logKindMismatch(name, "histogram");
      return false;
    }
    ((DoubleHistogram) instrument).record(value, attributes);
    return true;
  }

  boolean add(String name, long value, Attributes attributes) {
    Object instrument = instruments.computeIfAbsent(name, key -> meter.counterBuilder(key).build());
    if (!(instrument instanceof LongCounter)) {
      logKindMismatch(name, "counter");
      return false;
    }
    ((LongCounter) instrument).add(value, attributes);
    return true;
  }

  int size() {
    return instruments.size();
  }

  private static void logKindMismatch(String name, String requested) {
    logger.debug(
        "{} Metric '{}' already exists with a different kind, dropping {} value",
        BeaconConstants.LOG_PREFIX,
        name,
        requested);
  }
}

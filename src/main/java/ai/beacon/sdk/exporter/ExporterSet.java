package ai.beacon.sdk.exporter;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.logs.export.LogRecordExporter;
import io.opentelemetry.sdk.metrics.export.MetricExporter;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.Arrays;
import java.util.Objects;

/** The span, log and metric exporters for one destination */
public final class ExporterSet {
  private final SpanExporter spanExporter;
  private final LogRecordExporter logExporter;
  private final MetricExporter metricExporter;

  public ExporterSet(
      SpanExporter spanExporter, LogRecordExporter logExporter, MetricExporter metricExporter) {
    this.spanExporter = Objects.requireNonNull(spanExporter, "spanExporter");
    this.logExporter = Objects.requireNonNull(logExporter, "logExporter");
    this.metricExporter = Objects.requireNonNull(metricExporter, "metricExporter");
  }

  public SpanExporter getSpanExporter() {
    return spanExporter;
  }

  public LogRecordExporter getLogExporter() {
    return logExporter;
  }

  public MetricExporter getMetricExporter() {
    return metricExporter;
  }

  /** Shut down all three exporters */
  public CompletableResultCode shutdown() {
    return CompletableResultCode.ofAll(
        Arrays.asList(spanExporter.shutdown(), logExporter.shutdown(), metricExporter.shutdown()));
  }
}

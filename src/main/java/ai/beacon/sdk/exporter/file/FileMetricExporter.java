package ai.beacon.sdk.exporter.file;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.InstrumentType;
import io.opentelemetry.sdk.metrics.data.AggregationTemporality;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.export.MetricExporter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicBoolean;

/** Writes each metric export batch as one JSON line, with cumulative temporality */
public class FileMetricExporter implements MetricExporter {
  private final JsonLinesFileWriter writer;
  private final AtomicBoolean released = new AtomicBoolean();

  public FileMetricExporter(Path path) throws IOException {
    this.writer = new JsonLinesFileWriter(path);
  }

  /** Writes through a writer shared with other exporters, taking a reference to it. */
  public FileMetricExporter(JsonLinesFileWriter writer) {
    this.writer = writer.retain();
  }

  @Override
  public AggregationTemporality getAggregationTemporality(InstrumentType instrumentType) {
    return AggregationTemporality.CUMULATIVE;
  }

  @Override
  public CompletableResultCode export(Collection<MetricData> metrics) {
    if (metrics.isEmpty()) {
      return CompletableResultCode.ofSuccess();
    }
    String line = TelemetryJson.safeStringify(TelemetryJson.metricsToMap(metrics));
    try {
      writer.writeLines(Collections.singletonList(line));
      return CompletableResultCode.ofSuccess();
    } catch (IOException e) {
      return CompletableResultCode.ofExceptionalFailure(e);
    }
  }

  @Override
  public CompletableResultCode flush() {
    return CompletableResultCode.ofSuccess();
  }

  @Override
  public CompletableResultCode shutdown() {
    return FileExporters.release(writer, released);
  }

  @Override
  public String toString() {
    return "FileMetricExporter{path=" + writer.getPath() + "}";
  }
}

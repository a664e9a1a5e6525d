package ai.beacon.sdk.exporter;

import ai.beacon.sdk.config.TelemetryConfig;
import ai.beacon.sdk.constants.BeaconConstants;
import ai.beacon.sdk.exporter.file.FileLogRecordExporter;
import ai.beacon.sdk.exporter.file.FileMetricExporter;
import ai.beacon.sdk.exporter.file.FileSpanExporter;
import ai.beacon.sdk.exporter.file.JsonLinesFileWriter;
import ai.beacon.sdk.types.ExporterType;
import io.opentelemetry.exporter.logging.LoggingMetricExporter;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.logging.SystemOutLogRecordExporter;
import io.opentelemetry.exporter.otlp.http.logs.OtlpHttpLogRecordExporter;
import io.opentelemetry.exporter.otlp.http.logs.OtlpHttpLogRecordExporterBuilder;
import io.opentelemetry.exporter.otlp.http.metrics.OtlpHttpMetricExporter;
import io.opentelemetry.exporter.otlp.http.metrics.OtlpHttpMetricExporterBuilder;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporterBuilder;
import io.opentelemetry.exporter.otlp.logs.OtlpGrpcLogRecordExporter;
import io.opentelemetry.exporter.otlp.logs.OtlpGrpcLogRecordExporterBuilder;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporterBuilder;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporterBuilder;
import io.opentelemetry.sdk.logs.export.LogRecordExporter;
import io.opentelemetry.sdk.metrics.export.MetricExporter;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the exporter set for the configured {@link ExporterType} */
public class DefaultExporterFactory implements ExporterFactory {
  private static final Logger logger = LoggerFactory.getLogger(DefaultExporterFactory.class);

  @Override
  public CompletableFuture<ExporterSet> create(TelemetryConfig config) {
    try {
      return CompletableFuture.completedFuture(createExporters(config));
    } catch (Exception e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  ExporterSet createExporters(TelemetryConfig config) throws IOException {
    ExporterType type = config.getExporterType();

    if (type == ExporterType.FILE) {
      if (config.getFileExporterPath() != null) {
        return createFileExporters(Path.of(config.getFileExporterPath()));
      }
      logger.warn(
          "{} File exporter selected without a file path, falling back to OTLP",
          BeaconConstants.LOG_PREFIX);
    }

    if (type == ExporterType.CONSOLE) {
      return new ExporterSet(
          LoggingSpanExporter.create(),
          SystemOutLogRecordExporter.create(),
          LoggingMetricExporter.create());
    }

    if (type == ExporterType.OTLP_GRPC) {
      return createGrpcExporters(config);
    }

    return createHttpExporters(config);
  }

  private ExporterSet createFileExporters(Path path) throws IOException {
    // The three exporters share one writer; the factory's own reference is released on return
    try (JsonLinesFileWriter writer = new JsonLinesFileWriter(path)) {
      ExporterSet set =
          new ExporterSet(
              new FileSpanExporter(writer),
              new FileLogRecordExporter(writer),
              new FileMetricExporter(writer));
      logger.debug("{} Created file exporters for: {}", BeaconConstants.LOG_PREFIX, path);
      return set;
    }
  }

  private ExporterSet createGrpcExporters(TelemetryConfig config) {
    OtlpGrpcSpanExporterBuilder spanBuilder =
        OtlpGrpcSpanExporter.builder()
            .setEndpoint(signalEndpoint(config.getTracesEndpoint(), config, null));
    OtlpGrpcLogRecordExporterBuilder logBuilder =
        OtlpGrpcLogRecordExporter.builder()
            .setEndpoint(signalEndpoint(config.getLogsEndpoint(), config, null));
    OtlpGrpcMetricExporterBuilder metricBuilder =
        OtlpGrpcMetricExporter.builder()
            .setEndpoint(signalEndpoint(config.getMetricsEndpoint(), config, null));

    for (Map.Entry<String, String> header : config.getOtlpHeaders().entrySet()) {
      spanBuilder.addHeader(header.getKey(), header.getValue());
      logBuilder.addHeader(header.getKey(), header.getValue());
      metricBuilder.addHeader(header.getKey(), header.getValue());
    }

    logger.debug(
        "{} Created OTLP gRPC exporters for: {}",
        BeaconConstants.LOG_PREFIX,
        config.getOtlpEndpoint());
    return buildAll(spanBuilder::build, logBuilder::build, metricBuilder::build);
  }

  private ExporterSet createHttpExporters(TelemetryConfig config) {
    OtlpHttpSpanExporterBuilder spanBuilder =
        OtlpHttpSpanExporter.builder()
            .setEndpoint(
                signalEndpoint(
                    config.getTracesEndpoint(), config, BeaconConstants.TRACES_PATH));
    OtlpHttpLogRecordExporterBuilder logBuilder =
        OtlpHttpLogRecordExporter.builder()
            .setEndpoint(
                signalEndpoint(config.getLogsEndpoint(), config, BeaconConstants.LOGS_PATH));
    OtlpHttpMetricExporterBuilder metricBuilder =
        OtlpHttpMetricExporter.builder()
            .setEndpoint(
                signalEndpoint(
                    config.getMetricsEndpoint(), config, BeaconConstants.METRICS_PATH));

    for (Map.Entry<String, String> header : config.getOtlpHeaders().entrySet()) {
      spanBuilder.addHeader(header.getKey(), header.getValue());
      logBuilder.addHeader(header.getKey(), header.getValue());
      metricBuilder.addHeader(header.getKey(), header.getValue());
    }

    logger.debug(
        "{} Created OTLP HTTP exporters for: {}",
        BeaconConstants.LOG_PREFIX,
        config.getOtlpEndpoint());
    return buildAll(spanBuilder::build, logBuilder::build, metricBuilder::build);
  }

  /**
   * Endpoint for one signal. A per-signal override wins. For OTLP/HTTP a base endpoint without a
   * path gets the signal path appended; any other path is used as given.
   */
  static String signalEndpoint(String override, TelemetryConfig config, String signalPath) {
    if (override != null) {
      return override;
    }
    String base = config.getOtlpEndpoint();
    if (signalPath == null || base == null || base.isEmpty()) {
      return base;
    }
    int schemeEnd = base.indexOf("://");
    if (schemeEnd < 0) {
      return base;
    }
    String withoutScheme = base.substring(schemeEnd + 3);
    int pathStart = withoutScheme.indexOf('/');
    if (pathStart >= 0 && withoutScheme.substring(pathStart).equals("/")) {
      return base + signalPath;
    }
    return base;
  }

  // All three are built or none: a failure shuts down the ones already built
  private static ExporterSet buildAll(
      Supplier<? extends SpanExporter> spans,
      Supplier<? extends LogRecordExporter> logs,
      Supplier<? extends MetricExporter> metrics) {
    SpanExporter spanExporter = spans.get();
    LogRecordExporter logExporter = null;
    try {
      logExporter = logs.get();
      return new ExporterSet(spanExporter, logExporter, metrics.get());
    } catch (RuntimeException e) {
      spanExporter.shutdown();
      if (logExporter != null) {
        logExporter.shutdown();
      }
      throw e;
    }
  }
}

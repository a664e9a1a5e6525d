package ai.beacon.sdk.constants;

public final class BeaconConstants {

  public static final String LOG_PREFIX = "[Beacon]";
  public static final String SDK_LOGGER_NAME = "ai.beacon.sdk";
  public static final String OTEL_LOGGER_NAME = "io.opentelemetry";

  // Defaults
  public static final String DEFAULT_SERVICE_NAME = "beacon-service";
  public static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4318";
  public static final String HOST_TELEMETRY_OFF = "off";

  // OTLP HTTP signal paths, appended when the endpoint has no path of its own
  public static final String TRACES_PATH = "v1/traces";
  public static final String LOGS_PATH = "v1/logs";
  public static final String METRICS_PATH = "v1/metrics";

  // Resource attribute keys
  public static final String SERVICE_NAME_ATTRIBUTE = "service.name";
  public static final String SERVICE_VERSION_ATTRIBUTE = "service.version";
  public static final String SESSION_ID_ATTRIBUTE = "session.id";

  // Pre-initialization buffer
  public static final int MAX_BUFFER_SIZE = 1000;
  public static final int DRAIN_CHUNK_SIZE = 50;

  // Export scheduling
  public static final long DEFAULT_METRIC_EXPORT_INTERVAL_MILLIS = 10_000;
  public static final long DEFAULT_BATCH_SCHEDULE_DELAY_MILLIS = 5_000;

  public static final String INIT_THREAD_NAME = "beacon-telemetry-init";

  // Environment Variables (application-specific)
  public static final String ENV_ENABLED = "BEACON_OTEL_ENABLED";
  public static final String ENV_PROTOCOL = "BEACON_OTEL_PROTOCOL";
  public static final String ENV_ENDPOINT = "BEACON_OTEL_ENDPOINT";
  public static final String ENV_FILE_EXPORTER_PATH = "BEACON_OTEL_FILE_EXPORTER_PATH";
  public static final String ENV_CAPTURE_CONTENT = "BEACON_OTEL_CAPTURE_CONTENT";
  public static final String ENV_LOG_LEVEL = "BEACON_OTEL_LOG_LEVEL";
  public static final String ENV_HTTP_INSTRUMENTATION = "BEACON_OTEL_HTTP_INSTRUMENTATION";

  // Environment Variables (OpenTelemetry standard)
  public static final String ENV_OTLP_PROTOCOL = "OTEL_EXPORTER_OTLP_PROTOCOL";
  public static final String ENV_OTLP_ENDPOINT = "OTEL_EXPORTER_OTLP_ENDPOINT";
  public static final String ENV_OTLP_TRACES_ENDPOINT = "OTEL_EXPORTER_OTLP_TRACES_ENDPOINT";
  public static final String ENV_OTLP_LOGS_ENDPOINT = "OTEL_EXPORTER_OTLP_LOGS_ENDPOINT";
  public static final String ENV_OTLP_METRICS_ENDPOINT = "OTEL_EXPORTER_OTLP_METRICS_ENDPOINT";
  public static final String ENV_OTLP_HEADERS = "OTEL_EXPORTER_OTLP_HEADERS";
  public static final String ENV_SERVICE_NAME = "OTEL_SERVICE_NAME";
  public static final String ENV_RESOURCE_ATTRIBUTES = "OTEL_RESOURCE_ATTRIBUTES";
  public static final String ENV_METRIC_EXPORT_INTERVAL = "OTEL_METRIC_EXPORT_INTERVAL";
  public static final String ENV_BSP_SCHEDULE_DELAY = "OTEL_BSP_SCHEDULE_DELAY";

  private BeaconConstants() {
    // Utility class
  }
}

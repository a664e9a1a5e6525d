package ai.beacon.sdk.config;

import ai.beacon.sdk.constants.BeaconConstants;
import ai.beacon.sdk.types.ExporterType;
import ai.beacon.sdk.types.LogLevel;
import ai.beacon.sdk.types.OtlpProtocol;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved telemetry configuration.
 *
 * <p>Instances are immutable and created once per process by {@link ConfigResolver}. A disabled
 * configuration is still a complete object with safe defaults.
 */
public final class TelemetryConfig {
  private final boolean enabled;
  private final ExporterType exporterType;
  private final String otlpEndpoint;
  private final OtlpProtocol otlpProtocol;
  private final boolean captureContent;
  private final String fileExporterPath;
  private final LogLevel logLevel;
  private final boolean httpInstrumentation;
  private final String serviceName;
  private final String serviceVersion;
  private final String sessionId;
  private final Map<String, String> resourceAttributes;

  // Per-signal endpoints, null when not overridden
  private final String tracesEndpoint;
  private final String logsEndpoint;
  private final String metricsEndpoint;
  private final Map<String, String> otlpHeaders;
  private final long metricExportIntervalMillis;
  private final long batchScheduleDelayMillis;

  private TelemetryConfig(Builder builder) {
    this.enabled = builder.enabled;
    this.exporterType = builder.exporterType;
    this.otlpEndpoint = builder.otlpEndpoint;
    this.otlpProtocol = builder.otlpProtocol;
    this.captureContent = builder.captureContent;
    this.fileExporterPath = builder.fileExporterPath;
    this.logLevel = builder.logLevel;
    this.httpInstrumentation = builder.httpInstrumentation;
    this.serviceName = builder.serviceName;
    this.serviceVersion = builder.serviceVersion;
    this.sessionId = builder.sessionId;
    this.resourceAttributes =
        Collections.unmodifiableMap(new LinkedHashMap<>(builder.resourceAttributes));
    this.tracesEndpoint = builder.tracesEndpoint;
    this.logsEndpoint = builder.logsEndpoint;
    this.metricsEndpoint = builder.metricsEndpoint;
    this.otlpHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.otlpHeaders));
    this.metricExportIntervalMillis = builder.metricExportIntervalMillis;
    this.batchScheduleDelayMillis = builder.batchScheduleDelayMillis;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Disabled configuration carrying only the service identity */
  public static TelemetryConfig disabled(String serviceVersion, String sessionId) {
    return builder().enabled(false).serviceVersion(serviceVersion).sessionId(sessionId).build();
  }

  public boolean isEnabled() {
    return enabled;
  }

  public ExporterType getExporterType() {
    return exporterType;
  }

  public String getOtlpEndpoint() {
    return otlpEndpoint;
  }

  public OtlpProtocol getOtlpProtocol() {
    return otlpProtocol;
  }

  public boolean isCaptureContent() {
    return captureContent;
  }

  public String getFileExporterPath() {
    return fileExporterPath;
  }

  public LogLevel getLogLevel() {
    return logLevel;
  }

  public boolean isHttpInstrumentation() {
    return httpInstrumentation;
  }

  public String getServiceName() {
    return serviceName;
  }

  public String getServiceVersion() {
    return serviceVersion;
  }

  public String getSessionId() {
    return sessionId;
  }

  public Map<String, String> getResourceAttributes() {
    return resourceAttributes;
  }

  public String getTracesEndpoint() {
    return tracesEndpoint;
  }

  public String getLogsEndpoint() {
    return logsEndpoint;
  }

  public String getMetricsEndpoint() {
    return metricsEndpoint;
  }

  public Map<String, String> getOtlpHeaders() {
    return otlpHeaders;
  }

  public long getMetricExportIntervalMillis() {
    return metricExportIntervalMillis;
  }

  public long getBatchScheduleDelayMillis() {
    return batchScheduleDelayMillis;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TelemetryConfig)) {
      return false;
    }
    TelemetryConfig that = (TelemetryConfig) o;
    return enabled == that.enabled
        && captureContent == that.captureContent
        && httpInstrumentation == that.httpInstrumentation
        && metricExportIntervalMillis == that.metricExportIntervalMillis
        && batchScheduleDelayMillis == that.batchScheduleDelayMillis
        && exporterType == that.exporterType
        && otlpProtocol == that.otlpProtocol
        && logLevel == that.logLevel
        && Objects.equals(otlpEndpoint, that.otlpEndpoint)
        && Objects.equals(fileExporterPath, that.fileExporterPath)
        && Objects.equals(serviceName, that.serviceName)
        && Objects.equals(serviceVersion, that.serviceVersion)
        && Objects.equals(sessionId, that.sessionId)
        && Objects.equals(resourceAttributes, that.resourceAttributes)
        && Objects.equals(tracesEndpoint, that.tracesEndpoint)
        && Objects.equals(logsEndpoint, that.logsEndpoint)
        && Objects.equals(metricsEndpoint, that.metricsEndpoint)
        && Objects.equals(otlpHeaders, that.otlpHeaders);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        enabled,
        exporterType,
        otlpEndpoint,
        otlpProtocol,
        captureContent,
        fileExporterPath,
        logLevel,
        httpInstrumentation,
        serviceName,
        serviceVersion,
        sessionId,
        resourceAttributes,
        tracesEndpoint,
        logsEndpoint,
        metricsEndpoint,
        otlpHeaders,
        metricExportIntervalMillis,
        batchScheduleDelayMillis);
  }

  // Headers are left out, they usually carry credentials
  @Override
  public String toString() {
    return "TelemetryConfig{"
        + "enabled="
        + enabled
        + ", exporterType="
        + exporterType
        + ", otlpEndpoint='"
        + otlpEndpoint
        + '\''
        + ", otlpProtocol="
        + otlpProtocol
        + ", captureContent="
        + captureContent
        + ", fileExporterPath='"
        + fileExporterPath
        + '\''
        + ", logLevel="
        + logLevel
        + ", serviceName='"
        + serviceName
        + '\''
        + ", serviceVersion='"
        + serviceVersion
        + '\''
        + ", sessionId='"
        + sessionId
        + '\''
        + ", resourceAttributes="
        + resourceAttributes
        + '}';
  }

  public static class Builder {
    private boolean enabled;
    private ExporterType exporterType = ExporterType.OTLP_HTTP;
    private String otlpEndpoint = "";
    private OtlpProtocol otlpProtocol = OtlpProtocol.HTTP;
    private boolean captureContent;
    private String fileExporterPath;
    private LogLevel logLevel = LogLevel.INFO;
    private boolean httpInstrumentation;
    private String serviceName = BeaconConstants.DEFAULT_SERVICE_NAME;
    private String serviceVersion = "";
    private String sessionId = "";
    private Map<String, String> resourceAttributes = Collections.emptyMap();
    private String tracesEndpoint;
    private String logsEndpoint;
    private String metricsEndpoint;
    private Map<String, String> otlpHeaders = Collections.emptyMap();
    private long metricExportIntervalMillis = BeaconConstants.DEFAULT_METRIC_EXPORT_INTERVAL_MILLIS;
    private long batchScheduleDelayMillis = BeaconConstants.DEFAULT_BATCH_SCHEDULE_DELAY_MILLIS;

    private Builder() {}

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder exporterType(ExporterType exporterType) {
      this.exporterType = Objects.requireNonNull(exporterType, "exporterType");
      return this;
    }

    public Builder otlpEndpoint(String otlpEndpoint) {
      this.otlpEndpoint = otlpEndpoint != null ? otlpEndpoint : "";
      return this;
    }

    public Builder otlpProtocol(OtlpProtocol otlpProtocol) {
      this.otlpProtocol = Objects.requireNonNull(otlpProtocol, "otlpProtocol");
      return this;
    }

    public Builder captureContent(boolean captureContent) {
      this.captureContent = captureContent;
      return this;
    }

    public Builder fileExporterPath(String fileExporterPath) {
      this.fileExporterPath = fileExporterPath;
      return this;
    }

    public Builder logLevel(LogLevel logLevel) {
      this.logLevel = Objects.requireNonNull(logLevel, "logLevel");
      return this;
    }

    public Builder httpInstrumentation(boolean httpInstrumentation) {
      this.httpInstrumentation = httpInstrumentation;
      return this;
    }

    public Builder serviceName(String serviceName) {
      this.serviceName = serviceName != null ? serviceName : BeaconConstants.DEFAULT_SERVICE_NAME;
      return this;
    }

    public Builder serviceVersion(String serviceVersion) {
      this.serviceVersion = serviceVersion != null ? serviceVersion : "";
      return this;
    }

    public Builder sessionId(String sessionId) {
      this.sessionId = sessionId != null ? sessionId : "";
      return this;
    }

    public Builder resourceAttributes(Map<String, String> resourceAttributes) {
      this.resourceAttributes =
          resourceAttributes != null ? resourceAttributes : Collections.emptyMap();
      return this;
    }

    public Builder tracesEndpoint(String tracesEndpoint) {
      this.tracesEndpoint = tracesEndpoint;
      return this;
    }

    public Builder logsEndpoint(String logsEndpoint) {
      this.logsEndpoint = logsEndpoint;
      return this;
    }

    public Builder metricsEndpoint(String metricsEndpoint) {
      this.metricsEndpoint = metricsEndpoint;
      return this;
    }

    public Builder otlpHeaders(Map<String, String> otlpHeaders) {
      this.otlpHeaders = otlpHeaders != null ? otlpHeaders : Collections.emptyMap();
      return this;
    }

    public Builder metricExportIntervalMillis(long metricExportIntervalMillis) {
      this.metricExportIntervalMillis = metricExportIntervalMillis;
      return this;
    }

    public Builder batchScheduleDelayMillis(long batchScheduleDelayMillis) {
      this.batchScheduleDelayMillis = batchScheduleDelayMillis;
      return this;
    }

    public TelemetryConfig build() {
      return new TelemetryConfig(this);
    }
  }
}

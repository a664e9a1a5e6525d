package ai.beacon.sdk.config;

import ai.beacon.sdk.types.ExporterType;

/**
 * Telemetry settings supplied by the host application.
 *
 * <p>Every field is optional; an unset field is null and the resolver falls through to the next
 * source.
 */
public final class HostSettings {

  private static final HostSettings EMPTY = builder().build();

  private Boolean enabled;
  private ExporterType exporterType;
  private String otlpEndpoint;
  private Boolean captureContent;
  private String outfile;

  private HostSettings() {}

  public static Builder builder() {
    return new Builder();
  }

  /** Settings with nothing set */
  public static HostSettings empty() {
    return EMPTY;
  }

  public Boolean getEnabled() {
    return enabled;
  }

  public ExporterType getExporterType() {
    return exporterType;
  }

  public String getOtlpEndpoint() {
    return otlpEndpoint;
  }

  public Boolean getCaptureContent() {
    return captureContent;
  }

  public String getOutfile() {
    return outfile;
  }

  public static class Builder {
    private final HostSettings settings = new HostSettings();
    private boolean built;

    public Builder enabled(Boolean enabled) {
      settings.enabled = enabled;
      return this;
    }

    public Builder exporterType(ExporterType exporterType) {
      settings.exporterType = exporterType;
      return this;
    }

    // Overloaded for raw setting values such as "otlp-grpc"
    public Builder exporterType(String exporterType) {
      settings.exporterType = ExporterType.fromString(exporterType);
      return this;
    }

    public Builder otlpEndpoint(String otlpEndpoint) {
      settings.otlpEndpoint = otlpEndpoint;
      return this;
    }

    public Builder captureContent(Boolean captureContent) {
      settings.captureContent = captureContent;
      return this;
    }

    public Builder outfile(String outfile) {
      settings.outfile = outfile;
      return this;
    }

    public HostSettings build() {
      if (built) {
        throw new IllegalStateException("HostSettings.Builder can only build once");
      }
      built = true;
      return settings;
    }
  }
}

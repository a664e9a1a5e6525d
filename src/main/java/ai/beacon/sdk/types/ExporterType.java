package ai.beacon.sdk.types;

/** Destination kind for all three signal exporters */
public enum ExporterType {
  OTLP_GRPC("otlp-grpc"),
  OTLP_HTTP("otlp-http"),
  CONSOLE("console"),
  FILE("file");

  private final String id;

  ExporterType(String id) {
    this.id = id;
  }

  /** Setting value, e.g. {@code otlp-grpc} */
  public String getId() {
    return id;
  }

  /** Returns the type for an id or enum name, or null when it is not recognized. */
  public static ExporterType fromString(String value) {
    if (value == null) {
      return null;
    }
    String normalized = value.trim();
    for (ExporterType type : values()) {
      if (type.id.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
        return type;
      }
    }
    return null;
  }

  public static ExporterType forProtocol(OtlpProtocol protocol) {
    return protocol == OtlpProtocol.GRPC ? OTLP_GRPC : OTLP_HTTP;
  }

  @Override
  public String toString() {
    return id;
  }
}

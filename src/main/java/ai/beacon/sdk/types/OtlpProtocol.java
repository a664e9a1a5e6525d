package ai.beacon.sdk.types;

/** Transport used by the OTLP exporters */
public enum OtlpProtocol {
  GRPC,
  HTTP;

  /** Only an explicit {@code grpc} selects gRPC; everything else is HTTP. */
  public static OtlpProtocol fromString(String protocol) {
    if (protocol != null && protocol.trim().equalsIgnoreCase("grpc")) {
      return GRPC;
    }
    return HTTP;
  }
}

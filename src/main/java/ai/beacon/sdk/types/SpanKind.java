package ai.beacon.sdk.types;

public enum SpanKind {
  INTERNAL,
  SERVER,
  CLIENT,
  PRODUCER,
  CONSUMER;

  public io.opentelemetry.api.trace.SpanKind toOtel() {
    switch (this) {
      case SERVER:
        return io.opentelemetry.api.trace.SpanKind.SERVER;
      case CLIENT:
        return io.opentelemetry.api.trace.SpanKind.CLIENT;
      case PRODUCER:
        return io.opentelemetry.api.trace.SpanKind.PRODUCER;
      case CONSUMER:
        return io.opentelemetry.api.trace.SpanKind.CONSUMER;
      default:
        return io.opentelemetry.api.trace.SpanKind.INTERNAL;
    }
  }
}

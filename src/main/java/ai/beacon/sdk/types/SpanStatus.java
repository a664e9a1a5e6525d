package ai.beacon.sdk.types;

import io.opentelemetry.api.trace.StatusCode;

public enum SpanStatus {
  UNSET,
  OK,
  ERROR;

  public StatusCode toOtel() {
    switch (this) {
      case OK:
        return StatusCode.OK;
      case ERROR:
        return StatusCode.ERROR;
      default:
        return StatusCode.UNSET;
    }
  }
}

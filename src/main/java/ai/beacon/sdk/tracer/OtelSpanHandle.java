package ai.beacon.sdk.tracer;

import ai.beacon.sdk.api.SpanHandle;
import ai.beacon.sdk.types.SpanStatus;
import ai.beacon.sdk.utils.AttributeUtils;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import java.util.List;
import java.util.Map;

/** Handle bound to a live OpenTelemetry span */
public class OtelSpanHandle implements SpanHandle {
  private final Span span;

  public OtelSpanHandle(Span span) {
    this.span = span;
  }

  /** The underlying span */
  public Span getSpan() {
    return span;
  }

  @Override
  public void setAttribute(String key, String value) {
    if (key != null && value != null) {
      span.setAttribute(key, value);
    }
  }

  @Override
  public void setAttribute(String key, long value) {
    if (key != null) {
      span.setAttribute(key, value);
    }
  }

  @Override
  public void setAttribute(String key, double value) {
    if (key != null) {
      span.setAttribute(key, value);
    }
  }

  @Override
  public void setAttribute(String key, boolean value) {
    if (key != null) {
      span.setAttribute(key, value);
    }
  }

  @Override
  public void setAttribute(String key, List<String> value) {
    if (key != null && value != null) {
      span.setAttribute(AttributeKey.stringArrayKey(key), value);
    }
  }

  @Override
  public void setAttributes(Map<String, ?> attributes) {
    AttributeUtils.storeInSpan(attributes, span);
  }

  @Override
  public void setStatus(SpanStatus status) {
    setStatus(status, null);
  }

  @Override
  public void setStatus(SpanStatus status, String description) {
    if (status == null) {
      return;
    }
    if (description != null) {
      span.setStatus(status.toOtel(), description);
    } else {
      span.setStatus(status.toOtel());
    }
  }

  @Override
  public void recordException(Throwable exception) {
    if (exception != null) {
      span.recordException(exception);
    }
  }

  @Override
  public void end() {
    span.end();
  }
}

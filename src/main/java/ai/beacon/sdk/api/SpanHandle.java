package ai.beacon.sdk.api;

import ai.beacon.sdk.types.SpanStatus;
import java.util.List;
import java.util.Map;

/**
 * Lightweight handle for a span, independent of the OpenTelemetry SDK types.
 *
 * <p>No method throws. Calls made after {@link #end()} are ignored by the underlying span.
 */
public interface SpanHandle {

  void setAttribute(String key, String value);

  void setAttribute(String key, long value);

  void setAttribute(String key, double value);

  void setAttribute(String key, boolean value);

  void setAttribute(String key, List<String> value);

  /** Set several attributes; null values are skipped */
  void setAttributes(Map<String, ?> attributes);

  void setStatus(SpanStatus status);

  void setStatus(SpanStatus status, String description);

  void recordException(Throwable exception);

  void end();
}

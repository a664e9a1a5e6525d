package ai.beacon.sdk.tracer;

import ai.beacon.sdk.api.SpanHandle;
import ai.beacon.sdk.types.SpanStatus;
import java.util.List;
import java.util.Map;

/** Span handle that discards everything */
public final class NoopSpanHandle implements SpanHandle {

  public static final NoopSpanHandle INSTANCE = new NoopSpanHandle();

  private NoopSpanHandle() {}

  @Override
  public void setAttribute(String key, String value) {}

  @Override
  public void setAttribute(String key, long value) {}

  @Override
  public void setAttribute(String key, double value) {}

  @Override
  public void setAttribute(String key, boolean value) {}

  @Override
  public void setAttribute(String key, List<String> value) {}

  @Override
  public void setAttributes(Map<String, ?> attributes) {}

  @Override
  public void setStatus(SpanStatus status) {}

  @Override
  public void setStatus(SpanStatus status, String description) {}

  @Override
  public void recordException(Throwable exception) {}

  @Override
  public void end() {}
}

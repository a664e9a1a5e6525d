package ai.beacon.sdk.tracer;

import ai.beacon.sdk.api.SpanHandle;
import ai.beacon.sdk.types.SpanStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Span handle handed out before the backend is ready.
 *
 * <p>Until {@link #bind} is called every operation is queued. {@code bind} replays the queue in
 * call order against the real span, after which calls pass straight through. Calls made after
 * {@code end} is queued are dropped, since an ended span ignores them anyway. {@link #discard}
 * turns a handle that will never be bound into a no-op.
 */
public class BufferedSpanHandle implements SpanHandle {
  private final List<Consumer<SpanHandle>> pending = new ArrayList<>();
  private SpanHandle delegate;
  private boolean endQueued;

  @Override
  public void setAttribute(String key, String value) {
    apply(span -> span.setAttribute(key, value));
  }

  @Override
  public void setAttribute(String key, long value) {
    apply(span -> span.setAttribute(key, value));
  }

  @Override
  public void setAttribute(String key, double value) {
    apply(span -> span.setAttribute(key, value));
  }

  @Override
  public void setAttribute(String key, boolean value) {
    apply(span -> span.setAttribute(key, value));
  }

  @Override
  public void setAttribute(String key, List<String> value) {
    List<String> copy = value != null ? new ArrayList<>(value) : null;
    apply(span -> span.setAttribute(key, copy));
  }

  @Override
  public void setAttributes(Map<String, ?> attributes) {
    Map<String, ?> copy = attributes != null ? new LinkedHashMap<>(attributes) : null;
    apply(span -> span.setAttributes(copy));
  }

  @Override
  public void setStatus(SpanStatus status) {
    apply(span -> span.setStatus(status));
  }

  @Override
  public void setStatus(SpanStatus status, String description) {
    apply(span -> span.setStatus(status, description));
  }

  @Override
  public void recordException(Throwable exception) {
    apply(span -> span.recordException(exception));
  }

  @Override
  public synchronized void end() {
    apply(SpanHandle::end);
    endQueued = true;
  }

  /** Bind to the real span and replay queued operations. Only the first call has any effect. */
  public synchronized void bind(SpanHandle real) {
    if (delegate != null || real == null) {
      return;
    }
    delegate = real;
    for (Consumer<SpanHandle> op : pending) {
      op.accept(real);
    }
    pending.clear();
  }

  /** Drop queued operations; later calls do nothing. Has no effect once bound. */
  public synchronized void discard() {
    if (delegate != null) {
      return;
    }
    delegate = NoopSpanHandle.INSTANCE;
    pending.clear();
  }

  public synchronized boolean isBound() {
    return delegate != null;
  }

  synchronized int pendingCount() {
    return pending.size();
  }

  private synchronized void apply(Consumer<SpanHandle> op) {
    if (delegate != null) {
      op.accept(delegate);
    } else if (!endQueued) {
      pending.add(op);
    }
  }
}

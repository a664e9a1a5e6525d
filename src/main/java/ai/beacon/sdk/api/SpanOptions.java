package ai.beacon.sdk.api;

import ai.beacon.sdk.types.SpanKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Options applied when a span starts */
public final class SpanOptions {

  private static final SpanOptions DEFAULT = builder().build();

  private final SpanKind kind;
  private final Map<String, Object> attributes;

  private SpanOptions(SpanKind kind, Map<String, Object> attributes) {
    this.kind = kind;
    this.attributes = Collections.unmodifiableMap(attributes);
  }

  public static SpanOptions defaults() {
    return DEFAULT;
  }

  public static Builder builder() {
    return new Builder();
  }

  public SpanKind getKind() {
    return kind;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public static class Builder {
    private SpanKind kind = SpanKind.INTERNAL;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public Builder kind(SpanKind kind) {
      this.kind = kind != null ? kind : SpanKind.INTERNAL;
      return this;
    }

    public Builder attribute(String key, Object value) {
      if (key != null && value != null) {
        attributes.put(key, value);
      }
      return this;
    }

    public Builder attributes(Map<String, ?> attributes) {
      if (attributes != null) {
        attributes.forEach(this::attribute);
      }
      return this;
    }

    public SpanOptions build() {
      return new SpanOptions(kind, new LinkedHashMap<>(attributes));
    }
  }
}

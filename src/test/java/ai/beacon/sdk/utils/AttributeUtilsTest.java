package ai.beacon.sdk.utils;

import static org.assertj.core.api.Assertions.assertThat;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AttributeUtilsTest {

  @Test
  void valuesKeepTheirType() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("string", "value");
    data.put("int", 7);
    data.put("long", 8L);
    data.put("float", 1.5f);
    data.put("double", 2.5);
    data.put("boolean", true);
    data.put("array", new String[] {"a", "b"});
    data.put("list", List.of("c", 4));

    Attributes attributes = AttributeUtils.toAttributes(data);

    assertThat(attributes.get(AttributeKey.stringKey("string"))).isEqualTo("value");
    assertThat(attributes.get(AttributeKey.longKey("int"))).isEqualTo(7L);
    assertThat(attributes.get(AttributeKey.longKey("long"))).isEqualTo(8L);
    assertThat(attributes.get(AttributeKey.doubleKey("float"))).isEqualTo(1.5);
    assertThat(attributes.get(AttributeKey.doubleKey("double"))).isEqualTo(2.5);
    assertThat(attributes.get(AttributeKey.booleanKey("boolean"))).isTrue();
    assertThat(attributes.get(AttributeKey.stringArrayKey("array"))).containsExactly("a", "b");
    assertThat(attributes.get(AttributeKey.stringArrayKey("list"))).containsExactly("c", "4");
  }

  @Test
  void otherValuesAreStoredAsStrings() {
    Attributes attributes = AttributeUtils.toAttributes(Map.of("timeout", Duration.ofSeconds(2)));

    assertThat(attributes.get(AttributeKey.stringKey("timeout"))).isEqualTo("PT2S");
  }

  @Test
  void nullKeysAndValuesAreSkipped() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put(null, "no key");
    data.put("none", null);
    data.put("kept", "yes");

    Attributes attributes = AttributeUtils.toAttributes(data);

    assertThat(attributes.size()).isEqualTo(1);
    assertThat(attributes.get(AttributeKey.stringKey("kept"))).isEqualTo("yes");
  }

  @Test
  void emptyOrNullMapGivesEmptyAttributes() {
    assertThat(AttributeUtils.toAttributes(null).isEmpty()).isTrue();
    assertThat(AttributeUtils.toAttributes(Map.of()).isEmpty()).isTrue();
  }

  @Test
  void toMapUsesAttributeNames() {
    Attributes attributes =
        Attributes.of(AttributeKey.stringKey("a"), "1", AttributeKey.longKey("b"), 2L);

    assertThat(AttributeUtils.toMap(attributes))
        .containsOnly(Map.entry("a", "1"), Map.entry("b", 2L));
    assertThat(AttributeUtils.toMap(null)).isEmpty();
  }
}

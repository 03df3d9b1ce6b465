package io.tessera.conv.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {

  @Test
  void parsesNestedDocumentPreservingFieldOrder() {
    Map<String, Object> root = JsonSupport.parseObject(bytes(
        "{\"path\":\"ecog/samples\",\"rows\":1000,\"shape\":[1000,2],\"scale\":0.25,\"big\":true,\"none\":null}"));

    assertEquals(List.of("path", "rows", "shape", "scale", "big", "none"), List.copyOf(root.keySet()));
    assertEquals("ecog/samples", JsonSupport.requireString(root, "path"));
    assertEquals(1000L, JsonSupport.requireLong(root, "rows"));
    assertEquals(0.25d, JsonSupport.requireDouble(root, "scale"));
    assertEquals(2, JsonSupport.asArray("shape", root.get("shape")).size());
    assertEquals("fallback", JsonSupport.optionalString(root, "missing", "fallback"));
  }

  @Test
  void rendersNonFiniteDoublesAsStrings() {
    byte[] json = JsonSupport.render(generator -> {
      generator.writeStartObject();
      JsonSupport.writeDouble(generator, "first", Double.NaN);
      JsonSupport.writeDouble(generator, "last", 1.5d);
      generator.writeEndObject();
    });

    assertEquals("{\"first\":\"NaN\",\"last\":1.5}", new String(json, StandardCharsets.UTF_8));
    Map<String, Object> parsed = JsonSupport.parseObject(json);
    assertTrue(Double.isNaN(JsonSupport.requireDouble(parsed, "first")));
  }

  @Test
  void rejectsMalformedAndMistypedInput() {
    assertThrows(IllegalArgumentException.class, () -> JsonSupport.parse(bytes("{\"a\":")));
    assertThrows(IllegalArgumentException.class, () -> JsonSupport.parse(bytes("")));
    assertThrows(IllegalArgumentException.class, () -> JsonSupport.parse(bytes("{} {}")));
    assertThrows(IllegalArgumentException.class, () -> JsonSupport.parseObject(bytes("[1]")));

    Map<String, Object> root = JsonSupport.parseObject(bytes("{\"rows\":1.5,\"name\":7}"));
    assertThrows(IllegalArgumentException.class, () -> JsonSupport.requireLong(root, "rows"));
    assertThrows(IllegalArgumentException.class, () -> JsonSupport.requireString(root, "name"));
    assertThrows(IllegalArgumentException.class, () -> JsonSupport.requireDouble(root, "absent"));
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}

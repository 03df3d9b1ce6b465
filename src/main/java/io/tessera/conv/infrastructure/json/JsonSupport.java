package io.tessera.conv.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper over the Jackson streaming API. Parses catalogs and descriptors into
 * {@link Map}/{@link List} structures and renders documents through a {@link JsonGenerator}.
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private static final JsonFactory FACTORY = new JsonFactory();

  private JsonSupport() {
    // Utility
  }

  /**
   * Callback writing one JSON document.
   */
  @FunctionalInterface
  public interface DocumentWriter {
    void write(JsonGenerator generator) throws IOException;
  }

  /**
   * Parses a UTF-8 JSON document into maps, lists, and primitives.
   *
   * @param json UTF-8 bytes; never {@code null}
   * @return parsed object graph
   * @throws IllegalArgumentException when parsing fails
   */
  public static Object parse(byte[] json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = FACTORY.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new IllegalArgumentException("JSON document is empty");
      }
      Object value = readValue(parser, token);
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Invalid JSON document: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read JSON document", ex);
    }
  }

  /**
   * Parses a document whose root must be an object.
   *
   * @param json UTF-8 bytes
   * @return root object
   * @throws IllegalArgumentException when parsing fails or the root is not an object
   */
  public static Map<String, Object> parseObject(byte[] json) {
    return asObject("document", parse(json));
  }

  /**
   * Renders a document to UTF-8 bytes.
   *
   * @param writer callback emitting exactly one root value
   * @return UTF-8 bytes
   */
  public static byte[] render(DocumentWriter writer) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator generator = FACTORY.createGenerator(out)) {
      writer.write(generator);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON", ex);
    }
    return out.toByteArray();
  }

  @SuppressWarnings("unchecked")
  public static Map<String, Object> asObject(String name, Object value) {
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException(name + " must be a JSON object");
    }
    return (Map<String, Object>) value;
  }

  @SuppressWarnings("unchecked")
  public static List<Object> asArray(String name, Object value) {
    if (!(value instanceof List)) {
      throw new IllegalArgumentException(name + " must be a JSON array");
    }
    return (List<Object>) value;
  }

  public static String requireString(Map<String, Object> object, String key) {
    Object value = object.get(key);
    if (!(value instanceof String)) {
      throw new IllegalArgumentException("field '" + key + "' must be a string");
    }
    return (String) value;
  }

  public static String optionalString(Map<String, Object> object, String key, String fallback) {
    Object value = object.get(key);
    return value instanceof String ? (String) value : fallback;
  }

  public static long requireLong(Map<String, Object> object, String key) {
    Object value = object.get(key);
    if (!(value instanceof Number) || value instanceof Double || value instanceof Float) {
      throw new IllegalArgumentException("field '" + key + "' must be an integer");
    }
    return ((Number) value).longValue();
  }

  public static double requireDouble(Map<String, Object> object, String key) {
    Object value = object.get(key);
    if (value instanceof String) {
      return parseSpecialDouble(key, (String) value);
    }
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException("field '" + key + "' must be a number");
    }
    return ((Number) value).doubleValue();
  }

  /**
   * Writes a double that may be NaN or infinite, which plain JSON numbers cannot carry.
   *
   * @param generator target generator
   * @param field field name
   * @param value value to write
   * @throws IOException if the generator fails
   */
  public static void writeDouble(JsonGenerator generator, String field, double value) throws IOException {
    if (Double.isFinite(value)) {
      generator.writeNumberField(field, value);
    } else {
      generator.writeStringField(field, Double.toString(value));
    }
  }

  private static double parseSpecialDouble(String key, String text) {
    switch (text) {
      case "NaN":
        return Double.NaN;
      case "Infinity":
        return Double.POSITIVE_INFINITY;
      case "-Infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        throw new IllegalArgumentException("field '" + key + "' must be a number");
    }
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}

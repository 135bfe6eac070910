package ca.gc.cra.prism.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Minimal JSON helper over the Jackson streaming API.
 *
 * <p>Parses documents into {@link Map}/{@link List} graphs and writes such graphs back out. Typed accessors
 * convert missing or mistyped fields into {@link IllegalArgumentException}s naming the field.</p>
 *
 * @since PRISM 0.1
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a UTF-8 JSON document into maps, lists, and primitives.
   *
   * @param json JSON bytes; never {@code null}
   * @return parsed object graph
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(byte[] json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return parseDocument(parser);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a JSON string into maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return parseDocument(parser);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a document whose root must be an object.
   *
   * @param json JSON bytes
   * @return root object
   * @throws IllegalArgumentException when parsing fails or the root is not an object
   */
  public Map<String, Object> parseObject(byte[] json) {
    return asObject("document", parse(json));
  }

  /**
   * Serializes an object graph of maps, iterables, strings, numbers, booleans, and nulls.
   *
   * @param value graph to write
   * @param pretty whether to indent the output
   * @return UTF-8 JSON bytes
   */
  public byte[] write(Object value, boolean pretty) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      if (pretty) {
        generator.useDefaultPrettyPrinter();
      }
      writeValue(generator, value);
    } catch (IOException ex) {
      throw new IllegalStateException("JSON serialization failed", ex);
    }
    return out.toByteArray();
  }

  /**
   * Serializes compactly.
   *
   * @param value graph to write
   * @return UTF-8 JSON bytes
   */
  public byte[] write(Object value) {
    return write(value, false);
  }

  /**
   * Views a parsed value as a JSON object.
   *
   * @param field field name for the error message
   * @param value parsed value
   * @return copy of the object with its members in document order
   * @throws IllegalArgumentException if {@code value} is not an object with string keys
   */
  public static Map<String, Object> asObject(String field, Object value) {
    if (!(value instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(field + " must be a JSON object");
    }
    Map<String, Object> object = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(field + " has a non-string member name");
      }
      object.put(key, entry.getValue());
    }
    return object;
  }

  public static List<Object> asArray(String field, Object value) {
    if (value instanceof List<?> list) {
      return new ArrayList<>(list);
    }
    throw new IllegalArgumentException(field + " must be a JSON array");
  }

  public static String requireString(Map<String, Object> object, String field) {
    Object value = object.get(field);
    if (value instanceof String text) {
      return text;
    }
    throw new IllegalArgumentException("missing or non-string field: " + field);
  }

  public static Optional<String> optString(Map<String, Object> object, String field) {
    Object value = object.get(field);
    return value == null ? Optional.empty() : Optional.of(value.toString());
  }

  public static long requireLong(Map<String, Object> object, String field) {
    Object value = object.get(field);
    if (value instanceof Integer || value instanceof Long || value instanceof BigInteger) {
      try {
        return value instanceof BigInteger big ? big.longValueExact() : ((Number) value).longValue();
      } catch (ArithmeticException ex) {
        throw new IllegalArgumentException("field " + field + " exceeds 64-bit range", ex);
      }
    }
    throw new IllegalArgumentException("missing or non-integer field: " + field);
  }

  public static double requireDouble(Map<String, Object> object, String field) {
    Object value = object.get(field);
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw new IllegalArgumentException("missing or non-numeric field: " + field);
  }

  private Object parseDocument(JsonParser parser) throws IOException {
    JsonToken token = parser.nextToken();
    if (token == null) {
      return Map.of();
    }
    Object value = readValue(parser, token);
    JsonToken trailing = parser.nextToken();
    if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
      throw new IllegalArgumentException("JSON document contains trailing content");
    }
    return value;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
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

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
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
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
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

  private void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof Iterable<?> iterable) {
      generator.writeStartArray();
      for (Object element : iterable) {
        writeValue(generator, element);
      }
      generator.writeEndArray();
    } else if (value instanceof long[] longs) {
      generator.writeStartArray();
      for (long element : longs) {
        generator.writeNumber(element);
      }
      generator.writeEndArray();
    } else if (value instanceof String text) {
      generator.writeString(text);
    } else if (value instanceof Boolean bool) {
      generator.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      generator.writeNumber(((Number) value).doubleValue());
    } else if (value instanceof BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      generator.writeNumber(integer);
    } else {
      generator.writeString(value.toString());
    }
  }
}

package ca.gc.cra.parley.application.events.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Streaming JSON reader that turns structured telemetry messages into {@link Map}/{@link List}
 * graphs. Thread-safe: the factory is shared and each call uses its own parser.
 *
 * @since PARLEY 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses the supplied JSON string into an object graph of maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph; an empty document yields an empty map
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
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
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a document that must be a JSON object.
   *
   * @param json JSON text; {@code null} or blank yields empty
   * @return the object, or empty when the text is not valid JSON or not an object
   */
  public Optional<Map<String, Object>> parseObject(String json) {
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    try {
      Object value = parse(json);
      if (value instanceof Map<?, ?> map) {
        Map<String, Object> object = new LinkedHashMap<>(map.size());
        map.forEach((key, field) -> object.put(String.valueOf(key), field));
        return Optional.of(object);
      }
      return Optional.empty();
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
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
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }
}

package com.killradar.killfeed.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collection;

/** JSON array serializer for the v2 channel protocol. */
public class PhoenixCodec {
  private final ObjectMapper objectMapper;

  public PhoenixCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(PhoenixMessage message) {
    ArrayNode frame = objectMapper.createArrayNode();
    addNullable(frame, message.joinRef());
    addNullable(frame, message.ref());
    frame.add(message.topic());
    frame.add(message.event());
    frame.add(message.payload() == null ? objectMapper.createObjectNode() : message.payload());
    try {
      return objectMapper.writeValueAsString(frame);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Unserializable channel frame for event " + message.event(), ex);
    }
  }

  /**
   * Parses a frame.
   *
   * @throws IllegalArgumentException when the text is not a five-element JSON array
   */
  public PhoenixMessage decode(String text) {
    JsonNode frame;
    try {
      frame = objectMapper.readTree(text);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Malformed channel frame", ex);
    }
    if (frame == null || !frame.isArray() || frame.size() != 5) {
      throw new IllegalArgumentException("Channel frame must be a 5-element array");
    }
    return new PhoenixMessage(
        textOrNull(frame.get(0)),
        textOrNull(frame.get(1)),
        frame.get(2).asText(),
        frame.get(3).asText(),
        frame.get(4));
  }

  public ObjectNode systemsPayload(Collection<Long> systems) {
    ObjectNode payload = objectMapper.createObjectNode();
    ArrayNode array = payload.putArray("systems");
    for (Long system : systems) {
      array.add(system);
    }
    return payload;
  }

  public ObjectNode emptyPayload() {
    return objectMapper.createObjectNode();
  }

  private static void addNullable(ArrayNode frame, String value) {
    if (value == null) {
      frame.addNull();
    } else {
      frame.add(value);
    }
  }

  private static String textOrNull(JsonNode node) {
    return node == null || node.isNull() ? null : node.asText();
  }
}

package com.gentoro.twinsync.reverse;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.twinsync.exception.ValidationException;
import com.gentoro.twinsync.mapping.TwinCodec;
import com.gentoro.twinsync.model.TwinModel;
import com.gentoro.twinsync.utility.JacksonUtility;
import java.time.Instant;
import java.util.Map;

/**
 * Decodes twin graph cloud events of type {@code Microsoft.DigitalTwins.<Twin|Relationship>.<
 * Create|Update|Delete>}.
 */
public final class ChangeEventDecoder {
  public static final String TYPE_PREFIX = "Microsoft.DigitalTwins.";

  private ChangeEventDecoder() {}

  /** Decodes a cloud event envelope carrying {@code type}, {@code subject} and {@code data}. */
  public static ChangeEvent decode(JsonNode envelope) {
    if (envelope == null || !envelope.isObject()) {
      throw new ValidationException("Notification is not a JSON object");
    }
    JsonNode data = envelope.get("data");
    if (data == null || !data.isObject()) {
      throw new ValidationException(
          "Notification has no object 'data'", Map.of("type", text(envelope, "type")));
    }
    return decode(
        text(envelope, "type"),
        text(envelope, "subject"),
        TwinCodec.parseInstant(text(envelope, "time")),
        JacksonUtility.toMap(data));
  }

  public static ChangeEvent decode(
      String type, String subject, Instant time, Map<String, Object> body) {
    if (type == null || !type.startsWith(TYPE_PREFIX)) {
      throw new ValidationException("Unknown notification type: " + type);
    }
    if (subject == null || subject.isEmpty()) {
      throw new ValidationException("Notification of type " + type + " has no subject");
    }
    String[] parts = type.substring(TYPE_PREFIX.length()).split("\\.");
    if (parts.length != 2) {
      throw new ValidationException("Unknown notification type: " + type);
    }
    String resource = parts[0];
    String action = parts[1];
    switch (resource) {
      case "Twin" -> {
        EventKind kind =
            switch (action) {
              case "Create" -> EventKind.NODE_CREATED;
              case "Update" -> EventKind.NODE_UPDATED;
              case "Delete" -> EventKind.NODE_DELETED;
              default -> throw new ValidationException("Unknown twin action: " + type);
            };
        return new ChangeEvent(kind, subject, time, modelOf(kind, subject, body), body);
      }
      case "Relationship" -> {
        EventKind kind =
            switch (action) {
              case "Create" -> EventKind.EDGE_CREATED;
              case "Update" -> EventKind.EDGE_UPDATED;
              case "Delete" -> EventKind.EDGE_DELETED;
              default -> throw new ValidationException("Unknown relationship action: " + type);
            };
        return new ChangeEvent(kind, subject, time, null, body);
      }
      default -> throw new ValidationException("Unknown notification resource: " + type);
    }
  }

  private static TwinModel modelOf(EventKind kind, String subject, Map<String, Object> body) {
    Object model;
    if (kind == EventKind.NODE_UPDATED) {
      model = body.get("modelId");
    } else {
      Object meta = body.get(TwinCodec.METADATA);
      model = meta instanceof Map<?, ?> m ? m.get(TwinCodec.MODEL) : null;
    }
    if (!(model instanceof String modelId)) {
      throw new ValidationException(
          "Twin notification for '" + subject + "' carries no model", Map.of("subject", subject));
    }
    return TwinModel.fromModelId(modelId);
  }

  private static String text(JsonNode node, String field) {
    JsonNode v = node.get(field);
    return v == null || v.isNull() ? null : v.asText();
  }
}

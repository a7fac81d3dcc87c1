package com.gentoro.twinsync.mapping;

import com.gentoro.twinsync.exception.ValidationException;
import com.gentoro.twinsync.model.NodeTwinProperties;
import com.gentoro.twinsync.model.RelationshipKind;
import com.gentoro.twinsync.model.TimeseriesTwinProperties;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinModel;
import com.gentoro.twinsync.model.TwinProperties;
import com.gentoro.twinsync.model.TwinRelationship;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts twins and relationships to and from the JSON object shape used by the twin graph.
 * Keys starting with {@code $} are system fields; every other top-level key must belong to the
 * twin's model.
 */
public final class TwinCodec {
  public static final String DT_ID = "$dtId";
  public static final String METADATA = "$metadata";
  public static final String MODEL = "$model";
  public static final String RELATIONSHIP_ID = "$relationshipId";
  public static final String SOURCE_ID = "$sourceId";
  public static final String TARGET_ID = "$targetId";
  public static final String RELATIONSHIP_NAME = "$relationshipName";

  private TwinCodec() {}

  public static Map<String, Object> encodeTwin(Twin twin) {
    TwinProperties p = twin.properties();
    Map<String, Object> out = new LinkedHashMap<>();
    out.put(DT_ID, twin.twinId());
    out.put(METADATA, new LinkedHashMap<>(Map.of(MODEL, twin.model().modelId())));
    out.put("displayName", p.displayName());
    out.put("externalId", p.externalId());
    out.put("id", p.internalId() == null ? "" : p.internalId());
    if (p.description() != null) {
      out.put("description", p.description());
    }
    Map<String, Object> tags = new LinkedHashMap<>();
    tags.put(METADATA, new LinkedHashMap<>());
    tags.put("values", new LinkedHashMap<>(p.tags()));
    out.put("tags", tags);
    if (p instanceof TimeseriesTwinProperties ts) {
      if (ts.latestValue() != null) out.put("latestValue", ts.latestValue());
      if (ts.timestamp() != null) out.put("timestamp", ts.timestamp().toString());
    }
    return out;
  }

  public static Twin decodeTwin(Map<String, ?> json) {
    String twinId = requiredString(json, DT_ID);
    Object meta = json.get(METADATA);
    if (!(meta instanceof Map<?, ?> metaMap) || !(metaMap.get(MODEL) instanceof String)) {
      throw new ValidationException(
          "Twin '" + twinId + "' has no $metadata.$model", Map.of("twinId", twinId));
    }
    TwinModel model = TwinModel.fromModelId((String) metaMap.get(MODEL));
    for (String key : json.keySet()) {
      if (!key.startsWith("$") && !model.properties().contains(key)) {
        throw new ValidationException(
            "Unknown property '" + key + "' on twin '" + twinId + "'",
            Map.of("twinId", twinId, "property", key, "model", model.modelId()));
      }
    }
    String displayName = optionalString(json, "displayName");
    String externalId = optionalString(json, "externalId");
    String internalId = optionalString(json, "id");
    String description = optionalString(json, "description");
    Map<String, String> tags = decodeTags(twinId, json.get("tags"));
    if (model == TwinModel.NODE) {
      return Twin.node(
          twinId, new NodeTwinProperties(displayName, externalId, internalId, description, tags));
    }
    return Twin.timeseries(
        twinId,
        new TimeseriesTwinProperties(
            displayName,
            externalId,
            internalId,
            description,
            tags,
            optionalString(json, "latestValue"),
            parseInstant(optionalString(json, "timestamp"))));
  }

  public static Map<String, Object> encodeRelationship(TwinRelationship rel) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put(RELATIONSHIP_ID, rel.relationshipId());
    out.put(SOURCE_ID, rel.sourceTwinId());
    out.put(TARGET_ID, rel.targetTwinId());
    out.put(RELATIONSHIP_NAME, rel.kind().relationshipName());
    if (rel.labels() != null) out.put("labels", rel.labels());
    if (rel.createdAt() != null) out.put("createdAt", rel.createdAt().toString());
    return out;
  }

  public static TwinRelationship decodeRelationship(Map<String, ?> json) {
    String id = requiredString(json, RELATIONSHIP_ID);
    for (String key : json.keySet()) {
      if (!key.startsWith("$") && !"labels".equals(key) && !"createdAt".equals(key)) {
        throw new ValidationException(
            "Unknown property '" + key + "' on relationship '" + id + "'",
            Map.of("relationshipId", id, "property", key));
      }
    }
    return new TwinRelationship(
        id,
        requiredString(json, SOURCE_ID),
        requiredString(json, TARGET_ID),
        RelationshipKind.fromName(requiredString(json, RELATIONSHIP_NAME)),
        optionalString(json, "labels"),
        parseInstant(optionalString(json, "createdAt")));
  }

  public static Instant parseInstant(String text) {
    if (text == null || text.isBlank()) return null;
    try {
      return Instant.parse(text.trim());
    } catch (DateTimeParseException e) {
      throw new ValidationException("Invalid timestamp: " + text, e);
    }
  }

  private static Map<String, String> decodeTags(String twinId, Object raw) {
    Map<String, String> out = new LinkedHashMap<>();
    if (raw == null) return out;
    if (!(raw instanceof Map<?, ?> tags)) {
      throw new ValidationException("Twin '" + twinId + "' has malformed tags");
    }
    Object values = tags.get("values");
    if (values == null) return out;
    if (!(values instanceof Map<?, ?> valueMap)) {
      throw new ValidationException("Twin '" + twinId + "' has malformed tags.values");
    }
    valueMap.forEach((k, v) -> out.put(String.valueOf(k), v == null ? null : String.valueOf(v)));
    return out;
  }

  private static String requiredString(Map<String, ?> json, String key) {
    Object v = json.get(key);
    if (!(v instanceof String s) || s.isEmpty()) {
      throw new ValidationException("Missing required field '" + key + "'");
    }
    return s;
  }

  private static String optionalString(Map<String, ?> json, String key) {
    Object v = json.get(key);
    return v == null ? null : String.valueOf(v);
  }
}

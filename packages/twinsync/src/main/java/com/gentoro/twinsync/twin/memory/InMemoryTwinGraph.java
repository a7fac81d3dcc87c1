package com.gentoro.twinsync.twin.memory;

import com.gentoro.twinsync.exception.NotFoundException;
import com.gentoro.twinsync.exception.QueryLimitException;
import com.gentoro.twinsync.exception.ValidationException;
import com.gentoro.twinsync.mapping.TwinCodec;
import com.gentoro.twinsync.model.PatchOperation;
import com.gentoro.twinsync.model.RelationshipKey;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinRelationship;
import com.gentoro.twinsync.query.TwinQuery;
import com.gentoro.twinsync.query.TwinQueryTemplate;
import com.gentoro.twinsync.twin.TwinGraphClient;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Twin graph held in memory as wire-shaped JSON maps. Enforces the remote query limits and the
 * cascade of relationships on twin deletion. Used as the default driver and by the tests.
 */
public class InMemoryTwinGraph implements TwinGraphClient {
  public static final int MAX_IDS_PER_QUERY = 100;

  private final int maxQueryLength;
  private final Map<String, Map<String, Object>> twins = new ConcurrentHashMap<>();
  private final Map<RelationshipKey, Map<String, Object>> relationships =
      new ConcurrentHashMap<>();
  private final List<TwinQuery> queryLog = new CopyOnWriteArrayList<>();
  private final AtomicInteger writes = new AtomicInteger();

  public InMemoryTwinGraph() {
    this(8000);
  }

  public InMemoryTwinGraph(int maxQueryLength) {
    this.maxQueryLength = maxQueryLength;
  }

  @Override
  public Optional<Twin> getTwin(String twinId) {
    Map<String, Object> raw = twins.get(twinId);
    return raw == null ? Optional.empty() : Optional.of(TwinCodec.decodeTwin(raw));
  }

  @Override
  public void upsertTwin(Twin twin) {
    writes.incrementAndGet();
    twins.put(twin.twinId(), TwinCodec.encodeTwin(twin));
  }

  /** Stores a raw twin document as-is, bypassing model validation. */
  public void putRawTwin(Map<String, Object> json) {
    twins.put(String.valueOf(json.get(TwinCodec.DT_ID)), new LinkedHashMap<>(json));
  }

  @Override
  public synchronized void updateTwin(String twinId, List<PatchOperation> patch) {
    Map<String, Object> current = twins.get(twinId);
    if (current == null) {
      throw new NotFoundException("Twin not found: " + twinId, Map.of("twinId", twinId));
    }
    writes.incrementAndGet();
    Map<String, Object> updated = JsonPatch.apply(current, patch);
    TwinCodec.decodeTwin(updated);
    twins.put(twinId, updated);
  }

  @Override
  public synchronized void deleteTwin(String twinId) {
    if (twins.remove(twinId) == null) {
      return;
    }
    writes.incrementAndGet();
    relationships
        .entrySet()
        .removeIf(
            e ->
                twinId.equals(e.getKey().sourceTwinId())
                    || twinId.equals(e.getValue().get(TwinCodec.TARGET_ID)));
  }

  @Override
  public Optional<TwinRelationship> getRelationship(String sourceTwinId, String relationshipId) {
    Map<String, Object> raw = relationships.get(new RelationshipKey(sourceTwinId, relationshipId));
    return raw == null ? Optional.empty() : Optional.of(TwinCodec.decodeRelationship(raw));
  }

  @Override
  public synchronized void upsertRelationship(TwinRelationship relationship) {
    for (String endpoint : List.of(relationship.sourceTwinId(), relationship.targetTwinId())) {
      if (!twins.containsKey(endpoint)) {
        throw new NotFoundException(
            "Relationship endpoint twin not found: " + endpoint,
            Map.of("relationshipId", relationship.relationshipId(), "twinId", endpoint));
      }
    }
    writes.incrementAndGet();
    relationships.put(relationship.key(), TwinCodec.encodeRelationship(relationship));
  }

  @Override
  public synchronized void updateRelationship(
      String sourceTwinId, String relationshipId, List<PatchOperation> patch) {
    RelationshipKey key = new RelationshipKey(sourceTwinId, relationshipId);
    Map<String, Object> current = relationships.get(key);
    if (current == null) {
      throw new NotFoundException("Relationship not found: " + key);
    }
    writes.incrementAndGet();
    Map<String, Object> updated = JsonPatch.apply(current, patch);
    TwinCodec.decodeRelationship(updated);
    relationships.put(key, updated);
  }

  @Override
  public void deleteRelationship(String sourceTwinId, String relationshipId) {
    if (relationships.remove(new RelationshipKey(sourceTwinId, relationshipId)) != null) {
      writes.incrementAndGet();
    }
  }

  @Override
  public List<Map<String, Object>> query(TwinQuery query) {
    queryLog.add(query);
    if (query.ids().size() > MAX_IDS_PER_QUERY) {
      throw new QueryLimitException(
          "Query exceeds " + MAX_IDS_PER_QUERY + " ids",
          Map.of("ids", query.ids().size(), "template", query.template().name()));
    }
    String text = query.text();
    if (text.length() > maxQueryLength) {
      throw new QueryLimitException(
          "Query text exceeds " + maxQueryLength + " characters",
          Map.of("length", text.length(), "template", query.template().name()));
    }
    Set<String> ids = new HashSet<>(query.ids());
    TwinQueryTemplate t = query.template();
    List<Map<String, Object>> rows = new ArrayList<>();
    if (t.equals(TwinQueryTemplate.TWINS_BY_ID)) {
      for (String id : query.ids()) {
        Map<String, Object> twin = twins.get(id);
        if (twin != null) rows.add(Map.of(t.resultKey(), new LinkedHashMap<>(twin)));
      }
      return rows;
    }
    for (Map<String, Object> rel : relationships.values()) {
      boolean match;
      if (t.equals(TwinQueryTemplate.OUTGOING_RELATIONSHIPS)) {
        match = ids.contains(rel.get(TwinCodec.SOURCE_ID));
      } else if (t.equals(TwinQueryTemplate.INCOMING_RELATIONSHIPS)) {
        match = ids.contains(rel.get(TwinCodec.TARGET_ID));
      } else if (t.equals(TwinQueryTemplate.CHILD_RELATIONSHIPS)) {
        match =
            ids.contains(rel.get(TwinCodec.TARGET_ID))
                && "parent".equals(rel.get(TwinCodec.RELATIONSHIP_NAME));
      } else {
        throw new ValidationException("Unsupported query template: " + t.name());
      }
      if (match) rows.add(Map.of(t.resultKey(), new LinkedHashMap<>(rel)));
    }
    return rows;
  }

  public List<TwinQuery> queryLog() {
    return List.copyOf(queryLog);
  }

  /** Number of mutating calls that changed state. */
  public int writeCount() {
    return writes.get();
  }

  public Set<String> twinIds() {
    return Set.copyOf(twins.keySet());
  }

  public List<TwinRelationship> relationships() {
    List<TwinRelationship> out = new ArrayList<>();
    relationships.values().forEach(r -> out.add(TwinCodec.decodeRelationship(r)));
    return out;
  }
}

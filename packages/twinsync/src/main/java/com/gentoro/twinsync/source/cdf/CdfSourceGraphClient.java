package com.gentoro.twinsync.source.cdf;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.twinsync.exception.NotFoundException;
import com.gentoro.twinsync.http.BaseUrlInterceptor;
import com.gentoro.twinsync.http.HttpResult;
import com.gentoro.twinsync.http.JsonHttp;
import com.gentoro.twinsync.model.Datapoint;
import com.gentoro.twinsync.model.Edge;
import com.gentoro.twinsync.model.Node;
import com.gentoro.twinsync.model.Timeseries;
import com.gentoro.twinsync.query.QueryBatcher;
import com.gentoro.twinsync.source.SourceGraphClient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;

/**
 * Source graph binding for the Cognite Data Fusion REST API (assets, relationships, labels,
 * timeseries and datapoints). Timeseries reference assets by internal id on the wire; this client
 * translates to and from asset external ids.
 */
public class CdfSourceGraphClient implements SourceGraphClient {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(CdfSourceGraphClient.class);

  static final int LIST_LIMIT = 1000;
  static final int RELATIONSHIP_FILTER_IDS = 1000;
  static final int TIMESERIES_FILTER_IDS = 100;

  private final OkHttpClient http;
  private final String project;

  public CdfSourceGraphClient(OkHttpClient http, String project) {
    this.http = http;
    this.project = project;
  }

  // ---- assets

  @Override
  public Optional<Node> retrieveNode(String externalId) {
    JsonNode items = post("assets/byids", byExternalIds(List.of(externalId), true)).path("items");
    return items.size() == 0 ? Optional.empty() : Optional.of(toNode(items.get(0)));
  }

  @Override
  public List<Node> listSubtree(String rootExternalId) {
    Map<String, Object> filter =
        Map.of("assetSubtreeIds", List.of(Map.of("externalId", rootExternalId)));
    List<Node> nodes = new ArrayList<>();
    for (JsonNode item : list("assets/list", filter)) {
      Node node = toNode(item);
      if (node.externalId().equals(rootExternalId)) {
        nodes.add(0, node);
      } else {
        nodes.add(node);
      }
    }
    return nodes;
  }

  @Override
  public Node createNode(Node node) {
    Map<String, Object> item = new LinkedHashMap<>();
    item.put("externalId", node.externalId());
    item.put("name", node.name());
    if (node.description() != null) item.put("description", node.description());
    item.put("metadata", node.metadata());
    if (node.parentExternalId() != null) item.put("parentExternalId", node.parentExternalId());
    return toNode(post("assets", Map.of("items", List.of(item))).path("items").get(0));
  }

  @Override
  public Node updateNode(Node node) {
    Map<String, Object> update = new LinkedHashMap<>();
    update.put("name", set(node.name()));
    update.put("description", setOrNull(node.description()));
    update.put("metadata", set(node.metadata()));
    if (node.parentExternalId() != null) {
      update.put("parentExternalId", set(node.parentExternalId()));
    }
    JsonNode out = post("assets/update", updateItems(node.externalId(), update));
    return toNode(out.path("items").get(0));
  }

  @Override
  public void deleteNode(String externalId) {
    post("assets/delete", byExternalIds(List.of(externalId), true));
  }

  // ---- relationships and labels

  @Override
  public List<Edge> listEdges(
      Collection<String> sourceExternalIds, Collection<String> targetExternalIds) {
    Map<String, Edge> edges = new LinkedHashMap<>();
    List<String> sources = new ArrayList<>(new LinkedHashSet<>(sourceExternalIds));
    List<String> targets = new ArrayList<>(new LinkedHashSet<>(targetExternalIds));
    for (List<String> s : QueryBatcher.partition(sources, RELATIONSHIP_FILTER_IDS)) {
      for (List<String> t : QueryBatcher.partition(targets, RELATIONSHIP_FILTER_IDS)) {
        Map<String, Object> filter = Map.of("sourceExternalIds", s, "targetExternalIds", t);
        for (JsonNode item : list("relationships/list", filter)) {
          Edge e = toEdge(item);
          edges.putIfAbsent(e.externalId(), e);
        }
      }
    }
    return new ArrayList<>(edges.values());
  }

  @Override
  public Optional<Edge> retrieveEdge(String externalId) {
    JsonNode items =
        post("relationships/byids", byExternalIds(List.of(externalId), true)).path("items");
    return items.size() == 0 ? Optional.empty() : Optional.of(toEdge(items.get(0)));
  }

  @Override
  public Edge createEdge(Edge edge) {
    Map<String, Object> item = new LinkedHashMap<>();
    item.put("externalId", edge.externalId());
    item.put("sourceExternalId", edge.sourceExternalId());
    item.put("sourceType", "asset");
    item.put("targetExternalId", edge.targetExternalId());
    item.put("targetType", "asset");
    item.put("labels", labelRefs(edge.labels()));
    return toEdge(post("relationships", Map.of("items", List.of(item))).path("items").get(0));
  }

  @Override
  public void updateEdgeLabels(String externalId, List<String> add, List<String> remove) {
    Map<String, Object> labels = new LinkedHashMap<>();
    if (!add.isEmpty()) labels.put("add", labelRefs(add));
    if (!remove.isEmpty()) labels.put("remove", labelRefs(remove));
    if (labels.isEmpty()) return;
    post("relationships/update", updateItems(externalId, Map.of("labels", labels)));
  }

  @Override
  public void deleteEdge(String externalId) {
    post("relationships/delete", byExternalIds(List.of(externalId), true));
  }

  @Override
  public boolean labelExists(String labelExternalId) {
    Map<String, Object> filter = Map.of("externalIdPrefix", labelExternalId);
    for (JsonNode item : list("labels/list", filter)) {
      if (labelExternalId.equals(item.path("externalId").asText())) return true;
    }
    return false;
  }

  @Override
  public void createLabel(String labelExternalId) {
    post(
        "labels",
        Map.of("items", List.of(Map.of("externalId", labelExternalId, "name", labelExternalId))));
  }

  // ---- timeseries

  @Override
  public List<Timeseries> listTimeseries(Collection<String> assetExternalIds) {
    List<JsonNode> raw = new ArrayList<>();
    List<String> assets = new ArrayList<>(new LinkedHashSet<>(assetExternalIds));
    for (List<String> chunk : QueryBatcher.partition(assets, TIMESERIES_FILTER_IDS)) {
      list("timeseries/list", Map.of("assetExternalIds", chunk)).forEach(raw::add);
    }
    return toTimeseries(raw);
  }

  @Override
  public Optional<Timeseries> retrieveTimeseries(String externalId) {
    JsonNode items =
        post("timeseries/byids", byExternalIds(List.of(externalId), true)).path("items");
    if (items.size() == 0) return Optional.empty();
    return Optional.of(toTimeseries(List.of(items.get(0))).get(0));
  }

  @Override
  public Timeseries createTimeseries(Timeseries ts) {
    Map<String, Object> item = new LinkedHashMap<>();
    item.put("externalId", ts.externalId());
    item.put("name", ts.name() == null ? ts.externalId() : ts.name());
    if (ts.description() != null) item.put("description", ts.description());
    item.put("metadata", ts.metadata());
    item.put("isString", ts.isString());
    if (ts.assetExternalId() != null) item.put("assetId", assetInternalId(ts.assetExternalId()));
    JsonNode created = post("timeseries", Map.of("items", List.of(item))).path("items").get(0);
    return toTimeseries(List.of(created)).get(0);
  }

  @Override
  public Timeseries updateTimeseries(Timeseries ts) {
    Map<String, Object> update = new LinkedHashMap<>();
    update.put("name", set(ts.name() == null ? ts.externalId() : ts.name()));
    update.put("description", setOrNull(ts.description()));
    update.put("metadata", set(ts.metadata()));
    update.put(
        "assetId",
        ts.assetExternalId() == null
            ? Map.of("setNull", true)
            : set(assetInternalId(ts.assetExternalId())));
    JsonNode out = post("timeseries/update", updateItems(ts.externalId(), update));
    return toTimeseries(List.of(out.path("items").get(0))).get(0);
  }

  @Override
  public void deleteTimeseries(String externalId) {
    post("timeseries/delete", byExternalIds(List.of(externalId), true));
  }

  @Override
  public Optional<Datapoint> latestDatapoint(String timeseriesExternalId) {
    Map<String, Object> body =
        Map.of(
            "items",
            List.of(Map.of("externalId", timeseriesExternalId, "before", "now")),
            "ignoreUnknownIds",
            true);
    JsonNode items = post("timeseries/data/latest", body).path("items");
    if (items.size() == 0) return Optional.empty();
    JsonNode points = items.get(0).path("datapoints");
    if (points.size() == 0) return Optional.empty();
    JsonNode p = points.get(0);
    return Optional.of(
        new Datapoint(
            Instant.ofEpochMilli(p.path("timestamp").asLong()), p.path("value").asText()));
  }

  @Override
  public void insertDatapoint(String timeseriesExternalId, Datapoint datapoint) {
    Object value = datapoint.isNumeric() ? (Object) datapoint.numericValue() : datapoint.value();
    Map<String, Object> point =
        Map.of("timestamp", datapoint.timestamp().toEpochMilli(), "value", value);
    post(
        "timeseries/data",
        Map.of(
            "items",
            List.of(Map.of("externalId", timeseriesExternalId, "datapoints", List.of(point)))));
  }

  // ---- helpers

  private Long assetInternalId(String assetExternalId) {
    return retrieveNode(assetExternalId)
        .map(Node::internalId)
        .orElseThrow(
            () ->
                new NotFoundException(
                    "Asset not found: " + assetExternalId, Map.of("externalId", assetExternalId)));
  }

  private List<Timeseries> toTimeseries(List<JsonNode> raw) {
    Set<Long> assetIds = new HashSet<>();
    for (JsonNode item : raw) {
      if (item.hasNonNull("assetId")) assetIds.add(item.get("assetId").asLong());
    }
    Map<Long, String> assetExternalIds = new HashMap<>();
    if (!assetIds.isEmpty()) {
      List<Map<String, Object>> refs = new ArrayList<>();
      assetIds.forEach(id -> refs.add(Map.of("id", id)));
      JsonNode assets =
          post("assets/byids", Map.of("items", refs, "ignoreUnknownIds", true)).path("items");
      for (JsonNode a : assets) {
        assetExternalIds.put(a.path("id").asLong(), a.path("externalId").asText(null));
      }
    }
    List<Timeseries> out = new ArrayList<>();
    for (JsonNode item : raw) {
      String asset =
          item.hasNonNull("assetId") ? assetExternalIds.get(item.get("assetId").asLong()) : null;
      out.add(
          new Timeseries(
              item.path("externalId").asText(),
              item.hasNonNull("id") ? item.get("id").asLong() : null,
              item.path("name").asText(null),
              item.path("description").asText(null),
              stringMap(item.path("metadata")),
              asset,
              item.path("isString").asBoolean(false),
              null));
    }
    return out;
  }

  private static Node toNode(JsonNode item) {
    return new Node(
        item.path("externalId").asText(),
        item.hasNonNull("id") ? item.get("id").asLong() : null,
        item.path("name").asText(""),
        item.hasNonNull("description") ? item.get("description").asText() : null,
        stringMap(item.path("metadata")),
        item.hasNonNull("parentExternalId") ? item.get("parentExternalId").asText() : null);
  }

  private static Edge toEdge(JsonNode item) {
    List<String> labels = new ArrayList<>();
    for (JsonNode l : item.path("labels")) {
      labels.add(l.path("externalId").asText());
    }
    return new Edge(
        item.path("externalId").asText(),
        item.path("sourceExternalId").asText(),
        item.path("targetExternalId").asText(),
        labels);
  }

  private static Map<String, String> stringMap(JsonNode node) {
    Map<String, String> out = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> f = fields.next();
      out.put(f.getKey(), f.getValue().asText());
    }
    return out;
  }

  private static List<Map<String, String>> labelRefs(List<String> labels) {
    List<Map<String, String>> out = new ArrayList<>();
    labels.forEach(l -> out.add(Map.of("externalId", l)));
    return out;
  }

  private static Map<String, Object> set(Object value) {
    return Map.of("set", value);
  }

  private static Map<String, Object> setOrNull(String value) {
    return value == null ? Map.of("setNull", true) : set(value);
  }

  private static Map<String, Object> updateItems(String externalId, Map<String, Object> update) {
    return Map.of("items", List.of(Map.of("externalId", externalId, "update", update)));
  }

  private static Map<String, Object> byExternalIds(List<String> ids, boolean ignoreUnknown) {
    List<Map<String, String>> refs = new ArrayList<>();
    ids.forEach(id -> refs.add(Map.of("externalId", id)));
    return Map.of("items", refs, "ignoreUnknownIds", ignoreUnknown);
  }

  /** Follows {@code nextCursor} until the listing is exhausted. */
  private List<JsonNode> list(String resource, Map<String, Object> filter) {
    List<JsonNode> out = new ArrayList<>();
    String cursor = null;
    do {
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("filter", filter);
      body.put("limit", LIST_LIMIT);
      if (cursor != null) body.put("cursor", cursor);
      JsonNode page = post(resource, body);
      page.path("items").forEach(out::add);
      JsonNode next = page.get("nextCursor");
      cursor = next == null || next.isNull() ? null : next.asText();
    } while (cursor != null);
    log.debug("Listed {} item(s) from {}", out.size(), resource);
    return out;
  }

  private JsonNode post(String resource, Object body) {
    HttpUrl url =
        BaseUrlInterceptor.relative()
            .addPathSegments("api/v1/projects")
            .addPathSegment(project)
            .addPathSegments(resource)
            .build();
    HttpResult r =
        JsonHttp.call(http, new Request.Builder().url(url).post(JsonHttp.body(body)).build());
    if (!r.isSuccessful()) throw r.toException("POST " + resource);
    return r.json();
  }
}

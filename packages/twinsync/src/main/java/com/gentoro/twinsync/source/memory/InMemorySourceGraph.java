package com.gentoro.twinsync.source.memory;

import com.gentoro.twinsync.exception.AlreadyExistsException;
import com.gentoro.twinsync.exception.NotFoundException;
import com.gentoro.twinsync.exception.TypeConflictException;
import com.gentoro.twinsync.model.Datapoint;
import com.gentoro.twinsync.model.Edge;
import com.gentoro.twinsync.model.Node;
import com.gentoro.twinsync.model.Timeseries;
import com.gentoro.twinsync.source.SourceGraphClient;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** Source graph held in memory. Assigns internal ids and enforces timeseries value types. */
public class InMemorySourceGraph implements SourceGraphClient {
  private final AtomicLong ids = new AtomicLong(1000);
  private final Map<String, Node> nodes = new ConcurrentHashMap<>();
  private final Map<String, Edge> edges = new ConcurrentHashMap<>();
  private final Set<String> labels = ConcurrentHashMap.newKeySet();
  private final Map<String, Timeseries> timeseries = new ConcurrentHashMap<>();
  private final Map<String, ConcurrentSkipListMap<Instant, Datapoint>> datapoints =
      new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> lingering = new ConcurrentHashMap<>();
  private volatile int deletionVisibilityLag;

  /**
   * Number of reads for which a deleted timeseries stays visible, mimicking eventual consistency
   * of the remote store.
   */
  public void setDeletionVisibilityLag(int reads) {
    this.deletionVisibilityLag = reads;
  }

  @Override
  public Optional<Node> retrieveNode(String externalId) {
    return Optional.ofNullable(nodes.get(externalId));
  }

  @Override
  public List<Node> listSubtree(String rootExternalId) {
    List<Node> out = new ArrayList<>();
    Node root = nodes.get(rootExternalId);
    if (root == null) return out;
    Set<String> seen = new HashSet<>();
    Deque<Node> queue = new ArrayDeque<>(List.of(root));
    while (!queue.isEmpty()) {
      Node n = queue.poll();
      if (!seen.add(n.externalId())) continue;
      out.add(n);
      nodes.values().stream()
          .filter(c -> n.externalId().equals(c.parentExternalId()))
          .sorted(Comparator.comparing(Node::externalId))
          .forEach(queue::add);
    }
    return out;
  }

  @Override
  public Node createNode(Node node) {
    Node created = node.withInternalId(ids.incrementAndGet());
    if (nodes.putIfAbsent(node.externalId(), created) != null) {
      throw new AlreadyExistsException("Node already exists: " + node.externalId());
    }
    return created;
  }

  @Override
  public Node updateNode(Node node) {
    Node current = requireNode(node.externalId());
    Node updated = node.withInternalId(current.internalId());
    nodes.put(node.externalId(), updated);
    return updated;
  }

  @Override
  public void deleteNode(String externalId) {
    nodes.remove(externalId);
  }

  @Override
  public List<Edge> listEdges(
      Collection<String> sourceExternalIds, Collection<String> targetExternalIds) {
    Set<String> sources = new HashSet<>(sourceExternalIds);
    Set<String> targets = new HashSet<>(targetExternalIds);
    return edges.values().stream()
        .filter(e -> sources.contains(e.sourceExternalId()))
        .filter(e -> targets.contains(e.targetExternalId()))
        .sorted(Comparator.comparing(Edge::externalId))
        .toList();
  }

  @Override
  public Optional<Edge> retrieveEdge(String externalId) {
    return Optional.ofNullable(edges.get(externalId));
  }

  @Override
  public Edge createEdge(Edge edge) {
    for (String label : edge.labels()) {
      if (!labels.contains(label)) {
        throw new NotFoundException("Label not defined: " + label, Map.of("label", label));
      }
    }
    if (edges.putIfAbsent(edge.externalId(), edge) != null) {
      throw new AlreadyExistsException("Edge already exists: " + edge.externalId());
    }
    return edge;
  }

  @Override
  public void updateEdgeLabels(String externalId, List<String> add, List<String> remove) {
    Edge current = edges.get(externalId);
    if (current == null) {
      throw new NotFoundException("Edge not found: " + externalId);
    }
    Set<String> next = new LinkedHashSet<>(current.labels());
    next.removeAll(remove);
    for (String label : add) {
      if (!labels.contains(label)) {
        throw new NotFoundException("Label not defined: " + label, Map.of("label", label));
      }
      next.add(label);
    }
    edges.put(externalId, current.withLabels(new ArrayList<>(next)));
  }

  @Override
  public void deleteEdge(String externalId) {
    edges.remove(externalId);
  }

  @Override
  public boolean labelExists(String labelExternalId) {
    return labels.contains(labelExternalId);
  }

  @Override
  public void createLabel(String labelExternalId) {
    if (!labels.add(labelExternalId)) {
      throw new AlreadyExistsException("Label already exists: " + labelExternalId);
    }
  }

  @Override
  public List<Timeseries> listTimeseries(Collection<String> assetExternalIds) {
    Set<String> assets = new HashSet<>(assetExternalIds);
    return timeseries.values().stream()
        .filter(t -> t.assetExternalId() != null && assets.contains(t.assetExternalId()))
        .sorted(Comparator.comparing(Timeseries::externalId))
        .toList();
  }

  @Override
  public Optional<Timeseries> retrieveTimeseries(String externalId) {
    AtomicInteger remaining = lingering.get(externalId);
    if (remaining != null) {
      if (remaining.getAndDecrement() > 0) {
        return Optional.of(
            new Timeseries(externalId, null, externalId, null, null, null, false, null));
      }
      lingering.remove(externalId);
    }
    return Optional.ofNullable(timeseries.get(externalId)).map(t -> t.withLatest(null));
  }

  @Override
  public Timeseries createTimeseries(Timeseries ts) {
    Timeseries created = ts.withInternalId(ids.incrementAndGet()).withLatest(null);
    if (timeseries.putIfAbsent(ts.externalId(), created) != null) {
      throw new AlreadyExistsException("Timeseries already exists: " + ts.externalId());
    }
    lingering.remove(ts.externalId());
    return created;
  }

  @Override
  public Timeseries updateTimeseries(Timeseries ts) {
    Timeseries current = timeseries.get(ts.externalId());
    if (current == null) {
      throw new NotFoundException("Timeseries not found: " + ts.externalId());
    }
    Timeseries updated =
        ts.withInternalId(current.internalId()).withString(current.isString()).withLatest(null);
    timeseries.put(ts.externalId(), updated);
    return updated;
  }

  @Override
  public void deleteTimeseries(String externalId) {
    if (timeseries.remove(externalId) != null) {
      datapoints.remove(externalId);
      if (deletionVisibilityLag > 0) {
        lingering.put(externalId, new AtomicInteger(deletionVisibilityLag));
      }
    }
  }

  @Override
  public Optional<Datapoint> latestDatapoint(String timeseriesExternalId) {
    ConcurrentSkipListMap<Instant, Datapoint> series = datapoints.get(timeseriesExternalId);
    if (series == null || series.isEmpty()) return Optional.empty();
    return Optional.of(series.lastEntry().getValue());
  }

  @Override
  public void insertDatapoint(String timeseriesExternalId, Datapoint datapoint) {
    Timeseries ts = timeseries.get(timeseriesExternalId);
    if (ts == null) {
      throw new NotFoundException("Timeseries not found: " + timeseriesExternalId);
    }
    if (ts.isString() == datapoint.isNumeric()) {
      throw new TypeConflictException(
          "Value '" + datapoint.value() + "' does not match series type",
          Map.of("timeseries", timeseriesExternalId, "isString", ts.isString()));
    }
    datapoints
        .computeIfAbsent(timeseriesExternalId, k -> new ConcurrentSkipListMap<>())
        .put(datapoint.timestamp(), datapoint);
  }

  /** Every stored node, in no particular order. */
  public List<Node> nodes() {
    return List.copyOf(nodes.values());
  }

  public List<Edge> edges() {
    return List.copyOf(edges.values());
  }

  private Node requireNode(String externalId) {
    Node n = nodes.get(externalId);
    if (n == null) {
      throw new NotFoundException(
          "Node not found: " + externalId, Map.of("externalId", externalId));
    }
    return n;
  }
}

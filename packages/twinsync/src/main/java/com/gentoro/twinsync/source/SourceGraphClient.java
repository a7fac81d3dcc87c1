package com.gentoro.twinsync.source;

import com.gentoro.twinsync.model.Datapoint;
import com.gentoro.twinsync.model.Edge;
import com.gentoro.twinsync.model.Node;
import com.gentoro.twinsync.model.Timeseries;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Access to the source-of-truth asset graph. Deletes of absent entities are no-ops. */
public interface SourceGraphClient extends AutoCloseable {

  Optional<Node> retrieveNode(String externalId);

  /** Every node below {@code rootExternalId}, root included and listed first. */
  List<Node> listSubtree(String rootExternalId);

  Node createNode(Node node);

  /** Replaces name, description, metadata and parent of an existing node. */
  Node updateNode(Node node);

  void deleteNode(String externalId);

  /** Edges whose source is in {@code sourceExternalIds} and target in {@code targetExternalIds}. */
  List<Edge> listEdges(Collection<String> sourceExternalIds, Collection<String> targetExternalIds);

  Optional<Edge> retrieveEdge(String externalId);

  Edge createEdge(Edge edge);

  void updateEdgeLabels(String externalId, List<String> add, List<String> remove);

  void deleteEdge(String externalId);

  boolean labelExists(String labelExternalId);

  void createLabel(String labelExternalId);

  List<Timeseries> listTimeseries(Collection<String> assetExternalIds);

  Optional<Timeseries> retrieveTimeseries(String externalId);

  Timeseries createTimeseries(Timeseries timeseries);

  /** Replaces name, description, metadata and asset; the value type cannot change. */
  Timeseries updateTimeseries(Timeseries timeseries);

  void deleteTimeseries(String externalId);

  Optional<Datapoint> latestDatapoint(String timeseriesExternalId);

  void insertDatapoint(String timeseriesExternalId, Datapoint datapoint);

  @Override
  default void close() {}
}

package com.gentoro.twinsync.model;

import java.util.List;

/**
 * Snapshot of the synchronized subtree of the source graph.
 *
 * @param nodes every node of the subtree, root included
 * @param edges explicit edges with both endpoints inside the subtree
 * @param timeseries series attached to subtree nodes, with their latest datapoint
 */
public record SourceGraph(
    Node root, List<Node> nodes, List<Edge> edges, List<Timeseries> timeseries) {

  public SourceGraph {
    nodes = List.copyOf(nodes);
    edges = List.copyOf(edges);
    timeseries = List.copyOf(timeseries);
  }
}

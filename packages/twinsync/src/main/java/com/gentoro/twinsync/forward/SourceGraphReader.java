package com.gentoro.twinsync.forward;

import com.gentoro.twinsync.ambiguity.AmbiguityDetector;
import com.gentoro.twinsync.exception.ExceptionUtil;
import com.gentoro.twinsync.exception.NotFoundException;
import com.gentoro.twinsync.model.Edge;
import com.gentoro.twinsync.model.Node;
import com.gentoro.twinsync.model.SourceGraph;
import com.gentoro.twinsync.model.Timeseries;
import com.gentoro.twinsync.source.SourceGraphClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/** Pulls the full subtree under the root from the source graph, latest datapoints included. */
public class SourceGraphReader {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(SourceGraphReader.class);

  private final SourceGraphClient client;
  private final AmbiguityDetector detector;
  private final Executor executor;

  public SourceGraphReader(
      SourceGraphClient client, AmbiguityDetector detector, Executor executor) {
    this.client = client;
    this.detector = detector;
    this.executor = executor;
  }

  public SourceGraph read(String rootExternalId) {
    Node root =
        client
            .retrieveNode(rootExternalId)
            .orElseThrow(
                () ->
                    new NotFoundException(
                        "Root node '" + rootExternalId + "' does not exist in the source graph",
                        Map.of("rootExternalId", rootExternalId)));

    List<Node> nodes = client.listSubtree(rootExternalId);
    if (nodes.isEmpty()) {
      nodes = List.of(root);
    }
    List<String> ids = nodes.stream().map(Node::externalId).toList();

    List<Edge> edges = client.listEdges(ids, ids);
    edges.forEach(detector::detectLabelAmbiguity);

    List<Timeseries> series = withLatest(client.listTimeseries(ids));
    log.info(
        "Read source subtree '{}': {} node(s), {} edge(s), {} timeseries",
        rootExternalId,
        nodes.size(),
        edges.size(),
        series.size());
    return new SourceGraph(root, nodes, edges, series);
  }

  private List<Timeseries> withLatest(List<Timeseries> series) {
    List<CompletableFuture<Timeseries>> futures = new ArrayList<>();
    for (Timeseries ts : series) {
      futures.add(
          CompletableFuture.supplyAsync(
              () -> ts.withLatest(client.latestDatapoint(ts.externalId()).orElse(null)),
              executor));
    }
    List<Timeseries> out = new ArrayList<>(futures.size());
    try {
      for (CompletableFuture<Timeseries> f : futures) {
        out.add(f.join());
      }
    } catch (CompletionException e) {
      throw ExceptionUtil.asTwinSyncException(e);
    }
    return out;
  }
}

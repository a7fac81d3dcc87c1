package com.gentoro.twinsync.source.memory;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.twinsync.exception.AlreadyExistsException;
import com.gentoro.twinsync.exception.NotFoundException;
import com.gentoro.twinsync.exception.TypeConflictException;
import com.gentoro.twinsync.model.Datapoint;
import com.gentoro.twinsync.model.Edge;
import com.gentoro.twinsync.model.Node;
import com.gentoro.twinsync.model.Timeseries;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemorySourceGraphTest {

  private InMemorySourceGraph graph;

  @BeforeEach
  void setUp() {
    graph = new InMemorySourceGraph();
    graph.createNode(new Node("root", null, "root", null, Map.of(), null));
    graph.createNode(new Node("b", null, "b", null, Map.of(), "root"));
    graph.createNode(new Node("a", null, "a", null, Map.of(), "root"));
    graph.createNode(new Node("a1", null, "a1", null, Map.of(), "a"));
    graph.createNode(new Node("elsewhere", null, "elsewhere", null, Map.of(), null));
  }

  @Test
  void subtreeListsRootFirstThenBreadthFirst() {
    List<String> ids = graph.listSubtree("root").stream().map(Node::externalId).toList();

    assertEquals(List.of("root", "a", "b", "a1"), ids);
    assertTrue(graph.listSubtree("missing").isEmpty());
  }

  @Test
  void assignsInternalIdsAndRejectsDuplicates() {
    Node root = graph.retrieveNode("root").orElseThrow();

    assertNotNull(root.internalId());
    assertThrows(
        AlreadyExistsException.class,
        () -> graph.createNode(new Node("a", null, "again", null, null, "root")));
  }

  @Test
  void edgeLabelsMustBeDefined() {
    Edge edge = new Edge("e1", "a", "b", List.of("flows"));

    assertThrows(NotFoundException.class, () -> graph.createEdge(edge));

    graph.createLabel("flows");
    graph.createEdge(edge);
    graph.createLabel("feeds");
    graph.updateEdgeLabels("e1", List.of("feeds"), List.of("flows"));

    assertEquals(List.of("feeds"), graph.retrieveEdge("e1").orElseThrow().labels());
    assertEquals(1, graph.listEdges(List.of("a"), List.of("b", "root")).size());
    assertTrue(graph.listEdges(List.of("b"), List.of("a")).isEmpty());
  }

  @Test
  void datapointMustMatchSeriesType() {
    graph.createTimeseries(new Timeseries("ts", null, "ts", null, null, "a", false, null));
    Instant t = Instant.parse("2024-01-01T00:00:00Z");

    graph.insertDatapoint("ts", new Datapoint(t, "12.5"));

    assertThrows(
        TypeConflictException.class,
        () -> graph.insertDatapoint("ts", new Datapoint(t.plusSeconds(1), "open")));
    assertEquals("12.5", graph.latestDatapoint("ts").orElseThrow().value());
  }

  @Test
  void updateKeepsTheValueType() {
    graph.createTimeseries(new Timeseries("ts", null, "ts", null, null, "a", true, null));

    Timeseries updated =
        graph.updateTimeseries(new Timeseries("ts", null, "renamed", null, null, "b", false, null));

    assertTrue(updated.isString());
    assertEquals("renamed", updated.name());
    List<String> underB =
        graph.listTimeseries(List.of("b")).stream().map(Timeseries::externalId).toList();
    assertEquals(List.of("ts"), underB);
  }

  @Test
  void deletedSeriesLingersForConfiguredReads() {
    graph.setDeletionVisibilityLag(2);
    graph.createTimeseries(new Timeseries("ts", null, "ts", null, null, "a", false, null));

    graph.deleteTimeseries("ts");

    assertTrue(graph.retrieveTimeseries("ts").isPresent());
    assertTrue(graph.retrieveTimeseries("ts").isPresent());
    assertTrue(graph.retrieveTimeseries("ts").isEmpty());
  }

  @Test
  void deletesOfMissingEntitiesAreNoOps() {
    graph.deleteNode("missing");
    graph.deleteEdge("missing");
    graph.deleteTimeseries("missing");

    assertEquals(5, graph.nodes().size());
  }
}

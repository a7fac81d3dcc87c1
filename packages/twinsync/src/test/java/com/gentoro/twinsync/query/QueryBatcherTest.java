package com.gentoro.twinsync.query;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.twinsync.exception.QueryLimitException;
import com.gentoro.twinsync.model.NodeTwinProperties;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.twin.TwinGraphClient;
import com.gentoro.twinsync.twin.memory.InMemoryTwinGraph;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class QueryBatcherTest {

  private final ExecutorService pool = Executors.newFixedThreadPool(3);

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  private static List<String> ids(int n) {
    List<String> ids = new ArrayList<>();
    for (int i = 0; i < n; i++) ids.add(String.format("twin-%03d", i));
    return ids;
  }

  @Test
  void partitionsIntoChunksOfAtMostSize() {
    List<List<String>> chunks = QueryBatcher.partition(ids(250), 100);

    assertEquals(List.of(100, 100, 50), chunks.stream().map(List::size).toList());
  }

  @Test
  @DisplayName("250 ids run as 100/100/50 and the merged rows match an unbatched lookup")
  void batchedResultEqualsUnbatched() {
    // Arrange
    InMemoryTwinGraph graph = new InMemoryTwinGraph(100_000);
    List<String> ids = ids(250);
    for (String id : ids) {
      graph.upsertTwin(Twin.node(id, new NodeTwinProperties(id, id, "", null, Map.of())));
    }
    QueryBatcher batcher = new QueryBatcher(graph, 100, pool);

    // Act
    List<Map<String, Object>> rows =
        QueryBatcher.unwrapRows(
            TwinQueryTemplate.TWINS_BY_ID, batcher.execute(TwinQueryTemplate.TWINS_BY_ID, ids));

    // Assert
    List<Integer> batchSizes =
        graph.queryLog().stream().map(q -> q.ids().size()).sorted().toList();
    assertEquals(List.of(50, 100, 100), batchSizes);
    Set<Object> returned = rows.stream().map(r -> r.get("$dtId")).collect(Collectors.toSet());
    assertEquals(Set.copyOf(ids), returned);
    assertEquals(250, rows.size());
  }

  @Test
  void duplicatesAreQueriedOnce() {
    TwinGraphClient client = mock(TwinGraphClient.class);
    when(client.query(any())).thenReturn(List.of());
    QueryBatcher batcher = new QueryBatcher(client, 100, null);

    batcher.execute(TwinQueryTemplate.TWINS_BY_ID, List.of("a", "b", "a"));

    verify(client).query(new TwinQuery(TwinQueryTemplate.TWINS_BY_ID, List.of("a", "b")));
  }

  @Test
  void emptyIdSetIssuesNoQuery() {
    TwinGraphClient client = mock(TwinGraphClient.class);

    QueryBatcher batcher = new QueryBatcher(client, 100, pool);

    assertTrue(batcher.execute(TwinQueryTemplate.TWINS_BY_ID, List.of()).isEmpty());
    verifyNoInteractions(client);
  }

  @Test
  @DisplayName("query text over the remote limit fails the whole call")
  void overlongQueryTextIsFatal() {
    InMemoryTwinGraph graph = new InMemoryTwinGraph(500);
    List<String> longIds = new ArrayList<>();
    for (int i = 0; i < 10; i++) longIds.add("x".repeat(120) + i);

    QueryBatcher sequential = new QueryBatcher(graph, 100, null);
    QueryBatcher concurrent = new QueryBatcher(graph, 5, pool);

    assertThrows(
        QueryLimitException.class,
        () -> sequential.execute(TwinQueryTemplate.TWINS_BY_ID, longIds));
    assertThrows(
        QueryLimitException.class,
        () -> concurrent.execute(TwinQueryTemplate.TWINS_BY_ID, longIds));
  }

  @Test
  void renderEscapesQuotes() {
    String text = TwinQueryTemplate.TWINS_BY_ID.render(List.of("a", "o'neil"));

    assertEquals("SELECT T FROM DIGITALTWINS T WHERE T.$dtId IN ['a', 'o\\'neil']", text);
  }
}

package com.gentoro.twinsync.forward;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.gentoro.twinsync.diff.TwinGraphDiff;
import com.gentoro.twinsync.diff.TwinGraphDiff.RelationshipUpdate;
import com.gentoro.twinsync.diff.TwinGraphDiff.TwinUpdate;
import com.gentoro.twinsync.exception.NotFoundException;
import com.gentoro.twinsync.exception.ReconciliationException;
import com.gentoro.twinsync.forward.progress.NoOpProgressSink;
import com.gentoro.twinsync.forward.progress.ProgressSink;
import com.gentoro.twinsync.model.NodeTwinProperties;
import com.gentoro.twinsync.model.PatchOperation;
import com.gentoro.twinsync.model.RelationshipKind;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinRelationship;
import com.gentoro.twinsync.twin.TwinGraphClient;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DiffApplierTest {

  private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");

  @Mock private TwinGraphClient client;
  @Mock private ProgressSink progress;

  private final ExecutorService pool = Executors.newFixedThreadPool(4);

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  private static Twin twin(String id) {
    return Twin.node(id, new NodeTwinProperties(id, id, "", null, Map.of()));
  }

  private static TwinGraphDiff fullDiff() {
    TwinRelationship stale =
        new TwinRelationship("a->old", "a", "old", RelationshipKind.PARENT, null, null);
    TwinRelationship fresh =
        new TwinRelationship("a->b", "a", "b", RelationshipKind.PARENT, null, null);
    TwinRelationship edge =
        new TwinRelationship("e1", "a", "b", RelationshipKind.EXPLICIT, "x", null);
    return new TwinGraphDiff(
        List.of(twin("a"), twin("b")),
        List.of(new TwinUpdate("c", List.of(PatchOperation.replace("/displayName", "C")))),
        List.of("old"),
        List.of(fresh),
        List.of(new RelationshipUpdate(edge, List.of(PatchOperation.replace("/labels", "y")))),
        List.of(stale));
  }

  @Test
  @DisplayName("twin upserts, relationship deletes, relationship writes, then twin deletes")
  void tiersRunInOrder() {
    // Arrange
    DiffApplier applier = new DiffApplier(client, pool, NoOpProgressSink.INSTANCE);

    // Act
    applier.apply(fullDiff(), NOW);

    // Assert
    InOrder order = inOrder(client);
    order.verify(client, times(2)).upsertTwin(any());
    order.verify(client).deleteRelationship("a", "a->old");
    order.verify(client).upsertRelationship(any());
    order.verify(client).deleteTwin("old");
    verify(client).updateTwin(eq("c"), anyList());
    verify(client).updateRelationship(eq("a"), eq("e1"), anyList());
  }

  @Test
  void newRelationshipsAreStampedWithRunStart() {
    DiffApplier applier = new DiffApplier(client, null, NoOpProgressSink.INSTANCE);

    applier.apply(fullDiff(), NOW);

    ArgumentCaptor<TwinRelationship> captor = ArgumentCaptor.forClass(TwinRelationship.class);
    verify(client).upsertRelationship(captor.capture());
    assertEquals(NOW, captor.getValue().createdAt());
  }

  @Test
  void failedTierStopsLaterTiers() {
    // Arrange
    doThrow(new NotFoundException("twin endpoint missing"))
        .when(client)
        .deleteRelationship(anyString(), anyString());
    DiffApplier applier = new DiffApplier(client, pool, progress);

    // Act
    ReconciliationException ex =
        assertThrows(ReconciliationException.class, () -> applier.apply(fullDiff(), NOW));

    // Assert
    assertEquals("tier-2-relationship-deletes", ex.getContext().get("tier"));
    assertInstanceOf(NotFoundException.class, ex.getCause());
    verify(client, times(2)).upsertTwin(any());
    verify(client, never()).upsertRelationship(any());
    verify(client, never()).deleteTwin(anyString());
    verify(progress).endStageError(eq("tier-2-relationship-deletes"), anyString(), anyMap());
  }

  @Test
  void emptyDiffWritesNothing() {
    TwinGraphDiff empty =
        new TwinGraphDiff(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());

    new DiffApplier(client, pool, progress).apply(empty, NOW);

    verifyNoInteractions(client, progress);
  }
}

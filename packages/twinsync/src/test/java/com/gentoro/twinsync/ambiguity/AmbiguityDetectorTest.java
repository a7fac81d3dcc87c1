package com.gentoro.twinsync.ambiguity;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.twinsync.ambiguity.Ambiguity.AmbiguityKind;
import com.gentoro.twinsync.model.Edge;
import com.gentoro.twinsync.model.ProjectedGraph;
import com.gentoro.twinsync.model.RelationshipKind;
import com.gentoro.twinsync.model.TwinRelationship;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AmbiguityDetectorTest {

  private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

  private final AmbiguityDetector detector = new AmbiguityDetector();

  private static TwinRelationship parent(String id, String child, String parent, Instant at) {
    return new TwinRelationship(id, child, parent, RelationshipKind.PARENT, null, at);
  }

  @Test
  void latestCreatedWins() {
    TwinRelationship older = parent("z", "c", "p1", T0);
    TwinRelationship newer = parent("a", "c", "p2", T0.plusSeconds(1));

    assertEquals(newer, detector.resolve(List.of(older, newer)).orElseThrow());
  }

  @Test
  @DisplayName("a relationship without creation time loses to any dated one")
  void missingCreationTimeIsOldest() {
    TwinRelationship undated = parent("zz", "c", "p1", null);
    TwinRelationship dated = parent("aa", "c", "p2", Instant.EPOCH);

    assertEquals(dated, detector.resolve(List.of(undated, dated)).orElseThrow());
  }

  @Test
  void tiesGoToGreatestRelationshipId() {
    TwinRelationship a = parent("c->p1", "c", "p1", T0);
    TwinRelationship b = parent("c->p2", "c", "p2", T0);

    assertEquals(b, detector.resolve(List.of(b, a)).orElseThrow());
    assertEquals(b, detector.resolve(List.of(a, b)).orElseThrow());
  }

  @Test
  void noCandidatesResolveToEmpty() {
    assertTrue(detector.resolve(List.of()).isEmpty());
  }

  @Test
  void detectsMultipleParentsAndAttachments() {
    // Arrange
    List<TwinRelationship> rels =
        List.of(
            parent("c->p1", "c", "p1", T0),
            parent("c->p2", "c", "p2", T0),
            parent("d->p1", "d", "p1", T0),
            new TwinRelationship("p1->ts", "p1", "ts", RelationshipKind.ATTACHMENT, null, null),
            new TwinRelationship("p2->ts", "p2", "ts", RelationshipKind.ATTACHMENT, null, null),
            new TwinRelationship("e1", "c", "d", RelationshipKind.EXPLICIT, "x", null),
            new TwinRelationship("e2", "c", "d", RelationshipKind.EXPLICIT, "y", null));
    ProjectedGraph graph = new ProjectedGraph("p1", Map.of(), rels, Set.of());

    // Act
    List<Ambiguity> found = detector.detect(graph);

    // Assert
    assertEquals(
        List.of(
            new Ambiguity(AmbiguityKind.MULTIPLE_PARENTS, "c", List.of("c->p1", "c->p2")),
            new Ambiguity(AmbiguityKind.MULTIPLE_ATTACHMENTS, "ts", List.of("p1->ts", "p2->ts"))),
        found);
  }

  @Test
  void flagsLabelsContainingTheSeparator() {
    Edge edge = new Edge("e1", "a", "b", List.of("ok", "not,ok"));

    Ambiguity a = detector.detectLabelAmbiguity(edge).orElseThrow();

    assertEquals(AmbiguityKind.LABEL_CONTAINS_SEPARATOR, a.kind());
    assertTrue(detector.detectLabelAmbiguity(edge.withLabels(List.of("ok"))).isEmpty());
  }
}

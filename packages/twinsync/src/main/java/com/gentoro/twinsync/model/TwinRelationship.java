package com.gentoro.twinsync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Typed relationship in the twin graph.
 *
 * @param labels comma-joined label string, only meaningful for {@link RelationshipKind#EXPLICIT}
 * @param createdAt creation instant stamped by the writer, {@code null} when unknown
 */
public record TwinRelationship(
    String relationshipId,
    String sourceTwinId,
    String targetTwinId,
    RelationshipKind kind,
    String labels,
    Instant createdAt) {

  public TwinRelationship {
    Objects.requireNonNull(relationshipId, "relationshipId");
    Objects.requireNonNull(sourceTwinId, "sourceTwinId");
    Objects.requireNonNull(targetTwinId, "targetTwinId");
    Objects.requireNonNull(kind, "kind");
  }

  public RelationshipKey key() {
    return new RelationshipKey(sourceTwinId, relationshipId);
  }

  public TwinRelationship withCreatedAt(Instant instant) {
    return new TwinRelationship(
        relationshipId, sourceTwinId, targetTwinId, kind, labels, instant);
  }

  /** Same endpoints and kind, ignoring labels and creation time. */
  public boolean sameShape(TwinRelationship other) {
    return other != null
        && kind == other.kind
        && sourceTwinId.equals(other.sourceTwinId)
        && targetTwinId.equals(other.targetTwinId);
  }

  /** Labels compared with null and empty treated alike. */
  public boolean sameLabels(TwinRelationship other) {
    return normalized(labels).equals(normalized(other.labels));
  }

  private static String normalized(String s) {
    return s == null ? "" : s;
  }
}

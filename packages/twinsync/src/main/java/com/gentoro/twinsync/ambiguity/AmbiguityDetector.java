package com.gentoro.twinsync.ambiguity;

import com.gentoro.twinsync.ambiguity.Ambiguity.AmbiguityKind;
import com.gentoro.twinsync.mapping.EntityMapper;
import com.gentoro.twinsync.model.Edge;
import com.gentoro.twinsync.model.ProjectedGraph;
import com.gentoro.twinsync.model.RelationshipKind;
import com.gentoro.twinsync.model.TwinRelationship;
import com.gentoro.twinsync.utility.JacksonUtility;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Finds twin graph states with more than one parent or attachment, and applies the
 * latest-created-wins rule when the reverse path has to pick one.
 */
public class AmbiguityDetector {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(AmbiguityDetector.class);

  /**
   * Latest {@code createdAt} first; a missing value sorts as oldest and ties go to the
   * lexicographically greatest relationship id.
   */
  public static final Comparator<TwinRelationship> PRECEDENCE =
      Comparator.comparing(
              (TwinRelationship r) -> r.createdAt() == null ? Instant.MIN : r.createdAt())
          .thenComparing(TwinRelationship::relationshipId)
          .reversed();

  /** Reports findings; nothing is changed in the twin graph. */
  public List<Ambiguity> detect(ProjectedGraph graph) {
    List<Ambiguity> findings = new ArrayList<>();
    findings.addAll(
        group(
            graph.relationships(),
            RelationshipKind.PARENT,
            TwinRelationship::sourceTwinId,
            AmbiguityKind.MULTIPLE_PARENTS));
    findings.addAll(
        group(
            graph.relationships(),
            RelationshipKind.ATTACHMENT,
            TwinRelationship::targetTwinId,
            AmbiguityKind.MULTIPLE_ATTACHMENTS));
    findings.forEach(a -> log.warn("Ambiguous twin graph state: {}", JacksonUtility.toJson(a)));
    return findings;
  }

  private static List<Ambiguity> group(
      List<TwinRelationship> relationships,
      RelationshipKind kind,
      Function<TwinRelationship, String> subject,
      AmbiguityKind ambiguityKind) {
    Map<String, List<String>> bySubject = new LinkedHashMap<>();
    for (TwinRelationship r : relationships) {
      if (r.kind() != kind) continue;
      bySubject.computeIfAbsent(subject.apply(r), k -> new ArrayList<>()).add(r.relationshipId());
    }
    List<Ambiguity> out = new ArrayList<>();
    bySubject.forEach(
        (twinId, ids) -> {
          if (ids.size() > 1) out.add(new Ambiguity(ambiguityKind, twinId, ids));
        });
    return out;
  }

  /** Picks the winning relationship; the others are logged as dropped. */
  public Optional<TwinRelationship> resolve(List<TwinRelationship> candidates) {
    if (candidates == null || candidates.isEmpty()) return Optional.empty();
    List<TwinRelationship> ordered = new ArrayList<>(candidates);
    ordered.sort(PRECEDENCE);
    TwinRelationship winner = ordered.get(0);
    for (TwinRelationship dropped : ordered.subList(1, ordered.size())) {
      log.error(
          "Ambiguous {} relationship: '{}' wins over '{}' ({} -> {})",
          dropped.kind().relationshipName(),
          winner.relationshipId(),
          dropped.relationshipId(),
          dropped.sourceTwinId(),
          dropped.targetTwinId());
    }
    return Optional.of(winner);
  }

  public Optional<Ambiguity> detectLabelAmbiguity(Edge edge) {
    List<String> offending =
        edge.labels().stream().filter(l -> l.contains(EntityMapper.LABEL_SEPARATOR)).toList();
    if (offending.isEmpty()) return Optional.empty();
    Ambiguity a =
        new Ambiguity(AmbiguityKind.LABEL_CONTAINS_SEPARATOR, edge.externalId(), List.of());
    log.warn(
        "Edge '{}' has labels containing '{}': {}; they will not round-trip",
        edge.externalId(),
        EntityMapper.LABEL_SEPARATOR,
        offending);
    return Optional.of(a);
  }
}

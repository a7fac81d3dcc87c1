package com.gentoro.twinsync.diff;

import com.gentoro.twinsync.diff.TwinGraphDiff.RelationshipUpdate;
import com.gentoro.twinsync.diff.TwinGraphDiff.TwinUpdate;
import com.gentoro.twinsync.identity.IdentityNormalizer;
import com.gentoro.twinsync.mapping.EntityMapper;
import com.gentoro.twinsync.model.Edge;
import com.gentoro.twinsync.model.Node;
import com.gentoro.twinsync.model.PatchOperation;
import com.gentoro.twinsync.model.ProjectedGraph;
import com.gentoro.twinsync.model.RelationshipKey;
import com.gentoro.twinsync.model.SourceGraph;
import com.gentoro.twinsync.model.Timeseries;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinRelationship;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares the projection of a source subtree with what the twin graph holds.
 *
 * <p>Twins are keyed by twin id, relationships by source twin and relationship id. An explicit
 * relationship whose endpoints moved is deleted and re-created, one whose labels alone changed is
 * patched. Twins that are present but failed to decode are replaced wholesale, or deleted when
 * they have no source counterpart.
 */
public class GraphDiffer {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(GraphDiffer.class);

  public TwinGraphDiff diff(SourceGraph source, ProjectedGraph current) {
    Map<String, Twin> targetTwins = targetTwins(source);
    Map<RelationshipKey, TwinRelationship> targetRels = targetRelationships(source, targetTwins);

    List<Twin> twinCreates = new ArrayList<>();
    List<TwinUpdate> twinUpdates = new ArrayList<>();
    List<String> twinDeletes = new ArrayList<>();
    for (Twin target : targetTwins.values()) {
      Twin existing = current.twins().get(target.twinId());
      if (existing == null || existing.model() != target.model()) {
        twinCreates.add(target);
        continue;
      }
      List<PatchOperation> patch = TwinPatchBuilder.build(existing, target);
      if (!patch.isEmpty()) {
        twinUpdates.add(new TwinUpdate(target.twinId(), patch));
      }
    }
    for (String twinId : current.twins().keySet()) {
      if (!targetTwins.containsKey(twinId)) twinDeletes.add(twinId);
    }
    for (String twinId : current.invalidTwinIds()) {
      if (!targetTwins.containsKey(twinId)) twinDeletes.add(twinId);
    }

    Map<RelationshipKey, TwinRelationship> currentRels = new LinkedHashMap<>();
    current.relationships().forEach(r -> currentRels.put(r.key(), r));

    List<TwinRelationship> relCreates = new ArrayList<>();
    List<RelationshipUpdate> relUpdates = new ArrayList<>();
    List<TwinRelationship> relDeletes = new ArrayList<>();
    for (TwinRelationship target : targetRels.values()) {
      TwinRelationship existing = currentRels.get(target.key());
      if (existing == null) {
        relCreates.add(target);
      } else if (!existing.sameShape(target)) {
        relDeletes.add(existing);
        relCreates.add(target);
      } else if (!existing.sameLabels(target)) {
        relUpdates.add(new RelationshipUpdate(existing, labelPatch(existing, target)));
      }
    }
    for (TwinRelationship existing : currentRels.values()) {
      if (targetRels.containsKey(existing.key())) continue;
      if (existing.kind().isImplicit()
          && !existing
              .relationshipId()
              .equals(
                  EntityMapper.canonicalRelationshipId(
                      existing.sourceTwinId(), existing.targetTwinId()))) {
        log.warn(
            "Relationship '{}' ({}) is likely not created by the forward sync; replacing it",
            existing.key(),
            existing.kind().relationshipName());
      }
      relDeletes.add(existing);
    }

    return new TwinGraphDiff(
        twinCreates, twinUpdates, twinDeletes, relCreates, relUpdates, relDeletes);
  }

  private static List<PatchOperation> labelPatch(
      TwinRelationship existing, TwinRelationship target) {
    String path = PatchOperation.pointer("labels");
    if (target.labels() == null || target.labels().isEmpty()) {
      return List.of(PatchOperation.remove(path));
    }
    if (existing.labels() == null) {
      return List.of(PatchOperation.add(path, target.labels()));
    }
    return List.of(PatchOperation.replace(path, target.labels()));
  }

  /** First entity wins when two source ids collapse onto one twin id. */
  private static Map<String, Twin> targetTwins(SourceGraph source) {
    Map<String, Twin> out = new LinkedHashMap<>();
    for (Node node : source.nodes()) {
      put(out, EntityMapper.mapNodeToTwin(node), node.externalId());
    }
    for (Timeseries ts : source.timeseries()) {
      put(out, EntityMapper.mapTimeseriesToTwin(ts), ts.externalId());
    }
    return out;
  }

  private static void put(Map<String, Twin> out, Twin twin, String externalId) {
    if (!IdentityNormalizer.isLossless(externalId)) {
      log.warn(
          "External id '{}' contains a twin id placeholder character; it maps to '{}' lossily",
          externalId,
          twin.twinId());
    }
    Twin previous = out.putIfAbsent(twin.twinId(), twin);
    if (previous != null) {
      log.error(
          "External ids '{}' and '{}' both map to twin id '{}'; keeping the first",
          previous.properties().externalId(),
          externalId,
          twin.twinId());
    }
  }

  private static Map<RelationshipKey, TwinRelationship> targetRelationships(
      SourceGraph source, Map<String, Twin> twins) {
    Map<RelationshipKey, TwinRelationship> out = new LinkedHashMap<>();
    for (Node node : source.nodes()) {
      if (node.externalId().equals(source.root().externalId())) continue;
      EntityMapper.parentRelationship(node)
          .filter(r -> twins.containsKey(r.targetTwinId()))
          .ifPresent(r -> out.putIfAbsent(r.key(), r));
    }
    for (Timeseries ts : source.timeseries()) {
      EntityMapper.attachmentRelationship(ts)
          .filter(r -> twins.containsKey(r.sourceTwinId()))
          .ifPresent(r -> out.putIfAbsent(r.key(), r));
    }
    for (Edge edge : source.edges()) {
      TwinRelationship r = EntityMapper.mapEdgeToRelationship(edge);
      if (twins.containsKey(r.sourceTwinId()) && twins.containsKey(r.targetTwinId())) {
        out.putIfAbsent(r.key(), r);
      }
    }
    return out;
  }
}

package com.gentoro.twinsync.diff;

import com.gentoro.twinsync.model.PatchOperation;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinRelationship;
import java.util.List;

/** Writes needed to bring the twin graph in line with the source graph. */
public record TwinGraphDiff(
    List<Twin> twinCreates,
    List<TwinUpdate> twinUpdates,
    List<String> twinDeletes,
    List<TwinRelationship> relationshipCreates,
    List<RelationshipUpdate> relationshipUpdates,
    List<TwinRelationship> relationshipDeletes) {

  public record TwinUpdate(String twinId, List<PatchOperation> patch) {
    public TwinUpdate {
      patch = List.copyOf(patch);
    }
  }

  public record RelationshipUpdate(TwinRelationship relationship, List<PatchOperation> patch) {
    public RelationshipUpdate {
      patch = List.copyOf(patch);
    }
  }

  public TwinGraphDiff {
    twinCreates = List.copyOf(twinCreates);
    twinUpdates = List.copyOf(twinUpdates);
    twinDeletes = List.copyOf(twinDeletes);
    relationshipCreates = List.copyOf(relationshipCreates);
    relationshipUpdates = List.copyOf(relationshipUpdates);
    relationshipDeletes = List.copyOf(relationshipDeletes);
  }

  public boolean isEmpty() {
    return totalOperations() == 0;
  }

  public int totalOperations() {
    return twinCreates.size()
        + twinUpdates.size()
        + twinDeletes.size()
        + relationshipCreates.size()
        + relationshipUpdates.size()
        + relationshipDeletes.size();
  }
}

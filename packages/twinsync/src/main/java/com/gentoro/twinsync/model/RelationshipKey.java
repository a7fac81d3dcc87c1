package com.gentoro.twinsync.model;

/** Relationship ids are only unique per source twin. */
public record RelationshipKey(String sourceTwinId, String relationshipId) {

  @Override
  public String toString() {
    return sourceTwinId + "/relationships/" + relationshipId;
  }
}

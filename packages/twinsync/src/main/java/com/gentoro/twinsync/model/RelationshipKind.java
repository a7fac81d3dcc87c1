package com.gentoro.twinsync.model;

import com.gentoro.twinsync.exception.ValidationException;

/** Relationship names used in the twin graph. */
public enum RelationshipKind {
  /** Child asset to parent asset. */
  PARENT("parent"),
  /** Asset to attached timeseries. */
  ATTACHMENT("contains"),
  /** Labelled relationship mirroring a source graph edge. */
  EXPLICIT("relatesTo");

  private final String relationshipName;

  RelationshipKind(String relationshipName) {
    this.relationshipName = relationshipName;
  }

  public String relationshipName() {
    return relationshipName;
  }

  public boolean isImplicit() {
    return this != EXPLICIT;
  }

  public static RelationshipKind fromName(String name) {
    for (RelationshipKind k : values()) {
      if (k.relationshipName.equals(name)) return k;
    }
    throw new ValidationException("Unknown relationship name: " + name);
  }
}

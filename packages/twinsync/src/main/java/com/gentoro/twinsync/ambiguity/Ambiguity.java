package com.gentoro.twinsync.ambiguity;

import java.util.List;

/**
 * A twin graph state the source model cannot represent.
 *
 * @param subject twin id or edge external id the finding is about
 * @param relationshipIds the conflicting relationships, empty for label findings
 */
public record Ambiguity(AmbiguityKind kind, String subject, List<String> relationshipIds) {

  public enum AmbiguityKind {
    /** A node twin with more than one outgoing parent relationship. */
    MULTIPLE_PARENTS,
    /** A timeseries twin with more than one incoming contains relationship. */
    MULTIPLE_ATTACHMENTS,
    /** An edge label containing the label separator. */
    LABEL_CONTAINS_SEPARATOR
  }

  public Ambiguity {
    relationshipIds = List.copyOf(relationshipIds);
  }
}

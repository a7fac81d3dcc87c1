package com.gentoro.twinsync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/** Explicit, labelled relationship between two source graph nodes. Labels keep insertion order. */
public record Edge(
    String externalId, String sourceExternalId, String targetExternalId, List<String> labels) {

  public Edge {
    Objects.requireNonNull(externalId, "externalId");
    Objects.requireNonNull(sourceExternalId, "sourceExternalId");
    Objects.requireNonNull(targetExternalId, "targetExternalId");
    labels =
        labels == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(labels)));
  }

  public Edge withLabels(List<String> newLabels) {
    return new Edge(externalId, sourceExternalId, targetExternalId, newLabels);
  }
}

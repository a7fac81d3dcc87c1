package com.gentoro.twinsync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An asset of the source graph.
 *
 * @param internalId opaque numeric id assigned by the source graph, {@code null} before creation
 * @param parentExternalId {@code null} for a root
 */
public record Node(
    String externalId,
    Long internalId,
    String name,
    String description,
    Map<String, String> metadata,
    String parentExternalId) {

  public Node {
    Objects.requireNonNull(externalId, "externalId");
    Objects.requireNonNull(name, "name");
    metadata =
        metadata == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public boolean isRoot() {
    return parentExternalId == null;
  }

  public Node withParent(String parent) {
    return new Node(externalId, internalId, name, description, metadata, parent);
  }

  public Node withInternalId(Long id) {
    return new Node(externalId, id, name, description, metadata, parentExternalId);
  }

  public Node withFields(String newName, String newDescription, Map<String, String> newMetadata) {
    return new Node(externalId, internalId, newName, newDescription, newMetadata, parentExternalId);
  }
}

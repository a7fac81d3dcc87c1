package com.gentoro.twinsync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What the twin graph currently holds under the root twin.
 *
 * @param twins decodable twins keyed by twin id
 * @param relationships outgoing relationships of the subtree's node twins
 * @param invalidTwinIds twins present in the twin graph that failed to decode
 */
public record ProjectedGraph(
    String rootTwinId,
    Map<String, Twin> twins,
    List<TwinRelationship> relationships,
    Set<String> invalidTwinIds) {

  public ProjectedGraph {
    twins = Collections.unmodifiableMap(new LinkedHashMap<>(twins));
    relationships = List.copyOf(relationships);
    invalidTwinIds = Set.copyOf(invalidTwinIds);
  }

  public static ProjectedGraph empty(String rootTwinId) {
    return new ProjectedGraph(rootTwinId, Map.of(), List.of(), Set.of());
  }

  public boolean hasRoot() {
    return twins.containsKey(rootTwinId);
  }
}

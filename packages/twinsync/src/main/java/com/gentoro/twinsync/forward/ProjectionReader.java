package com.gentoro.twinsync.forward;

import com.gentoro.twinsync.exception.ValidationException;
import com.gentoro.twinsync.mapping.TwinCodec;
import com.gentoro.twinsync.model.ProjectedGraph;
import com.gentoro.twinsync.model.RelationshipKind;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinRelationship;
import com.gentoro.twinsync.query.QueryBatcher;
import com.gentoro.twinsync.query.TwinQueryTemplate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads what the twin graph holds under the root twin: node twins reached by walking parent
 * relationships downwards, their outgoing relationships, and the timeseries twins they contain.
 */
public class ProjectionReader {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(ProjectionReader.class);

  private final QueryBatcher batcher;

  public ProjectionReader(QueryBatcher batcher) {
    this.batcher = batcher;
  }

  public ProjectedGraph read(String rootTwinId) {
    Set<String> nodeIds = new LinkedHashSet<>();
    nodeIds.add(rootTwinId);
    List<String> frontier = List.of(rootTwinId);
    while (!frontier.isEmpty()) {
      List<String> next = new ArrayList<>();
      for (Map<String, Object> rel : fetch(TwinQueryTemplate.CHILD_RELATIONSHIPS, frontier)) {
        String child = String.valueOf(rel.get(TwinCodec.SOURCE_ID));
        if (nodeIds.add(child)) next.add(child);
      }
      frontier = next;
    }

    Map<String, Twin> twins = new LinkedHashMap<>();
    Set<String> invalid = new LinkedHashSet<>();
    decodeTwins(fetch(TwinQueryTemplate.TWINS_BY_ID, nodeIds), twins, invalid);
    if (!twins.containsKey(rootTwinId) && !invalid.contains(rootTwinId)) {
      log.info("Root twin '{}' does not exist yet", rootTwinId);
      return ProjectedGraph.empty(rootTwinId);
    }

    List<TwinRelationship> relationships = new ArrayList<>();
    for (Map<String, Object> raw : fetch(TwinQueryTemplate.OUTGOING_RELATIONSHIPS, nodeIds)) {
      try {
        relationships.add(TwinCodec.decodeRelationship(raw));
      } catch (ValidationException e) {
        log.error(
            "Skipping undecodable relationship {}: {}",
            raw.get(TwinCodec.RELATIONSHIP_ID),
            e.getMessage());
      }
    }

    Set<String> seriesIds = new LinkedHashSet<>();
    for (TwinRelationship r : relationships) {
      if (r.kind() == RelationshipKind.ATTACHMENT && !twins.containsKey(r.targetTwinId())) {
        seriesIds.add(r.targetTwinId());
      }
    }
    Map<String, Twin> series = new LinkedHashMap<>();
    decodeTwins(fetch(TwinQueryTemplate.TWINS_BY_ID, seriesIds), series, invalid);
    series.values().stream().filter(Twin::isTimeseries).forEach(t -> twins.put(t.twinId(), t));

    log.info(
        "Read twin projection '{}': {} twin(s), {} relationship(s), {} undecodable",
        rootTwinId,
        twins.size(),
        relationships.size(),
        invalid.size());
    return new ProjectedGraph(rootTwinId, twins, relationships, invalid);
  }

  private List<Map<String, Object>> fetch(TwinQueryTemplate template, Collection<String> ids) {
    return QueryBatcher.unwrapRows(template, batcher.execute(template, ids));
  }

  private static void decodeTwins(
      List<Map<String, Object>> rows, Map<String, Twin> into, Set<String> invalid) {
    for (Map<String, Object> raw : rows) {
      try {
        Twin t = TwinCodec.decodeTwin(raw);
        into.put(t.twinId(), t);
      } catch (ValidationException e) {
        Object id = raw.get(TwinCodec.DT_ID);
        log.warn("Twin '{}' does not match its model and will be replaced: {}", id, e.getMessage());
        if (id != null) invalid.add(String.valueOf(id));
      }
    }
  }
}

package com.gentoro.twinsync.twin;

import com.gentoro.twinsync.model.PatchOperation;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinRelationship;
import com.gentoro.twinsync.query.TwinQuery;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Access to the digital twin graph.
 *
 * <p>Deletes are idempotent: removing an absent twin or relationship is not an error. Removing a
 * twin removes every relationship that starts or ends at it. {@link #query(TwinQuery)} accepts at
 * most 100 ids per query and a bounded text length; exceeding either raises {@link
 * com.gentoro.twinsync.exception.QueryLimitException}.
 */
public interface TwinGraphClient extends AutoCloseable {

  Optional<Twin> getTwin(String twinId);

  /** Create or fully replace a twin. */
  void upsertTwin(Twin twin);

  void updateTwin(String twinId, List<PatchOperation> patch);

  void deleteTwin(String twinId);

  Optional<TwinRelationship> getRelationship(String sourceTwinId, String relationshipId);

  /** Create or fully replace a relationship; both endpoints must exist. */
  void upsertRelationship(TwinRelationship relationship);

  void updateRelationship(String sourceTwinId, String relationshipId, List<PatchOperation> patch);

  void deleteRelationship(String sourceTwinId, String relationshipId);

  /** Raw result rows, each a map keyed by the query's projection column. */
  List<Map<String, Object>> query(TwinQuery query);

  @Override
  default void close() {}
}

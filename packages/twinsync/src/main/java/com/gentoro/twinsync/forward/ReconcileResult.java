package com.gentoro.twinsync.forward;

import com.gentoro.twinsync.diff.TwinGraphDiff;
import com.gentoro.twinsync.exception.ErrorDetails;
import com.gentoro.twinsync.exception.ExceptionUtil;
import com.gentoro.twinsync.exception.TwinSyncException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Outcome and counters of one forward run. */
public record ReconcileResult(
    String rootExternalId,
    Status status,
    Instant startedAt,
    Instant finishedAt,
    int twinsCreated,
    int twinsUpdated,
    int twinsDeleted,
    int relationshipsCreated,
    int relationshipsUpdated,
    int relationshipsDeleted,
    int ambiguities,
    TwinSyncException failure) {

  public enum Status {
    SUCCEEDED,
    FAILED,
    /** Another run held the lock. */
    SKIPPED
  }

  public static ReconcileResult succeeded(
      String root, Instant started, Instant finished, TwinGraphDiff diff, int ambiguities) {
    return new ReconcileResult(
        root,
        Status.SUCCEEDED,
        started,
        finished,
        diff.twinCreates().size(),
        diff.twinUpdates().size(),
        diff.twinDeletes().size(),
        diff.relationshipCreates().size(),
        diff.relationshipUpdates().size(),
        diff.relationshipDeletes().size(),
        ambiguities,
        null);
  }

  public static ReconcileResult failed(
      String root, Instant started, Instant finished, TwinSyncException failure) {
    return new ReconcileResult(
        root, Status.FAILED, started, finished, 0, 0, 0, 0, 0, 0, 0, failure);
  }

  public static ReconcileResult skipped(String root, Instant now) {
    return new ReconcileResult(root, Status.SKIPPED, now, now, 0, 0, 0, 0, 0, 0, 0, null);
  }

  public boolean ok() {
    return status == Status.SUCCEEDED;
  }

  public int totalWrites() {
    return twinsCreated
        + twinsUpdated
        + twinsDeleted
        + relationshipsCreated
        + relationshipsUpdated
        + relationshipsDeleted;
  }

  public ErrorDetails error() {
    return failure == null ? null : ExceptionUtil.toErrorDetails(failure);
  }

  /** Shape logged at the end of a run. */
  public Map<String, Object> summary() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("root", rootExternalId);
    m.put("status", status);
    m.put("durationMs", finishedAt.toEpochMilli() - startedAt.toEpochMilli());
    m.put("twinsCreated", twinsCreated);
    m.put("twinsUpdated", twinsUpdated);
    m.put("twinsDeleted", twinsDeleted);
    m.put("relationshipsCreated", relationshipsCreated);
    m.put("relationshipsUpdated", relationshipsUpdated);
    m.put("relationshipsDeleted", relationshipsDeleted);
    m.put("ambiguities", ambiguities);
    if (failure != null) m.put("error", error());
    return m;
  }
}

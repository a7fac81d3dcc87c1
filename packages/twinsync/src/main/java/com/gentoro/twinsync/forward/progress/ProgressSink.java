package com.gentoro.twinsync.forward.progress;

import java.util.Map;

/**
 * Receives progress of a forward run, one stage per read phase or write tier. Implementations
 * must tolerate calls from several worker threads.
 */
public interface ProgressSink {

  /**
   * @param id stable stage id, e.g. {@code tier-1-twin-upserts}
   * @param totalWork number of writes in the stage, 0 when unknown
   */
  void beginStage(String id, String label, long totalWork);

  void step(String id, long completed, String message, Map<String, Object> attrs);

  void endStageOk(String id, Map<String, Object> attrs);

  void endStageError(String id, String errorSummary, Map<String, Object> attrs);
}

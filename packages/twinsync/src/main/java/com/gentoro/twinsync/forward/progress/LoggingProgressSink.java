package com.gentoro.twinsync.forward.progress;

import com.gentoro.twinsync.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Writes progress as one JSON object per log line under the {@code [reconcile.progress]} prefix:
 *
 * <pre>
 * {"stageId":"tier-1-twin-upserts","label":"Twin creates and updates","completed":40,
 *  "total":120,"percent":33,"message":"upsert plant-1","status":"running"}
 * </pre>
 *
 * Steps are throttled with a {@link ProgressRateLimiter}; begin and end events always pass.
 */
public class LoggingProgressSink implements ProgressSink {
  private final org.slf4j.Logger log;
  private final ProgressRateLimiter limiter;
  private final LongSupplier clockMs;
  private final Map<String, Long> totals = new ConcurrentHashMap<>();
  private final Map<String, Long> completions = new ConcurrentHashMap<>();
  private final Map<String, String> labels = new ConcurrentHashMap<>();

  public LoggingProgressSink(org.slf4j.Logger logger, long minIntervalMs, long minDelta) {
    this(logger, new ProgressRateLimiter(minIntervalMs, minDelta), System::currentTimeMillis);
  }

  LoggingProgressSink(org.slf4j.Logger logger, ProgressRateLimiter limiter, LongSupplier clockMs) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.limiter = limiter;
    this.clockMs = clockMs;
  }

  @Override
  public void beginStage(String id, String label, long totalWork) {
    totals.put(id, Math.max(0, totalWork));
    completions.put(id, 0L);
    labels.put(id, label);
    limiter.reset(id);
    emit(payload(id, 0L, "begin", Map.of(), "running"));
  }

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {
    completions.merge(id, completed, Math::max);
    if (limiter.tryAcquire(id, clockMs.getAsLong(), completed)) {
      emit(payload(id, completed, message, attrs, "running"));
    }
  }

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {
    emit(payload(id, totals.getOrDefault(id, 0L), "end", attrs, "ok"));
  }

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
    Map<String, Object> merged = new LinkedHashMap<>();
    if (attrs != null) merged.putAll(attrs);
    if (errorSummary != null) merged.put("error", errorSummary);
    emit(payload(id, completions.getOrDefault(id, 0L), "error", merged, "error"));
  }

  Map<String, Object> payload(
      String id, long completed, String message, Map<String, Object> attrs, String status) {
    long total = totals.getOrDefault(id, 0L);
    long done = total > 0 ? Math.min(Math.max(0, completed), total) : Math.max(0, completed);
    int percent = total > 0 ? (int) Math.round(done * 100.0 / total) : 0;
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("stageId", id);
    out.put("label", labels.getOrDefault(id, id));
    out.put("completed", done);
    out.put("total", total);
    out.put("percent", percent);
    out.put("message", message);
    if (attrs != null && !attrs.isEmpty()) out.put("attrs", attrs);
    out.put("status", status);
    return out;
  }

  void emit(Map<String, Object> payload) {
    log.info("[reconcile.progress] {}", JacksonUtility.toJson(payload));
  }
}

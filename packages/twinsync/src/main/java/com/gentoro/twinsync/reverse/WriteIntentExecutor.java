package com.gentoro.twinsync.reverse;

import com.gentoro.twinsync.exception.StateException;
import com.gentoro.twinsync.exception.ValidationException;
import com.gentoro.twinsync.model.Timeseries;
import com.gentoro.twinsync.retry.RetryPolicy;
import com.gentoro.twinsync.retry.Sleeper;
import com.gentoro.twinsync.reverse.WriteIntent.CreateEdge;
import com.gentoro.twinsync.reverse.WriteIntent.CreateNode;
import com.gentoro.twinsync.reverse.WriteIntent.CreateTimeseries;
import com.gentoro.twinsync.reverse.WriteIntent.DeleteEdge;
import com.gentoro.twinsync.reverse.WriteIntent.DeleteNode;
import com.gentoro.twinsync.reverse.WriteIntent.DeleteTimeseries;
import com.gentoro.twinsync.reverse.WriteIntent.EnsureLabel;
import com.gentoro.twinsync.reverse.WriteIntent.InsertDatapoint;
import com.gentoro.twinsync.reverse.WriteIntent.RecreateTimeseries;
import com.gentoro.twinsync.reverse.WriteIntent.UpdateEdgeLabels;
import com.gentoro.twinsync.reverse.WriteIntent.UpdateNode;
import com.gentoro.twinsync.reverse.WriteIntent.UpdateTimeseries;
import com.gentoro.twinsync.source.SourceGraphClient;
import java.util.List;
import java.util.Map;

/** Applies write intents to the source graph, in order. */
public class WriteIntentExecutor {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(WriteIntentExecutor.class);

  private final SourceGraphClient source;
  private final RetryPolicy deletionWait;
  private final Sleeper sleeper;

  /**
   * @param deletionWait bounds the polling for a deleted series to disappear before it is created
   *     again
   */
  public WriteIntentExecutor(SourceGraphClient source, RetryPolicy deletionWait, Sleeper sleeper) {
    this.source = source;
    this.deletionWait = deletionWait;
    this.sleeper = sleeper;
  }

  public void execute(List<WriteIntent> intents) {
    for (WriteIntent intent : intents) {
      log.debug("Executing {}", intent);
      execute(intent);
    }
  }

  void execute(WriteIntent intent) {
    if (intent instanceof CreateNode i) {
      source.createNode(i.node());
    } else if (intent instanceof UpdateNode i) {
      source.updateNode(i.node());
    } else if (intent instanceof DeleteNode i) {
      source.deleteNode(i.externalId());
    } else if (intent instanceof CreateTimeseries i) {
      source.createTimeseries(i.timeseries());
    } else if (intent instanceof UpdateTimeseries i) {
      source.updateTimeseries(i.timeseries());
    } else if (intent instanceof RecreateTimeseries i) {
      recreate(i.timeseries());
    } else if (intent instanceof DeleteTimeseries i) {
      source.deleteTimeseries(i.externalId());
    } else if (intent instanceof EnsureLabel i) {
      if (!source.labelExists(i.labelExternalId())) {
        log.warn("Label '{}' is not defined in the source graph; creating it", i.labelExternalId());
        source.createLabel(i.labelExternalId());
      }
    } else if (intent instanceof CreateEdge i) {
      source.createEdge(i.edge());
    } else if (intent instanceof UpdateEdgeLabels i) {
      source.updateEdgeLabels(i.externalId(), i.add(), i.remove());
    } else if (intent instanceof DeleteEdge i) {
      source.deleteEdge(i.externalId());
    } else if (intent instanceof InsertDatapoint i) {
      source.insertDatapoint(i.timeseriesExternalId(), i.datapoint());
    } else {
      throw new ValidationException("Unsupported write intent: " + intent);
    }
  }

  private void recreate(Timeseries ts) {
    log.warn(
        "Recreating timeseries '{}' as {} to change its value type",
        ts.externalId(),
        ts.isString() ? "string" : "numeric");
    source.deleteTimeseries(ts.externalId());
    int attempts = 0;
    while (source.retrieveTimeseries(ts.externalId()).isPresent()) {
      attempts++;
      if (!deletionWait.hasAttemptsLeft(attempts)) {
        throw new StateException(
            "Timeseries '" + ts.externalId() + "' is still present after deletion",
            Map.of("externalId", ts.externalId(), "attempts", attempts));
      }
      try {
        sleeper.sleep(deletionWait.backoffMs(attempts));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new StateException(
            "Interrupted while waiting for timeseries '" + ts.externalId() + "' to disappear", e);
      }
    }
    source.createTimeseries(ts.withInternalId(null).withLatest(null));
  }
}

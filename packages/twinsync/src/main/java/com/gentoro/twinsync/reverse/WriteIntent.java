package com.gentoro.twinsync.reverse;

import com.gentoro.twinsync.model.Datapoint;
import com.gentoro.twinsync.model.Edge;
import com.gentoro.twinsync.model.Node;
import com.gentoro.twinsync.model.Timeseries;
import java.util.List;

/** One planned write against the source graph. */
public interface WriteIntent {

  record CreateNode(Node node) implements WriteIntent {}

  record UpdateNode(Node node) implements WriteIntent {}

  record DeleteNode(String externalId) implements WriteIntent {}

  record CreateTimeseries(Timeseries timeseries) implements WriteIntent {}

  record UpdateTimeseries(Timeseries timeseries) implements WriteIntent {}

  /** Delete then create again, used to change the value type of a series without datapoints. */
  record RecreateTimeseries(Timeseries timeseries) implements WriteIntent {}

  record DeleteTimeseries(String externalId) implements WriteIntent {}

  record EnsureLabel(String labelExternalId) implements WriteIntent {}

  record CreateEdge(Edge edge) implements WriteIntent {}

  record UpdateEdgeLabels(String externalId, List<String> add, List<String> remove)
      implements WriteIntent {}

  record DeleteEdge(String externalId) implements WriteIntent {}

  record InsertDatapoint(String timeseriesExternalId, Datapoint datapoint)
      implements WriteIntent {}
}

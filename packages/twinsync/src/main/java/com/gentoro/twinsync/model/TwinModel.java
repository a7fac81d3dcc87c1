package com.gentoro.twinsync.model;

import com.gentoro.twinsync.exception.ValidationException;
import java.util.Map;
import java.util.Set;

/** The two twin models and the closed set of properties each one accepts. */
public enum TwinModel {
  NODE(
      "dtmi:digitaltwins:cognite:cdf:Asset;1",
      Set.of("displayName", "externalId", "id", "description", "tags")),
  TIMESERIES(
      "dtmi:digitaltwins:cognite:cdf:TimeSeries;1",
      Set.of(
          "displayName", "externalId", "id", "description", "tags", "latestValue", "timestamp"));

  private final String modelId;
  private final Set<String> properties;

  TwinModel(String modelId, Set<String> properties) {
    this.modelId = modelId;
    this.properties = properties;
  }

  public String modelId() {
    return modelId;
  }

  public Set<String> properties() {
    return properties;
  }

  public static TwinModel fromModelId(String modelId) {
    for (TwinModel m : values()) {
      if (m.modelId.equals(modelId)) return m;
    }
    throw new ValidationException(
        "Unknown twin model: " + modelId, Map.of("modelId", String.valueOf(modelId)));
  }
}

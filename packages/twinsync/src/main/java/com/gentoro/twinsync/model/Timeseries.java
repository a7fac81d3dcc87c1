package com.gentoro.twinsync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A timeseries of the source graph, optionally attached to an asset.
 *
 * @param isString value type, fixed for the lifetime of the series
 * @param latest most recent datapoint when it was read alongside the series, else {@code null}
 */
public record Timeseries(
    String externalId,
    Long internalId,
    String name,
    String description,
    Map<String, String> metadata,
    String assetExternalId,
    boolean isString,
    Datapoint latest) {

  public Timeseries {
    Objects.requireNonNull(externalId, "externalId");
    metadata =
        metadata == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public Timeseries withLatest(Datapoint datapoint) {
    return new Timeseries(
        externalId, internalId, name, description, metadata, assetExternalId, isString, datapoint);
  }

  public Timeseries withAsset(String asset) {
    return new Timeseries(
        externalId, internalId, name, description, metadata, asset, isString, latest);
  }

  public Timeseries withString(boolean stringValued) {
    return new Timeseries(
        externalId, internalId, name, description, metadata, assetExternalId, stringValued, latest);
  }

  public Timeseries withInternalId(Long id) {
    return new Timeseries(
        externalId, id, name, description, metadata, assetExternalId, isString, latest);
  }

  public Timeseries withFields(
      String newName, String newDescription, Map<String, String> newMetadata) {
    return new Timeseries(
        externalId,
        internalId,
        newName,
        newDescription,
        newMetadata,
        assetExternalId,
        isString,
        latest);
  }
}

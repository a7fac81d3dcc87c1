package com.gentoro.twinsync.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param latestValue textual value of the latest datapoint, {@code null} when none is known
 * @param timestamp timestamp of the latest datapoint
 */
public record TimeseriesTwinProperties(
    String displayName,
    String externalId,
    String internalId,
    String description,
    Map<String, String> tags,
    String latestValue,
    Instant timestamp)
    implements TwinProperties {

  public TimeseriesTwinProperties {
    tags =
        tags == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
  }
}

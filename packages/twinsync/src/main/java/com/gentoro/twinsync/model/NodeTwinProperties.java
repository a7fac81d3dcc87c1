package com.gentoro.twinsync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record NodeTwinProperties(
    String displayName,
    String externalId,
    String internalId,
    String description,
    Map<String, String> tags)
    implements TwinProperties {

  public NodeTwinProperties {
    tags =
        tags == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
  }
}

package com.gentoro.twinsync.model;

import java.util.Map;

/** Property bag shared by both twin models. One implementation per {@link TwinModel}. */
public interface TwinProperties {
  String displayName();

  String externalId();

  /** Internal id of the source entity, as a string; empty when unknown. */
  String internalId();

  String description();

  /** Metadata with normalized keys. */
  Map<String, String> tags();
}

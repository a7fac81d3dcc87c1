package com.gentoro.twinsync.model;

import java.time.Instant;
import java.util.Objects;

/** A single timeseries sample. The value is kept in its textual form on both sides. */
public record Datapoint(Instant timestamp, String value) {

  public Datapoint {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(value, "value");
  }

  /** True when the value parses as a finite double. */
  public boolean isNumeric() {
    return isNumeric(value);
  }

  public double numericValue() {
    return Double.parseDouble(value.trim());
  }

  public boolean isNewerThan(Datapoint other) {
    return other == null || timestamp.isAfter(other.timestamp);
  }

  public static boolean isNumeric(String value) {
    if (value == null || value.isBlank()) return false;
    try {
      double d = Double.parseDouble(value.trim());
      return Double.isFinite(d);
    } catch (NumberFormatException e) {
      return false;
    }
  }
}

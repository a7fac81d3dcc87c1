package com.gentoro.twinsync.reverse;

public enum ApplyOutcome {
  /** At least one write reached the source graph. */
  APPLIED,
  NO_OP,
  /** Refused without retry, e.g. a datapoint of the wrong value type. */
  REJECTED
}

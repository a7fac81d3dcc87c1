package com.gentoro.twinsync.reverse;

public enum EventKind {
  NODE_CREATED,
  NODE_UPDATED,
  NODE_DELETED,
  EDGE_CREATED,
  EDGE_UPDATED,
  EDGE_DELETED;

  public boolean isNodeEvent() {
    return this == NODE_CREATED || this == NODE_UPDATED || this == NODE_DELETED;
  }
}

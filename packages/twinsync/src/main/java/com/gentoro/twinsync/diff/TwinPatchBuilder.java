package com.gentoro.twinsync.diff;

import com.gentoro.twinsync.model.PatchOperation;
import com.gentoro.twinsync.model.TimeseriesTwinProperties;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the patch turning a twin's current properties into the projected ones. Identity
 * properties ({@code externalId}, {@code id}) are only filled in when empty.
 */
public final class TwinPatchBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(TwinPatchBuilder.class);

  private TwinPatchBuilder() {}

  public static List<PatchOperation> build(Twin current, Twin target) {
    TwinProperties cur = current.properties();
    TwinProperties tgt = target.properties();
    List<PatchOperation> ops = new ArrayList<>();

    scalar(ops, "displayName", cur.displayName(), tgt.displayName());
    identity(ops, current.twinId(), "externalId", cur.externalId(), tgt.externalId());
    identity(ops, current.twinId(), "id", cur.internalId(), tgt.internalId());
    scalar(ops, "description", cur.description(), tgt.description());
    tags(ops, cur.tags(), tgt.tags());

    if (cur instanceof TimeseriesTwinProperties c && tgt instanceof TimeseriesTwinProperties t) {
      boolean changed =
          t.latestValue() != null
              && (!t.latestValue().equals(c.latestValue())
                  || !Objects.equals(t.timestamp(), c.timestamp()));
      if (changed) {
        scalar(ops, "latestValue", c.latestValue(), t.latestValue());
        scalar(
            ops,
            "timestamp",
            c.timestamp() == null ? null : c.timestamp().toString(),
            t.timestamp() == null ? null : t.timestamp().toString());
      }
    }
    return ops;
  }

  private static void scalar(List<PatchOperation> ops, String name, String cur, String tgt) {
    if (Objects.equals(cur, tgt)) return;
    String path = PatchOperation.pointer(name);
    if (tgt == null) {
      ops.add(PatchOperation.remove(path));
    } else if (cur == null) {
      ops.add(PatchOperation.add(path, tgt));
    } else {
      ops.add(PatchOperation.replace(path, tgt));
    }
  }

  private static void identity(
      List<PatchOperation> ops, String twinId, String name, String cur, String tgt) {
    if (tgt == null || tgt.isEmpty() || tgt.equals(cur)) return;
    if (cur == null || cur.isEmpty()) {
      ops.add(PatchOperation.add(PatchOperation.pointer(name), tgt));
      return;
    }
    log.warn(
        "Twin '{}' has {} '{}' but the source entity has '{}'; identity is not overwritten",
        twinId,
        name,
        cur,
        tgt);
  }

  private static void tags(
      List<PatchOperation> ops, Map<String, String> cur, Map<String, String> tgt) {
    for (Map.Entry<String, String> e : cur.entrySet()) {
      if (!tgt.containsKey(e.getKey())) {
        ops.add(PatchOperation.remove(PatchOperation.pointer("tags", "values", e.getKey())));
      }
    }
    for (Map.Entry<String, String> e : tgt.entrySet()) {
      String path = PatchOperation.pointer("tags", "values", e.getKey());
      if (!cur.containsKey(e.getKey())) {
        ops.add(PatchOperation.add(path, e.getValue()));
      } else if (!Objects.equals(cur.get(e.getKey()), e.getValue())) {
        ops.add(PatchOperation.replace(path, e.getValue()));
      }
    }
  }
}

package com.gentoro.twinsync.twin.memory;

import com.gentoro.twinsync.exception.ValidationException;
import com.gentoro.twinsync.model.PatchOperation;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Applies add/replace/remove operations to nested JSON maps. Arrays are not addressed. */
final class JsonPatch {
  private JsonPatch() {}

  static Map<String, Object> apply(Map<String, Object> document, List<PatchOperation> patch) {
    Map<String, Object> copy = deepCopy(document);
    for (PatchOperation op : patch) {
      List<String> segments = PatchOperation.segments(op.path());
      if (segments.isEmpty()) {
        throw new ValidationException("Patch path must not be empty");
      }
      Map<String, Object> parent = copy;
      for (String segment : segments.subList(0, segments.size() - 1)) {
        Object child = parent.get(segment);
        if (!(child instanceof Map)) {
          if (op.op() == PatchOperation.Op.REMOVE) {
            throw new ValidationException("Path does not exist: " + op.path());
          }
          child = new LinkedHashMap<String, Object>();
          parent.put(segment, child);
        }
        parent = cast(child);
      }
      String leaf = segments.get(segments.size() - 1);
      switch (op.op()) {
        case ADD -> parent.put(leaf, copyValue(op.value()));
        case REPLACE -> {
          if (!parent.containsKey(leaf)) {
            throw new ValidationException("Cannot replace missing path: " + op.path());
          }
          parent.put(leaf, copyValue(op.value()));
        }
        case REMOVE -> {
          if (parent.remove(leaf) == null) {
            throw new ValidationException("Cannot remove missing path: " + op.path());
          }
        }
      }
    }
    return copy;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> cast(Object o) {
    return (Map<String, Object>) o;
  }

  private static Object copyValue(Object value) {
    return value instanceof Map ? deepCopy(cast(value)) : value;
  }

  private static Map<String, Object> deepCopy(Map<String, Object> in) {
    Map<String, Object> out = new LinkedHashMap<>();
    in.forEach((k, v) -> out.put(k, copyValue(v)));
    return out;
  }
}

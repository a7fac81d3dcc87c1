package com.gentoro.twinsync.model;

import com.gentoro.twinsync.exception.ValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** One JSON-patch operation against a twin or relationship property bag. */
public record PatchOperation(Op op, String path, Object value) {

  public enum Op {
    ADD,
    REPLACE,
    REMOVE;

    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }

    public static Op fromWireName(String name) {
      for (Op o : values()) {
        if (o.wireName().equals(name)) return o;
      }
      throw new ValidationException("Unsupported patch op: " + name);
    }
  }

  public PatchOperation {
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(path, "path");
  }

  public static PatchOperation add(String path, Object value) {
    return new PatchOperation(Op.ADD, path, value);
  }

  public static PatchOperation replace(String path, Object value) {
    return new PatchOperation(Op.REPLACE, path, value);
  }

  public static PatchOperation remove(String path) {
    return new PatchOperation(Op.REMOVE, path, null);
  }

  /** Builds a JSON pointer, escaping {@code ~} and {@code /} inside segments. */
  public static String pointer(String... segments) {
    StringBuilder sb = new StringBuilder();
    for (String s : segments) {
      sb.append('/').append(s.replace("~", "~0").replace("/", "~1"));
    }
    return sb.toString();
  }

  /** Splits a JSON pointer into unescaped segments. */
  public static List<String> segments(String pointer) {
    List<String> out = new ArrayList<>();
    if (pointer == null || pointer.isEmpty()) return out;
    String p = pointer.startsWith("/") ? pointer.substring(1) : pointer;
    for (String s : p.split("/", -1)) {
      out.add(s.replace("~1", "/").replace("~0", "~"));
    }
    return out;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("op", op.wireName());
    m.put("path", path);
    if (op != Op.REMOVE) {
      m.put("value", value);
    }
    return m;
  }

  public static PatchOperation fromMap(Map<?, ?> m) {
    Object op = m.get("op");
    Object path = m.get("path");
    if (!(op instanceof String) || !(path instanceof String)) {
      throw new ValidationException("Malformed patch operation: " + m);
    }
    return new PatchOperation(Op.fromWireName((String) op), (String) path, m.get("value"));
  }

  public static List<PatchOperation> fromList(Object raw) {
    List<PatchOperation> out = new ArrayList<>();
    if (raw == null) return out;
    if (!(raw instanceof List<?> list)) {
      throw new ValidationException("Patch must be a JSON array");
    }
    for (Object item : list) {
      if (!(item instanceof Map<?, ?> m)) {
        throw new ValidationException("Patch entries must be JSON objects");
      }
      out.add(fromMap(m));
    }
    return out;
  }
}

package com.gentoro.twinsync.identity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps source identifiers onto the character set accepted by the twin graph and back.
 *
 * <p>Twin ids: space becomes {@code _} and {@code :} becomes {@code *}. Map keys: {@code $} becomes
 * {@code #}, {@code .} becomes {@code ^} and space becomes {@code _}. Both mappings are exact
 * inverses only for inputs that do not already contain a placeholder character; {@link
 * #isLossless(String)} and {@link #isLosslessKey(String)} tell the two cases apart.
 */
public final class IdentityNormalizer {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(IdentityNormalizer.class);

  private IdentityNormalizer() {}

  public static String toTwinId(String externalId) {
    if (externalId == null) return null;
    return externalId.replace(' ', '_').replace(':', '*');
  }

  public static String fromTwinId(String twinId) {
    if (twinId == null) return null;
    return twinId.replace('_', ' ').replace('*', ':');
  }

  public static boolean isLossless(String externalId) {
    return externalId == null || (externalId.indexOf('_') < 0 && externalId.indexOf('*') < 0);
  }

  public static String toMapKey(String rawKey) {
    if (rawKey == null) return null;
    return rawKey.replace('$', '#').replace('.', '^').replace(' ', '_');
  }

  public static String fromMapKey(String safeKey) {
    if (safeKey == null) return null;
    return safeKey.replace('#', '$').replace('^', '.').replace('_', ' ');
  }

  public static boolean isLosslessKey(String rawKey) {
    return rawKey == null
        || (rawKey.indexOf('#') < 0 && rawKey.indexOf('^') < 0 && rawKey.indexOf('_') < 0);
  }

  /** Keys that collide after normalization keep the first value seen. */
  public static Map<String, String> normalizeKeys(Map<String, String> raw) {
    Map<String, String> out = new LinkedHashMap<>();
    if (raw == null) return out;
    raw.forEach(
        (k, v) -> {
          String safe = toMapKey(k);
          if (out.putIfAbsent(safe, v) != null) {
            log.warn("Metadata key '{}' collides with another key as '{}'; dropped", k, safe);
          }
        });
    return out;
  }

  public static Map<String, String> denormalizeKeys(Map<String, String> safe) {
    Map<String, String> out = new LinkedHashMap<>();
    if (safe == null) return out;
    safe.forEach((k, v) -> out.putIfAbsent(fromMapKey(k), v));
    return out;
  }
}

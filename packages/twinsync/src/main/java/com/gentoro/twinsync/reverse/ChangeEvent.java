package com.gentoro.twinsync.reverse;

import com.gentoro.twinsync.model.PatchOperation;
import com.gentoro.twinsync.model.TwinModel;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded twin graph change notification.
 *
 * @param subject twin id for node events, {@code <source>/relationships/<id>} for edge events
 * @param model twin model of a node event, {@code null} for edge events
 * @param body full entity for create and delete, {@code {"patch": [...]}} for updates
 */
public record ChangeEvent(
    EventKind kind, String subject, Instant time, TwinModel model, Map<String, Object> body) {

  public ChangeEvent {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(subject, "subject");
    body =
        body == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(body));
  }

  public List<PatchOperation> patch() {
    return PatchOperation.fromList(body.get("patch"));
  }
}

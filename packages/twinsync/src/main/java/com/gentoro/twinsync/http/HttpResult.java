package com.gentoro.twinsync.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.twinsync.exception.AlreadyExistsException;
import com.gentoro.twinsync.exception.NetworkException;
import com.gentoro.twinsync.exception.NotFoundException;
import com.gentoro.twinsync.exception.TwinSyncErrorCode;
import com.gentoro.twinsync.exception.TwinSyncException;
import com.gentoro.twinsync.exception.ValidationException;
import com.gentoro.twinsync.utility.JacksonUtility;
import java.util.Map;

/** Status and fully read body of an HTTP exchange. */
public record HttpResult(int code, String body) {

  public boolean isSuccessful() {
    return code >= 200 && code < 300;
  }

  public JsonNode json() {
    return JacksonUtility.readTree(body);
  }

  /** Maps a non-2xx result onto the exception hierarchy. */
  public TwinSyncException toException(String operation) {
    Map<String, Object> ctx = Map.of("operation", operation, "status", code, "body", abbreviate());
    String message = operation + " failed with HTTP " + code;
    if (code == 404) return new NotFoundException(message, ctx);
    if (code == 409) return new AlreadyExistsException(message, ctx);
    if (code == 429 || code >= 500) return new NetworkException(message, ctx);
    if (code >= 400) return new ValidationException(message, ctx);
    return new TwinSyncException(TwinSyncErrorCode.UNKNOWN, message, ctx);
  }

  private String abbreviate() {
    if (body == null) return "";
    return body.length() > 512 ? body.substring(0, 512) + "..." : body;
  }
}

package com.gentoro.twinsync.http;

import com.gentoro.twinsync.exception.NetworkException;
import com.gentoro.twinsync.utility.JacksonUtility;
import java.io.IOException;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** JSON request bodies and blocking calls that always consume and close the response. */
public final class JsonHttp {
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  public static final MediaType JSON_PATCH = MediaType.get("application/json-patch+json");

  private JsonHttp() {}

  public static RequestBody body(Object payload) {
    return body(payload, JSON);
  }

  public static RequestBody body(Object payload, MediaType type) {
    return RequestBody.create(JacksonUtility.toJson(payload), type);
  }

  public static HttpResult call(OkHttpClient http, Request request) {
    try (Response response = http.newCall(request).execute()) {
      ResponseBody body = response.body();
      return new HttpResult(response.code(), body == null ? "" : body.string());
    } catch (IOException e) {
      throw new NetworkException(
          request.method() + " " + request.url() + " failed: " + e.getMessage(),
          Map.of("url", request.url().toString()),
          e);
    }
  }
}

package com.gentoro.twinsync.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/** Request/response logging: method, URL, status and timing at debug, bodies at trace. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long start = System.nanoTime();
    log.debug("--> {} {}", request.method(), request.url());
    if (log.isTraceEnabled()) {
      log.trace("Request body: {}", bodyToString(request.body()));
    }

    Response response = chain.proceed(request);

    log.debug(
        "<-- {} {} {} ({} ms)",
        response.code(),
        request.method(),
        response.request().url(),
        String.format("%.1f", (System.nanoTime() - start) / 1e6d));
    if (log.isTraceEnabled()) {
      log.trace("Response body: {}", response.peekBody(64 * 1024L).string());
    }
    return response;
  }

  private static String bodyToString(RequestBody body) {
    if (body == null) return "";
    try {
      Buffer buffer = new Buffer();
      body.writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(unreadable body: " + e.getMessage() + ")";
    }
  }
}

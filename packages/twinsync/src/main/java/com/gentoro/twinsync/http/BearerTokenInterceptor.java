package com.gentoro.twinsync.http;

import java.io.IOException;
import java.util.function.Supplier;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Adds {@code Authorization: Bearer <token>} when a token is available. */
public class BearerTokenInterceptor implements Interceptor {
  private final Supplier<String> token;

  public BearerTokenInterceptor(Supplier<String> token) {
    this.token = token == null ? () -> null : token;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    String value = token.get();
    if (value == null || value.isBlank() || request.header("Authorization") != null) {
      return chain.proceed(request);
    }
    return chain.proceed(request.newBuilder().header("Authorization", "Bearer " + value).build());
  }
}

package com.gentoro.twinsync.http;

import com.gentoro.twinsync.retry.RetryPolicy;
import com.gentoro.twinsync.retry.Sleeper;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import okhttp3.OkHttpClient;

/** Builds the OkHttp client used by both graph bindings. */
public final class OkHttpFactory {
  private OkHttpFactory() {}

  /**
   * @param baseUrl absolute base URL requests addressed to {@link BaseUrlInterceptor#BASE_HOST} are
   *     rewritten to
   * @param token bearer token supplier; may return {@code null} for anonymous access
   */
  public static OkHttpClient create(
      String baseUrl, Supplier<String> token, RetryPolicy retryPolicy, Sleeper sleeper) {
    return new OkHttpClient.Builder()
        .connectTimeout(10, TimeUnit.SECONDS)
        .readTimeout(20, TimeUnit.SECONDS)
        .retryOnConnectionFailure(false)
        .addInterceptor(new BaseUrlInterceptor(baseUrl))
        .addInterceptor(new BearerTokenInterceptor(token))
        .addInterceptor(new RetryInterceptor(retryPolicy, sleeper))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}

package com.gentoro.twinsync.http;

import java.io.IOException;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Points requests built against {@link #BASE_HOST} at the configured base URL, keeping path and
 * query. The base URL's own path is used as a prefix.
 */
public class BaseUrlInterceptor implements Interceptor {
  public static final String BASE_HOST = "base.invalid";

  private final HttpUrl baseUrl;

  public BaseUrlInterceptor(String baseUrl) {
    this.baseUrl = HttpUrl.get(baseUrl);
  }

  /** Starting point for request URLs that this interceptor will rebase. */
  public static HttpUrl.Builder relative() {
    return new HttpUrl.Builder().scheme("http").host(BASE_HOST);
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    HttpUrl url = original.url();
    if (!BASE_HOST.equals(url.host())) {
      return chain.proceed(original);
    }
    HttpUrl.Builder rebased =
        baseUrl.newBuilder().encodedQuery(url.encodedQuery()).encodedFragment(null);
    for (String segment : url.encodedPathSegments()) {
      if (!segment.isEmpty()) rebased.addEncodedPathSegment(segment);
    }
    return chain.proceed(original.newBuilder().url(rebased.build()).build());
  }
}

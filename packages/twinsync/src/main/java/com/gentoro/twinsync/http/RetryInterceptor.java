package com.gentoro.twinsync.http;

import com.gentoro.twinsync.exception.NetworkException;
import com.gentoro.twinsync.retry.RetryPolicy;
import com.gentoro.twinsync.retry.Sleeper;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Map;
import java.util.Set;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Retries a call on I/O failure, 429 and 5xx gateway-style statuses with capped exponential
 * backoff. A {@code Retry-After} header in seconds overrides the computed delay, bounded by the
 * policy maximum. When attempts run out on an I/O failure a {@link NetworkException} is thrown;
 * a retryable status is returned as-is for the caller to map.
 */
public class RetryInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(RetryInterceptor.class);

  static final Set<Integer> RETRYABLE_STATUS = Set.of(429, 500, 502, 503, 504);

  private final RetryPolicy policy;
  private final Sleeper sleeper;

  public RetryInterceptor(RetryPolicy policy, Sleeper sleeper) {
    this.policy = policy;
    this.sleeper = sleeper;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    int attempt = 0;
    while (true) {
      attempt++;
      Response response;
      try {
        response = chain.proceed(request);
      } catch (IOException e) {
        if (Thread.currentThread().isInterrupted()) throw e;
        response = null;
        if (!policy.hasAttemptsLeft(attempt)) throw exhausted(request, attempt, e);
        log.warn(
            "{} {} failed (attempt {}): {}",
            request.method(),
            request.url(),
            attempt,
            e.toString());
      }

      long delay = policy.backoffMs(attempt);
      if (response != null) {
        if (!RETRYABLE_STATUS.contains(response.code()) || !policy.hasAttemptsLeft(attempt)) {
          return response;
        }
        delay = retryAfter(response, delay);
        log.warn(
            "{} {} returned {} (attempt {}), retrying in {} ms",
            request.method(),
            request.url(),
            response.code(),
            attempt,
            delay);
        response.close();
      }
      pause(delay);
    }
  }

  private long retryAfter(Response response, long fallback) {
    String header = response.header("Retry-After");
    if (header == null) return fallback;
    try {
      long seconds = Long.parseLong(header.trim());
      return Math.min(policy.maxBackoffMs(), Math.max(0L, seconds * 1000L));
    } catch (NumberFormatException e) {
      return fallback;
    }
  }

  private void pause(long delay) throws IOException {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting to retry");
    }
  }

  private static NetworkException exhausted(Request request, int attempts, IOException cause) {
    return new NetworkException(
        "Request failed after " + attempts + " attempt(s): " + request.method() + " "
            + request.url(),
        Map.of("attempts", attempts, "url", request.url().toString()),
        cause);
  }
}

package com.gentoro.twinsync.http;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.twinsync.exception.AlreadyExistsException;
import com.gentoro.twinsync.exception.NotFoundException;
import com.gentoro.twinsync.exception.ValidationException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.junit.jupiter.api.Test;

class InterceptorChainTest {

  @Test
  void rebasesRelativeUrlsAndAddsToken() {
    // Arrange
    StubInterceptor stub = new StubInterceptor().reply(200, "{}");
    OkHttpClient http =
        new OkHttpClient.Builder()
            .addInterceptor(new BaseUrlInterceptor("https://twins.example.com/tenant/"))
            .addInterceptor(new BearerTokenInterceptor(() -> "s3cret"))
            .addInterceptor(new LoggingInterceptor())
            .addInterceptor(stub)
            .build();
    Request request =
        new Request.Builder()
            .url(
                BaseUrlInterceptor.relative()
                    .addPathSegment("digitaltwins")
                    .addPathSegment("pump 7")
                    .addQueryParameter("api-version", "2023-10-31")
                    .build())
            .build();

    // Act
    JsonHttp.call(http, request);

    // Assert
    StubInterceptor.Exchange sent = stub.exchanges().get(0);
    assertEquals(
        "https://twins.example.com/tenant/digitaltwins/pump%207?api-version=2023-10-31",
        sent.url());
    assertEquals("Bearer s3cret", sent.authorization());
  }

  @Test
  void missingTokenSendsNoHeader() {
    StubInterceptor stub = new StubInterceptor().reply(200, "{}");
    OkHttpClient http =
        new OkHttpClient.Builder()
            .addInterceptor(new BearerTokenInterceptor(() -> null))
            .addInterceptor(stub)
            .build();

    JsonHttp.call(http, new Request.Builder().url("http://graph.test/").build());

    assertNull(stub.exchanges().get(0).authorization());
  }

  @Test
  void statusCodesMapToExceptions() {
    assertInstanceOf(NotFoundException.class, new HttpResult(404, "").toException("get"));
    assertInstanceOf(AlreadyExistsException.class, new HttpResult(409, "").toException("put"));
    assertInstanceOf(ValidationException.class, new HttpResult(422, "x").toException("post"));
    assertEquals(409, new HttpResult(409, "").toException("put").getContext().get("status"));
  }
}

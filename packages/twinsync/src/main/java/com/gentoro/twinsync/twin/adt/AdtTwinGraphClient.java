package com.gentoro.twinsync.twin.adt;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.twinsync.exception.QueryLimitException;
import com.gentoro.twinsync.http.BaseUrlInterceptor;
import com.gentoro.twinsync.http.HttpResult;
import com.gentoro.twinsync.http.JsonHttp;
import com.gentoro.twinsync.mapping.TwinCodec;
import com.gentoro.twinsync.model.PatchOperation;
import com.gentoro.twinsync.model.RelationshipKind;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinRelationship;
import com.gentoro.twinsync.query.TwinQuery;
import com.gentoro.twinsync.twin.TwinGraphClient;
import com.gentoro.twinsync.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;

/**
 * Twin graph binding for the Azure Digital Twins data plane REST API.
 *
 * <p>The query endpoint pages through {@code continuationToken}. A 400 answer to a query whose text
 * is longer than the documented limit is reported as {@link QueryLimitException}.
 */
public class AdtTwinGraphClient implements TwinGraphClient {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(AdtTwinGraphClient.class);

  private final OkHttpClient http;
  private final String apiVersion;
  private final int maxQueryLength;

  public AdtTwinGraphClient(OkHttpClient http, String apiVersion, int maxQueryLength) {
    this.http = http;
    this.apiVersion = apiVersion;
    this.maxQueryLength = maxQueryLength;
  }

  @Override
  public Optional<Twin> getTwin(String twinId) {
    HttpResult r = JsonHttp.call(http, new Request.Builder().url(twinUrl(twinId)).get().build());
    if (r.code() == 404) return Optional.empty();
    if (!r.isSuccessful()) throw r.toException("get twin " + twinId);
    return Optional.of(TwinCodec.decodeTwin(JacksonUtility.toMap(r.body())));
  }

  @Override
  public void upsertTwin(Twin twin) {
    Request req =
        new Request.Builder()
            .url(twinUrl(twin.twinId()))
            .put(JsonHttp.body(TwinCodec.encodeTwin(twin)))
            .build();
    expectSuccess(req, "upsert twin " + twin.twinId());
  }

  @Override
  public void updateTwin(String twinId, List<PatchOperation> patch) {
    Request req =
        new Request.Builder()
            .url(twinUrl(twinId))
            .patch(JsonHttp.body(toWire(patch), JsonHttp.JSON_PATCH))
            .build();
    expectSuccess(req, "update twin " + twinId);
  }

  @Override
  public void deleteTwin(String twinId) {
    for (TwinRelationship rel : listRelationships(twinId, "relationships")) {
      deleteRelationship(rel.sourceTwinId(), rel.relationshipId());
    }
    for (TwinRelationship rel : listRelationships(twinId, "incomingrelationships")) {
      deleteRelationship(rel.sourceTwinId(), rel.relationshipId());
    }
    HttpResult r = JsonHttp.call(http, new Request.Builder().url(twinUrl(twinId)).delete().build());
    if (r.code() == 404) {
      log.debug("Twin '{}' already absent", twinId);
      return;
    }
    if (!r.isSuccessful()) throw r.toException("delete twin " + twinId);
  }

  @Override
  public Optional<TwinRelationship> getRelationship(String sourceTwinId, String relationshipId) {
    HttpResult r =
        JsonHttp.call(
            http,
            new Request.Builder().url(relationshipUrl(sourceTwinId, relationshipId)).get().build());
    if (r.code() == 404) return Optional.empty();
    if (!r.isSuccessful()) throw r.toException("get relationship " + relationshipId);
    return Optional.of(TwinCodec.decodeRelationship(JacksonUtility.toMap(r.body())));
  }

  @Override
  public void upsertRelationship(TwinRelationship relationship) {
    Request req =
        new Request.Builder()
            .url(relationshipUrl(relationship.sourceTwinId(), relationship.relationshipId()))
            .put(JsonHttp.body(TwinCodec.encodeRelationship(relationship)))
            .build();
    expectSuccess(req, "upsert relationship " + relationship.key());
  }

  @Override
  public void updateRelationship(
      String sourceTwinId, String relationshipId, List<PatchOperation> patch) {
    Request req =
        new Request.Builder()
            .url(relationshipUrl(sourceTwinId, relationshipId))
            .patch(JsonHttp.body(toWire(patch), JsonHttp.JSON_PATCH))
            .build();
    expectSuccess(req, "update relationship " + relationshipId);
  }

  @Override
  public void deleteRelationship(String sourceTwinId, String relationshipId) {
    HttpResult r =
        JsonHttp.call(
            http,
            new Request.Builder()
                .url(relationshipUrl(sourceTwinId, relationshipId))
                .delete()
                .build());
    if (r.code() == 404) return;
    if (!r.isSuccessful()) throw r.toException("delete relationship " + relationshipId);
  }

  @Override
  public List<Map<String, Object>> query(TwinQuery query) {
    String text = query.text();
    List<Map<String, Object>> rows = new ArrayList<>();
    String continuation = null;
    do {
      Map<String, Object> payload = new LinkedHashMap<>();
      if (continuation == null) {
        payload.put("query", text);
      } else {
        payload.put("continuationToken", continuation);
      }
      HttpUrl url =
          BaseUrlInterceptor.relative()
              .addPathSegment("query")
              .addQueryParameter("api-version", apiVersion)
              .build();
      HttpResult r =
          JsonHttp.call(http, new Request.Builder().url(url).post(JsonHttp.body(payload)).build());
      if (r.code() == 400 && text.length() > maxQueryLength) {
        throw new QueryLimitException(
            "Query text of " + text.length() + " characters was rejected",
            Map.of("template", query.template().name(), "length", text.length()));
      }
      if (!r.isSuccessful()) throw r.toException("query " + query.template().name());
      JsonNode body = r.json();
      for (JsonNode row : body.path("value")) {
        rows.add(JacksonUtility.toMap(row));
      }
      JsonNode next = body.get("continuationToken");
      continuation = next == null || next.isNull() ? null : next.asText();
    } while (continuation != null);
    return rows;
  }

  private List<TwinRelationship> listRelationships(String twinId, String collection) {
    List<TwinRelationship> out = new ArrayList<>();
    HttpUrl url =
        BaseUrlInterceptor.relative()
            .addPathSegment("digitaltwins")
            .addPathSegment(twinId)
            .addPathSegment(collection)
            .addQueryParameter("api-version", apiVersion)
            .build();
    while (url != null) {
      HttpResult r = JsonHttp.call(http, new Request.Builder().url(url).get().build());
      if (r.code() == 404) return out;
      if (!r.isSuccessful()) throw r.toException("list " + collection + " of " + twinId);
      JsonNode body = r.json();
      for (JsonNode item : body.path("value")) {
        Map<String, Object> m = JacksonUtility.toMap(item);
        if (!m.containsKey(TwinCodec.TARGET_ID)) {
          // incoming relationship listings only carry the source side
          out.add(
              new TwinRelationship(
                  String.valueOf(m.get(TwinCodec.RELATIONSHIP_ID)),
                  String.valueOf(m.get(TwinCodec.SOURCE_ID)),
                  twinId,
                  RelationshipKind.fromName(
                      String.valueOf(m.get(TwinCodec.RELATIONSHIP_NAME))),
                  null,
                  null));
        } else {
          out.add(TwinCodec.decodeRelationship(m));
        }
      }
      JsonNode next = body.get("nextLink");
      url = next == null || next.isNull() ? null : HttpUrl.parse(next.asText());
    }
    return out;
  }

  private void expectSuccess(Request req, String operation) {
    HttpResult r = JsonHttp.call(http, req);
    if (!r.isSuccessful()) throw r.toException(operation);
  }

  private static List<Map<String, Object>> toWire(List<PatchOperation> patch) {
    List<Map<String, Object>> out = new ArrayList<>(patch.size());
    patch.forEach(p -> out.add(p.toMap()));
    return out;
  }

  private HttpUrl twinUrl(String twinId) {
    return BaseUrlInterceptor.relative()
        .addPathSegment("digitaltwins")
        .addPathSegment(twinId)
        .addQueryParameter("api-version", apiVersion)
        .build();
  }

  private HttpUrl relationshipUrl(String sourceTwinId, String relationshipId) {
    return BaseUrlInterceptor.relative()
        .addPathSegment("digitaltwins")
        .addPathSegment(sourceTwinId)
        .addPathSegment("relationships")
        .addPathSegment(relationshipId)
        .addQueryParameter("api-version", apiVersion)
        .build();
  }
}

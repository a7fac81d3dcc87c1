package com.gentoro.twinsync.query;

import com.gentoro.twinsync.exception.ExceptionUtil;
import com.gentoro.twinsync.twin.TwinGraphClient;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Splits an id set into chunks of at most {@code batchSize}, runs one query per chunk and
 * concatenates the rows.
 *
 * <p>Chunks run concurrently when an executor is supplied. Only the id count is bounded: a query
 * whose rendered text is too long for the remote fails the whole call, it is never re-chunked.
 */
public class QueryBatcher {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(QueryBatcher.class);

  private final TwinGraphClient client;
  private final int batchSize;
  private final Executor executor;

  public QueryBatcher(TwinGraphClient client, int batchSize, Executor executor) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    this.client = client;
    this.batchSize = batchSize;
    this.executor = executor;
  }

  public static List<List<String>> partition(List<String> ids, int size) {
    List<List<String>> chunks = new ArrayList<>();
    for (int i = 0; i < ids.size(); i += size) {
      chunks.add(List.copyOf(ids.subList(i, Math.min(ids.size(), i + size))));
    }
    return chunks;
  }

  /** Runs {@code template} over {@code ids} (duplicates removed) and returns all rows. */
  public List<Map<String, Object>> execute(TwinQueryTemplate template, Collection<String> ids) {
    List<String> unique = new ArrayList<>(new LinkedHashSet<>(ids));
    if (unique.isEmpty()) {
      return List.of();
    }
    List<TwinQuery> queries = new ArrayList<>();
    for (List<String> chunk : partition(unique, batchSize)) {
      queries.add(new TwinQuery(template, chunk));
    }
    log.debug(
        "Query '{}' over {} ids in {} batch(es)", template.name(), unique.size(), queries.size());

    if (executor == null || queries.size() == 1) {
      List<Map<String, Object>> rows = new ArrayList<>();
      for (TwinQuery q : queries) {
        rows.addAll(client.query(q));
      }
      return rows;
    }

    List<CompletableFuture<List<Map<String, Object>>>> futures = new ArrayList<>();
    for (TwinQuery q : queries) {
      futures.add(CompletableFuture.supplyAsync(() -> client.query(q), executor));
    }
    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    } catch (CompletionException e) {
      throw ExceptionUtil.asTwinSyncException(e);
    }
    List<Map<String, Object>> rows = new ArrayList<>();
    for (CompletableFuture<List<Map<String, Object>>> f : futures) {
      rows.addAll(f.join());
    }
    return rows;
  }

  /** Extracts the per-row entity stored under the template's result column. */
  @SuppressWarnings("unchecked")
  public static List<Map<String, Object>> unwrapRows(
      TwinQueryTemplate template, List<Map<String, Object>> rows) {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      Object entity = row.get(template.resultKey());
      if (entity instanceof Map<?, ?> m) {
        out.add((Map<String, Object>) m);
      } else {
        out.add(row);
      }
    }
    return out;
  }
}

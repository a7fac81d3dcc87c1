package com.gentoro.twinsync.reverse;

import static com.gentoro.twinsync.identity.IdentityNormalizer.fromMapKey;
import static com.gentoro.twinsync.identity.IdentityNormalizer.fromTwinId;
import static com.gentoro.twinsync.identity.IdentityNormalizer.toMapKey;

import com.gentoro.twinsync.SyncContext;
import com.gentoro.twinsync.ambiguity.AmbiguityDetector;
import com.gentoro.twinsync.exception.TypeConflictException;
import com.gentoro.twinsync.exception.ValidationException;
import com.gentoro.twinsync.mapping.EntityMapper;
import com.gentoro.twinsync.mapping.TwinCodec;
import com.gentoro.twinsync.model.Datapoint;
import com.gentoro.twinsync.model.Edge;
import com.gentoro.twinsync.model.Node;
import com.gentoro.twinsync.model.PatchOperation;
import com.gentoro.twinsync.model.RelationshipKey;
import com.gentoro.twinsync.model.RelationshipKind;
import com.gentoro.twinsync.model.Timeseries;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinModel;
import com.gentoro.twinsync.model.TwinRelationship;
import com.gentoro.twinsync.query.QueryBatcher;
import com.gentoro.twinsync.query.TwinQueryTemplate;
import com.gentoro.twinsync.reverse.WriteIntent.CreateEdge;
import com.gentoro.twinsync.reverse.WriteIntent.CreateNode;
import com.gentoro.twinsync.reverse.WriteIntent.CreateTimeseries;
import com.gentoro.twinsync.reverse.WriteIntent.DeleteEdge;
import com.gentoro.twinsync.reverse.WriteIntent.DeleteNode;
import com.gentoro.twinsync.reverse.WriteIntent.DeleteTimeseries;
import com.gentoro.twinsync.reverse.WriteIntent.EnsureLabel;
import com.gentoro.twinsync.reverse.WriteIntent.InsertDatapoint;
import com.gentoro.twinsync.reverse.WriteIntent.RecreateTimeseries;
import com.gentoro.twinsync.reverse.WriteIntent.UpdateEdgeLabels;
import com.gentoro.twinsync.reverse.WriteIntent.UpdateNode;
import com.gentoro.twinsync.reverse.WriteIntent.UpdateTimeseries;
import com.gentoro.twinsync.source.SourceGraphClient;
import com.gentoro.twinsync.twin.TwinGraphClient;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Translates one twin graph change notification into writes against the source graph.
 *
 * <p>{@link #plan(ChangeEvent)} only reads; {@link #apply(ChangeEvent)} plans and executes. Twins
 * and timeseries created here without a known parent or asset are linked under the configured
 * root until a parent or attachment notification arrives.
 */
public class ReverseApplier {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(ReverseApplier.class);

  private final String rootExternalId;
  private final SourceGraphClient source;
  private final TwinGraphClient twins;
  private final AmbiguityDetector detector;
  private final QueryBatcher batcher;
  private final WriteIntentExecutor executor;
  private final Clock clock;

  public ReverseApplier(SyncContext ctx) {
    this(
        ctx,
        new AmbiguityDetector(),
        new QueryBatcher(ctx.twins(), ctx.settings().batchSize(), null));
  }

  public ReverseApplier(SyncContext ctx, AmbiguityDetector detector, QueryBatcher batcher) {
    this.rootExternalId = ctx.settings().rootExternalId();
    this.source = ctx.source();
    this.twins = ctx.twins();
    this.detector = detector;
    this.batcher = batcher;
    this.executor =
        new WriteIntentExecutor(ctx.source(), ctx.settings().retryPolicy(), ctx.sleeper());
    this.clock = ctx.clock();
  }

  public ApplyOutcome apply(ChangeEvent event) {
    List<WriteIntent> intents;
    try {
      intents = plan(event);
      if (intents.isEmpty()) {
        log.info("{} '{}': nothing to write", event.kind(), event.subject());
        return ApplyOutcome.NO_OP;
      }
      executor.execute(intents);
    } catch (TypeConflictException e) {
      log.error(
          "{} '{}' rejected: {} {}",
          event.kind(),
          event.subject(),
          e.getMessage(),
          e.getContext());
      return ApplyOutcome.REJECTED;
    }
    log.info("{} '{}': applied {} write(s)", event.kind(), event.subject(), intents.size());
    return ApplyOutcome.APPLIED;
  }

  public List<WriteIntent> plan(ChangeEvent event) {
    return switch (event.kind()) {
      case NODE_CREATED, NODE_UPDATED -> event.model() == TwinModel.NODE
          ? planNodeUpsert(event)
          : planTimeseriesUpsert(event);
      case NODE_DELETED -> planTwinDelete(event);
      case EDGE_CREATED, EDGE_UPDATED -> planEdgeUpsert(event);
      case EDGE_DELETED -> planEdgeDelete(event);
    };
  }

  // ---------------------------------------------------------------- nodes and timeseries

  private List<WriteIntent> planNodeUpsert(ChangeEvent event) {
    boolean create = event.kind() == EventKind.NODE_CREATED;
    Twin twin = create ? TwinCodec.decodeTwin(event.body()) : null;
    String externalId = eventExternalId(event, twin);
    Optional<Node> existing = source.retrieveNode(externalId);
    if (existing.isEmpty() && !create) {
      Optional<String> stored = storedExternalId(event.subject());
      if (stored.isPresent() && !stored.get().equals(externalId)) {
        externalId = stored.get();
        existing = source.retrieveNode(externalId);
      }
    }

    Node target;
    if (existing.isPresent()) {
      Node current = existing.get();
      target =
          create
              ? current.withFields(
                  nameOf(twin), twin.properties().description(), metadataOf(twin))
              : patchNode(current, event.patch());
      if (target.equals(current)) {
        return List.of();
      }
      return List.of(new UpdateNode(target));
    }

    if (create) {
      target = EntityMapper.mapTwinToNode(twin).withParent(rootExternalId);
    } else {
      Node base =
          twins
              .getTwin(event.subject())
              .filter(Twin::isNode)
              .map(EntityMapper::mapTwinToNode)
              .orElse(new Node(externalId, null, event.subject(), null, Map.of(), null));
      target = patchNode(base, event.patch());
    }
    target =
        new Node(
            externalId,
            null,
            target.name(),
            target.description(),
            target.metadata(),
            isRoot(externalId) ? null : rootExternalId);
    log.info("Node '{}' not found in the source graph; creating it", externalId);
    return List.of(new CreateNode(target));
  }

  private List<WriteIntent> planTimeseriesUpsert(ChangeEvent event) {
    boolean create = event.kind() == EventKind.NODE_CREATED;
    Twin twin = create ? TwinCodec.decodeTwin(event.body()) : null;
    String externalId = eventExternalId(event, twin);
    Optional<Timeseries> existing = source.retrieveTimeseries(externalId);
    if (existing.isEmpty() && !create) {
      Optional<String> stored = storedExternalId(event.subject());
      if (stored.isPresent() && !stored.get().equals(externalId)) {
        externalId = stored.get();
        existing = source.retrieveTimeseries(externalId);
      }
    }

    PendingDatapoint pending;
    Timeseries target;
    if (create) {
      Map<String, Object> body = event.body();
      pending =
          PendingDatapoint.of(stringOrNull(body.get("latestValue")), body.get("timestamp"));
      Timeseries mapped = EntityMapper.mapTwinToTimeseries(twin);
      target =
          existing
              .map(ts -> ts.withFields(mapped.name(), mapped.description(), mapped.metadata()))
              .orElse(mapped);
    } else {
      List<PatchOperation> patch = event.patch();
      pending = datapointFromPatch(patch);
      String fallbackId = externalId;
      Timeseries base =
          existing.orElseGet(
              () ->
                  twins
                      .getTwin(event.subject())
                      .filter(Twin::isTimeseries)
                      .map(EntityMapper::mapTwinToTimeseries)
                      .orElse(bareTimeseries(fallbackId, event.subject())));
      target = patchTimeseries(base, patch);
    }

    List<WriteIntent> intents = new ArrayList<>();
    if (existing.isPresent()) {
      Timeseries current = existing.get();
      Datapoint latest =
          pending.datapoint() == null ? null : source.latestDatapoint(externalId).orElse(null);
      if (pending.datapoint() != null
          && pending.datapoint().isNewerThan(latest)
          && current.isString() == pending.datapoint().isNumeric()) {
        if (latest != null) {
          TypeConflictException conflict =
              new TypeConflictException(
                  "Cannot write a "
                      + (pending.datapoint().isNumeric() ? "numeric" : "string")
                      + " value into "
                      + (current.isString() ? "string" : "numeric")
                      + " timeseries '"
                      + externalId
                      + "'",
                  Map.of("externalId", externalId, "value", pending.datapoint().value()));
          if (sameFields(target, current)) {
            throw conflict;
          }
          // the field changes still apply, only the datapoint is dropped
          log.error(
              "Datapoint rejected: {} {}; applying the remaining field changes",
              conflict.getMessage(),
              conflict.getContext());
          intents.add(new UpdateTimeseries(target));
          return intents;
        }
        log.warn(
            "First datapoint '{}' of timeseries '{}' does not match its value type",
            pending.datapoint().value(),
            externalId);
        intents.add(new RecreateTimeseries(target.withString(!current.isString())));
      } else if (!sameFields(target, current)) {
        intents.add(new UpdateTimeseries(target));
      }
      addDatapoint(intents, externalId, pending, latest);
      return intents;
    }

    boolean isString = pending.datapoint() != null && !pending.datapoint().isNumeric();
    Timeseries created =
        new Timeseries(
            externalId,
            null,
            target.name(),
            target.description(),
            target.metadata(),
            rootExternalId,
            isString,
            null);
    log.info("Timeseries '{}' not found in the source graph; creating it", externalId);
    intents.add(new CreateTimeseries(created));
    addDatapoint(intents, externalId, pending, null);
    return intents;
  }

  private void addDatapoint(
      List<WriteIntent> intents, String externalId, PendingDatapoint pending, Datapoint latest) {
    if (pending.datapoint() == null) {
      if (pending.partial()) {
        log.warn(
            "Timeseries '{}' update carries a value or a timestamp but not both; ignored",
            externalId);
      }
      return;
    }
    if (!pending.datapoint().isNewerThan(latest)) {
      log.info(
          "Datapoint at {} for '{}' is not newer than the latest one at {}; ignored",
          pending.datapoint().timestamp(),
          externalId,
          latest.timestamp());
      return;
    }
    intents.add(new InsertDatapoint(externalId, pending.datapoint()));
  }

  private List<WriteIntent> planTwinDelete(ChangeEvent event) {
    Object bodyExternalId = event.body().get("externalId");
    String externalId =
        bodyExternalId instanceof String s && !s.isEmpty() ? s : fromTwinId(event.subject());
    if (event.model() == TwinModel.NODE) {
      return source.retrieveNode(externalId).isPresent()
          ? List.of(new DeleteNode(externalId))
          : List.of();
    }
    return source.retrieveTimeseries(externalId).isPresent()
        ? List.of(new DeleteTimeseries(externalId))
        : List.of();
  }

  // ---------------------------------------------------------------- relationships

  private List<WriteIntent> planEdgeUpsert(ChangeEvent event) {
    TwinRelationship rel;
    List<String> patchedLabels = null;
    if (event.kind() == EventKind.EDGE_CREATED) {
      rel = TwinCodec.decodeRelationship(event.body());
      if (rel.createdAt() == null) {
        rel = rel.withCreatedAt(event.time() != null ? event.time() : clock.instant());
      }
    } else {
      RelationshipKey key = parseRelationshipSubject(event.subject());
      Optional<TwinRelationship> current =
          twins.getRelationship(key.sourceTwinId(), key.relationshipId());
      if (current.isEmpty()) {
        log.warn("Relationship '{}' no longer exists in the twin graph", key);
        return List.of();
      }
      rel = current.get();
      for (PatchOperation op : event.patch()) {
        if ("/labels".equals(op.path())) {
          patchedLabels =
              op.op() == PatchOperation.Op.REMOVE
                  ? List.of()
                  : EntityMapper.splitLabels(stringOrNull(op.value()));
        }
      }
    }
    if (rel.kind() == RelationshipKind.EXPLICIT) {
      List<String> labels =
          patchedLabels != null ? patchedLabels : EntityMapper.splitLabels(rel.labels());
      return planExplicitUpsert(rel, labels);
    }
    return planImplicitUpsert(rel);
  }

  private List<WriteIntent> planExplicitUpsert(TwinRelationship rel, List<String> labels) {
    Optional<Edge> existing = source.retrieveEdge(rel.relationshipId());
    List<WriteIntent> intents = new ArrayList<>();
    for (String label : labels) {
      if (!source.labelExists(label)) {
        intents.add(new EnsureLabel(label));
      }
    }
    if (existing.isPresent()) {
      List<String> old = existing.get().labels();
      List<String> add = labels.stream().filter(l -> !old.contains(l)).toList();
      List<String> remove = old.stream().filter(l -> !labels.contains(l)).toList();
      if (add.isEmpty() && remove.isEmpty()) {
        return List.of();
      }
      intents.add(new UpdateEdgeLabels(rel.relationshipId(), add, remove));
      return intents;
    }
    Optional<String> from = resolveNode(rel.sourceTwinId());
    Optional<String> to = resolveNode(rel.targetTwinId());
    if (from.isEmpty() || to.isEmpty()) {
      log.warn(
          "Relationship '{}' has an endpoint missing from the source graph ({} -> {})",
          rel.relationshipId(),
          rel.sourceTwinId(),
          rel.targetTwinId());
      return List.of();
    }
    intents.add(new CreateEdge(new Edge(rel.relationshipId(), from.get(), to.get(), labels)));
    return intents;
  }

  private List<WriteIntent> planImplicitUpsert(TwinRelationship rel) {
    // the twin graph copy of this relationship may lack the creation time stamped from the event
    List<TwinRelationship> candidates = new ArrayList<>();
    for (TwinRelationship sibling : siblings(rel)) {
      if (!sibling.relationshipId().equals(rel.relationshipId())) {
        candidates.add(sibling);
      }
    }
    candidates.add(rel);
    TwinRelationship winner = detector.resolve(candidates).orElse(rel);
    return relink(rel.kind(), subjectTwinId(rel), Optional.of(winner));
  }

  private List<WriteIntent> planEdgeDelete(ChangeEvent event) {
    TwinRelationship rel = TwinCodec.decodeRelationship(event.body());
    if (rel.kind() == RelationshipKind.EXPLICIT) {
      Optional<Edge> existing = source.retrieveEdge(rel.relationshipId());
      if (existing.isEmpty()) {
        return List.of();
      }
      String from = resolveNode(rel.sourceTwinId()).orElse(fromTwinId(rel.sourceTwinId()));
      String to = resolveNode(rel.targetTwinId()).orElse(fromTwinId(rel.targetTwinId()));
      Edge edge = existing.get();
      if (!edge.sourceExternalId().equals(from) || !edge.targetExternalId().equals(to)) {
        log.warn(
            "Relationship '{}' not deleted: source graph has {} -> {}, twin graph has {} -> {}",
            rel.relationshipId(),
            edge.sourceExternalId(),
            edge.targetExternalId(),
            from,
            to);
        return List.of();
      }
      return List.of(new DeleteEdge(rel.relationshipId()));
    }

    String subject = subjectTwinId(rel);
    String removedTwinId =
        rel.kind() == RelationshipKind.PARENT ? rel.targetTwinId() : rel.sourceTwinId();
    String removed = resolveNode(removedTwinId).orElse(fromTwinId(removedTwinId));
    Optional<String> linked = currentLink(rel.kind(), subject);
    if (linked.isEmpty() || !linked.get().equals(removed)) {
      log.warn(
          "Deleted {} relationship '{}' does not match the source graph link {}; ignored",
          rel.kind().relationshipName(),
          rel.relationshipId(),
          linked.orElse("<none>"));
      return List.of();
    }
    List<TwinRelationship> remaining =
        siblings(rel).stream()
            .filter(r -> !r.relationshipId().equals(rel.relationshipId()))
            .toList();
    return relink(rel.kind(), subject, detector.resolve(remaining));
  }

  /**
   * Points the parent of a node, or the asset of a timeseries, at the winner's far endpoint, or at
   * the root when there is no winner.
   */
  private List<WriteIntent> relink(
      RelationshipKind kind, String subjectTwinId, Optional<TwinRelationship> winner) {
    String linkTo;
    if (winner.isPresent()) {
      String farTwinId =
          kind == RelationshipKind.PARENT
              ? winner.get().targetTwinId()
              : winner.get().sourceTwinId();
      Optional<String> resolved = resolveNode(farTwinId);
      if (resolved.isEmpty()) {
        log.warn("Twin '{}' has no node in the source graph; link left unchanged", farTwinId);
        return List.of();
      }
      linkTo = resolved.get();
    } else {
      linkTo = rootExternalId;
    }

    if (kind == RelationshipKind.PARENT) {
      Optional<Node> node = resolveNode(subjectTwinId).flatMap(source::retrieveNode);
      if (node.isEmpty()) {
        log.warn("Twin '{}' has no node in the source graph", subjectTwinId);
        return List.of();
      }
      if (isRoot(node.get().externalId())) {
        log.warn("Ignoring parent change of root node '{}'", rootExternalId);
        return List.of();
      }
      if (linkTo.equals(node.get().parentExternalId())) {
        return List.of();
      }
      return List.of(new UpdateNode(node.get().withParent(linkTo)));
    }

    Optional<Timeseries> ts = resolveTimeseries(subjectTwinId).flatMap(source::retrieveTimeseries);
    if (ts.isEmpty()) {
      log.warn("Twin '{}' has no timeseries in the source graph", subjectTwinId);
      return List.of();
    }
    if (linkTo.equals(ts.get().assetExternalId())) {
      return List.of();
    }
    return List.of(new UpdateTimeseries(ts.get().withAsset(linkTo)));
  }

  /** Every relationship in the twin graph of the same implicit kind for the same subject. */
  private List<TwinRelationship> siblings(TwinRelationship rel) {
    TwinQueryTemplate template =
        rel.kind() == RelationshipKind.PARENT
            ? TwinQueryTemplate.OUTGOING_RELATIONSHIPS
            : TwinQueryTemplate.INCOMING_RELATIONSHIPS;
    List<Map<String, Object>> rows =
        QueryBatcher.unwrapRows(template, batcher.execute(template, List.of(subjectTwinId(rel))));
    List<TwinRelationship> out = new ArrayList<>();
    for (Map<String, Object> row : rows) {
      TwinRelationship r;
      try {
        r = TwinCodec.decodeRelationship(row);
      } catch (ValidationException e) {
        log.warn("Skipping undecodable relationship {}: {}", row, e.getMessage());
        continue;
      }
      if (r.kind() == rel.kind()) {
        out.add(r);
      }
    }
    return out;
  }

  private Optional<String> currentLink(RelationshipKind kind, String subjectTwinId) {
    if (kind == RelationshipKind.PARENT) {
      return resolveNode(subjectTwinId)
          .flatMap(source::retrieveNode)
          .map(Node::parentExternalId);
    }
    return resolveTimeseries(subjectTwinId)
        .flatMap(source::retrieveTimeseries)
        .map(Timeseries::assetExternalId);
  }

  /** The twin whose single-valued link the relationship sets: the child or the series. */
  private static String subjectTwinId(TwinRelationship rel) {
    return rel.kind() == RelationshipKind.PARENT ? rel.sourceTwinId() : rel.targetTwinId();
  }

  static RelationshipKey parseRelationshipSubject(String subject) {
    String[] parts = subject.split("/");
    if (parts.length != 3 || !"relationships".equals(parts[1])) {
      throw new ValidationException(
          "Subject '" + subject + "' does not name a relationship", Map.of("subject", subject));
    }
    return new RelationshipKey(parts[0], parts[2]);
  }

  // ---------------------------------------------------------------- identity resolution

  private Optional<String> resolveNode(String twinId) {
    String candidate = fromTwinId(twinId);
    if (source.retrieveNode(candidate).isPresent()) {
      return Optional.of(candidate);
    }
    return storedExternalId(twinId).filter(id -> source.retrieveNode(id).isPresent());
  }

  private Optional<String> resolveTimeseries(String twinId) {
    String candidate = fromTwinId(twinId);
    if (source.retrieveTimeseries(candidate).isPresent()) {
      return Optional.of(candidate);
    }
    return storedExternalId(twinId).filter(id -> source.retrieveTimeseries(id).isPresent());
  }

  private Optional<String> storedExternalId(String twinId) {
    return twins.getTwin(twinId).map(EntityMapper::externalIdOf);
  }

  private static String eventExternalId(ChangeEvent event, Twin twin) {
    if (twin != null) {
      String stored = twin.properties().externalId();
      if (stored != null && !stored.isEmpty()) return stored;
    }
    return fromTwinId(event.subject());
  }

  private boolean isRoot(String externalId) {
    return rootExternalId.equals(externalId);
  }

  // ---------------------------------------------------------------- patches

  private Node patchNode(Node node, List<PatchOperation> patch) {
    Fields f = new Fields(node.name(), node.description(), node.metadata());
    for (PatchOperation op : patch) {
      applyCommon(node.externalId(), f, op);
    }
    return node.withFields(f.name, f.description, f.metadata);
  }

  private Timeseries patchTimeseries(Timeseries ts, List<PatchOperation> patch) {
    Fields f = new Fields(ts.name(), ts.description(), ts.metadata());
    for (PatchOperation op : patch) {
      String path = op.path();
      if ("/latestValue".equals(path) || "/timestamp".equals(path)) continue;
      applyCommon(ts.externalId(), f, op);
    }
    return ts.withFields(f.name, f.description, f.metadata);
  }

  private void applyCommon(String externalId, Fields f, PatchOperation op) {
    List<String> path = PatchOperation.segments(op.path());
    boolean remove = op.op() == PatchOperation.Op.REMOVE;
    String head = path.isEmpty() ? "" : path.get(0);
    switch (head) {
      case "displayName" -> {
        if (!remove && op.value() != null) f.name = String.valueOf(op.value());
      }
      case "description" -> f.description = remove ? null : stringOrNull(op.value());
      case "externalId", "id" -> log.error(
          "Property '{}' of '{}' is immutable; patch {} ignored", head, externalId, op.toMap());
      case "tags" -> applyTags(externalId, f, op, path);
      default -> log.warn("Unsupported patch path '{}' on '{}'; ignored", op.path(), externalId);
    }
  }

  private void applyTags(String externalId, Fields f, PatchOperation op, List<String> path) {
    boolean remove = op.op() == PatchOperation.Op.REMOVE;
    if (path.size() < 2 || !"values".equals(path.get(1))) {
      log.warn("Unsupported patch path '{}' on '{}'; ignored", op.path(), externalId);
      return;
    }
    if (path.size() == 2) {
      if (remove) {
        f.metadata = new LinkedHashMap<>();
      } else if (op.op() == PatchOperation.Op.ADD && !f.metadata.isEmpty()) {
        log.warn("Tags of '{}' are not empty; whole-map add ignored", externalId);
      } else {
        f.metadata = new LinkedHashMap<>(denormalizedTags(op.value()));
      }
      return;
    }
    String key = metadataKey(f.metadata, path.get(2));
    if (remove) {
      f.metadata.remove(key);
    } else {
      f.metadata.put(key, stringOrNull(op.value()));
    }
  }

  /** Existing raw key whose safe form matches, otherwise the decoded safe key. */
  private static String metadataKey(Map<String, String> metadata, String safeKey) {
    for (String raw : metadata.keySet()) {
      if (toMapKey(raw).equals(safeKey)) return raw;
    }
    return fromMapKey(safeKey);
  }

  private static Map<String, String> denormalizedTags(Object value) {
    Map<String, String> out = new LinkedHashMap<>();
    if (value instanceof Map<?, ?> m) {
      m.forEach((k, v) -> out.put(fromMapKey(String.valueOf(k)), stringOrNull(v)));
    } else if (value != null) {
      throw new ValidationException("Tag values must be a JSON object, got: " + value);
    }
    return out;
  }

  private static PendingDatapoint datapointFromPatch(List<PatchOperation> patch) {
    String value = null;
    Object timestamp = null;
    for (PatchOperation op : patch) {
      if (op.op() == PatchOperation.Op.REMOVE) continue;
      if ("/latestValue".equals(op.path())) value = stringOrNull(op.value());
      if ("/timestamp".equals(op.path())) timestamp = op.value();
    }
    return PendingDatapoint.of(value, timestamp);
  }

  private static boolean sameFields(Timeseries a, Timeseries b) {
    return Objects.equals(a.name(), b.name())
        && Objects.equals(a.description(), b.description())
        && Objects.equals(a.metadata(), b.metadata())
        && Objects.equals(a.assetExternalId(), b.assetExternalId());
  }

  private static Timeseries bareTimeseries(String externalId, String name) {
    return new Timeseries(externalId, null, name, null, Map.of(), null, false, null);
  }

  private static String nameOf(Twin twin) {
    String name = twin.properties().displayName();
    return name == null || name.isEmpty() ? twin.twinId() : name;
  }

  private static Map<String, String> metadataOf(Twin twin) {
    return EntityMapper.mapTwinToNode(twin).metadata();
  }

  private static String stringOrNull(Object v) {
    return v == null ? null : String.valueOf(v);
  }

  private static final class Fields {
    String name;
    String description;
    Map<String, String> metadata;

    Fields(String name, String description, Map<String, String> metadata) {
      this.name = name;
      this.description = description;
      this.metadata = new LinkedHashMap<>(metadata);
    }
  }

  /** A datapoint carried by an event; {@code partial} when only one of value and time came. */
  private record PendingDatapoint(Datapoint datapoint, boolean partial) {
    static PendingDatapoint of(String value, Object timestamp) {
      if (value == null && timestamp == null) return new PendingDatapoint(null, false);
      if (value == null || timestamp == null) return new PendingDatapoint(null, true);
      return new PendingDatapoint(
          new Datapoint(TwinCodec.parseInstant(String.valueOf(timestamp)), value), false);
    }
  }
}

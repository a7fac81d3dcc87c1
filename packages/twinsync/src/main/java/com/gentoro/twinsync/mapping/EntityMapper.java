package com.gentoro.twinsync.mapping;

import static com.gentoro.twinsync.identity.IdentityNormalizer.denormalizeKeys;
import static com.gentoro.twinsync.identity.IdentityNormalizer.fromTwinId;
import static com.gentoro.twinsync.identity.IdentityNormalizer.normalizeKeys;
import static com.gentoro.twinsync.identity.IdentityNormalizer.toTwinId;

import com.gentoro.twinsync.exception.ValidationException;
import com.gentoro.twinsync.model.Edge;
import com.gentoro.twinsync.model.Node;
import com.gentoro.twinsync.model.NodeTwinProperties;
import com.gentoro.twinsync.model.RelationshipKind;
import com.gentoro.twinsync.model.Timeseries;
import com.gentoro.twinsync.model.TimeseriesTwinProperties;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinProperties;
import com.gentoro.twinsync.model.TwinRelationship;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/** Pure conversions between source entities and twin graph entities. */
public final class EntityMapper {
  public static final String LABEL_SEPARATOR = ",";

  private EntityMapper() {}

  public static Twin mapNodeToTwin(Node node) {
    return Twin.node(
        toTwinId(node.externalId()),
        new NodeTwinProperties(
            node.name(),
            node.externalId(),
            idString(node.internalId()),
            emptyToNull(node.description()),
            normalizeKeys(node.metadata())));
  }

  public static Twin mapTimeseriesToTwin(Timeseries ts) {
    String latestValue = ts.latest() == null ? null : ts.latest().value();
    return Twin.timeseries(
        toTwinId(ts.externalId()),
        new TimeseriesTwinProperties(
            ts.name() == null ? ts.externalId() : ts.name(),
            ts.externalId(),
            idString(ts.internalId()),
            emptyToNull(ts.description()),
            normalizeKeys(ts.metadata()),
            latestValue,
            ts.latest() == null ? null : ts.latest().timestamp()));
  }

  /** Node without parent; the parent lives on a separate relationship. */
  public static Node mapTwinToNode(Twin twin) {
    if (!twin.isNode()) {
      throw new ValidationException("Twin '" + twin.twinId() + "' is not a node twin");
    }
    TwinProperties p = twin.properties();
    return new Node(
        externalIdOf(twin),
        parseId(p.internalId()),
        p.displayName() == null || p.displayName().isEmpty() ? twin.twinId() : p.displayName(),
        p.description(),
        denormalizeKeys(p.tags()),
        null);
  }

  /**
   * Timeseries without asset and with a numeric value type; the type is settled by the first
   * datapoint written through the reverse path.
   */
  public static Timeseries mapTwinToTimeseries(Twin twin) {
    if (!twin.isTimeseries()) {
      throw new ValidationException("Twin '" + twin.twinId() + "' is not a timeseries twin");
    }
    TwinProperties p = twin.properties();
    return new Timeseries(
        externalIdOf(twin),
        parseId(p.internalId()),
        p.displayName() == null || p.displayName().isEmpty() ? twin.twinId() : p.displayName(),
        p.description(),
        denormalizeKeys(p.tags()),
        null,
        false,
        null);
  }

  public static TwinRelationship mapEdgeToRelationship(Edge edge) {
    return new TwinRelationship(
        edge.externalId(),
        toTwinId(edge.sourceExternalId()),
        toTwinId(edge.targetExternalId()),
        RelationshipKind.EXPLICIT,
        edge.labels().isEmpty() ? null : joinLabels(edge.labels()),
        null);
  }

  public static Edge mapRelationshipToEdge(TwinRelationship rel) {
    if (rel.kind() != RelationshipKind.EXPLICIT) {
      throw new ValidationException(
          "Relationship '" + rel.relationshipId() + "' of kind " + rel.kind() + " is implicit");
    }
    return new Edge(
        rel.relationshipId(),
        fromTwinId(rel.sourceTwinId()),
        fromTwinId(rel.targetTwinId()),
        splitLabels(rel.labels()));
  }

  public static Optional<TwinRelationship> parentRelationship(Node node) {
    if (node.parentExternalId() == null) return Optional.empty();
    String child = toTwinId(node.externalId());
    String parent = toTwinId(node.parentExternalId());
    return Optional.of(
        new TwinRelationship(
            canonicalRelationshipId(child, parent),
            child,
            parent,
            RelationshipKind.PARENT,
            null,
            null));
  }

  public static Optional<TwinRelationship> attachmentRelationship(Timeseries ts) {
    if (ts.assetExternalId() == null) return Optional.empty();
    String asset = toTwinId(ts.assetExternalId());
    String series = toTwinId(ts.externalId());
    return Optional.of(
        new TwinRelationship(
            canonicalRelationshipId(asset, series),
            asset,
            series,
            RelationshipKind.ATTACHMENT,
            null,
            null));
  }

  public static String canonicalRelationshipId(String sourceTwinId, String targetTwinId) {
    return sourceTwinId + "->" + targetTwinId;
  }

  public static String joinLabels(List<String> labels) {
    if (labels == null || labels.isEmpty()) return "";
    return String.join(LABEL_SEPARATOR, labels);
  }

  public static List<String> splitLabels(String joined) {
    if (joined == null || joined.isEmpty()) return List.of();
    return List.copyOf(new LinkedHashSet<>(List.of(joined.split(LABEL_SEPARATOR))));
  }

  /** Stored externalId property, falling back to the inverse of the twin id. */
  public static String externalIdOf(Twin twin) {
    String stored = twin.properties().externalId();
    return stored == null || stored.isEmpty() ? fromTwinId(twin.twinId()) : stored;
  }

  static String idString(Long id) {
    return id == null ? "" : String.valueOf(id);
  }

  static Long parseId(String id) {
    if (id == null || id.isBlank()) return null;
    try {
      return Long.valueOf(id.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String emptyToNull(String s) {
    return s == null || s.isEmpty() ? null : s;
  }
}

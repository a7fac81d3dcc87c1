package com.gentoro.twinsync.reverse;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.twinsync.SyncContext;
import com.gentoro.twinsync.config.SyncSettings;
import com.gentoro.twinsync.exception.ValidationException;
import com.gentoro.twinsync.mapping.TwinCodec;
import com.gentoro.twinsync.model.Datapoint;
import com.gentoro.twinsync.model.Edge;
import com.gentoro.twinsync.model.Node;
import com.gentoro.twinsync.model.NodeTwinProperties;
import com.gentoro.twinsync.model.PatchOperation;
import com.gentoro.twinsync.model.RelationshipKey;
import com.gentoro.twinsync.model.RelationshipKind;
import com.gentoro.twinsync.model.Timeseries;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinModel;
import com.gentoro.twinsync.model.TwinRelationship;
import com.gentoro.twinsync.source.memory.InMemorySourceGraph;
import com.gentoro.twinsync.state.InMemorySyncStateStore;
import com.gentoro.twinsync.twin.memory.InMemoryTwinGraph;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReverseApplierTest {

  private static final String ROOT = "plant 1";
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  private InMemorySourceGraph source;
  private InMemoryTwinGraph twins;
  private List<Long> sleeps;
  private SyncContext ctx;
  private ReverseApplier applier;

  @BeforeEach
  void setUp() {
    source = new InMemorySourceGraph();
    source.createNode(new Node(ROOT, null, "Plant 1", null, Map.of(), null));
    twins = new InMemoryTwinGraph();
    twins.upsertTwin(nodeTwin("plant_1", ROOT));
    sleeps = new ArrayList<>();
    ctx =
        new SyncContext(
            SyncSettings.inMemory(ROOT),
            source,
            twins,
            Executors.newSingleThreadExecutor(),
            new InMemorySyncStateStore(),
            Clock.systemUTC(),
            sleeps::add);
    applier = new ReverseApplier(ctx);
  }

  @AfterEach
  void tearDown() {
    ctx.close();
  }

  private static Twin nodeTwin(String twinId, String externalId) {
    return Twin.node(twinId, new NodeTwinProperties(externalId, externalId, "", null, Map.of()));
  }

  private static ChangeEvent event(String type, String subject, Map<String, Object> body) {
    return eventAt(type, subject, T0, body);
  }

  private static ChangeEvent eventAt(
      String type, String subject, Instant time, Map<String, Object> body) {
    return ChangeEventDecoder.decode(ChangeEventDecoder.TYPE_PREFIX + type, subject, time, body);
  }

  private static Map<String, Object> twinPatch(TwinModel model, PatchOperation... ops) {
    List<Map<String, Object>> patch = new ArrayList<>();
    for (PatchOperation op : ops) patch.add(op.toMap());
    return Map.of("modelId", model.modelId(), "patch", patch);
  }

  private void addNode(String externalId, String parent) {
    source.createNode(new Node(externalId, null, externalId, null, Map.of(), parent));
  }

  @Nested
  class Twins {

    @Test
    @DisplayName("a twin created without a known parent lands under the root")
    void createdNodeGoesUnderRoot() {
      // Arrange
      Twin pump =
          Twin.node(
              "pump_7",
              new NodeTwinProperties(
                  "Pump 7", "pump 7", "", "main", Map.of("vendor^name", "acme")));

      // Act
      ApplyOutcome outcome =
          applier.apply(event("Twin.Create", "pump_7", TwinCodec.encodeTwin(pump)));

      // Assert
      assertEquals(ApplyOutcome.APPLIED, outcome);
      Node created = source.retrieveNode("pump 7").orElseThrow();
      assertEquals(ROOT, created.parentExternalId());
      assertEquals("Pump 7", created.name());
      assertEquals(Map.of("vendor.name", "acme"), created.metadata());
    }

    @Test
    void patchUpdatesDescriptionAndTags() {
      // Arrange
      source.createNode(
          new Node("pump 7", null, "Pump 7", "old", Map.of("vendor.name", "acme"), ROOT));
      ChangeEvent update =
          event(
              "Twin.Update",
              "pump_7",
              twinPatch(
                  TwinModel.NODE,
                  PatchOperation.replace("/description", "rebuilt"),
                  PatchOperation.replace("/tags/values/vendor^name", "globex"),
                  PatchOperation.add("/tags/values/unit", "kW")));

      // Act
      ApplyOutcome first = applier.apply(update);
      ApplyOutcome second = applier.apply(update);

      // Assert
      assertEquals(ApplyOutcome.APPLIED, first);
      assertEquals(ApplyOutcome.NO_OP, second);
      Node node = source.retrieveNode("pump 7").orElseThrow();
      assertEquals("rebuilt", node.description());
      assertEquals(Map.of("vendor.name", "globex", "unit", "kW"), node.metadata());
      assertEquals(ROOT, node.parentExternalId());
    }

    @Test
    void immutableAndMissingDisplayNameAreIgnored() {
      addNode("pump 7", ROOT);
      ChangeEvent update =
          event(
              "Twin.Update",
              "pump_7",
              twinPatch(
                  TwinModel.NODE,
                  PatchOperation.replace("/externalId", "other"),
                  PatchOperation.remove("/displayName")));

      assertEquals(ApplyOutcome.NO_OP, applier.apply(update));
      assertEquals("pump 7", source.retrieveNode("pump 7").orElseThrow().name());
    }

    @Test
    void deleteRemovesExistingNodeAndIgnoresMissingOne() {
      addNode("pump 7", ROOT);
      Map<String, Object> body = TwinCodec.encodeTwin(nodeTwin("pump_7", "pump 7"));

      assertEquals(ApplyOutcome.APPLIED, applier.apply(event("Twin.Delete", "pump_7", body)));
      assertEquals(ApplyOutcome.NO_OP, applier.apply(event("Twin.Delete", "pump_7", body)));
      assertTrue(source.retrieveNode("pump 7").isEmpty());
    }
  }

  @Nested
  class Datapoints {

    private ChangeEvent valueUpdate(String subject, String value, Instant at) {
      return event(
          "Twin.Update",
          subject,
          twinPatch(
              TwinModel.TIMESERIES,
              PatchOperation.replace("/latestValue", value),
              PatchOperation.replace("/timestamp", at.toString())));
    }

    @Test
    void onlyNewerDatapointsAreWritten() {
      // Arrange
      source.createTimeseries(new Timeseries("flow", null, "flow", null, null, ROOT, false, null));
      source.insertDatapoint("flow", new Datapoint(T0, "1"));

      // Act
      ApplyOutcome older = applier.apply(valueUpdate("flow", "2", T0.minusSeconds(60)));
      ApplyOutcome newer = applier.apply(valueUpdate("flow", "3", T0.plusSeconds(60)));

      // Assert
      assertEquals(ApplyOutcome.NO_OP, older);
      assertEquals(ApplyOutcome.APPLIED, newer);
      assertEquals("3", source.latestDatapoint("flow").orElseThrow().value());
    }

    @Test
    @DisplayName("the first string value turns an empty numeric series into a string series")
    void firstValueSettlesTheValueType() {
      // Arrange
      source.setDeletionVisibilityLag(1);
      source.createTimeseries(
          new Timeseries("status", null, "Status", null, Map.of("k", "v"), ROOT, false, null));

      // Act
      ApplyOutcome outcome = applier.apply(valueUpdate("status", "open", T0));

      // Assert
      assertEquals(ApplyOutcome.APPLIED, outcome);
      Timeseries recreated = source.retrieveTimeseries("status").orElseThrow();
      assertTrue(recreated.isString());
      assertEquals("Status", recreated.name());
      assertEquals(ROOT, recreated.assetExternalId());
      assertEquals("open", source.latestDatapoint("status").orElseThrow().value());
      assertEquals(List.of(200L), sleeps);
    }

    @Test
    void valueOfTheWrongTypeIsRejectedOnceDataExists() {
      source.createTimeseries(new Timeseries("flow", null, "flow", null, null, ROOT, false, null));
      source.insertDatapoint("flow", new Datapoint(T0, "1"));

      ApplyOutcome outcome = applier.apply(valueUpdate("flow", "closed", T0.plusSeconds(1)));

      assertEquals(ApplyOutcome.REJECTED, outcome);
      assertEquals("1", source.latestDatapoint("flow").orElseThrow().value());
      assertFalse(source.retrieveTimeseries("flow").orElseThrow().isString());
    }

    @Test
    @DisplayName("a rejected value does not drop the field changes of the same update")
    void fieldChangesSurviveRejectedValue() {
      // Arrange
      source.createTimeseries(
          new Timeseries("flow", null, "Old name", null, null, ROOT, false, null));
      source.insertDatapoint("flow", new Datapoint(T0, "1"));
      ChangeEvent update =
          event(
              "Twin.Update",
              "flow",
              twinPatch(
                  TwinModel.TIMESERIES,
                  PatchOperation.replace("/displayName", "New name"),
                  PatchOperation.replace("/latestValue", "closed"),
                  PatchOperation.replace("/timestamp", T0.plusSeconds(1).toString())));

      // Act
      ApplyOutcome outcome = applier.apply(update);

      // Assert
      assertEquals(ApplyOutcome.APPLIED, outcome);
      Timeseries flow = source.retrieveTimeseries("flow").orElseThrow();
      assertEquals("New name", flow.name());
      assertFalse(flow.isString());
      assertEquals("1", source.latestDatapoint("flow").orElseThrow().value());
    }

    @Test
    void valueWithoutTimestampIsIgnored() {
      source.createTimeseries(new Timeseries("flow", null, "flow", null, null, ROOT, false, null));
      ChangeEvent partial =
          event(
              "Twin.Update",
              "flow",
              twinPatch(TwinModel.TIMESERIES, PatchOperation.replace("/latestValue", "5")));

      assertEquals(ApplyOutcome.NO_OP, applier.apply(partial));
      assertTrue(source.latestDatapoint("flow").isEmpty());
    }

    @Test
    void unknownSeriesIsCreatedUnderRootWithItsFirstValue() {
      ApplyOutcome outcome = applier.apply(valueUpdate("temp", "21.5", T0));

      assertEquals(ApplyOutcome.APPLIED, outcome);
      Timeseries created = source.retrieveTimeseries("temp").orElseThrow();
      assertEquals(ROOT, created.assetExternalId());
      assertFalse(created.isString());
      assertEquals("21.5", source.latestDatapoint("temp").orElseThrow().value());
    }
  }

  @Nested
  class Relationships {

    @BeforeEach
    void graph() {
      addNode("area", ROOT);
      addNode("pump 7", "area");
      addNode("valve 1", ROOT);
      twins.upsertTwin(nodeTwin("area", "area"));
      twins.upsertTwin(nodeTwin("pump_7", "pump 7"));
      twins.upsertTwin(nodeTwin("valve_1", "valve 1"));
    }

    private Map<String, Object> body(TwinRelationship rel) {
      return TwinCodec.encodeRelationship(rel);
    }

    @Test
    void deletedParentFallsBackToRoot() {
      TwinRelationship rel =
          new TwinRelationship("pump_7->area", "pump_7", "area", RelationshipKind.PARENT, null, T0);

      String subject = "pump_7/relationships/pump_7->area";

      ApplyOutcome outcome = applier.apply(event("Relationship.Delete", subject, body(rel)));

      assertEquals(ApplyOutcome.APPLIED, outcome);
      assertEquals(ROOT, source.retrieveNode("pump 7").orElseThrow().parentExternalId());
    }

    @Test
    void deletedParentThatIsNotTheCurrentLinkIsIgnored() {
      TwinRelationship rel =
          new TwinRelationship(
              "pump_7->valve_1", "pump_7", "valve_1", RelationshipKind.PARENT, null, T0);

      ApplyOutcome outcome =
          applier.apply(event("Relationship.Delete", "pump_7/relationships/x", body(rel)));

      assertEquals(ApplyOutcome.NO_OP, outcome);
      assertEquals("area", source.retrieveNode("pump 7").orElseThrow().parentExternalId());
    }

    @Test
    @DisplayName("with two parents in the twin graph the latest created one wins")
    void ambiguousParentResolvesToLatest() {
      // Arrange
      TwinRelationship older =
          new TwinRelationship("pump_7->area", "pump_7", "area", RelationshipKind.PARENT, null, T0);
      TwinRelationship newer =
          new TwinRelationship(
              "pump_7->valve_1",
              "pump_7",
              "valve_1",
              RelationshipKind.PARENT,
              null,
              T0.plusSeconds(30));
      twins.upsertRelationship(older);
      twins.upsertRelationship(newer);

      // Act
      String subject = "pump_7/relationships/pump_7->area";
      ApplyOutcome outcome = applier.apply(event("Relationship.Create", subject, body(older)));

      // Assert
      assertEquals(ApplyOutcome.APPLIED, outcome);
      assertEquals("valve 1", source.retrieveNode("pump 7").orElseThrow().parentExternalId());
    }

    @Test
    @DisplayName("undated parents are ordered by the time of their create notifications")
    void undatedParentsResolveByNotificationTime() {
      // Arrange
      TwinRelationship first =
          new TwinRelationship(
              "pump_7->valve_1", "pump_7", "valve_1", RelationshipKind.PARENT, null, null);
      TwinRelationship second =
          new TwinRelationship(
              "pump_7->area", "pump_7", "area", RelationshipKind.PARENT, null, null);

      // Act
      twins.upsertRelationship(first);
      ApplyOutcome firstOutcome =
          applier.apply(
              eventAt(
                  "Relationship.Create",
                  "pump_7/relationships/pump_7->valve_1",
                  T0,
                  body(first)));
      twins.upsertRelationship(second);
      ApplyOutcome secondOutcome =
          applier.apply(
              eventAt(
                  "Relationship.Create",
                  "pump_7/relationships/pump_7->area",
                  T0.plusSeconds(30),
                  body(second)));

      // Assert
      assertEquals(ApplyOutcome.APPLIED, firstOutcome);
      assertEquals(ApplyOutcome.APPLIED, secondOutcome);
      assertEquals("area", source.retrieveNode("pump 7").orElseThrow().parentExternalId());
    }

    @Test
    void explicitCreateDefinesMissingLabels() {
      TwinRelationship rel =
          new TwinRelationship(
              "e1", "pump_7", "valve_1", RelationshipKind.EXPLICIT, "feeds,drains", T0);

      ApplyOutcome outcome =
          applier.apply(event("Relationship.Create", "pump_7/relationships/e1", body(rel)));

      assertEquals(ApplyOutcome.APPLIED, outcome);
      assertTrue(source.labelExists("feeds"));
      assertTrue(source.labelExists("drains"));
      Edge edge = source.retrieveEdge("e1").orElseThrow();
      assertEquals("pump 7", edge.sourceExternalId());
      assertEquals("valve 1", edge.targetExternalId());
      assertEquals(List.of("feeds", "drains"), edge.labels());
    }

    @Test
    void labelPatchAddsAndRemovesLabels() {
      // Arrange
      source.createLabel("feeds");
      source.createEdge(new Edge("e1", "pump 7", "valve 1", List.of("feeds")));
      twins.upsertRelationship(
          new TwinRelationship("e1", "pump_7", "valve_1", RelationshipKind.EXPLICIT, "drains", T0));
      Map<String, Object> patch =
          Map.of("patch", List.of(PatchOperation.replace("/labels", "drains").toMap()));

      // Act
      ApplyOutcome outcome =
          applier.apply(event("Relationship.Update", "pump_7/relationships/e1", patch));

      // Assert
      assertEquals(ApplyOutcome.APPLIED, outcome);
      assertEquals(List.of("drains"), source.retrieveEdge("e1").orElseThrow().labels());
    }

    @Test
    void explicitDeleteRequiresMatchingEndpoints() {
      source.createEdge(new Edge("e1", "pump 7", "valve 1", List.of()));
      TwinRelationship moved =
          new TwinRelationship("e1", "pump_7", "area", RelationshipKind.EXPLICIT, null, T0);
      TwinRelationship same =
          new TwinRelationship("e1", "pump_7", "valve_1", RelationshipKind.EXPLICIT, null, T0);
      String subject = "pump_7/relationships/e1";

      assertEquals(
          ApplyOutcome.NO_OP, applier.apply(event("Relationship.Delete", subject, body(moved))));
      assertTrue(source.retrieveEdge("e1").isPresent());
      assertEquals(
          ApplyOutcome.APPLIED, applier.apply(event("Relationship.Delete", subject, body(same))));
      assertTrue(source.retrieveEdge("e1").isEmpty());
    }

    @Test
    void attachmentMovesTheSeries() {
      source.createTimeseries(new Timeseries("flow", null, "flow", null, null, ROOT, false, null));
      TwinRelationship rel =
          new TwinRelationship(
              "pump_7->flow", "pump_7", "flow", RelationshipKind.ATTACHMENT, null, T0);

      String subject = "pump_7/relationships/pump_7->flow";

      ApplyOutcome outcome = applier.apply(event("Relationship.Create", subject, body(rel)));

      assertEquals(ApplyOutcome.APPLIED, outcome);
      assertEquals("pump 7", source.retrieveTimeseries("flow").orElseThrow().assetExternalId());
    }
  }

  @Test
  void relationshipSubjectIsParsed() {
    assertEquals(
        new RelationshipKey("pump_7", "e1"),
        ReverseApplier.parseRelationshipSubject("pump_7/relationships/e1"));
    assertThrows(
        ValidationException.class, () -> ReverseApplier.parseRelationshipSubject("pump_7/e1"));
  }
}

package com.gentoro.twinsync.reverse;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.twinsync.exception.ValidationException;
import com.gentoro.twinsync.model.PatchOperation;
import com.gentoro.twinsync.model.TwinModel;
import com.gentoro.twinsync.utility.JacksonUtility;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChangeEventDecoderTest {

  @Test
  void createTakesModelFromMetadata() {
    String json =
        "{\"type\":\"Microsoft.DigitalTwins.Twin.Create\",\"subject\":\"flow\","
            + "\"time\":\"2024-03-01T10:00:00Z\",\"data\":{\"$dtId\":\"flow\","
            + "\"$metadata\":{\"$model\":\"dtmi:digitaltwins:cognite:cdf:TimeSeries;1\"}}}";

    ChangeEvent event = ChangeEventDecoder.decode(JacksonUtility.readTree(json));

    assertEquals(EventKind.NODE_CREATED, event.kind());
    assertEquals(TwinModel.TIMESERIES, event.model());
    assertEquals(Instant.parse("2024-03-01T10:00:00Z"), event.time());
    assertEquals("flow", event.body().get("$dtId"));
  }

  @Test
  void updateTakesModelFromModelIdAndCarriesPatch() {
    String json =
        "{\"type\":\"Microsoft.DigitalTwins.Twin.Update\",\"subject\":\"pump_7\","
            + "\"data\":{\"modelId\":\"dtmi:digitaltwins:cognite:cdf:Asset;1\","
            + "\"patch\":[{\"op\":\"remove\",\"path\":\"/description\"}]}}";

    ChangeEvent event = ChangeEventDecoder.decode(JacksonUtility.readTree(json));

    assertEquals(EventKind.NODE_UPDATED, event.kind());
    assertEquals(TwinModel.NODE, event.model());
    assertNull(event.time());
    assertEquals(List.of(PatchOperation.remove("/description")), event.patch());
  }

  @Test
  void relationshipEventsHaveNoModel() {
    ChangeEvent event =
        ChangeEventDecoder.decode(
            "Microsoft.DigitalTwins.Relationship.Delete",
            "a/relationships/e1",
            null,
            Map.of("$relationshipId", "e1"));

    assertEquals(EventKind.EDGE_DELETED, event.kind());
    assertNull(event.model());
    assertFalse(event.kind().isNodeEvent());
  }

  @Test
  void rejectsUnknownTypesAndMissingModel() {
    Map<String, Object> empty = Map.of();

    assertThrows(
        ValidationException.class,
        () -> ChangeEventDecoder.decode("Microsoft.DigitalTwins.Telemetry", "a", null, empty));
    assertThrows(
        ValidationException.class,
        () -> ChangeEventDecoder.decode("Microsoft.DigitalTwins.Twin.Move", "a", null, empty));
    assertThrows(
        ValidationException.class,
        () -> ChangeEventDecoder.decode("Other.Twin.Create", "a", null, empty));
    assertThrows(
        ValidationException.class,
        () -> ChangeEventDecoder.decode("Microsoft.DigitalTwins.Twin.Create", "a", null, empty));
  }

  @Test
  void envelopeNeedsObjectData() {
    String json = "{\"type\":\"Microsoft.DigitalTwins.Twin.Delete\",\"subject\":\"a\",\"data\":1}";

    assertThrows(
        ValidationException.class, () -> ChangeEventDecoder.decode(JacksonUtility.readTree(json)));
  }
}

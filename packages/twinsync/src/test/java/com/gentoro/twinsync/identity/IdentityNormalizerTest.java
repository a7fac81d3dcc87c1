package com.gentoro.twinsync.identity;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IdentityNormalizerTest {

  @Test
  void twinIdReplacesSpaceAndColon() {
    assertEquals("pump_7*inlet", IdentityNormalizer.toTwinId("pump 7:inlet"));
    assertEquals("pump 7:inlet", IdentityNormalizer.fromTwinId("pump_7*inlet"));
  }

  @Test
  @DisplayName("ids without placeholder characters survive the round trip")
  void roundTripForLosslessIds() {
    for (String id : new String[] {"plant-1", "area 51", "a:b:c", "tank 3: level"}) {
      assertTrue(IdentityNormalizer.isLossless(id), id);
      assertEquals(id, IdentityNormalizer.fromTwinId(IdentityNormalizer.toTwinId(id)));
    }
  }

  @Test
  @DisplayName("an id already containing '_' does not round-trip")
  void lossyIdIsDetected() {
    String id = "pump_7";

    assertFalse(IdentityNormalizer.isLossless(id));
    assertEquals("pump 7", IdentityNormalizer.fromTwinId(IdentityNormalizer.toTwinId(id)));
  }

  @Test
  void mapKeyReplacesDollarDotAndSpace() {
    assertEquals("#ref^unit_name", IdentityNormalizer.toMapKey("$ref.unit name"));
    assertEquals("$ref.unit name", IdentityNormalizer.fromMapKey("#ref^unit_name"));
    assertTrue(IdentityNormalizer.isLosslessKey("$ref.unit name"));
    assertFalse(IdentityNormalizer.isLosslessKey("unit_name"));
  }

  @Test
  void collidingKeysKeepTheFirstValue() {
    // Arrange
    Map<String, String> raw = new LinkedHashMap<>();
    raw.put("flow rate", "first");
    raw.put("flow_rate", "second");

    // Act
    Map<String, String> safe = IdentityNormalizer.normalizeKeys(raw);

    // Assert
    assertEquals(Map.of("flow_rate", "first"), safe);
  }

  @Test
  void nullsPassThrough() {
    assertNull(IdentityNormalizer.toTwinId(null));
    assertNull(IdentityNormalizer.fromMapKey(null));
    assertTrue(IdentityNormalizer.normalizeKeys(null).isEmpty());
  }
}

package bulkmail.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DeliveryLogTest {
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Test
  void sentHasNoReason() {
    DeliveryLog log = DeliveryLog.sent("c1", "r1", "a@example.com", NOW);

    assertEquals(DeliveryOutcome.SENT, log.outcome());
    assertNull(log.failureReason());
  }

  @Test
  void failedRequiresReason() {
    assertThrows(IllegalArgumentException.class, () ->
        DeliveryLog.failed("c1", "r1", "a@example.com", null, NOW));
    assertThrows(IllegalArgumentException.class, () ->
        DeliveryLog.failed("c1", "r1", "a@example.com", "", NOW));
  }

  @Test
  void sentRejectsReason() {
    assertThrows(IllegalArgumentException.class, () ->
        new DeliveryLog("c1", "r1", "a@example.com", DeliveryOutcome.SENT, "boom", NOW));
  }

  @Test
  void nullKeyRejected() {
    assertThrows(NullPointerException.class, () ->
        DeliveryLog.sent(null, "r1", "a@example.com", NOW));
  }
}

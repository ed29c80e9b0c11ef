package bulkmail;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DeliveryResultTest {

  @Test
  void sentIsSingleton() {
    assertSame(DeliveryResult.sent(), DeliveryResult.sent());
  }

  @Test
  void failedCarriesReason() {
    assertEquals("mailbox full", DeliveryResult.failed("mailbox full").reason());
  }

  @Test
  void failedRejectsMissingReason() {
    assertThrows(NullPointerException.class, () -> DeliveryResult.failed(null));
    assertThrows(IllegalArgumentException.class, () -> DeliveryResult.failed(""));
  }
}

package bulkmail;

import java.util.Objects;

/**
 * Result returned by {@link MailTransport#send(OutgoingMail)}.
 *
 * <ul>
 *   <li>{@link Sent}: the transport accepted the message.</li>
 *   <li>{@link Failed}: the transport rejected it; {@code reason} is stored on the delivery log.</li>
 * </ul>
 */
public sealed interface DeliveryResult permits DeliveryResult.Sent, DeliveryResult.Failed {

  Sent SENT = new Sent();

  static Sent sent() {
    return SENT;
  }

  static Failed failed(String reason) {
    return new Failed(reason);
  }

  record Sent() implements DeliveryResult {
  }

  record Failed(String reason) implements DeliveryResult {
    public Failed {
      Objects.requireNonNull(reason, "reason must not be null");
      if (reason.isEmpty()) {
        throw new IllegalArgumentException("reason must not be empty");
      }
    }
  }
}

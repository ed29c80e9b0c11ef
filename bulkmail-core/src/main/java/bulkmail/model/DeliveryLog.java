package bulkmail.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of the single delivery attempt made for a (campaign, recipient) pair.
 *
 * <p>{@code failureReason} is present iff the outcome is {@link DeliveryOutcome#FAILED}.
 */
public record DeliveryLog(
    String campaignId,
    String recipientId,
    String recipientEmail,
    DeliveryOutcome outcome,
    String failureReason,
    Instant loggedAt
) {
  public DeliveryLog {
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(recipientId, "recipientId");
    Objects.requireNonNull(recipientEmail, "recipientEmail");
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(loggedAt, "loggedAt");
    if (outcome == DeliveryOutcome.FAILED && (failureReason == null || failureReason.isEmpty())) {
      throw new IllegalArgumentException("failureReason is required for a FAILED delivery");
    }
    if (outcome == DeliveryOutcome.SENT && failureReason != null) {
      throw new IllegalArgumentException("failureReason must be null for a SENT delivery");
    }
  }

  public static DeliveryLog sent(String campaignId, String recipientId, String email, Instant at) {
    return new DeliveryLog(campaignId, recipientId, email, DeliveryOutcome.SENT, null, at);
  }

  public static DeliveryLog failed(String campaignId, String recipientId, String email, String reason, Instant at) {
    return new DeliveryLog(campaignId, recipientId, email, DeliveryOutcome.FAILED, reason, at);
  }
}

package bulkmail.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot row linking a campaign to a recipient, captured when the campaign is claimed.
 * Later subscription changes on the recipient do not affect it.
 */
public record CampaignRecipient(
    String campaignId,
    String recipientId,
    String email,
    String name,
    SubscriptionStatus subscriptionStatus,
    Instant createdAt
) {
  public CampaignRecipient {
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(recipientId, "recipientId");
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(subscriptionStatus, "subscriptionStatus");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public boolean isDispatchable() {
    return subscriptionStatus == SubscriptionStatus.SUBSCRIBED;
  }
}

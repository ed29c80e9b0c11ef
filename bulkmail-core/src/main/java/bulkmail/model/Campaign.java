package bulkmail.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only view of a persisted campaign row.
 *
 * <p>Status changes never go through this record; they are issued as compare-and-set
 * statements by {@link bulkmail.state.CampaignStateMachine}.
 *
 * @param completedAt set once the campaign reaches {@link CampaignStatus#COMPLETED}, otherwise {@code null}
 */
public record Campaign(
    String campaignId,
    String name,
    String subject,
    String body,
    Instant scheduledTime,
    CampaignStatus status,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt
) {
  public Campaign {
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(scheduledTime, "scheduledTime");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
  }

  /**
   * Returns {@code true} if the campaign is SCHEDULED and its time has arrived.
   */
  public boolean isDue(Instant now) {
    return status == CampaignStatus.SCHEDULED && !scheduledTime.isAfter(now);
  }
}

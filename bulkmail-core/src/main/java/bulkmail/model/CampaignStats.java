package bulkmail.model;

import java.time.Instant;

/**
 * Aggregate counts for dashboards and detail views. Computed on read, including
 * while a campaign is still in progress.
 *
 * @param dispatchable number of snapshot rows eligible for delivery (0 before the claim)
 */
public record CampaignStats(
    String campaignId,
    String name,
    CampaignStatus status,
    Instant scheduledTime,
    int dispatchable,
    int sent,
    int failed
) {

  public int logged() {
    return sent + failed;
  }

  public int pending() {
    return Math.max(0, dispatchable - logged());
  }
}

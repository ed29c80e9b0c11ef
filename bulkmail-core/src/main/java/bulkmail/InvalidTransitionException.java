package bulkmail;

import bulkmail.model.CampaignStatus;

/**
 * Thrown when a requested status change has no edge in the campaign state graph,
 * for example cancelling a campaign that is already IN_PROGRESS.
 */
public class InvalidTransitionException extends RuntimeException {
  private final String campaignId;
  private final CampaignStatus current;
  private final CampaignStatus requested;

  public InvalidTransitionException(String campaignId, CampaignStatus current, CampaignStatus requested) {
    super("Campaign " + campaignId + " cannot move from " + current + " to " + requested);
    this.campaignId = campaignId;
    this.current = current;
    this.requested = requested;
  }

  public String campaignId() {
    return campaignId;
  }

  public CampaignStatus current() {
    return current;
  }

  public CampaignStatus requested() {
    return requested;
  }
}

package bulkmail;

public class CampaignNotFoundException extends RuntimeException {
  private final String campaignId;

  public CampaignNotFoundException(String campaignId) {
    super("Campaign not found: " + campaignId);
    this.campaignId = campaignId;
  }

  public String campaignId() {
    return campaignId;
  }
}

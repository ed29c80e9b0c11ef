package bulkmail.dispatch;

import bulkmail.OutgoingMail;
import bulkmail.model.Campaign;
import bulkmail.model.CampaignRecipient;

import java.util.Objects;

/**
 * One delivery attempt for a (campaign, recipient) pair, as queued in the worker pool.
 */
public record DeliveryTask(Campaign campaign, CampaignRecipient recipient) {
  public DeliveryTask {
    Objects.requireNonNull(campaign, "campaign");
    Objects.requireNonNull(recipient, "recipient");
    if (!campaign.campaignId().equals(recipient.campaignId())) {
      throw new IllegalArgumentException("recipient " + recipient.recipientId()
          + " belongs to campaign " + recipient.campaignId() + ", not " + campaign.campaignId());
    }
  }

  public String campaignId() {
    return campaign.campaignId();
  }

  public String recipientId() {
    return recipient.recipientId();
  }

  /**
   * Returns the in-flight key, {@code campaignId:recipientId}.
   */
  public String key() {
    return key(campaign.campaignId(), recipient.recipientId());
  }

  public OutgoingMail toMail() {
    return new OutgoingMail(recipient.email(), campaign.subject(), campaign.body());
  }

  static String key(String campaignId, String recipientId) {
    return campaignId + ":" + recipientId;
  }
}

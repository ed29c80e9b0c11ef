package bulkmail.dispatch;

import bulkmail.CampaignStateException;
import bulkmail.completion.CompletionDetector;
import bulkmail.model.Campaign;
import bulkmail.model.CampaignRecipient;
import bulkmail.model.CampaignStatus;
import bulkmail.spi.CampaignStore;
import bulkmail.spi.ConnectionProvider;
import bulkmail.spi.DeliveryLogStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Fans a claimed campaign out to the {@link DeliveryWorkerPool}, one task per snapshot
 * recipient that is dispatchable and not yet logged.
 *
 * <p>Dispatching is idempotent per recipient and may be repeated for the same campaign
 * (recovery after a crash, or a manual redispatch). It does not wait for the deliveries.
 */
public final class CampaignDispatcher {
  private static final Logger logger = Logger.getLogger(CampaignDispatcher.class.getName());

  private final ConnectionProvider connectionProvider;
  private final CampaignStore campaignStore;
  private final DeliveryLogStore deliveryLogStore;
  private final DeliveryWorkerPool workerPool;
  private final CompletionDetector completionDetector;

  public CampaignDispatcher(
      ConnectionProvider connectionProvider,
      CampaignStore campaignStore,
      DeliveryLogStore deliveryLogStore,
      DeliveryWorkerPool workerPool,
      CompletionDetector completionDetector
  ) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.campaignStore = Objects.requireNonNull(campaignStore, "campaignStore");
    this.deliveryLogStore = Objects.requireNonNull(deliveryLogStore, "deliveryLogStore");
    this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
    this.completionDetector = Objects.requireNonNull(completionDetector, "completionDetector");
  }

  /**
   * Submits a delivery task for every pending recipient of an IN_PROGRESS campaign.
   *
   * <p>If no recipient is pending the campaign is handed straight to the completion
   * detector, which completes campaigns with an empty snapshot and campaigns whose last
   * delivery was logged before a crash.
   *
   * @param campaign the campaign to dispatch
   * @return the number of tasks submitted
   */
  public int dispatch(Campaign campaign) {
    Objects.requireNonNull(campaign, "campaign");
    String campaignId = campaign.campaignId();
    if (campaign.status() != CampaignStatus.IN_PROGRESS) {
      logger.warning("Not dispatching campaign " + campaignId + " in status " + campaign.status());
      return 0;
    }

    List<CampaignRecipient> pending = pendingRecipients(campaignId);
    if (pending.isEmpty()) {
      logger.fine(() -> "No pending recipients for campaign " + campaignId);
      completionDetector.checkAndComplete(campaignId);
      return 0;
    }

    int submitted = 0;
    int skipped = 0;
    for (CampaignRecipient recipient : pending) {
      DeliveryWorkerPool.Submission result = workerPool.submit(new DeliveryTask(campaign, recipient));
      if (result == DeliveryWorkerPool.Submission.REJECTED) {
        logger.warning("Worker pool rejected campaign " + campaignId + " after "
            + submitted + " of " + pending.size() + " deliveries");
        break;
      }
      if (result == DeliveryWorkerPool.Submission.ACCEPTED) {
        submitted++;
      } else {
        skipped++;
      }
    }
    logger.info("Dispatched " + submitted + " deliveries for campaign " + campaignId
        + (skipped > 0 ? " (" + skipped + " already in flight)" : ""));
    return submitted;
  }

  private List<CampaignRecipient> pendingRecipients(String campaignId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      List<CampaignRecipient> snapshot = campaignStore.findSnapshot(conn, campaignId);
      Set<String> logged = deliveryLogStore.findLoggedRecipientIds(conn, campaignId);
      List<CampaignRecipient> pending = new ArrayList<>(snapshot.size());
      for (CampaignRecipient recipient : snapshot) {
        if (recipient.isDispatchable() && !logged.contains(recipient.recipientId())) {
          pending.add(recipient);
        }
      }
      return pending;
    } catch (SQLException e) {
      throw new CampaignStateException("Failed to load pending recipients for campaign " + campaignId, e);
    }
  }
}

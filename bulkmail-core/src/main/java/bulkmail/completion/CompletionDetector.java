package bulkmail.completion;

import bulkmail.CampaignStateException;
import bulkmail.InvalidTransitionException;
import bulkmail.spi.CampaignStore;
import bulkmail.spi.ConnectionProvider;
import bulkmail.spi.DeliveryLogStore;
import bulkmail.state.CampaignStateMachine;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether a campaign has a delivery log entry for every dispatchable snapshot row,
 * and if so completes it.
 *
 * <p>Workers call {@link #checkAndComplete(String)} after each successful log append.
 * Concurrent callers that all observe equal counts race on
 * {@link CampaignStateMachine#markCompleted(String)}; exactly one wins.
 */
public final class CompletionDetector {
  private static final Logger logger = Logger.getLogger(CompletionDetector.class.getName());

  private final ConnectionProvider connectionProvider;
  private final CampaignStore campaignStore;
  private final DeliveryLogStore deliveryLogStore;
  private final CampaignStateMachine stateMachine;

  public CompletionDetector(
      ConnectionProvider connectionProvider,
      CampaignStore campaignStore,
      DeliveryLogStore deliveryLogStore,
      CampaignStateMachine stateMachine
  ) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.campaignStore = Objects.requireNonNull(campaignStore, "campaignStore");
    this.deliveryLogStore = Objects.requireNonNull(deliveryLogStore, "deliveryLogStore");
    this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
  }

  /**
   * Completes the campaign if every dispatchable recipient has been logged.
   *
   * @return {@code true} if this call moved the campaign to COMPLETED
   */
  public boolean checkAndComplete(String campaignId) {
    Objects.requireNonNull(campaignId, "campaignId");
    int dispatchable;
    int logged;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      dispatchable = campaignStore.countDispatchable(conn, campaignId);
      logged = deliveryLogStore.count(conn, campaignId);
    } catch (SQLException e) {
      throw new CampaignStateException("Failed to count deliveries for campaign " + campaignId, e);
    }
    if (logged < dispatchable) {
      return false;
    }
    if (logged > dispatchable) {
      logger.warning("Campaign " + campaignId + " has " + logged + " delivery logs for "
          + dispatchable + " dispatchable recipients; not completing");
      return false;
    }
    try {
      return stateMachine.markCompleted(campaignId);
    } catch (InvalidTransitionException e) {
      logger.log(Level.WARNING, "Campaign " + campaignId + " is fully logged but cannot complete", e);
      return false;
    }
  }
}

package bulkmail.view;

import bulkmail.CampaignNotFoundException;
import bulkmail.CampaignStateException;
import bulkmail.model.Campaign;
import bulkmail.model.CampaignStats;
import bulkmail.model.DeliveryLog;
import bulkmail.model.DeliveryOutcome;
import bulkmail.spi.CampaignStore;
import bulkmail.spi.ConnectionProvider;
import bulkmail.spi.DeliveryLogStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only queries behind the dashboard and campaign detail pages. Counts are computed
 * on read, so they are live while a campaign is in progress.
 */
public final class CampaignViews {
  private final ConnectionProvider connectionProvider;
  private final CampaignStore campaignStore;
  private final DeliveryLogStore deliveryLogStore;

  public CampaignViews(ConnectionProvider connectionProvider, CampaignStore campaignStore,
      DeliveryLogStore deliveryLogStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.campaignStore = Objects.requireNonNull(campaignStore, "campaignStore");
    this.deliveryLogStore = Objects.requireNonNull(deliveryLogStore, "deliveryLogStore");
  }

  /**
   * @throws CampaignNotFoundException if no campaign has this id
   */
  public CampaignStats stats(String campaignId) {
    Objects.requireNonNull(campaignId, "campaignId");
    try (Connection conn = open()) {
      Campaign campaign = campaignStore.findById(conn, campaignId)
          .orElseThrow(() -> new CampaignNotFoundException(campaignId));
      return stats(conn, campaign);
    } catch (SQLException e) {
      throw new CampaignStateException("Failed to load stats for campaign " + campaignId, e);
    }
  }

  /**
   * Stats for every campaign, most recently created first.
   */
  public List<CampaignStats> dashboard() {
    try (Connection conn = open()) {
      List<Campaign> campaigns = campaignStore.findAll(conn);
      List<CampaignStats> result = new ArrayList<>(campaigns.size());
      for (Campaign campaign : campaigns) {
        result.add(stats(conn, campaign));
      }
      return result;
    } catch (SQLException e) {
      throw new CampaignStateException("Failed to load dashboard", e);
    }
  }

  /**
   * Delivery log entries ordered by logged time, then email.
   */
  public List<DeliveryLog> deliveryLogs(String campaignId) {
    Objects.requireNonNull(campaignId, "campaignId");
    try (Connection conn = open()) {
      return deliveryLogStore.findByCampaign(conn, campaignId);
    } catch (SQLException e) {
      throw new CampaignStateException("Failed to load delivery logs for campaign " + campaignId, e);
    }
  }

  private CampaignStats stats(Connection conn, Campaign campaign) {
    String campaignId = campaign.campaignId();
    int dispatchable = campaignStore.countDispatchable(conn, campaignId);
    Map<DeliveryOutcome, Integer> counts = deliveryLogStore.countByOutcome(conn, campaignId);
    return new CampaignStats(campaignId, campaign.name(), campaign.status(), campaign.scheduledTime(),
        dispatchable,
        counts.getOrDefault(DeliveryOutcome.SENT, 0),
        counts.getOrDefault(DeliveryOutcome.FAILED, 0));
  }

  private Connection open() throws SQLException {
    Connection conn = connectionProvider.getConnection();
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      conn.close();
      throw e;
    }
    return conn;
  }
}

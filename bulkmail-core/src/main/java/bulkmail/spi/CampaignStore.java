package bulkmail.spi;

import bulkmail.model.Campaign;
import bulkmail.model.CampaignRecipient;
import bulkmail.model.CampaignStatus;
import bulkmail.model.Recipient;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence contract for campaigns and their recipient snapshots.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Status is only ever changed through
 * {@link #compareAndSetStatus}; implementations must not expose any other way
 * to write it.
 *
 * @see bulkmail.jdbc.store.AbstractJdbcCampaignStore
 */
public interface CampaignStore {

  /**
   * Inserts a new campaign row.
   *
   * @param conn     the JDBC connection
   * @param campaign the campaign to persist
   */
  void insert(Connection conn, Campaign campaign);

  /**
   * Loads a campaign by id.
   *
   * @param conn       the JDBC connection
   * @param campaignId the campaign id
   * @return the campaign, or empty if no row exists
   */
  Optional<Campaign> findById(Connection conn, String campaignId);

  /**
   * Lists campaigns in the given status, oldest scheduled time first.
   */
  List<Campaign> findByStatus(Connection conn, CampaignStatus status);

  /**
   * Lists all campaigns, most recently created first.
   */
  List<Campaign> findAll(Connection conn);

  /**
   * Moves one due campaign (SCHEDULED, {@code scheduled_time <= now}) to IN_PROGRESS.
   *
   * <p>Must be called inside a transaction that also materializes the snapshot.
   * Implementations select candidates oldest-first and compare-and-set their status;
   * a candidate whose status changed under a concurrent claimer is skipped.
   *
   * @param conn  the JDBC connection (auto-commit disabled)
   * @param now   the claim instant
   * @param limit maximum number of candidates to try
   * @return the claimed campaign with status IN_PROGRESS, or empty if none could be claimed
   */
  Optional<Campaign> claimDue(Connection conn, Instant now, int limit);

  /**
   * Sets {@code next} as the status if the current status is one of {@code expected}.
   *
   * <p>Also stamps {@code updated_at}, and {@code completed_at} when {@code next}
   * is COMPLETED.
   *
   * @return the number of rows updated (0 or 1)
   */
  int compareAndSetStatus(Connection conn, String campaignId, Set<CampaignStatus> expected,
      CampaignStatus next, Instant at);

  /**
   * Inserts one snapshot row per recipient for the campaign.
   *
   * @return the number of rows inserted
   */
  int insertSnapshot(Connection conn, String campaignId, List<Recipient> recipients, Instant at);

  /**
   * Returns the snapshot rows for the campaign.
   */
  List<CampaignRecipient> findSnapshot(Connection conn, String campaignId);

  /**
   * Counts the snapshot rows whose snapshotted status is SUBSCRIBED.
   */
  int countDispatchable(Connection conn, String campaignId);
}

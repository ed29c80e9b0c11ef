package bulkmail.spi;

import bulkmail.model.DeliveryLog;
import bulkmail.model.DeliveryOutcome;

import java.sql.Connection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Append-only persistence for delivery outcomes.
 *
 * <p>Implementations must enforce at most one entry per (campaign, recipient).
 * This unique key is what keeps racing workers and repeated dispatches from
 * recording a recipient twice.
 *
 * @see bulkmail.jdbc.store.JdbcDeliveryLogStore
 */
public interface DeliveryLogStore {

  /**
   * Appends an entry.
   *
   * @param conn  the JDBC connection
   * @param entry the entry to append
   * @return {@code true} if the row was inserted, {@code false} if an entry for the
   *     same (campaign, recipient) already existed
   */
  boolean append(Connection conn, DeliveryLog entry);

  boolean exists(Connection conn, String campaignId, String recipientId);

  /**
   * Returns the ids of recipients that already have an entry for the campaign.
   */
  Set<String> findLoggedRecipientIds(Connection conn, String campaignId);

  int count(Connection conn, String campaignId);

  /**
   * Counts entries per outcome. Outcomes with no entries map to zero.
   */
  Map<DeliveryOutcome, Integer> countByOutcome(Connection conn, String campaignId);

  /**
   * Returns all entries for the campaign ordered by logged time, then email.
   */
  List<DeliveryLog> findByCampaign(Connection conn, String campaignId);
}

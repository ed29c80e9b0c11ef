package bulkmail.jdbc.store;

import bulkmail.jdbc.DuplicateKeyException;
import bulkmail.jdbc.JdbcTemplate;
import bulkmail.model.DeliveryLog;
import bulkmail.model.DeliveryOutcome;
import bulkmail.spi.DeliveryLogStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JDBC delivery log store. The primary key on {@code (campaign_id, recipient_id)}
 * turns a second append for the same pair into a no-op.
 */
public final class JdbcDeliveryLogStore implements DeliveryLogStore {
  private static final String TABLE = "delivery_log";
  private static final String COLUMNS = "campaign_id, recipient_id, recipient_email, outcome, failure_reason, logged_at";

  private static final JdbcTemplate.RowMapper<DeliveryLog> ROW_MAPPER = rs -> new DeliveryLog(
      rs.getString("campaign_id"),
      rs.getString("recipient_id"),
      rs.getString("recipient_email"),
      DeliveryOutcome.fromCode(rs.getInt("outcome")),
      rs.getString("failure_reason"),
      rs.getTimestamp("logged_at").toInstant());

  @Override
  public boolean append(Connection conn, DeliveryLog entry) {
    String sql = "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?)";
    try {
      JdbcTemplate.update(conn, sql,
          entry.campaignId(), entry.recipientId(), entry.recipientEmail(),
          entry.outcome().code(), entry.failureReason(), Timestamp.from(entry.loggedAt()));
      return true;
    } catch (DuplicateKeyException e) {
      return false;
    }
  }

  @Override
  public boolean exists(Connection conn, String campaignId, String recipientId) {
    String sql = "SELECT COUNT(*) FROM " + TABLE + " WHERE campaign_id=? AND recipient_id=?";
    return JdbcTemplate.queryForInt(conn, sql, campaignId, recipientId) > 0;
  }

  @Override
  public Set<String> findLoggedRecipientIds(Connection conn, String campaignId) {
    String sql = "SELECT recipient_id FROM " + TABLE + " WHERE campaign_id=?";
    return new HashSet<>(JdbcTemplate.query(conn, sql, rs -> rs.getString(1), campaignId));
  }

  @Override
  public int count(Connection conn, String campaignId) {
    String sql = "SELECT COUNT(*) FROM " + TABLE + " WHERE campaign_id=?";
    return JdbcTemplate.queryForInt(conn, sql, campaignId);
  }

  @Override
  public Map<DeliveryOutcome, Integer> countByOutcome(Connection conn, String campaignId) {
    Map<DeliveryOutcome, Integer> counts = new EnumMap<>(DeliveryOutcome.class);
    for (DeliveryOutcome outcome : DeliveryOutcome.values()) {
      counts.put(outcome, 0);
    }
    String sql = "SELECT outcome, COUNT(*) FROM " + TABLE + " WHERE campaign_id=? GROUP BY outcome";
    JdbcTemplate.query(conn, sql, rs -> {
      counts.put(DeliveryOutcome.fromCode(rs.getInt(1)), rs.getInt(2));
      return null;
    }, campaignId);
    return counts;
  }

  @Override
  public List<DeliveryLog> findByCampaign(Connection conn, String campaignId) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE +
        " WHERE campaign_id=? ORDER BY logged_at, recipient_email";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, campaignId);
  }
}

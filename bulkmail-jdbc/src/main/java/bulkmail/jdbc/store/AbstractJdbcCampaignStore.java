package bulkmail.jdbc.store;

import bulkmail.jdbc.JdbcTemplate;
import bulkmail.model.Campaign;
import bulkmail.model.CampaignRecipient;
import bulkmail.model.CampaignStatus;
import bulkmail.model.Recipient;
import bulkmail.model.SubscriptionStatus;
import bulkmail.spi.CampaignStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Base JDBC campaign store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #selectDueSql()} and {@link #candidateLimit(int)} to provide
 * database-specific claim strategies. Register custom implementations via
 * {@code META-INF/services/bulkmail.jdbc.store.AbstractJdbcCampaignStore}.
 *
 * @see JdbcCampaignStores
 */
public abstract class AbstractJdbcCampaignStore implements CampaignStore {
  protected static final String CAMPAIGN_TABLE = "campaign";
  protected static final String SNAPSHOT_TABLE = "campaign_recipient";

  private static final String CAMPAIGN_COLUMNS =
      "campaign_id, name, subject, body, scheduled_time, status, created_at, updated_at, completed_at";

  protected static final JdbcTemplate.RowMapper<Campaign> CAMPAIGN_ROW_MAPPER = rs -> {
    Timestamp completedAt = rs.getTimestamp("completed_at");
    return new Campaign(
        rs.getString("campaign_id"),
        rs.getString("name"),
        rs.getString("subject"),
        rs.getString("body"),
        rs.getTimestamp("scheduled_time").toInstant(),
        CampaignStatus.fromCode(rs.getInt("status")),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant(),
        completedAt == null ? null : completedAt.toInstant());
  };

  private static final JdbcTemplate.RowMapper<CampaignRecipient> SNAPSHOT_ROW_MAPPER = rs -> new CampaignRecipient(
      rs.getString("campaign_id"),
      rs.getString("recipient_id"),
      rs.getString("email"),
      rs.getString("name"),
      SubscriptionStatus.fromCode(rs.getInt("subscription_status")),
      rs.getTimestamp("created_at").toInstant());

  /**
   * Unique identifier for this campaign store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this campaign store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  @Override
  public void insert(Connection conn, Campaign campaign) {
    String sql = "INSERT INTO " + CAMPAIGN_TABLE + " (" + CAMPAIGN_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        campaign.campaignId(), campaign.name(), campaign.subject(), campaign.body(),
        Timestamp.from(campaign.scheduledTime()), campaign.status().code(),
        Timestamp.from(campaign.createdAt()), Timestamp.from(campaign.updatedAt()),
        campaign.completedAt() == null ? null : Timestamp.from(campaign.completedAt()));
  }

  @Override
  public Optional<Campaign> findById(Connection conn, String campaignId) {
    String sql = "SELECT " + CAMPAIGN_COLUMNS + " FROM " + CAMPAIGN_TABLE + " WHERE campaign_id=?";
    return JdbcTemplate.query(conn, sql, CAMPAIGN_ROW_MAPPER, campaignId).stream().findFirst();
  }

  @Override
  public List<Campaign> findByStatus(Connection conn, CampaignStatus status) {
    String sql = "SELECT " + CAMPAIGN_COLUMNS + " FROM " + CAMPAIGN_TABLE +
        " WHERE status=? ORDER BY scheduled_time, campaign_id";
    return JdbcTemplate.query(conn, sql, CAMPAIGN_ROW_MAPPER, status.code());
  }

  @Override
  public List<Campaign> findAll(Connection conn) {
    String sql = "SELECT " + CAMPAIGN_COLUMNS + " FROM " + CAMPAIGN_TABLE +
        " ORDER BY created_at DESC, campaign_id DESC";
    return JdbcTemplate.query(conn, sql, CAMPAIGN_ROW_MAPPER);
  }

  /**
   * Selects up to {@link #candidateLimit(int)} due campaigns oldest-first, then
   * compare-and-sets them one by one until one moves to IN_PROGRESS.
   */
  @Override
  public Optional<Campaign> claimDue(Connection conn, Instant now, int limit) {
    List<String> candidates = JdbcTemplate.query(conn, selectDueSql(), rs -> rs.getString("campaign_id"),
        CampaignStatus.SCHEDULED.code(), Timestamp.from(now), candidateLimit(limit));
    for (String campaignId : candidates) {
      int updated = compareAndSetStatus(conn, campaignId, Set.of(CampaignStatus.SCHEDULED),
          CampaignStatus.IN_PROGRESS, now);
      if (updated == 1) {
        return findById(conn, campaignId);
      }
    }
    return Optional.empty();
  }

  /**
   * Query returning {@code campaign_id} of due campaigns. Parameters: status code,
   * claim instant, row limit.
   */
  protected String selectDueSql() {
    return "SELECT campaign_id FROM " + CAMPAIGN_TABLE +
        " WHERE status=? AND scheduled_time<=? ORDER BY scheduled_time, campaign_id LIMIT ?";
  }

  /**
   * Number of candidates fetched per claim. Stores that lock the selected rows
   * return {@code 1}: a locked candidate can always be claimed.
   */
  protected int candidateLimit(int requested) {
    return requested;
  }

  @Override
  public int compareAndSetStatus(Connection conn, String campaignId, Set<CampaignStatus> expected,
      CampaignStatus next, Instant at) {
    if (expected.isEmpty()) {
      return 0;
    }
    Timestamp ts = Timestamp.from(at);
    if (next == CampaignStatus.COMPLETED) {
      String sql = "UPDATE " + CAMPAIGN_TABLE + " SET status=?, updated_at=?, completed_at=?" +
          " WHERE campaign_id=? AND status IN " + codesIn(expected);
      return JdbcTemplate.update(conn, sql, next.code(), ts, ts, campaignId);
    }
    String sql = "UPDATE " + CAMPAIGN_TABLE + " SET status=?, updated_at=?" +
        " WHERE campaign_id=? AND status IN " + codesIn(expected);
    return JdbcTemplate.update(conn, sql, next.code(), ts, campaignId);
  }

  @Override
  public int insertSnapshot(Connection conn, String campaignId, List<Recipient> recipients, Instant at) {
    String sql = "INSERT INTO " + SNAPSHOT_TABLE +
        " (campaign_id, recipient_id, email, name, subscription_status, created_at) VALUES (?,?,?,?,?,?)";
    Timestamp ts = Timestamp.from(at);
    List<Object[]> rows = new ArrayList<>(recipients.size());
    for (Recipient r : recipients) {
      rows.add(new Object[]{campaignId, r.recipientId(), r.email(), r.name(), r.subscriptionStatus().code(), ts});
    }
    return JdbcTemplate.batchUpdate(conn, sql, rows);
  }

  @Override
  public List<CampaignRecipient> findSnapshot(Connection conn, String campaignId) {
    String sql = "SELECT campaign_id, recipient_id, email, name, subscription_status, created_at FROM " +
        SNAPSHOT_TABLE + " WHERE campaign_id=? ORDER BY email";
    return JdbcTemplate.query(conn, sql, SNAPSHOT_ROW_MAPPER, campaignId);
  }

  @Override
  public int countDispatchable(Connection conn, String campaignId) {
    String sql = "SELECT COUNT(*) FROM " + SNAPSHOT_TABLE + " WHERE campaign_id=? AND subscription_status=?";
    return JdbcTemplate.queryForInt(conn, sql, campaignId, SubscriptionStatus.SUBSCRIBED.code());
  }

  static String codesIn(Set<CampaignStatus> statuses) {
    StringJoiner joiner = new StringJoiner(",", "(", ")");
    for (CampaignStatus status : statuses) {
      joiner.add(Integer.toString(status.code()));
    }
    return joiner.toString();
  }
}

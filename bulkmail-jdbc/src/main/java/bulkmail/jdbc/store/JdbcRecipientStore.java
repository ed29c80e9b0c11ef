package bulkmail.jdbc.store;

import bulkmail.jdbc.DuplicateKeyException;
import bulkmail.jdbc.JdbcTemplate;
import bulkmail.model.Recipient;
import bulkmail.model.SubscriptionStatus;
import bulkmail.spi.RecipientStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC recipient store. The SQL is portable across H2, MySQL and PostgreSQL.
 */
public final class JdbcRecipientStore implements RecipientStore {
  private static final String TABLE = "recipient";
  private static final String COLUMNS = "recipient_id, email, name, subscription_status, created_at";

  private static final JdbcTemplate.RowMapper<Recipient> ROW_MAPPER = rs -> new Recipient(
      rs.getString("recipient_id"),
      rs.getString("email"),
      rs.getString("name"),
      SubscriptionStatus.fromCode(rs.getInt("subscription_status")),
      rs.getTimestamp("created_at").toInstant());

  @Override
  public boolean insert(Connection conn, Recipient recipient) {
    String sql = "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?,?,?,?,?)";
    try {
      JdbcTemplate.update(conn, sql,
          recipient.recipientId(), recipient.email(), recipient.name(),
          recipient.subscriptionStatus().code(), Timestamp.from(recipient.createdAt()));
      return true;
    } catch (DuplicateKeyException e) {
      return false;
    }
  }

  @Override
  public Optional<Recipient> findByEmail(Connection conn, String email) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE email=?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, Recipient.normalizeEmail(email)).stream().findFirst();
  }

  @Override
  public int updateSubscription(Connection conn, String email, SubscriptionStatus status) {
    String sql = "UPDATE " + TABLE + " SET subscription_status=? WHERE email=?";
    return JdbcTemplate.update(conn, sql, status.code(), Recipient.normalizeEmail(email));
  }

  @Override
  public List<Recipient> findSubscribed(Connection conn, Instant asOf) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE +
        " WHERE subscription_status=? AND created_at<=? ORDER BY email";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, SubscriptionStatus.SUBSCRIBED.code(), Timestamp.from(asOf));
  }
}

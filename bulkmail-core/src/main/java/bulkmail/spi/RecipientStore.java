package bulkmail.spi;

import bulkmail.model.Recipient;
import bulkmail.model.SubscriptionStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for recipients. The pipeline only reads it; the write
 * methods exist for the upload collaborator.
 *
 * @see bulkmail.jdbc.store.JdbcRecipientStore
 */
public interface RecipientStore {

  /**
   * Inserts a recipient.
   *
   * @return {@code false} if a recipient with the same email already exists
   */
  boolean insert(Connection conn, Recipient recipient);

  Optional<Recipient> findByEmail(Connection conn, String email);

  /**
   * Changes the subscription status of the recipient with the given email.
   *
   * @return the number of rows updated (0 or 1)
   */
  int updateSubscription(Connection conn, String email, SubscriptionStatus status);

  /**
   * Returns recipients that were subscribed and created no later than {@code asOf}.
   */
  List<Recipient> findSubscribed(Connection conn, Instant asOf);
}

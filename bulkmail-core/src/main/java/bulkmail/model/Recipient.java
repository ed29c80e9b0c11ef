package bulkmail.model;

import bulkmail.util.Ids;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * A mail recipient. Emails are stored trimmed and lower-cased; uniqueness is
 * enforced by the recipient store.
 */
public record Recipient(
    String recipientId,
    String email,
    String name,
    SubscriptionStatus subscriptionStatus,
    Instant createdAt
) {
  public Recipient {
    Objects.requireNonNull(recipientId, "recipientId");
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(subscriptionStatus, "subscriptionStatus");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public static Recipient create(String email, String name, SubscriptionStatus status, Instant createdAt) {
    return new Recipient(Ids.newId(), normalizeEmail(email), name.trim(), status, createdAt);
  }

  public boolean isSubscribed() {
    return subscriptionStatus == SubscriptionStatus.SUBSCRIBED;
  }

  public static String normalizeEmail(String email) {
    Objects.requireNonNull(email, "email");
    String normalized = email.trim().toLowerCase(Locale.ROOT);
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("email must not be blank");
    }
    return normalized;
  }
}

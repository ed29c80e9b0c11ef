package bulkmail.support;

import bulkmail.model.DeliveryLog;
import bulkmail.model.DeliveryOutcome;
import bulkmail.spi.DeliveryLogStore;

import java.sql.Connection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Delivery log keyed by (campaign, recipient); a second append for the same key returns false.
 */
public class InMemoryDeliveryLogStore implements DeliveryLogStore {
  private final Map<String, DeliveryLog> entries = new ConcurrentHashMap<>();
  public final AtomicInteger appendAttempts = new AtomicInteger();

  @Override
  public boolean append(Connection conn, DeliveryLog entry) {
    appendAttempts.incrementAndGet();
    return entries.putIfAbsent(key(entry.campaignId(), entry.recipientId()), entry) == null;
  }

  @Override
  public boolean exists(Connection conn, String campaignId, String recipientId) {
    return entries.containsKey(key(campaignId, recipientId));
  }

  @Override
  public Set<String> findLoggedRecipientIds(Connection conn, String campaignId) {
    return entries.values().stream()
        .filter(e -> e.campaignId().equals(campaignId))
        .map(DeliveryLog::recipientId)
        .collect(Collectors.toSet());
  }

  @Override
  public int count(Connection conn, String campaignId) {
    return (int) entries.values().stream().filter(e -> e.campaignId().equals(campaignId)).count();
  }

  @Override
  public Map<DeliveryOutcome, Integer> countByOutcome(Connection conn, String campaignId) {
    Map<DeliveryOutcome, Integer> counts = new EnumMap<>(DeliveryOutcome.class);
    for (DeliveryOutcome outcome : DeliveryOutcome.values()) {
      counts.put(outcome, 0);
    }
    for (DeliveryLog entry : entries.values()) {
      if (entry.campaignId().equals(campaignId)) {
        counts.merge(entry.outcome(), 1, Integer::sum);
      }
    }
    return counts;
  }

  @Override
  public List<DeliveryLog> findByCampaign(Connection conn, String campaignId) {
    return entries.values().stream()
        .filter(e -> e.campaignId().equals(campaignId))
        .sorted(Comparator.comparing(DeliveryLog::loggedAt).thenComparing(DeliveryLog::recipientEmail))
        .toList();
  }

  private static String key(String campaignId, String recipientId) {
    return campaignId + ":" + recipientId;
  }
}

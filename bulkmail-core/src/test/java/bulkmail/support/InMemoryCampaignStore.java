package bulkmail.support;

import bulkmail.model.Campaign;
import bulkmail.model.CampaignRecipient;
import bulkmail.model.CampaignStatus;
import bulkmail.model.Recipient;
import bulkmail.spi.CampaignStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Map-backed CampaignStore. Every method is synchronized, which makes the
 * compare-and-set atomic.
 */
public class InMemoryCampaignStore implements CampaignStore {
  private final Map<String, Campaign> campaigns = new LinkedHashMap<>();
  private final Map<String, List<CampaignRecipient>> snapshots = new LinkedHashMap<>();

  @Override
  public synchronized void insert(Connection conn, Campaign campaign) {
    if (campaigns.putIfAbsent(campaign.campaignId(), campaign) != null) {
      throw new IllegalStateException("duplicate campaign " + campaign.campaignId());
    }
  }

  @Override
  public synchronized Optional<Campaign> findById(Connection conn, String campaignId) {
    return Optional.ofNullable(campaigns.get(campaignId));
  }

  @Override
  public synchronized List<Campaign> findByStatus(Connection conn, CampaignStatus status) {
    return campaigns.values().stream()
        .filter(c -> c.status() == status)
        .sorted(Comparator.comparing(Campaign::scheduledTime))
        .toList();
  }

  @Override
  public synchronized List<Campaign> findAll(Connection conn) {
    return campaigns.values().stream()
        .sorted(Comparator.comparing(Campaign::createdAt).thenComparing(Campaign::campaignId).reversed())
        .toList();
  }

  @Override
  public synchronized Optional<Campaign> claimDue(Connection conn, Instant now, int limit) {
    List<Campaign> due = campaigns.values().stream()
        .filter(c -> c.isDue(now))
        .sorted(Comparator.comparing(Campaign::scheduledTime))
        .limit(limit)
        .toList();
    for (Campaign candidate : due) {
      if (compareAndSetStatus(conn, candidate.campaignId(), Set.of(CampaignStatus.SCHEDULED),
          CampaignStatus.IN_PROGRESS, now) == 1) {
        return Optional.of(campaigns.get(candidate.campaignId()));
      }
    }
    return Optional.empty();
  }

  @Override
  public synchronized int compareAndSetStatus(Connection conn, String campaignId, Set<CampaignStatus> expected,
      CampaignStatus next, Instant at) {
    Campaign current = campaigns.get(campaignId);
    if (current == null || !expected.contains(current.status())) {
      return 0;
    }
    Instant completedAt = next == CampaignStatus.COMPLETED ? at : current.completedAt();
    campaigns.put(campaignId, new Campaign(current.campaignId(), current.name(), current.subject(),
        current.body(), current.scheduledTime(), next, current.createdAt(), at, completedAt));
    return 1;
  }

  @Override
  public synchronized int insertSnapshot(Connection conn, String campaignId, List<Recipient> recipients, Instant at) {
    List<CampaignRecipient> rows = snapshots.computeIfAbsent(campaignId, k -> new ArrayList<>());
    for (Recipient r : recipients) {
      rows.add(new CampaignRecipient(campaignId, r.recipientId(), r.email(), r.name(), r.subscriptionStatus(), at));
    }
    return recipients.size();
  }

  @Override
  public synchronized List<CampaignRecipient> findSnapshot(Connection conn, String campaignId) {
    return List.copyOf(snapshots.getOrDefault(campaignId, List.of()));
  }

  @Override
  public synchronized int countDispatchable(Connection conn, String campaignId) {
    return (int) snapshots.getOrDefault(campaignId, List.of()).stream()
        .filter(CampaignRecipient::isDispatchable)
        .count();
  }

  /** Adds snapshot rows directly, bypassing a claim. */
  public synchronized void putSnapshot(String campaignId, List<CampaignRecipient> rows) {
    snapshots.computeIfAbsent(campaignId, k -> new ArrayList<>()).addAll(rows);
  }

  public synchronized CampaignStatus statusOf(String campaignId) {
    return campaigns.get(campaignId).status();
  }
}

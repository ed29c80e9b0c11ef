package bulkmail.state;

import bulkmail.CampaignNotFoundException;
import bulkmail.CampaignStateException;
import bulkmail.InvalidTransitionException;
import bulkmail.ReportGenerator;
import bulkmail.model.Campaign;
import bulkmail.model.CampaignStatus;
import bulkmail.model.DeliveryLog;
import bulkmail.model.NewCampaign;
import bulkmail.model.Recipient;
import bulkmail.spi.CampaignStore;
import bulkmail.spi.ConnectionProvider;
import bulkmail.spi.DeliveryLogStore;
import bulkmail.spi.MetricsExporter;
import bulkmail.spi.RecipientStore;
import bulkmail.util.Ids;
import bulkmail.util.SqlStates;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns every campaign status change.
 *
 * <p>Each transition is a single compare-and-set statement against the campaign row, so
 * any number of nodes may call these methods concurrently: at most one caller observes a
 * successful transition, and only that caller performs the transition's side effects
 * (snapshot materialization for a claim, report generation for a completion).
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see CampaignStatus
 */
public final class CampaignStateMachine {
  private static final Logger logger = Logger.getLogger(CampaignStateMachine.class.getName());

  private static final Set<CampaignStatus> CREATABLE = EnumSet.of(CampaignStatus.DRAFT, CampaignStatus.SCHEDULED);

  private final ConnectionProvider connectionProvider;
  private final CampaignStore campaignStore;
  private final RecipientStore recipientStore;
  private final DeliveryLogStore deliveryLogStore;
  private final ReportGenerator reportGenerator;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int claimCandidates;

  private CampaignStateMachine(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.campaignStore = Objects.requireNonNull(builder.campaignStore, "campaignStore");
    this.recipientStore = Objects.requireNonNull(builder.recipientStore, "recipientStore");
    this.deliveryLogStore = Objects.requireNonNull(builder.deliveryLogStore, "deliveryLogStore");
    this.reportGenerator = Objects.requireNonNull(builder.reportGenerator, "reportGenerator");
    if (builder.claimCandidates <= 0) {
      throw new IllegalArgumentException("claimCandidates must be > 0");
    }
    this.claimCandidates = builder.claimCandidates;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Persists a new campaign in DRAFT or SCHEDULED.
   *
   * @param campaign the campaign definition
   * @param now      the creation instant; the scheduled time must be strictly after it
   * @return the persisted campaign
   * @throws IllegalArgumentException if the scheduled time is not in the future, or the
   *     initial status is neither DRAFT nor SCHEDULED
   */
  public Campaign create(NewCampaign campaign, Instant now) {
    Objects.requireNonNull(campaign, "campaign");
    Objects.requireNonNull(now, "now");
    if (!CREATABLE.contains(campaign.initialStatus())) {
      throw new IllegalArgumentException("initialStatus must be DRAFT or SCHEDULED, was " + campaign.initialStatus());
    }
    if (!campaign.scheduledTime().isAfter(now)) {
      throw new IllegalArgumentException("scheduledTime must be in the future: " + campaign.scheduledTime());
    }
    Campaign created = new Campaign(Ids.newId(), campaign.name(), campaign.subject(), campaign.body(),
        campaign.scheduledTime(), campaign.initialStatus(), now, now, null);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      campaignStore.insert(conn, created);
    } catch (SQLException e) {
      throw new CampaignStateException("Failed to create campaign " + campaign.name(), e);
    }
    logger.fine(() -> "Created campaign " + created.campaignId() + " in " + created.status());
    return created;
  }

  /**
   * Moves a campaign from DRAFT to SCHEDULED.
   *
   * @throws InvalidTransitionException if the campaign is not in DRAFT
   * @throws CampaignNotFoundException  if no campaign has this id
   */
  public void schedule(String campaignId) {
    transition(campaignId, CampaignStatus.SCHEDULED);
  }

  /**
   * Moves a DRAFT or SCHEDULED campaign to CANCELLED.
   *
   * @throws InvalidTransitionException if the campaign is IN_PROGRESS or already terminal
   * @throws CampaignNotFoundException  if no campaign has this id
   */
  public void cancel(String campaignId) {
    transition(campaignId, CampaignStatus.CANCELLED);
  }

  /**
   * Claims the oldest due campaign and materializes its recipient snapshot.
   *
   * <p>The status change and the snapshot are committed together. When another node
   * claims the same campaign first, or the database reports a lock or serialization
   * conflict, this returns empty and leaves the campaign to the winner. Any other
   * failure rolls the transaction back, leaving the campaign SCHEDULED, and propagates.
   *
   * @param now the claim instant; campaigns scheduled at or before it are due
   * @return the claimed campaign in IN_PROGRESS, or empty if nothing was claimed
   */
  public Optional<Campaign> claimDue(Instant now) {
    Objects.requireNonNull(now, "now");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        Optional<Campaign> claimed = campaignStore.claimDue(conn, now, claimCandidates);
        if (claimed.isEmpty()) {
          conn.commit();
          return Optional.empty();
        }
        Campaign campaign = claimed.get();
        List<Recipient> recipients = recipientStore.findSubscribed(conn, now);
        int rows = campaignStore.insertSnapshot(conn, campaign.campaignId(), recipients, now);
        conn.commit();
        metrics.incrementCampaignsClaimed();
        logger.info("Claimed campaign " + campaign.campaignId() + " (" + campaign.name()
            + ") with " + rows + " recipients");
        return claimed;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        if (SqlStates.isConcurrencyConflict(e)) {
          logger.log(Level.FINE, "Claim lost to a concurrent transaction", e);
          return Optional.empty();
        }
        throw e;
      }
    } catch (SQLException e) {
      throw new CampaignStateException("Failed to claim due campaign", e);
    }
  }

  /**
   * Moves an IN_PROGRESS campaign to COMPLETED and, if this call made the change,
   * invokes the report generator.
   *
   * @return {@code true} if this call performed the transition, {@code false} if the
   *     campaign was already COMPLETED
   * @throws InvalidTransitionException if the campaign is DRAFT, SCHEDULED or CANCELLED
   * @throws CampaignNotFoundException  if no campaign has this id
   */
  public boolean markCompleted(String campaignId) {
    Objects.requireNonNull(campaignId, "campaignId");
    Instant now = clock.instant();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int updated = campaignStore.compareAndSetStatus(conn, campaignId,
          EnumSet.of(CampaignStatus.IN_PROGRESS), CampaignStatus.COMPLETED, now);
      if (updated == 0) {
        CampaignStatus current = currentStatus(conn, campaignId);
        if (current == CampaignStatus.COMPLETED) {
          return false;
        }
        throw new InvalidTransitionException(campaignId, current, CampaignStatus.COMPLETED);
      }
    } catch (SQLException e) {
      throw new CampaignStateException("Failed to complete campaign " + campaignId, e);
    }
    metrics.incrementCampaignsCompleted();
    logger.info("Campaign " + campaignId + " completed");
    generateReport(campaignId);
    return true;
  }

  /**
   * Loads a campaign.
   */
  public Optional<Campaign> find(String campaignId) {
    Objects.requireNonNull(campaignId, "campaignId");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return campaignStore.findById(conn, campaignId);
    } catch (SQLException e) {
      throw new CampaignStateException("Failed to load campaign " + campaignId, e);
    }
  }

  /**
   * Lists campaigns currently IN_PROGRESS, oldest scheduled time first.
   */
  public List<Campaign> inProgress() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return campaignStore.findByStatus(conn, CampaignStatus.IN_PROGRESS);
    } catch (SQLException e) {
      throw new CampaignStateException("Failed to list in-progress campaigns", e);
    }
  }

  private void transition(String campaignId, CampaignStatus next) {
    Objects.requireNonNull(campaignId, "campaignId");
    Set<CampaignStatus> expected = CampaignStatus.predecessorsOf(next);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int updated = campaignStore.compareAndSetStatus(conn, campaignId, expected, next, clock.instant());
      if (updated == 0) {
        throw new InvalidTransitionException(campaignId, currentStatus(conn, campaignId), next);
      }
    } catch (SQLException e) {
      throw new CampaignStateException("Failed to move campaign " + campaignId + " to " + next, e);
    }
    logger.fine(() -> "Campaign " + campaignId + " moved to " + next);
  }

  private CampaignStatus currentStatus(Connection conn, String campaignId) {
    return campaignStore.findById(conn, campaignId)
        .map(Campaign::status)
        .orElseThrow(() -> new CampaignNotFoundException(campaignId));
  }

  private void generateReport(String campaignId) {
    try {
      Campaign campaign;
      List<DeliveryLog> logs;
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        campaign = campaignStore.findById(conn, campaignId)
            .orElseThrow(() -> new CampaignNotFoundException(campaignId));
        logs = deliveryLogStore.findByCampaign(conn, campaignId);
      }
      reportGenerator.generate(campaign, logs);
    } catch (Exception e) {
      metrics.incrementReportFailures();
      logger.log(Level.SEVERE, "Report generation failed for campaign " + campaignId, e);
    }
  }

  /** Builder for {@link CampaignStateMachine}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private CampaignStore campaignStore;
    private RecipientStore recipientStore;
    private DeliveryLogStore deliveryLogStore;
    private ReportGenerator reportGenerator;
    private MetricsExporter metrics;
    private Clock clock;
    private int claimCandidates = 10;

    private Builder() {}

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder campaignStore(CampaignStore campaignStore) {
      this.campaignStore = campaignStore;
      return this;
    }

    /**
     * Source of the subscribed recipients copied into each claimed campaign's snapshot.
     *
     * <p><b>Required.</b>
     */
    public Builder recipientStore(RecipientStore recipientStore) {
      this.recipientStore = recipientStore;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder deliveryLogStore(DeliveryLogStore deliveryLogStore) {
      this.deliveryLogStore = deliveryLogStore;
      return this;
    }

    /**
     * Sets the generator invoked once per completed campaign.
     *
     * <p><b>Required.</b>
     */
    public Builder reportGenerator(ReportGenerator reportGenerator) {
      this.reportGenerator = reportGenerator;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used to stamp {@code updated_at} and {@code completed_at}.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how many due candidates a single claim attempt inspects before giving up.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     */
    public Builder claimCandidates(int claimCandidates) {
      this.claimCandidates = claimCandidates;
      return this;
    }

    /**
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if {@code claimCandidates <= 0}
     */
    public CampaignStateMachine build() {
      return new CampaignStateMachine(this);
    }
  }
}

package bulkmail;

import bulkmail.completion.CompletionDetector;
import bulkmail.dispatch.CampaignDispatcher;
import bulkmail.dispatch.DeliveryWorkerPool;
import bulkmail.dispatch.InFlightTracker;
import bulkmail.model.Campaign;
import bulkmail.model.CampaignStats;
import bulkmail.model.DeliveryLog;
import bulkmail.report.LoggingReportGenerator;
import bulkmail.scheduler.CampaignScheduler;
import bulkmail.spi.CampaignStore;
import bulkmail.spi.ConnectionProvider;
import bulkmail.spi.DeliveryLogStore;
import bulkmail.spi.MetricsExporter;
import bulkmail.spi.RecipientStore;
import bulkmail.state.CampaignStateMachine;
import bulkmail.view.CampaignViews;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the state machine, worker pool, dispatcher, completion
 * detector and scheduler into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Bulkmail bulkmail = Bulkmail.builder()
 *     .connectionProvider(connProvider)
 *     .campaignStore(JdbcCampaignStores.detect(dataSource))
 *     .recipientStore(new JdbcRecipientStore())
 *     .deliveryLogStore(new JdbcDeliveryLogStore())
 *     .transport(smtpTransport)
 *     .build()) {
 *   bulkmail.start();
 *   bulkmail.stateMachine().create(NewCampaign.scheduled(...), Instant.now());
 * }
 * }</pre>
 *
 * @see CampaignStateMachine
 * @see CampaignScheduler
 * @see DeliveryWorkerPool
 */
public final class Bulkmail implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Bulkmail.class.getName());

  private final CampaignStateMachine stateMachine;
  private final DeliveryWorkerPool workerPool;
  private final CampaignDispatcher dispatcher;
  private final CompletionDetector completionDetector;
  private final CampaignScheduler scheduler;
  private final CampaignViews views;
  private final MetricsExporter metrics;
  private final ReportGenerator reportGenerator;

  private Bulkmail(Builder builder) {
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.reportGenerator = builder.reportGenerator != null ? builder.reportGenerator : new LoggingReportGenerator();
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.stateMachine = CampaignStateMachine.builder()
        .connectionProvider(builder.connectionProvider)
        .campaignStore(builder.campaignStore)
        .recipientStore(builder.recipientStore)
        .deliveryLogStore(builder.deliveryLogStore)
        .reportGenerator(reportGenerator)
        .metrics(metrics)
        .clock(clock)
        .build();
    this.completionDetector = new CompletionDetector(
        builder.connectionProvider, builder.campaignStore, builder.deliveryLogStore, stateMachine);
    this.workerPool = DeliveryWorkerPool.builder()
        .connectionProvider(builder.connectionProvider)
        .deliveryLogStore(builder.deliveryLogStore)
        .transport(builder.transport)
        .completionDetector(completionDetector)
        .inFlightTracker(builder.inFlightTracker)
        .metrics(metrics)
        .clock(clock)
        .workerCount(builder.workerCount)
        .queueCapacity(builder.queueCapacity)
        .sendTimeoutMs(builder.sendTimeoutMs)
        .drainTimeoutMs(builder.drainTimeoutMs)
        .build();
    CampaignDispatcher campaignDispatcher;
    CampaignScheduler campaignScheduler;
    try {
      campaignDispatcher = new CampaignDispatcher(builder.connectionProvider, builder.campaignStore,
          builder.deliveryLogStore, workerPool, completionDetector);
      campaignScheduler = CampaignScheduler.builder()
          .stateMachine(stateMachine)
          .dispatcher(campaignDispatcher)
          .clock(clock)
          .intervalMs(builder.intervalMs)
          .maxClaimsPerTick(builder.maxClaimsPerTick)
          .resumeOnStart(builder.resumeOnStart)
          .build();
    } catch (RuntimeException e) {
      workerPool.close();
      throw e;
    }
    this.dispatcher = campaignDispatcher;
    this.scheduler = campaignScheduler;
    this.views = new CampaignViews(builder.connectionProvider, builder.campaignStore, builder.deliveryLogStore);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduler loop. Subsequent calls are no-ops.
   */
  public void start() {
    scheduler.start();
    logger.info("Bulkmail scheduler started");
  }

  public CampaignStateMachine stateMachine() {
    return stateMachine;
  }

  public CampaignScheduler scheduler() {
    return scheduler;
  }

  public CompletionDetector completionDetector() {
    return completionDetector;
  }

  /**
   * Dispatches the pending recipients of an IN_PROGRESS campaign again. Already logged
   * recipients are skipped, so this is safe to call at any time.
   *
   * @return the number of deliveries submitted
   * @throws CampaignNotFoundException if no campaign has this id
   */
  public int redispatch(String campaignId) {
    Campaign campaign = stateMachine.find(campaignId)
        .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    return dispatcher.dispatch(campaign);
  }

  public CampaignStats stats(String campaignId) {
    return views.stats(campaignId);
  }

  public List<CampaignStats> dashboard() {
    return views.dashboard();
  }

  public List<DeliveryLog> deliveryLogs(String campaignId) {
    return views.deliveryLogs(campaignId);
  }

  /**
   * Shuts down components in order: scheduler, worker pool, then the report generator and
   * metrics exporter if they are {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      scheduler.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      workerPool.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    first = closeQuietly(reportGenerator, first);
    first = closeQuietly(metrics, first);
    if (first != null) {
      throw first;
    }
  }

  private static RuntimeException closeQuietly(Object component, RuntimeException first) {
    if (component instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) return re;
        first.addSuppressed(re);
      }
    }
    return first;
  }

  /**
   * Builder for {@link Bulkmail}. Single use.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private CampaignStore campaignStore;
    private RecipientStore recipientStore;
    private DeliveryLogStore deliveryLogStore;
    private MailTransport transport;
    private ReportGenerator reportGenerator;
    private InFlightTracker inFlightTracker;
    private MetricsExporter metrics;
    private Clock clock;
    private long intervalMs = 60_000;
    private int maxClaimsPerTick = 100;
    private boolean resumeOnStart = true;
    private int workerCount = 4;
    private int queueCapacity = 1000;
    private long sendTimeoutMs = 30_000;
    private long drainTimeoutMs = 5000;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param campaignStore the campaign store
     * @return this builder
     */
    public Builder campaignStore(CampaignStore campaignStore) {
      this.campaignStore = campaignStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param recipientStore the recipient store
     * @return this builder
     */
    public Builder recipientStore(RecipientStore recipientStore) {
      this.recipientStore = recipientStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param deliveryLogStore the delivery log store
     * @return this builder
     */
    public Builder deliveryLogStore(DeliveryLogStore deliveryLogStore) {
      this.deliveryLogStore = deliveryLogStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param transport the mail transport
     * @return this builder
     */
    public Builder transport(MailTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Optional. Defaults to {@link LoggingReportGenerator}.
     *
     * @param reportGenerator invoked once per completed campaign
     * @return this builder
     */
    public Builder reportGenerator(ReportGenerator reportGenerator) {
      this.reportGenerator = reportGenerator;
      return this;
    }

    /**
     * Optional. Defaults to a {@link bulkmail.dispatch.DefaultInFlightTracker}.
     *
     * @param inFlightTracker the in-flight tracker
     * @return this builder
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock shared by every component
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Defaults to {@code 60000} ms.
     *
     * @param intervalMs scheduler tick interval in milliseconds
     * @return this builder
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Optional. Defaults to {@code 100}.
     *
     * @param maxClaimsPerTick maximum campaigns claimed per tick
     * @return this builder
     */
    public Builder maxClaimsPerTick(int maxClaimsPerTick) {
      this.maxClaimsPerTick = maxClaimsPerTick;
      return this;
    }

    /**
     * Optional. Defaults to {@code true}.
     *
     * @param resumeOnStart whether the first tick redispatches IN_PROGRESS campaigns
     * @return this builder
     */
    public Builder resumeOnStart(boolean resumeOnStart) {
      this.resumeOnStart = resumeOnStart;
      return this;
    }

    /**
     * Optional. Defaults to {@code 4}.
     *
     * @param workerCount number of delivery worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Optional. Defaults to {@code 1000}.
     *
     * @param queueCapacity maximum number of queued deliveries
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Optional. Defaults to {@code 30000} ms.
     *
     * @param sendTimeoutMs per-attempt transport timeout in milliseconds
     * @return this builder
     */
    public Builder sendTimeoutMs(long sendTimeoutMs) {
      this.sendTimeoutMs = sendTimeoutMs;
      return this;
    }

    /**
     * Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs shutdown drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the composite. Worker threads start immediately; call {@link Bulkmail#start()}
     * to start the scheduler.
     *
     * @return a new {@link Bulkmail}
     * @throws IllegalStateException    if {@code build()} was already called
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public Bulkmail build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new Bulkmail(this);
    }
  }
}

package bulkmail.micrometer;

import bulkmail.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code bulkmail.campaigns.claimed}: campaigns moved to IN_PROGRESS</li>
 *   <li>{@code bulkmail.campaigns.completed}: campaigns moved to COMPLETED</li>
 *   <li>{@code bulkmail.deliveries.sent}: deliveries logged as SENT</li>
 *   <li>{@code bulkmail.deliveries.failed}: deliveries logged as FAILED</li>
 *   <li>{@code bulkmail.deliveries.duplicate}: attempts whose log entry already existed</li>
 *   <li>{@code bulkmail.reports.failed}: report generator failures</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code bulkmail.queue.depth}: delivery tasks waiting for a worker</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code bulkmail.send.duration.ms}: time spent in the mail transport per attempt</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter campaignsClaimed;
  private final Counter campaignsCompleted;
  private final Counter deliveriesSent;
  private final Counter deliveriesFailed;
  private final Counter duplicatesDiscarded;
  private final Counter reportFailures;
  private final Gauge queueDepthGauge;
  private final DistributionSummary sendDuration;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "bulkmail"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "bulkmail");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "newsletter.bulkmail"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.campaignsClaimed = Counter.builder(namePrefix + ".campaigns.claimed")
        .description("Campaigns claimed for sending")
        .register(registry);
    this.campaignsCompleted = Counter.builder(namePrefix + ".campaigns.completed")
        .description("Campaigns completed")
        .register(registry);
    this.deliveriesSent = Counter.builder(namePrefix + ".deliveries.sent")
        .description("Deliveries accepted by the mail transport")
        .register(registry);
    this.deliveriesFailed = Counter.builder(namePrefix + ".deliveries.failed")
        .description("Deliveries that failed and were logged")
        .register(registry);
    this.duplicatesDiscarded = Counter.builder(namePrefix + ".deliveries.duplicate")
        .description("Delivery log entries discarded because one already existed")
        .register(registry);
    this.reportFailures = Counter.builder(namePrefix + ".reports.failed")
        .description("Completion reports that could not be generated")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);

    this.sendDuration = DistributionSummary.builder(namePrefix + ".send.duration.ms")
        .description("Mail transport time per attempt in milliseconds")
        .register(registry);
  }

  @Override
  public void incrementCampaignsClaimed() {
    if (closed) return;
    campaignsClaimed.increment();
  }

  @Override
  public void incrementCampaignsCompleted() {
    if (closed) return;
    campaignsCompleted.increment();
  }

  @Override
  public void incrementDeliveriesSent() {
    if (closed) return;
    deliveriesSent.increment();
  }

  @Override
  public void incrementDeliveriesFailed() {
    if (closed) return;
    deliveriesFailed.increment();
  }

  @Override
  public void incrementDuplicatesDiscarded() {
    if (closed) return;
    duplicatesDiscarded.increment();
  }

  @Override
  public void incrementReportFailures() {
    if (closed) return;
    reportFailures.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordSendDurationMs(long durationMs) {
    if (closed) return;
    sendDuration.record(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link bulkmail.Bulkmail#close()} calls this so that a stopped pipeline leaves
   * no stale gauge behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(campaignsClaimed, campaignsCompleted, deliveriesSent,
        deliveriesFailed, duplicatesDiscarded, reportFailures, queueDepthGauge, sendDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}

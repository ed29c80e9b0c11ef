package bulkmail.dispatch;

import bulkmail.DeliveryResult;
import bulkmail.MailTransport;
import bulkmail.OutgoingMail;
import bulkmail.completion.CompletionDetector;
import bulkmail.model.DeliveryLog;
import bulkmail.spi.ConnectionProvider;
import bulkmail.spi.DeliveryLogStore;
import bulkmail.spi.MetricsExporter;
import bulkmail.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded pool of worker threads that performs delivery attempts.
 *
 * <p>Tasks wait in a single {@link ArrayBlockingQueue}; {@link #submit} blocks while it is
 * full. Each task makes exactly one call to the {@link MailTransport} through a
 * {@link TimedMailTransport} holding one transport thread per worker, bounded by
 * {@code sendTimeoutMs}. A transport that ignores interruption after a timeout keeps its
 * thread, and later attempts fail as saturated instead of spawning new threads. The
 * worker records the outcome with one auto-commit append to the
 * {@link DeliveryLogStore}. The append is the point of no return: if another worker already
 * logged the same (campaign, recipient), the append reports a duplicate and this result is
 * discarded. After a successful append the worker asks the {@link CompletionDetector}
 * whether the campaign is done.
 *
 * <p>A worker interrupted mid-attempt writes nothing. The key stays unlogged and is picked
 * up by the next redispatch of the campaign.
 *
 * <p>Create instances via {@link #builder()}. Workers start immediately. This class is
 * thread-safe and implements {@link AutoCloseable} for graceful shutdown.
 */
public final class DeliveryWorkerPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryWorkerPool.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;
  static final int MAX_REASON_LENGTH = 4000;

  /** Outcome of {@link #submit(DeliveryTask)}. */
  public enum Submission {
    ACCEPTED,
    /** The same key is already queued or running in this pool. */
    ALREADY_IN_FLIGHT,
    /** The pool is closed or the caller was interrupted while waiting for space. */
    REJECTED
  }

  private final BlockingQueue<DeliveryTask> queue;
  private final ExecutorService workers;
  private final TimedMailTransport transport;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private final ConnectionProvider connectionProvider;
  private final DeliveryLogStore deliveryLogStore;
  private final CompletionDetector completionDetector;
  private final InFlightTracker inFlightTracker;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final long drainTimeoutMs;

  private DeliveryWorkerPool(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.deliveryLogStore = Objects.requireNonNull(builder.deliveryLogStore, "deliveryLogStore");
    Objects.requireNonNull(builder.transport, "transport");
    this.completionDetector = Objects.requireNonNull(builder.completionDetector, "completionDetector");
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    int workerCount = builder.workerCount;
    if (workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.sendTimeoutMs <= 0) {
      throw new IllegalArgumentException("sendTimeoutMs must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.queue = new ArrayBlockingQueue<>(builder.queueCapacity);
    this.transport = new TimedMailTransport(builder.transport, Math.max(workerCount, 1),
        builder.sendTimeoutMs, "bulkmail-transport-");

    if (workerCount > 0) {
      this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("bulkmail-worker-"));
      for (int i = 0; i < workerCount; i++) {
        workers.submit(this::workerLoop);
      }
    } else {
      // workerCount=0: tasks stay queued (testing only)
      logger.warning("workerCount=0: no delivery workers started; queued deliveries will not be sent");
      this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("bulkmail-worker-"));
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Queues a delivery attempt, blocking while the queue is full.
   *
   * @param task the delivery to attempt
   * @return whether the task was queued
   */
  public Submission submit(DeliveryTask task) {
    Objects.requireNonNull(task, "task");
    if (!accepting.get()) {
      return Submission.REJECTED;
    }
    String key = task.key();
    if (!inFlightTracker.tryAcquire(key)) {
      return Submission.ALREADY_IN_FLIGHT;
    }
    try {
      while (accepting.get()) {
        if (queue.offer(task, QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
          metrics.recordQueueDepth(queue.size());
          return Submission.ACCEPTED;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    inFlightTracker.release(key);
    return Submission.REJECTED;
  }

  public int queueDepth() {
    return queue.size();
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && queue.isEmpty()) {
          break;
        }
        DeliveryTask task = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (task == null) {
          if (!running.get()) break;
          continue;
        }
        metrics.recordQueueDepth(queue.size());
        process(task);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Delivery worker error", t);
      }
    }
  }

  private void process(DeliveryTask task) throws InterruptedException {
    try {
      deliver(task);
    } finally {
      inFlightTracker.release(task.key());
    }
  }

  private void deliver(DeliveryTask task) throws InterruptedException {
    String campaignId = task.campaignId();
    String recipientId = task.recipientId();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (deliveryLogStore.exists(conn, campaignId, recipientId)) {
        logger.fine(() -> "Skipping already logged delivery " + task.key());
        return;
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to check delivery log for " + task.key() + "; not sending", e);
      return;
    }

    DeliveryResult result = attempt(task.toMail());
    DeliveryLog entry = toLogEntry(task, result);

    boolean appended;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      appended = deliveryLogStore.append(conn, entry);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record " + entry.outcome() + " delivery for " + task.key(), e);
      return;
    }
    if (!appended) {
      metrics.incrementDuplicatesDiscarded();
      logger.fine(() -> "Discarded duplicate delivery result for " + task.key());
      return;
    }
    if (result instanceof DeliveryResult.Sent) {
      metrics.incrementDeliveriesSent();
    } else {
      metrics.incrementDeliveriesFailed();
    }
    completionDetector.checkAndComplete(campaignId);
  }

  private DeliveryResult attempt(OutgoingMail mail) throws InterruptedException {
    long start = System.nanoTime();
    try {
      DeliveryResult result = transport.send(mail);
      return result != null ? result : DeliveryResult.failed("Transport returned no result");
    } catch (InterruptedException e) {
      throw e;
    } catch (Exception e) {
      return DeliveryResult.failed(describe(e));
    } finally {
      metrics.recordSendDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }
  }

  private DeliveryLog toLogEntry(DeliveryTask task, DeliveryResult result) {
    String email = task.recipient().email();
    if (result instanceof DeliveryResult.Failed failed) {
      return DeliveryLog.failed(task.campaignId(), task.recipientId(), email,
          truncate(failed.reason()), clock.instant());
    }
    return DeliveryLog.sent(task.campaignId(), task.recipientId(), email, clock.instant());
  }

  static String describe(Throwable failure) {
    String message = failure.getMessage();
    if (message == null || message.isBlank()) {
      return failure.getClass().getName();
    }
    return message;
  }

  static String truncate(String reason) {
    return reason.length() <= MAX_REASON_LENGTH ? reason : reason.substring(0, MAX_REASON_LENGTH);
  }

  /**
   * Stops accepting tasks, lets workers drain the queue within the drain timeout,
   * then shuts down the worker and transport threads.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Queued deliveries remaining: "
            + queue.size());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      transport.close();
    }
  }

  /** Builder for {@link DeliveryWorkerPool}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DeliveryLogStore deliveryLogStore;
    private MailTransport transport;
    private CompletionDetector completionDetector;
    private InFlightTracker inFlightTracker;
    private MetricsExporter metrics;
    private Clock clock;
    private int workerCount = 4;
    private int queueCapacity = 1000;
    private long sendTimeoutMs = 30_000;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the connection provider used for delivery log reads and appends.
     *
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
     * @param deliveryLogStore the store recording one outcome per (campaign, recipient)
     * @return this builder
     */
    public Builder deliveryLogStore(DeliveryLogStore deliveryLogStore) {
      this.deliveryLogStore = deliveryLogStore;
      return this;
    }

    /**
     * Sets the transport that sends each message.
     *
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
     * <p><b>Required.</b>
     *
     * @param completionDetector invoked after each successful log append
     * @return this builder
     */
    public Builder completionDetector(CompletionDetector completionDetector) {
      this.completionDetector = completionDetector;
      return this;
    }

    /**
     * Optional. Defaults to a {@link DefaultInFlightTracker}.
     *
     * @param inFlightTracker the tracker implementation
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
     * Sets the clock used to stamp delivery log entries.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the number of worker threads.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 0. Setting to {@code 0}
     * disables processing (useful for testing only).
     *
     * @param workerCount number of worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param queueCapacity maximum number of queued deliveries
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets the per-attempt transport timeout. An attempt that exceeds it is interrupted
     * and recorded as FAILED.
     *
     * <p>Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
     *
     * @param sendTimeoutMs timeout in milliseconds
     * @return this builder
     */
    public Builder sendTimeoutMs(long sendTimeoutMs) {
      this.sendTimeoutMs = sendTimeoutMs;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds to wait for queued deliveries during shutdown.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the pool and starts its worker threads.
     *
     * @return a new {@link DeliveryWorkerPool}
     * @throws NullPointerException if {@code connectionProvider}, {@code deliveryLogStore},
     *     {@code transport} or {@code completionDetector} is null
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public DeliveryWorkerPool build() {
      return new DeliveryWorkerPool(this);
    }
  }
}

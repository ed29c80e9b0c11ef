package bulkmail.spi;

/**
 * Observability hook for exporting pipeline counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of campaigns moved from SCHEDULED to IN_PROGRESS.
     */
    void incrementCampaignsClaimed();

    /**
     * Increments the count of campaigns moved to COMPLETED.
     */
    void incrementCampaignsCompleted();

    /**
     * Increments the count of deliveries logged as SENT.
     */
    void incrementDeliveriesSent();

    /**
     * Increments the count of deliveries logged as FAILED.
     */
    void incrementDeliveriesFailed();

    /**
     * Increments the count of attempts whose log append lost to an existing entry.
     */
    void incrementDuplicatesDiscarded();

    /**
     * Increments the count of report generator invocations that threw.
     */
    default void incrementReportFailures() {
    }

    /**
     * Records the current depth of the delivery task queue.
     *
     * @param depth number of queued tasks
     */
    void recordQueueDepth(int depth);

    /**
     * Records the time spent in the mail transport for one attempt.
     *
     * @param durationMs attempt duration in milliseconds (always non-negative)
     */
    default void recordSendDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementCampaignsClaimed() {
        }

        @Override
        public void incrementCampaignsCompleted() {
        }

        @Override
        public void incrementDeliveriesSent() {
        }

        @Override
        public void incrementDeliveriesFailed() {
        }

        @Override
        public void incrementDuplicatesDiscarded() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}

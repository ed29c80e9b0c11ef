/**
 * Fan-out of claimed campaigns into per-recipient delivery attempts.
 *
 * <p>{@link bulkmail.dispatch.CampaignDispatcher} turns a campaign snapshot into
 * {@link bulkmail.dispatch.DeliveryTask}s; {@link bulkmail.dispatch.DeliveryWorkerPool}
 * executes them on a bounded queue and records each outcome once.
 */
package bulkmail.dispatch;

/**
 * Periodic claiming of due campaigns.
 */
package bulkmail.scheduler;

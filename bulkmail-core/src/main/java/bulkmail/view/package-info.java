/**
 * Read views: per-campaign stats, dashboard and delivery logs.
 */
package bulkmail.view;

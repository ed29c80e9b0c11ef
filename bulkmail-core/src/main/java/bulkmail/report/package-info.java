/**
 * Completed-campaign reports.
 */
package bulkmail.report;

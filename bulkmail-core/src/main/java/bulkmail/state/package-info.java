/**
 * Campaign lifecycle transitions, each issued as a compare-and-set against the campaign row.
 */
package bulkmail.state;

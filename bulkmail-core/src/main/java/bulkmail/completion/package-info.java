/**
 * Count-based completion detection.
 */
package bulkmail.completion;

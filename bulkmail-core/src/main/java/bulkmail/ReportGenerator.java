package bulkmail;

import bulkmail.model.Campaign;
import bulkmail.model.DeliveryLog;

import java.util.List;

/**
 * Produces the summary artifact for a completed campaign.
 *
 * <p>Invoked once per campaign, by the thread that won the IN_PROGRESS to COMPLETED
 * transition. A thrown exception is logged and counted; the campaign stays COMPLETED.
 *
 * @see bulkmail.report.LoggingReportGenerator
 * @see bulkmail.report.DeliveryReport
 */
@FunctionalInterface
public interface ReportGenerator {

  /**
   * @param campaign the completed campaign
   * @param logs     every delivery log entry of the campaign, ordered by logged time
   * @throws Exception if generation fails
   */
  void generate(Campaign campaign, List<DeliveryLog> logs) throws Exception;
}

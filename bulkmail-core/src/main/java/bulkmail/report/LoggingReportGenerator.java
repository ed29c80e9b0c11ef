package bulkmail.report;

import bulkmail.ReportGenerator;
import bulkmail.model.Campaign;
import bulkmail.model.DeliveryLog;

import java.util.List;
import java.util.logging.Logger;

/**
 * Writes the text form of the {@link DeliveryReport} to the log at INFO.
 */
public final class LoggingReportGenerator implements ReportGenerator {
  private static final Logger logger = Logger.getLogger(LoggingReportGenerator.class.getName());

  @Override
  public void generate(Campaign campaign, List<DeliveryLog> logs) {
    DeliveryReport report = DeliveryReport.of(campaign, logs);
    logger.info("Campaign report " + campaign.campaignId() + "\n" + report.text());
  }
}

package bulkmail.report;

import bulkmail.model.Campaign;
import bulkmail.model.DeliveryLog;
import bulkmail.model.DeliveryOutcome;

import java.util.List;
import java.util.Objects;

/**
 * Summary of a completed campaign, renderable as plain text or CSV.
 */
public final class DeliveryReport {
  static final String CSV_HEADER = "recipient_email,status,failure_reason,sent_at";

  private final Campaign campaign;
  private final List<DeliveryLog> logs;
  private final int sent;
  private final int failed;

  private DeliveryReport(Campaign campaign, List<DeliveryLog> logs) {
    this.campaign = campaign;
    this.logs = logs;
    int sentCount = 0;
    for (DeliveryLog log : logs) {
      if (log.outcome() == DeliveryOutcome.SENT) {
        sentCount++;
      }
    }
    this.sent = sentCount;
    this.failed = logs.size() - sentCount;
  }

  public static DeliveryReport of(Campaign campaign, List<DeliveryLog> logs) {
    Objects.requireNonNull(campaign, "campaign");
    Objects.requireNonNull(logs, "logs");
    return new DeliveryReport(campaign, List.copyOf(logs));
  }

  public Campaign campaign() {
    return campaign;
  }

  public List<DeliveryLog> logs() {
    return logs;
  }

  public int total() {
    return logs.size();
  }

  public int sent() {
    return sent;
  }

  public int failed() {
    return failed;
  }

  /**
   * Summary header followed by one line per delivery:
   * {@code loggedAt | email | outcome | reason}.
   */
  public String text() {
    StringBuilder sb = new StringBuilder();
    sb.append("Campaign: ").append(campaign.name()).append('\n');
    sb.append("Subject: ").append(campaign.subject()).append('\n');
    sb.append("Scheduled Time: ").append(campaign.scheduledTime()).append('\n');
    sb.append("Status: ").append(campaign.status()).append('\n');
    sb.append('\n');
    sb.append("Total: ").append(total()).append('\n');
    sb.append("Sent: ").append(sent).append('\n');
    sb.append("Failed: ").append(failed).append('\n');
    sb.append('\n');
    sb.append("Detailed delivery logs:");
    for (DeliveryLog log : logs) {
      sb.append('\n')
          .append(log.loggedAt()).append(" | ")
          .append(log.recipientEmail()).append(" | ")
          .append(log.outcome()).append(" | ")
          .append(log.failureReason() == null ? "" : log.failureReason());
    }
    return sb.toString();
  }

  /**
   * One row per delivery under the header {@value #CSV_HEADER}. Commas inside failure
   * reasons are replaced with semicolons.
   */
  public String csv() {
    StringBuilder sb = new StringBuilder(CSV_HEADER);
    for (DeliveryLog log : logs) {
      String reason = log.failureReason() == null ? "" : log.failureReason().replace(',', ';');
      sb.append('\n')
          .append(log.recipientEmail()).append(',')
          .append(log.outcome()).append(',')
          .append(reason).append(',')
          .append(log.loggedAt());
    }
    return sb.toString();
  }

  /**
   * Suggested file name for the CSV attachment.
   */
  public String csvFileName() {
    return "campaign_" + campaign.campaignId() + "_report.csv";
  }
}

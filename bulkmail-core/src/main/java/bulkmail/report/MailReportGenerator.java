package bulkmail.report;

import bulkmail.DeliveryResult;
import bulkmail.MailTransport;
import bulkmail.OutgoingMail;
import bulkmail.ReportGenerator;
import bulkmail.dispatch.TimedMailTransport;
import bulkmail.model.Campaign;
import bulkmail.model.DeliveryLog;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Mails the campaign report to an administrator address through a {@link MailTransport}.
 *
 * <p>The message body is the text report followed by the CSV rows. Reports run on the
 * delivery worker that completed the campaign, so the send goes through a single-thread
 * {@link TimedMailTransport}: a hung admin mail fails with a {@link TimeoutException}
 * after {@code sendTimeoutMs} and the worker moves on.
 */
public final class MailReportGenerator implements ReportGenerator, AutoCloseable {
  private static final Logger logger = Logger.getLogger(MailReportGenerator.class.getName());

  static final long DEFAULT_SEND_TIMEOUT_MS = 30_000;

  private final TimedMailTransport transport;
  private final String adminEmail;

  public MailReportGenerator(MailTransport transport, String adminEmail) {
    this(transport, adminEmail, DEFAULT_SEND_TIMEOUT_MS);
  }

  public MailReportGenerator(MailTransport transport, String adminEmail, long sendTimeoutMs) {
    Objects.requireNonNull(transport, "transport");
    this.adminEmail = Objects.requireNonNull(adminEmail, "adminEmail");
    if (adminEmail.isBlank()) {
      throw new IllegalArgumentException("adminEmail must not be blank");
    }
    this.transport = new TimedMailTransport(transport, 1, sendTimeoutMs, "bulkmail-report-");
  }

  @Override
  public void generate(Campaign campaign, List<DeliveryLog> logs) throws Exception {
    DeliveryReport report = DeliveryReport.of(campaign, logs);
    String body = report.text() + "\n\n" + report.csvFileName() + ":\n" + report.csv();
    OutgoingMail mail = new OutgoingMail(adminEmail, "[Campaign Report] " + campaign.name(), body);
    DeliveryResult result = transport.send(mail);
    if (result instanceof DeliveryResult.Failed failed) {
      throw new IllegalStateException("Report mail to " + adminEmail + " failed: " + failed.reason());
    }
    logger.fine(() -> "Mailed report for campaign " + campaign.campaignId() + " to " + adminEmail);
  }

  @Override
  public void close() {
    transport.close();
  }
}

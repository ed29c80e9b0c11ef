package bulkmail.demo;

import bulkmail.Bulkmail;
import bulkmail.DeliveryResult;
import bulkmail.MailTransport;
import bulkmail.jdbc.DataSourceConnectionProvider;
import bulkmail.jdbc.SchemaScripts;
import bulkmail.jdbc.store.AbstractJdbcCampaignStore;
import bulkmail.jdbc.store.JdbcCampaignStores;
import bulkmail.jdbc.store.JdbcDeliveryLogStore;
import bulkmail.jdbc.store.JdbcRecipientStore;
import bulkmail.model.Campaign;
import bulkmail.model.CampaignStats;
import bulkmail.model.DeliveryLog;
import bulkmail.model.NewCampaign;
import bulkmail.model.Recipient;
import bulkmail.model.SubscriptionStatus;
import bulkmail.report.DeliveryReport;

import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs one campaign end to end against an in-memory H2 database, without Spring.
 *
 * Run with: mvn -pl samples/bulkmail-demo exec:java
 */
public final class BulkmailDemo {

  public static void main(String[] args) throws Exception {
    // 1. Setup H2 in-memory database
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:bulkmail_demo;MODE=MySQL;DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection()) {
      SchemaScripts.apply(conn, "h2");
    }

    AbstractJdbcCampaignStore campaignStore = JdbcCampaignStores.detect(dataSource);
    JdbcRecipientStore recipientStore = new JdbcRecipientStore();
    DataSourceConnectionProvider connectionProvider = new DataSourceConnectionProvider(dataSource);

    // 2. Upload recipients; one of them has unsubscribed
    Instant now = Instant.now();
    addRecipients(connectionProvider, recipientStore, now,
        "alice@example.com", "bob@example.com", "carol@bounce.example.com", "dave@example.com");
    try (Connection conn = connectionProvider.getConnection()) {
      recipientStore.updateSubscription(conn, "dave@example.com", SubscriptionStatus.UNSUBSCRIBED);
    }

    // 3. A transport that prints messages and rejects one domain
    MailTransport transport = mail -> {
      if (mail.to().endsWith("@bounce.example.com")) {
        return DeliveryResult.failed("550 mailbox unavailable");
      }
      System.out.println("[Transport] -> " + mail.to() + ": " + mail.subject());
      return DeliveryResult.sent();
    };

    CountDownLatch reported = new CountDownLatch(1);
    Bulkmail bulkmail = Bulkmail.builder()
        .connectionProvider(connectionProvider)
        .campaignStore(campaignStore)
        .recipientStore(recipientStore)
        .deliveryLogStore(new JdbcDeliveryLogStore())
        .transport(transport)
        .reportGenerator((campaign, logs) -> {
          System.out.println("\n=== Report ===\n" + DeliveryReport.of(campaign, logs).text());
          reported.countDown();
        })
        .intervalMs(500)
        .workerCount(2)
        .build();

    System.out.println("=== Bulkmail Demo ===\n");

    // 4. Schedule a campaign one second from now and start the scheduler
    Campaign campaign = bulkmail.stateMachine().create(
        NewCampaign.scheduled("Spring launch", "Our spring collection is here",
            "<h1>Hello!</h1><p>New arrivals inside.</p>", now.plusSeconds(1)),
        now);
    System.out.println("Scheduled campaign " + campaign.campaignId() + " for " + campaign.scheduledTime());
    bulkmail.start();

    boolean completed = reported.await(10, TimeUnit.SECONDS);
    if (!completed) {
      System.out.println("\nTimeout waiting for the campaign to complete.");
    }

    // 5. Show the dashboard and the delivery log
    System.out.println("\n=== Dashboard ===");
    System.out.printf("%-26s | %-14s | %-11s | %4s | %6s | %4s%n", "ID", "NAME", "STATUS", "SENT", "FAILED", "LEFT");
    System.out.println("-".repeat(80));
    for (CampaignStats stats : bulkmail.dashboard()) {
      System.out.printf("%-26s | %-14s | %-11s | %4d | %6d | %4d%n",
          stats.campaignId(), stats.name(), stats.status(), stats.sent(), stats.failed(), stats.pending());
    }

    System.out.println("\n=== Delivery log ===");
    for (DeliveryLog log : bulkmail.deliveryLogs(campaign.campaignId())) {
      System.out.println(log.recipientEmail() + " " + log.outcome()
          + (log.failureReason() == null ? "" : " (" + log.failureReason() + ")"));
    }

    // 6. Cleanup
    bulkmail.close();
    System.out.println("\nDemo complete.");
  }

  private static void addRecipients(DataSourceConnectionProvider connectionProvider,
      JdbcRecipientStore recipientStore, Instant createdAt, String... emails) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      for (String email : emails) {
        String name = email.substring(0, email.indexOf('@'));
        recipientStore.insert(conn, Recipient.create(email, name, SubscriptionStatus.SUBSCRIBED, createdAt));
      }
    }
  }
}

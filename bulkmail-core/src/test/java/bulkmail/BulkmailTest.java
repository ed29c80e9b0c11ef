package bulkmail;

import bulkmail.model.Campaign;
import bulkmail.model.CampaignStats;
import bulkmail.model.CampaignStatus;
import bulkmail.model.DeliveryLog;
import bulkmail.model.DeliveryOutcome;
import bulkmail.model.NewCampaign;
import bulkmail.model.SubscriptionStatus;
import bulkmail.support.InMemoryCampaignStore;
import bulkmail.support.InMemoryDeliveryLogStore;
import bulkmail.support.InMemoryRecipientStore;
import bulkmail.support.RecordingReportGenerator;
import bulkmail.support.StubConnections;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BulkmailTest {
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private final InMemoryCampaignStore campaigns = new InMemoryCampaignStore();
  private final InMemoryRecipientStore recipients = new InMemoryRecipientStore();
  private final InMemoryDeliveryLogStore logs = new InMemoryDeliveryLogStore();
  private final RecordingReportGenerator reports = new RecordingReportGenerator();

  @Test
  void builderRejectsMissingTransport() {
    assertThrows(NullPointerException.class, () -> baseBuilder().build());
  }

  @Test
  void builderIsSingleUse() {
    Bulkmail.Builder builder = baseBuilder().transport(mail -> DeliveryResult.sent());
    try (Bulkmail ignored = builder.build()) {
      assertThrows(IllegalStateException.class, builder::build);
    }
  }

  @Test
  void campaignRunsToCompletionWithMixedOutcomes() throws Exception {
    recipients.add("a@example.com", SubscriptionStatus.SUBSCRIBED, NOW.minusSeconds(600));
    recipients.add("b@example.com", SubscriptionStatus.SUBSCRIBED, NOW.minusSeconds(600));
    recipients.add("c@example.com", SubscriptionStatus.SUBSCRIBED, NOW.minusSeconds(600));
    MailTransport transport = mail -> mail.to().startsWith("b")
        ? DeliveryResult.failed("mailbox full")
        : DeliveryResult.sent();

    try (Bulkmail bulkmail = baseBuilder().transport(transport).build()) {
      Campaign campaign = bulkmail.stateMachine().create(
          NewCampaign.scheduled("Launch", "Hello", "Body", NOW.minusSeconds(1)), NOW.minusSeconds(300));

      assertEquals(1, bulkmail.scheduler().tick());
      assertTrue(reports.generated.await(3, TimeUnit.SECONDS));

      CampaignStats stats = bulkmail.stats(campaign.campaignId());
      assertEquals(CampaignStatus.COMPLETED, stats.status());
      assertEquals(3, stats.dispatchable());
      assertEquals(2, stats.sent());
      assertEquals(1, stats.failed());
      assertEquals(0, stats.pending());

      List<DeliveryLog> entries = bulkmail.deliveryLogs(campaign.campaignId());
      assertEquals(3, entries.size());
      DeliveryLog failed = entries.stream().filter(e -> e.outcome() == DeliveryOutcome.FAILED).findFirst().orElseThrow();
      assertEquals("b@example.com", failed.recipientEmail());
      assertEquals("mailbox full", failed.failureReason());

      assertEquals(1, reports.campaigns.size());
      assertEquals(3, reports.logs.get(0).size());
    }
  }

  @Test
  void dashboardListsNewestFirst() {
    try (Bulkmail bulkmail = baseBuilder().transport(mail -> DeliveryResult.sent()).build()) {
      Campaign older = bulkmail.stateMachine().create(
          NewCampaign.draft("Older", "s", "b", NOW.plusSeconds(60)), NOW.minusSeconds(10));
      Campaign newer = bulkmail.stateMachine().create(
          NewCampaign.draft("Newer", "s", "b", NOW.plusSeconds(60)), NOW);

      List<CampaignStats> dashboard = bulkmail.dashboard();

      assertEquals(2, dashboard.size());
      assertEquals(newer.campaignId(), dashboard.get(0).campaignId());
      assertEquals(older.campaignId(), dashboard.get(1).campaignId());
      assertEquals(0, dashboard.get(0).dispatchable());
    }
  }

  @Test
  void unknownCampaignViews() {
    try (Bulkmail bulkmail = baseBuilder().transport(mail -> DeliveryResult.sent()).build()) {
      assertThrows(CampaignNotFoundException.class, () -> bulkmail.stats("missing"));
      assertThrows(CampaignNotFoundException.class, () -> bulkmail.redispatch("missing"));
    }
  }

  private Bulkmail.Builder baseBuilder() {
    return Bulkmail.builder()
        .connectionProvider(StubConnections.provider())
        .campaignStore(campaigns)
        .recipientStore(recipients)
        .deliveryLogStore(logs)
        .reportGenerator(reports)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .workerCount(2)
        .drainTimeoutMs(1000);
  }
}

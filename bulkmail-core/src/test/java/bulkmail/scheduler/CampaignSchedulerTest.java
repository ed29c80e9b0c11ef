package bulkmail.scheduler;

import bulkmail.DeliveryResult;
import bulkmail.model.Campaign;
import bulkmail.model.CampaignStatus;
import bulkmail.model.NewCampaign;
import bulkmail.model.SubscriptionStatus;
import bulkmail.support.TestPipeline;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

import static bulkmail.support.TestPipeline.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CampaignSchedulerTest {

    @Test
    void builderValidation() {
        try (TestPipeline p = new TestPipeline(mail -> DeliveryResult.sent())) {
            assertThrows(NullPointerException.class, () ->
                    CampaignScheduler.builder().dispatcher(p.dispatcher).build());
            assertThrows(IllegalArgumentException.class, () ->
                    CampaignScheduler.builder().stateMachine(p.stateMachine).dispatcher(p.dispatcher)
                            .intervalMs(0).build());
            assertThrows(IllegalArgumentException.class, () ->
                    CampaignScheduler.builder().stateMachine(p.stateMachine).dispatcher(p.dispatcher)
                            .maxClaimsPerTick(0).build());
        }
    }

    @Test
    void tickClaimsOnlyDueCampaigns() throws Exception {
        try (TestPipeline p = new TestPipeline(mail -> DeliveryResult.sent())) {
            p.recipients.add("a@example.com", SubscriptionStatus.SUBSCRIBED, NOW.minusSeconds(600));
            Campaign due = p.stateMachine.create(NewCampaign.scheduled("Due", "s", "b", NOW.minusSeconds(1)),
                    NOW.minusSeconds(300));
            Campaign later = p.stateMachine.create(NewCampaign.scheduled("Later", "s", "b", NOW.plusSeconds(3600)),
                    NOW.minusSeconds(300));
            CampaignScheduler scheduler = scheduler(p, 100);

            assertEquals(1, scheduler.tick());

            assertTrue(p.reports.generated.await(3, TimeUnit.SECONDS));
            assertEquals(CampaignStatus.COMPLETED, p.campaigns.statusOf(due.campaignId()));
            assertEquals(CampaignStatus.SCHEDULED, p.campaigns.statusOf(later.campaignId()));
            assertEquals(0, scheduler.tick());
        }
    }

    @Test
    void tickRespectsClaimLimit() {
        try (TestPipeline p = new TestPipeline(mail -> DeliveryResult.sent())) {
            for (int i = 0; i < 3; i++) {
                p.stateMachine.create(NewCampaign.scheduled("C" + i, "s", "b", NOW.minusSeconds(10 - i)),
                        NOW.minusSeconds(300));
            }
            CampaignScheduler scheduler = scheduler(p, 2);

            assertEquals(2, scheduler.tick());
            assertEquals(1, scheduler.tick());
            assertEquals(0, scheduler.tick());
        }
    }

    @Test
    void startResumesInProgressCampaigns() throws Exception {
        try (TestPipeline p = new TestPipeline(mail -> DeliveryResult.sent())) {
            p.recipients.add("a@example.com", SubscriptionStatus.SUBSCRIBED, NOW.minusSeconds(600));
            p.recipients.add("b@example.com", SubscriptionStatus.SUBSCRIBED, NOW.minusSeconds(600));
            // claimed but never dispatched, as after a crash
            Campaign orphan = p.claimedCampaign("Orphan");

            try (CampaignScheduler scheduler = CampaignScheduler.builder()
                    .stateMachine(p.stateMachine)
                    .dispatcher(p.dispatcher)
                    .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                    .intervalMs(60_000)
                    .build()) {
                scheduler.start();

                assertTrue(p.reports.generated.await(3, TimeUnit.SECONDS));
                assertEquals(CampaignStatus.COMPLETED, p.campaigns.statusOf(orphan.campaignId()));
                assertEquals(2, p.logs.count(null, orphan.campaignId()));
            }
        }
    }

    @Test
    void closedSchedulerCannotStart() {
        try (TestPipeline p = new TestPipeline(mail -> DeliveryResult.sent())) {
            CampaignScheduler scheduler = scheduler(p, 1);
            scheduler.close();

            assertThrows(IllegalStateException.class, scheduler::start);
            assertEquals(0, scheduler.tick());
        }
    }

    private static CampaignScheduler scheduler(TestPipeline p, int maxClaims) {
        return CampaignScheduler.builder()
                .stateMachine(p.stateMachine)
                .dispatcher(p.dispatcher)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .maxClaimsPerTick(maxClaims)
                .resumeOnStart(false)
                .build();
    }
}

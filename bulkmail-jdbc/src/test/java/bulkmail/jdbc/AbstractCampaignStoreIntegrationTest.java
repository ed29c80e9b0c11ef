package bulkmail.jdbc;

import bulkmail.jdbc.store.AbstractJdbcCampaignStore;
import bulkmail.jdbc.store.JdbcCampaignStores;
import bulkmail.jdbc.store.JdbcDeliveryLogStore;
import bulkmail.jdbc.store.JdbcRecipientStore;
import bulkmail.model.Campaign;
import bulkmail.model.CampaignStatus;
import bulkmail.model.DeliveryLog;
import bulkmail.model.DeliveryOutcome;
import bulkmail.model.Recipient;
import bulkmail.model.SubscriptionStatus;
import bulkmail.util.Ids;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Store behaviour shared by every real database. Subclasses provide the DataSource
 * and the store they expect auto-detection to pick.
 */
abstract class AbstractCampaignStoreIntegrationTest {
    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.SECONDS);

    private final JdbcRecipientStore recipients = new JdbcRecipientStore();
    private final JdbcDeliveryLogStore logs = new JdbcDeliveryLogStore();

    abstract DataSource dataSource();

    abstract AbstractJdbcCampaignStore store();

    static void applySchema(DataSource dataSource, String storeName) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            SchemaScripts.apply(conn, storeName);
        }
    }

    static void clearTables(DataSource dataSource) throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("DELETE FROM delivery_log");
            stmt.execute("DELETE FROM campaign_recipient");
            stmt.execute("DELETE FROM campaign");
            stmt.execute("DELETE FROM recipient");
        }
    }

    @Test
    void detectPicksThisStore() {
        assertSame(store().getClass(), JdbcCampaignStores.detect(dataSource()).getClass());
    }

    @Test
    void claimSnapshotAndCountAgainstRealDatabase() throws Exception {
        Campaign campaign = new Campaign(Ids.newId(), "Launch", "Hello", "Body text",
            NOW.minusSeconds(5), CampaignStatus.SCHEDULED, NOW.minusSeconds(60), NOW.minusSeconds(60), null);

        try (Connection conn = dataSource().getConnection()) {
            conn.setAutoCommit(true);
            store().insert(conn, campaign);
            Recipient amy = Recipient.create("amy@example.com", "Amy", SubscriptionStatus.SUBSCRIBED, NOW.minusSeconds(60));
            Recipient bob = Recipient.create("bob@example.com", "Bob", SubscriptionStatus.SUBSCRIBED, NOW.minusSeconds(60));
            assertTrue(recipients.insert(conn, amy));
            assertTrue(recipients.insert(conn, bob));
            assertFalse(recipients.insert(conn, Recipient.create("AMY@example.com", "Amy", SubscriptionStatus.SUBSCRIBED, NOW)));

            conn.setAutoCommit(false);
            Optional<Campaign> claimed = store().claimDue(conn, NOW, 10);
            assertTrue(claimed.isPresent());
            assertEquals(2, store().insertSnapshot(conn, campaign.campaignId(), recipients.findSubscribed(conn, NOW), NOW));
            conn.commit();
            conn.setAutoCommit(true);

            assertEquals(CampaignStatus.IN_PROGRESS, store().findById(conn, campaign.campaignId()).orElseThrow().status());
            assertEquals(2, store().countDispatchable(conn, campaign.campaignId()));

            assertTrue(logs.append(conn, DeliveryLog.sent(campaign.campaignId(), amy.recipientId(), amy.email(), NOW)));
            assertFalse(logs.append(conn, DeliveryLog.sent(campaign.campaignId(), amy.recipientId(), amy.email(), NOW)));
            assertTrue(logs.append(conn, DeliveryLog.failed(campaign.campaignId(), bob.recipientId(), bob.email(), "bounced", NOW)));
            assertEquals(Map.of(DeliveryOutcome.SENT, 1, DeliveryOutcome.FAILED, 1),
                logs.countByOutcome(conn, campaign.campaignId()));

            assertEquals(1, store().compareAndSetStatus(conn, campaign.campaignId(),
                Set.of(CampaignStatus.IN_PROGRESS), CampaignStatus.COMPLETED, NOW));
            Campaign completed = store().findById(conn, campaign.campaignId()).orElseThrow();
            assertEquals(NOW, completed.completedAt());
        }
    }

    @Test
    void lockedCandidateIsSkippedByConcurrentClaimer() throws Exception {
        Campaign first = new Campaign(Ids.newId(), "First", "s", "b",
            NOW.minusSeconds(20), CampaignStatus.SCHEDULED, NOW.minusSeconds(60), NOW.minusSeconds(60), null);
        Campaign second = new Campaign(Ids.newId(), "Second", "s", "b",
            NOW.minusSeconds(10), CampaignStatus.SCHEDULED, NOW.minusSeconds(60), NOW.minusSeconds(60), null);

        try (Connection setup = dataSource().getConnection()) {
            store().insert(setup, first);
            store().insert(setup, second);
        }

        try (Connection a = dataSource().getConnection(); Connection b = dataSource().getConnection()) {
            a.setAutoCommit(false);
            b.setAutoCommit(false);

            Campaign claimedByA = store().claimDue(a, NOW, 10).orElseThrow();
            Campaign claimedByB = store().claimDue(b, NOW, 10).orElseThrow();

            assertEquals(first.campaignId(), claimedByA.campaignId());
            assertEquals(second.campaignId(), claimedByB.campaignId());
            a.commit();
            b.commit();
        }

        try (Connection conn = dataSource().getConnection()) {
            List<Campaign> inProgress = store().findByStatus(conn, CampaignStatus.IN_PROGRESS);
            assertEquals(2, inProgress.size());
        }
    }
}

/**
 * JDBC store implementations for campaigns, recipients and delivery logs.
 *
 * <p>{@link bulkmail.jdbc.store.JdbcCampaignStores} picks the campaign store matching
 * a JDBC URL; recipient and delivery log SQL is shared by every supported database.
 */
package bulkmail.jdbc.store;

package bulkmail.jdbc.store;

import java.util.List;

/**
 * MySQL 8 campaign store. Also compatible with TiDB.
 *
 * <p>Selects the due candidate with {@code FOR UPDATE SKIP LOCKED}, so concurrent
 * schedulers each lock a different campaign instead of queueing on the same row.
 */
public final class MySqlCampaignStore extends AbstractJdbcCampaignStore {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected String selectDueSql() {
    return super.selectDueSql() + " FOR UPDATE SKIP LOCKED";
  }

  @Override
  protected int candidateLimit(int requested) {
    return 1;
  }
}

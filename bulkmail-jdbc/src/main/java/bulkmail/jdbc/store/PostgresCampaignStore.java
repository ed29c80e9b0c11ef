package bulkmail.jdbc.store;

import java.util.List;

/**
 * PostgreSQL campaign store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} when selecting the due candidate.
 */
public final class PostgresCampaignStore extends AbstractJdbcCampaignStore {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
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

package bulkmail.jdbc.store;

import java.util.List;

/**
 * H2 campaign store. Uses the default select-then-compare-and-set claim; a concurrent
 * claimer either sees zero rows updated or a lock conflict, both of which count as a lost claim.
 */
public final class H2CampaignStore extends AbstractJdbcCampaignStore {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}

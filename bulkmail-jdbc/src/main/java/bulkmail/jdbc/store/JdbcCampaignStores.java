package bulkmail.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC campaign stores with auto-detection support.
 *
 * <p>Campaign stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/bulkmail.jdbc.store.AbstractJdbcCampaignStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcCampaignStore store = JdbcCampaignStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcCampaignStore store = JdbcCampaignStores.detect("jdbc:mysql://localhost/mail");
 *
 * // Get by name
 * AbstractJdbcCampaignStore store = JdbcCampaignStores.get("postgresql");
 * }</pre>
 */
public final class JdbcCampaignStores {

    private static final List<AbstractJdbcCampaignStore> STORES;
    private static final Map<String, AbstractJdbcCampaignStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcCampaignStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcCampaignStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcCampaignStores() {
    }

    /**
     * Returns all registered campaign stores.
     */
    public static List<AbstractJdbcCampaignStore> all() {
        return STORES;
    }

    /**
     * Gets a campaign store by name.
     *
     * @param name campaign store name (case-insensitive)
     * @return the campaign store
     * @throws IllegalArgumentException if no campaign store found
     */
    public static AbstractJdbcCampaignStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcCampaignStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown campaign store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the campaign store from a DataSource.
     *
     * @param dataSource the data source
     * @return detected campaign store
     * @throws IllegalStateException if detection fails or no matching campaign store
     */
    public static AbstractJdbcCampaignStore detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect campaign store from DataSource", e);
        }
    }

    /**
     * Auto-detects the campaign store from a JDBC URL.
     *
     * @param jdbcUrl the JDBC URL
     * @return detected campaign store
     * @throws IllegalArgumentException if no matching campaign store found
     */
    public static AbstractJdbcCampaignStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcCampaignStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No campaign store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}

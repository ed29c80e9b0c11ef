package bulkmail.jdbc;

import bulkmail.jdbc.store.AbstractJdbcCampaignStore;
import bulkmail.jdbc.store.MySqlCampaignStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class MySqlCampaignStoreIntegrationTest extends AbstractCampaignStoreIntegrationTest {

    @Container
    static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("bulkmail_test");

    private static final MySqlCampaignStore STORE = new MySqlCampaignStore();
    private static SimpleDataSource dataSource;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
        applySchema(dataSource, STORE.name());
    }

    @BeforeEach
    void clear() throws Exception {
        clearTables(dataSource);
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcCampaignStore store() {
        return STORE;
    }
}

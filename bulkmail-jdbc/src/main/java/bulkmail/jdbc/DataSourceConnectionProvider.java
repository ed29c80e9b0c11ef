package bulkmail.jdbc;

import bulkmail.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} backed by a {@link DataSource}.
 *
 * <p>Each pipeline step borrows one connection and closes it when done, so a pooled
 * {@code DataSource} should allow at least one connection per delivery worker plus one for
 * the scheduler.
 *
 * @see ConnectionProvider
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  /**
   * @throws SQLException if the data source fails or hands out no connection
   */
  @Override
  public Connection getConnection() throws SQLException {
    Connection conn = dataSource.getConnection();
    if (conn == null) {
      throw new SQLException("DataSource " + dataSource.getClass().getName() + " returned no connection");
    }
    return conn;
  }
}

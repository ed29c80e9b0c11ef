package bulkmail.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Creates private in-memory H2 databases with the bulkmail schema applied.
 */
final class H2Databases {

  private H2Databases() {}

  static String newUrl() {
    return "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1";
  }

  static JdbcDataSource withSchema() throws SQLException {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL(newUrl());
    try (Connection conn = dataSource.getConnection()) {
      SchemaScripts.apply(conn, "h2");
    }
    return dataSource;
  }
}

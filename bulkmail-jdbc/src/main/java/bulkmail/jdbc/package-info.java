/**
 * JDBC support: {@link bulkmail.jdbc.JdbcTemplate}, {@link bulkmail.jdbc.DataSourceConnectionProvider}
 * and the reference schema runner.
 *
 * <p>Store implementations live in {@link bulkmail.jdbc.store}.
 */
package bulkmail.jdbc;

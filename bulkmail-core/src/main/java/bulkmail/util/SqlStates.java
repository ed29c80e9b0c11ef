package bulkmail.util;

import java.sql.SQLException;

/**
 * Classifies {@link SQLException}s raised by H2, MySQL and PostgreSQL.
 *
 * <p>Both methods walk the cause chain, so they also accept the unchecked
 * wrappers thrown by the JDBC stores.
 */
public final class SqlStates {
  private static final int MYSQL_DUPLICATE_ENTRY = 1062;
  private static final int MYSQL_LOCK_WAIT_TIMEOUT = 1205;
  private static final int MYSQL_DEADLOCK = 1213;

  private SqlStates() {}

  /**
   * Returns {@code true} if the failure is a unique or primary key violation.
   */
  public static boolean isUniqueViolation(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof SQLException e) {
        String state = e.getSQLState();
        if ("23505".equals(state)) {
          return true;
        }
        if (e.getErrorCode() == MYSQL_DUPLICATE_ENTRY) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Returns {@code true} if the failure means another transaction won a race for
   * the same rows: serialization failure, deadlock, lock timeout or H2's
   * concurrent-update error.
   */
  public static boolean isConcurrencyConflict(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof SQLException e) {
        String state = e.getSQLState();
        if (state != null && (state.equals("40001") || state.equals("40P01")
            || state.equals("90131") || state.equals("HYT00"))) {
          return true;
        }
        int code = e.getErrorCode();
        if (code == MYSQL_LOCK_WAIT_TIMEOUT || code == MYSQL_DEADLOCK) {
          return true;
        }
      }
    }
    return false;
  }
}

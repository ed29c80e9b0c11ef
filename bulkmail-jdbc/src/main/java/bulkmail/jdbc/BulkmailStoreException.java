package bulkmail.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the stores in {@link bulkmail.jdbc.store}.
 */
public class BulkmailStoreException extends RuntimeException {
  public BulkmailStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

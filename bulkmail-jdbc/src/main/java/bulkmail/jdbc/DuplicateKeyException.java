package bulkmail.jdbc;

/**
 * Thrown when a statement violates a primary key or unique constraint.
 */
public final class DuplicateKeyException extends BulkmailStoreException {
  public DuplicateKeyException(String message, Throwable cause) {
    super(message, cause);
  }
}

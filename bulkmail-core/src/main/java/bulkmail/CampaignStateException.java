package bulkmail;

/**
 * Unchecked exception wrapping JDBC errors raised while reading or changing campaign state
 * (connection acquisition, commit, rollback).
 */
public final class CampaignStateException extends RuntimeException {
  public CampaignStateException(String message, Throwable cause) {
    super(message, cause);
  }
}

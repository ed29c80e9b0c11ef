package bulkmail.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Identifier generation for campaigns and recipients.
 */
public final class Ids {

  private Ids() {}

  /**
   * Returns a new monotonic ULID string (26 characters, lexicographically time-ordered).
   */
  public static String newId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}

package bulkmail.model;

public enum SubscriptionStatus {
  SUBSCRIBED(0),
  UNSUBSCRIBED(1);

  private final int code;

  SubscriptionStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static SubscriptionStatus fromCode(int code) {
    for (SubscriptionStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown subscription status code: " + code);
  }
}

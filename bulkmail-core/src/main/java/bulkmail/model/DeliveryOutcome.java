package bulkmail.model;

public enum DeliveryOutcome {
  SENT(0),
  FAILED(1);

  private final int code;

  DeliveryOutcome(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static DeliveryOutcome fromCode(int code) {
    for (DeliveryOutcome outcome : values()) {
      if (outcome.code == code) {
        return outcome;
      }
    }
    throw new IllegalArgumentException("Unknown delivery outcome code: " + code);
  }
}

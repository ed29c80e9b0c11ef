package bulkmail.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a campaign.
 *
 * <pre>
 * DRAFT ──► SCHEDULED ──► IN_PROGRESS ──► COMPLETED
 *   │           │
 *   └─────┬─────┘
 *         ▼
 *     CANCELLED
 * </pre>
 *
 * <p>COMPLETED and CANCELLED are terminal. The integer {@link #code()} is what the
 * JDBC stores persist.
 */
public enum CampaignStatus {
  DRAFT(0),
  SCHEDULED(1),
  IN_PROGRESS(2),
  COMPLETED(3),
  CANCELLED(4);

  private final int code;

  CampaignStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Returns {@code true} if the state graph has an edge from this status to {@code next}.
   */
  public boolean canTransitionTo(CampaignStatus next) {
    return switch (this) {
      case DRAFT -> next == SCHEDULED || next == CANCELLED;
      case SCHEDULED -> next == IN_PROGRESS || next == CANCELLED;
      case IN_PROGRESS -> next == COMPLETED;
      case COMPLETED, CANCELLED -> false;
    };
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }

  /**
   * Returns every status with an edge into {@code next}.
   */
  public static Set<CampaignStatus> predecessorsOf(CampaignStatus next) {
    Set<CampaignStatus> result = EnumSet.noneOf(CampaignStatus.class);
    for (CampaignStatus status : values()) {
      if (status.canTransitionTo(next)) {
        result.add(status);
      }
    }
    return result;
  }

  public static CampaignStatus fromCode(int code) {
    for (CampaignStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown campaign status code: " + code);
  }
}

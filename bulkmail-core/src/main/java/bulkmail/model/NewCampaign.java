package bulkmail.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Input for {@link bulkmail.state.CampaignStateMachine#create(NewCampaign, Instant)}.
 *
 * @param initialStatus either {@link CampaignStatus#DRAFT} or {@link CampaignStatus#SCHEDULED}
 */
public record NewCampaign(
    String name,
    String subject,
    String body,
    Instant scheduledTime,
    CampaignStatus initialStatus
) {
  public NewCampaign {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(scheduledTime, "scheduledTime");
    Objects.requireNonNull(initialStatus, "initialStatus");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
  }

  public static NewCampaign draft(String name, String subject, String body, Instant scheduledTime) {
    return new NewCampaign(name, subject, body, scheduledTime, CampaignStatus.DRAFT);
  }

  public static NewCampaign scheduled(String name, String subject, String body, Instant scheduledTime) {
    return new NewCampaign(name, subject, body, scheduledTime, CampaignStatus.SCHEDULED);
  }
}

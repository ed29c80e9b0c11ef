package bulkmail;

import java.util.Objects;

/**
 * A single message handed to the {@link MailTransport}.
 *
 * @param body plain text or HTML content, passed through unchanged
 */
public record OutgoingMail(String to, String subject, String body) {
  public OutgoingMail {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(body, "body");
  }
}

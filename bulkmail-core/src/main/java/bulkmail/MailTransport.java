package bulkmail;

/**
 * Sends one e-mail. Each call is one delivery attempt.
 *
 * <p>Implementations may block on network I/O; the worker pool bounds every call
 * with a timeout and interrupts the calling thread when it expires. Returning
 * {@link DeliveryResult.Failed} and throwing are equivalent: both are recorded as a
 * FAILED delivery and never retried.
 *
 * <pre>{@code
 * MailTransport transport = mail -> {
 *   smtpClient.send(mail.to(), mail.subject(), mail.body());
 *   return DeliveryResult.sent();
 * };
 * }</pre>
 */
@FunctionalInterface
public interface MailTransport {

  /**
   * Attempts delivery of a single message.
   *
   * @param mail the message
   * @return the outcome of the attempt
   * @throws Exception if the attempt fails; the exception message becomes the failure reason
   */
  DeliveryResult send(OutgoingMail mail) throws Exception;
}

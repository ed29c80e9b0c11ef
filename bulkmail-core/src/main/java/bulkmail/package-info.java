/**
 * Campaign execution pipeline.
 *
 * <p>{@link bulkmail.Bulkmail} is the composite entry point. Applications supply a
 * {@link bulkmail.MailTransport} and optionally a {@link bulkmail.ReportGenerator}; the
 * stores come from the {@code bulkmail-jdbc} module.
 */
package bulkmail;

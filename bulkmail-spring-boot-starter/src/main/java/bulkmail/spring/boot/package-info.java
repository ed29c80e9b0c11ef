/**
 * Spring Boot auto-configuration for the bulk mail pipeline.
 *
 * <p>Applications supply a {@code DataSource} and a {@link bulkmail.MailTransport} bean;
 * everything else is wired from {@code bulkmail.*} properties.
 */
package bulkmail.spring.boot;

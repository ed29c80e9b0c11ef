package bulkmail.spring.boot;

import bulkmail.Bulkmail;
import bulkmail.MailTransport;
import bulkmail.ReportGenerator;
import bulkmail.jdbc.DataSourceConnectionProvider;
import bulkmail.jdbc.store.AbstractJdbcCampaignStore;
import bulkmail.jdbc.store.JdbcCampaignStores;
import bulkmail.jdbc.store.JdbcDeliveryLogStore;
import bulkmail.jdbc.store.JdbcRecipientStore;
import bulkmail.report.LoggingReportGenerator;
import bulkmail.report.MailReportGenerator;
import bulkmail.spi.CampaignStore;
import bulkmail.spi.ConnectionProvider;
import bulkmail.spi.DeliveryLogStore;
import bulkmail.spi.MetricsExporter;
import bulkmail.spi.RecipientStore;
import bulkmail.state.CampaignStateMachine;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the bulk mail pipeline.
 *
 * <p>Wires a {@link Bulkmail} composite from a {@link DataSource}, an application-provided
 * {@link MailTransport} and {@link BulkmailProperties}. The campaign store is picked by
 * JDBC URL; the scheduler starts with the context unless {@code bulkmail.scheduler.enabled}
 * is {@code false}.
 *
 * @see BulkmailProperties
 * @see BulkmailMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, SqlInitializationAutoConfiguration.class})
@ConditionalOnClass(Bulkmail.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(BulkmailProperties.class)
public class BulkmailAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(CampaignStore.class)
  public AbstractJdbcCampaignStore campaignStore(DataSource dataSource) {
    return JdbcCampaignStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(RecipientStore.class)
  public JdbcRecipientStore recipientStore() {
    return new JdbcRecipientStore();
  }

  @Bean
  @ConditionalOnMissingBean(DeliveryLogStore.class)
  public JdbcDeliveryLogStore deliveryLogStore() {
    return new JdbcDeliveryLogStore();
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ReportGenerator.class)
  @ConditionalOnBean(MailTransport.class)
  public ReportGenerator reportGenerator(BulkmailProperties props, MailTransport transport) {
    String adminEmail = props.getReport().getAdminEmail();
    if (adminEmail == null || adminEmail.isBlank()) {
      return new LoggingReportGenerator();
    }
    return new MailReportGenerator(transport, adminEmail, props.getWorkers().getSendTimeoutMs());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(MailTransport.class)
  @DependsOnDatabaseInitialization
  public Bulkmail bulkmail(BulkmailProperties props,
      ConnectionProvider connectionProvider,
      CampaignStore campaignStore,
      RecipientStore recipientStore,
      DeliveryLogStore deliveryLogStore,
      MailTransport transport,
      ReportGenerator reportGenerator,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var builder = Bulkmail.builder()
        .connectionProvider(connectionProvider)
        .campaignStore(campaignStore)
        .recipientStore(recipientStore)
        .deliveryLogStore(deliveryLogStore)
        .transport(transport)
        .reportGenerator(reportGenerator)
        .intervalMs(props.getScheduler().getIntervalMs())
        .maxClaimsPerTick(props.getScheduler().getMaxClaimsPerTick())
        .resumeOnStart(props.getScheduler().isResumeOnStart())
        .workerCount(props.getWorkers().getWorkerCount())
        .queueCapacity(props.getWorkers().getQueueCapacity())
        .sendTimeoutMs(props.getWorkers().getSendTimeoutMs())
        .drainTimeoutMs(props.getWorkers().getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    Bulkmail bulkmail = builder.build();
    if (props.getScheduler().isEnabled()) {
      bulkmail.start();
    }
    return bulkmail;
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(Bulkmail.class)
  public CampaignStateMachine campaignStateMachine(Bulkmail bulkmail) {
    return bulkmail.stateMachine();
  }
}

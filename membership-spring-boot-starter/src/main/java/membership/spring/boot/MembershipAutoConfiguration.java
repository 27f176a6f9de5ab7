package membership.spring.boot;

import membership.MembershipManager;
import membership.MembershipScheduler;
import membership.jdbc.JdbcAmbiguousTransactionStore;
import membership.jdbc.JdbcAuditSink;
import membership.jdbc.JdbcExpiryQueueStore;
import membership.jdbc.JdbcMembershipStore;
import membership.jdbc.TableNames;
import membership.queue.ExponentialBackoffRetryPolicy;
import membership.queue.RetryPolicy;
import membership.spi.AmbiguousTransactionStore;
import membership.spi.AuditSink;
import membership.spi.ConnectionProvider;
import membership.spi.ExpiryQueueStore;
import membership.spi.GroupMembership;
import membership.spi.MembershipStore;
import membership.spi.MetricsExporter;
import membership.spi.NotificationSender;
import membership.util.JsonCodec;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for the membership engine.
 *
 * <p>Wires the JDBC stores from a {@link DataSource} and, once the application
 * provides a {@link NotificationSender} and a {@link GroupMembership}, a
 * {@link MembershipManager}. The background {@link MembershipScheduler} is created
 * only when {@code membership.scheduler.enabled=true}.
 *
 * @see MembershipProperties
 * @see MembershipMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(MembershipManager.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(MembershipProperties.class)
public class MembershipAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public TableNames membershipTableNames(MembershipProperties props) {
    return TableNames.withPrefix(props.getTablePrefix());
  }

  @Bean
  @ConditionalOnMissingBean
  public ConnectionProvider connectionProvider(DataSource dataSource) {
    return dataSource::getConnection;
  }

  @Bean
  @ConditionalOnMissingBean(MembershipStore.class)
  public JdbcMembershipStore membershipStore(ConnectionProvider connectionProvider, TableNames tables) {
    return new JdbcMembershipStore(connectionProvider, tables);
  }

  @Bean
  @ConditionalOnMissingBean(ExpiryQueueStore.class)
  public JdbcExpiryQueueStore expiryQueueStore(ConnectionProvider connectionProvider, TableNames tables) {
    return new JdbcExpiryQueueStore(connectionProvider, tables);
  }

  @Bean
  @ConditionalOnMissingBean(AuditSink.class)
  public JdbcAuditSink auditSink(ConnectionProvider connectionProvider, TableNames tables) {
    return new JdbcAuditSink(connectionProvider, tables);
  }

  @Bean
  @ConditionalOnMissingBean(AmbiguousTransactionStore.class)
  public JdbcAmbiguousTransactionStore ambiguousTransactionStore(ConnectionProvider connectionProvider,
      TableNames tables) {
    return new JdbcAmbiguousTransactionStore(connectionProvider, tables, JsonCodec.getDefault());
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy membershipRetryPolicy(MembershipProperties props) {
    MembershipProperties.Retry retry = props.getRetry();
    return new ExponentialBackoffRetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getJitter());
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean({NotificationSender.class, GroupMembership.class})
  public MembershipManager membershipManager(MembershipProperties props,
      MembershipStore membershipStore,
      ExpiryQueueStore expiryQueueStore,
      AuditSink auditSink,
      AmbiguousTransactionStore ambiguousTransactionStore,
      RetryPolicy retryPolicy,
      NotificationSender notificationSender,
      GroupMembership groupMembership,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Clock> clockProvider) {

    MembershipManager.Builder builder = MembershipManager.builder()
        .membershipStore(membershipStore)
        .queueStore(expiryQueueStore)
        .notificationSender(notificationSender)
        .groupMembership(groupMembership)
        .groups(props.getGroups())
        .auditSink(auditSink)
        .ambiguousStore(ambiguousTransactionStore)
        .retryPolicy(retryPolicy)
        .batchSize(props.getQueue().getBatchSize())
        .maxAttempts(props.getQueue().getMaxAttempts())
        .triggerInterval(props.getQueue().getTriggerInterval());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    Clock clock = clockProvider.getIfAvailable();
    if (clock != null) {
      builder.clock(clock);
    }
    return builder.build();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(MembershipManager.class)
  @ConditionalOnProperty(prefix = "membership.scheduler", name = "enabled", havingValue = "true")
  public MembershipScheduler membershipScheduler(MembershipManager manager, MembershipProperties props) {
    return MembershipScheduler.builder()
        .manager(manager)
        .intervalSeconds(props.getScheduler().getIntervalSeconds())
        .initialDelaySeconds(props.getScheduler().getInitialDelaySeconds())
        .build();
  }
}

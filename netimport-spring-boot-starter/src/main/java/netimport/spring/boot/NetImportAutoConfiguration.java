package netimport.spring.boot;

import netimport.NetImport;
import netimport.dispatch.JobDispatcher;
import netimport.jdbc.DataSourceConnectionProvider;
import netimport.jdbc.TableNames;
import netimport.jdbc.purge.JdbcJobPurgers;
import netimport.jdbc.store.AbstractJdbcJobStore;
import netimport.jdbc.store.H2JobStore;
import netimport.jdbc.store.JdbcJobStores;
import netimport.jdbc.store.MySqlJobStore;
import netimport.jdbc.store.PostgresJobStore;
import netimport.jdbc.transport.JdbcWorkerTransports;
import netimport.query.JobQueries;
import netimport.settings.BatfishSetting;
import netimport.settings.InventorySetting;
import netimport.settings.NetworkCredentials;
import netimport.settings.RegistrySettingsResolver;
import netimport.spi.ConnectionProvider;
import netimport.spi.ImportExecutor;
import netimport.spi.MetricsExporter;
import netimport.spi.SettingsResolver;
import netimport.spi.WorkerTransport;

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

/**
 * Auto-configuration for network import jobs.
 *
 * <p>Wires a {@link NetImport} composite from a {@link DataSource}, an application-supplied
 * {@link ImportExecutor} and {@link NetImportProperties}. The database dialect is detected
 * from the JDBC URL; the same database carries the job records, the worker queue and the
 * worker registry. Supports API nodes (optionally with an embedded worker) and worker-only
 * nodes.
 *
 * @see NetImportProperties
 * @see NetImportMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(NetImport.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(NetImportProperties.class)
public class NetImportAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcJobStore jobStore(DataSource dataSource, NetImportProperties props) {
    AbstractJdbcJobStore detected = JdbcJobStores.detect(dataSource);
    if (!TableNames.DEFAULT_PREFIX.equals(props.getTablePrefix())) {
      TableNames tables = TableNames.withPrefix(props.getTablePrefix());
      return switch (detected.name()) {
        case "h2" -> new H2JobStore(tables);
        case "mysql" -> new MySqlJobStore(tables);
        case "postgresql" -> new PostgresJobStore(tables);
        default -> detected;
      };
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(WorkerTransport.class)
  public WorkerTransport workerTransport(ConnectionProvider connectionProvider,
      AbstractJdbcJobStore jobStore, NetImportProperties props) {
    return JdbcWorkerTransports.create(jobStore.name(), connectionProvider,
        TableNames.withPrefix(props.getTablePrefix()), props.getProbe().getLivenessWindow());
  }

  @Bean
  @ConditionalOnMissingBean(SettingsResolver.class)
  public RegistrySettingsResolver settingsResolver(NetImportProperties props) {
    RegistrySettingsResolver.Builder builder = RegistrySettingsResolver.builder();
    NetImportProperties.Settings settings = props.getSettings();
    settings.getInventories().forEach((name, inv) ->
        builder.inventory(new InventorySetting(name, inv.getAddress(), inv.getToken(), inv.isVerifySsl())));
    settings.getCredentials().forEach((name, creds) ->
        builder.credentials(new NetworkCredentials(name, creds.getLogin(), creds.getPassword())));
    settings.getBatfish().forEach((name, bf) ->
        builder.batfish(new BatfishSetting(name, bf.getAddress(), bf.getPortV1(), bf.getPortV2(), bf.getUseSsl())));
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(ImportExecutor.class)
  public NetImport netImport(NetImportProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcJobStore jobStore,
      WorkerTransport workerTransport,
      SettingsResolver settingsResolver,
      ImportExecutor importExecutor,
      ObjectProvider<MetricsExporter> metricsProvider) {

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    NetImportProperties.Worker worker = props.getWorker();

    return switch (props.getRole()) {
      case API -> {
        var builder = NetImport.apiNode()
            .connectionProvider(connectionProvider)
            .jobStore(jobStore)
            .transport(workerTransport)
            .settingsResolver(settingsResolver)
            .importExecutor(importExecutor)
            .runnerHeartbeatIntervalMs(props.getRunner().getHeartbeatIntervalMs())
            .probeTimeout(props.getProbe().getTimeout())
            .forceImmediate(props.getExecution().isForceImmediate());
        if (worker.isEnabled()) {
          builder.embeddedWorker(worker.getConcurrency(), worker.getPollIntervalMs(),
              worker.getHeartbeatIntervalMs(), worker.getLockTimeout());
        }
        configureBackground(builder, props, jobStore);
        if (metrics != null) {
          builder.metrics(metrics);
        }
        yield builder.build();
      }
      case WORKER -> {
        var builder = NetImport.workerNode()
            .connectionProvider(connectionProvider)
            .jobStore(jobStore)
            .transport(workerTransport)
            .settingsResolver(settingsResolver)
            .importExecutor(importExecutor)
            .runnerHeartbeatIntervalMs(props.getRunner().getHeartbeatIntervalMs())
            .concurrency(worker.getConcurrency())
            .pollIntervalMs(worker.getPollIntervalMs())
            .heartbeatIntervalMs(worker.getHeartbeatIntervalMs())
            .lockTimeout(worker.getLockTimeout());
        if (worker.getId() != null && !worker.getId().isEmpty()) {
          builder.workerId(worker.getId());
        }
        configureBackground(builder, props, jobStore);
        if (metrics != null) {
          builder.metrics(metrics);
        }
        yield builder.build();
      }
    };
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(NetImport.class)
  public JobQueries jobQueries(NetImport netImport) {
    return netImport.queries();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(NetImport.class)
  @ConditionalOnProperty(prefix = "netimport", name = "role", havingValue = "api", matchIfMissing = true)
  public JobDispatcher jobDispatcher(NetImport netImport) {
    return netImport.dispatcher();
  }

  private static void configureBackground(NetImport.AbstractBuilder<?> builder,
      NetImportProperties props, AbstractJdbcJobStore jobStore) {
    NetImportProperties.Lease lease = props.getLease();
    if (lease.isEnabled()) {
      builder.orphanReaper(lease.getTimeout(), lease.getIntervalSeconds());
    }
    NetImportProperties.Purge purge = props.getPurge();
    if (purge.isEnabled()) {
      builder.purge(JdbcJobPurgers.create(jobStore.name(), TableNames.withPrefix(props.getTablePrefix())),
          purge.getRetention(), purge.getBatchSize(), purge.getIntervalSeconds());
    }
  }
}

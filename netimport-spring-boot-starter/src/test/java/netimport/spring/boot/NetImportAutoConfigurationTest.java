package netimport.spring.boot;

import netimport.NetImport;
import netimport.dispatch.ExecutionMode;
import netimport.dispatch.JobDispatcher;
import netimport.dispatch.JobHandle;
import netimport.dispatch.JobRequest;
import netimport.jdbc.DataSourceConnectionProvider;
import netimport.jdbc.store.AbstractJdbcJobStore;
import netimport.jdbc.store.H2JobStore;
import netimport.jdbc.transport.H2WorkerTransport;
import netimport.model.Job;
import netimport.model.JobSettings;
import netimport.model.JobStatus;
import netimport.model.LogEntry;
import netimport.query.JobQueries;
import netimport.settings.RegistrySettingsResolver;
import netimport.spi.ConnectionProvider;
import netimport.spi.ImportExecutor;
import netimport.spi.ImportResult;
import netimport.spi.SettingsResolver;
import netimport.spi.WorkerTransport;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NetImportAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          NetImportAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:netimport_auto_test;MODE=MySQL;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema.sql",
          "netimport.settings.inventories.lab.address=https://nautobot.lab",
          "netimport.settings.inventories.lab.token=secret",
          "netimport.settings.credentials.ops.login=admin",
          "netimport.settings.credentials.ops.password=admin");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(ExecutorConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("jobStore"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("workerTransport"));
      assertTrue(ctx.containsBean("settingsResolver"));
      assertTrue(ctx.containsBean("netImport"));
      assertTrue(ctx.containsBean("jobQueries"));
      assertTrue(ctx.containsBean("jobDispatcher"));

      assertInstanceOf(H2JobStore.class, ctx.getBean(AbstractJdbcJobStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(H2WorkerTransport.class, ctx.getBean(WorkerTransport.class));
      assertInstanceOf(RegistrySettingsResolver.class, ctx.getBean(SettingsResolver.class));
      assertInstanceOf(NetImport.class, ctx.getBean(NetImport.class));
    });
  }

  @Test
  void settingsFromPropertiesAreResolvable() {
    runner.withUserConfiguration(ExecutorConfig.class).run(ctx -> {
      var resolver = ctx.getBean(RegistrySettingsResolver.class);
      var resolved = resolver.resolve("hq", JobSettings.of("lab", "ops"));
      assertEquals("https://nautobot.lab", resolved.inventory().address());
      assertEquals("admin", resolved.credentials().login());
    });
  }

  @Test
  void submitsInlineWhenNoWorkerIsAlive() {
    runner.withUserConfiguration(ExecutorConfig.class).run(ctx -> {
      JobDispatcher dispatcher = ctx.getBean(JobDispatcher.class);
      JobHandle handle = dispatcher.submit(new JobRequest("hq", "check", JobSettings.of("lab", "ops")), "alice");

      assertEquals(ExecutionMode.IMMEDIATE, handle.executionMode());
      Job job = ctx.getBean(JobQueries.class).getJob(handle.job().id());
      assertEquals(JobStatus.COMPLETED, job.status());
      assertEquals(Boolean.TRUE, job.success());
      assertEquals("alice", job.principal());

      List<LogEntry> logs = ctx.getBean(JobQueries.class).getLogs(job.id());
      assertFalse(logs.isEmpty());
      assertEquals(1L, logs.get(0).sequence());
    });
  }

  @Test
  void embeddedWorkerMakesSubmissionsQueued() {
    runner
        .withPropertyValues("netimport.worker.enabled=true",
            "spring.datasource.url=jdbc:h2:mem:netimport_embedded_test;MODE=MySQL;DB_CLOSE_DELAY=-1",
            "netimport.worker.heartbeat-interval-ms=200",
            "netimport.worker.poll-interval-ms=50")
        .withUserConfiguration(ExecutorConfig.class).run(ctx -> {
          NetImport netImport = ctx.getBean(NetImport.class);
          assertNotNull(netImport.worker());

          JobHandle handle = ctx.getBean(JobDispatcher.class)
              .submit(new JobRequest("hq", "apply", JobSettings.of("lab", "ops")), "bob");
          assertEquals(ExecutionMode.QUEUED, handle.executionMode());
          assertNotNull(handle.job().taskRef());

          JobQueries queries = ctx.getBean(JobQueries.class);
          long deadline = System.currentTimeMillis() + 10_000;
          while (!queries.getJob(handle.job().id()).isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
          }
          assertEquals(JobStatus.COMPLETED, queries.getJob(handle.job().id()).status());
        });
  }

  @Test
  void forceImmediateSkipsTheProbe() {
    runner
        .withPropertyValues("netimport.execution.force-immediate=true", "netimport.worker.enabled=true",
            "spring.datasource.url=jdbc:h2:mem:netimport_forced_test;MODE=MySQL;DB_CLOSE_DELAY=-1")
        .withUserConfiguration(ExecutorConfig.class).run(ctx -> {
          JobHandle handle = ctx.getBean(JobDispatcher.class)
              .submit(new JobRequest("hq", "check", JobSettings.of("lab", "ops")), "carol");
          assertEquals(ExecutionMode.IMMEDIATE, handle.executionMode());
        });
  }

  @Test
  void customTablePrefix() {
    runner
        .withPropertyValues("netimport.table-prefix=lab_",
            "spring.datasource.url=jdbc:h2:mem:netimport_custom_test;MODE=MySQL;DB_CLOSE_DELAY=-1",
            "spring.sql.init.schema-locations=classpath:schema-custom.sql")
        .withUserConfiguration(ExecutorConfig.class).run(ctx -> {
          var store = ctx.getBean(AbstractJdbcJobStore.class);
          assertInstanceOf(H2JobStore.class, store);

          JobHandle handle = ctx.getBean(JobDispatcher.class)
              .submit(new JobRequest("hq", "check", JobSettings.of("lab", "ops")), "dave");
          assertEquals(JobStatus.COMPLETED, ctx.getBean(JobQueries.class).getJob(handle.job().id()).status());
        });
  }

  @Test
  void workerRoleHasNoDispatcher() {
    runner
        .withPropertyValues("netimport.role=WORKER", "netimport.worker.id=worker-a",
            "spring.datasource.url=jdbc:h2:mem:netimport_worker_test;MODE=MySQL;DB_CLOSE_DELAY=-1")
        .withUserConfiguration(ExecutorConfig.class).run(ctx -> {
          NetImport netImport = ctx.getBean(NetImport.class);
          assertEquals("worker-a", netImport.worker().workerId());
          assertFalse(ctx.containsBean("jobDispatcher"));
          assertTrue(ctx.containsBean("jobQueries"));
        });
  }

  @Test
  void purgeAndLeaseCanBeConfigured() {
    runner
        .withPropertyValues("netimport.purge.enabled=true", "netimport.purge.retention=P1D",
            "netimport.lease.timeout=PT1M", "netimport.lease.interval-seconds=30")
        .withUserConfiguration(ExecutorConfig.class).run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertInstanceOf(NetImport.class, ctx.getBean(NetImport.class));
        });
  }

  @Test
  void invalidBatfishPortsFailStartup() {
    runner
        .withPropertyValues("netimport.settings.batfish.bf.address=batfish.lab",
            "netimport.settings.batfish.bf.port-v1=9996",
            "netimport.settings.batfish.bf.port-v2=9996")
        .withUserConfiguration(ExecutorConfig.class).run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void noCompositeWithoutImportExecutor() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("jobStore"));
      assertFalse(ctx.containsBean("netImport"));
      assertFalse(ctx.containsBean("jobDispatcher"));
    });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(NetImportAutoConfiguration.class))
        .withUserConfiguration(ExecutorConfig.class)
        .run(ctx -> {
          assertFalse(ctx.containsBean("netImport"));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomStoreConfig.class, ExecutorConfig.class).run(ctx -> {
      var store = ctx.getBean(AbstractJdbcJobStore.class);
      assertInstanceOf(H2JobStore.class, store);
      assertEquals("myJobStore", ctx.getBeanNamesForType(AbstractJdbcJobStore.class)[0]);
    });
  }

  // ── Test configurations ──────────────────────────────────────

  @Configuration
  static class ExecutorConfig {
    @Bean
    ImportExecutor importExecutor() {
      return (request, log) -> {
        log.info("Importing " + request.siteCode());
        log.info("Done");
        return ImportResult.succeeded();
      };
    }
  }

  @Configuration
  static class CustomStoreConfig {
    @Bean
    AbstractJdbcJobStore myJobStore() {
      return new H2JobStore();
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}

package io.cronkeeper.core.runtime;

import io.cronkeeper.core.account.BackupAccount;
import io.cronkeeper.core.account.ConfiguredAccountResolver;
import io.cronkeeper.core.alert.DefaultAlertBridge;
import io.cronkeeper.core.alert.FileAlertStore;
import io.cronkeeper.core.alert.WebhookAlertSender;
import io.cronkeeper.core.config.ConfigPaths;
import io.cronkeeper.core.config.model.AccountConfig;
import io.cronkeeper.core.config.model.CronkeeperConfig;
import io.cronkeeper.core.config.model.SourceConfig;
import io.cronkeeper.core.job.JobRegistry;
import io.cronkeeper.core.job.JobType;
import io.cronkeeper.core.job.SqliteJobStore;
import io.cronkeeper.core.record.SqliteRecordStore;
import io.cronkeeper.core.retention.RetentionManager;
import io.cronkeeper.core.runner.JobActionRegistry;
import io.cronkeeper.core.runner.JobRunner;
import io.cronkeeper.core.runner.impl.CurlJobAction;
import io.cronkeeper.core.runner.impl.DirectoryBackupAction;
import io.cronkeeper.core.runner.impl.ShellJobAction;
import io.cronkeeper.core.schedule.SchedulerEngine;
import io.cronkeeper.core.store.SqliteDatabase;
import io.cronkeeper.core.transfer.ImportExportCodec;
import io.cronkeeper.core.transfer.InMemorySourceResolver;
import io.cronkeeper.core.transfer.SourceRef;
import io.cronkeeper.core.transfer.SourceResolvers;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores, scheduler and registry wired from one configuration.
 */
public final class CronkeeperRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CronkeeperRuntime.class);

    private final CronkeeperConfig config;
    private final Path dataDir;
    private final ExecutorService workers;
    private final SchedulerEngine engine;
    private final JobRegistry registry;
    private final ConfiguredAccountResolver accounts;

    private CronkeeperRuntime(
        CronkeeperConfig config,
        Path dataDir,
        ExecutorService workers,
        SchedulerEngine engine,
        JobRegistry registry,
        ConfiguredAccountResolver accounts
    ) {
        this.config = config;
        this.dataDir = dataDir;
        this.workers = workers;
        this.engine = engine;
        this.registry = registry;
        this.accounts = accounts;
    }

    public static CronkeeperRuntime open(CronkeeperConfig config) throws IOException {
        return open(config, Clock.systemUTC());
    }

    public static CronkeeperRuntime open(CronkeeperConfig config, Clock clock) throws IOException {
        Path dataDir = ConfigPaths.dataDir(config);
        Files.createDirectories(dataDir);
        ZoneId zone = config.scheduler().zoneId();

        SqliteDatabase database = new SqliteDatabase(ConfigPaths.databasePath(config));
        SqliteJobStore jobStore = new SqliteJobStore(database);
        SqliteRecordStore recordStore = new SqliteRecordStore(database);

        List<BackupAccount> configured = new ArrayList<>();
        for (AccountConfig account : config.accounts()) {
            configured.add(account.toAccount());
        }
        ConfiguredAccountResolver accounts = new ConfiguredAccountResolver(configured);

        DefaultAlertBridge alerts = new DefaultAlertBridge(new FileAlertStore(ConfigPaths.alertsPath(config)), clock);
        if (config.alerts().webhookConfigured()) {
            alerts.register(new WebhookAlertSender(
                config.alerts().webhookUrl(),
                Duration.ofSeconds(Math.max(1, config.alerts().timeoutSeconds()))
            ));
        }

        ExecutorService workers = Executors.newFixedThreadPool(config.scheduler().workerThreads(), namedThreads());
        SchedulerEngine engine = new SchedulerEngine(
            clock,
            zone,
            workers,
            Duration.ofMillis(config.scheduler().tickMillis())
        );

        JobActionRegistry actions = new JobActionRegistry();
        actions.register(new ShellJobAction());
        actions.register(new CurlJobAction());
        actions.register(new DirectoryBackupAction(zone));

        RetentionManager retention = new RetentionManager(recordStore, accounts);
        JobRunner runner = new JobRunner(recordStore, retention, alerts, actions, accounts, dataDir, clock, zone);
        ImportExportCodec codec = new ImportExportCodec(jobStore, sourceResolvers(config), accounts, alerts, clock);
        JobRegistry registry = new JobRegistry(
            jobStore,
            recordStore,
            engine,
            runner,
            retention,
            alerts,
            accounts,
            codec,
            dataDir,
            clock
        );
        return new CronkeeperRuntime(config, dataDir, workers, engine, registry, accounts);
    }

    public int start() throws IOException {
        int restored = registry.restore();
        engine.start();
        return restored;
    }

    public CronkeeperConfig config() {
        return config;
    }

    public Path dataDir() {
        return dataDir;
    }

    public SchedulerEngine engine() {
        return engine;
    }

    public JobRegistry registry() {
        return registry;
    }

    public ConfiguredAccountResolver accounts() {
        return accounts;
    }

    @Override
    public void close() {
        engine.close();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not drain within 30s, interrupting running jobs");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private static SourceResolvers sourceResolvers(CronkeeperConfig config) {
        Map<JobType, InMemorySourceResolver> byType = new EnumMap<>(JobType.class);
        for (SourceConfig source : config.sources()) {
            JobType type = JobType.fromWire(source.type());
            byType.computeIfAbsent(type, key -> new InMemorySourceResolver())
                .put(source.id(), new SourceRef(source.name(), source.detailName()));
        }
        SourceResolvers resolvers = new SourceResolvers();
        resolvers.register(byType.getOrDefault(JobType.APP, new InMemorySourceResolver()), JobType.APP);
        resolvers.registerWebsites(byType.getOrDefault(JobType.WEBSITE, new InMemorySourceResolver()));
        resolvers.register(byType.getOrDefault(JobType.DATABASE, new InMemorySourceResolver()), JobType.DATABASE);
        return resolvers;
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "cronkeeper-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

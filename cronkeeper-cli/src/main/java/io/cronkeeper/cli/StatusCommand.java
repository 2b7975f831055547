package io.cronkeeper.cli;

import io.cronkeeper.core.config.ConfigPaths;
import io.cronkeeper.core.config.model.CronkeeperConfig;
import io.cronkeeper.core.job.JobQuery;
import io.cronkeeper.core.runtime.CronkeeperRuntime;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and job status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronkeeperConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Data directory: " + ConfigPaths.dataDir(config));
            System.out.println("Database: " + ConfigPaths.databasePath(config));
            System.out.println("Time zone: " + config.scheduler().zoneId());
            System.out.println("Worker threads: " + config.scheduler().workerThreads());
            System.out.println("Backup accounts: " + config.accounts().size());
            System.out.println("Webhook alerts configured: " + config.alerts().webhookConfigured());
            try (CronkeeperRuntime runtime = context.runtimeFactory().open(config)) {
                System.out.println("Jobs: " + runtime.registry().page(JobQuery.all()).total());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}

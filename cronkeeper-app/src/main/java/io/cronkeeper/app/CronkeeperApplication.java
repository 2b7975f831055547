package io.cronkeeper.app;

import io.cronkeeper.cli.CliContext;
import io.cronkeeper.cli.CronkeeperCliCommand;
import io.cronkeeper.core.config.ConfigPaths;
import io.cronkeeper.core.config.ConfigService;
import io.cronkeeper.core.config.model.CronkeeperConfig;
import io.cronkeeper.core.runtime.CronkeeperRuntime;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CronkeeperApplication {
    private static final Logger LOG = LoggerFactory.getLogger(CronkeeperApplication.class);

    private CronkeeperApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = resolveConfigPath();
        CliContext context = new CliContext(
            configService,
            configPath,
            CronkeeperRuntime::open,
            () -> runDaemon(configService, configPath)
        );

        int exitCode = CronkeeperCliCommand.build(context).execute(args);
        System.exit(exitCode);
    }

    private static Path resolveConfigPath() {
        String raw = System.getenv("CRONKEEPER_CONFIG");
        if (raw == null || raw.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        return ConfigPaths.resolve(raw.trim());
    }

    private static int runDaemon(ConfigService configService, Path configPath) throws Exception {
        CronkeeperConfig config = configService.load(configPath);
        CountDownLatch shutdown = new CountDownLatch(1);
        try (CronkeeperRuntime runtime = CronkeeperRuntime.open(config)) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            int restored = runtime.start();
            LOG.info("Cronkeeper daemon started: {} job(s) scheduled, data in {}", restored, runtime.dataDir());
            System.out.println("Cronkeeper daemon running with " + restored + " enabled job(s). Press Ctrl+C to stop.");
            shutdown.await();
            LOG.info("Cronkeeper daemon stopping");
        }
        return 0;
    }
}

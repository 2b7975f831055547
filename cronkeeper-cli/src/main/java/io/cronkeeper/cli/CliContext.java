package io.cronkeeper.cli;

import io.cronkeeper.core.config.ConfigService;
import io.cronkeeper.core.runtime.CronkeeperRuntime;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    RuntimeFactory runtimeFactory,
    DaemonRunner daemonRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, CronkeeperRuntime::open, () -> {
            throw new UnsupportedOperationException("daemon runner is not configured");
        });
    }

    public CronkeeperRuntime openRuntime() throws IOException {
        return runtimeFactory.open(configService.load(configPath));
    }
}

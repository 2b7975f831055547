package io.cronkeeper.cli;

import io.cronkeeper.core.config.model.CronkeeperConfig;
import io.cronkeeper.core.runtime.CronkeeperRuntime;
import java.io.IOException;

@FunctionalInterface
public interface RuntimeFactory {
    CronkeeperRuntime open(CronkeeperConfig config) throws IOException;
}

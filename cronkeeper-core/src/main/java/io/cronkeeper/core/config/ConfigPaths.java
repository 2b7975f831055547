package io.cronkeeper.core.config;

import io.cronkeeper.core.config.model.CronkeeperConfig;
import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".cronkeeper", "config.json");
    }

    public static Path resolve(String rawPath) {
        if (rawPath.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path dataDir(CronkeeperConfig config) {
        String raw = config.storage().dataDir();
        if (raw == null || raw.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".cronkeeper", "data");
        }
        return resolve(raw);
    }

    public static Path databasePath(CronkeeperConfig config) {
        String name = config.storage().database();
        return dataDir(config).resolve(name == null || name.isBlank() ? "cronkeeper.db" : name);
    }

    public static Path alertsPath(CronkeeperConfig config) {
        return dataDir(config).resolve("alerts.json");
    }
}

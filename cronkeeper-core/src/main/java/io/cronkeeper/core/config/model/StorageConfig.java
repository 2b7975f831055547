package io.cronkeeper.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(String dataDir, String database) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.cronkeeper/data", "cronkeeper.db");
    }
}

package io.cronkeeper.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cronkeeper.core.config.model.CronkeeperConfig;
import io.cronkeeper.core.error.ValidationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper = new ObjectMapper();

    public CronkeeperConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return CronkeeperConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(CronkeeperConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        CronkeeperConfig config = mapper.treeToValue(deepMerge(defaultsNode, existingNode), CronkeeperConfig.class);
        validate(config);
        return config;
    }

    public void save(Path configPath, CronkeeperConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        CronkeeperConfig config;
        if (created || overwrite) {
            config = CronkeeperConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);
        Path dataDir = ConfigPaths.dataDir(config);
        Files.createDirectories(dataDir);
        return new InitResult(configPath, dataDir, created, overwritten);
    }

    public String toPrettyJson(CronkeeperConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private void validate(CronkeeperConfig config) {
        if (config.scheduler().tickMillis() <= 0) {
            throw new ValidationException("scheduler.tickMillis must be > 0");
        }
        if (config.scheduler().workerThreads() <= 0) {
            throw new ValidationException("scheduler.workerThreads must be > 0");
        }
        try {
            config.scheduler().zoneId();
        } catch (DateTimeException e) {
            throw new ValidationException("scheduler.zone is invalid: " + config.scheduler().zone(), e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}

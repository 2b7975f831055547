package io.cronkeeper.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cronkeeper.core.account.BackupAccount;
import io.cronkeeper.core.config.model.CronkeeperConfig;
import io.cronkeeper.core.error.ValidationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {
    @TempDir
    Path tempDir;

    private final ConfigService configService = new ConfigService();

    @Test
    void missingFileShouldYieldDefaults() throws Exception {
        CronkeeperConfig config = configService.load(tempDir.resolve("absent.json"));

        assertThat(config.scheduler().tickMillis()).isEqualTo(1000);
        assertThat(config.scheduler().workerThreads()).isEqualTo(4);
        assertThat(config.accounts()).hasSize(1);
        assertThat(config.accounts().get(0).toAccount().type()).isEqualTo(BackupAccount.LOCAL);
    }

    @Test
    void loadShouldMergePartialFileOverDefaults() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "scheduler": { "zone": "Europe/Berlin" },
              "storage": { "dataDir": "%s" },
              "alerts": { "webhookUrl": "http://localhost:9/hook" },
              "unknownSection": true
            }
            """.formatted(tempDir.resolve("data").toString().replace("\\", "\\\\")));

        CronkeeperConfig config = configService.load(configPath);

        assertThat(config.scheduler().zoneId()).isEqualTo(ZoneId.of("Europe/Berlin"));
        assertThat(config.scheduler().tickMillis()).isEqualTo(1000);
        assertThat(config.storage().database()).isEqualTo("cronkeeper.db");
        assertThat(ConfigPaths.databasePath(config)).isEqualTo(tempDir.resolve("data").resolve("cronkeeper.db"));
        assertThat(config.alerts().webhookConfigured()).isTrue();
        assertThat(config.alerts().timeoutSeconds()).isEqualTo(10);
        assertThat(config.accounts()).hasSize(1);
    }

    @Test
    void invalidValuesShouldBeRejected() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{\"scheduler\": {\"workerThreads\": 0}}");
        assertThatThrownBy(() -> configService.load(configPath))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("workerThreads");

        Files.writeString(configPath, "{\"scheduler\": {\"zone\": \"Mars/Olympus\"}}");
        assertThatThrownBy(() -> configService.load(configPath))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("zone");
    }

    @Test
    void initShouldCreateOnceAndKeepExistingValues() throws Exception {
        Path configPath = tempDir.resolve("nested").resolve("config.json");

        InitResult first = configService.init(configPath, false);
        assertThat(first.createdConfig()).isTrue();
        assertThat(first.overwrittenConfig()).isFalse();
        assertThat(Files.exists(configPath)).isTrue();

        Files.writeString(configPath, "{\"scheduler\": {\"tickMillis\": 250}, \"storage\": {\"dataDir\": \""
            + tempDir.resolve("data").toString().replace("\\", "\\\\") + "\"}}");
        InitResult second = configService.init(configPath, false);
        assertThat(second.createdConfig()).isFalse();
        assertThat(configService.load(configPath).scheduler().tickMillis()).isEqualTo(250);
        assertThat(second.dataDir()).isEqualTo(tempDir.resolve("data"));
        assertThat(Files.isDirectory(second.dataDir())).isTrue();
    }

    @Test
    void tildeShouldExpandToUserHome() {
        assertThat(ConfigPaths.resolve("~/.cronkeeper/data"))
            .isEqualTo(Path.of(System.getProperty("user.home"), ".cronkeeper", "data"));
        assertThat(ConfigPaths.resolve("/var/lib/cronkeeper")).isEqualTo(Path.of("/var/lib/cronkeeper"));
    }
}

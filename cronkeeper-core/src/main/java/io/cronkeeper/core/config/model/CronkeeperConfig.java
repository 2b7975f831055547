package io.cronkeeper.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronkeeperConfig(
    SchedulerConfig scheduler,
    StorageConfig storage,
    List<AccountConfig> accounts,
    List<SourceConfig> sources,
    AlertsConfig alerts
) {

    public CronkeeperConfig {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static CronkeeperConfig defaults() {
        return new CronkeeperConfig(
            SchedulerConfig.defaults(),
            StorageConfig.defaults(),
            List.of(AccountConfig.localDefault()),
            List.of(),
            AlertsConfig.defaults()
        );
    }
}

package io.cronkeeper.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(String zone, long tickMillis, int workerThreads) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig("", 1000, 4);
    }

    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone.trim());
    }
}

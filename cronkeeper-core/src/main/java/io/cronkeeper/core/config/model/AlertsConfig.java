package io.cronkeeper.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AlertsConfig(String webhookUrl, int timeoutSeconds) {

    public static AlertsConfig defaults() {
        return new AlertsConfig("", 10);
    }

    public boolean webhookConfigured() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}

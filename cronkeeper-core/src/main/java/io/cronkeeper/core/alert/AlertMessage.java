package io.cronkeeper.core.alert;

import java.time.Instant;

public record AlertMessage(String title, String jobName, String jobType, String status, String message,
                           int consecutiveFailures, Instant at) {
}

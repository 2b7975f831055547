package io.cronkeeper.core.alert;

import io.cronkeeper.core.job.JobType;

public record AlertSubscription(JobType type, long jobId, String title, int sendCount, String method) {
    public AlertSubscription {
        title = title == null ? "" : title.trim();
        sendCount = Math.max(0, sendCount);
        method = method == null || method.isBlank() ? LoggingAlertSender.METHOD : method.trim();
    }

    public boolean matches(JobType otherType, long otherJobId) {
        return type == otherType && jobId == otherJobId;
    }
}

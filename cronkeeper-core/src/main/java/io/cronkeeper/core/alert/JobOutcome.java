package io.cronkeeper.core.alert;

import io.cronkeeper.core.job.JobType;
import io.cronkeeper.core.record.RecordStatus;
import java.time.Instant;

public record JobOutcome(JobType type, long jobId, String jobName, long recordId, RecordStatus status, String message,
                         Instant finishedAt) {
    public JobOutcome {
        jobName = jobName == null ? "" : jobName;
        message = message == null ? "" : message;
    }

    public boolean failed() {
        return status == RecordStatus.FAILED;
    }
}

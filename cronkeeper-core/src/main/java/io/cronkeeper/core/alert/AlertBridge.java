package io.cronkeeper.core.alert;

import io.cronkeeper.core.job.JobType;
import java.io.IOException;
import java.util.Optional;

public interface AlertBridge {
    Optional<AlertSubscription> find(JobType type, long jobId) throws IOException;

    void upsert(AlertSubscription subscription) throws IOException;

    void delete(JobType type, long jobId) throws IOException;

    void notify(JobOutcome outcome);
}

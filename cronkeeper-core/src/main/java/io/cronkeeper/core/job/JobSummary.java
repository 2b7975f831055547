package io.cronkeeper.core.job;

import java.time.Instant;
import java.util.List;

public record JobSummary(
    Job job,
    String lastRecordStatus,
    String lastRecordTime,
    int alertCount,
    List<String> sourceAccounts,
    String downloadAccount,
    Instant nextRun
) {
    public static final String NONE = "-";

    public JobSummary {
        lastRecordStatus = lastRecordStatus == null || lastRecordStatus.isBlank() ? NONE : lastRecordStatus;
        lastRecordTime = lastRecordTime == null || lastRecordTime.isBlank() ? NONE : lastRecordTime;
        sourceAccounts = sourceAccounts == null ? List.of() : List.copyOf(sourceAccounts);
        downloadAccount = downloadAccount == null ? "" : downloadAccount;
    }
}

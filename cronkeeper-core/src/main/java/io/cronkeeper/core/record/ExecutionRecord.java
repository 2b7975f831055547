package io.cronkeeper.core.record;

import java.time.Instant;
import java.util.List;

public record ExecutionRecord(
    long id,
    long jobId,
    Instant startTime,
    RecordStatus status,
    String message,
    List<String> artifacts,
    List<String> accounts,
    String logPath,
    boolean fromLocal,
    long durationMillis
) {
    public static final long DETACHED = 0L;

    public ExecutionRecord {
        startTime = startTime == null ? Instant.EPOCH : startTime;
        status = status == null ? RecordStatus.RUNNING : status;
        message = message == null ? "" : message;
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        logPath = logPath == null ? "" : logPath;
    }

    public static ExecutionRecord running(long jobId, Instant startTime, String logPath) {
        return new ExecutionRecord(0, jobId, startTime, RecordStatus.RUNNING, "", List.of(), List.of(), logPath, true, 0);
    }

    public ExecutionRecord withId(long newId) {
        return new ExecutionRecord(newId, jobId, startTime, status, message, artifacts, accounts, logPath, fromLocal,
            durationMillis);
    }

    public ExecutionRecord succeeded(List<String> newArtifacts, List<String> newAccounts, boolean local, long duration) {
        return new ExecutionRecord(id, jobId, startTime, RecordStatus.SUCCESS, "", newArtifacts, newAccounts, logPath,
            local, duration);
    }

    public ExecutionRecord failed(String error, long duration) {
        return new ExecutionRecord(id, jobId, startTime, RecordStatus.FAILED, error, artifacts, accounts, logPath,
            fromLocal, duration);
    }

    public ExecutionRecord withAccounts(List<String> remaining) {
        return new ExecutionRecord(id, jobId, startTime, status, message, artifacts, remaining, logPath, fromLocal,
            durationMillis);
    }

    public boolean detached() {
        return jobId == DETACHED;
    }
}

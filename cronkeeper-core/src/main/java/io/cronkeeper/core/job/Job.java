package io.cronkeeper.core.job;

import com.fasterxml.jackson.databind.JsonNode;
import io.cronkeeper.core.schedule.EntryHandle;
import java.time.Instant;
import java.util.List;

public record Job(
    long id,
    String name,
    JobType type,
    String spec,
    JobStatus status,
    JobPayload payload,
    SourceSelector sources,
    List<Long> sourceAccountIds,
    long downloadAccountId,
    int retainCopies,
    int retryTimes,
    long timeoutSeconds,
    boolean ignoreErr,
    String secret,
    JsonNode snapshotRule,
    List<EntryHandle> entryHandles,
    Instant createdAt
) {
    public Job {
        name = name == null ? "" : name.trim();
        spec = spec == null ? "" : spec.trim();
        status = status == null ? JobStatus.DISABLE : status;
        payload = payload == null ? JobPayload.empty() : payload;
        sources = sources == null ? SourceSelector.none() : sources;
        sourceAccountIds = sourceAccountIds == null ? List.of() : List.copyOf(sourceAccountIds);
        secret = secret == null ? "" : secret;
        snapshotRule = snapshotRule == null || snapshotRule.isNull() ? null : snapshotRule;
        entryHandles = entryHandles == null ? List.of() : List.copyOf(entryHandles);
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    public static Job from(JobRequest request, JobStatus status, Instant createdAt) {
        return new Job(
            0,
            request.name(),
            request.type(),
            request.spec(),
            status,
            request.payload(),
            request.sources(),
            request.sourceAccountIds(),
            request.downloadAccountId(),
            request.retainCopies(),
            request.retryTimes(),
            request.timeoutSeconds(),
            request.ignoreErr(),
            request.secret(),
            request.snapshotRule(),
            List.of(),
            createdAt
        );
    }

    public Job withId(long newId) {
        return new Job(newId, name, type, spec, status, payload, sources, sourceAccountIds, downloadAccountId,
            retainCopies, retryTimes, timeoutSeconds, ignoreErr, secret, snapshotRule, entryHandles, createdAt);
    }

    public Job withSchedule(JobStatus newStatus, List<EntryHandle> handles) {
        return new Job(id, name, type, spec, newStatus, payload, sources, sourceAccountIds, downloadAccountId,
            retainCopies, retryTimes, timeoutSeconds, ignoreErr, secret, snapshotRule, handles, createdAt);
    }

    public Job withAccounts(List<Long> accountIds, long downloadAccount) {
        return new Job(id, name, type, spec, status, payload, sources, accountIds, downloadAccount,
            retainCopies, retryTimes, timeoutSeconds, ignoreErr, secret, snapshotRule, entryHandles, createdAt);
    }

    /**
     * Applies the mutable fields of an update. Type, status, handles and creation time are kept.
     */
    public Job merge(JobRequest request) {
        return new Job(
            id,
            request.name(),
            type,
            request.spec(),
            status,
            request.payload(),
            request.sources(),
            request.sourceAccountIds(),
            request.downloadAccountId(),
            request.retainCopies(),
            request.retryTimes(),
            request.timeoutSeconds(),
            request.ignoreErr(),
            request.secret(),
            request.snapshotRule(),
            entryHandles,
            createdAt
        );
    }
}

package io.cronkeeper.core.transfer;

import com.fasterxml.jackson.databind.JsonNode;
import io.cronkeeper.core.job.JobPayload;
import io.cronkeeper.core.job.JobType;
import java.util.List;

public record TransferableJob(
    String name,
    JobType type,
    String spec,
    JobPayload payload,
    List<SourceRef> sources,
    boolean allSources,
    List<String> sourceAccounts,
    String downloadAccount,
    int retainCopies,
    int retryTimes,
    long timeoutSeconds,
    boolean ignoreErr,
    String secret,
    JsonNode snapshotRule,
    String alertTitle,
    int alertCount,
    String alertMethod
) {
    public TransferableJob {
        name = name == null ? "" : name.trim();
        spec = spec == null ? "" : spec.trim();
        payload = payload == null ? JobPayload.empty() : payload;
        sources = sources == null ? List.of() : List.copyOf(sources);
        sourceAccounts = sourceAccounts == null ? List.of() : List.copyOf(sourceAccounts);
        downloadAccount = downloadAccount == null ? "" : downloadAccount.trim();
        secret = secret == null ? "" : secret;
        snapshotRule = snapshotRule == null || snapshotRule.isNull() ? null : snapshotRule;
        alertTitle = alertTitle == null ? "" : alertTitle;
        alertMethod = alertMethod == null ? "" : alertMethod;
    }
}

package io.cronkeeper.core.job;

import com.fasterxml.jackson.databind.JsonNode;
import io.cronkeeper.core.error.ValidationException;
import java.util.ArrayList;
import java.util.List;

public record JobRequest(
    String name,
    JobType type,
    String spec,
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
    String alertTitle,
    int alertCount,
    String alertMethod
) {
    public JobRequest {
        name = name == null ? "" : name.trim();
        spec = spec == null ? "" : spec.trim();
        payload = payload == null ? JobPayload.empty() : payload;
        sources = sources == null ? SourceSelector.none() : sources;
        sourceAccountIds = sourceAccountIds == null ? List.of() : List.copyOf(sourceAccountIds);
        secret = secret == null ? "" : secret;
        alertTitle = alertTitle == null ? "" : alertTitle.trim();
        alertMethod = alertMethod == null ? "" : alertMethod.trim();
    }

    public void validate() {
        if (name.isBlank()) {
            throw new ValidationException("name is required");
        }
        if (type == null) {
            throw new ValidationException("type is required");
        }
        if (retainCopies < 0 || retryTimes < 0 || timeoutSeconds < 0 || alertCount < 0) {
            throw new ValidationException("retainCopies, retryTimes, timeoutSeconds and alertCount must be >= 0");
        }
    }

    public static Builder builder(String name, JobType type, String spec) {
        return new Builder(name, type, spec);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(name, type, spec);
        builder.payload = payload;
        builder.sources = sources;
        builder.sourceAccountIds = new ArrayList<>(sourceAccountIds);
        builder.downloadAccountId = downloadAccountId;
        builder.retainCopies = retainCopies;
        builder.retryTimes = retryTimes;
        builder.timeoutSeconds = timeoutSeconds;
        builder.ignoreErr = ignoreErr;
        builder.secret = secret;
        builder.snapshotRule = snapshotRule;
        builder.alertTitle = alertTitle;
        builder.alertCount = alertCount;
        builder.alertMethod = alertMethod;
        return builder;
    }

    public static final class Builder {
        private String name;
        private final JobType type;
        private String spec;
        private JobPayload payload = JobPayload.empty();
        private SourceSelector sources = SourceSelector.none();
        private List<Long> sourceAccountIds = new ArrayList<>();
        private long downloadAccountId;
        private int retainCopies;
        private int retryTimes;
        private long timeoutSeconds;
        private boolean ignoreErr;
        private String secret = "";
        private JsonNode snapshotRule;
        private String alertTitle = "";
        private int alertCount;
        private String alertMethod = "";

        private Builder(String name, JobType type, String spec) {
            this.name = name;
            this.type = type;
            this.spec = spec;
        }

        public Builder name(String value) {
            this.name = value;
            return this;
        }

        public Builder spec(String value) {
            this.spec = value;
            return this;
        }

        public Builder payload(JobPayload value) {
            this.payload = value;
            return this;
        }

        public Builder sources(SourceSelector value) {
            this.sources = value;
            return this;
        }

        public Builder sourceAccounts(List<Long> ids, long downloadAccount) {
            this.sourceAccountIds = new ArrayList<>(ids);
            this.downloadAccountId = downloadAccount;
            return this;
        }

        public Builder retainCopies(int value) {
            this.retainCopies = value;
            return this;
        }

        public Builder retryTimes(int value) {
            this.retryTimes = value;
            return this;
        }

        public Builder timeoutSeconds(long value) {
            this.timeoutSeconds = value;
            return this;
        }

        public Builder ignoreErr(boolean value) {
            this.ignoreErr = value;
            return this;
        }

        public Builder secret(String value) {
            this.secret = value;
            return this;
        }

        public Builder snapshotRule(JsonNode value) {
            this.snapshotRule = value;
            return this;
        }

        public Builder alert(String title, int count, String method) {
            this.alertTitle = title;
            this.alertCount = count;
            this.alertMethod = method;
            return this;
        }

        public JobRequest build() {
            return new JobRequest(
                name,
                type,
                spec,
                payload,
                sources,
                sourceAccountIds,
                downloadAccountId,
                retainCopies,
                retryTimes,
                timeoutSeconds,
                ignoreErr,
                secret,
                snapshotRule,
                alertTitle,
                alertCount,
                alertMethod
            );
        }
    }
}

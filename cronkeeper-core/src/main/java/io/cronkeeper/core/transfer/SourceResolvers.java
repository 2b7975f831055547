package io.cronkeeper.core.transfer;

import io.cronkeeper.core.job.JobType;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public final class SourceResolvers {
    private final Map<JobType, SourceResolver> resolvers = new EnumMap<>(JobType.class);

    public synchronized SourceResolvers register(SourceResolver resolver, JobType... types) {
        for (JobType type : types) {
            resolvers.put(type, resolver);
        }
        return this;
    }

    public synchronized SourceResolvers registerWebsites(SourceResolver resolver) {
        return register(resolver, JobType.WEBSITE, JobType.CUT_WEBSITE_LOG);
    }

    public synchronized Optional<SourceResolver> find(JobType type) {
        return Optional.ofNullable(resolvers.get(type));
    }
}

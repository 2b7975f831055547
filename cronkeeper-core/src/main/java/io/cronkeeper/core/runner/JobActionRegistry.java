package io.cronkeeper.core.runner;

import io.cronkeeper.core.job.JobType;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class JobActionRegistry {
    private final Map<JobType, JobAction> actions = new ConcurrentHashMap<>();

    public void register(JobAction action) {
        actions.put(action.type(), action);
    }

    public Optional<JobAction> find(JobType type) {
        return Optional.ofNullable(actions.get(type));
    }

    public Collection<JobAction> all() {
        return actions.values();
    }
}

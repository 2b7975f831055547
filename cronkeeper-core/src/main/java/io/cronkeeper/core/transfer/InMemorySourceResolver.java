package io.cronkeeper.core.transfer;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySourceResolver implements SourceResolver {
    private final Map<Long, SourceRef> sources = new ConcurrentHashMap<>();

    public InMemorySourceResolver put(long id, SourceRef ref) {
        sources.put(id, ref);
        return this;
    }

    @Override
    public Optional<SourceRef> describe(long id) {
        return Optional.ofNullable(sources.get(id));
    }

    @Override
    public Optional<Long> resolve(SourceRef ref) {
        return sources.entrySet().stream()
            .filter(entry -> entry.getValue().equals(ref))
            .map(Map.Entry::getKey)
            .findFirst();
    }
}

package io.cronkeeper.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class BatchResult {
    private final List<String> succeeded = new ArrayList<>();
    private final List<String> skipped = new ArrayList<>();
    private final List<String> pending = new ArrayList<>();
    private final Map<String, String> failures = new LinkedHashMap<>();

    public BatchResult succeeded(String item) {
        succeeded.add(item);
        return this;
    }

    public BatchResult skipped(String item) {
        skipped.add(item);
        return this;
    }

    public BatchResult pending(String item) {
        pending.add(item);
        return this;
    }

    public BatchResult failed(String item, String reason) {
        failures.put(item, reason == null ? "" : reason);
        return this;
    }

    public List<String> succeeded() {
        return List.copyOf(succeeded);
    }

    public List<String> skipped() {
        return List.copyOf(skipped);
    }

    public List<String> pending() {
        return List.copyOf(pending);
    }

    public Map<String, String> failures() {
        return Map.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "succeeded=" + succeeded + ", skipped=" + skipped + ", pending=" + pending + ", failures=" + failures;
    }
}

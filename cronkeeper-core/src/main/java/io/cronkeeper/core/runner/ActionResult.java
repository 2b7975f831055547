package io.cronkeeper.core.runner;

import java.util.List;

public record ActionResult(List<String> artifacts) {
    public ActionResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public static ActionResult empty() {
        return new ActionResult(List.of());
    }

    public static ActionResult of(String... artifacts) {
        return new ActionResult(List.of(artifacts));
    }
}

package io.cronkeeper.core.job;

public record JobPayload(
    String executor,
    String command,
    String script,
    String containerName,
    String user,
    String url,
    String dbType,
    String sourceDir,
    String exclusionRules
) {
    public JobPayload {
        executor = safe(executor);
        command = safe(command);
        script = safe(script);
        containerName = safe(containerName);
        user = safe(user);
        url = safe(url);
        dbType = safe(dbType);
        sourceDir = safe(sourceDir);
        exclusionRules = safe(exclusionRules);
    }

    public static JobPayload empty() {
        return new JobPayload(null, null, null, null, null, null, null, null, null);
    }

    public static JobPayload command(String executor, String command) {
        return new JobPayload(executor, command, null, null, null, null, null, null, null);
    }

    public static JobPayload database(String dbType) {
        return new JobPayload(null, null, null, null, null, null, dbType, null, null);
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}

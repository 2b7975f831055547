package io.cronkeeper.core.account;

public record BackupAccount(long id, String name, String type, String backupPath) {
    public static final String LOCAL = "LOCAL";

    public BackupAccount {
        name = name == null ? "" : name.trim();
        type = type == null || type.isBlank() ? LOCAL : type.trim();
        backupPath = backupPath == null ? "" : backupPath.trim();
    }

    public boolean isLocal() {
        return LOCAL.equalsIgnoreCase(type);
    }
}

package io.cronkeeper.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.cronkeeper.core.account.BackupAccount;
import io.cronkeeper.core.config.ConfigPaths;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountConfig(long id, String name, String type, String backupPath) {

    public static AccountConfig localDefault() {
        return new AccountConfig(1, "localhost", BackupAccount.LOCAL, "~/.cronkeeper/backup");
    }

    public BackupAccount toAccount() {
        String path = backupPath == null || backupPath.isBlank()
            ? ""
            : ConfigPaths.resolve(backupPath).toString();
        return new BackupAccount(id, name, type, path);
    }
}

package io.cronkeeper.core.runner;

import io.cronkeeper.core.account.AccountResolver;
import io.cronkeeper.core.account.BackupAccount;
import io.cronkeeper.core.account.BackupClient;
import io.cronkeeper.core.job.Job;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record ActionContext(
    Job job,
    int attempt,
    Duration timeout,
    Instant startedAt,
    Path logFile,
    Path workDir,
    List<BackupAccount> accounts,
    AccountResolver resolver
) {
    public ActionContext {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        timeout = timeout == null ? Duration.ZERO : timeout;
    }

    public boolean bounded() {
        return !timeout.isZero();
    }

    public BackupClient client(BackupAccount account) {
        return resolver.client(account);
    }

    public void log(String line) throws IOException {
        if (logFile.getParent() != null) {
            Files.createDirectories(logFile.getParent());
        }
        Files.writeString(
            logFile,
            line + System.lineSeparator(),
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        );
    }
}

package io.cronkeeper.core.runner.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cronkeeper.core.account.BackupAccount;
import io.cronkeeper.core.account.ConfiguredAccountResolver;
import io.cronkeeper.core.job.Job;
import io.cronkeeper.core.job.JobPayload;
import io.cronkeeper.core.job.JobRequest;
import io.cronkeeper.core.job.JobStatus;
import io.cronkeeper.core.job.JobType;
import io.cronkeeper.core.runner.ActionContext;
import io.cronkeeper.core.runner.ActionResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryBackupActionTest {
    private static final Instant STARTED = Instant.parse("2026-04-02T03:04:05Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldArchiveDirectoryWithoutExcludedFiles() throws Exception {
        Path source = tempDir.resolve("site");
        Files.createDirectories(source.resolve("cache"));
        Files.writeString(source.resolve("index.html"), "<html/>");
        Files.writeString(source.resolve("cache").resolve("tmp.bin"), "x");
        BackupAccount local = new BackupAccount(1, "localhost", BackupAccount.LOCAL, tempDir.resolve("backup").toString());

        ActionContext context = context(source.toString(), "cache", List.of(local));
        ActionResult result = new DirectoryBackupAction(ZoneOffset.UTC).invoke(context);

        String artifact = "directory/site-files/site-files_20260402030405_1.zip";
        assertThat(result.artifacts()).containsExactly(artifact);
        Path archive = tempDir.resolve("backup").resolve(artifact);
        assertThat(entries(archive)).containsExactly("index.html");
        assertThat(Files.exists(context.workDir().resolve("site-files_20260402030405_1.zip"))).isFalse();
    }

    @Test
    void missingSourceDirectoryShouldFail() {
        BackupAccount local = new BackupAccount(1, "localhost", BackupAccount.LOCAL, tempDir.resolve("backup").toString());

        assertThatThrownBy(() -> new DirectoryBackupAction(ZoneOffset.UTC)
            .invoke(context(tempDir.resolve("absent").toString(), "", List.of(local))))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("does not exist");
    }

    private ActionContext context(String sourceDir, String exclusions, List<BackupAccount> accounts) {
        JobPayload payload = new JobPayload(null, null, null, null, null, null, null, sourceDir, exclusions);
        Job job = Job.from(JobRequest.builder("site-files", JobType.DIRECTORY, "0 3 * * *").payload(payload).build(),
            JobStatus.ENABLE, STARTED).withId(1);
        return new ActionContext(job, 1, Duration.ZERO, STARTED, tempDir.resolve("log").resolve("run.log"),
            tempDir.resolve("task"), accounts, new ConfiguredAccountResolver(accounts));
    }

    private static List<String> entries(Path archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}

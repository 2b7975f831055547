package io.cronkeeper.core.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronkeeper.core.model.Page;
import io.cronkeeper.core.schedule.EntryHandle;
import io.cronkeeper.core.store.SqliteDatabase;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteJobStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistAllJobFields() throws Exception {
        SqliteJobStore store = new SqliteJobStore(new SqliteDatabase(tempDir.resolve("db/cronkeeper.db")));
        Job job = new Job(
            0,
            "nightly-db",
            JobType.DATABASE,
            "0 2 * * *",
            JobStatus.ENABLE,
            JobPayload.database("mysql"),
            SourceSelector.byIds(List.of(3L, 7L)),
            List.of(1L, 2L),
            2L,
            3,
            1,
            600,
            true,
            "s3cret",
            new ObjectMapper().readTree("{\"withImage\":true}"),
            List.of(new EntryHandle(4), new EntryHandle(5)),
            Instant.parse("2026-01-01T00:00:00Z")
        );

        Job saved = store.insert(job);
        Job loaded = store.get(saved.id()).orElseThrow();

        assertThat(saved.id()).isPositive();
        assertThat(loaded).isEqualTo(saved);
        assertThat(loaded.sources()).isEqualTo(SourceSelector.byIds(List.of(3L, 7L)));
        assertThat(loaded.snapshotRule().get("withImage").asBoolean()).isTrue();
        assertThat(store.findByName("nightly-db")).contains(loaded);
    }

    @Test
    void shouldKeepAllSelector() throws Exception {
        SqliteJobStore store = new SqliteJobStore(new SqliteDatabase(tempDir.resolve("cronkeeper.db")));
        Job job = Job.from(
            JobRequest.builder("all-sites", JobType.WEBSITE, "@every 5m").sources(SourceSelector.all()).build(),
            JobStatus.DISABLE,
            Instant.parse("2026-01-01T00:00:00Z")
        );

        Job saved = store.insert(job);

        assertThat(store.get(saved.id()).orElseThrow().sources()).isInstanceOf(SourceSelector.All.class);
    }

    @Test
    void pageShouldFilterSortAndCount() throws Exception {
        SqliteJobStore store = new SqliteJobStore(new SqliteDatabase(tempDir.resolve("cronkeeper.db")));
        for (String name : List.of("backup-b", "backup-a", "cleanup", "backup-c")) {
            store.insert(Job.from(
                JobRequest.builder(name, JobType.SHELL, "@every 1m").build(),
                JobStatus.DISABLE,
                Instant.parse("2026-01-01T00:00:00Z")
            ));
        }

        Page<Job> page = store.page(new JobQuery("backup", "name", true, 1, 2));

        assertThat(page.total()).isEqualTo(3);
        assertThat(page.items()).extracting(Job::name).containsExactly("backup-a", "backup-b");
        assertThat(store.page(new JobQuery("backup", "name", true, 2, 2)).items())
            .extracting(Job::name)
            .containsExactly("backup-c");
    }

    @Test
    void creationOrderShouldFollowInstantsNotTheirText() throws Exception {
        SqliteJobStore store = new SqliteJobStore(new SqliteDatabase(tempDir.resolve("cronkeeper.db")));
        store.insert(Job.from(JobRequest.builder("later", JobType.SHELL, "@every 1m").build(),
            JobStatus.DISABLE, Instant.parse("2026-01-01T00:00:00.500Z")));
        store.insert(Job.from(JobRequest.builder("earlier", JobType.SHELL, "@every 1m").build(),
            JobStatus.DISABLE, Instant.parse("2026-01-01T00:00:00Z")));

        Page<Job> page = store.page(new JobQuery("", "createdAt", true, 1, 10));

        assertThat(page.items()).extracting(Job::name).containsExactly("earlier", "later");
    }

    @Test
    void nameFilterShouldMatchWildcardCharactersLiterally() throws Exception {
        SqliteJobStore store = new SqliteJobStore(new SqliteDatabase(tempDir.resolve("cronkeeper.db")));
        for (String name : List.of("a_b", "axb", "50%-off", "500-off")) {
            store.insert(Job.from(JobRequest.builder(name, JobType.SHELL, "@every 1m").build(),
                JobStatus.DISABLE, Instant.EPOCH));
        }

        assertThat(store.page(new JobQuery("a_b", "name", true, 1, 10)).items())
            .extracting(Job::name)
            .containsExactly("a_b");
        Page<Job> percent = store.page(new JobQuery("50%", "name", true, 1, 10));
        assertThat(percent.total()).isEqualTo(1);
        assertThat(percent.items()).extracting(Job::name).containsExactly("50%-off");
    }

    @Test
    void deleteShouldReportWhetherRowExisted() throws Exception {
        SqliteJobStore store = new SqliteJobStore(new SqliteDatabase(tempDir.resolve("cronkeeper.db")));
        Job saved = store.insert(Job.from(
            JobRequest.builder("tmp", JobType.CURL, "@every 1m").build(),
            JobStatus.DISABLE,
            Instant.EPOCH
        ));

        assertThat(store.delete(saved.id())).isTrue();
        assertThat(store.delete(saved.id())).isFalse();
        assertThat(store.get(saved.id())).isEmpty();
    }
}

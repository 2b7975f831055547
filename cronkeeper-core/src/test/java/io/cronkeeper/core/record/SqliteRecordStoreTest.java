package io.cronkeeper.core.record;

import static org.assertj.core.api.Assertions.assertThat;

import io.cronkeeper.core.model.Page;
import io.cronkeeper.core.store.SqliteDatabase;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteRecordStoreTest {
    private static final Instant T0 = Instant.parse("2026-01-01T02:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldAppendAndFinishRecord() throws Exception {
        SqliteRecordStore store = new SqliteRecordStore(new SqliteDatabase(tempDir.resolve("cronkeeper.db")));

        ExecutionRecord running = store.append(ExecutionRecord.running(1, T0, "/tmp/x.log"));
        store.update(running.succeeded(List.of("db/a.sql.gz"), List.of("localhost"), true, 1200));

        ExecutionRecord loaded = store.get(running.id()).orElseThrow();
        assertThat(loaded.status()).isEqualTo(RecordStatus.SUCCESS);
        assertThat(loaded.artifacts()).containsExactly("db/a.sql.gz");
        assertThat(loaded.accounts()).containsExactly("localhost");
        assertThat(loaded.durationMillis()).isEqualTo(1200);
        assertThat(loaded.startTime()).isEqualTo(T0);
    }

    @Test
    void listByJobShouldBeNewestFirstWithInsertionTieBreak() throws Exception {
        SqliteRecordStore store = new SqliteRecordStore(new SqliteDatabase(tempDir.resolve("cronkeeper.db")));
        ExecutionRecord older = store.append(ExecutionRecord.running(1, T0, ""));
        ExecutionRecord tieFirst = store.append(ExecutionRecord.running(1, T0.plusSeconds(60), ""));
        ExecutionRecord tieSecond = store.append(ExecutionRecord.running(1, T0.plusSeconds(60), ""));
        store.append(ExecutionRecord.running(2, T0.plusSeconds(120), ""));

        List<ExecutionRecord> records = store.listByJob(1);

        assertThat(records).extracting(ExecutionRecord::id)
            .containsExactly(tieSecond.id(), tieFirst.id(), older.id());
        assertThat(store.latest(1).orElseThrow().id()).isEqualTo(tieSecond.id());
        assertThat(store.latest(3)).isEmpty();
    }

    @Test
    void pageShouldFilterByStatusAndDateRange() throws Exception {
        SqliteRecordStore store = new SqliteRecordStore(new SqliteDatabase(tempDir.resolve("cronkeeper.db")));
        for (int i = 0; i < 4; i++) {
            ExecutionRecord record = store.append(ExecutionRecord.running(1, T0.plusSeconds(3600L * i), ""));
            store.update(i % 2 == 0 ? record.succeeded(List.of(), List.of(), true, 1) : record.failed("boom", 1));
        }

        Page<ExecutionRecord> failed = store.page(new RecordQuery(1, RecordStatus.FAILED, null, null, 1, 10));
        Page<ExecutionRecord> window = store.page(new RecordQuery(1, null, T0.plusSeconds(3600), T0.plusSeconds(3 * 3600), 1, 10));

        assertThat(failed.total()).isEqualTo(2);
        assertThat(failed.items()).allMatch(record -> record.message().equals("boom"));
        assertThat(window.items()).extracting(ExecutionRecord::startTime)
            .containsExactly(T0.plusSeconds(2 * 3600), T0.plusSeconds(3600));
    }

    @Test
    void deleteByJobShouldRemoveRowsAndLogFiles() throws Exception {
        SqliteRecordStore store = new SqliteRecordStore(new SqliteDatabase(tempDir.resolve("cronkeeper.db")));
        Path log = Files.writeString(tempDir.resolve("run.log"), "output");
        store.append(ExecutionRecord.running(5, T0, log.toString()));
        store.append(ExecutionRecord.running(5, T0, tempDir.resolve("missing.log").toString()));

        int removed = store.deleteByJob(5);

        assertThat(removed).isEqualTo(2);
        assertThat(store.listByJob(5)).isEmpty();
        assertThat(Files.exists(log)).isFalse();
    }

    @Test
    void detachShouldKeepRecordsWithoutJobReference() throws Exception {
        SqliteRecordStore store = new SqliteRecordStore(new SqliteDatabase(tempDir.resolve("cronkeeper.db")));
        ExecutionRecord record = store.append(ExecutionRecord.running(9, T0, ""));

        assertThat(store.detach(9)).isEqualTo(1);

        assertThat(store.listByJob(9)).isEmpty();
        assertThat(store.get(record.id()).orElseThrow().detached()).isTrue();
    }

    @Test
    void readLogShouldReturnEmptyWhenRecordOrFileIsMissing() throws Exception {
        SqliteRecordStore store = new SqliteRecordStore(new SqliteDatabase(tempDir.resolve("cronkeeper.db")));
        Path log = Files.writeString(tempDir.resolve("ok.log"), "hello log");
        ExecutionRecord withLog = store.append(ExecutionRecord.running(1, T0, log.toString()));
        ExecutionRecord gone = store.append(ExecutionRecord.running(1, T0, tempDir.resolve("gone.log").toString()));

        assertThat(store.readLog(withLog.id())).isEqualTo("hello log");
        assertThat(store.readLog(gone.id())).isEmpty();
        assertThat(store.readLog(12345)).isEmpty();
    }
}

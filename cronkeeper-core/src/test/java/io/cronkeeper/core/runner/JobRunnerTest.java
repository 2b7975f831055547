package io.cronkeeper.core.runner;

import static org.assertj.core.api.Assertions.assertThat;

import io.cronkeeper.core.MutableClock;
import io.cronkeeper.core.account.BackupAccount;
import io.cronkeeper.core.account.ConfiguredAccountResolver;
import io.cronkeeper.core.alert.AlertMessage;
import io.cronkeeper.core.alert.AlertSender;
import io.cronkeeper.core.alert.AlertSubscription;
import io.cronkeeper.core.alert.DefaultAlertBridge;
import io.cronkeeper.core.alert.FileAlertStore;
import io.cronkeeper.core.alert.JobOutcome;
import io.cronkeeper.core.job.Job;
import io.cronkeeper.core.job.JobPayload;
import io.cronkeeper.core.job.JobRequest;
import io.cronkeeper.core.job.JobStatus;
import io.cronkeeper.core.job.JobType;
import io.cronkeeper.core.record.ExecutionRecord;
import io.cronkeeper.core.record.RecordStatus;
import io.cronkeeper.core.record.SqliteRecordStore;
import io.cronkeeper.core.retention.RetentionManager;
import io.cronkeeper.core.store.SqliteDatabase;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobRunnerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T02:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqliteRecordStore records;
    private DefaultAlertBridge alerts;
    private JobActionRegistry actions;
    private JobRunner runner;
    private final List<AlertMessage> sent = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(NOW);
        records = new SqliteRecordStore(new SqliteDatabase(tempDir.resolve("cronkeeper.db")));
        BackupAccount local = new BackupAccount(1, "localhost", BackupAccount.LOCAL, tempDir.resolve("backup").toString());
        ConfiguredAccountResolver accounts = new ConfiguredAccountResolver(List.of(local));
        alerts = new DefaultAlertBridge(new FileAlertStore(tempDir.resolve("alerts.json")), clock);
        alerts.register(new AlertSender() {
            @Override
            public String method() {
                return "memory";
            }

            @Override
            public void send(AlertMessage message) {
                sent.add(message);
            }
        });
        actions = new JobActionRegistry();
        runner = new JobRunner(
            records,
            new RetentionManager(records, accounts),
            alerts,
            actions,
            accounts,
            tempDir.resolve("data"),
            clock,
            ZoneOffset.UTC
        );
    }

    @Test
    void successfulRunShouldRecordArtifactsAndLocalAccount() throws Exception {
        actions.register(new FixedAction(JobType.DATABASE, 0, ActionResult.of("database/nightly/dump.sql.gz")));
        Job job = job(JobType.DATABASE, 0, false, List.of(1L));

        ExecutionRecord record = runner.run(job);

        assertThat(record.status()).isEqualTo(RecordStatus.SUCCESS);
        assertThat(record.artifacts()).containsExactly("database/nightly/dump.sql.gz");
        assertThat(record.accounts()).containsExactly("localhost");
        assertThat(record.fromLocal()).isTrue();
        assertThat(records.get(record.id())).contains(record);
        assertThat(Path.of(record.logPath()))
            .startsWith(tempDir.resolve("data").resolve("log").resolve("database").resolve("nightly"));
        assertThat(records.readLog(record.id())).contains("attempt 1/1").contains("finished: Success");
    }

    @Test
    void shouldRetryUntilActionSucceeds() throws Exception {
        FixedAction action = new FixedAction(JobType.SHELL, 2, ActionResult.empty());
        actions.register(action);

        ExecutionRecord record = runner.run(job(JobType.SHELL, 2, false, List.of()));

        assertThat(record.status()).isEqualTo(RecordStatus.SUCCESS);
        assertThat(action.calls.get()).isEqualTo(3);
        assertThat(record.accounts()).isEmpty();
        assertThat(records.readLog(record.id())).contains("attempt 2 failed: boom 2").contains("attempt 3/3");
    }

    @Test
    void exhaustedRetriesShouldFailAndAlert() throws Exception {
        FixedAction action = new FixedAction(JobType.SHELL, 10, ActionResult.empty());
        actions.register(action);
        Job job = job(JobType.SHELL, 1, false, List.of());
        alerts.upsert(new AlertSubscription(JobType.SHELL, job.id(), "cleanup failing", 1, "memory"));

        ExecutionRecord record = runner.run(job);

        assertThat(record.status()).isEqualTo(RecordStatus.FAILED);
        assertThat(record.message()).contains("boom 2");
        assertThat(action.calls.get()).isEqualTo(2);
        assertThat(sent).singleElement().satisfies(message -> {
            assertThat(message.title()).isEqualTo("cleanup failing");
            assertThat(message.status()).isEqualTo("Failed");
        });
    }

    @Test
    void ignoredErrorShouldNotAlert() throws Exception {
        actions.register(new FixedAction(JobType.SHELL, 10, ActionResult.empty()));
        Job job = job(JobType.SHELL, 0, true, List.of());
        alerts.upsert(new AlertSubscription(JobType.SHELL, job.id(), "", 1, "memory"));

        ExecutionRecord record = runner.run(job);

        assertThat(record.status()).isEqualTo(RecordStatus.FAILED);
        assertThat(sent).isEmpty();
    }

    @Test
    void missingActionShouldProduceFailedRecord() throws Exception {
        ExecutionRecord record = runner.run(job(JobType.CURL, 3, false, List.of()));

        assertThat(record.status()).isEqualTo(RecordStatus.FAILED);
        assertThat(record.message()).contains("no action registered for job type curl");
        assertThat(records.listByJob(record.jobId())).hasSize(1);
    }

    @Test
    void durationShouldFollowClock() throws Exception {
        actions.register(new JobAction() {
            @Override
            public JobType type() {
                return JobType.SHELL;
            }

            @Override
            public ActionResult invoke(ActionContext context) {
                clock.advance(Duration.ofSeconds(3));
                return ActionResult.empty();
            }
        });

        ExecutionRecord record = runner.run(job(JobType.SHELL, 0, false, List.of()));

        assertThat(record.startTime()).isEqualTo(NOW);
        assertThat(record.durationMillis()).isEqualTo(3000);
        assertThat(Files.exists(Path.of(record.logPath()))).isTrue();
    }

    @Test
    void accountWithoutBackupClientShouldNotAbortRetentionOrAlerting() throws Exception {
        BackupAccount local = new BackupAccount(1, "localhost", BackupAccount.LOCAL, tempDir.resolve("backup").toString());
        BackupAccount tape = new BackupAccount(9, "tape", "TAPE", "/");
        ConfiguredAccountResolver withTape = new ConfiguredAccountResolver(List.of(local, tape));
        JobRunner tapeRunner = new JobRunner(records, new RetentionManager(records, withTape), alerts, actions,
            withTape, tempDir.resolve("data"), clock, ZoneOffset.UTC);
        actions.register(new FixedAction(JobType.DATABASE, 0, ActionResult.of("database/nightly/dump_2.sql.gz")));
        JobRequest request = JobRequest.builder("nightly", JobType.DATABASE, "@every 1m")
            .payload(JobPayload.database("mysql"))
            .sourceAccounts(List.of(9L, 1L), 1)
            .retainCopies(1)
            .build();
        Job job = Job.from(request, JobStatus.ENABLE, NOW).withId(5);
        ExecutionRecord older = records.append(ExecutionRecord.running(5, NOW.minus(Duration.ofDays(1)), ""));
        records.update(older.succeeded(List.of("database/nightly/dump_1.sql.gz"), List.of("tape", "localhost"), true, 10));
        alerts.upsert(new AlertSubscription(JobType.DATABASE, 5, "nightly failing", 2, "memory"));
        alerts.notify(new JobOutcome(JobType.DATABASE, 5, "nightly", older.id(), RecordStatus.FAILED, "boom", NOW));

        ExecutionRecord record = tapeRunner.run(job);

        assertThat(record.status()).isEqualTo(RecordStatus.SUCCESS);
        assertThat(records.get(older.id()).orElseThrow().accounts()).containsExactly("tape");

        alerts.notify(new JobOutcome(JobType.DATABASE, 5, "nightly", record.id(), RecordStatus.FAILED, "boom", NOW));
        assertThat(sent).isEmpty();
    }

    private static Job job(JobType type, int retryTimes, boolean ignoreErr, List<Long> accountIds) {
        JobRequest request = JobRequest.builder(type == JobType.DATABASE ? "nightly" : "cleanup", type, "@every 1m")
            .payload(type == JobType.DATABASE ? JobPayload.database("mysql") : JobPayload.command("bash", "true"))
            .sourceAccounts(accountIds, 0)
            .retryTimes(retryTimes)
            .ignoreErr(ignoreErr)
            .build();
        return Job.from(request, JobStatus.ENABLE, NOW).withId(5);
    }

    private static final class FixedAction implements JobAction {
        private final JobType type;
        private final int failures;
        private final ActionResult result;
        private final AtomicInteger calls = new AtomicInteger();

        private FixedAction(JobType type, int failures, ActionResult result) {
            this.type = type;
            this.failures = failures;
            this.result = result;
        }

        @Override
        public JobType type() {
            return type;
        }

        @Override
        public ActionResult invoke(ActionContext context) throws Exception {
            int call = calls.incrementAndGet();
            if (call <= failures) {
                throw new IllegalStateException("boom " + call);
            }
            return result;
        }
    }
}

package io.cronkeeper.core.runner;

import io.cronkeeper.core.account.AccountResolver;
import io.cronkeeper.core.account.BackupAccount;
import io.cronkeeper.core.alert.AlertBridge;
import io.cronkeeper.core.alert.JobOutcome;
import io.cronkeeper.core.error.JobExecutionException;
import io.cronkeeper.core.job.Job;
import io.cronkeeper.core.record.ExecutionRecord;
import io.cronkeeper.core.record.RecordStore;
import io.cronkeeper.core.retention.RetentionManager;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class JobRunner {
    private static final Logger LOG = LoggerFactory.getLogger(JobRunner.class);
    private static final DateTimeFormatter LOG_STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final RecordStore records;
    private final RetentionManager retention;
    private final AlertBridge alerts;
    private final JobActionRegistry actions;
    private final AccountResolver accounts;
    private final Path dataDir;
    private final Clock clock;
    private final ZoneId zone;
    private final AtomicLong logSequence = new AtomicLong();

    public JobRunner(
        RecordStore records,
        RetentionManager retention,
        AlertBridge alerts,
        JobActionRegistry actions,
        AccountResolver accounts,
        Path dataDir,
        Clock clock,
        ZoneId zone
    ) {
        this.records = Objects.requireNonNull(records, "records must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.actions = Objects.requireNonNull(actions, "actions must not be null");
        this.accounts = Objects.requireNonNull(accounts, "accounts must not be null");
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ExecutionRecord run(Job job) throws IOException {
        Objects.requireNonNull(job, "job must not be null");
        Instant start = clock.instant();
        Path logFile = logFileFor(job, start);
        ExecutionRecord record = records.append(ExecutionRecord.running(job.id(), start, logFile.toString()));
        List<BackupAccount> sourceAccounts = job.type().producesBackups() ? retention.sourceAccounts(job) : List.of();
        LOG.info("Running job {} ({}) as record {}", job.name(), job.type().wireName(), record.id());

        ExecutionRecord finished;
        try {
            ActionResult result = execute(job, start, logFile, sourceAccounts);
            List<String> accountNames = sourceAccounts.stream().map(BackupAccount::name).toList();
            boolean local = sourceAccounts.isEmpty() || sourceAccounts.stream().anyMatch(BackupAccount::isLocal);
            finished = record.succeeded(result.artifacts(), accountNames, local, elapsed(start));
            records.update(finished);
            appendLog(logFile, "finished: " + finished.status().wireName());
            LOG.info("Job {} succeeded in {}ms", job.name(), finished.durationMillis());
            trim(job, sourceAccounts, finished.id());
        } catch (JobExecutionException e) {
            finished = record.failed(e.getMessage(), elapsed(start));
            records.update(finished);
            appendLog(logFile, "finished: " + finished.status().wireName() + ": " + e.getMessage());
            if (job.ignoreErr()) {
                LOG.info("Job {} failed, error ignored: {}", job.name(), e.getMessage());
                return finished;
            }
            LOG.warn("Job {} failed: {}", job.name(), e.getMessage());
        }

        alerts.notify(new JobOutcome(
            job.type(),
            job.id(),
            job.name(),
            finished.id(),
            finished.status(),
            finished.message(),
            clock.instant()
        ));
        return finished;
    }

    private ActionResult execute(Job job, Instant start, Path logFile, List<BackupAccount> sourceAccounts) {
        JobAction action = actions.find(job.type()).orElse(null);
        if (action == null) {
            throw new JobExecutionException(
                job.name(),
                0,
                new IllegalStateException("no action registered for job type " + job.type().wireName())
            );
        }
        Path workDir = dataDir.resolve("task").resolve(job.type().wireName()).resolve(job.name());
        Duration timeout = Duration.ofSeconds(job.timeoutSeconds());
        int maxAttempts = job.retryTimes() + 1;
        Exception last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ActionContext context = new ActionContext(
                job,
                attempt,
                timeout,
                start,
                logFile,
                workDir,
                sourceAccounts,
                accounts
            );
            try {
                appendLog(logFile, "attempt " + attempt + "/" + maxAttempts);
                return action.invoke(context);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new JobExecutionException(job.name(), attempt, e);
            } catch (Exception e) {
                last = e;
                appendLog(logFile, "attempt " + attempt + " failed: " + e.getMessage());
                if (attempt < maxAttempts) {
                    LOG.debug("Job {} attempt {} failed, retrying: {}", job.name(), attempt, e.getMessage());
                }
            }
        }
        throw new JobExecutionException(job.name(), maxAttempts, last);
    }

    private void trim(Job job, List<BackupAccount> sourceAccounts, long recordId) {
        if (job.retainCopies() <= 0 || sourceAccounts.isEmpty()) {
            return;
        }
        try {
            retention.removeExpired(job, sourceAccounts, recordId);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Retention pass for job {} failed: {}", job.name(), e.getMessage());
        }
    }

    private Path logFileFor(Job job, Instant start) {
        String stamp = LOG_STAMP.format(start.atZone(zone));
        return dataDir.resolve("log")
            .resolve(job.type().wireName())
            .resolve(job.name())
            .resolve(stamp + "-" + logSequence.incrementAndGet() + ".log");
    }

    private long elapsed(Instant start) {
        return Math.max(0, Duration.between(start, clock.instant()).toMillis());
    }

    private void appendLog(Path logFile, String line) {
        try {
            Files.createDirectories(logFile.getParent());
            Files.writeString(
                logFile,
                "[" + clock.instant() + "] " + line + System.lineSeparator(),
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            );
        } catch (IOException e) {
            LOG.warn("Failed to write log file {}: {}", logFile, e.getMessage());
        }
    }
}

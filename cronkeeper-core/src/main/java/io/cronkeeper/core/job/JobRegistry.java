package io.cronkeeper.core.job;

import io.cronkeeper.core.account.AccountResolver;
import io.cronkeeper.core.account.BackupAccount;
import io.cronkeeper.core.account.LocalBackupClient;
import io.cronkeeper.core.alert.AlertBridge;
import io.cronkeeper.core.alert.AlertSubscription;
import io.cronkeeper.core.error.CronkeeperException;
import io.cronkeeper.core.error.DuplicateNameException;
import io.cronkeeper.core.error.InvalidSpecException;
import io.cronkeeper.core.error.NotFoundException;
import io.cronkeeper.core.error.ValidationException;
import io.cronkeeper.core.model.BatchResult;
import io.cronkeeper.core.model.Page;
import io.cronkeeper.core.record.ExecutionRecord;
import io.cronkeeper.core.record.RecordQuery;
import io.cronkeeper.core.record.RecordStore;
import io.cronkeeper.core.retention.RetentionManager;
import io.cronkeeper.core.runner.JobRunner;
import io.cronkeeper.core.schedule.EntryHandle;
import io.cronkeeper.core.schedule.SchedulerEngine;
import io.cronkeeper.core.schedule.TriggerSpec;
import io.cronkeeper.core.transfer.ImportExportCodec;
import io.cronkeeper.core.transfer.TransferableJob;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the job definitions and the scheduler handles that keep enabled jobs firing.
 */
public final class JobRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(JobRegistry.class);
    private static final int DEFAULT_PREVIEW = 5;

    private final JobStore jobs;
    private final RecordStore records;
    private final SchedulerEngine engine;
    private final JobRunner runner;
    private final RetentionManager retention;
    private final AlertBridge alerts;
    private final AccountResolver accounts;
    private final ImportExportCodec codec;
    private final Path dataDir;
    private final Clock clock;

    public JobRegistry(
        JobStore jobs,
        RecordStore records,
        SchedulerEngine engine,
        JobRunner runner,
        RetentionManager retention,
        AlertBridge alerts,
        AccountResolver accounts,
        ImportExportCodec codec,
        Path dataDir,
        Clock clock
    ) {
        this.jobs = Objects.requireNonNull(jobs, "jobs must not be null");
        this.records = Objects.requireNonNull(records, "records must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.accounts = Objects.requireNonNull(accounts, "accounts must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized Job create(JobRequest request) throws IOException {
        Objects.requireNonNull(request, "request must not be null");
        request.validate();
        if (jobs.findByName(request.name()).isPresent()) {
            throw new DuplicateNameException(request.name());
        }
        List<String> segments = validateSpec(request.spec());

        Job job = bindLocalAccount(Job.from(request, JobStatus.ENABLE, clock.instant()));
        job = jobs.insert(job);
        List<EntryHandle> handles;
        try {
            handles = registerAll(job.id(), segments);
        } catch (RuntimeException e) {
            jobs.delete(job.id());
            throw e;
        }
        job = job.withSchedule(JobStatus.ENABLE, handles);
        jobs.update(job);
        if (request.alertCount() > 0) {
            alerts.upsert(subscriptionOf(job, request));
        }
        LOG.info("Created job {} ({}) with {} trigger(s)", job.name(), job.type().wireName(), job.entryHandles().size());
        return job;
    }

    public synchronized Job update(long id, JobRequest request) throws IOException {
        Objects.requireNonNull(request, "request must not be null");
        Job current = require(id);
        request.validate();
        Optional<Job> sameName = jobs.findByName(request.name());
        if (sameName.isPresent() && sameName.get().id() != id) {
            throw new DuplicateNameException(request.name());
        }
        List<String> segments = validateSpec(request.spec());

        Job merged = bindLocalAccount(current.merge(request));
        Job updated;
        if (current.status() == JobStatus.DISABLE) {
            updated = merged.withSchedule(JobStatus.DISABLE, List.of());
        } else {
            updated = merged.withSchedule(JobStatus.ENABLE, registerAll(id, segments));
        }
        unregisterAll(current);
        jobs.update(updated);

        if (request.alertCount() > 0) {
            alerts.upsert(subscriptionOf(updated, request));
        } else {
            alerts.delete(updated.type(), id);
        }
        LOG.info("Updated job {} (status {}, {} trigger(s))",
            updated.name(), updated.status().wireName(), updated.entryHandles().size());
        return updated;
    }

    public synchronized Job updateStatus(long id, JobStatus status) throws IOException {
        Objects.requireNonNull(status, "status must not be null");
        Job current = require(id);
        List<EntryHandle> handles = List.of();
        if (status == JobStatus.ENABLE) {
            handles = registerAll(id, validateSpec(current.spec()));
        }
        unregisterAll(current);
        Job updated = current.withSchedule(status, handles);
        jobs.update(updated);
        LOG.info("Job {} is now {}", updated.name(), status.wireName());
        return updated;
    }

    public synchronized BatchResult delete(Collection<Long> ids, boolean cleanData, boolean cleanRemoteData) {
        BatchResult result = new BatchResult();
        for (Long id : ids) {
            String label = String.valueOf(id);
            try {
                Job job = require(id);
                label = job.name();
                removeTaskDir(job);
                unregisterAll(job);
                if (!job.entryHandles().isEmpty()) {
                    jobs.update(job.withSchedule(JobStatus.DISABLE, List.of()));
                }
                retention.cleanRecord(job, cleanData, cleanRemoteData, true);
                jobs.delete(job.id());
                alerts.delete(job.type(), job.id());
                result.succeeded(label);
                LOG.info("Deleted job {}", job.name());
            } catch (IOException | CronkeeperException e) {
                LOG.warn("Failed to delete job {}: {}", label, e.getMessage());
                result.failed(label, e.getMessage());
            }
        }
        return result;
    }

    public synchronized JobDetail get(long id) throws IOException {
        Job job = require(id);
        Optional<AlertSubscription> alert = alerts.find(job.type(), job.id());
        return new JobDetail(
            job,
            alert.map(AlertSubscription::title).orElse(""),
            alert.map(AlertSubscription::sendCount).orElse(0),
            alert.map(AlertSubscription::method).orElse("")
        );
    }

    public synchronized Page<JobSummary> page(JobQuery query) throws IOException {
        Page<Job> page = jobs.page(query == null ? JobQuery.all() : query);
        List<JobSummary> summaries = new ArrayList<>();
        for (Job job : page.items()) {
            summaries.add(summarize(job));
        }
        return new Page<>(summaries, page.total(), page.page(), page.pageSize());
    }

    public List<Instant> nextRuns(String spec) {
        return nextRuns(spec, DEFAULT_PREVIEW);
    }

    public List<Instant> nextRuns(String spec, int n) {
        return engine.computeNext(spec, clock.instant(), n);
    }

    public ExecutionRecord runOnce(long id) throws IOException {
        Job job;
        synchronized (this) {
            job = require(id);
        }
        return runner.run(job);
    }

    public Page<ExecutionRecord> records(RecordQuery query) throws IOException {
        return records.page(query);
    }

    public String recordLog(long recordId) throws IOException {
        return records.readLog(recordId);
    }

    public Path download(long recordId, long accountId) throws IOException {
        ExecutionRecord record = records.get(recordId).orElseThrow(() -> new NotFoundException("record", recordId));
        BackupAccount account = accounts.findById(accountId)
            .orElseThrow(() -> new NotFoundException("backup account", accountId));
        if (record.artifacts().isEmpty()) {
            throw new ValidationException("record " + recordId + " has no artifact");
        }
        String artifact = record.artifacts().get(0);

        Optional<BackupAccount> local = account.isLocal() ? Optional.of(account) : Optional.empty();
        if (local.isEmpty() && record.fromLocal()) {
            local = accounts.findLocal();
        }
        if (local.isPresent()) {
            Path path = new LocalBackupClient(Path.of(local.get().backupPath())).resolve(artifact);
            if (!Files.exists(path)) {
                throw new NoSuchFileException(path.toString());
            }
            return path;
        }

        Path target = dataDir.resolve("download").resolve(artifact).normalize();
        if (!Files.exists(target)) {
            accounts.client(account).download(artifact, target);
            LOG.info("Downloaded {} from account {}", artifact, account.name());
        }
        return target;
    }

    public synchronized void cleanRecord(long id, boolean cleanData, boolean cleanRemoteData) throws IOException {
        retention.cleanRecord(require(id), cleanData, cleanRemoteData, false);
    }

    /**
     * Registers every enabled job against the engine. Handles from a previous process are discarded.
     */
    public synchronized int restore() throws IOException {
        int registered = 0;
        for (Job job : jobs.list()) {
            if (job.status() != JobStatus.ENABLE) {
                if (!job.entryHandles().isEmpty()) {
                    jobs.update(job.withSchedule(job.status(), List.of()));
                }
                continue;
            }
            try {
                List<EntryHandle> handles = registerAll(job.id(), validateSpec(job.spec()));
                jobs.update(job.withSchedule(JobStatus.ENABLE, handles));
                registered++;
            } catch (InvalidSpecException e) {
                LOG.error("Job {} has an invalid spec and was disabled: {}", job.name(), e.getMessage());
                jobs.update(job.withSchedule(JobStatus.DISABLE, List.of()));
            }
        }
        LOG.info("Restored {} enabled job(s)", registered);
        return registered;
    }

    public synchronized List<TransferableJob> export(Collection<Long> ids) throws IOException {
        return codec.export(ids);
    }

    public synchronized String exportJson(Collection<Long> ids) throws IOException {
        return codec.exportJson(ids);
    }

    public List<TransferableJob> parseExport(String json) throws IOException {
        return codec.parse(json);
    }

    public synchronized BatchResult importJobs(List<TransferableJob> items) throws IOException {
        return codec.importJobs(items);
    }

    private JobSummary summarize(Job job) throws IOException {
        Optional<ExecutionRecord> last = records.latest(job.id());
        int alertCount = alerts.find(job.type(), job.id()).map(AlertSubscription::sendCount).orElse(0);
        List<String> accountNames = new ArrayList<>();
        for (Long accountId : job.sourceAccountIds()) {
            accounts.findById(accountId).ifPresent(account -> accountNames.add(account.name()));
        }
        String download = accounts.findById(job.downloadAccountId()).map(BackupAccount::name).orElse("");
        Instant nextRun = job.entryHandles().stream()
            .map(engine::nextFireTime)
            .flatMap(Optional::stream)
            .min(Comparator.naturalOrder())
            .orElse(null);
        return new JobSummary(
            job,
            last.map(record -> record.status().wireName()).orElse(JobSummary.NONE),
            last.map(record -> record.startTime().toString()).orElse(JobSummary.NONE),
            alertCount,
            accountNames,
            download,
            nextRun
        );
    }

    private Job bindLocalAccount(Job job) {
        if (job.type() != JobType.CUT_WEBSITE_LOG) {
            return job;
        }
        BackupAccount local = accounts.findLocal()
            .orElseThrow(() -> new ValidationException("no local backup account configured for " + job.name()));
        return job.withAccounts(List.of(local.id()), local.id());
    }

    /**
     * Parses every segment and checks that it has at least one future firing time.
     */
    private List<String> validateSpec(String spec) {
        List<String> segments = TriggerSpec.segments(spec);
        Instant now = clock.instant();
        for (String segment : segments) {
            engine.computeNext(segment, now, 1);
        }
        return segments;
    }

    private List<EntryHandle> registerAll(long jobId, List<String> segments) {
        List<EntryHandle> handles = new ArrayList<>();
        try {
            for (String segment : segments) {
                handles.add(engine.register(segment, () -> fire(jobId)));
            }
        } catch (RuntimeException e) {
            handles.forEach(engine::unregister);
            throw e;
        }
        return handles;
    }

    private void unregisterAll(Job job) {
        for (EntryHandle handle : job.entryHandles()) {
            engine.unregister(handle);
        }
    }

    private void fire(long jobId) {
        try {
            Optional<Job> job = jobs.get(jobId);
            if (job.isEmpty()) {
                LOG.warn("Job {} fired but no longer exists", jobId);
                return;
            }
            runner.run(job.get());
        } catch (IOException e) {
            LOG.error("Execution of job {} could not be recorded", jobId, e);
        }
    }

    private Job require(long id) throws IOException {
        return jobs.get(id).orElseThrow(() -> new NotFoundException("job", id));
    }

    private AlertSubscription subscriptionOf(Job job, JobRequest request) {
        return new AlertSubscription(job.type(), job.id(), request.alertTitle(), request.alertCount(),
            request.alertMethod());
    }

    private void removeTaskDir(Job job) {
        Path taskDir = dataDir.resolve("task").resolve(job.type().wireName()).resolve(job.name());
        if (!Files.exists(taskDir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(taskDir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            LOG.warn("Failed to remove task directory {}: {}", taskDir, e.getMessage());
        }
    }
}

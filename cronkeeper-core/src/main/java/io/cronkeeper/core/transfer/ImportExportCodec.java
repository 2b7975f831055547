package io.cronkeeper.core.transfer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronkeeper.core.account.AccountResolver;
import io.cronkeeper.core.account.BackupAccount;
import io.cronkeeper.core.alert.AlertBridge;
import io.cronkeeper.core.alert.AlertSubscription;
import io.cronkeeper.core.error.ResolutionException;
import io.cronkeeper.core.error.ValidationException;
import io.cronkeeper.core.job.Job;
import io.cronkeeper.core.job.JobStatus;
import io.cronkeeper.core.job.JobStore;
import io.cronkeeper.core.job.SourceSelector;
import io.cronkeeper.core.model.BatchResult;
import io.cronkeeper.core.schedule.TriggerSpec;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts jobs to a portable form where local ids are replaced by names, and back.
 */
public final class ImportExportCodec {
    private static final Logger LOG = LoggerFactory.getLogger(ImportExportCodec.class);
    private static final String UNRESOLVED_PREFIX = "#";
    private static final TypeReference<List<TransferableJob>> JOB_LIST = new TypeReference<>() {
    };

    private final JobStore jobs;
    private final SourceResolvers sources;
    private final AccountResolver accounts;
    private final AlertBridge alerts;
    private final Clock clock;
    private final ObjectMapper mapper;

    public ImportExportCodec(JobStore jobs, SourceResolvers sources, AccountResolver accounts, AlertBridge alerts,
                             Clock clock) {
        this.jobs = Objects.requireNonNull(jobs, "jobs must not be null");
        this.sources = Objects.requireNonNull(sources, "sources must not be null");
        this.accounts = Objects.requireNonNull(accounts, "accounts must not be null");
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<TransferableJob> export(Collection<Long> ids) throws IOException {
        List<TransferableJob> exported = new ArrayList<>();
        for (Job job : jobs.listByIds(ids)) {
            exported.add(toTransferable(job));
        }
        return exported;
    }

    public String exportJson(Collection<Long> ids) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(export(ids));
    }

    public List<TransferableJob> parse(String json) throws IOException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return mapper.readValue(json, JOB_LIST);
    }

    public BatchResult importJobs(List<TransferableJob> items) throws IOException {
        BatchResult result = new BatchResult();
        for (TransferableJob item : items) {
            String label = item.name().isBlank() ? "<unnamed>" : item.name();
            try {
                if (item.name().isBlank() || item.type() == null) {
                    throw new ValidationException("name and type are required");
                }
                if (jobs.findByName(item.name()).isPresent()) {
                    result.skipped(label);
                    continue;
                }
                for (String segment : TriggerSpec.segments(item.spec())) {
                    TriggerSpec.parse(segment);
                }
                Job imported = importOne(item);
                if (imported.status() == JobStatus.PENDING) {
                    result.pending(label);
                } else {
                    result.succeeded(label);
                }
            } catch (ValidationException e) {
                LOG.warn("Skipping import of job {}: {}", label, e.getMessage());
                result.failed(label, e.getMessage());
            } catch (IOException e) {
                LOG.warn("Failed to import job {}: {}", label, e.getMessage());
                result.failed(label, e.getMessage());
            }
        }
        LOG.info("Imported jobs: {}", result);
        return result;
    }

    private TransferableJob toTransferable(Job job) throws IOException {
        List<SourceRef> refs = new ArrayList<>();
        Optional<SourceResolver> resolver = sources.find(job.type());
        boolean allSources = resolver.isPresent() && job.sources() instanceof SourceSelector.All;
        if (resolver.isPresent() && job.sources() instanceof SourceSelector.ByIds byIds) {
            for (Long id : byIds.ids()) {
                Optional<SourceRef> ref = resolver.get().describe(id);
                if (ref.isPresent()) {
                    refs.add(ref.get());
                } else {
                    // an unresolvable ref imports as pending
                    LOG.warn("Source {} of job {} no longer exists, exported as unresolved", id, job.name());
                    refs.add(SourceRef.of(UNRESOLVED_PREFIX + id));
                }
            }
        }

        List<String> accountNames = new ArrayList<>();
        for (Long id : job.sourceAccountIds()) {
            accounts.findById(id).ifPresent(account -> accountNames.add(account.name()));
        }
        String download = accounts.findById(job.downloadAccountId()).map(BackupAccount::name).orElse("");

        Optional<AlertSubscription> alert = alerts.find(job.type(), job.id());
        boolean alerting = alert.isPresent() && alert.get().sendCount() != 0;
        return new TransferableJob(
            job.name(),
            job.type(),
            job.spec(),
            job.payload(),
            refs,
            allSources,
            accountNames,
            download,
            job.retainCopies(),
            job.retryTimes(),
            job.timeoutSeconds(),
            job.ignoreErr(),
            job.secret(),
            job.snapshotRule(),
            alerting ? alert.get().title() : "",
            alerting ? alert.get().sendCount() : 0,
            alerting ? alert.get().method() : ""
        );
    }

    private Job importOne(TransferableJob item) throws IOException {
        List<String> missing = new ArrayList<>();

        SourceSelector selector = SourceSelector.none();
        Optional<SourceResolver> resolver = sources.find(item.type());
        if (resolver.isPresent()) {
            if (item.allSources()) {
                selector = SourceSelector.all();
            } else {
                Set<Long> ids = new LinkedHashSet<>();
                for (SourceRef ref : item.sources()) {
                    try {
                        ids.add(requireSource(resolver.get(), item, ref));
                    } catch (ResolutionException e) {
                        missing.add(e.getMessage());
                    }
                }
                selector = SourceSelector.byIds(ids);
            }
        }

        List<Long> accountIds = new ArrayList<>();
        long downloadAccountId = 0;
        for (String name : item.sourceAccounts()) {
            Optional<BackupAccount> account = accounts.findByName(name);
            if (account.isEmpty()) {
                missing.add(new ResolutionException("backup account", name).getMessage());
                continue;
            }
            if (name.equals(item.downloadAccount())) {
                downloadAccountId = account.get().id();
            }
            accountIds.add(account.get().id());
        }

        JobStatus status = missing.isEmpty() ? JobStatus.DISABLE : JobStatus.PENDING;
        if (!missing.isEmpty()) {
            LOG.warn("Job {} imported as {}: {}", item.name(), status.wireName(), missing);
        }
        Job job = jobs.insert(new Job(
            0,
            item.name(),
            item.type(),
            item.spec(),
            status,
            item.payload(),
            selector,
            accountIds,
            downloadAccountId,
            item.retainCopies(),
            item.retryTimes(),
            item.timeoutSeconds(),
            item.ignoreErr(),
            item.secret(),
            item.snapshotRule(),
            List.of(),
            clock.instant()
        ));
        if (item.alertCount() != 0) {
            alerts.upsert(new AlertSubscription(
                job.type(),
                job.id(),
                item.alertTitle(),
                item.alertCount(),
                item.alertMethod()
            ));
        }
        return job;
    }

    private long requireSource(SourceResolver resolver, TransferableJob item, SourceRef ref) {
        return resolver.resolve(ref)
            .orElseThrow(() -> new ResolutionException(item.type().wireName() + " source", ref.toString()));
    }
}

package io.cronkeeper.core.retention;

import io.cronkeeper.core.account.AccountResolver;
import io.cronkeeper.core.account.BackupAccount;
import io.cronkeeper.core.account.BackupClient;
import io.cronkeeper.core.job.Job;
import io.cronkeeper.core.record.ExecutionRecord;
import io.cronkeeper.core.record.RecordStatus;
import io.cronkeeper.core.record.RecordStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trims backup artifacts and execution history of a job down to its retention count, per source account.
 */
public final class RetentionManager {
    private static final Logger LOG = LoggerFactory.getLogger(RetentionManager.class);

    private final RecordStore records;
    private final AccountResolver accounts;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> recordLocks = new ConcurrentHashMap<>();

    public RetentionManager(RecordStore records, AccountResolver accounts) {
        this.records = Objects.requireNonNull(records, "records must not be null");
        this.accounts = Objects.requireNonNull(accounts, "accounts must not be null");
    }

    public void removeExpired(Job job, List<BackupAccount> targets, long excludeRecordId) throws IOException {
        Objects.requireNonNull(job, "job must not be null");
        if (job.retainCopies() <= 0) {
            return;
        }
        trim(job, targets, job.retainCopies(), excludeRecordId);
    }

    public void cleanRecord(Job job, boolean cleanData, boolean cleanRemoteData, boolean isDelete) throws IOException {
        Objects.requireNonNull(job, "job must not be null");
        if (cleanData && job.type().producesBackups()) {
            List<BackupAccount> targets = new ArrayList<>();
            for (BackupAccount account : sourceAccounts(job)) {
                if (cleanRemoteData || account.isLocal()) {
                    targets.add(account);
                }
            }
            if (!targets.isEmpty()) {
                trim(job, targets, 0, ExecutionRecord.DETACHED);
            }
        }
        if (isDelete) {
            for (ExecutionRecord record : records.listByJob(job.id())) {
                removeLogFile(record);
            }
            int detached = records.detach(job.id());
            releaseLocks(job);
            LOG.info("Detached {} record(s) of job {}", detached, job.name());
            return;
        }
        int removed = records.deleteByJob(job.id());
        LOG.info("Removed {} record(s) of job {}", removed, job.name());
    }

    public List<BackupAccount> sourceAccounts(Job job) {
        List<BackupAccount> resolved = new ArrayList<>();
        for (Long id : job.sourceAccountIds()) {
            Optional<BackupAccount> account = accounts.findById(id);
            if (account.isPresent()) {
                resolved.add(account.get());
            } else {
                LOG.warn("Backup account {} of job {} is not configured", id, job.name());
            }
        }
        return resolved;
    }

    private void trim(Job job, List<BackupAccount> targets, int retain, long excludeRecordId) throws IOException {
        for (BackupAccount account : targets) {
            ReentrantLock lock = locks.computeIfAbsent(job.id() + ":" + account.name(), key -> new ReentrantLock());
            lock.lock();
            try {
                trimAccount(job, account, retain, excludeRecordId);
            } finally {
                lock.unlock();
            }
        }
    }

    private void trimAccount(Job job, BackupAccount account, int retain, long excludeRecordId) throws IOException {
        List<ExecutionRecord> held = new ArrayList<>();
        for (ExecutionRecord record : records.listByJob(job.id())) {
            if (record.status() == RecordStatus.SUCCESS && record.accounts().contains(account.name())) {
                held.add(record);
            }
        }
        if (held.size() <= retain) {
            return;
        }
        BackupClient client;
        try {
            client = accounts.client(account);
        } catch (RuntimeException e) {
            LOG.warn("Skipping retention of job {} on account {}: {}", job.name(), account.name(), e.getMessage());
            return;
        }
        int trimmed = 0;
        for (ExecutionRecord record : held.subList(retain, held.size())) {
            if (record.id() == excludeRecordId) {
                continue;
            }
            if (!deleteArtifacts(client, account, record)) {
                continue;
            }
            detachAccount(job, record.id(), account.name());
            trimmed++;
        }
        LOG.debug("Trimmed {} expired copies of job {} from account {}", trimmed, job.name(), account.name());
    }

    /**
     * Removes one account from a record, deleting the record once no account holds it. The row is re-read under the
     * job's lock; trims of other accounts edit the same row.
     */
    private void detachAccount(Job job, long recordId, String accountName) throws IOException {
        ReentrantLock lock = recordLocks.computeIfAbsent(job.id(), key -> new ReentrantLock());
        lock.lock();
        try {
            Optional<ExecutionRecord> current = records.get(recordId);
            if (current.isEmpty()) {
                return;
            }
            List<String> remaining = new ArrayList<>(current.get().accounts());
            remaining.remove(accountName);
            if (remaining.isEmpty()) {
                records.delete(recordId);
            } else {
                records.update(current.get().withAccounts(remaining));
            }
        } finally {
            lock.unlock();
        }
    }

    private void releaseLocks(Job job) {
        String prefix = job.id() + ":";
        locks.keySet().removeIf(key -> key.startsWith(prefix));
        recordLocks.remove(job.id());
    }

    int lockCount() {
        return locks.size() + recordLocks.size();
    }

    private boolean deleteArtifacts(BackupClient client, BackupAccount account, ExecutionRecord record) {
        for (String artifact : record.artifacts()) {
            try {
                client.delete(artifact);
            } catch (IOException | RuntimeException e) {
                LOG.warn("Failed to delete {} from account {} for record {}: {}",
                    artifact, account.name(), record.id(), e.getMessage());
                return false;
            }
        }
        return true;
    }

    private void removeLogFile(ExecutionRecord record) {
        if (record.logPath().isBlank()) {
            return;
        }
        try {
            Files.deleteIfExists(Path.of(record.logPath()));
        } catch (IOException e) {
            LOG.warn("Failed to remove log file {}: {}", record.logPath(), e.getMessage());
        }
    }
}

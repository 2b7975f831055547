package io.cronkeeper.core.alert;

import io.cronkeeper.core.job.JobType;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps subscriptions in an {@link AlertStore} and raises an alert once a job has failed
 * {@code sendCount} times in a row. A success resets the streak.
 */
public final class DefaultAlertBridge implements AlertBridge {
    private static final Logger LOG = LoggerFactory.getLogger(DefaultAlertBridge.class);

    private final AlertStore store;
    private final Clock clock;
    private final Map<String, AlertSender> senders = new ConcurrentHashMap<>();
    private final Map<String, Integer> failureStreaks = new ConcurrentHashMap<>();

    public DefaultAlertBridge(AlertStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        register(new LoggingAlertSender());
    }

    public void register(AlertSender sender) {
        senders.put(sender.method(), sender);
    }

    @Override
    public synchronized Optional<AlertSubscription> find(JobType type, long jobId) throws IOException {
        return store.load().stream().filter(subscription -> subscription.matches(type, jobId)).findFirst();
    }

    @Override
    public synchronized void upsert(AlertSubscription subscription) throws IOException {
        Objects.requireNonNull(subscription, "subscription must not be null");
        List<AlertSubscription> subscriptions = new ArrayList<>();
        for (AlertSubscription existing : store.load()) {
            if (!existing.matches(subscription.type(), subscription.jobId())) {
                subscriptions.add(existing);
            }
        }
        subscriptions.add(subscription);
        store.save(subscriptions);
    }

    @Override
    public synchronized void delete(JobType type, long jobId) throws IOException {
        List<AlertSubscription> subscriptions = new ArrayList<>(store.load());
        if (subscriptions.removeIf(existing -> existing.matches(type, jobId))) {
            store.save(subscriptions);
        }
        failureStreaks.remove(key(type, jobId));
    }

    @Override
    public void notify(JobOutcome outcome) {
        Optional<AlertSubscription> subscription;
        try {
            subscription = find(outcome.type(), outcome.jobId());
        } catch (IOException e) {
            LOG.warn("Failed to load alert subscription for job {}: {}", outcome.jobName(), e.getMessage());
            return;
        }
        if (subscription.isEmpty()) {
            return;
        }
        String key = key(outcome.type(), outcome.jobId());
        if (!outcome.failed()) {
            failureStreaks.remove(key);
            return;
        }
        int streak = failureStreaks.merge(key, 1, Integer::sum);
        AlertSubscription active = subscription.get();
        if (active.sendCount() <= 0 || streak < active.sendCount()) {
            return;
        }
        failureStreaks.remove(key);
        AlertSender sender = senders.get(active.method());
        if (sender == null) {
            LOG.warn("No alert sender for method '{}', job {}", active.method(), outcome.jobName());
            return;
        }
        AlertMessage message = new AlertMessage(
            active.title().isBlank() ? outcome.jobName() : active.title(),
            outcome.jobName(),
            outcome.type().wireName(),
            outcome.status().wireName(),
            outcome.message(),
            streak,
            clock.instant()
        );
        try {
            sender.send(message);
            LOG.info("Alert sent via {} for job {}", active.method(), outcome.jobName());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to send alert via {} for job {}: {}", active.method(), outcome.jobName(), e.getMessage());
        }
    }

    private static String key(JobType type, long jobId) {
        return type.wireName() + ":" + jobId;
    }
}

package io.cronkeeper.core.schedule;

import io.cronkeeper.core.error.InvalidSpecException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SchedulerEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerEngine.class);

    private final Clock clock;
    private final ZoneId zone;
    private final Executor executor;
    private final Duration tick;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<EntryHandle, Entry> entries = new ConcurrentHashMap<>();
    private ScheduledExecutorService ticker;

    public SchedulerEngine(Clock clock, ZoneId zone, Executor executor) {
        this(clock, zone, executor, Duration.ofSeconds(1));
    }

    public SchedulerEngine(Clock clock, ZoneId zone, Executor executor, Duration tick) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.tick = Objects.requireNonNull(tick, "tick must not be null");
        if (tick.isZero() || tick.isNegative()) {
            throw new IllegalArgumentException("tick must be > 0");
        }
    }

    public TriggerSpec parse(String spec) {
        return TriggerSpec.parse(spec);
    }

    public List<Instant> computeNext(String spec, Instant now, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be > 0");
        }
        TriggerSpec trigger = parse(spec);
        List<Instant> result = new ArrayList<>(n);
        Instant cursor = now;
        for (int i = 0; i < n; i++) {
            Instant next = nextAfter(trigger, cursor);
            result.add(next);
            cursor = next;
        }
        return List.copyOf(result);
    }

    public EntryHandle register(String spec, Runnable callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        TriggerSpec trigger = parse(spec);
        Instant first = nextAfter(trigger, clock.instant());
        EntryHandle handle = new EntryHandle(sequence.incrementAndGet());
        entries.put(handle, new Entry(trigger, callback, first));
        LOG.debug("Registered entry {} for spec '{}', first firing at {}", handle, trigger.expression(), first);
        return handle;
    }

    public void unregister(EntryHandle handle) {
        if (handle == null) {
            return;
        }
        if (entries.remove(handle) != null) {
            LOG.debug("Unregistered entry {}", handle);
        }
    }

    public synchronized int runDue() {
        Instant now = clock.instant();
        int fired = 0;
        for (Map.Entry<EntryHandle, Entry> item : entries.entrySet()) {
            Entry entry = item.getValue();
            if (entry.next.isAfter(now)) {
                continue;
            }
            entry.next = nextAfter(entry.trigger, now);
            if (entries.get(item.getKey()) != entry) {
                continue;
            }
            dispatch(item.getKey(), entry);
            fired++;
        }
        return fired;
    }

    public synchronized void start() {
        if (ticker != null) {
            return;
        }
        ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cronkeeper-ticker");
            thread.setDaemon(true);
            return thread;
        });
        ticker.scheduleAtFixedRate(this::tickSafely, tick.toMillis(), tick.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Scheduler started with {} registered entries, tick {}ms", entries.size(), tick.toMillis());
    }

    @Override
    public synchronized void close() {
        if (ticker != null) {
            ticker.shutdownNow();
            ticker = null;
            LOG.info("Scheduler stopped");
        }
    }

    public int registeredCount() {
        return entries.size();
    }

    public boolean isRegistered(EntryHandle handle) {
        return handle != null && entries.containsKey(handle);
    }

    public Optional<Instant> nextFireTime(EntryHandle handle) {
        Entry entry = handle == null ? null : entries.get(handle);
        return entry == null ? Optional.empty() : Optional.of(entry.next);
    }

    public ZoneId zone() {
        return zone;
    }

    public Clock clock() {
        return clock;
    }

    private void dispatch(EntryHandle handle, Entry entry) {
        executor.execute(() -> {
            try {
                entry.callback.run();
            } catch (RuntimeException e) {
                LOG.error("Callback of entry {} ('{}') failed", handle, entry.trigger.expression(), e);
            }
        });
    }

    private void tickSafely() {
        try {
            runDue();
        } catch (RuntimeException e) {
            LOG.error("Scheduler tick failed", e);
        }
    }

    private Instant nextAfter(TriggerSpec trigger, Instant from) {
        Optional<Instant> next;
        try {
            next = trigger.next(from, zone);
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidSpecException(trigger.expression(), e);
        }
        return next.orElseThrow(() -> new InvalidSpecException(trigger.expression(), "no future firing time"));
    }

    private static final class Entry {
        private final TriggerSpec trigger;
        private final Runnable callback;
        private volatile Instant next;

        private Entry(TriggerSpec trigger, Runnable callback, Instant next) {
            this.trigger = trigger;
            this.callback = callback;
            this.next = next;
        }
    }
}

package io.cronkeeper.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cronkeeper.core.MutableClock;
import io.cronkeeper.core.error.InvalidSpecException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SchedulerEngineTest {
    private static final Instant START = Instant.parse("2026-01-01T00:00:10Z");

    @Test
    void computeNextForIntervalShouldStepByInterval() {
        SchedulerEngine engine = new SchedulerEngine(new MutableClock(START), ZoneOffset.UTC, Runnable::run);

        List<Instant> next = engine.computeNext("@every 30s", START, 3);

        assertThat(next).containsExactly(
            START.plusSeconds(30),
            START.plusSeconds(60),
            START.plusSeconds(90)
        );
    }

    @Test
    void computeNextForCronShouldReturnStrictlyIncreasingInstants() {
        SchedulerEngine engine = new SchedulerEngine(new MutableClock(START), ZoneOffset.UTC, Runnable::run);

        List<Instant> next = engine.computeNext("*/5 * * * *", START, 5);

        assertThat(next).hasSize(5);
        assertThat(next.get(0)).isEqualTo(Instant.parse("2026-01-01T00:05:00Z"));
        for (int i = 1; i < next.size(); i++) {
            assertThat(next.get(i)).isAfter(next.get(i - 1));
            assertThat(Duration.between(next.get(i - 1), next.get(i))).isEqualTo(Duration.ofMinutes(5));
        }
    }

    @Test
    void computeNextShouldRejectNonPositiveCount() {
        SchedulerEngine engine = new SchedulerEngine(new MutableClock(START), ZoneOffset.UTC, Runnable::run);

        assertThatThrownBy(() -> engine.computeNext("@every 1m", START, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFireRegisteredEntryWhenDue() {
        MutableClock clock = new MutableClock(START);
        SchedulerEngine engine = new SchedulerEngine(clock, ZoneOffset.UTC, Runnable::run);
        AtomicInteger fired = new AtomicInteger();

        EntryHandle handle = engine.register("@every 30s", fired::incrementAndGet);

        assertThat(engine.runDue()).isZero();
        clock.advance(Duration.ofSeconds(30));
        assertThat(engine.runDue()).isEqualTo(1);
        assertThat(fired).hasValue(1);
        assertThat(engine.nextFireTime(handle)).contains(START.plusSeconds(60));
    }

    @Test
    void unregisterShouldStopFiringAndBeIdempotent() {
        MutableClock clock = new MutableClock(START);
        SchedulerEngine engine = new SchedulerEngine(clock, ZoneOffset.UTC, Runnable::run);
        AtomicInteger fired = new AtomicInteger();
        EntryHandle handle = engine.register("@every 10s", fired::incrementAndGet);

        engine.unregister(handle);
        engine.unregister(handle);
        engine.unregister(new EntryHandle(999));
        clock.advance(Duration.ofMinutes(5));

        assertThat(engine.runDue()).isZero();
        assertThat(fired).hasValue(0);
        assertThat(engine.registeredCount()).isZero();
        assertThat(engine.isRegistered(handle)).isFalse();
    }

    @Test
    void missedFiringsShouldCollapseIntoOne() {
        MutableClock clock = new MutableClock(START);
        SchedulerEngine engine = new SchedulerEngine(clock, ZoneOffset.UTC, Runnable::run);
        AtomicInteger fired = new AtomicInteger();
        EntryHandle handle = engine.register("@every 10s", fired::incrementAndGet);

        clock.advance(Duration.ofSeconds(95));
        engine.runDue();
        engine.runDue();

        assertThat(fired).hasValue(1);
        assertThat(engine.nextFireTime(handle)).contains(START.plusSeconds(105));
    }

    @Test
    void failingCallbackShouldNotStopOtherEntries() {
        MutableClock clock = new MutableClock(START);
        SchedulerEngine engine = new SchedulerEngine(clock, ZoneOffset.UTC, Runnable::run);
        List<String> fired = new ArrayList<>();
        engine.register("@every 10s", () -> {
            throw new IllegalStateException("boom");
        });
        engine.register("@every 10s", () -> fired.add("second"));

        clock.advance(Duration.ofSeconds(10));

        assertThat(engine.runDue()).isEqualTo(2);
        assertThat(fired).containsExactly("second");
    }

    @Test
    void registerShouldRejectInvalidSpecWithoutAddingEntry() {
        SchedulerEngine engine = new SchedulerEngine(new MutableClock(START), ZoneOffset.UTC, Runnable::run);

        assertThatThrownBy(() -> engine.register("not a spec", () -> { }))
            .isInstanceOf(InvalidSpecException.class);
        assertThat(engine.registeredCount()).isZero();
    }

    @Test
    void shouldIssueDistinctHandles() {
        SchedulerEngine engine = new SchedulerEngine(new MutableClock(START), ZoneOffset.UTC, Runnable::run);

        EntryHandle first = engine.register("@every 1m", () -> { });
        EntryHandle second = engine.register("@every 1m", () -> { });

        assertThat(first).isNotEqualTo(second);
        assertThat(engine.registeredCount()).isEqualTo(2);
    }
}

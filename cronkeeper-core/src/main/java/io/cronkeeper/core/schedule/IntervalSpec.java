package io.cronkeeper.core.schedule;

import io.cronkeeper.core.error.InvalidSpecException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

public record IntervalSpec(long amount, ChronoUnit unit) implements TriggerSpec {

    public IntervalSpec {
        if (unit != ChronoUnit.SECONDS && unit != ChronoUnit.MINUTES) {
            throw new InvalidSpecException("@every " + amount, "unit must be seconds or minutes");
        }
        if (amount <= 0) {
            throw new InvalidSpecException("@every " + amount + suffix(unit), "interval must be > 0");
        }
    }

    public Duration interval() {
        return Duration.of(amount, unit);
    }

    @Override
    public String expression() {
        return "@every " + amount + suffix(unit);
    }

    @Override
    public Optional<Instant> next(Instant from, ZoneId zone) {
        return Optional.of(from.plus(interval()));
    }

    private static String suffix(ChronoUnit unit) {
        return unit == ChronoUnit.SECONDS ? "s" : "m";
    }
}

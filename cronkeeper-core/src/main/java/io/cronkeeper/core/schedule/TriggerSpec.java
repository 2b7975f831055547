package io.cronkeeper.core.schedule;

import io.cronkeeper.core.error.InvalidSpecException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public sealed interface TriggerSpec permits IntervalSpec, CronSpec {
    Pattern EVERY_PATTERN = Pattern.compile("^@every\\s+(\\d+)(s|m)$");

    String expression();

    Optional<Instant> next(Instant from, ZoneId zone);

    static TriggerSpec parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new InvalidSpecException(String.valueOf(spec), "spec is required");
        }
        String normalized = spec.trim();
        if (normalized.startsWith("@every")) {
            Matcher matcher = EVERY_PATTERN.matcher(normalized);
            if (!matcher.matches()) {
                throw new InvalidSpecException(normalized, "expected '@every <int>(s|m)'");
            }
            long amount;
            try {
                amount = Long.parseLong(matcher.group(1));
            } catch (NumberFormatException e) {
                throw new InvalidSpecException(normalized, e);
            }
            ChronoUnit unit = "s".equals(matcher.group(2)) ? ChronoUnit.SECONDS : ChronoUnit.MINUTES;
            return new IntervalSpec(amount, unit);
        }
        return CronSpec.parse(normalized);
    }

    /**
     * Splits a job spec on commas. Blank segments are rejected so the number of
     * segments always matches the number of handles a job holds.
     */
    static List<String> segments(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new InvalidSpecException(String.valueOf(spec), "spec is required");
        }
        List<String> segments = new ArrayList<>();
        for (String raw : spec.split(",", -1)) {
            String segment = raw.trim();
            if (segment.isEmpty()) {
                throw new InvalidSpecException(spec, "empty segment");
            }
            segments.add(segment);
        }
        return List.copyOf(segments);
    }
}

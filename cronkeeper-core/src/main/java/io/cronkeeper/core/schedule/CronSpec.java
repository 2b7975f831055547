package io.cronkeeper.core.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import io.cronkeeper.core.error.InvalidSpecException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

public record CronSpec(
    String minute,
    String hour,
    String dayOfMonth,
    String month,
    String dayOfWeek
) implements TriggerSpec {
    private static final CronParser PARSER = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    static CronSpec parse(String expression) {
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new InvalidSpecException(expression, "expected 5 cron fields but got " + fields.length);
        }
        try {
            Cron cron = PARSER.parse(expression.trim());
            cron.validate();
        } catch (IllegalArgumentException e) {
            throw new InvalidSpecException(expression, e);
        }
        return new CronSpec(fields[0], fields[1], fields[2], fields[3], fields[4]);
    }

    @Override
    public String expression() {
        return String.join(" ", minute, hour, dayOfMonth, month, dayOfWeek);
    }

    @Override
    public Optional<Instant> next(Instant from, ZoneId zone) {
        ExecutionTime executionTime = ExecutionTime.forCron(PARSER.parse(expression()));
        return executionTime.nextExecution(ZonedDateTime.ofInstant(from, zone))
            .map(ZonedDateTime::toInstant);
    }
}

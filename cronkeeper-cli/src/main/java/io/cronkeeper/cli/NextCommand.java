package io.cronkeeper.cli;

import io.cronkeeper.core.runtime.CronkeeperRuntime;
import io.cronkeeper.core.schedule.SchedulerEngine;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "next", description = "Preview the next firing times of a trigger spec")
public final class NextCommand implements Callable<Integer> {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final CliContext context;

    @Parameters(index = "0", description = "Trigger spec, e.g. '@every 30s' or '0 2 * * *'")
    String spec;

    @Option(names = {"-n", "--count"}, defaultValue = "5")
    int count;

    public NextCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (CronkeeperRuntime runtime = context.openRuntime()) {
            SchedulerEngine engine = runtime.engine();
            for (Instant next : runtime.registry().nextRuns(spec, count)) {
                System.out.println(FORMAT.format(next.atZone(engine.zone())));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Next command failed: " + e.getMessage());
            return 1;
        }
    }
}

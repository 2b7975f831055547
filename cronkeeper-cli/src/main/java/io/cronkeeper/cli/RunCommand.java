package io.cronkeeper.cli;

import io.cronkeeper.core.record.ExecutionRecord;
import io.cronkeeper.core.record.RecordStatus;
import io.cronkeeper.core.runtime.CronkeeperRuntime;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "run", description = "Execute a job once, regardless of its status")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    long id;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (CronkeeperRuntime runtime = context.openRuntime()) {
            ExecutionRecord record = runtime.registry().runOnce(id);
            System.out.println("Record " + record.id() + ": " + record.status().wireName()
                + " in " + record.durationMillis() + "ms");
            if (!record.message().isBlank()) {
                System.out.println(record.message());
            }
            for (String artifact : record.artifacts()) {
                System.out.println("Artifact: " + artifact);
            }
            return record.status() == RecordStatus.SUCCESS ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }
}

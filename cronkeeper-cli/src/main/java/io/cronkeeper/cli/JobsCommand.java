package io.cronkeeper.cli;

import io.cronkeeper.core.job.JobQuery;
import io.cronkeeper.core.job.JobSummary;
import io.cronkeeper.core.model.Page;
import io.cronkeeper.core.runtime.CronkeeperRuntime;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "jobs", description = "List jobs with their latest execution")
public final class JobsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--filter", description = "Name substring", defaultValue = "")
    String filter;

    @Option(names = "--order-by", description = "name, type, status or createdAt", defaultValue = "createdAt")
    String orderBy;

    @Option(names = "--asc", description = "Sort ascending")
    boolean ascending;

    @Option(names = "--page", defaultValue = "1")
    int page;

    @Option(names = "--size", defaultValue = "20")
    int size;

    public JobsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (CronkeeperRuntime runtime = context.openRuntime()) {
            Page<JobSummary> result = runtime.registry().page(new JobQuery(filter, orderBy, ascending, page, size));
            System.out.printf("%-6s %-24s %-14s %-8s %-22s %-8s %s%n",
                "ID", "NAME", "TYPE", "STATUS", "SPEC", "LAST", "LAST RUN");
            for (JobSummary summary : result.items()) {
                System.out.printf("%-6d %-24s %-14s %-8s %-22s %-8s %s%n",
                    summary.job().id(),
                    summary.job().name(),
                    summary.job().type().wireName(),
                    summary.job().status().wireName(),
                    summary.job().spec(),
                    summary.lastRecordStatus(),
                    summary.lastRecordTime());
            }
            System.out.println("Total: " + result.total());
            return 0;
        } catch (Exception e) {
            System.err.println("Jobs command failed: " + e.getMessage());
            return 1;
        }
    }
}

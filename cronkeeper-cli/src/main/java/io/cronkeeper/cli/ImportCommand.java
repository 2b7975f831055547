package io.cronkeeper.cli;

import io.cronkeeper.core.model.BatchResult;
import io.cronkeeper.core.runtime.CronkeeperRuntime;
import io.cronkeeper.core.transfer.TransferableJob;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "import", description = "Import jobs from an export file")
public final class ImportCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Export file")
    Path file;

    public ImportCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (CronkeeperRuntime runtime = context.openRuntime()) {
            List<TransferableJob> items = runtime.registry().parseExport(Files.readString(file));
            BatchResult result = runtime.registry().importJobs(items);
            System.out.println("Imported: " + result.succeeded());
            System.out.println("Pending: " + result.pending());
            System.out.println("Skipped: " + result.skipped());
            for (Map.Entry<String, String> failure : result.failures().entrySet()) {
                System.out.println("Failed: " + failure.getKey() + " (" + failure.getValue() + ")");
            }
            return result.hasFailures() ? 1 : 0;
        } catch (Exception e) {
            System.err.println("Import command failed: " + e.getMessage());
            return 1;
        }
    }
}

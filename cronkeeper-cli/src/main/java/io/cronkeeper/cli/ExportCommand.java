package io.cronkeeper.cli;

import io.cronkeeper.core.runtime.CronkeeperRuntime;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "export", description = "Export jobs to portable JSON")
public final class ExportCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--ids", split = ",", required = true, description = "Comma-separated job ids")
    List<Long> ids;

    @Option(names = "--out", description = "Output file, stdout when omitted")
    Path out;

    public ExportCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (CronkeeperRuntime runtime = context.openRuntime()) {
            String json = runtime.registry().exportJson(ids);
            if (out == null) {
                System.out.println(json);
            } else {
                if (out.toAbsolutePath().getParent() != null) {
                    Files.createDirectories(out.toAbsolutePath().getParent());
                }
                Files.writeString(out, json + System.lineSeparator());
                System.out.println("Exported " + ids.size() + " job id(s) to " + out);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Export command failed: " + e.getMessage());
            return 1;
        }
    }
}

package io.cronkeeper.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "daemon", description = "Run the scheduler in the foreground until stopped")
public final class DaemonCommand implements Callable<Integer> {
    private final CliContext context;

    public DaemonCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.daemonRunner().run();
        } catch (Exception e) {
            System.err.println("Daemon command failed: " + e.getMessage());
            return 1;
        }
    }
}

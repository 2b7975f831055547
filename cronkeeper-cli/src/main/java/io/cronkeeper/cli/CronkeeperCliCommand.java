package io.cronkeeper.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(name = "cronkeeper", mixinStandardHelpOptions = true, description = "Recurring maintenance job scheduler")
public final class CronkeeperCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }

    public static CommandLine build(CliContext context) {
        CommandLine commandLine = new CommandLine(new CronkeeperCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("jobs", new JobsCommand(context));
        commandLine.addSubcommand("next", new NextCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("export", new ExportCommand(context));
        commandLine.addSubcommand("import", new ImportCommand(context));
        commandLine.addSubcommand("daemon", new DaemonCommand(context));
        return commandLine;
    }
}

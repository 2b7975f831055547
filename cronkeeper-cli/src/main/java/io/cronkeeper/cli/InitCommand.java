package io.cronkeeper.cli;

import io.cronkeeper.core.account.BackupAccount;
import io.cronkeeper.core.config.InitResult;
import io.cronkeeper.core.config.model.AccountConfig;
import io.cronkeeper.core.config.model.CronkeeperConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Write the config file and prepare data and local backup directories")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with defaults")
    boolean overwrite;

    @Option(names = "--show", description = "Print the effective config after writing it")
    boolean show;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            InitResult result = context.configService().init(context.configPath(), overwrite);
            String action = result.createdConfig() ? "Created"
                : result.overwrittenConfig() ? "Reset to defaults" : "Refreshed";
            System.out.println(action + " config " + result.configPath());
            System.out.println("Data directory ready: " + result.dataDir());

            CronkeeperConfig config = context.configService().load(result.configPath());
            for (AccountConfig accountConfig : config.accounts()) {
                BackupAccount account = accountConfig.toAccount();
                if (account.isLocal() && !account.backupPath().isBlank()) {
                    Path root = Files.createDirectories(Path.of(account.backupPath()));
                    System.out.println("Local backup account " + account.name() + ": " + root);
                }
            }
            if (show) {
                System.out.println(context.configService().toPrettyJson(config));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Init command failed: " + e.getMessage());
            return 1;
        }
    }
}

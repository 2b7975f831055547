package io.cronkeeper.core.runner.impl;

import io.cronkeeper.core.job.JobType;
import io.cronkeeper.core.runner.ActionContext;
import io.cronkeeper.core.runner.ActionResult;
import io.cronkeeper.core.runner.JobAction;
import java.io.IOException;
import java.lang.ProcessBuilder.Redirect;
import java.nio.file.Files;
import java.util.concurrent.TimeUnit;

public final class ShellJobAction implements JobAction {
    @Override
    public JobType type() {
        return JobType.SHELL;
    }

    @Override
    public ActionResult invoke(ActionContext context) throws IOException, InterruptedException {
        String command = context.job().payload().script().isBlank()
            ? context.job().payload().command()
            : context.job().payload().script();
        if (command.isBlank()) {
            throw new IllegalArgumentException("command is required");
        }

        Files.createDirectories(context.workDir());
        Files.createDirectories(context.logFile().getParent());
        Process process = new ProcessBuilder("/bin/sh", "-c", command)
            .directory(context.workDir().toFile())
            .redirectErrorStream(true)
            .redirectOutput(Redirect.appendTo(context.logFile().toFile()))
            .start();

        if (context.bounded()) {
            boolean finished = process.waitFor(context.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("command timed out after " + context.timeout().toSeconds() + "s");
            }
        } else {
            process.waitFor();
        }
        if (process.exitValue() != 0) {
            throw new IOException("command exited with status " + process.exitValue());
        }
        return ActionResult.empty();
    }
}

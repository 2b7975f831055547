package io.cronkeeper.core.runner.impl;

import io.cronkeeper.core.account.BackupAccount;
import io.cronkeeper.core.job.JobType;
import io.cronkeeper.core.runner.ActionContext;
import io.cronkeeper.core.runner.ActionResult;
import io.cronkeeper.core.runner.JobAction;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Archives {@code payload.sourceDir} into a zip and uploads it to every source account of the job.
 */
public final class DirectoryBackupAction implements JobAction {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final ZoneId zone;

    public DirectoryBackupAction(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public JobType type() {
        return JobType.DIRECTORY;
    }

    @Override
    public ActionResult invoke(ActionContext context) throws IOException {
        Path source = Path.of(context.job().payload().sourceDir());
        if (context.job().payload().sourceDir().isBlank() || !Files.isDirectory(source)) {
            throw new IOException("source directory does not exist: " + source);
        }
        if (context.accounts().isEmpty()) {
            throw new IOException("no backup account configured for job " + context.job().name());
        }

        String fileName = context.job().name() + "_" + STAMP.format(context.startedAt().atZone(zone))
            + "_" + context.attempt() + ".zip";
        String artifact = "directory/" + context.job().name() + "/" + fileName;
        Path staging = context.workDir().resolve(fileName);
        Files.createDirectories(context.workDir());
        try {
            int entries = zip(source, staging, exclusions(context.job().payload().exclusionRules()));
            context.log("archived " + entries + " file(s) from " + source);
            for (BackupAccount account : context.accounts()) {
                context.client(account).upload(staging, artifact);
                context.log("uploaded " + artifact + " to " + account.name());
            }
        } finally {
            Files.deleteIfExists(staging);
        }
        return ActionResult.of(artifact);
    }

    private int zip(Path source, Path target, List<String> exclusions) throws IOException {
        List<Path> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(source)) {
            walk.filter(Files::isRegularFile)
                .filter(path -> exclusions.stream().noneMatch(rule -> source.relativize(path).toString().contains(rule)))
                .forEach(files::add);
        }
        try (OutputStream out = Files.newOutputStream(target);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Path file : files) {
                zip.putNextEntry(new ZipEntry(source.relativize(file).toString().replace('\\', '/')));
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }
        return files.size();
    }

    private List<String> exclusions(String rules) {
        List<String> result = new ArrayList<>();
        for (String rule : rules.split(",")) {
            if (!rule.isBlank()) {
                result.add(rule.trim());
            }
        }
        return result;
    }
}

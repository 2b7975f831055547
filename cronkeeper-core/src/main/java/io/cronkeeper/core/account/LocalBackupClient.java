package io.cronkeeper.core.account;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class LocalBackupClient implements BackupClient {
    private final Path root;

    public LocalBackupClient(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void upload(Path localFile, String remotePath) throws IOException {
        Path target = resolve(remotePath);
        if (target.equals(localFile.toAbsolutePath().normalize())) {
            return;
        }
        Files.createDirectories(target.getParent());
        Files.copy(localFile, target, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public void download(String remotePath, Path target) throws IOException {
        Path source = resolve(remotePath);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public void delete(String remotePath) throws IOException {
        Files.deleteIfExists(resolve(remotePath));
    }

    public Path resolve(String remotePath) {
        Path resolved = root.resolve(stripLeadingSlash(remotePath)).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes backup root: " + remotePath);
        }
        return resolved;
    }

    public Path root() {
        return root;
    }

    private static String stripLeadingSlash(String path) {
        String value = path == null ? "" : path.trim();
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
        return value;
    }
}

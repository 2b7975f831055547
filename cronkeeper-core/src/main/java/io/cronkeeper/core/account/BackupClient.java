package io.cronkeeper.core.account;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Storage operations against one backup account. Remote paths are relative to the account's backup root.
 */
public interface BackupClient {
    void upload(Path localFile, String remotePath) throws IOException;

    void download(String remotePath, Path target) throws IOException;

    void delete(String remotePath) throws IOException;
}

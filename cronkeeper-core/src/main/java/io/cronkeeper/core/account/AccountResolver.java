package io.cronkeeper.core.account;

import java.util.List;
import java.util.Optional;

public interface AccountResolver {
    Optional<BackupAccount> findById(long id);

    Optional<BackupAccount> findByName(String name);

    List<BackupAccount> all();

    default Optional<BackupAccount> findLocal() {
        return all().stream().filter(BackupAccount::isLocal).findFirst();
    }

    BackupClient client(BackupAccount account);
}

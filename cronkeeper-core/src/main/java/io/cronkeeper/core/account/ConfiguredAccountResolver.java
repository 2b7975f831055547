package io.cronkeeper.core.account;

import io.cronkeeper.core.error.ValidationException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

public final class ConfiguredAccountResolver implements AccountResolver {
    private final List<BackupAccount> accounts;
    private final Map<String, Function<BackupAccount, BackupClient>> factories = new ConcurrentHashMap<>();
    private final Map<Long, BackupClient> clients = new ConcurrentHashMap<>();

    public ConfiguredAccountResolver(List<BackupAccount> accounts) {
        this.accounts = accounts == null ? List.of() : List.copyOf(accounts);
        registerClientFactory(BackupAccount.LOCAL, account -> new LocalBackupClient(Path.of(account.backupPath())));
    }

    public void registerClientFactory(String accountType, Function<BackupAccount, BackupClient> factory) {
        factories.put(accountType.toUpperCase(Locale.ROOT), factory);
    }

    @Override
    public Optional<BackupAccount> findById(long id) {
        return accounts.stream().filter(account -> account.id() == id).findFirst();
    }

    @Override
    public Optional<BackupAccount> findByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return accounts.stream().filter(account -> account.name().equals(name.trim())).findFirst();
    }

    @Override
    public List<BackupAccount> all() {
        return accounts;
    }

    @Override
    public BackupClient client(BackupAccount account) {
        return clients.computeIfAbsent(account.id(), id -> {
            Function<BackupAccount, BackupClient> factory = factories.get(account.type().toUpperCase(Locale.ROOT));
            if (factory == null) {
                throw new ValidationException("No backup client for account type " + account.type());
            }
            return factory.apply(account);
        });
    }
}

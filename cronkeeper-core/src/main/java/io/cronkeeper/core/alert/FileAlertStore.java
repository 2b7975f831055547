package io.cronkeeper.core.alert;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

public final class FileAlertStore implements AlertStore {
    private final Path path;
    private final ObjectMapper mapper = new ObjectMapper();

    public FileAlertStore(Path path) {
        this.path = path;
    }

    @Override
    public synchronized List<AlertSubscription> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        return mapper.readValue(Files.readString(path), new TypeReference<List<AlertSubscription>>() {
        });
    }

    @Override
    public synchronized void save(List<AlertSubscription> subscriptions) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(subscriptions);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}

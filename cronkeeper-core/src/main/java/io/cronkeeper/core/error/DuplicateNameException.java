package io.cronkeeper.core.error;

public final class DuplicateNameException extends ValidationException {
    public DuplicateNameException(String name) {
        super("job name already exists: " + name);
    }
}

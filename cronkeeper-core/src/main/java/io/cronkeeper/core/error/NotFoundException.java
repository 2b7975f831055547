package io.cronkeeper.core.error;

public final class NotFoundException extends CronkeeperException {
    public NotFoundException(String what, long id) {
        super(what + " not found: " + id);
    }
}

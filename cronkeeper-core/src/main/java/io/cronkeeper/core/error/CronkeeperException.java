package io.cronkeeper.core.error;

public class CronkeeperException extends RuntimeException {
    public CronkeeperException(String message) {
        super(message);
    }

    public CronkeeperException(String message, Throwable cause) {
        super(message, cause);
    }
}

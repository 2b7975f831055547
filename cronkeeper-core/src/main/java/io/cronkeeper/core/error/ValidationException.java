package io.cronkeeper.core.error;

public class ValidationException extends CronkeeperException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

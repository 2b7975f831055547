package io.cronkeeper.core.error;

public final class JobExecutionException extends CronkeeperException {
    private final int attempts;

    public JobExecutionException(String jobName, int attempts, Throwable cause) {
        super("job " + jobName + " failed after " + attempts + " attempt(s): " + describe(cause), cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}

package io.cronkeeper.core.error;

public final class ResolutionException extends CronkeeperException {
    public ResolutionException(String kind, String reference) {
        super("unable to resolve " + kind + ": " + reference);
    }
}

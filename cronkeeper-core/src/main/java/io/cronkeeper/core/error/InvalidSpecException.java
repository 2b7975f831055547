package io.cronkeeper.core.error;

public final class InvalidSpecException extends ValidationException {
    private final String spec;

    public InvalidSpecException(String spec, String reason) {
        super("invalid trigger spec '" + spec + "': " + reason);
        this.spec = spec;
    }

    public InvalidSpecException(String spec, Throwable cause) {
        super("invalid trigger spec '" + spec + "': " + cause.getMessage(), cause);
        this.spec = spec;
    }

    public String spec() {
        return spec;
    }
}

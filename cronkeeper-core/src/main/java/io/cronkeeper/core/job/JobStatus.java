package io.cronkeeper.core.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.cronkeeper.core.error.ValidationException;

public enum JobStatus {
    PENDING("Pending"),
    ENABLE("Enable"),
    DISABLE("Disable");

    private final String wireName;

    JobStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static JobStatus fromWire(String value) {
        if (value != null) {
            for (JobStatus status : values()) {
                if (status.wireName.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new ValidationException("unknown job status: " + value);
    }
}

package io.cronkeeper.core.record;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.cronkeeper.core.error.ValidationException;

public enum RecordStatus {
    RUNNING("Running"),
    SUCCESS("Success"),
    FAILED("Failed");

    private final String wireName;

    RecordStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RecordStatus fromWire(String value) {
        if (value != null) {
            for (RecordStatus status : values()) {
                if (status.wireName.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new ValidationException("unknown record status: " + value);
    }
}

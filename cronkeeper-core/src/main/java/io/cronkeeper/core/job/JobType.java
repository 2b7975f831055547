package io.cronkeeper.core.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.cronkeeper.core.error.ValidationException;

public enum JobType {
    APP("app", true),
    WEBSITE("website", true),
    DATABASE("database", true),
    DIRECTORY("directory", true),
    SNAPSHOT("snapshot", true),
    LOG("log", true),
    CUT_WEBSITE_LOG("cutWebsiteLog", false),
    SHELL("shell", false),
    CURL("curl", false);

    private final String wireName;
    private final boolean backup;

    JobType(String wireName, boolean backup) {
        this.wireName = wireName;
        this.backup = backup;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean producesBackups() {
        return backup;
    }

    @JsonCreator
    public static JobType fromWire(String value) {
        if (value != null) {
            for (JobType type : values()) {
                if (type.wireName.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new ValidationException("unknown job type: " + value);
    }
}

package io.cronkeeper.core.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public record EntryHandle(long id) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EntryHandle of(long id) {
        return new EntryHandle(id);
    }

    @JsonValue
    public long value() {
        return id;
    }

    @Override
    public String toString() {
        return Long.toString(id);
    }
}

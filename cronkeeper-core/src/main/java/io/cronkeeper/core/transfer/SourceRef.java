package io.cronkeeper.core.transfer;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SourceRef(String name, String detailName) {
    public SourceRef {
        name = name == null ? "" : name.trim();
        detailName = detailName == null ? "" : detailName.trim();
    }

    public static SourceRef of(String name) {
        return new SourceRef(name, "");
    }

    @Override
    public String toString() {
        return detailName.isEmpty() ? name : name + "/" + detailName;
    }
}

package io.cronkeeper.core.model;

import java.util.List;

public record Page<T>(List<T> items, long total, int page, int pageSize) {
    public Page {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static int offset(int page, int pageSize) {
        return (Math.max(1, page) - 1) * Math.max(1, pageSize);
    }
}

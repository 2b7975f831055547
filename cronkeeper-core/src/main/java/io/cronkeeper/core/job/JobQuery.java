package io.cronkeeper.core.job;

public record JobQuery(String info, String orderBy, boolean ascending, int page, int pageSize) {
    public JobQuery {
        info = info == null ? "" : info.trim();
        orderBy = orderBy == null || orderBy.isBlank() ? "createdAt" : orderBy.trim();
        page = Math.max(1, page);
        pageSize = pageSize <= 0 ? 20 : pageSize;
    }

    public static JobQuery all() {
        return new JobQuery("", "createdAt", false, 1, Integer.MAX_VALUE);
    }
}

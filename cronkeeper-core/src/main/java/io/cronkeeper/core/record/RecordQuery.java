package io.cronkeeper.core.record;

import java.time.Instant;

public record RecordQuery(long jobId, RecordStatus status, Instant from, Instant to, int page, int pageSize) {
    public RecordQuery {
        page = Math.max(1, page);
        pageSize = pageSize <= 0 ? 20 : pageSize;
    }

    public static RecordQuery forJob(long jobId) {
        return new RecordQuery(jobId, null, null, null, 1, 20);
    }
}

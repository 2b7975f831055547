package io.cronkeeper.core.record;

import io.cronkeeper.core.model.Page;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface RecordStore {
    ExecutionRecord append(ExecutionRecord record) throws IOException;

    void update(ExecutionRecord record) throws IOException;

    Optional<ExecutionRecord> get(long id) throws IOException;

    /**
     * Records of a job, newest first. Records sharing a start time are ordered by insertion, newest first.
     */
    List<ExecutionRecord> listByJob(long jobId) throws IOException;

    Optional<ExecutionRecord> latest(long jobId) throws IOException;

    Page<ExecutionRecord> page(RecordQuery query) throws IOException;

    void delete(long id) throws IOException;

    int deleteByJob(long jobId) throws IOException;

    int detach(long jobId) throws IOException;

    String readLog(long recordId) throws IOException;
}

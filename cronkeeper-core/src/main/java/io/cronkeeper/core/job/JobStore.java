package io.cronkeeper.core.job;

import io.cronkeeper.core.model.Page;
import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface JobStore {
    Job insert(Job job) throws IOException;

    void update(Job job) throws IOException;

    Optional<Job> get(long id) throws IOException;

    Optional<Job> findByName(String name) throws IOException;

    List<Job> list() throws IOException;

    List<Job> listByIds(Collection<Long> ids) throws IOException;

    Page<Job> page(JobQuery query) throws IOException;

    boolean delete(long id) throws IOException;
}

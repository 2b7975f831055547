package io.cronkeeper.core.runner;

import io.cronkeeper.core.job.JobType;

public interface JobAction {
    JobType type();

    /**
     * Runs one attempt of a job. Implementations enforce {@link ActionContext#timeout()} themselves
     * and signal failure by throwing.
     */
    ActionResult invoke(ActionContext context) throws Exception;
}

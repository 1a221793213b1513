package io.tickwork.core.schedule;

import java.util.List;
import java.util.Set;
import io.tickwork.core.repository.ResourceNotFoundException;

public interface WorkflowScheduleStore
{
    /**
     * Replaces the set of schedules linked to a workflow. Throws
     * ResourceNotFoundException without changing the links if the workflow
     * or one of the schedules doesn't exist or is deleted.
     */
    void replaceWorkflowSchedules(long workflowId, Set<Long> scheduleIds)
        throws ResourceNotFoundException;

    List<Long> getScheduleIdsOfWorkflow(long workflowId);
}

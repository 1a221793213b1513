package io.tickwork.core.schedule;

import java.time.Instant;
import java.util.List;

public interface ScheduleStoreManager
{
    ScheduleStore getScheduleStore();

    WorkflowScheduleStore getWorkflowScheduleStore();

    /**
     * Locks due schedules, sets their updatedAt to {@code now} and returns
     * them fanned out per linked workflow, in ascending order of due time,
     * schedule id and workflow id.
     *
     * Must be called in a transaction. The locks are held and the advance
     * becomes visible when that transaction commits. If it aborts, the
     * schedules stay due.
     *
     * At most {@code maxBatchSize} items are returned. Items of one schedule
     * are never split across calls unless the first schedule alone has more
     * links than {@code maxBatchSize}.
     */
    List<ClaimedSchedule> claimDueSchedules(Instant now, int maxBatchSize);
}

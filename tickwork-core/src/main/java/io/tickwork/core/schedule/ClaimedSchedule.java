package io.tickwork.core.schedule;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * One (workflow, schedule) pair returned by a claim. A schedule linked to
 * several active workflows yields one item per workflow.
 *
 * {@link #getSchedule()} is the row as it was read before the claim
 * advanced its {@code updatedAt}.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableClaimedSchedule.class)
@JsonDeserialize(as = ImmutableClaimedSchedule.class)
public abstract class ClaimedSchedule
{
    public abstract long getWorkflowId();

    public abstract long getScheduleId();

    public abstract StoredSchedule getSchedule();

    public static ClaimedSchedule of(long workflowId, StoredSchedule schedule)
    {
        return ImmutableClaimedSchedule.builder()
            .workflowId(workflowId)
            .scheduleId(schedule.getId())
            .schedule(schedule)
            .build();
    }
}

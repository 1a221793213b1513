package io.tickwork.core.schedule;

import java.util.List;

/**
 * Receives each claimed batch inside the claiming transaction. Throwing an
 * exception rolls the claim back and the schedules stay due.
 */
public interface ClaimedScheduleHandler
{
    void handle(List<ClaimedSchedule> claimed);
}

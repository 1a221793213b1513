package io.tickwork.core.schedule;

import java.util.List;
import java.util.UUID;
import com.google.common.base.Optional;
import io.tickwork.core.repository.ResourceNotFoundException;

/**
 * Lifecycle of schedules. Soft-deleted schedules are invisible to every
 * method of this interface.
 */
public interface ScheduleStore
{
    StoredSchedule createSchedule(Schedule schedule);

    StoredSchedule getScheduleById(long schedId)
        throws ResourceNotFoundException;

    /**
     * Active schedules of an owner in ascending id order, starting after
     * {@code lastId} if given.
     */
    List<StoredSchedule> getSchedulesByOwnerId(UUID ownerId, int pageSize, Optional<Long> lastId);

    /**
     * Applies a partial update. Due time is not changed except through the
     * new interval.
     */
    StoredSchedule updateScheduleById(long schedId, ScheduleUpdate update)
        throws ResourceNotFoundException;

    /**
     * Soft-deletes a schedule. Deleting a schedule that is already deleted
     * or that never existed does nothing.
     */
    void deleteScheduleById(long schedId);

    /**
     * Soft-deletes every active schedule of an owner and returns how many
     * were deleted.
     */
    int deleteSchedulesByOwnerId(UUID ownerId);
}

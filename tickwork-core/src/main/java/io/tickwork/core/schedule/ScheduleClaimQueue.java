package io.tickwork.core.schedule;

import java.time.Instant;
import java.util.List;
import com.google.inject.Inject;
import io.tickwork.core.database.TransactionManager;

/**
 * Claims due schedules in a transaction of its own.
 */
public class ScheduleClaimQueue
{
    private final TransactionManager tm;
    private final ScheduleStoreManager sm;

    @Inject
    public ScheduleClaimQueue(TransactionManager tm, ScheduleStoreManager sm)
    {
        this.tm = tm;
        this.sm = sm;
    }

    /**
     * Claims up to {@code maxBatchSize} items and commits. An empty list
     * means nothing was due.
     */
    public List<ClaimedSchedule> claimDue(int maxBatchSize, Instant now)
    {
        return tm.begin(() -> sm.claimDueSchedules(now, maxBatchSize));
    }

    /**
     * Claims up to {@code maxBatchSize} items and passes them to the handler
     * before committing. The handler is not called when nothing was due.
     * If the handler throws, the claim is rolled back and the exception is
     * rethrown.
     */
    public List<ClaimedSchedule> claimDue(int maxBatchSize, Instant now, ClaimedScheduleHandler handler)
    {
        return tm.begin(() -> {
            List<ClaimedSchedule> claimed = sm.claimDueSchedules(now, maxBatchSize);
            if (!claimed.isEmpty()) {
                handler.handle(claimed);
            }
            return claimed;
        });
    }
}

package io.tickwork.core.schedule;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingClaimedScheduleHandler
        implements ClaimedScheduleHandler
{
    private static final Logger logger = LoggerFactory.getLogger(LoggingClaimedScheduleHandler.class);

    @Override
    public void handle(List<ClaimedSchedule> claimed)
    {
        for (ClaimedSchedule c : claimed) {
            logger.info("Schedule {} is due for workflow {} (interval {}s, last updated at {})",
                    c.getScheduleId(), c.getWorkflowId(),
                    c.getSchedule().getUpdateInterval(), c.getSchedule().getUpdatedAt());
        }
    }
}

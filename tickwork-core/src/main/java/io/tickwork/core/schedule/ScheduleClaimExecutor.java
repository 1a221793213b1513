package io.tickwork.core.schedule;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background poller. Every {@code schedule.claim.pollInterval} seconds it
 * claims due schedules and hands them to the {@link ClaimedScheduleHandler},
 * repeating until nothing is due.
 */
public class ScheduleClaimExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleClaimExecutor.class);

    private final ScheduleClaimQueue queue;
    private final ClaimedScheduleHandler handler;
    private final ScheduleClaimConfig config;
    private final Clock clock;
    private ScheduledExecutorService executor;

    @Inject
    public ScheduleClaimExecutor(
            ScheduleClaimQueue queue,
            ClaimedScheduleHandler handler,
            ScheduleClaimConfig config,
            Clock clock)
    {
        this.queue = queue;
        this.handler = handler;
        this.config = config;
        this.clock = clock;
    }

    @VisibleForTesting
    synchronized boolean isStarted()
    {
        return executor != null;
    }

    public synchronized void start()
    {
        if (!config.getEnabled()) {
            logger.debug("Schedule claimer is disabled.");
            return;
        }
        if (executor == null) {
            executor = Executors.newScheduledThreadPool(1,
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("schedule-claimer-%d")
                    .build()
                    );
            executor.scheduleWithFixedDelay(() -> runClaims(),
                    config.getPollInterval(), config.getPollInterval(), TimeUnit.SECONDS);
            logger.info("Started schedule claimer: batchSize={}, pollInterval={}s",
                    config.getBatchSize(), config.getPollInterval());
        }
    }

    public synchronized void shutdown()
    {
        if (executor != null) {
            executor.shutdown();
            try {
                // lets a running claim finish its transaction
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    logger.warn("Schedule claimer didn't stop in 30 seconds");
                }
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
    }

    private void runClaims()
    {
        runClaims(clock.instant());
    }

    @VisibleForTesting
    void runClaims(Instant now)
    {
        try {
            while (claimOnce(now))
                ;  // repeat until nothing is due
        }
        catch (Throwable t) {
            logger.error("An uncaught exception is ignored. Claiming will be retried.", t);
        }
    }

    /**
     * Returns true if something was claimed. A batch may be shorter than
     * the batch size while more schedules are due, because the fan-out of
     * one schedule is never split across batches.
     */
    @VisibleForTesting
    boolean claimOnce(Instant now)
    {
        List<ClaimedSchedule> claimed = queue.claimDue(config.getBatchSize(), now, handler);
        return !claimed.isEmpty();
    }
}

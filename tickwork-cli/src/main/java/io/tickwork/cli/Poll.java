package io.tickwork.cli;

import com.beust.jcommander.Parameter;
import com.google.inject.Module;
import io.tickwork.client.api.ObjectMappers;
import io.tickwork.client.config.Config;
import io.tickwork.client.config.ConfigElement;
import io.tickwork.core.TickworkEmbed;
import io.tickwork.core.schedule.ClaimedSchedule;
import io.tickwork.core.schedule.ClaimedScheduleHandler;
import io.tickwork.core.schedule.LoggingClaimedScheduleHandler;
import io.tickwork.core.schedule.ScheduleClaimConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

import static io.tickwork.cli.SystemExitException.systemExit;

public class Poll
    extends Command
{
    private static final Logger logger = LoggerFactory.getLogger(Poll.class);

    @Parameter(names = {"--batch-size"})
    Integer batchSize = null;

    @Parameter(names = {"--poll-interval"})
    Integer pollInterval = null;

    @Parameter(names = {"--json"})
    boolean json = false;

    @Parameter(names = {"--once"})
    boolean once = false;

    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 0) {
            throw usage(null);
        }

        Properties props = loadSystemProperties();
        if (batchSize != null) {
            props.setProperty("schedule.claim.batchSize", Integer.toString(batchSize));
        }
        if (pollInterval != null) {
            props.setProperty("schedule.claim.pollInterval", Integer.toString(pollInterval));
        }
        // use memory database by default
        if (!props.containsKey("database.type")) {
            props.setProperty("database.type", "memory");
        }

        Config systemConfig = buildSystemConfig(props);
        ScheduleClaimConfig claimConfig = ScheduleClaimConfig.convertFrom(systemConfig);
        ClaimedScheduleHandler handler = json
            ? new JsonClaimedSchedulePrinter(ObjectMappers.objectMapper(), out)
            : new LoggingClaimedScheduleHandler();

        if (once) {
            claimOnce(systemConfig, claimConfig, handler);
        }
        else {
            pollUntilShutdown(systemConfig, handler);
        }
    }

    private void claimOnce(Config systemConfig, ScheduleClaimConfig claimConfig, ClaimedScheduleHandler handler)
    {
        try (TickworkEmbed embed = new TickworkEmbed.Bootstrap()
                .setSystemConfig(ConfigElement.copyOf(systemConfig))
                .withScheduleExecutor(false)
                .initialize()) {
            List<ClaimedSchedule> claimed = embed.getScheduleClaimQueue()
                .claimDue(claimConfig.getBatchSize(), Instant.now(), handler);
            logger.info("Claimed {} items", claimed.size());
        }
    }

    private void pollUntilShutdown(Config systemConfig, ClaimedScheduleHandler handler)
            throws InterruptedException
    {
        Module handlerModule = (binder) -> binder.bind(ClaimedScheduleHandler.class).toInstance(handler);
        TickworkEmbed embed = new TickworkEmbed.Bootstrap()
            .setSystemConfig(ConfigElement.copyOf(systemConfig))
            .overrideModulesWith(handlerModule)
            .initialize();

        CountDownLatch closed = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down schedule poller");
            try {
                embed.close();
            }
            finally {
                closed.countDown();
            }
        }, "shutdown"));

        logger.info("Polling schedules. Press Ctrl-C to stop.");
        closed.await();
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " poll [options...]");
        err.println("  Options:");
        err.println("    -o, --database DIR               path to H2 database (default: in-memory database)");
        err.println("        --batch-size N               maximum number of items claimed at once (default: 10)");
        err.println("        --poll-interval SECONDS      seconds between polls (default: 1)");
        err.println("        --json                       print claimed items to stdout as JSON lines");
        err.println("        --once                       claim one batch and exit");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}

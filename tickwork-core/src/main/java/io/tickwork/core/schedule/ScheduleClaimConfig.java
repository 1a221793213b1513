package io.tickwork.core.schedule;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Preconditions;
import io.tickwork.client.config.Config;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableScheduleClaimConfig.class)
@JsonDeserialize(as = ImmutableScheduleClaimConfig.class)
public interface ScheduleClaimConfig
{
    boolean getEnabled();

    int getBatchSize();

    int getPollInterval();  // seconds

    @Value.Check
    default void check()
    {
        Preconditions.checkState(getBatchSize() > 0, "schedule.claim.batchSize must be positive");
        Preconditions.checkState(getPollInterval() > 0, "schedule.claim.pollInterval must be positive");
    }

    static ImmutableScheduleClaimConfig.Builder defaultBuilder()
    {
        return ImmutableScheduleClaimConfig.builder()
            .enabled(true)
            .batchSize(10)
            .pollInterval(1);
    }

    static ScheduleClaimConfig convertFrom(Config config)
    {
        return defaultBuilder()
            .enabled(config.get("schedule.claim.enabled", boolean.class, true))
            .batchSize(config.get("schedule.claim.batchSize", int.class, 10))
            .pollInterval(config.get("schedule.claim.pollInterval", int.class, 1))
            .build();
    }
}

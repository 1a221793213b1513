package io.tickwork.core.schedule;

import java.util.UUID;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Preconditions;
import io.tickwork.client.config.Config;
import org.immutables.value.Value;

/**
 * A recurring trigger. It becomes due {@code updateInterval} seconds after
 * it was created or last claimed.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSchedule.class)
@JsonDeserialize(as = ImmutableSchedule.class)
public abstract class Schedule
{
    public abstract UUID getOwnerId();

    /**
     * Seconds between two due times.
     */
    public abstract int getUpdateInterval();

    public abstract Config getMetadata();

    @Value.Check
    protected void check()
    {
        Preconditions.checkState(getUpdateInterval() > 0,
                "updateInterval must be positive: %s", getUpdateInterval());
    }

    public static Schedule of(UUID ownerId, int updateInterval, Config metadata)
    {
        return ImmutableSchedule.builder()
            .ownerId(ownerId)
            .updateInterval(updateInterval)
            .metadata(metadata)
            .build();
    }
}

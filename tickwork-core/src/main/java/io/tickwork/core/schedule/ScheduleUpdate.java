package io.tickwork.core.schedule;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import io.tickwork.client.config.Config;
import org.immutables.value.Value;

/**
 * Partial update of a schedule. Absent fields are kept as they are.
 */
@Value.Immutable
public abstract class ScheduleUpdate
{
    public abstract Optional<Integer> getUpdateInterval();

    public abstract Optional<Config> getMetadata();

    @Value.Check
    protected void check()
    {
        if (getUpdateInterval().isPresent()) {
            Preconditions.checkState(getUpdateInterval().get() > 0,
                    "updateInterval must be positive: %s", getUpdateInterval().get());
        }
    }

    public boolean isEmpty()
    {
        return !getUpdateInterval().isPresent() && !getMetadata().isPresent();
    }

    public static ImmutableScheduleUpdate.Builder builder()
    {
        return ImmutableScheduleUpdate.builder();
    }
}

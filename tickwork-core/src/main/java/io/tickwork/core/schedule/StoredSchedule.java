package io.tickwork.core.schedule;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableStoredSchedule.class)
@JsonDeserialize(as = ImmutableStoredSchedule.class)
public abstract class StoredSchedule
        extends Schedule
{
    public abstract long getId();

    public abstract Instant getCreatedAt();

    /**
     * Time of creation or of the last claim.
     */
    public abstract Instant getUpdatedAt();

    public abstract Optional<Instant> getDeletedAt();

    public Instant getDueAt()
    {
        return getUpdatedAt().plusSeconds(getUpdateInterval());
    }

    public boolean isDue(Instant now)
    {
        return !getDueAt().isAfter(now);
    }
}
